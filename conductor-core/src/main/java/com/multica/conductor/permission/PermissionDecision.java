/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A decision for a pending permission request, as reported by the presenter.
 *
 * @param requestId the id generated by {@link PermissionCorrelator} for the request
 * @param optionId the chosen option
 * @param data the structured answer for question tools, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionDecision(@JsonProperty("requestId") String requestId,
		@JsonProperty("optionId") String optionId, @JsonProperty("data") PermissionAnswerData data) {

	public PermissionDecision(String requestId, String optionId) {
		this(requestId, optionId, null);
	}

}
