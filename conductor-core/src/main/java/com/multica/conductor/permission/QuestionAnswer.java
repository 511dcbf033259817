/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One answered question of a question tool call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionAnswer(@JsonProperty("question") String question, @JsonProperty("answer") String answer,
		@JsonProperty("isCustom") Boolean isCustom) {

	public QuestionAnswer(String question, String answer) {
		this(question, answer, null);
	}

}
