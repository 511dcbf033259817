/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle state of a durable session.
 */
public enum SessionStatus {

	@JsonProperty("active")
	ACTIVE, @JsonProperty("completed")
	COMPLETED, @JsonProperty("error")
	ERROR

}
