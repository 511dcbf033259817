/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A session record together with its full update history.
 *
 * @param session the session record
 * @param updates stored updates in arrival order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionData(@JsonProperty("session") ConductorSession session,
		@JsonProperty("updates") List<StoredSessionUpdate> updates) {
}
