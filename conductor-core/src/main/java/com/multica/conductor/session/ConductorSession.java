/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A durable session: the application's record of a conversation with an agent. Its
 * {@code id} is stable across agent restarts while {@code agentSessionId} is whatever the
 * currently running agent assigned.
 *
 * @param id durable session id
 * @param agentSessionId protocol session id of the most recent agent run
 * @param agentId id of the agent configuration, for example {@code opencode}
 * @param workingDirectory directory the agent works in
 * @param createdAt ISO-8601 creation time
 * @param updatedAt ISO-8601 time of the last change
 * @param status lifecycle state
 * @param title optional display title
 * @param messageCount rough message count for list display
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConductorSession(@JsonProperty("id") String id, @JsonProperty("agentSessionId") String agentSessionId,
		@JsonProperty("agentId") String agentId, @JsonProperty("workingDirectory") String workingDirectory,
		@JsonProperty("createdAt") String createdAt, @JsonProperty("updatedAt") String updatedAt,
		@JsonProperty("status") SessionStatus status, @JsonProperty("title") String title,
		@JsonProperty("messageCount") int messageCount) {

	ConductorSession withMeta(SessionMetaUpdate meta, String now) {
		return new ConductorSession(this.id, meta.agentSessionId() != null ? meta.agentSessionId() : this.agentSessionId,
				meta.agentId() != null ? meta.agentId() : this.agentId, this.workingDirectory, this.createdAt, now,
				meta.status() != null ? meta.status() : this.status, meta.title() != null ? meta.title() : this.title,
				this.messageCount);
	}

	ConductorSession withActivity(String now, int messageCount) {
		return new ConductorSession(this.id, this.agentSessionId, this.agentId, this.workingDirectory, this.createdAt,
				now, this.status, this.title, messageCount);
	}

}
