/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a session's history. {@code update} is the raw {@code session/update}
 * notification ({@code sessionId} plus the inner {@code update} object) as a JSON tree,
 * which also lets the conductor record entries that are not ACP updates, such as the
 * user's own messages.
 *
 * @param timestamp ISO-8601 time the entry was stored
 * @param sequenceNumber per-session position, starting at 1
 * @param update the notification as a JSON tree
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredSessionUpdate(@JsonProperty("timestamp") String timestamp,
		@JsonProperty("sequenceNumber") long sequenceNumber, @JsonProperty("update") Map<String, Object> update) {

	/**
	 * The {@code sessionUpdate} discriminator of the inner update, or null.
	 * @return the update kind, for example {@code agent_message_chunk}
	 */
	@JsonIgnore
	public String kind() {
		Map<String, Object> inner = inner();
		return inner != null && inner.get("sessionUpdate") instanceof String kind ? kind : null;
	}

	/**
	 * The inner update object, or null when absent.
	 * @return the inner update
	 */
	@JsonIgnore
	@SuppressWarnings("unchecked")
	public Map<String, Object> inner() {
		if (this.update != null && this.update.get("update") instanceof Map<?, ?> inner) {
			return (Map<String, Object>) inner;
		}
		return null;
	}

}
