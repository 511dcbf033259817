/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.multica.conductor.spec.AcpSchema;

/**
 * What a {@link PermissionPresenter} needs to show a permission request to the user.
 *
 * @param requestId id to echo back in the {@link PermissionDecision}
 * @param sessionId the agent's session id
 * @param durableSessionId the conductor's session id, or the agent's when it has none
 * @param toolCall the tool call asking for permission
 * @param options the choices offered by the agent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionRequestView(@JsonProperty("requestId") String requestId,
		@JsonProperty("sessionId") String sessionId, @JsonProperty("durableSessionId") String durableSessionId,
		@JsonProperty("toolCall") ToolCallSummary toolCall,
		@JsonProperty("options") List<AcpSchema.PermissionOption> options) {

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record ToolCallSummary(@JsonProperty("toolCallId") String toolCallId, @JsonProperty("title") String title,
			@JsonProperty("kind") AcpSchema.ToolKind kind, @JsonProperty("status") AcpSchema.ToolCallStatus status,
			@JsonProperty("rawInput") Object rawInput) {

		static ToolCallSummary of(AcpSchema.ToolCallUpdate toolCall) {
			if (toolCall == null) {
				return new ToolCallSummary(null, null, null, null, null);
			}
			return new ToolCallSummary(toolCall.toolCallId(), toolCall.title(), toolCall.kind(), toolCall.status(),
					toolCall.rawInput());
		}

	}

}
