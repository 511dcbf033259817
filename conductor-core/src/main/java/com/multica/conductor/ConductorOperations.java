/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.List;

import com.multica.conductor.permission.PermissionAnswerData;
import com.multica.conductor.spec.AcpSchema;
import reactor.core.publisher.Mono;

/**
 * Session operations the permission components call back into. {@link Conductor} is the
 * production implementation.
 *
 * <p>
 * Session ids are the conductor's durable ids unless stated otherwise.
 */
public interface ConductorOperations {

	/**
	 * Maps an agent-assigned session id to the durable session id.
	 * @param protocolSessionId the id the agent uses
	 * @return the durable id, or null when the agent session is unknown
	 */
	String resolveSessionId(String protocolSessionId);

	/**
	 * Cancels the running turn of a session. Completes without effect when the session has
	 * no running agent.
	 * @param sessionId the durable session id
	 * @return completion of the cancel notification
	 */
	Mono<Void> cancelRequest(String sessionId);

	/**
	 * Sends a prompt and completes when the agent ends the turn.
	 * @param sessionId the durable session id
	 * @param content the prompt content
	 * @param options delivery options
	 * @return completion of the turn
	 */
	Mono<Void> sendPrompt(String sessionId, List<AcpSchema.ContentBlock> content, PromptOptions options);

	boolean isSessionProcessing(String sessionId);

	/**
	 * Queues a question and its answer for delivery with the next prompt of the session.
	 */
	void addPendingAnswer(String sessionId, String question, String answer);

	/**
	 * Records the user's answer to a question tool call in the session history.
	 * @param sessionId the durable session id
	 * @param toolCallId the question tool call
	 * @param response the answer
	 */
	void recordQuestionResponse(String sessionId, String toolCallId, PermissionAnswerData response);

}
