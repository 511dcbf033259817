/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import com.multica.conductor.session.ConductorSession;
import com.multica.conductor.spec.AcpSchema;

/**
 * Receives conductor events, typically to forward them to a user interface. All methods
 * default to doing nothing.
 */
public interface ConductorListener {

	/**
	 * Called for every update an agent sends, after it was stored, and for the error
	 * messages the conductor synthesizes when a prompt fails.
	 * @param notification the update with the agent's session id
	 * @param sessionId the durable session id
	 * @param sequenceNumber position in the stored history, or null when not stored
	 */
	default void onSessionUpdate(AcpSchema.SessionNotification notification, String sessionId,
			Long sequenceNumber) {
	}

	/**
	 * Called when a session starts or stops processing a prompt.
	 */
	default void onStatusChange() {
	}

	default void onSessionMetaUpdated(ConductorSession session) {
	}

	/**
	 * Called after a question tool answer was stored in the history.
	 * @param sessionId the durable session id
	 * @param toolCallId the question tool call
	 */
	default void onQuestionResponseRecorded(String sessionId, String toolCallId) {
	}

}
