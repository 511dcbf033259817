/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

import com.multica.conductor.error.AcpErrorCodes;
import com.multica.conductor.error.AcpProtocolException;

/**
 * Turns prompt failures into short messages fit for the chat transcript.
 */
final class AgentErrorMessages {

	private AgentErrorMessages() {
	}

	static final String AUTHENTICATION_REQUIRED = "Authentication required. Please log in to the agent first.";

	static final String SESSION_NOT_FOUND = "Session not found. Please start a new session.";

	static final String TIMED_OUT = "Request timed out. Please try again.";

	static String describe(Throwable error) {
		String message = (error.getMessage() != null) ? error.getMessage() : error.getClass().getSimpleName();
		if (error instanceof AcpProtocolException protocolError) {
			if (protocolError.isAuthenticationRequired()) {
				return AUTHENTICATION_REQUIRED;
			}
			if (protocolError.isSessionNotFound()) {
				return SESSION_NOT_FOUND;
			}
			String rawMessage = protocolError.getRawMessage();
			message = (rawMessage != null && !rawMessage.isBlank()) ? rawMessage
					: AcpErrorCodes.getDescription(protocolError.getCode());
		}
		if (error instanceof TimeoutException) {
			return TIMED_OUT;
		}
		if (message.toLowerCase(Locale.ROOT).contains("auth")) {
			return AUTHENTICATION_REQUIRED;
		}
		return message;
	}

}
