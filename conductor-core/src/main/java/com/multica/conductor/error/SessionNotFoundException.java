/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.error;

/**
 * Raised when a durable session id is not known to the session store.
 */
public class SessionNotFoundException extends AcpProtocolException {

	private final String sessionId;

	public SessionNotFoundException(String sessionId) {
		super(AcpErrorCodes.SESSION_NOT_FOUND, "Session not found: " + sessionId, sessionId);
		this.sessionId = sessionId;
	}

	public String getSessionId() {
		return this.sessionId;
	}

}
