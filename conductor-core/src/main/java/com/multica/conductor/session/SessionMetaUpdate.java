/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

/**
 * Partial update of a session record. Null components are left unchanged.
 *
 * @param agentSessionId new protocol session id
 * @param agentId new agent configuration id
 * @param status new status
 * @param title new title
 */
public record SessionMetaUpdate(String agentSessionId, String agentId, SessionStatus status, String title) {

	public static SessionMetaUpdate agentSessionId(String agentSessionId) {
		return new SessionMetaUpdate(agentSessionId, null, null, null);
	}

	public static SessionMetaUpdate status(SessionStatus status) {
		return new SessionMetaUpdate(null, null, status, null);
	}

	public static SessionMetaUpdate title(String title) {
		return new SessionMetaUpdate(null, null, null, title);
	}

}
