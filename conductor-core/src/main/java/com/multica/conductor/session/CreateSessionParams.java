/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

/**
 * Input for {@link SessionStore#create(CreateSessionParams)}.
 *
 * @param agentSessionId protocol session id, may be null when the agent is not started yet
 * @param agentId agent configuration id
 * @param workingDirectory directory the agent works in
 */
public record CreateSessionParams(String agentSessionId, String agentId, String workingDirectory) {
}
