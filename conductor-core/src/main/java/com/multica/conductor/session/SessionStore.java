/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Persistence for durable sessions and their update history, keyed by durable session id.
 *
 * <p>
 * Operations on an unknown session id complete empty ({@link #get}, {@link #getData}) or
 * fail with {@link com.multica.conductor.error.SessionNotFoundException} (mutations).
 */
public interface SessionStore {

	/**
	 * Prepares the store, for example by loading an index from disk.
	 * @return completes when the store is ready
	 */
	Mono<Void> initialize();

	Mono<ConductorSession> create(CreateSessionParams params);

	Mono<ConductorSession> get(String sessionId);

	Mono<SessionData> getData(String sessionId);

	/**
	 * Lists sessions sorted by {@code updatedAt}, most recent first.
	 * @param options filter and paging
	 * @return the matching sessions
	 */
	Mono<List<ConductorSession>> list(ListSessionsOptions options);

	Mono<ConductorSession> updateMeta(String sessionId, SessionMetaUpdate update);

	/**
	 * Appends an update to the session history and touches {@code updatedAt}.
	 * @param sessionId durable session id
	 * @param update the notification as a JSON tree
	 * @return the stored entry with its sequence number
	 */
	Mono<StoredSessionUpdate> appendUpdate(String sessionId, Map<String, Object> update);

	Mono<Void> delete(String sessionId);

	/**
	 * Finds the session whose most recent agent run used the given protocol session id.
	 * @param agentSessionId protocol session id
	 * @return the session, or empty
	 */
	Mono<ConductorSession> findByAgentSessionId(String agentSessionId);

}
