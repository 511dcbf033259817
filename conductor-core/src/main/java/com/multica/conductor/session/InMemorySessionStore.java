/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import com.multica.conductor.error.SessionNotFoundException;
import com.multica.conductor.util.Assert;
import reactor.core.publisher.Mono;

/**
 * {@link SessionStore} that keeps everything in memory. Subclasses may persist the index
 * and the per-session data by overriding {@link #persistIndex()} and
 * {@link #persistSession(SessionData)}.
 */
public class InMemorySessionStore implements SessionStore {

	private static final int CHUNKS_PER_MESSAGE = 10;

	private final Clock clock;

	protected final Map<String, ConductorSession> index = new LinkedHashMap<>();

	protected final Map<String, SessionData> sessions = new LinkedHashMap<>();

	public InMemorySessionStore() {
		this(Clock.systemUTC());
	}

	public InMemorySessionStore(Clock clock) {
		Assert.notNull(clock, "Clock must not be null");
		this.clock = clock;
	}

	@Override
	public Mono<Void> initialize() {
		return Mono.empty();
	}

	@Override
	public Mono<ConductorSession> create(CreateSessionParams params) {
		Assert.notNull(params, "Params must not be null");
		return Mono.fromCallable(() -> {
			synchronized (this) {
				String now = now();
				ConductorSession session = new ConductorSession(UUID.randomUUID().toString(), params.agentSessionId(),
						params.agentId(), params.workingDirectory(), now, now, SessionStatus.ACTIVE, null, 0);
				SessionData data = new SessionData(session, new ArrayList<>());
				this.index.put(session.id(), session);
				this.sessions.put(session.id(), data);
				persistSession(data);
				persistIndex();
				return session;
			}
		});
	}

	@Override
	public Mono<ConductorSession> get(String sessionId) {
		return Mono.fromCallable(() -> {
			synchronized (this) {
				return this.index.get(sessionId);
			}
		});
	}

	@Override
	public Mono<SessionData> getData(String sessionId) {
		return Mono.fromCallable(() -> {
			synchronized (this) {
				SessionData data = loadSession(sessionId);
				return data != null ? new SessionData(data.session(), List.copyOf(data.updates())) : null;
			}
		});
	}

	@Override
	public Mono<List<ConductorSession>> list(ListSessionsOptions options) {
		ListSessionsOptions effective = options != null ? options : ListSessionsOptions.all();
		return Mono.fromCallable(() -> {
			List<ConductorSession> snapshot;
			synchronized (this) {
				snapshot = List.copyOf(this.index.values());
			}
			Stream<ConductorSession> stream = snapshot.stream()
				.filter(session -> effective.agentId() == null || effective.agentId().equals(session.agentId()))
				.filter(session -> effective.status() == null || effective.status() == session.status())
				.sorted(Comparator.comparing((ConductorSession session) -> Instant.parse(session.updatedAt())).reversed());
			if (effective.offset() != null) {
				stream = stream.skip(effective.offset());
			}
			if (effective.limit() != null) {
				stream = stream.limit(effective.limit());
			}
			return stream.toList();
		});
	}

	@Override
	public Mono<ConductorSession> updateMeta(String sessionId, SessionMetaUpdate update) {
		Assert.notNull(update, "Update must not be null");
		return Mono.fromCallable(() -> {
			synchronized (this) {
				SessionData data = requireSession(sessionId);
				ConductorSession session = data.session().withMeta(update, now());
				store(new SessionData(session, data.updates()));
				return session;
			}
		});
	}

	@Override
	public Mono<StoredSessionUpdate> appendUpdate(String sessionId, Map<String, Object> update) {
		Assert.notNull(update, "Update must not be null");
		return Mono.fromCallable(() -> {
			synchronized (this) {
				SessionData data = requireSession(sessionId);
				String now = now();
				StoredSessionUpdate stored = new StoredSessionUpdate(now, data.updates().size() + 1L, update);
				List<StoredSessionUpdate> updates = new ArrayList<>(data.updates());
				updates.add(stored);
				ConductorSession session = data.session().withActivity(now, countMessages(updates));
				store(new SessionData(session, updates));
				return stored;
			}
		});
	}

	@Override
	public Mono<Void> delete(String sessionId) {
		return Mono.fromRunnable(() -> {
			synchronized (this) {
				this.index.remove(sessionId);
				this.sessions.remove(sessionId);
				deleteSession(sessionId);
				persistIndex();
			}
		});
	}

	@Override
	public Mono<ConductorSession> findByAgentSessionId(String agentSessionId) {
		return Mono.fromCallable(() -> {
			synchronized (this) {
				return this.index.values()
					.stream()
					.filter(session -> agentSessionId != null && agentSessionId.equals(session.agentSessionId()))
					.findFirst()
					.orElse(null);
			}
		});
	}

	private SessionData requireSession(String sessionId) {
		SessionData data = loadSession(sessionId);
		if (data == null) {
			throw new SessionNotFoundException(sessionId);
		}
		return data;
	}

	private void store(SessionData data) {
		this.index.put(data.session().id(), data.session());
		this.sessions.put(data.session().id(), data);
		persistSession(data);
		persistIndex();
	}

	/**
	 * Returns the full data of a known session, loading it if needed. Called with the
	 * store's monitor held.
	 * @param sessionId durable session id
	 * @return the data, or null for an unknown session
	 */
	protected SessionData loadSession(String sessionId) {
		return this.sessions.get(sessionId);
	}

	/**
	 * Hook called with the store's monitor held after the index changed.
	 */
	protected void persistIndex() {
	}

	/**
	 * Hook called with the store's monitor held after a session's data changed.
	 * @param data the new session data
	 */
	protected void persistSession(SessionData data) {
	}

	/**
	 * Hook called with the store's monitor held after a session was deleted.
	 * @param sessionId durable session id
	 */
	protected void deleteSession(String sessionId) {
	}

	private String now() {
		return this.clock.instant().toString();
	}

	static int countMessages(List<StoredSessionUpdate> updates) {
		long chunks = updates.stream()
			.map(StoredSessionUpdate::kind)
			.filter(kind -> "agent_message_chunk".equals(kind) || "user_message_chunk".equals(kind))
			.count();
		return (int) Math.max(1, (chunks + CHUNKS_PER_MESSAGE - 1) / CHUNKS_PER_MESSAGE);
	}

}
