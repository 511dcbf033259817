/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;

import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * {@link SessionStore} backed by JSON files:
 *
 * <pre>
 * basePath/
 *   index.json          list of session records
 *   data/{id}.json      record plus full update history
 * </pre>
 *
 * Session data is loaded lazily on first access. Every write goes to a temporary file that
 * is then moved over the target.
 */
public class JsonFileSessionStore extends InMemorySessionStore {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileSessionStore.class);

	private static final TypeRef<List<ConductorSession>> INDEX_TYPE_REF = new TypeRef<>() {
	};

	private final Path indexPath;

	private final Path dataPath;

	private final McpJsonMapper jsonMapper;

	public JsonFileSessionStore(Path basePath, McpJsonMapper jsonMapper) {
		this(basePath, jsonMapper, Clock.systemUTC());
	}

	public JsonFileSessionStore(Path basePath, McpJsonMapper jsonMapper, Clock clock) {
		super(clock);
		Assert.notNull(basePath, "Base path must not be null");
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		this.indexPath = basePath.resolve("index.json");
		this.dataPath = basePath.resolve("data");
		this.jsonMapper = jsonMapper;
	}

	@Override
	public Mono<Void> initialize() {
		return Mono.fromRunnable(() -> {
			synchronized (this) {
				try {
					Files.createDirectories(this.dataPath);
				}
				catch (IOException e) {
					throw new UncheckedIOException("Cannot create session directory " + this.dataPath, e);
				}
				this.index.clear();
				this.sessions.clear();
				if (!Files.exists(this.indexPath)) {
					return;
				}
				try {
					String json = Files.readString(this.indexPath, StandardCharsets.UTF_8);
					this.jsonMapper.readValue(json, INDEX_TYPE_REF).forEach(session -> this.index.put(session.id(), session));
					logger.info("Loaded {} sessions from {}", this.index.size(), this.indexPath);
				}
				catch (IOException e) {
					logger.error("Failed to load session index {}, starting fresh", this.indexPath, e);
				}
			}
		});
	}

	@Override
	protected SessionData loadSession(String sessionId) {
		SessionData loaded = super.loadSession(sessionId);
		if (loaded != null || !this.index.containsKey(sessionId)) {
			return loaded;
		}
		Path file = sessionFile(sessionId);
		if (!Files.exists(file)) {
			return null;
		}
		try {
			SessionData data = this.jsonMapper.readValue(Files.readString(file, StandardCharsets.UTF_8),
					SessionData.class);
			this.sessions.put(sessionId, data);
			return data;
		}
		catch (IOException e) {
			logger.error("Failed to load session {}", sessionId, e);
			return null;
		}
	}

	@Override
	protected void persistIndex() {
		write(this.indexPath, List.copyOf(this.index.values()));
	}

	@Override
	protected void persistSession(SessionData data) {
		write(sessionFile(data.session().id()), data);
	}

	@Override
	protected void deleteSession(String sessionId) {
		try {
			Files.deleteIfExists(sessionFile(sessionId));
		}
		catch (IOException e) {
			throw new UncheckedIOException("Cannot delete session file for " + sessionId, e);
		}
	}

	private Path sessionFile(String sessionId) {
		return this.dataPath.resolve(sessionId + ".json");
	}

	private void write(Path target, Object value) {
		Path temp = target.resolveSibling(target.getFileName() + ".tmp");
		try {
			Files.writeString(temp, this.jsonMapper.writeValueAsString(value), StandardCharsets.UTF_8);
			try {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Cannot write " + target, e);
		}
	}

}
