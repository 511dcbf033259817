/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import com.multica.conductor.util.Assert;

/**
 * Answers collected per durable session until the next prompt delivers them. Each
 * session maps to an immutable list that is replaced on every add, so readers always
 * see a complete snapshot.
 */
public class PendingAnswerStore {

	private final ConcurrentHashMap<String, List<PendingAnswer>> answers = new ConcurrentHashMap<>();

	public void add(String sessionId, String question, String answer) {
		Assert.notNull(sessionId, "Session id must not be null");
		this.answers.merge(sessionId, List.of(new PendingAnswer(question, answer)), (current, added) -> {
			List<PendingAnswer> updated = new ArrayList<>(current);
			updated.addAll(added);
			return List.copyOf(updated);
		});
	}

	public List<PendingAnswer> get(String sessionId) {
		return this.answers.getOrDefault(sessionId, List.of());
	}

	/**
	 * Returns and clears the answers of a session.
	 * @param sessionId the durable session id
	 * @return the answers in the order they were added, empty when there are none
	 */
	public List<PendingAnswer> consume(String sessionId) {
		List<PendingAnswer> list = this.answers.remove(sessionId);
		return (list != null) ? list : List.of();
	}

	public void clear(String sessionId) {
		this.answers.remove(sessionId);
	}

}
