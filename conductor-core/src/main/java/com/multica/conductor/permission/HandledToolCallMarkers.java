/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.multica.conductor.util.Assert;
import reactor.core.scheduler.Scheduler;

/**
 * Tool call ids that have already been handled, each kept for a fixed retention window.
 * Expired entries are swept on access, so the set stays bounded by the number of tool
 * calls seen within one window.
 */
class HandledToolCallMarkers {

	private final ConcurrentHashMap<String, Long> expiries = new ConcurrentHashMap<>();

	private final Duration retention;

	private final Scheduler clock;

	HandledToolCallMarkers(Duration retention, Scheduler clock) {
		Assert.notNull(retention, "Retention must not be null");
		Assert.notNull(clock, "Clock must not be null");
		this.retention = retention;
		this.clock = clock;
	}

	/**
	 * Marks a tool call as handled unless it already is.
	 * @param toolCallId the tool call id
	 * @return true if the id was not marked, or its marker had expired
	 */
	boolean tryMark(String toolCallId) {
		long now = now();
		sweep(now);
		AtomicBoolean marked = new AtomicBoolean(false);
		this.expiries.compute(toolCallId, (id, expiry) -> {
			if (expiry != null && expiry > now) {
				return expiry;
			}
			marked.set(true);
			return now + this.retention.toMillis();
		});
		return marked.get();
	}

	boolean isMarked(String toolCallId) {
		Long expiry = this.expiries.get(toolCallId);
		return expiry != null && expiry > now();
	}

	int size() {
		sweep(now());
		return this.expiries.size();
	}

	private void sweep(long now) {
		this.expiries.values().removeIf(expiry -> expiry <= now);
	}

	private long now() {
		return this.clock.now(TimeUnit.MILLISECONDS);
	}

}
