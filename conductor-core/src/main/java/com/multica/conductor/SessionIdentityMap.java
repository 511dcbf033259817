/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.HashMap;
import java.util.Map;

import com.multica.conductor.util.Assert;

/**
 * Two-way mapping between durable session ids and the session ids assigned by running
 * agents. A durable session maps to at most one agent session at a time; binding a new
 * agent session replaces the previous one.
 */
public class SessionIdentityMap {

	private final Map<String, String> protocolByDurable = new HashMap<>();

	private final Map<String, String> durableByProtocol = new HashMap<>();

	public synchronized void bind(String durableSessionId, String protocolSessionId) {
		Assert.hasText(durableSessionId, "Durable session id must not be empty");
		Assert.hasText(protocolSessionId, "Protocol session id must not be empty");
		String previousProtocol = this.protocolByDurable.put(durableSessionId, protocolSessionId);
		if (previousProtocol != null) {
			this.durableByProtocol.remove(previousProtocol);
		}
		String previousDurable = this.durableByProtocol.put(protocolSessionId, durableSessionId);
		if (previousDurable != null && !previousDurable.equals(durableSessionId)) {
			this.protocolByDurable.remove(previousDurable);
		}
	}

	/**
	 * Removes the binding of a durable session.
	 * @param durableSessionId the durable id
	 * @return the agent session id it was bound to, or null
	 */
	public synchronized String unbind(String durableSessionId) {
		String protocolSessionId = this.protocolByDurable.remove(durableSessionId);
		if (protocolSessionId != null) {
			this.durableByProtocol.remove(protocolSessionId);
		}
		return protocolSessionId;
	}

	public synchronized String durableId(String protocolSessionId) {
		return (protocolSessionId != null) ? this.durableByProtocol.get(protocolSessionId) : null;
	}

	public synchronized String protocolId(String durableSessionId) {
		return (durableSessionId != null) ? this.protocolByDurable.get(durableSessionId) : null;
	}

	public synchronized int size() {
		return this.protocolByDurable.size();
	}

}
