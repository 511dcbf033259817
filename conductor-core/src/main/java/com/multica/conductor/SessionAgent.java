/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import com.multica.conductor.client.AcpAsyncClient;

/**
 * A running agent serving one durable session.
 */
final class SessionAgent {

	private final String sessionId;

	private final AgentConfig agent;

	private final AcpAsyncClient client;

	private final String protocolSessionId;

	private volatile boolean needsHistoryReplay;

	SessionAgent(String sessionId, AgentConfig agent, AcpAsyncClient client, String protocolSessionId,
			boolean needsHistoryReplay) {
		this.sessionId = sessionId;
		this.agent = agent;
		this.client = client;
		this.protocolSessionId = protocolSessionId;
		this.needsHistoryReplay = needsHistoryReplay;
	}

	String sessionId() {
		return this.sessionId;
	}

	AgentConfig agent() {
		return this.agent;
	}

	AcpAsyncClient client() {
		return this.client;
	}

	String protocolSessionId() {
		return this.protocolSessionId;
	}

	boolean needsHistoryReplay() {
		return this.needsHistoryReplay;
	}

	void historyReplayed() {
		this.needsHistoryReplay = false;
	}

}
