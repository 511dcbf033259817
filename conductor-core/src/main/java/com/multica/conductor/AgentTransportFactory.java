/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import com.multica.conductor.spec.AcpClientTransport;

/**
 * Creates the transport connecting the conductor to a new agent instance.
 */
@FunctionalInterface
public interface AgentTransportFactory {

	/**
	 * @param agent the agent to launch
	 * @param workingDirectory the session's working directory
	 * @return an unconnected transport
	 */
	AcpClientTransport create(AgentConfig agent, String workingDirectory);

}
