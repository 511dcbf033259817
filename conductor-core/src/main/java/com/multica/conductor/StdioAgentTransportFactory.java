/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import com.multica.conductor.client.transport.AgentParameters;
import com.multica.conductor.client.transport.StdioAcpClientTransport;
import com.multica.conductor.spec.AcpClientTransport;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;

/**
 * Launches each agent as a child process of the conductor.
 */
public class StdioAgentTransportFactory implements AgentTransportFactory {

	private final McpJsonMapper jsonMapper;

	public StdioAgentTransportFactory() {
		this(McpJsonMapper.getDefault());
	}

	public StdioAgentTransportFactory(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	@Override
	public AcpClientTransport create(AgentConfig agent, String workingDirectory) {
		AgentParameters params = AgentParameters.builder(agent.command())
			.args(agent.args())
			.env(agent.env())
			.workingDirectory(workingDirectory)
			.build();
		return new StdioAcpClientTransport(params, this.jsonMapper);
	}

}
