/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.List;
import java.util.Map;

import com.multica.conductor.util.Assert;

/**
 * How to launch one kind of agent.
 *
 * @param id registry key, for example {@code opencode}
 * @param name display name
 * @param command executable to run
 * @param args command line arguments
 * @param env variables added to the inherited environment
 * @param enabled whether sessions may use this agent
 */
public record AgentConfig(String id, String name, String command, List<String> args, Map<String, String> env,
		boolean enabled) {

	public AgentConfig {
		Assert.hasText(id, "Agent id must not be empty");
		Assert.hasText(command, "Agent command must not be empty");
		args = (args != null) ? List.copyOf(args) : List.of();
		env = (env != null) ? Map.copyOf(env) : Map.of();
	}

	public AgentConfig(String id, String name, String command, List<String> args) {
		this(id, name, command, args, Map.of(), true);
	}

}
