/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The agents the conductor knows out of the box.
 */
public final class DefaultAgents {

	public static final AgentConfig CLAUDE_CODE = new AgentConfig("claude-code", "Claude Code", "claude-code-acp",
			List.of());

	public static final AgentConfig OPENCODE = new AgentConfig("opencode", "opencode", "opencode", List.of("acp"));

	public static final AgentConfig CODEX = new AgentConfig("codex", "Codex CLI (ACP)", "codex-acp", List.of());

	private DefaultAgents() {
	}

	/**
	 * The built-in agents keyed by id, in display order.
	 * @return a new mutable map
	 */
	public static Map<String, AgentConfig> all() {
		Map<String, AgentConfig> agents = new LinkedHashMap<>();
		agents.put(CLAUDE_CODE.id(), CLAUDE_CODE);
		agents.put(OPENCODE.id(), OPENCODE);
		agents.put(CODEX.id(), CODEX);
		return agents;
	}

}
