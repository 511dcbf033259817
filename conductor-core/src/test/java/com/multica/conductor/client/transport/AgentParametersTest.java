/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.client.transport;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test suite for {@link AgentParameters} builder and configuration.
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
class AgentParametersTest {

	@Test
	void testBuilderWithCommand() {
		AgentParameters params = AgentParameters.builder("opencode").build();

		assertThat(params.getCommand()).isEqualTo("opencode");
		assertThat(params.getArgs()).isEmpty();
		assertThat(params.getEnv()).isNotEmpty(); // inherits the conductor's environment
		assertThat(params.getWorkingDirectory()).isNull();
	}

	@Test
	void testBuilderWithNullCommand() {
		assertThatThrownBy(() -> AgentParameters.builder(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("The command can not be null");
	}

	@Test
	void testBuilderWithArgs() {
		List<String> argsList = Arrays.asList("--model", "sonnet");
		AgentParameters params = AgentParameters.builder("opencode").arg("acp").args(argsList).args("--verbose").build();

		assertThat(params.getArgs()).containsExactly("acp", "--model", "sonnet", "--verbose");
		assertThat(params.getArgs()).isNotSameAs(argsList);
		assertThat(params.getCommandLine()).containsExactly("opencode", "acp", "--model", "sonnet", "--verbose");
	}

	@Test
	void testBuilderWithNullArg() {
		assertThatThrownBy(() -> AgentParameters.builder("opencode").arg(null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("The arg can not be null");
	}

	@Test
	void testEnvironmentOverlay() {
		AgentParameters params = AgentParameters.builder("codex-acp")
			.addEnvVar("OPENAI_API_KEY", "sk-test")
			.env(Map.of("RUST_LOG", "debug"))
			.env(null)
			.build();

		assertThat(params.getEnv()).containsEntry("OPENAI_API_KEY", "sk-test").containsEntry("RUST_LOG", "debug");
	}

	@Test
	void testBuilderWithNullEnvValue() {
		assertThatThrownBy(() -> AgentParameters.builder("opencode").addEnvVar("KEY", null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("The value can not be null");
	}

	@Test
	void testWorkingDirectory() {
		AgentParameters params = AgentParameters.builder("opencode").workingDirectory("/workspace").build();

		assertThat(params.getWorkingDirectory()).isEqualTo("/workspace");
	}

	@Test
	void testParametersAreImmutable() {
		AgentParameters params = AgentParameters.builder("opencode").arg("acp").build();

		assertThatThrownBy(() -> params.getArgs().add("more")).isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> params.getEnv().put("K", "V")).isInstanceOf(UnsupportedOperationException.class);
	}

}
