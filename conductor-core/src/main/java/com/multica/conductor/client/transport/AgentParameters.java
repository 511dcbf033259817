/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.client.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.multica.conductor.util.Assert;

/**
 * Command line and environment used to launch an agent subprocess.
 *
 * <p>
 * The environment starts from the conductor's own environment, so agents see the user's
 * credentials and {@code PATH}, and is then overlaid with the variables added through the
 * builder.
 *
 * @author Mark Pollack
 */
public class AgentParameters {

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	private final String workingDirectory;

	private AgentParameters(String command, List<String> args, Map<String, String> env, String workingDirectory) {
		Assert.notNull(command, "The command can not be null");
		Assert.notNull(args, "The args can not be null");
		this.command = command;
		this.args = List.copyOf(args);
		this.env = Map.copyOf(env);
		this.workingDirectory = workingDirectory;
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	public Map<String, String> getEnv() {
		return this.env;
	}

	/**
	 * Directory the agent process starts in, or null to inherit the conductor's.
	 * @return the working directory
	 */
	public String getWorkingDirectory() {
		return this.workingDirectory;
	}

	/**
	 * The full command line, command first.
	 * @return the command followed by its arguments
	 */
	public List<String> getCommandLine() {
		List<String> commandLine = new ArrayList<>();
		commandLine.add(this.command);
		commandLine.addAll(this.args);
		return commandLine;
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>(System.getenv());

		private String workingDirectory;

		public Builder(String command) {
			Assert.notNull(command, "The command can not be null");
			this.command = command;
		}

		public Builder arg(String arg) {
			Assert.notNull(arg, "The arg can not be null");
			this.args.add(arg);
			return this;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.notNull(key, "The key can not be null");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		public Builder env(Map<String, String> env) {
			if (env != null && !env.isEmpty()) {
				env.forEach(this::addEnvVar);
			}
			return this;
		}

		public Builder workingDirectory(String workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public AgentParameters build() {
			return new AgentParameters(this.command, this.args, this.env, this.workingDirectory);
		}

	}

}
