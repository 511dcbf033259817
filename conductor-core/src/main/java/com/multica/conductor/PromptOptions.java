/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

/**
 * Per-prompt delivery options.
 *
 * @param internal when true the prompt reaches the agent but is flagged so that user-facing
 * transcripts can hide it
 */
public record PromptOptions(boolean internal) {

	private static final PromptOptions DEFAULT = new PromptOptions(false);

	private static final PromptOptions INTERNAL = new PromptOptions(true);

	public static PromptOptions defaults() {
		return DEFAULT;
	}

	public static PromptOptions internalPrompt() {
		return INTERNAL;
	}

}
