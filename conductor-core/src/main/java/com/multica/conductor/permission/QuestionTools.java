/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.util.Locale;

/**
 * Names of the tools agents use to ask the user structured questions.
 */
public final class QuestionTools {

	public static final String ASK_USER_QUESTION = "AskUserQuestion";

	/** The opencode variant, which never reaches the client as a permission request. */
	public static final String QUESTION = "question";

	public static final String MCP_CONDUCTOR_ASK_USER_QUESTION = "mcp__conductor__askuserquestion";

	private QuestionTools() {
	}

	/**
	 * Whether a tool title names a question tool. Matching ignores case.
	 * @param title the tool call title, may be null
	 * @return true for any of the question tool names
	 */
	public static boolean isQuestionTool(String title) {
		if (title == null) {
			return false;
		}
		String normalized = title.toLowerCase(Locale.ROOT);
		return normalized.equals(ASK_USER_QUESTION.toLowerCase(Locale.ROOT)) || normalized.equals(QUESTION)
				|| normalized.equals(MCP_CONDUCTOR_ASK_USER_QUESTION);
	}

}
