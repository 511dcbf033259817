/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of the answer carried in a permission outcome's {@code _meta.answerType}.
 */
public enum AnswerType {

	MULTI_QUESTION("multi-question"), MULTI_SELECTED("multi-selected"), SELECTED("selected"), CUSTOM("custom");

	private final String value;

	AnswerType(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return this.value;
	}

}
