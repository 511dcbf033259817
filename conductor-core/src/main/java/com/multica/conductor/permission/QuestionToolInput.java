/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.modelcontextprotocol.json.McpJsonMapper;

/**
 * The raw input of a question tool call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionToolInput(@JsonProperty("questions") List<Question> questions) {

	private static final QuestionToolInput EMPTY = new QuestionToolInput(List.of());

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Question(@JsonProperty("question") String question, @JsonProperty("header") String header,
			@JsonProperty("options") List<Option> options, @JsonProperty("multiSelect") Boolean multiSelect) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Option(@JsonProperty("label") String label, @JsonProperty("description") String description) {
	}

	/**
	 * Reads the questions out of a tool call's raw input. Input of any other shape yields
	 * no questions.
	 * @param jsonMapper the mapper used to convert the input
	 * @param rawInput the tool call's raw input, may be null
	 * @return the parsed input, never null
	 */
	public static QuestionToolInput from(McpJsonMapper jsonMapper, Object rawInput) {
		if (rawInput == null) {
			return EMPTY;
		}
		try {
			QuestionToolInput input = jsonMapper.convertValue(rawInput, QuestionToolInput.class);
			return (input == null || input.questions() == null) ? EMPTY : input;
		}
		catch (IllegalArgumentException e) {
			return EMPTY;
		}
	}

}
