/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured answer attached to a permission decision for a question tool. At most one
 * of the forms is expected to be set: a list of answered questions, several selected
 * option labels, one selected label, or free text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionAnswerData(@JsonProperty("selectedOption") String selectedOption,
		@JsonProperty("selectedOptions") List<String> selectedOptions, @JsonProperty("customText") String customText,
		@JsonProperty("answers") List<QuestionAnswer> answers) {

	public static PermissionAnswerData selected(String selectedOption) {
		return new PermissionAnswerData(selectedOption, null, null, null);
	}

	public static PermissionAnswerData multiSelected(List<String> selectedOptions) {
		return new PermissionAnswerData(null, selectedOptions, null, null);
	}

	public static PermissionAnswerData custom(String customText) {
		return new PermissionAnswerData(null, null, customText, null);
	}

	public static PermissionAnswerData answers(List<QuestionAnswer> answers) {
		return new PermissionAnswerData(null, null, null, answers);
	}

	/**
	 * Whether any form of answer is present.
	 * @return true when there is something to hand back to the agent
	 */
	@JsonIgnore
	public boolean hasAnswer() {
		return (this.answers != null && !this.answers.isEmpty()) || this.selectedOptions != null
				|| hasText(this.selectedOption) || hasText(this.customText);
	}

	/**
	 * The answer as one line of text: the answers of all questions, else the selected
	 * labels, else the selected label, else the free text, each joined with
	 * {@code ", "}.
	 * @return the answer text, or null when no form carries text
	 */
	@JsonIgnore
	public String answerText() {
		if (this.answers != null && !this.answers.isEmpty()) {
			String joined = String.join(", ", this.answers.stream().map(QuestionAnswer::answer).toList());
			if (!joined.isEmpty()) {
				return joined;
			}
		}
		return choiceText();
	}

	/**
	 * The single-question answer: the selected labels, else the selected label, else the
	 * free text.
	 * @return the answer text, or null when none is present
	 */
	@JsonIgnore
	public String choiceText() {
		if (this.selectedOptions != null && !this.selectedOptions.isEmpty()) {
			String joined = String.join(", ", this.selectedOptions);
			if (!joined.isEmpty()) {
				return joined;
			}
		}
		if (hasText(this.selectedOption)) {
			return this.selectedOption;
		}
		return hasText(this.customText) ? this.customText : null;
	}

	/**
	 * Classifies the answer for the {@code _meta.answerType} field.
	 * @return the answer type
	 */
	@JsonIgnore
	public AnswerType answerType() {
		if (this.answers != null && this.answers.size() > 1) {
			return AnswerType.MULTI_QUESTION;
		}
		if (this.selectedOptions != null) {
			return AnswerType.MULTI_SELECTED;
		}
		if (hasText(this.selectedOption)) {
			return AnswerType.SELECTED;
		}
		return AnswerType.CUSTOM;
	}

	private static boolean hasText(String value) {
		return value != null && !value.isEmpty();
	}

}
