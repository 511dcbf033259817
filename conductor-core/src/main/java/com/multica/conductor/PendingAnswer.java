/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

/**
 * A question and the user's answer, waiting to be sent with the next prompt.
 */
public record PendingAnswer(String question, String answer) {
}
