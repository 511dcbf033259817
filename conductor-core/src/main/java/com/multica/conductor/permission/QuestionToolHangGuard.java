/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.multica.conductor.ConductorOperations;
import com.multica.conductor.PromptOptions;
import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Unblocks turns stuck in opencode's {@code question} tool.
 *
 * <p>
 * In ACP mode that tool waits for an answer that is never routed to the client, so the
 * turn never ends. When a {@code tool_call_update} reports the tool as
 * {@code in_progress} the guard cancels the turn, waits
 * {@link PermissionTimings#cancelSettleDelay()} and sends an internal prompt asking the
 * agent to put its questions to the user as plain text.
 *
 * <p>
 * Each tool call id is handled once per {@link PermissionTimings#handledToolCallRetention()}.
 */
public class QuestionToolHangGuard {

	private static final Logger logger = LoggerFactory.getLogger(QuestionToolHangGuard.class);

	static final String BROKEN_TOOL_TITLE = QuestionTools.QUESTION;

	private final ConductorOperations conductor;

	private final PermissionTimings timings;

	private final Scheduler scheduler;

	private final McpJsonMapper jsonMapper;

	private final HandledToolCallMarkers handled;

	public QuestionToolHangGuard(ConductorOperations conductor, PermissionTimings timings, Scheduler scheduler,
			McpJsonMapper jsonMapper) {
		Assert.notNull(conductor, "Conductor must not be null");
		Assert.notNull(timings, "Timings must not be null");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		this.conductor = conductor;
		this.timings = timings;
		this.scheduler = scheduler;
		this.jsonMapper = jsonMapper;
		this.handled = new HandledToolCallMarkers(timings.handledToolCallRetention(), scheduler);
	}

	/**
	 * Inspects a session update and starts the workaround for a stuck question tool.
	 * Returns without waiting for the workaround.
	 * @param notification the raw session update
	 */
	public void handleSessionUpdate(AcpSchema.SessionNotification notification) {
		if (notification == null
				|| !(notification.update() instanceof AcpSchema.ToolCallUpdateNotification update)) {
			return;
		}
		if (!BROKEN_TOOL_TITLE.equals(update.title()) || update.status() != AcpSchema.ToolCallStatus.IN_PROGRESS) {
			return;
		}

		String toolCallId = update.toolCallId();
		if (toolCallId != null && this.handled.isMarked(toolCallId)) {
			logger.debug("Already handled tool call {}, skipping", toolCallId);
			return;
		}

		String sessionId = this.conductor.resolveSessionId(notification.sessionId());
		if (sessionId == null) {
			return;
		}
		if (toolCallId != null && !this.handled.tryMark(toolCallId)) {
			return;
		}

		String questionTexts = questionTexts(QuestionToolInput.from(this.jsonMapper, update.rawInput()).questions());
		logger.info("Question tool in session {} will hang, cancelling and notifying the agent", sessionId);
		if (!questionTexts.isEmpty()) {
			logger.info("Original questions:\n{}", questionTexts);
		}

		String prompt = questionTexts.isEmpty()
				? "The \"question\" tool is not available in this environment. Please ask your question directly in "
						+ "the conversation instead of using the question tool."
				: "The \"question\" tool is not available in this environment. You tried to ask:\n\n" + questionTexts
						+ "\n\nPlease ask these questions directly in the conversation (as plain text) so the user "
						+ "can respond.";

		Mono.defer(() -> this.conductor.cancelRequest(sessionId))
			.then(Mono.delay(this.timings.cancelSettleDelay(), this.scheduler))
			.then(Mono.defer(() -> this.conductor.sendPrompt(sessionId, List.of(new AcpSchema.TextContent(prompt)),
					PromptOptions.internalPrompt())))
			.subscribeOn(this.scheduler)
			.subscribe(v -> {
			}, error -> logger.error("Failed to handle question tool in session {}", sessionId, error),
					() -> logger.info("Agent in session {} notified to ask directly", sessionId));
	}

	boolean isHandled(String toolCallId) {
		return this.handled.isMarked(toolCallId);
	}

	static String questionTexts(List<QuestionToolInput.Question> questions) {
		return IntStream.range(0, questions.size()).mapToObj(i -> {
			QuestionToolInput.Question question = questions.get(i);
			StringBuilder text = new StringBuilder().append(i + 1).append(". ").append(question.question());
			if (question.options() != null && !question.options().isEmpty()) {
				text.append("\n   Options: ")
					.append(question.options()
						.stream()
						.map(QuestionToolInput.Option::label)
						.collect(Collectors.joining(", ")));
			}
			return text.toString();
		}).collect(Collectors.joining("\n"));
	}

}
