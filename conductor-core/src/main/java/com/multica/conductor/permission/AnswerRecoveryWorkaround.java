/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.multica.conductor.ConductorOperations;
import com.multica.conductor.PromptOptions;
import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Makes the user's answer to a question tool visible to the agent.
 *
 * <p>
 * Agents only learn that a question tool was answered, not what the answer was. After
 * the permission outcome has been returned this component queues the answer on the
 * session, cancels the turn, waits until the conductor reports the session idle (bounded
 * by {@link PermissionTimings#processingMaxWait()}), pauses for
 * {@link PermissionTimings#cancelSettleDelay()} and sends the answer as an internal
 * prompt.
 *
 * <p>
 * {@link #handle} returns once the answer is queued. Failures of the cancel and re-prompt
 * sequence are logged and never reach the caller.
 */
public class AnswerRecoveryWorkaround {

	private static final Logger logger = LoggerFactory.getLogger(AnswerRecoveryWorkaround.class);

	private static final String UNKNOWN_QUESTION = "Unknown question";

	private final ConductorOperations conductor;

	private final PermissionTimings timings;

	private final Scheduler scheduler;

	private final McpJsonMapper jsonMapper;

	public AnswerRecoveryWorkaround(ConductorOperations conductor, PermissionTimings timings, Scheduler scheduler,
			McpJsonMapper jsonMapper) {
		Assert.notNull(conductor, "Conductor must not be null");
		Assert.notNull(timings, "Timings must not be null");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		this.conductor = conductor;
		this.timings = timings;
		this.scheduler = scheduler;
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Queues the answer and schedules the cancel and re-prompt sequence.
	 * @param protocolSessionId the agent's session id
	 * @param toolCall the question tool call, used for its raw input
	 * @param data the user's answer
	 */
	public void handle(String protocolSessionId, AcpSchema.ToolCallUpdate toolCall, PermissionAnswerData data) {
		String sessionId = this.conductor.resolveSessionId(protocolSessionId);
		if (sessionId == null) {
			logger.warn("Could not find session for agent session {}", protocolSessionId);
			return;
		}
		if (data == null) {
			return;
		}

		String answerText;
		List<QuestionAnswer> answers = data.answers();
		if (answers != null && !answers.isEmpty()) {
			logger.info("Processing {} answers for session {}", answers.size(), sessionId);
			for (QuestionAnswer item : answers) {
				this.conductor.addPendingAnswer(sessionId, item.question(), item.answer());
				logger.debug("Stored answer: \"{}\" -> \"{}\"", item.question(), item.answer());
			}
			answerText = (answers.size() == 1) ? answers.get(0).answer() : transcript(answers);
		}
		else {
			Object rawInput = (toolCall != null) ? toolCall.rawInput() : null;
			List<QuestionToolInput.Question> questions = QuestionToolInput.from(this.jsonMapper, rawInput)
				.questions();
			if (questions.isEmpty()) {
				return;
			}
			String question = questions.get(0).question();
			if (question == null || question.isEmpty()) {
				question = UNKNOWN_QUESTION;
			}
			String answer = data.choiceText();
			if (answer == null) {
				return;
			}
			this.conductor.addPendingAnswer(sessionId, question, answer);
			logger.debug("Stored answer for session {}: \"{}\" -> \"{}\"", sessionId, question, answer);
			answerText = answer;
		}

		resubmit(sessionId, answerText).subscribe(v -> {
		}, error -> logger.error("Error during cancel and re-prompt for session {}", sessionId, error));
	}

	private Mono<Void> resubmit(String sessionId, String answerText) {
		return Mono.defer(() -> {
			logger.info("Cancelling current turn of session {} to deliver the user's answer", sessionId);
			return this.conductor.cancelRequest(sessionId);
		})
			.then(awaitIdle(sessionId))
			.then(Mono.delay(this.timings.cancelSettleDelay(), this.scheduler))
			.then(Mono.defer(() -> this.conductor.sendPrompt(sessionId, List.of(new AcpSchema.TextContent(answerText)),
					PromptOptions.internalPrompt())))
			.doOnSuccess(v -> logger.info("Re-prompt sent to session {} with user answer: \"{}\"", sessionId,
					abbreviate(answerText)))
			.subscribeOn(this.scheduler);
	}

	private Mono<Void> awaitIdle(String sessionId) {
		return Flux.interval(Duration.ZERO, this.timings.processingPollInterval(), this.scheduler)
			.filter(tick -> !this.conductor.isSessionProcessing(sessionId))
			.next()
			.timeout(this.timings.processingMaxWait(), this.scheduler)
			.doOnNext(tick -> logger.debug("Cancel of session {} completed after {} polls", sessionId, tick))
			.onErrorResume(TimeoutException.class, e -> {
				logger.warn("Timed out waiting for cancel of session {} to complete, proceeding anyway", sessionId);
				return Mono.empty();
			})
			.then();
	}

	private static String transcript(List<QuestionAnswer> answers) {
		return IntStream.range(0, answers.size())
			.mapToObj(i -> "Q" + (i + 1) + ": " + answers.get(i).question() + "\nA" + (i + 1) + ": "
					+ answers.get(i).answer())
			.collect(Collectors.joining("\n\n"));
	}

	private static String abbreviate(String text) {
		return (text.length() > 100) ? text.substring(0, 100) + "..." : text;
	}

}
