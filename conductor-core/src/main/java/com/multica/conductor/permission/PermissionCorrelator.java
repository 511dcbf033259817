/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.multica.conductor.ConductorOperations;
import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Matches permission requests raised by agents with decisions the user makes later.
 *
 * <p>
 * Each call to {@link #request} generates a request id, shows the request through the
 * {@link PermissionPresenter} and waits. The wait ends exactly once: either
 * {@link #resolve} is called with the matching id, or
 * {@link PermissionTimings#permissionTimeout()} elapses and the first {@code deny} option
 * (or the first option) is chosen. Whichever comes first removes the request, so a late
 * decision is logged and ignored.
 *
 * <p>
 * A decision that answers a question tool also records the answer on the session and
 * hands it to the {@link AnswerRecoveryWorkaround}. The outcome is returned to the agent
 * without waiting for that.
 */
public class PermissionCorrelator {

	private static final Logger logger = LoggerFactory.getLogger(PermissionCorrelator.class);

	static final String DENY_KIND = "deny";

	private final ConcurrentHashMap<String, PendingPermission> pending = new ConcurrentHashMap<>();

	private final ConductorOperations conductor;

	private final PermissionPresenter presenter;

	private final AnswerRecoveryWorkaround answerRecovery;

	private final PermissionTimings timings;

	private final Scheduler scheduler;

	private final Supplier<String> requestIdGenerator;

	public PermissionCorrelator(ConductorOperations conductor, PermissionPresenter presenter,
			AnswerRecoveryWorkaround answerRecovery, PermissionTimings timings, Scheduler scheduler) {
		this(conductor, presenter, answerRecovery, timings, scheduler, () -> UUID.randomUUID().toString());
	}

	public PermissionCorrelator(ConductorOperations conductor, PermissionPresenter presenter,
			AnswerRecoveryWorkaround answerRecovery, PermissionTimings timings, Scheduler scheduler,
			Supplier<String> requestIdGenerator) {
		Assert.notNull(conductor, "Conductor must not be null");
		Assert.notNull(presenter, "Presenter must not be null");
		Assert.notNull(answerRecovery, "Answer recovery must not be null");
		Assert.notNull(timings, "Timings must not be null");
		Assert.notNull(scheduler, "Scheduler must not be null");
		Assert.notNull(requestIdGenerator, "Request id generator must not be null");
		this.conductor = conductor;
		this.presenter = presenter;
		this.answerRecovery = answerRecovery;
		this.timings = timings;
		this.scheduler = scheduler;
		this.requestIdGenerator = requestIdGenerator;
	}

	/**
	 * Shows a permission request and waits for its outcome.
	 * @param request the agent's request
	 * @return the outcome, completing when a decision arrives or the timeout elapses
	 */
	public Mono<AcpSchema.RequestPermissionResponse> request(AcpSchema.RequestPermissionRequest request) {
		Assert.notNull(request, "Permission request must not be null");
		return Mono.defer(() -> {
			String requestId = this.requestIdGenerator.get();
			List<AcpSchema.PermissionOption> options = (request.options() != null) ? request.options() : List.of();
			String title = (request.toolCall() != null) ? request.toolCall().title() : null;

			logger.info("Permission request {}: {}", requestId, title);
			logger.debug("Permission request {} options: {}", requestId, options.stream()
				.map(option -> option.name() + " (" + option.optionId() + ")")
				.collect(Collectors.joining(", ")));

			PendingPermission pendingPermission = new PendingPermission(request);
			if (this.pending.putIfAbsent(requestId, pendingPermission) != null) {
				return Mono.error(new IllegalStateException("Duplicate permission request id " + requestId));
			}
			pendingPermission.timer = Mono.delay(this.timings.permissionTimeout(), this.scheduler)
				.subscribe(tick -> expire(requestId));

			String durableSessionId = this.conductor.resolveSessionId(request.sessionId());
			PermissionRequestView view = new PermissionRequestView(requestId, request.sessionId(),
					(durableSessionId != null) ? durableSessionId : request.sessionId(),
					PermissionRequestView.ToolCallSummary.of(request.toolCall()), options);
			try {
				this.presenter.present(view);
			}
			catch (RuntimeException e) {
				logger.error("Presenter failed to show permission request {}", requestId, e);
			}

			return pendingPermission.outcome.asMono()
				.map(AcpSchema.RequestPermissionResponse::new)
				.doOnCancel(() -> discard(requestId));
		});
	}

	/**
	 * Applies a decision to its pending request. A decision for an unknown, expired or
	 * already resolved request is logged and ignored.
	 * @param decision the user's decision
	 */
	public void resolve(PermissionDecision decision) {
		Assert.notNull(decision, "Permission decision must not be null");
		logger.info("Received decision for {}: {}", decision.requestId(), decision.optionId());

		PendingPermission pendingPermission = (decision.requestId() != null) ? this.pending.remove(decision.requestId())
				: null;
		if (pendingPermission == null) {
			logger.warn("No pending permission request for requestId: {}", decision.requestId());
			return;
		}
		pendingPermission.disposeTimer();

		PermissionAnswerData data = decision.data();
		pendingPermission.outcome
			.tryEmitValue(new AcpSchema.PermissionSelected(decision.optionId(), meta(data)));

		AcpSchema.RequestPermissionRequest request = pendingPermission.request;
		String title = (request.toolCall() != null) ? request.toolCall().title() : null;
		if (data != null && QuestionTools.isQuestionTool(title) && data.hasAnswer()) {
			recordAndRecover(request, data);
		}
	}

	/**
	 * Number of requests still waiting for a decision.
	 * @return the pending count
	 */
	public int pendingCount() {
		return this.pending.size();
	}

	private void recordAndRecover(AcpSchema.RequestPermissionRequest request, PermissionAnswerData data) {
		try {
			String sessionId = this.conductor.resolveSessionId(request.sessionId());
			if (sessionId != null && request.toolCall() != null) {
				this.conductor.recordQuestionResponse(sessionId, request.toolCall().toolCallId(), data);
			}
			this.answerRecovery.handle(request.sessionId(), request.toolCall(), data);
		}
		catch (RuntimeException e) {
			logger.error("Failed to recover answer for session {}", request.sessionId(), e);
		}
	}

	private void expire(String requestId) {
		PendingPermission pendingPermission = this.pending.remove(requestId);
		if (pendingPermission == null) {
			return;
		}
		List<AcpSchema.PermissionOption> options = pendingPermission.request.options();
		if (options == null || options.isEmpty()) {
			logger.info("Permission request {} timed out without options, cancelling", requestId);
			pendingPermission.outcome.tryEmitValue(new AcpSchema.PermissionCancelled());
			return;
		}
		AcpSchema.PermissionOption option = options.stream()
			.filter(candidate -> DENY_KIND.equals(candidate.kind()))
			.findFirst()
			.orElse(options.get(0));
		logger.info("Permission request {} timed out, selecting {}", requestId, option.optionId());
		pendingPermission.outcome.tryEmitValue(new AcpSchema.PermissionSelected(option.optionId()));
	}

	private void discard(String requestId) {
		PendingPermission pendingPermission = this.pending.remove(requestId);
		if (pendingPermission != null) {
			logger.debug("Permission request {} abandoned by the agent", requestId);
			pendingPermission.disposeTimer();
		}
	}

	static Map<String, Object> meta(PermissionAnswerData data) {
		if (data == null) {
			return null;
		}
		Map<String, Object> meta = new LinkedHashMap<>();
		String userAnswer = data.answerText();
		if (userAnswer != null) {
			meta.put("userAnswer", userAnswer);
		}
		if (data.answers() != null) {
			meta.put("userAnswers", data.answers());
		}
		meta.put("answerType", data.answerType().getValue());
		return meta;
	}

	private static final class PendingPermission {

		private final AcpSchema.RequestPermissionRequest request;

		private final Sinks.One<AcpSchema.RequestPermissionOutcome> outcome = Sinks.one();

		private volatile Disposable timer;

		private PendingPermission(AcpSchema.RequestPermissionRequest request) {
			this.request = request;
		}

		private void disposeTimer() {
			Disposable current = this.timer;
			if (current != null) {
				current.dispose();
			}
		}

	}

}
