/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import com.multica.conductor.client.AcpAsyncClient;
import com.multica.conductor.client.AcpClient;
import com.multica.conductor.error.SessionNotFoundException;
import com.multica.conductor.permission.AnswerRecoveryWorkaround;
import com.multica.conductor.permission.PermissionAnswerData;
import com.multica.conductor.permission.PermissionCorrelator;
import com.multica.conductor.permission.PermissionDecision;
import com.multica.conductor.permission.PermissionPresenter;
import com.multica.conductor.permission.PermissionRequestView;
import com.multica.conductor.permission.PermissionTimings;
import com.multica.conductor.permission.QuestionToolHangGuard;
import com.multica.conductor.session.ConductorSession;
import com.multica.conductor.session.CreateSessionParams;
import com.multica.conductor.session.InMemorySessionStore;
import com.multica.conductor.session.ListSessionsOptions;
import com.multica.conductor.session.SessionData;
import com.multica.conductor.session.SessionMetaUpdate;
import com.multica.conductor.session.SessionStatus;
import com.multica.conductor.session.SessionStore;
import com.multica.conductor.spec.AcpClientTransport;
import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs agent sessions and routes their traffic.
 *
 * <p>
 * Every durable session is served by at most one running agent. The conductor starts
 * agents through an {@link AgentTransportFactory}, keeps the mapping between durable and
 * agent session ids, stores every update in the {@link SessionStore} and forwards it to the
 * {@link ConductorListener}. Permission requests go through a {@link PermissionCorrelator};
 * tool updates go through a {@link QuestionToolHangGuard}.
 *
 * <pre>{@code
 * Conductor conductor = Conductor.builder(new StdioAgentTransportFactory())
 *     .sessionStore(new JsonFileSessionStore(dataDir, McpJsonMapper.getDefault()))
 *     .permissionPresenter(ui::showPermissionRequest)
 *     .listener(ui)
 *     .build();
 *
 * conductor.initialize().block();
 * ConductorSession session = conductor.createSession("/workspace", "opencode").block();
 * conductor.prompt(session.id(), List.of(new AcpSchema.TextContent("Fix the failing test"))).block();
 *
 * // later, from the UI thread
 * conductor.handlePermissionResponse(new PermissionDecision(requestId, "allow"));
 * }</pre>
 */
public class Conductor implements ConductorOperations {

	private static final Logger logger = LoggerFactory.getLogger(Conductor.class);

	static final String USER_MESSAGE = "user_message";

	static final String QUESTION_RESPONSE = "askuserquestion_response";

	static final int PROTOCOL_VERSION = 1;

	private static final TypeRef<Map<String, Object>> MAP_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<List<Object>> LIST_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.RequestPermissionRequest> REQUEST_PERMISSION_TYPE_REF = new TypeRef<>() {
	};

	private final AgentTransportFactory transportFactory;

	private final SessionStore sessionStore;

	private final Map<String, AgentConfig> agents;

	private final ConductorListener listener;

	private final Scheduler scheduler;

	private final boolean ownsScheduler;

	private final McpJsonMapper jsonMapper;

	private final Duration requestTimeout;

	private final Duration promptTimeout;

	private final SessionIdentityMap identities = new SessionIdentityMap();

	private final PendingAnswerStore pendingAnswers = new PendingAnswerStore();

	private final ConcurrentHashMap<String, SessionAgent> running = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, Mono<SessionAgent>> starting = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, Integer> processing = new ConcurrentHashMap<>();

	private final PermissionCorrelator permissionCorrelator;

	private final QuestionToolHangGuard questionToolHangGuard;

	private Conductor(Builder builder) {
		this.transportFactory = builder.transportFactory;
		this.sessionStore = (builder.sessionStore != null) ? builder.sessionStore : new InMemorySessionStore();
		this.agents = Map.copyOf(builder.agents);
		this.listener = builder.listener;
		this.ownsScheduler = builder.scheduler == null;
		this.scheduler = this.ownsScheduler ? defaultScheduler() : builder.scheduler;
		this.jsonMapper = builder.jsonMapper;
		this.requestTimeout = builder.requestTimeout;
		this.promptTimeout = builder.promptTimeout;

		AnswerRecoveryWorkaround answerRecovery = new AnswerRecoveryWorkaround(this, builder.timings, this.scheduler,
				this.jsonMapper);
		PermissionPresenter presenter = (builder.permissionPresenter != null) ? builder.permissionPresenter
				: this::autoApprove;
		this.permissionCorrelator = new PermissionCorrelator(this, presenter, answerRecovery, builder.timings,
				this.scheduler);
		this.questionToolHangGuard = new QuestionToolHangGuard(this, builder.timings, this.scheduler,
				this.jsonMapper);
	}

	public static Builder builder(AgentTransportFactory transportFactory) {
		return new Builder(transportFactory);
	}

	private static Scheduler defaultScheduler() {
		return Schedulers.fromExecutorService(Executors.newScheduledThreadPool(1, runnable -> {
			Thread thread = new Thread(runnable, "conductor-timer");
			thread.setDaemon(true);
			return thread;
		}), "conductor-timer");
	}

	/**
	 * Prepares the session store.
	 * @return completes when the conductor is ready
	 */
	public Mono<Void> initialize() {
		return this.sessionStore.initialize();
	}

	// ---------------------------
	// Session lifecycle
	// ---------------------------

	/**
	 * Creates a durable session and starts its agent.
	 * @param workingDirectory directory the agent works in
	 * @param agentId id of a configured agent
	 * @return the stored session, including the agent's session id
	 */
	public Mono<ConductorSession> createSession(String workingDirectory, String agentId) {
		return Mono.defer(() -> {
			Assert.hasText(workingDirectory, "Working directory must not be empty");
			AgentConfig agent = agentConfig(agentId);
			return this.sessionStore.create(new CreateSessionParams(null, agent.id(), workingDirectory))
				.flatMap(session -> {
					logger.info("Created session {} for agent {} in {}", session.id(), agent.id(), workingDirectory);
					return startAgent(session, false).then(this.sessionStore.get(session.id()));
				});
		});
	}

	/**
	 * Makes sure a stored session has a running agent. A new agent starts without memory
	 * of the conversation, so the next prompt carries the stored history.
	 * @param sessionId durable session id
	 * @return the session record
	 */
	public Mono<ConductorSession> resumeSession(String sessionId) {
		return requireSession(sessionId).flatMap(session -> {
			if (this.running.containsKey(sessionId)) {
				logger.debug("Session {} is already running", sessionId);
				return Mono.just(session);
			}
			return ensureAgent(sessionId).then(this.sessionStore.get(sessionId));
		});
	}

	/**
	 * Reads a stored session and its history without starting an agent.
	 * @param sessionId durable session id
	 * @return the session data
	 */
	public Mono<SessionData> loadSession(String sessionId) {
		return this.sessionStore.getData(sessionId)
			.switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
	}

	public Mono<List<ConductorSession>> listSessions(ListSessionsOptions options) {
		return this.sessionStore.list(options);
	}

	/**
	 * Stops the agent of a session. The session stays in the store.
	 * @param sessionId durable session id
	 * @return completes once the agent connection is closed
	 */
	public Mono<Void> stopSession(String sessionId) {
		return Mono.defer(() -> {
			SessionAgent agent = this.running.remove(sessionId);
			this.processing.remove(sessionId);
			if (agent == null) {
				return Mono.empty();
			}
			unbind(agent);
			logger.info("Stopping agent {} of session {}", agent.agent().id(), sessionId);
			this.listener.onStatusChange();
			return agent.client().closeGracefully().onErrorResume(error -> {
				logger.warn("Agent of session {} did not close cleanly", sessionId, error);
				return Mono.empty();
			});
		});
	}

	public Mono<Void> stopAllSessions() {
		return Flux.fromIterable(List.copyOf(this.running.keySet())).flatMap(this::stopSession).then();
	}

	/**
	 * Stops the agent of a session and removes the session from the store.
	 * @param sessionId durable session id
	 * @return completes once the session is gone
	 */
	public Mono<Void> deleteSession(String sessionId) {
		return stopSession(sessionId).then(this.sessionStore.delete(sessionId))
			.then(Mono.fromRunnable(() -> this.pendingAnswers.clear(sessionId)));
	}

	public Set<String> getRunningSessionIds() {
		return Set.copyOf(this.running.keySet());
	}

	public Set<String> getProcessingSessionIds() {
		return Set.copyOf(this.processing.keySet());
	}

	public boolean isSessionRunning(String sessionId) {
		return this.running.containsKey(sessionId);
	}

	public Map<String, AgentConfig> getAgents() {
		return this.agents;
	}

	// ---------------------------
	// Prompts
	// ---------------------------

	/**
	 * Sends a user prompt to the agent of a session, starting the agent if needed.
	 * Pending answers and, for a resumed session, the stored history are sent ahead of the
	 * content.
	 * @param sessionId durable session id
	 * @param content the prompt
	 * @return the agent's reason for ending the turn
	 */
	public Mono<AcpSchema.PromptResponse> prompt(String sessionId, List<AcpSchema.ContentBlock> content) {
		return prompt(sessionId, content, PromptOptions.defaults());
	}

	/**
	 * Sends a prompt to the agent of a session, starting the agent if needed. The session
	 * counts as processing from subscription until the turn ends. A failed turn is reported
	 * to the listener as an agent message and then propagated.
	 * @param sessionId durable session id
	 * @param content the prompt
	 * @param options delivery options
	 * @return the agent's reason for ending the turn
	 */
	public Mono<AcpSchema.PromptResponse> prompt(String sessionId, List<AcpSchema.ContentBlock> content,
			PromptOptions options) {
		Assert.notNull(sessionId, "Session id must not be null");
		Assert.notNull(content, "Content must not be null");
		PromptOptions effective = (options != null) ? options : PromptOptions.defaults();
		return Mono.defer(() -> {
			startProcessing(sessionId);
			return ensureAgent(sessionId).flatMap(agent -> deliver(agent, content, effective))
				.doOnError(error -> reportPromptError(sessionId, error))
				.doFinally(signal -> stopProcessing(sessionId));
		});
	}

	@Override
	public Mono<Void> sendPrompt(String sessionId, List<AcpSchema.ContentBlock> content, PromptOptions options) {
		return prompt(sessionId, content, options).then();
	}

	@Override
	public Mono<Void> cancelRequest(String sessionId) {
		return Mono.defer(() -> {
			SessionAgent agent = this.running.get(sessionId);
			if (agent == null) {
				logger.debug("No running agent for session {}, nothing to cancel", sessionId);
				return Mono.empty();
			}
			logger.info("Cancelling request for session {}", sessionId);
			return agent.client().cancel(new AcpSchema.CancelNotification(agent.protocolSessionId()));
		});
	}

	@Override
	public boolean isSessionProcessing(String sessionId) {
		return sessionId != null && this.processing.containsKey(sessionId);
	}

	@Override
	public String resolveSessionId(String protocolSessionId) {
		return this.identities.durableId(protocolSessionId);
	}

	// ---------------------------
	// Answers
	// ---------------------------

	@Override
	public void addPendingAnswer(String sessionId, String question, String answer) {
		this.pendingAnswers.add(sessionId, question, answer);
	}

	public List<PendingAnswer> getPendingAnswers(String sessionId) {
		return this.pendingAnswers.get(sessionId);
	}

	@Override
	public void recordQuestionResponse(String sessionId, String toolCallId, PermissionAnswerData response) {
		Map<String, Object> inner = new LinkedHashMap<>();
		inner.put("sessionUpdate", QUESTION_RESPONSE);
		inner.put("toolCallId", toolCallId);
		inner.put("response", this.jsonMapper.convertValue(response, MAP_TYPE_REF));
		Map<String, Object> update = new LinkedHashMap<>();
		update.put("sessionId", sessionId);
		update.put("update", inner);

		logger.debug("Storing question response for tool call {}", toolCallId);
		this.sessionStore.appendUpdate(sessionId, update)
			.subscribe(stored -> this.listener.onQuestionResponseRecorded(sessionId, toolCallId),
					error -> logger.error("Failed to store question response for session {}", sessionId, error));
	}

	// ---------------------------
	// Inbound routing
	// ---------------------------

	/**
	 * Shows a permission request raised by an agent and waits for the decision.
	 * @param request the agent's request
	 * @return the outcome to send back to the agent
	 */
	public Mono<AcpSchema.RequestPermissionResponse> handlePermissionRequest(
			AcpSchema.RequestPermissionRequest request) {
		return this.permissionCorrelator.request(request);
	}

	/**
	 * Applies a decision made by the user.
	 * @param decision the decision
	 */
	public void handlePermissionResponse(PermissionDecision decision) {
		this.permissionCorrelator.resolve(decision);
	}

	public void handleSessionUpdate(AcpSchema.SessionNotification notification) {
		this.questionToolHangGuard.handleSessionUpdate(notification);
	}

	public Mono<Void> closeGracefully() {
		return stopAllSessions().doFinally(signal -> {
			if (this.ownsScheduler) {
				this.scheduler.dispose();
			}
		});
	}

	// ---------------------------
	// Internals
	// ---------------------------

	private AgentConfig agentConfig(String agentId) {
		AgentConfig agent = (agentId != null) ? this.agents.get(agentId) : null;
		if (agent == null) {
			throw new IllegalArgumentException("Unknown agent: " + agentId);
		}
		if (!agent.enabled()) {
			throw new IllegalArgumentException("Agent is disabled: " + agentId);
		}
		return agent;
	}

	private Mono<ConductorSession> requireSession(String sessionId) {
		return this.sessionStore.get(sessionId).switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
	}

	private Mono<SessionAgent> ensureAgent(String sessionId) {
		return Mono.defer(() -> {
			SessionAgent agent = this.running.get(sessionId);
			if (agent != null) {
				return Mono.just(agent);
			}
			return this.starting.computeIfAbsent(sessionId, id -> requireSession(id)
				.flatMap(session -> startAgent(session, true))
				.doFinally(signal -> this.starting.remove(id))
				.cache());
		});
	}

	private Mono<SessionAgent> startAgent(ConductorSession session, boolean replayHistory) {
		return Mono.defer(() -> {
			AgentConfig agent = agentConfig(session.agentId());
			AcpClientTransport transport = this.transportFactory.create(agent, session.workingDirectory());
			AtomicReference<SessionAgent> started = new AtomicReference<>();

			AcpAsyncClient client = AcpClient.async(transport)
				.requestTimeout(this.requestTimeout)
				.promptTimeout(this.promptTimeout)
				.sessionUpdateConsumer(this::onAgentUpdate)
				.requestPermissionHandler(
						params -> handlePermissionRequest(transport.unmarshalFrom(params, REQUEST_PERMISSION_TYPE_REF)))
				.onClose(() -> onAgentClosed(session.id(), started.get()))
				.build();

			logger.info("Starting agent {} for session {}", agent.id(), session.id());
			return client
				.initialize(new AcpSchema.InitializeRequest(PROTOCOL_VERSION,
						new AcpSchema.ClientCapabilities(new AcpSchema.FileSystemCapability(false, false), false)))
				.then(Mono.defer(() -> client
					.newSession(new AcpSchema.NewSessionRequest(session.workingDirectory(), List.of()))))
				.flatMap(response -> {
					SessionAgent sessionAgent = new SessionAgent(session.id(), agent, client, response.sessionId(),
							replayHistory);
					started.set(sessionAgent);
					this.running.put(session.id(), sessionAgent);
					this.identities.bind(session.id(), response.sessionId());
					logger.info("Agent {} started for session {} with agent session {}", agent.id(), session.id(),
							response.sessionId());
					return this.sessionStore
						.updateMeta(session.id(),
								new SessionMetaUpdate(response.sessionId(), null, SessionStatus.ACTIVE, null))
						.doOnNext(this.listener::onSessionMetaUpdated)
						.thenReturn(sessionAgent);
				})
				.onErrorResume(error -> {
					logger.error("Failed to start agent {} for session {}", agent.id(), session.id(), error);
					return client.closeGracefully()
						.onErrorResume(closeError -> Mono.empty())
						.then(this.sessionStore.updateMeta(session.id(), SessionMetaUpdate.status(SessionStatus.ERROR)))
						.doOnNext(this.listener::onSessionMetaUpdated)
						.then(Mono.<SessionAgent>error(error));
				});
		});
	}

	private void onAgentClosed(String sessionId, SessionAgent agent) {
		if (agent != null && this.running.remove(sessionId, agent)) {
			unbind(agent);
			this.processing.remove(sessionId);
			logger.info("Agent {} of session {} exited", agent.agent().id(), sessionId);
			this.listener.onStatusChange();
		}
	}

	private void unbind(SessionAgent agent) {
		if (agent.protocolSessionId().equals(this.identities.protocolId(agent.sessionId()))) {
			this.identities.unbind(agent.sessionId());
		}
	}

	private Mono<Void> onAgentUpdate(AcpSchema.SessionNotification notification) {
		String sessionId = this.identities.durableId(notification.sessionId());
		if (sessionId == null) {
			logger.debug("Update for unknown agent session {}", notification.sessionId());
			handleSessionUpdate(notification);
			return Mono.empty();
		}
		return this.sessionStore.appendUpdate(sessionId, this.jsonMapper.convertValue(notification, MAP_TYPE_REF))
			.map(stored -> Optional.of(stored.sequenceNumber()))
			.onErrorResume(error -> {
				logger.error("Failed to store update for session {}", sessionId, error);
				return Mono.just(Optional.empty());
			})
			.defaultIfEmpty(Optional.empty())
			.doOnNext(sequenceNumber -> {
				this.listener.onSessionUpdate(notification, sessionId, sequenceNumber.orElse(null));
				handleSessionUpdate(notification);
			})
			.then();
	}

	private Mono<AcpSchema.PromptResponse> deliver(SessionAgent agent, List<AcpSchema.ContentBlock> content,
			PromptOptions options) {
		String sessionId = agent.sessionId();
		return historyPrefix(agent).map(Optional::of).defaultIfEmpty(Optional.empty()).flatMap(history -> {
			List<AcpSchema.ContentBlock> prompt = new ArrayList<>();
			List<PendingAnswer> answers = this.pendingAnswers.consume(sessionId);
			if (!answers.isEmpty()) {
				logger.info("Injecting {} pending answer(s) for session {}", answers.size(), sessionId);
				prompt.add(new AcpSchema.TextContent(answerContext(answers)));
			}
			history.ifPresent(text -> prompt.add(new AcpSchema.TextContent(text)));
			prompt.addAll(content);

			Map<String, Object> inner = new LinkedHashMap<>();
			inner.put("sessionUpdate", USER_MESSAGE);
			inner.put("content", this.jsonMapper.convertValue(content, LIST_TYPE_REF));
			inner.put("_internal", options.internal());
			Map<String, Object> userMessage = new LinkedHashMap<>();
			userMessage.put("sessionId", agent.protocolSessionId());
			userMessage.put("update", inner);

			logger.info("Sending prompt to session {} (agent session {})", sessionId, agent.protocolSessionId());
			return this.sessionStore.appendUpdate(sessionId, userMessage)
				.then(Mono.defer(() -> agent.client()
					.prompt(new AcpSchema.PromptRequest(agent.protocolSessionId(), prompt))))
				.doOnNext(response -> logger.info("Prompt for session {} completed with stop reason {}", sessionId,
						response.stopReason()));
		});
	}

	private Mono<String> historyPrefix(SessionAgent agent) {
		if (!agent.needsHistoryReplay()) {
			return Mono.empty();
		}
		return this.sessionStore.getData(agent.sessionId())
			.filter(data -> HistoryReplay.hasReplayableHistory(data.updates()))
			.mapNotNull(data -> {
				logger.info("Prepending conversation history ({} updates) for session {}", data.updates().size(),
						agent.sessionId());
				return HistoryReplay.format(data.updates());
			})
			.onErrorResume(error -> {
				logger.error("Failed to load history of session {} for replay", agent.sessionId(), error);
				return Mono.empty();
			})
			.doFinally(signal -> agent.historyReplayed());
	}

	static String answerContext(List<PendingAnswer> answers) {
		return "---\n" + answers.stream()
			.map(answer -> "[User's answer to \"" + answer.question() + "\"]: " + answer.answer())
			.collect(Collectors.joining("\n")) + "\n---\n";
	}

	private void reportPromptError(String sessionId, Throwable error) {
		logger.error("Prompt failed for session {}", sessionId, error);
		String protocolSessionId = this.identities.protocolId(sessionId);
		AcpSchema.SessionNotification notification = new AcpSchema.SessionNotification(
				(protocolSessionId != null) ? protocolSessionId : sessionId, new AcpSchema.AgentMessageChunk(
						new AcpSchema.TextContent("\n\n**Error:** " + AgentErrorMessages.describe(error) + "\n")));
		this.listener.onSessionUpdate(notification, sessionId, null);
	}

	private void startProcessing(String sessionId) {
		this.processing.merge(sessionId, 1, Integer::sum);
		this.listener.onStatusChange();
	}

	private void stopProcessing(String sessionId) {
		this.processing.computeIfPresent(sessionId, (id, count) -> (count > 1) ? count - 1 : null);
		this.listener.onStatusChange();
	}

	private void autoApprove(PermissionRequestView request) {
		if (request.options().isEmpty()) {
			logger.warn("Permission request {} has no options to approve", request.requestId());
			return;
		}
		String optionId = request.options().get(0).optionId();
		logger.info("No permission presenter configured, approving {} with option {}", request.requestId(),
				optionId);
		this.permissionCorrelator.resolve(new PermissionDecision(request.requestId(), optionId));
	}

	public static class Builder {

		private final AgentTransportFactory transportFactory;

		private SessionStore sessionStore;

		private final Map<String, AgentConfig> agents = DefaultAgents.all();

		private PermissionPresenter permissionPresenter;

		private ConductorListener listener = new ConductorListener() {
		};

		private PermissionTimings timings = PermissionTimings.defaults();

		private Scheduler scheduler;

		private McpJsonMapper jsonMapper = McpJsonMapper.getDefault();

		private Duration requestTimeout = Duration.ofSeconds(30);

		private Duration promptTimeout = Duration.ofMinutes(30);

		private Builder(AgentTransportFactory transportFactory) {
			Assert.notNull(transportFactory, "Transport factory must not be null");
			this.transportFactory = transportFactory;
		}

		public Builder sessionStore(SessionStore sessionStore) {
			Assert.notNull(sessionStore, "Session store must not be null");
			this.sessionStore = sessionStore;
			return this;
		}

		/**
		 * Adds an agent, replacing a built-in one with the same id.
		 * @param agent the agent configuration
		 * @return this builder
		 */
		public Builder agent(AgentConfig agent) {
			Assert.notNull(agent, "Agent must not be null");
			this.agents.put(agent.id(), agent);
			return this;
		}

		/**
		 * Replaces all agents, built-in ones included.
		 * @param agents the agent configurations
		 * @return this builder
		 */
		public Builder agents(List<AgentConfig> agents) {
			Assert.notNull(agents, "Agents must not be null");
			this.agents.clear();
			agents.forEach(this::agent);
			return this;
		}

		/**
		 * Sets the presenter for permission requests. Without one every request is approved
		 * with its first option.
		 * @param permissionPresenter the presenter
		 * @return this builder
		 */
		public Builder permissionPresenter(PermissionPresenter permissionPresenter) {
			this.permissionPresenter = permissionPresenter;
			return this;
		}

		public Builder listener(ConductorListener listener) {
			Assert.notNull(listener, "Listener must not be null");
			this.listener = listener;
			return this;
		}

		public Builder timings(PermissionTimings timings) {
			Assert.notNull(timings, "Timings must not be null");
			this.timings = timings;
			return this;
		}

		/**
		 * Sets the scheduler for all delays and timeouts of the permission components. By
		 * default the conductor creates and owns a single daemon thread.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "Scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder promptTimeout(Duration promptTimeout) {
			Assert.notNull(promptTimeout, "Prompt timeout must not be null");
			this.promptTimeout = promptTimeout;
			return this;
		}

		public Conductor build() {
			return new Conductor(this);
		}

	}

}
