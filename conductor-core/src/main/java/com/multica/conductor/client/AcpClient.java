/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.multica.conductor.spec.AcpClientSession;
import com.multica.conductor.spec.AcpClientTransport;
import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.spec.AcpSession;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Factory for the ACP client the conductor uses to drive one agent subprocess.
 *
 * <p>
 * Example:
 *
 * <pre>{@code
 * AgentParameters params = AgentParameters.builder("opencode").arg("acp").build();
 * StdioAcpClientTransport transport = new StdioAcpClientTransport(params, McpJsonMapper.getDefault());
 *
 * AcpAsyncClient client = AcpClient.async(transport)
 *     .requestTimeout(Duration.ofSeconds(30))
 *     .sessionUpdateConsumer(notification -> {
 *         logger.info("Session update: {}", notification);
 *         return Mono.empty();
 *     })
 *     .requestPermissionHandler(params -> correlator.request(...))
 *     .onClose(() -> logger.info("agent exited"))
 *     .build();
 *
 * client.initialize(new AcpSchema.InitializeRequest(1, new AcpSchema.ClientCapabilities()))
 *     .then(client.newSession(new AcpSchema.NewSessionRequest("/workspace", List.of())))
 *     .flatMap(session -> client.prompt(new AcpSchema.PromptRequest(session.sessionId(),
 *         List.of(new AcpSchema.TextContent("Fix the failing test")))))
 *     .block();
 * }</pre>
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 * @see AcpAsyncClient
 * @see AcpClientTransport
 */
public interface AcpClient {

	Logger logger = LoggerFactory.getLogger(AcpClient.class);

	/**
	 * Start building an asynchronous ACP client with the specified transport layer.
	 * @param transport the transport layer implementation for ACP communication
	 * @return a new builder instance for configuring the client
	 * @throws IllegalArgumentException if transport is null
	 */
	static AsyncSpec async(AcpClientTransport transport) {
		return new AsyncSpec(transport);
	}

	/**
	 * Asynchronous client specification.
	 */
	class AsyncSpec {

		private final AcpClientTransport transport;

		private Duration requestTimeout = Duration.ofSeconds(30);

		private Duration promptTimeout = Duration.ofMinutes(30);

		private final Map<String, AcpClientSession.RequestHandler<?>> requestHandlers = new HashMap<>();

		private final Map<String, AcpClientSession.NotificationHandler> notificationHandlers = new HashMap<>();

		private final List<Function<AcpSchema.SessionNotification, Mono<Void>>> sessionUpdateConsumers = new ArrayList<>();

		private final List<Runnable> closeHandlers = new ArrayList<>();

		private AsyncSpec(AcpClientTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * Sets how long to wait for agent responses to short requests such as
		 * {@code initialize} and {@code session/new}.
		 * @param requestTimeout the timeout, must not be null
		 * @return this builder
		 */
		public AsyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * Sets how long a single prompt turn may run. A turn includes tool calls and any
		 * permission waits, so this is much longer than the request timeout.
		 * @param promptTimeout the timeout, must not be null
		 * @return this builder
		 */
		public AsyncSpec promptTimeout(Duration promptTimeout) {
			Assert.notNull(promptTimeout, "Prompt timeout must not be null");
			this.promptTimeout = promptTimeout;
			return this;
		}

		/**
		 * Registers the handler answering {@code session/request_permission} requests from
		 * the agent. The handler receives the raw request parameters.
		 * @param handler the handler
		 * @return this builder
		 */
		public AsyncSpec requestPermissionHandler(
				AcpClientSession.RequestHandler<AcpSchema.RequestPermissionResponse> handler) {
			Assert.notNull(handler, "Request permission handler must not be null");
			this.requestHandlers.put(AcpSchema.METHOD_SESSION_REQUEST_PERMISSION, handler);
			return this;
		}

		/**
		 * Adds a consumer for {@code session/update} notifications.
		 * @param sessionUpdateConsumer the consumer
		 * @return this builder
		 */
		public AsyncSpec sessionUpdateConsumer(
				Function<AcpSchema.SessionNotification, Mono<Void>> sessionUpdateConsumer) {
			Assert.notNull(sessionUpdateConsumer, "Session update consumer must not be null");
			this.sessionUpdateConsumers.add(sessionUpdateConsumer);
			return this;
		}

		/**
		 * Adds a callback run once the agent connection ends, whether because the agent
		 * exited or the client was closed.
		 * @param closeHandler the callback
		 * @return this builder
		 */
		public AsyncSpec onClose(Runnable closeHandler) {
			Assert.notNull(closeHandler, "Close handler must not be null");
			this.closeHandlers.add(closeHandler);
			return this;
		}

		public AsyncSpec requestHandler(String method, AcpClientSession.RequestHandler<?> handler) {
			Assert.notNull(method, "Method must not be null");
			Assert.notNull(handler, "Handler must not be null");
			this.requestHandlers.put(method, handler);
			return this;
		}

		public AcpAsyncClient build() {
			if (!this.sessionUpdateConsumers.isEmpty()) {
				List<Function<AcpSchema.SessionNotification, Mono<Void>>> consumers = List
					.copyOf(this.sessionUpdateConsumers);
				this.notificationHandlers.put(AcpSchema.METHOD_SESSION_UPDATE, params -> {
					AcpSchema.SessionNotification notification = this.transport.unmarshalFrom(params,
							new TypeRef<AcpSchema.SessionNotification>() {
							});
					logger.debug("Received session update for session: {}", notification.sessionId());
					return Mono.when(consumers.stream().map(consumer -> consumer.apply(notification)).toList());
				});
			}

			List<Runnable> onClose = List.copyOf(this.closeHandlers);
			AcpSession session = new AcpClientSession(this.requestTimeout, this.transport, this.requestHandlers,
					this.notificationHandlers, connection -> connection.doFinally(signal -> onClose.forEach(Runnable::run)));

			return new AcpAsyncClient(session, this.promptTimeout);
		}

	}

}
