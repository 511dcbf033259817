/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.client;

import java.time.Duration;

import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.spec.AcpSession;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Non-blocking ACP client for one agent connection.
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
public class AcpAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(AcpAsyncClient.class);

	private static final TypeRef<AcpSchema.InitializeResponse> INITIALIZE_RESPONSE_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.NewSessionResponse> NEW_SESSION_RESPONSE_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.PromptResponse> PROMPT_RESPONSE_TYPE_REF = new TypeRef<>() {
	};

	private final AcpSession session;

	private final Duration promptTimeout;

	private volatile AcpSchema.InitializeResponse initializeResponse;

	AcpAsyncClient(AcpSession session, Duration promptTimeout) {
		Assert.notNull(session, "Session must not be null");
		Assert.notNull(promptTimeout, "Prompt timeout must not be null");
		this.session = session;
		this.promptTimeout = promptTimeout;
	}

	/**
	 * Performs the protocol handshake.
	 * @param initializeRequest the client's protocol version and capabilities
	 * @return the agent's protocol version and capabilities
	 */
	public Mono<AcpSchema.InitializeResponse> initialize(AcpSchema.InitializeRequest initializeRequest) {
		Assert.notNull(initializeRequest, "Initialize request must not be null");
		return this.session
			.sendRequest(AcpSchema.METHOD_INITIALIZE, initializeRequest, INITIALIZE_RESPONSE_TYPE_REF)
			.doOnNext(response -> {
				this.initializeResponse = response;
				logger.debug("Agent initialized with protocol version {}", response.protocolVersion());
			});
	}

	/**
	 * Creates a new agent session.
	 * @param newSessionRequest the working directory and MCP servers for the session
	 * @return the agent-assigned session
	 */
	public Mono<AcpSchema.NewSessionResponse> newSession(AcpSchema.NewSessionRequest newSessionRequest) {
		Assert.notNull(newSessionRequest, "New session request must not be null");
		return this.session.sendRequest(AcpSchema.METHOD_SESSION_NEW, newSessionRequest,
				NEW_SESSION_RESPONSE_TYPE_REF);
	}

	/**
	 * Runs one prompt turn. The returned {@link Mono} completes when the agent ends the
	 * turn, including when the turn was cancelled.
	 * @param promptRequest the session id and prompt content
	 * @return the reason the turn stopped
	 */
	public Mono<AcpSchema.PromptResponse> prompt(AcpSchema.PromptRequest promptRequest) {
		Assert.notNull(promptRequest, "Prompt request must not be null");
		return this.session.sendRequest(AcpSchema.METHOD_SESSION_PROMPT, promptRequest, PROMPT_RESPONSE_TYPE_REF,
				this.promptTimeout);
	}

	/**
	 * Asks the agent to cancel the running turn of a session.
	 * @param cancelNotification the session to cancel
	 * @return a {@link Mono} completing once the notification is written
	 */
	public Mono<Void> cancel(AcpSchema.CancelNotification cancelNotification) {
		Assert.notNull(cancelNotification, "Cancel notification must not be null");
		return this.session.sendNotification(AcpSchema.METHOD_SESSION_CANCEL, cancelNotification);
	}

	/**
	 * The agent's answer to {@link #initialize}, or null before the handshake completed.
	 * @return the initialize response
	 */
	public AcpSchema.InitializeResponse getInitializeResponse() {
		return this.initializeResponse;
	}

	public Mono<Void> closeGracefully() {
		return this.session.closeGracefully();
	}

	public void close() {
		this.session.close();
	}

}
