/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.spec;

import java.util.function.Consumer;
import java.util.function.Function;

import reactor.core.publisher.Mono;

/**
 * Client side of an {@link AcpTransport}: the conductor end of the channel to an agent.
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
public interface AcpClientTransport extends AcpTransport {

	/**
	 * Connects to the agent and registers the handler for inbound messages.
	 * @param handler a transformer applied to every inbound message
	 * @return a {@link Mono} that completes when the inbound stream ends, for example
	 * because the agent process exited
	 */
	Mono<Void> connect(Function<Mono<AcpSchema.JSONRPCMessage>, Mono<AcpSchema.JSONRPCMessage>> handler);

	/**
	 * Sets the exception handler for exceptions raised on the transport layer.
	 * @param handler allows reacting to transport level exceptions by the higher layers
	 */
	default void setExceptionHandler(Consumer<Throwable> handler) {
	}

}
