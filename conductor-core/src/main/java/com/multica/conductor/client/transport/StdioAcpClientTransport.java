/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.client.transport;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Function;

import com.multica.conductor.spec.AcpClientTransport;
import com.multica.conductor.spec.AcpSchema;
import com.multica.conductor.spec.AcpSchema.JSONRPCMessage;
import com.multica.conductor.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Runs an agent as a child process and exchanges newline-delimited JSON-RPC messages over
 * its standard input and output. Standard error is logged.
 *
 * <p>
 * The {@link Mono} returned by {@link #connect(Function)} completes when the agent closes
 * its standard output, which is how callers learn that the agent exited.
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
public class StdioAcpClientTransport implements AcpClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioAcpClientTransport.class);

	private static final Duration EMIT_BUSY_LOOP = Duration.ofMillis(100);

	private final Sinks.Many<JSONRPCMessage> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.Many<JSONRPCMessage> outboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final AgentParameters params;

	private final McpJsonMapper jsonMapper;

	private final Scheduler inboundScheduler;

	private final Scheduler outboundScheduler;

	private final Scheduler errorScheduler;

	private volatile Process process;

	private volatile boolean isClosing = false;

	private Consumer<Throwable> exceptionHandler = error -> {
	};

	public StdioAcpClientTransport(AgentParameters params, McpJsonMapper jsonMapper) {
		Assert.notNull(params, "The params can not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.params = params;
		this.jsonMapper = jsonMapper;
		this.inboundScheduler = daemonScheduler("acp-stdio-inbound");
		this.outboundScheduler = daemonScheduler("acp-stdio-outbound");
		this.errorScheduler = daemonScheduler("acp-stdio-stderr");
	}

	private static Scheduler daemonScheduler(String name) {
		return Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, name);
			thread.setDaemon(true);
			return thread;
		}), name);
	}

	@Override
	public Mono<Void> connect(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler) {
		return Mono.fromRunnable(this::startProcess)
			.then(this.inboundSink.asFlux()
				.flatMap(message -> Mono.just(message).transform(handler))
				.doOnError(this.exceptionHandler)
				.then());
	}

	private void startProcess() {
		ProcessBuilder processBuilder = new ProcessBuilder(this.params.getCommandLine());
		processBuilder.environment().putAll(this.params.getEnv());
		if (this.params.getWorkingDirectory() != null) {
			processBuilder.directory(new File(this.params.getWorkingDirectory()));
		}

		try {
			this.process = processBuilder.start();
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to start agent process: " + this.params.getCommandLine(), e);
		}
		logger.info("Started agent process {} (pid {})", this.params.getCommand(), this.process.pid());

		startInboundProcessing(this.process.getInputStream());
		startOutboundProcessing(this.process.getOutputStream());
		startErrorProcessing(this.process.getErrorStream());
	}

	private void startInboundProcessing(InputStream stdout) {
		this.inboundScheduler.schedule(() -> {
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
				String line;
				while (!this.isClosing && (line = reader.readLine()) != null) {
					if (line.isBlank()) {
						continue;
					}
					try {
						JSONRPCMessage message = AcpSchema.deserializeJsonRpcMessage(this.jsonMapper, line);
						this.inboundSink.emitNext(message, Sinks.EmitFailureHandler.busyLooping(EMIT_BUSY_LOOP));
					}
					catch (IOException | IllegalArgumentException e) {
						logger.warn("Ignoring non JSON-RPC output from agent: {}", line);
					}
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading agent output", e);
					this.exceptionHandler.accept(e);
				}
			}
			finally {
				logger.info("Agent process {} closed its output", this.params.getCommand());
				this.inboundSink.tryEmitComplete();
			}
		});
	}

	private void startOutboundProcessing(OutputStream stdin) {
		this.outboundSink.asFlux().publishOn(this.outboundScheduler).subscribe(message -> {
			try {
				String json = this.jsonMapper.writeValueAsString(message);
				logger.debug("Sending JSON message: {}", json);
				stdin.write((json + "\n").getBytes(StandardCharsets.UTF_8));
				stdin.flush();
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error writing message to agent", e);
					this.exceptionHandler.accept(e);
				}
			}
		}, error -> logger.error("Outbound processing failed", error));
	}

	private void startErrorProcessing(InputStream stderr) {
		this.errorScheduler.schedule(() -> {
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
				String line;
				while (!this.isClosing && (line = reader.readLine()) != null) {
					logger.debug("[{} stderr] {}", this.params.getCommand(), line);
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.warn("Error reading agent stderr", e);
				}
			}
		});
	}

	@Override
	public Mono<Void> sendMessage(JSONRPCMessage message) {
		return Mono.fromRunnable(() -> {
			if (this.isClosing) {
				throw new IllegalStateException("Transport is closing");
			}
			this.outboundSink.emitNext(message, Sinks.EmitFailureHandler.busyLooping(EMIT_BUSY_LOOP));
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			this.isClosing = true;
			this.outboundSink.tryEmitComplete();
			Process current = this.process;
			if (current == null) {
				this.inboundSink.tryEmitComplete();
				return disposeSchedulers();
			}
			logger.debug("Terminating agent process {}", this.params.getCommand());
			current.destroy();
			return Mono.fromFuture(current.onExit())
				.doOnNext(exited -> logger.info("Agent process {} exited with code {}", this.params.getCommand(),
						exited.exitValue()))
				.then(disposeSchedulers());
		});
	}

	private Mono<Void> disposeSchedulers() {
		return Mono.fromRunnable(() -> {
			this.inboundScheduler.dispose();
			this.outboundScheduler.dispose();
			this.errorScheduler.dispose();
		});
	}

	@Override
	public void setExceptionHandler(Consumer<Throwable> handler) {
		Assert.notNull(handler, "The exception handler can not be null");
		this.exceptionHandler = handler;
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeRef<T> typeRef) {
		return this.jsonMapper.convertValue(data, typeRef);
	}

}
