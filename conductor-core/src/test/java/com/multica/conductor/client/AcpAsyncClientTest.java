/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.multica.conductor.MockAcpClientTransport;
import com.multica.conductor.error.AcpErrorCodes;
import com.multica.conductor.error.AcpException;
import com.multica.conductor.error.AcpProtocolException;
import com.multica.conductor.spec.AcpSchema;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test suite for {@link AcpAsyncClient} verifying the high-level client API methods.
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
class AcpAsyncClientTest {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final AcpSchema.InitializeResponse MOCK_INIT_RESPONSE = new AcpSchema.InitializeResponse(1,
			new AcpSchema.AgentCapabilities(), List.of());

	private static Object toMap(Object value) {
		return McpJsonMapper.getDefault().convertValue(value, new TypeRef<Map<String, Object>>() {
		});
	}

	private static void respond(MockAcpClientTransport transport, AcpSchema.JSONRPCRequest request, Object result) {
		transport.simulateIncomingMessage(
				new AcpSchema.JSONRPCResponse(AcpSchema.JSONRPC_VERSION, request.id(), toMap(result), null));
	}

	private static MockAcpClientTransport agentAnswering(String method, Object result) {
		return new MockAcpClientTransport((transport, message) -> {
			if (message instanceof AcpSchema.JSONRPCRequest request && method.equals(request.method())) {
				respond(transport, request, result);
			}
		});
	}

	@Test
	void testConstructorWithNullSession() {
		assertThatThrownBy(() -> new AcpAsyncClient(null, TIMEOUT)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Session must not be null");
	}

	@Test
	void testBuilderWithNullTransport() {
		assertThatThrownBy(() -> AcpClient.async(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Transport must not be null");
	}

	@Test
	void testBuilderWithNullTimeout() {
		var transport = new MockAcpClientTransport();
		assertThatThrownBy(() -> AcpClient.async(transport).requestTimeout(null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Request timeout must not be null");
		assertThatThrownBy(() -> AcpClient.async(transport).promptTimeout(null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Prompt timeout must not be null");
	}

	@Test
	void testInitialize() {
		var transport = agentAnswering(AcpSchema.METHOD_INITIALIZE, MOCK_INIT_RESPONSE);
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		AcpSchema.InitializeRequest request = new AcpSchema.InitializeRequest(1,
				new AcpSchema.ClientCapabilities(new AcpSchema.FileSystemCapability(false, false), false));

		StepVerifier.create(client.initialize(request)).consumeNextWith(response -> {
			assertThat(response.protocolVersion()).isEqualTo(1);
			assertThat(response.agentCapabilities()).isNotNull();
		}).verifyComplete();

		assertThat(client.getInitializeResponse()).isNotNull();
		AcpSchema.JSONRPCRequest sent = transport.getLastSentMessageAsRequest();
		assertThat(sent.method()).isEqualTo(AcpSchema.METHOD_INITIALIZE);
		assertThat(sent.params()).isEqualTo(request);

		client.close();
	}

	@Test
	void testInitializeWithNullRequest() {
		var transport = new MockAcpClientTransport();
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		assertThatThrownBy(() -> client.initialize(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Initialize request must not be null");

		client.close();
	}

	@Test
	void testNewSession() {
		var transport = agentAnswering(AcpSchema.METHOD_SESSION_NEW,
				new AcpSchema.NewSessionResponse("agent-session-1", null, null));
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		StepVerifier.create(client.newSession(new AcpSchema.NewSessionRequest("/workspace", List.of())))
			.consumeNextWith(response -> assertThat(response.sessionId()).isEqualTo("agent-session-1"))
			.verifyComplete();

		client.close();
	}

	@Test
	void testNewSessionWithNullRequest() {
		var transport = new MockAcpClientTransport();
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		assertThatThrownBy(() -> client.newSession(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("New session request must not be null");

		client.close();
	}

	@Test
	void testPrompt() {
		var transport = agentAnswering(AcpSchema.METHOD_SESSION_PROMPT,
				new AcpSchema.PromptResponse(AcpSchema.StopReason.END_TURN));
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		AcpSchema.PromptRequest request = new AcpSchema.PromptRequest("agent-session-1",
				List.of(new AcpSchema.TextContent("Fix the failing test")));

		StepVerifier.create(client.prompt(request))
			.consumeNextWith(response -> assertThat(response.stopReason()).isEqualTo(AcpSchema.StopReason.END_TURN))
			.verifyComplete();

		client.close();
	}

	@Test
	void testPromptWithNullRequest() {
		var transport = new MockAcpClientTransport();
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		assertThatThrownBy(() -> client.prompt(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Prompt request must not be null");

		client.close();
	}

	@Test
	void testPromptUsesPromptTimeout() {
		var transport = new MockAcpClientTransport();
		AcpAsyncClient client = AcpClient.async(transport)
			.requestTimeout(Duration.ofMillis(50))
			.promptTimeout(Duration.ofMillis(300))
			.build();

		long start = System.nanoTime();
		StepVerifier
			.create(client.prompt(new AcpSchema.PromptRequest("s", List.of(new AcpSchema.TextContent("hi")))))
			.expectError(TimeoutException.class)
			.verify(TIMEOUT);
		assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(300));

		client.close();
	}

	@Test
	void testErrorResponseBecomesProtocolException() {
		var transport = new MockAcpClientTransport((t, message) -> {
			if (message instanceof AcpSchema.JSONRPCRequest request) {
				t.simulateIncomingMessage(new AcpSchema.JSONRPCResponse(AcpSchema.JSONRPC_VERSION, request.id(), null,
						new AcpSchema.JSONRPCError(AcpErrorCodes.AUTHENTICATION_REQUIRED, "Please log in", null)));
			}
		});
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		StepVerifier.create(client.newSession(new AcpSchema.NewSessionRequest("/workspace", List.of())))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(AcpProtocolException.class);
				assertThat(((AcpProtocolException) error).isAuthenticationRequired()).isTrue();
				assertThat(((AcpProtocolException) error).getRawMessage()).isEqualTo("Please log in");
			})
			.verify(TIMEOUT);

		client.close();
	}

	@Test
	void testCancel() {
		var transport = new MockAcpClientTransport();
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).build();

		StepVerifier.create(client.cancel(new AcpSchema.CancelNotification("agent-session-1"))).verifyComplete();

		AcpSchema.JSONRPCNotification sent = transport.getLastSentMessageAsNotification();
		assertThat(sent.method()).isEqualTo(AcpSchema.METHOD_SESSION_CANCEL);
		assertThat(sent.params()).isEqualTo(new AcpSchema.CancelNotification("agent-session-1"));

		assertThatThrownBy(() -> client.cancel(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Cancel notification must not be null");

		client.close();
	}

	@Test
	void testSessionUpdateConsumer() {
		var transport = new MockAcpClientTransport();
		AtomicReference<AcpSchema.SessionNotification> received = new AtomicReference<>();
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).sessionUpdateConsumer(update -> {
			received.set(update);
			return Mono.empty();
		}).build();

		transport.simulateIncomingMessage(new AcpSchema.JSONRPCNotification(AcpSchema.JSONRPC_VERSION,
				AcpSchema.METHOD_SESSION_UPDATE, toMap(new AcpSchema.SessionNotification("agent-session-1",
						new AcpSchema.AgentMessageChunk(new AcpSchema.TextContent("Working on it"))))));

		assertThat(received.get()).isNotNull();
		assertThat(received.get().sessionId()).isEqualTo("agent-session-1");
		assertThat(received.get().update()).isInstanceOfSatisfying(AcpSchema.AgentMessageChunk.class,
				chunk -> assertThat(((AcpSchema.TextContent) chunk.content()).text()).isEqualTo("Working on it"));

		client.close();
	}

	@Test
	void testRequestPermissionHandler() {
		var transport = new MockAcpClientTransport();
		AtomicReference<Object> receivedParams = new AtomicReference<>();
		AcpAsyncClient client = AcpClient.async(transport).requestTimeout(TIMEOUT).requestPermissionHandler(params -> {
			receivedParams.set(params);
			return Mono.just(new AcpSchema.RequestPermissionResponse(new AcpSchema.PermissionSelected("allow")));
		}).build();

		AcpSchema.RequestPermissionRequest request = new AcpSchema.RequestPermissionRequest("agent-session-1",
				new AcpSchema.ToolCallUpdate("call-1", "Edit file", AcpSchema.ToolKind.EDIT,
						AcpSchema.ToolCallStatus.PENDING, null, null, null, null),
				List.of(new AcpSchema.PermissionOption("allow", "Allow", "allow_once")));
		transport.simulateIncomingMessage(new AcpSchema.JSONRPCRequest(AcpSchema.JSONRPC_VERSION, "perm-1",
				AcpSchema.METHOD_SESSION_REQUEST_PERMISSION, toMap(request)));

		assertThat(receivedParams.get()).isNotNull();
		AcpSchema.JSONRPCResponse response = (AcpSchema.JSONRPCResponse) transport.getLastSentMessage();
		assertThat(response.id()).isEqualTo("perm-1");
		assertThat(response.error()).isNull();
		assertThat(response.result()).isEqualTo(
				new AcpSchema.RequestPermissionResponse(new AcpSchema.PermissionSelected("selected", "allow", null)));

		client.close();
	}

	@Test
	void testOnCloseRunsWhenAgentExits() {
		var transport = new MockAcpClientTransport();
		AtomicInteger closed = new AtomicInteger();
		AcpAsyncClient client = AcpClient.async(transport)
			.requestTimeout(TIMEOUT)
			.onClose(closed::incrementAndGet)
			.build();

		Mono<AcpSchema.PromptResponse> pending = client
			.prompt(new AcpSchema.PromptRequest("s", List.of(new AcpSchema.TextContent("hi"))));

		StepVerifier.create(pending)
			.then(transport::simulateExit)
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(AcpException.class)
				.hasMessage("Agent connection closed before a response was received"))
			.verify(TIMEOUT);
		assertThat(closed).hasValue(1);

		client.close();
	}

}
