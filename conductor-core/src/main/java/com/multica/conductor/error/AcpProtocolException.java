/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.error;

import com.multica.conductor.spec.AcpSchema;

/**
 * Exception carrying a JSON-RPC error, either received from an agent or raised locally to
 * be sent back as an error response.
 *
 * @author Mark Pollack
 */
public class AcpProtocolException extends AcpException {

	private final int code;

	private final String rawMessage;

	private final Object data;

	public AcpProtocolException(AcpSchema.JSONRPCError error) {
		this(error.code(), error.message(), error.data());
	}

	public AcpProtocolException(int code, String message) {
		this(code, message, null);
	}

	public AcpProtocolException(int code, String message, Object data) {
		super("ACP error " + code + ": " + message);
		this.code = code;
		this.rawMessage = message;
		this.data = data;
	}

	public int getCode() {
		return this.code;
	}

	public Object getData() {
		return this.data;
	}

	/**
	 * The error message as sent on the wire, without the code prefix.
	 * @return the raw error message
	 */
	public String getRawMessage() {
		return this.rawMessage;
	}

	public AcpSchema.JSONRPCError toJsonRpcError() {
		return new AcpSchema.JSONRPCError(this.code, this.rawMessage, this.data);
	}

	public boolean isMethodNotFound() {
		return this.code == AcpErrorCodes.METHOD_NOT_FOUND;
	}

	public boolean isSessionNotFound() {
		return this.code == AcpErrorCodes.SESSION_NOT_FOUND;
	}

	public boolean isAuthenticationRequired() {
		return this.code == AcpErrorCodes.AUTHENTICATION_REQUIRED;
	}

	public boolean isInternalError() {
		return this.code == AcpErrorCodes.INTERNAL_ERROR;
	}

}
