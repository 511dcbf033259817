/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.error;

/**
 * JSON-RPC 2.0 and ACP error codes.
 *
 * <p>
 * Codes in the range -32768 to -32000 are reserved by JSON-RPC. ACP uses the -32000 to
 * -32099 server error range for protocol specific conditions.
 *
 * @author Mark Pollack
 */
public final class AcpErrorCodes {

	private AcpErrorCodes() {
	}

	public static final int PARSE_ERROR = -32700;

	public static final int INVALID_REQUEST = -32600;

	public static final int METHOD_NOT_FOUND = -32601;

	public static final int INVALID_PARAMS = -32602;

	public static final int INTERNAL_ERROR = -32603;

	public static final int CONCURRENT_PROMPT = -32000;

	public static final int CAPABILITY_NOT_SUPPORTED = -32001;

	public static final int SESSION_NOT_FOUND = -32002;

	public static final int NOT_INITIALIZED = -32003;

	public static final int AUTHENTICATION_REQUIRED = -32004;

	public static final int PERMISSION_DENIED = -32005;

	/**
	 * Returns a short human readable description of an error code.
	 * @param code the error code
	 * @return the description, or {@code "Unknown error"} for unrecognized codes
	 */
	public static String getDescription(int code) {
		return switch (code) {
			case PARSE_ERROR -> "Parse error";
			case INVALID_REQUEST -> "Invalid request";
			case METHOD_NOT_FOUND -> "Method not found";
			case INVALID_PARAMS -> "Invalid params";
			case INTERNAL_ERROR -> "Internal error";
			case CONCURRENT_PROMPT -> "Concurrent prompt";
			case CAPABILITY_NOT_SUPPORTED -> "Capability not supported";
			case SESSION_NOT_FOUND -> "Session not found";
			case NOT_INITIALIZED -> "Not initialized";
			case AUTHENTICATION_REQUIRED -> "Authentication required";
			case PERMISSION_DENIED -> "Permission denied";
			default -> "Unknown error";
		};
	}

}
