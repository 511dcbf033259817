/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.error;

/**
 * Base class for all unchecked exceptions raised by the conductor and its ACP client.
 *
 * @author Mark Pollack
 */
public class AcpException extends RuntimeException {

	public AcpException(String message) {
		super(message);
	}

	public AcpException(String message, Throwable cause) {
		super(message, cause);
	}

}
