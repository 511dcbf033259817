/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.time.Duration;

import com.multica.conductor.util.Assert;

/**
 * Fixed waiting windows used by the permission components.
 *
 * @param permissionTimeout how long a permission request waits for a decision before the
 * default option is chosen
 * @param cancelSettleDelay pause between cancelling a turn and sending the follow-up prompt
 * @param processingPollInterval how often the answer recovery checks whether a cancelled turn
 * has finished
 * @param processingMaxWait upper bound on that check
 * @param handledToolCallRetention how long a broken question tool call stays marked as handled
 */
public record PermissionTimings(Duration permissionTimeout, Duration cancelSettleDelay,
		Duration processingPollInterval, Duration processingMaxWait, Duration handledToolCallRetention) {

	public PermissionTimings {
		Assert.notNull(permissionTimeout, "Permission timeout must not be null");
		Assert.notNull(cancelSettleDelay, "Cancel settle delay must not be null");
		Assert.notNull(processingPollInterval, "Processing poll interval must not be null");
		Assert.notNull(processingMaxWait, "Processing max wait must not be null");
		Assert.notNull(handledToolCallRetention, "Handled tool call retention must not be null");
	}

	public static PermissionTimings defaults() {
		return new PermissionTimings(Duration.ofMinutes(5), Duration.ofMillis(200), Duration.ofMillis(100),
				Duration.ofSeconds(2), Duration.ofSeconds(60));
	}

	public PermissionTimings withPermissionTimeout(Duration permissionTimeout) {
		return new PermissionTimings(permissionTimeout, this.cancelSettleDelay, this.processingPollInterval,
				this.processingMaxWait, this.handledToolCallRetention);
	}

}
