/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

/**
 * Shows permission requests to a user. The user's choice comes back later through
 * {@link PermissionCorrelator#resolve(PermissionDecision)}.
 */
@FunctionalInterface
public interface PermissionPresenter {

	void present(PermissionRequestView request);

}
