/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.session;

/**
 * Filter and paging for {@link SessionStore#list(ListSessionsOptions)}. Null components
 * do not filter.
 *
 * @param agentId only sessions of this agent
 * @param status only sessions in this state
 * @param limit maximum number of sessions returned
 * @param offset number of sessions skipped after sorting
 */
public record ListSessionsOptions(String agentId, SessionStatus status, Integer limit, Integer offset) {

	public static ListSessionsOptions all() {
		return new ListSessionsOptions(null, null, null, null);
	}

}
