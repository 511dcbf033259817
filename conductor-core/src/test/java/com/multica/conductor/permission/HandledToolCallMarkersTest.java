/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor.permission;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;

class HandledToolCallMarkersTest {

	private final VirtualTimeScheduler clock = VirtualTimeScheduler.create();

	private final HandledToolCallMarkers markers = new HandledToolCallMarkers(Duration.ofSeconds(60), this.clock);

	@AfterEach
	void tearDown() {
		this.clock.dispose();
	}

	@Test
	void testMarkOnlyOnceWithinRetention() {
		assertThat(this.markers.tryMark("call-1")).isTrue();
		assertThat(this.markers.tryMark("call-1")).isFalse();
		assertThat(this.markers.isMarked("call-1")).isTrue();
		assertThat(this.markers.isMarked("call-2")).isFalse();
	}

	@Test
	void testMarkersExpireAndAreSwept() {
		this.markers.tryMark("call-1");
		this.clock.advanceTimeBy(Duration.ofSeconds(30));
		this.markers.tryMark("call-2");
		assertThat(this.markers.size()).isEqualTo(2);

		this.clock.advanceTimeBy(Duration.ofSeconds(30));
		assertThat(this.markers.isMarked("call-1")).isFalse();
		assertThat(this.markers.size()).isEqualTo(1);

		assertThat(this.markers.tryMark("call-1")).isTrue();
		this.clock.advanceTimeBy(Duration.ofSeconds(60));
		assertThat(this.markers.size()).isZero();
	}

}
