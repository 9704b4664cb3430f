package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateBudgetTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-01T00:00:00Z"));

    @Test
    void startsFullAndRunsDry() {
        RateBudget budget = new RateBudget(clock, 2, 1, Duration.ofSeconds(1));

        assertThat(budget.tryAcquire(Duration.ZERO)).isTrue();
        assertThat(budget.tryAcquire(Duration.ZERO)).isTrue();
        assertThat(budget.tryAcquire(Duration.ZERO)).isFalse();
    }

    @Test
    void refillsInWholeStepsUpToCapacity() {
        RateBudget budget = new RateBudget(clock, 3, 1, Duration.ofSeconds(1));
        budget.tryAcquire(Duration.ZERO);
        budget.tryAcquire(Duration.ZERO);
        budget.tryAcquire(Duration.ZERO);

        clock.advance(Duration.ofMillis(1500));
        assertThat(budget.availableTokens()).isEqualTo(1);

        clock.advance(Duration.ofMillis(500));
        assertThat(budget.availableTokens()).isEqualTo(2);

        clock.advance(Duration.ofMinutes(5));
        assertThat(budget.availableTokens()).isEqualTo(3);
    }

    @Test
    void boundedWaitGivesUpWhenNoRefillArrives() {
        RateBudget budget = new RateBudget(clock, 1, 1, Duration.ofHours(1));
        budget.tryAcquire(Duration.ZERO);

        long started = System.nanoTime();
        boolean acquired = budget.tryAcquire(Duration.ofMillis(50));
        long waitedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertThat(acquired).isFalse();
        assertThat(waitedMs).isGreaterThanOrEqualTo(40L);
    }

    @Test
    void interruptedWaitReturnsFalse() {
        RateBudget budget = new RateBudget(clock, 1, 1, Duration.ofHours(1));
        budget.tryAcquire(Duration.ZERO);

        Thread.currentThread().interrupt();
        try {
            assertThat(budget.tryAcquire(Duration.ofSeconds(5))).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
