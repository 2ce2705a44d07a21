package com.toolfinder.search.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.toolfinder.search.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_000_000L);
        meterRegistry = new SimpleMeterRegistry();
        breaker = new CircuitBreaker("vector-store", 3, 10_000L, clock, meterRegistry);
    }

    @Test
    void opensAfterThresholdConsecutiveFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());

        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
        assertEquals(1L, breaker.getStats().getRejectedTotal());
        assertEquals(
            1.0,
            meterRegistry.counter("circuit_breaker_transition_total", "name", "vector-store", "state", "open").count()
        );
    }

    @Test
    void successWhileClosedResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getFailureCount());
    }

    @Test
    void halfOpenAfterResetTimeoutAdmitsSingleTrial() {
        tripBreaker();

        clock.advanceMillis(9_999L);
        assertFalse(breaker.allowRequest());

        clock.advanceMillis(1L);
        assertTrue(breaker.allowRequest());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());

        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
        assertTrue(breaker.allowRequest());
    }

    @Test
    void failedTrialReopensWithFreshFailureTime() {
        tripBreaker();
        clock.advanceMillis(10_000L);
        assertTrue(breaker.allowRequest());

        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.millis(), breaker.getLastFailureAt());
        clock.advanceMillis(5_000L);
        assertFalse(breaker.allowRequest());
        assertEquals(2L, breaker.getStats().getOpenedTotal());
    }

    @Test
    void successReportedWhileOpenKeepsBreakerOpen() {
        long permit = breaker.acquirePermit();
        tripBreaker();

        breaker.recordSuccess(permit);
        breaker.recordSuccess();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
        assertEquals(2L, breaker.getStats().getSuccessTotal());
    }

    @Test
    void staleSuccessLeavesHalfOpenTrialInFlight() {
        long admittedWhileClosed = breaker.acquirePermit();
        tripBreaker();
        clock.advanceMillis(10_000L);
        long trial = breaker.acquirePermit();
        assertThat(trial).isNotEqualTo(CircuitBreaker.NO_PERMIT).isNotEqualTo(admittedWhileClosed);

        breaker.recordSuccess(admittedWhileClosed);

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(CircuitBreaker.NO_PERMIT, breaker.acquirePermit());

        breaker.recordSuccess(trial);
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void staleFailureDoesNotCountAgainstRecoveredBreaker() {
        long admittedBeforeTrip = breaker.acquirePermit();
        tripBreaker();
        clock.advanceMillis(10_000L);
        breaker.recordSuccess(breaker.acquirePermit());
        assertEquals(CircuitState.CLOSED, breaker.getState());

        breaker.recordFailure(admittedBeforeTrip);

        assertEquals(0, breaker.getFailureCount());
        assertEquals(4L, breaker.getStats().getFailureTotal());
    }

    @Test
    void executeRejectsWhileOpenAndCountsOutcomes() {
        assertEquals("ok", breaker.execute(() -> "ok"));
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IllegalStateException("store down");
            })).isInstanceOf(IllegalStateException.class);
        }

        assertThatThrownBy(() -> breaker.execute(() -> "never"))
            .isInstanceOf(CircuitOpenException.class)
            .hasMessage("vector-store_circuit_open");

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.getSuccessTotal()).isEqualTo(1L);
        assertThat(stats.getFailureTotal()).isEqualTo(3L);
        assertThat(stats.getState()).isEqualTo(CircuitState.OPEN);
    }

    private void tripBreaker() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
    }
}
