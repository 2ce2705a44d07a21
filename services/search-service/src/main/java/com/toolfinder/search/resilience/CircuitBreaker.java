package com.toolfinder.search.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consecutive-failure breaker guarding one outbound dependency.
 * All state changes happen under the instance monitor.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final long NO_PERMIT = -1L;

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private long lastFailureAt;
    private boolean trialInFlight;
    private long generation;
    private long successTotal;
    private long failureTotal;
    private long rejectedTotal;
    private long openedTotal;

    public CircuitBreaker(String name, int failureThreshold, long resetTimeoutMs) {
        this(name, failureThreshold, resetTimeoutMs, Clock.systemUTC(), null);
    }

    public CircuitBreaker(
        String name,
        int failureThreshold,
        long resetTimeoutMs,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.resetTimeoutMs = Math.max(1L, resetTimeoutMs);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.meterRegistry = meterRegistry;
    }

    public String getName() {
        return name;
    }

    /**
     * Acquires permission for one call. In HALF_OPEN only a single trial call is admitted
     * until it reports back through {@link #recordSuccess()} or {@link #recordFailure()}.
     */
    public boolean allowRequest() {
        return acquirePermit() != NO_PERMIT;
    }

    /**
     * Like {@link #allowRequest()}, but returns the generation the call was admitted in, or
     * {@link #NO_PERMIT}. Outcomes reported with a permit from an earlier generation only count
     * towards the totals and never move the state.
     */
    public synchronized long acquirePermit() {
        if (state == CircuitState.CLOSED) {
            return generation;
        }
        if (state == CircuitState.OPEN) {
            if (clock.millis() - lastFailureAt >= resetTimeoutMs) {
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return generation;
            }
            rejectedTotal++;
            return NO_PERMIT;
        }
        if (trialInFlight) {
            rejectedTotal++;
            return NO_PERMIT;
        }
        trialInFlight = true;
        return generation;
    }

    public synchronized boolean isOpen() {
        return state == CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        recordSuccess(generation);
    }

    /**
     * Only a success admitted in the current generation counts. While OPEN nothing is admitted,
     * so a success can never close an open breaker without a HALF_OPEN trial.
     */
    public synchronized void recordSuccess(long permit) {
        successTotal++;
        if (permit != generation || state == CircuitState.OPEN) {
            log.debug("circuit_stale_success name={} permit={} generation={}", name, permit, generation);
            return;
        }
        failureCount = 0;
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            transitionTo(CircuitState.CLOSED);
        }
    }

    public synchronized void recordFailure() {
        recordFailure(generation);
    }

    public synchronized void recordFailure(long permit) {
        failureTotal++;
        if (permit != generation) {
            log.debug("circuit_stale_failure name={} permit={} generation={}", name, permit, generation);
            return;
        }
        lastFailureAt = clock.millis();
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            transitionTo(CircuitState.OPEN);
            return;
        }
        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            transitionTo(CircuitState.OPEN);
        }
    }

    public <T> T execute(Supplier<T> call) {
        long permit = acquirePermit();
        if (permit == NO_PERMIT) {
            log.debug("circuit_rejected name={}", name);
            throw new CircuitOpenException(name);
        }
        T result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            recordFailure(permit);
            throw e;
        }
        recordSuccess(permit);
        return result;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized long getLastFailureAt() {
        return lastFailureAt;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(
            name,
            state,
            failureCount,
            lastFailureAt,
            successTotal,
            failureTotal,
            rejectedTotal,
            openedTotal
        );
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        generation++;
        if (next == CircuitState.OPEN) {
            openedTotal++;
            log.warn("circuit_open name={} failures={} reset_timeout_ms={}", name, failureCount, resetTimeoutMs);
        } else if (next == CircuitState.HALF_OPEN) {
            log.info("circuit_half_open name={}", name);
        } else {
            failureCount = 0;
            log.info("circuit_closed name={} previous={}", name, previous);
        }
        if (meterRegistry != null) {
            meterRegistry.counter("circuit_breaker_transition_total", "name", name, "state", next.name().toLowerCase(Locale.ROOT))
                .increment();
        }
    }
}
