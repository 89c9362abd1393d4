package com.traffic.anomaly.client;

import com.traffic.anomaly.model.CircuitState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure circuit breaker with a fixed cooldown.
 *
 * <p>CLOSED opens once {@code consecutiveFailures >= threshold}. OPEN closes again,
 * with the counter reset, once {@code cooldown} has elapsed since it opened. Any
 * success closes the circuit and resets the counter.
 *
 * <p>Not thread-safe: the owning client guards every call with its pool lock.
 */
class CircuitBreaker {

    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private Instant openSince;
    private int consecutiveFailures;

    CircuitBreaker(int threshold, Duration cooldown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("circuitBreakerThreshold must be >= 1");
        }
        this.threshold = threshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * @return true if a call may proceed; closes an open circuit whose cooldown has elapsed
     */
    boolean allowRequest() {
        if (state == CircuitState.OPEN
                && Duration.between(openSince, clock.instant()).compareTo(cooldown) >= 0) {
            state = CircuitState.CLOSED;
            openSince = null;
            consecutiveFailures = 0;
        }
        return state == CircuitState.CLOSED;
    }

    /**
     * @return true if this failure tripped the circuit
     */
    boolean recordFailure() {
        consecutiveFailures++;
        if (state == CircuitState.CLOSED && consecutiveFailures >= threshold) {
            state = CircuitState.OPEN;
            openSince = clock.instant();
            return true;
        }
        return false;
    }

    void recordSuccess() {
        consecutiveFailures = 0;
        state = CircuitState.CLOSED;
        openSince = null;
    }

    CircuitState getState() {
        return state;
    }

    Instant getOpenSince() {
        return openSince;
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
