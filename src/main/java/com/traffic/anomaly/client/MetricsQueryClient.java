package com.traffic.anomaly.client;

import com.traffic.anomaly.model.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * Client for a PromQL-speaking metrics backend. Implementations are shared between
 * callers and must be thread-safe.
 */
public interface MetricsQueryClient {

    /**
     * Run an instant query.
     *
     * @return the raw JSON response body
     * @throws MetricsQueryException if the circuit is open or every attempt failed
     */
    String query(String expression);

    /**
     * Run a range query.
     *
     * @return the raw JSON response body
     * @throws MetricsQueryException if the circuit is open or every attempt failed
     */
    String queryRange(String expression, Instant start, Instant end, Duration step);

    CircuitState getCircuitState();

    int getConsecutiveFailures();
}
