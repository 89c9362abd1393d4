package com.traffic.anomaly.client;

import com.traffic.anomaly.config.MetricsConfig;
import com.traffic.anomaly.config.PrometheusClientConfig;
import com.traffic.anomaly.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * PromQL HTTP client with a fixed connection pool, bounded linear-backoff retries
 * and a circuit breaker.
 *
 * <p>Configuration is copied at construction; changing {@link PrometheusClientConfig}
 * afterwards has no effect on an existing instance. Pool acquisition and every circuit
 * breaker update happen under one lock so concurrent failures are never lost.
 */
@Component
public class PrometheusQueryClient implements MetricsQueryClient {

    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryClient.class);

    static final String QUERY_PATH = "/api/v1/query";
    static final String QUERY_RANGE_PATH = "/api/v1/query_range";

    private final String endpointUrl;
    private final int maxRetries;
    private final Duration retryBackoff;
    private final List<RestClient> pool;
    private final CircuitBreaker circuitBreaker;
    private final MetricsConfig metricsConfig;

    private final Object poolLock = new Object();
    private int nextClient;

    @Autowired
    public PrometheusQueryClient(PrometheusClientConfig config,
                                 RestClient.Builder restClientBuilder,
                                 MetricsConfig metricsConfig) {
        this(config, restClientBuilder.requestFactory(requestFactory(config.getTimeout())),
                metricsConfig, Clock.systemUTC());
    }

    /**
     * @param restClientBuilder template for the pooled clients; each pool slot is built
     *                          from a clone carrying the base URL and auth headers
     */
    public PrometheusQueryClient(PrometheusClientConfig config,
                                 RestClient.Builder restClientBuilder,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        if (config.getConnectionPoolSize() < 1) {
            throw new IllegalArgumentException("connectionPoolSize must be >= 1");
        }
        if (config.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.endpointUrl = config.getEndpointUrl();
        this.maxRetries = config.getMaxRetries();
        this.retryBackoff = config.getRetryBackoff();
        this.metricsConfig = metricsConfig;
        this.circuitBreaker = new CircuitBreaker(
                config.getCircuitBreakerThreshold(), config.getCircuitCooldown(), clock);

        List<RestClient> clients = new ArrayList<>(config.getConnectionPoolSize());
        for (int i = 0; i < config.getConnectionPoolSize(); i++) {
            clients.add(restClientBuilder.clone()
                    .baseUrl(endpointUrl)
                    .defaultHeaders(headers -> {
                        if (hasText(config.getBearerToken())) {
                            headers.setBearerAuth(config.getBearerToken());
                        } else if (hasText(config.getUsername()) && hasText(config.getPassword())) {
                            headers.setBasicAuth(config.getUsername(), config.getPassword());
                        }
                    })
                    .build());
        }
        this.pool = List.copyOf(clients);

        log.info("Prometheus client ready: endpoint={}, poolSize={}, timeout={}, maxRetries={}, " +
                        "circuitThreshold={}, cooldown={}, auth={}",
                endpointUrl, pool.size(), config.getTimeout(), maxRetries,
                config.getCircuitBreakerThreshold(), config.getCircuitCooldown(), authMode(config));
    }

    @Override
    public String query(String expression) {
        return execute("query", client -> client.get()
                .uri(uriBuilder -> uriBuilder.path(QUERY_PATH)
                        .queryParam("query", "{query}")
                        .build(expression))
                .retrieve()
                .body(String.class));
    }

    @Override
    public String queryRange(String expression, Instant start, Instant end, Duration step) {
        String startParam = DateTimeFormatter.ISO_INSTANT.format(start.truncatedTo(ChronoUnit.SECONDS));
        String endParam = DateTimeFormatter.ISO_INSTANT.format(end.truncatedTo(ChronoUnit.SECONDS));
        String stepParam = String.valueOf(step.getSeconds());
        return execute("query_range", client -> client.get()
                .uri(uriBuilder -> uriBuilder.path(QUERY_RANGE_PATH)
                        .queryParam("query", "{query}")
                        .queryParam("start", "{start}")
                        .queryParam("end", "{end}")
                        .queryParam("step", "{step}")
                        .build(expression, startParam, endParam, stepParam))
                .retrieve()
                .body(String.class));
    }

    @Override
    public CircuitState getCircuitState() {
        synchronized (poolLock) {
            return circuitBreaker.getState();
        }
    }

    @Override
    public int getConsecutiveFailures() {
        synchronized (poolLock) {
            return circuitBreaker.getConsecutiveFailures();
        }
    }

    private String execute(String operation, Function<RestClient, String> call) {
        RestClient client = acquireClient();

        MetricsQueryException lastFailure = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                backoff(attempt);
            }
            try {
                String body = call.apply(client);
                recordSuccess();
                return body == null ? "" : body;
            } catch (RestClientResponseException e) {
                lastFailure = new MetricsQueryException(FailureReason.HTTP_STATUS,
                        "HTTP " + e.getStatusCode().value() + " from " + operation, e);
            } catch (RestClientException e) {
                lastFailure = new MetricsQueryException(FailureReason.TRANSPORT_FAILURE,
                        "Transport failure on " + operation + ": " + e.getMessage(), e);
            }
            recordFailure(lastFailure, attempt);
        }

        throw new MetricsQueryException(lastFailure.getReason(),
                "Prometheus " + operation + " failed after " + (maxRetries + 1) + " attempts: "
                        + lastFailure.getMessage(), lastFailure);
    }

    private RestClient acquireClient() {
        synchronized (poolLock) {
            if (!circuitBreaker.allowRequest()) {
                metricsConfig.recordQueryFailure(FailureReason.CIRCUIT_OPEN.name());
                throw new MetricsQueryException(FailureReason.CIRCUIT_OPEN, "Circuit breaker open");
            }
            RestClient client = pool.get(nextClient);
            nextClient = (nextClient + 1) % pool.size();
            return client;
        }
    }

    private void recordSuccess() {
        metricsConfig.recordQueryAttempt("success");
        synchronized (poolLock) {
            if (circuitBreaker.getConsecutiveFailures() > 0) {
                log.info("Prometheus query succeeded after {} consecutive failures, circuit closed",
                        circuitBreaker.getConsecutiveFailures());
            }
            circuitBreaker.recordSuccess();
        }
    }

    private void recordFailure(MetricsQueryException failure, int attempt) {
        metricsConfig.recordQueryAttempt("failure");
        metricsConfig.recordQueryFailure(failure.getReason().name());
        boolean tripped;
        int failures;
        synchronized (poolLock) {
            tripped = circuitBreaker.recordFailure();
            failures = circuitBreaker.getConsecutiveFailures();
        }
        log.warn("Prometheus attempt {}/{} failed ({}): {}",
                attempt + 1, maxRetries + 1, failure.getReason(), failure.getMessage());
        if (tripped) {
            metricsConfig.recordCircuitOpened();
            log.warn("Circuit breaker opened for {} after {} consecutive failures", endpointUrl, failures);
        }
    }

    private void backoff(int retry) {
        try {
            Thread.sleep(retryBackoff.toMillis() * retry);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricsQueryException(FailureReason.TRANSPORT_FAILURE,
                    "Interrupted while backing off before retry " + retry, e);
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }

    private static String authMode(PrometheusClientConfig config) {
        if (hasText(config.getBearerToken())) return "bearer";
        if (hasText(config.getUsername()) && hasText(config.getPassword())) return "basic";
        return "none";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
