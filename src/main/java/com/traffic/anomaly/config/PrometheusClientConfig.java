package com.traffic.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "prometheus")
public class PrometheusClientConfig {

    // Base URL of the PromQL backend, without the /api/v1 suffix
    private String endpointUrl = "http://localhost:9090";

    // Basic auth, used only when no bearer token is set
    private String username;
    private String password;

    // Takes precedence over basic auth
    private String bearerToken;

    // Connect and read timeout per attempt
    private Duration timeout = Duration.ofSeconds(5);

    // Additional attempts after the first failure
    private int maxRetries = 3;

    // Consecutive failures that open the circuit
    private int circuitBreakerThreshold = 5;

    private int connectionPoolSize = 4;

    // How long an open circuit rejects calls before closing again
    private Duration circuitCooldown = Duration.ofSeconds(30);

    // Backoff before retry n is retryBackoff * n
    private Duration retryBackoff = Duration.ofMillis(100);
}
