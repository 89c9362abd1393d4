package com.traffic.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Configuration
@ConfigurationProperties(prefix = "baseline")
public class BaselineConfig {

    // Threshold = mean + sensitivity * stddev
    private double sensitivity = 0.1;

    // EWMA smoothing factor (0 < alpha <= 1)
    private double learningRate = 0.05;

    // Calendar used for hour/weekday/week bucket keys. Blank means the JVM default zone.
    private String zoneId;

    // Recent-observation window kept per metric; zero disables a bound
    private Duration windowDuration = Duration.ofMinutes(5);
    private int windowMaxElements = 1000;

    public ZoneId resolveZone() {
        return zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
    }
}
