package com.traffic.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordQueryAttempt(String outcome) {
        Counter.builder("prometheus.query.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordQueryFailure(String reason) {
        Counter.builder("prometheus.query.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCircuitOpened() {
        Counter.builder("prometheus.circuit.opened.count")
                .register(registry)
                .increment();
    }

    public void recordRuleEvaluation(String outcome) {
        Counter.builder("rule.evaluation.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordBaselineObservation(String metric) {
        Counter.builder("baseline.observation.count")
                .tag("metric", metric)
                .register(registry)
                .increment();
    }
}
