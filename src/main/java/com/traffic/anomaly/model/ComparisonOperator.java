package com.traffic.anomaly.model;

import java.util.Optional;

public enum ComparisonOperator {
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String token;

    ComparisonOperator(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_THAN -> value < threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> value == threshold;
            case NOT_EQUAL -> value != threshold;
        };
    }

    public static Optional<ComparisonOperator> fromToken(String token) {
        if (token == null) return Optional.empty();
        for (ComparisonOperator op : values()) {
            if (op.token.equals(token)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
