package com.traffic.anomaly.exception;

/**
 * A rule registry contract violation, reported to the caller as a distinct failure.
 */
public abstract class RuleRegistryException extends RuntimeException {

    private final String ruleName;

    protected RuleRegistryException(String ruleName, String message) {
        super(message);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
