package com.traffic.anomaly.exception;

public class RuleValidationException extends RuleRegistryException {

    public RuleValidationException(String ruleName, String message) {
        super(ruleName, message);
    }
}
