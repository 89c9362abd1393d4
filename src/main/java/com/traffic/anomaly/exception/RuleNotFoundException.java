package com.traffic.anomaly.exception;

public class RuleNotFoundException extends RuleRegistryException {

    public RuleNotFoundException(String ruleName) {
        super(ruleName, "Rule not found: " + ruleName);
    }
}
