package com.traffic.anomaly.exception;

public class DuplicateRuleException extends RuleRegistryException {

    public DuplicateRuleException(String ruleName) {
        super(ruleName, "Rule already exists: " + ruleName);
    }
}
