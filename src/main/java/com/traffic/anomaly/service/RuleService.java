package com.traffic.anomaly.service;

import com.traffic.anomaly.config.DetectionRulesConfig;
import com.traffic.anomaly.engine.AnomalyRuleEngine;
import com.traffic.anomaly.exception.DuplicateRuleException;
import com.traffic.anomaly.exception.RuleNotFoundException;
import com.traffic.anomaly.exception.RuleValidationException;
import com.traffic.anomaly.model.AnomalyVerdict;
import com.traffic.anomaly.model.ComparisonOperator;
import com.traffic.anomaly.model.PromQLRule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service layer over the rule engine. Validates rules before they reach the registry
 * and turns registry refusals into typed exceptions.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final AnomalyRuleEngine ruleEngine;
    private final DetectionRulesConfig rulesConfig;

    public RuleService(AnomalyRuleEngine ruleEngine, DetectionRulesConfig rulesConfig) {
        this.ruleEngine = ruleEngine;
        this.rulesConfig = rulesConfig;
    }

    @PostConstruct
    public void init() {
        int loaded = 0;
        for (PromQLRule rule : rulesConfig.getRules()) {
            try {
                createRule(rule);
                loaded++;
            } catch (RuleValidationException | DuplicateRuleException e) {
                log.warn("Skipping configured rule '{}': {}", rule.getName(), e.getMessage());
            }
        }
        log.info("Loaded {} of {} configured rules", loaded, rulesConfig.getRules().size());
    }

    public List<PromQLRule> getAllRules() {
        return ruleEngine.listRules();
    }

    public PromQLRule getRule(String name) {
        return ruleEngine.getRule(name).orElseThrow(() -> new RuleNotFoundException(name));
    }

    public PromQLRule createRule(PromQLRule rule) {
        validate(rule);
        if (!ruleEngine.addRule(rule)) {
            throw new DuplicateRuleException(rule.getName());
        }
        return rule;
    }

    public PromQLRule updateRule(String name, PromQLRule updated) {
        if (updated.getName() == null) {
            updated.setName(name);
        } else if (!updated.getName().equals(name)) {
            throw new RuleValidationException(name,
                    "Rule name in body '" + updated.getName() + "' does not match '" + name + "'");
        }
        validate(updated);
        if (!ruleEngine.updateRule(updated)) {
            throw new RuleNotFoundException(name);
        }
        return updated;
    }

    public void deleteRule(String name) {
        if (!ruleEngine.removeRule(name)) {
            throw new RuleNotFoundException(name);
        }
    }

    public boolean isValid(PromQLRule rule) {
        return AnomalyRuleEngine.validateRule(rule);
    }

    public AnomalyVerdict evaluate(String name, Map<String, String> contextVariables) {
        return ruleEngine.evaluate(name, contextVariables).orElseThrow(() -> new RuleNotFoundException(name));
    }

    public List<AnomalyVerdict> evaluateAll(Map<String, String> contextVariables) {
        return ruleEngine.evaluateAll(contextVariables);
    }

    private void validate(PromQLRule rule) {
        if (AnomalyRuleEngine.validateRule(rule)) {
            return;
        }
        String name = rule == null ? null : rule.getName();
        if (rule == null || name == null || name.isBlank()) {
            throw new RuleValidationException(name, "Rule name must not be empty");
        }
        if (rule.getQueryTemplate() == null || rule.getQueryTemplate().isBlank()) {
            throw new RuleValidationException(name, "Query template must not be empty");
        }
        if (ComparisonOperator.fromToken(rule.getComparison()).isEmpty()) {
            throw new RuleValidationException(name,
                    "Unsupported comparison '" + rule.getComparison() + "', expected one of "
                            + Arrays.stream(ComparisonOperator.values())
                                    .map(ComparisonOperator::getToken)
                                    .collect(Collectors.joining(" ")));
        }
        throw new RuleValidationException(name, "Invalid rule");
    }
}
