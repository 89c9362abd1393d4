package com.traffic.anomaly.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traffic.anomaly.client.MetricsQueryClient;
import com.traffic.anomaly.config.MetricsConfig;
import com.traffic.anomaly.model.AnomalyVerdict;
import com.traffic.anomaly.model.ComparisonOperator;
import com.traffic.anomaly.model.PromQLRule;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of named PromQL rules and their evaluation against the metrics backend.
 *
 * <p>The registry lock only covers map access. Evaluation works on a copy of the rule,
 * so a slow backend query never blocks registry reads or writes.
 *
 * <p>Evaluation never throws for backend or response problems: those come back as a
 * non-anomalous verdict with a descriptive {@code details} string.
 */
@Component
public class AnomalyRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRuleEngine.class);

    private final MetricsQueryClient queryClient;
    private final QueryResultParser resultParser;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    private final Object rulesLock = new Object();
    private final Map<String, PromQLRule> rules = new LinkedHashMap<>();

    public AnomalyRuleEngine(MetricsQueryClient queryClient, ObjectMapper objectMapper,
                             Tracer tracer, MetricsConfig metricsConfig) {
        this.queryClient = queryClient;
        this.resultParser = new QueryResultParser(objectMapper);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    // ── Registry ──

    /**
     * @return false if the name is blank or already registered
     */
    public boolean addRule(PromQLRule rule) {
        if (isBlank(rule.getName())) {
            return false;
        }
        synchronized (rulesLock) {
            if (rules.containsKey(rule.getName())) {
                return false;
            }
            rules.put(rule.getName(), rule.copy());
        }
        log.info("Registered rule '{}': {} {} {}",
                rule.getName(), rule.getQueryTemplate(), rule.getComparison(), rule.getThreshold());
        return true;
    }

    public boolean removeRule(String name) {
        synchronized (rulesLock) {
            return rules.remove(name) != null;
        }
    }

    /**
     * Replace the rule with the same name, keeping its registration order.
     *
     * @return false if no rule with that name exists
     */
    public boolean updateRule(PromQLRule rule) {
        synchronized (rulesLock) {
            if (!rules.containsKey(rule.getName())) {
                return false;
            }
            rules.put(rule.getName(), rule.copy());
            return true;
        }
    }

    public Optional<PromQLRule> getRule(String name) {
        synchronized (rulesLock) {
            return Optional.ofNullable(rules.get(name)).map(PromQLRule::copy);
        }
    }

    public List<PromQLRule> listRules() {
        synchronized (rulesLock) {
            List<PromQLRule> snapshot = new ArrayList<>(rules.size());
            for (PromQLRule rule : rules.values()) {
                snapshot.add(rule.copy());
            }
            return snapshot;
        }
    }

    public int ruleCount() {
        synchronized (rulesLock) {
            return rules.size();
        }
    }

    /**
     * A rule is valid when its name and query template are non-empty and its comparison
     * is one of {@code > >= < <= == !=}.
     */
    public static boolean validateRule(PromQLRule rule) {
        return rule != null
                && !isBlank(rule.getName())
                && !isBlank(rule.getQueryTemplate())
                && ComparisonOperator.fromToken(rule.getComparison()).isPresent();
    }

    // ── Templates ──

    /**
     * Replace every {@code {{key}}} whose key is bound in {@code variables} with the bound
     * value, verbatim. Unbound placeholders are left as they are, and inserted values are
     * never scanned for further placeholders.
     */
    public static String substitute(String template, Map<String, String> variables) {
        if (template == null || variables == null || variables.isEmpty() || !template.contains("{{")) {
            return template;
        }
        StringBuilder out = new StringBuilder(template.length());
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf("{{", pos);
            int close = open < 0 ? -1 : template.indexOf("}}", open + 2);
            if (close < 0) {
                out.append(template, pos, template.length());
                break;
            }
            String value = variables.get(template.substring(open + 2, close));
            if (value != null) {
                out.append(template, pos, open).append(value);
                pos = close + 2;
            } else {
                // Shift by one so "{{{ip}}}" still resolves the inner placeholder
                out.append(template, pos, open + 1);
                pos = open + 1;
            }
        }
        return out.toString();
    }

    // ── Evaluation ──

    /**
     * Evaluate one rule with the given context variables, which override the rule's
     * default variables.
     *
     * @return empty if no rule with that name is registered
     */
    @Observed(name = "rules.evaluate", contextualName = "evaluate-rule")
    public Optional<AnomalyVerdict> evaluate(String ruleName, Map<String, String> contextVariables) {
        PromQLRule rule;
        synchronized (rulesLock) {
            PromQLRule stored = rules.get(ruleName);
            if (stored == null) {
                return Optional.empty();
            }
            rule = stored.copy();
        }
        return Optional.of(evaluateRule(rule, contextVariables));
    }

    /**
     * Evaluate every registered rule with the same context. Rules whose evaluation fails
     * are included as error verdicts.
     */
    @Observed(name = "rules.evaluate_all", contextualName = "evaluate-all-rules")
    public List<AnomalyVerdict> evaluateAll(Map<String, String> contextVariables) {
        List<PromQLRule> snapshot = listRules();
        List<AnomalyVerdict> verdicts = new ArrayList<>(snapshot.size());
        for (PromQLRule rule : snapshot) {
            verdicts.add(evaluateRule(rule, contextVariables));
        }
        return verdicts;
    }

    private AnomalyVerdict evaluateRule(PromQLRule rule, Map<String, String> contextVariables) {
        Span ruleSpan = tracer.nextSpan()
                .name("rule.evaluate")
                .tag("rule.name", rule.getName())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
            AnomalyVerdict verdict = doEvaluate(rule, contextVariables);

            ruleSpan.tag("rule.anomaly", String.valueOf(verdict.isAnomaly()));
            ruleSpan.tag("rule.details", verdict.getDetails());

            if (!verdict.isOk()) {
                metricsConfig.recordRuleEvaluation("error");
                log.debug("Rule '{}' produced no comparison: {}", rule.getName(), verdict.getDetails());
            } else if (verdict.isAnomaly()) {
                metricsConfig.recordRuleEvaluation("anomaly");
                log.debug("Rule '{}' flagged anomaly: value={} {} threshold={}, score={}",
                        rule.getName(), verdict.getObservedValue(), rule.getComparison(),
                        rule.getThreshold(), verdict.getScore());
            } else {
                metricsConfig.recordRuleEvaluation("normal");
            }
            return verdict;
        } finally {
            ruleSpan.end();
        }
    }

    private AnomalyVerdict doEvaluate(PromQLRule rule, Map<String, String> contextVariables) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (rule.getVariables() != null) {
            merged.putAll(rule.getVariables());
        }
        if (contextVariables != null) {
            // A null context value means "not given" and keeps the rule's default
            contextVariables.forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, value);
                }
            });
        }
        String query = substitute(rule.getQueryTemplate(), merged);

        AnomalyVerdict.AnomalyVerdictBuilder verdict = AnomalyVerdict.builder()
                .ruleName(rule.getName())
                .threshold(rule.getThreshold())
                .comparison(rule.getComparison())
                .query(query)
                .evaluatedAt(System.currentTimeMillis());

        String body;
        try {
            body = queryClient.query(query);
        } catch (RuntimeException e) {
            log.warn("Query for rule '{}' failed: {}", rule.getName(), e.getMessage());
            return verdict.details(AnomalyVerdict.QUERY_ERROR_PREFIX + e.getMessage()).build();
        }

        QueryResultParser.Sample sample = resultParser.parse(body);
        if (!sample.ok()) {
            return verdict.details(sample.error()).build();
        }

        double value = sample.value();
        Optional<ComparisonOperator> operator = ComparisonOperator.fromToken(rule.getComparison());
        if (operator.isEmpty()) {
            return verdict.observedValue(value)
                    .details(AnomalyVerdict.DETAILS_INVALID_OPERATOR)
                    .build();
        }

        return verdict.observedValue(value)
                .anomaly(operator.get().test(value, rule.getThreshold()))
                .score(Math.abs(value - rule.getThreshold()))
                .details(AnomalyVerdict.DETAILS_OK)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
