package com.traffic.anomaly.controller;

import com.traffic.anomaly.client.MetricsQueryClient;
import com.traffic.anomaly.exception.RuleNotFoundException;
import com.traffic.anomaly.model.AnomalyVerdict;
import com.traffic.anomaly.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/evaluations")
@Tag(name = "Evaluations", description = "Evaluate PromQL rules against the metrics backend")
public class EvaluationController {

    private final RuleService ruleService;
    private final MetricsQueryClient queryClient;

    public EvaluationController(RuleService ruleService, MetricsQueryClient queryClient) {
        this.ruleService = ruleService;
        this.queryClient = queryClient;
    }

    @Operation(summary = "Evaluate one rule",
            description = "Body is a flat map of context variables (e.g. ip, path) that override the rule's defaults. " +
                    "Backend and parse failures are returned as a verdict with anomaly=false and a details message.")
    @PostMapping("/{name}")
    public ResponseEntity<?> evaluate(
            @Parameter(description = "Rule name", example = "ip-request-rate")
            @PathVariable String name,
            @RequestBody(required = false) Map<String, String> contextVariables) {
        try {
            return ResponseEntity.ok(ruleService.evaluate(name, orEmpty(contextVariables)));
        } catch (RuleNotFoundException e) {
            Map<String, String> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("rule", name);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
    }

    @Operation(summary = "Evaluate every rule",
            description = "Returns one verdict per registered rule, including error verdicts.")
    @PostMapping
    public ResponseEntity<List<AnomalyVerdict>> evaluateAll(
            @RequestBody(required = false) Map<String, String> contextVariables) {
        return ResponseEntity.ok(ruleService.evaluateAll(orEmpty(contextVariables)));
    }

    @Operation(summary = "Metrics backend circuit state")
    @GetMapping("/backend")
    public ResponseEntity<Map<String, Object>> backendStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("circuitState", queryClient.getCircuitState().name());
        response.put("consecutiveFailures", queryClient.getConsecutiveFailures());
        return ResponseEntity.ok(response);
    }

    private static Map<String, String> orEmpty(Map<String, String> variables) {
        return variables == null ? Map.of() : variables;
    }
}
