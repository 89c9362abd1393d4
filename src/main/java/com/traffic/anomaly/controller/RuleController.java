package com.traffic.anomaly.controller;

import com.traffic.anomaly.exception.DuplicateRuleException;
import com.traffic.anomaly.exception.RuleNotFoundException;
import com.traffic.anomaly.exception.RuleRegistryException;
import com.traffic.anomaly.exception.RuleValidationException;
import com.traffic.anomaly.model.PromQLRule;
import com.traffic.anomaly.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage PromQL anomaly rules (register, replace, remove, validate)")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all rules", description = "Returns every registered rule in registration order.")
    @GetMapping
    public ResponseEntity<List<PromQLRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a rule by name")
    @GetMapping("/{name}")
    public ResponseEntity<?> getRule(
            @Parameter(description = "Rule name", example = "ip-request-rate")
            @PathVariable String name) {
        try {
            return ResponseEntity.ok(ruleService.getRule(name));
        } catch (RuleNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e);
        }
    }

    @Operation(summary = "Register a new rule",
            description = "Fails with 409 if a rule with the same name exists, 400 if the rule is invalid.")
    @PostMapping
    public ResponseEntity<?> createRule(@RequestBody PromQLRule rule) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.createRule(rule));
        } catch (RuleValidationException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        } catch (DuplicateRuleException e) {
            return error(HttpStatus.CONFLICT, e);
        }
    }

    @Operation(summary = "Replace an existing rule",
            description = "The body replaces the stored rule. Fails with 404 if no rule has that name.")
    @PutMapping("/{name}")
    public ResponseEntity<?> updateRule(
            @Parameter(description = "Rule name", example = "ip-request-rate")
            @PathVariable String name,
            @RequestBody PromQLRule updated) {
        try {
            return ResponseEntity.ok(ruleService.updateRule(name, updated));
        } catch (RuleValidationException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        } catch (RuleNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e);
        }
    }

    @Operation(summary = "Remove a rule")
    @DeleteMapping("/{name}")
    public ResponseEntity<?> deleteRule(
            @Parameter(description = "Rule name", example = "ip-request-rate")
            @PathVariable String name) {
        try {
            ruleService.deleteRule(name);
            return ResponseEntity.noContent().build();
        } catch (RuleNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e);
        }
    }

    @Operation(summary = "Validate a rule without registering it",
            description = "A rule is valid when name and query template are non-empty and the comparison is one of > >= < <= == !=")
    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validateRule(@RequestBody PromQLRule rule) {
        return ResponseEntity.ok(Map.of("valid", ruleService.isValid(rule)));
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, RuleRegistryException e) {
        // Map.of rejects null values and the rule name may be missing
        Map<String, String> body = new HashMap<>();
        body.put("error", e.getMessage());
        body.put("rule", e.getRuleName());
        return ResponseEntity.status(status).body(body);
    }
}
