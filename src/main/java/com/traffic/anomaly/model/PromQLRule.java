package com.traffic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A named PromQL query template evaluated against a threshold")
public class PromQLRule {

    @Schema(description = "Unique rule name", example = "ip-request-rate")
    private String name;

    @Schema(description = "PromQL expression with {{var}} placeholders",
            example = "sum(rate(http_requests_total{ip=\"{{ip}}\"}[5m]))")
    private String queryTemplate;

    @Schema(description = "Threshold the query result is compared against", example = "100.0")
    private double threshold;

    @Schema(description = "Comparison operator: >, >=, <, <=, ==, !=", example = ">")
    private String comparison;

    @Schema(description = "Default template variables, overridden by per-call context variables",
            example = "{\"path\": \"/login\"}")
    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();

    /**
     * Deep copy, so callers holding the copy never share the variables map with the registry.
     */
    public PromQLRule copy() {
        return toBuilder()
                .variables(variables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(variables))
                .build();
    }
}
