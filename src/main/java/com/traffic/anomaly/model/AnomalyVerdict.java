package com.traffic.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of evaluating one PromQL rule")
public class AnomalyVerdict {

    public static final String DETAILS_OK = "OK";
    public static final String DETAILS_BACKEND_ERROR = "Prometheus error";
    public static final String DETAILS_NO_DATA = "No data";
    public static final String DETAILS_INVALID_OPERATOR = "Invalid comparison operator";
    public static final String QUERY_ERROR_PREFIX = "Query error: ";
    public static final String PARSE_ERROR_PREFIX = "Parse error: ";

    @Schema(description = "Name of the evaluated rule", example = "ip-request-rate")
    private String ruleName;

    @Schema(description = "Scalar returned by the backend (0 when the query failed)", example = "142.5")
    private double observedValue;

    @Schema(description = "Whether the observed value satisfied the rule's comparison", example = "true")
    private boolean anomaly;

    @Schema(description = "Distance from the threshold, |observed - threshold|; 0 on error", example = "42.5")
    private double score;

    @Schema(description = "OK, or the reason evaluation did not produce a comparison",
            example = "OK")
    private String details;

    @Schema(description = "Rule threshold at evaluation time", example = "100.0")
    private double threshold;

    @Schema(description = "Rule comparison operator at evaluation time", example = ">")
    private String comparison;

    @Schema(description = "The PromQL expression after variable substitution")
    private String query;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long evaluatedAt;

    @JsonIgnore
    public boolean isOk() {
        return DETAILS_OK.equals(details);
    }
}
