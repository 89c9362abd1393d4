package com.traffic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A value compared against its seasonal baseline threshold")
public class BaselineCheck {

    @Schema(description = "Metric the baseline belongs to", example = "requests_per_ip")
    private String metric;

    @Schema(description = "Value being checked", example = "310.0")
    private double value;

    @Schema(description = "mean + sensitivity * stddev for the bucket", example = "250.0")
    private double threshold;

    @Schema(description = "Bucket confidence, usable to down-weight young baselines", example = "1.0")
    private double confidence;

    @Schema(description = "True when value exceeds the threshold", example = "true")
    private boolean breached;

    @Schema(description = "Time context used", example = "HOURLY")
    private TimeContext context;

    @Schema(description = "Bucket key within the context", example = "14")
    private int bucket;
}
