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
@Schema(description = "Baseline of one seasonal bucket together with the threshold derived from it")
public class BaselineSnapshot {

    @Schema(description = "Metric the baseline belongs to", example = "requests_per_ip")
    private String metric;

    @Schema(description = "Time context used", example = "HOURLY")
    private TimeContext context;

    @Schema(description = "Bucket key within the context", example = "14")
    private int bucket;

    private Baseline baseline;

    @Schema(description = "mean + sensitivity * stddev", example = "250.0")
    private double threshold;

    @Schema(description = "Bucket confidence", example = "0.7")
    private double confidence;
}
