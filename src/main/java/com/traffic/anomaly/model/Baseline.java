package com.traffic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Exponentially smoothed statistics for one seasonal bucket")
public class Baseline {

    @Schema(description = "EWMA mean", example = "120.4")
    private double mean;

    @Schema(description = "EWMA standard deviation", example = "15.2")
    private double stddev;

    @Schema(description = "Trust in this baseline, ramps from 0 to 1 over the first 10 observations",
            example = "0.7")
    private double confidence;

    @Schema(description = "Observations folded into this bucket", example = "7")
    private long count;
}
