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
@Schema(description = "A metric value at a point in time")
public class ObservationRequest {

    @Schema(description = "Observed value", example = "142.0")
    private double value;

    @Schema(description = "Epoch milliseconds; defaults to now", example = "1739886764000")
    private Long timestamp;

    @Schema(description = "Time context for checks; defaults to HOURLY", example = "HOURLY")
    private TimeContext context;
}
