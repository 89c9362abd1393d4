package com.traffic.anomaly.controller;

import com.traffic.anomaly.exception.NoBaselineDataException;
import com.traffic.anomaly.model.BaselineSnapshot;
import com.traffic.anomaly.model.ObservationRequest;
import com.traffic.anomaly.model.TimeContext;
import com.traffic.anomaly.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Seasonal EWMA baselines and recent-observation windows per metric")
public class BaselineController {

    private final BaselineService baselineService;

    public BaselineController(BaselineService baselineService) {
        this.baselineService = baselineService;
    }

    @Operation(summary = "List tracked metrics")
    @GetMapping
    public ResponseEntity<Set<String>> listMetrics() {
        return ResponseEntity.ok(baselineService.getMetricNames());
    }

    @Operation(summary = "Record an observation",
            description = "Updates the hourly, daily and weekly buckets matching the timestamp and appends to the recent window.")
    @PostMapping("/{metric}/observations")
    public ResponseEntity<Map<String, Object>> recordObservation(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric,
            @RequestBody ObservationRequest request) {
        long timestamp = timestampOrNow(request.getTimestamp());
        baselineService.recordObservation(metric, request.getValue(), timestamp);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("metric", metric);
        response.put("value", request.getValue());
        response.put("timestamp", timestamp);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Get the baseline, threshold and confidence for a point in time")
    @GetMapping("/{metric}")
    public ResponseEntity<?> getBaseline(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric,
            @Parameter(description = "Epoch milliseconds; defaults to now")
            @RequestParam(required = false) Long timestamp,
            @RequestParam(defaultValue = "HOURLY") TimeContext context) {
        Optional<BaselineSnapshot> snapshot = baselineService.describe(metric, timestampOrNow(timestamp), context);
        if (snapshot.isEmpty()) {
            return noData("No data for metric " + metric + " in " + context + " context");
        }
        return ResponseEntity.ok(snapshot.get());
    }

    @Operation(summary = "Check a value against its seasonal threshold",
            description = "breached = value > mean + sensitivity * stddev for the matching bucket.")
    @PostMapping("/{metric}/check")
    public ResponseEntity<?> check(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric,
            @RequestBody ObservationRequest request) {
        TimeContext context = request.getContext() == null ? TimeContext.HOURLY : request.getContext();
        try {
            return ResponseEntity.ok(baselineService.check(
                    metric, request.getValue(), timestampOrNow(request.getTimestamp()), context));
        } catch (NoBaselineDataException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            if (e.getContext() != null) {
                body.put("context", e.getContext());
                body.put("bucket", e.getBucket());
            }
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
    }

    @Operation(summary = "Values currently inside the metric's recent window, oldest first")
    @GetMapping("/{metric}/window")
    public ResponseEntity<?> recentValues(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric) {
        try {
            return ResponseEntity.ok(baselineService.recentValues(metric));
        } catch (NoBaselineDataException e) {
            return noData(e.getMessage());
        }
    }

    @Operation(summary = "Export the recent window as a binary snapshot")
    @GetMapping(value = "/{metric}/window/snapshot", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<byte[]> exportWindow(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric) {
        try {
            return ResponseEntity.ok(baselineService.exportWindow(metric));
        } catch (NoBaselineDataException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Replace the recent window from a binary snapshot",
            description = "Seasonal baselines are not affected.")
    @PutMapping(value = "/{metric}/window/snapshot", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<Map<String, Object>> importWindow(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric,
            @RequestBody byte[] snapshot) {
        try {
            int size = baselineService.importWindow(metric, snapshot);
            return ResponseEntity.ok(Map.of("metric", metric, "entries", size));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Drop every baseline and the window of a metric")
    @DeleteMapping("/{metric}")
    public ResponseEntity<Void> reset(
            @Parameter(description = "Metric name", example = "requests_per_ip")
            @PathVariable String metric) {
        if (!baselineService.reset(metric)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    // ── Settings ──

    @Operation(summary = "Get baseline tuning")
    @GetMapping("/settings")
    public ResponseEntity<Map<String, Object>> getSettings() {
        return ResponseEntity.ok(Map.of(
                "sensitivity", baselineService.getSensitivity(),
                "learningRate", baselineService.getLearningRate(),
                "zoneId", baselineService.getZone().getId()
        ));
    }

    @Operation(summary = "Update baseline tuning",
            description = "Changes apply to future updates and thresholds only, and reset on restart.")
    @PutMapping("/settings")
    public ResponseEntity<?> updateSettings(@RequestBody Map<String, Object> body) {
        double sensitivity = toDouble(body, "sensitivity", baselineService.getSensitivity());
        double learningRate = toDouble(body, "learningRate", baselineService.getLearningRate());

        if (sensitivity < 0) return badRequest("sensitivity must be >= 0", "sensitivity");
        if (learningRate <= 0 || learningRate > 1) return badRequest("learningRate must be in (0, 1]", "learningRate");

        baselineService.updateSettings(sensitivity, learningRate);
        return getSettings();
    }

    // ── Helpers ──

    private static long timestampOrNow(Long timestamp) {
        return timestamp == null ? System.currentTimeMillis() : timestamp;
    }

    private ResponseEntity<Map<String, String>> noData(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
