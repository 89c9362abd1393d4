package com.traffic.anomaly.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traffic.anomaly.model.AnomalyVerdict;

/**
 * Extracts the first sample value from a Prometheus instant-query response:
 * <pre>{"status":"success","data":{"result":[{"value":[&lt;unixSeconds&gt;, "&lt;number&gt;"]}]}}</pre>
 */
class QueryResultParser {

    private final ObjectMapper objectMapper;

    QueryResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Either a value or, on any deviation from the expected envelope, the verdict
     * details describing why there is none.
     */
    record Sample(double value, String error) {

        static Sample of(double value) {
            return new Sample(value, null);
        }

        static Sample failed(String error) {
            return new Sample(0.0, error);
        }

        boolean ok() {
            return error == null;
        }
    }

    Sample parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return Sample.failed(AnomalyVerdict.PARSE_ERROR_PREFIX + e.getOriginalMessage());
        }
        if (root == null || !"success".equals(root.path("status").asText(null))) {
            return Sample.failed(AnomalyVerdict.DETAILS_BACKEND_ERROR);
        }

        JsonNode result = root.path("data").path("result");
        if (!result.isArray() || result.isEmpty()) {
            return Sample.failed(AnomalyVerdict.DETAILS_NO_DATA);
        }
        JsonNode pair = result.get(0).path("value");
        if (!pair.isArray() || pair.size() != 2) {
            return Sample.failed(AnomalyVerdict.DETAILS_NO_DATA);
        }

        JsonNode raw = pair.get(1);
        if (!raw.isTextual()) {
            return Sample.failed(AnomalyVerdict.PARSE_ERROR_PREFIX + "sample value is not a string: " + raw);
        }
        try {
            return Sample.of(parseSampleValue(raw.asText()));
        } catch (NumberFormatException e) {
            return Sample.failed(AnomalyVerdict.PARSE_ERROR_PREFIX + e.getMessage());
        }
    }

    // Prometheus renders infinities as +Inf / -Inf
    private static double parseSampleValue(String text) {
        return switch (text) {
            case "+Inf", "Inf" -> Double.POSITIVE_INFINITY;
            case "-Inf" -> Double.NEGATIVE_INFINITY;
            case "NaN" -> Double.NaN;
            default -> Double.parseDouble(text.trim());
        };
    }
}
