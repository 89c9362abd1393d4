package com.traffic.anomaly.client;

/**
 * Single error kind surfaced by {@link MetricsQueryClient}. The {@link FailureReason}
 * tells circuit rejections apart from exhausted retries.
 */
public class MetricsQueryException extends RuntimeException {

    private final FailureReason reason;

    public MetricsQueryException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MetricsQueryException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
