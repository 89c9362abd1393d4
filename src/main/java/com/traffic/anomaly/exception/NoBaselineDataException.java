package com.traffic.anomaly.exception;

import com.traffic.anomaly.model.TimeContext;

public class NoBaselineDataException extends RuntimeException {

    private final TimeContext context;
    private final int bucket;

    public NoBaselineDataException(TimeContext context, int bucket) {
        super("No data for " + context + " bucket " + bucket);
        this.context = context;
        this.bucket = bucket;
    }

    public NoBaselineDataException(String message) {
        super(message);
        this.context = null;
        this.bucket = -1;
    }

    public TimeContext getContext() {
        return context;
    }

    public int getBucket() {
        return bucket;
    }
}
