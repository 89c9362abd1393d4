package com.traffic.anomaly.model;

/**
 * Calendar granularity a seasonal baseline is keyed on.
 */
public enum TimeContext {
    /** Hour of day, 0-23. */
    HOURLY(24),
    /** Day of week, 0 (Sunday) - 6 (Saturday). */
    DAILY(7),
    /** Week of year, (day-of-year - 1) / 7, 0-52. */
    WEEKLY(53);

    private final int bucketCount;

    TimeContext(int bucketCount) {
        this.bucketCount = bucketCount;
    }

    public int getBucketCount() {
        return bucketCount;
    }
}
