package com.traffic.anomaly.baseline;

import com.traffic.anomaly.exception.NoBaselineDataException;
import com.traffic.anomaly.model.Baseline;
import com.traffic.anomaly.model.BaselineCheck;
import com.traffic.anomaly.model.TimeContext;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Seasonal baselines keyed by hour-of-day, day-of-week and week-of-year.
 *
 * <p>Each observation updates one bucket per {@link TimeContext} with an EWMA:
 * <pre>
 *   delta  = value - mean
 *   mean   = mean + alpha * delta
 *   stddev = sqrt((1 - alpha) * stddev^2 + alpha * delta^2)
 * </pre>
 * where {@code delta} is taken against the mean before the update. Confidence ramps
 * linearly to 1.0 over the first {@value #FULL_CONFIDENCE_OBSERVATIONS} observations.
 *
 * <p>Bucket keys depend on the configured {@link ZoneId}; the same timestamp can land
 * in different buckets on deployments with different zones.
 *
 * <p>Not thread-safe. Callers must serialize updates to one model.
 */
public class SeasonalBaselineModel {

    public static final int FULL_CONFIDENCE_OBSERVATIONS = 10;

    private final ZoneId zone;
    private final Map<TimeContext, Map<Integer, Baseline>> buckets = new EnumMap<>(TimeContext.class);
    private volatile double sensitivity;
    private volatile double learningRate;

    public SeasonalBaselineModel(double sensitivity, double learningRate, ZoneId zone) {
        validateLearningRate(learningRate);
        this.sensitivity = sensitivity;
        this.learningRate = learningRate;
        this.zone = zone;
        for (TimeContext context : TimeContext.values()) {
            buckets.put(context, new HashMap<>());
        }
    }

    public void addObservation(double value, long timestampMs) {
        ZonedDateTime time = toZoned(timestampMs);
        double alpha = learningRate;
        for (TimeContext context : TimeContext.values()) {
            Baseline baseline = buckets.get(context).computeIfAbsent(bucketKey(time, context), k -> new Baseline());
            update(baseline, value, alpha);
        }
    }

    /**
     * Copy of the bucket matching {@code timestampMs} under {@code context}, or empty if
     * that bucket has never been observed.
     */
    public Optional<Baseline> getBaseline(long timestampMs, TimeContext context) {
        Baseline baseline = buckets.get(context).get(bucketKey(timestampMs, context));
        return Optional.ofNullable(baseline).map(b -> b.toBuilder().build());
    }

    /**
     * @throws NoBaselineDataException if the bucket has never been observed
     */
    public double getThreshold(long timestampMs, TimeContext context) {
        Baseline baseline = require(timestampMs, context);
        return baseline.getMean() + sensitivity * baseline.getStddev();
    }

    /**
     * @throws NoBaselineDataException if the bucket has never been observed
     */
    public double getConfidence(long timestampMs, TimeContext context) {
        return require(timestampMs, context).getConfidence();
    }

    /**
     * Compare {@code value} against the threshold of its bucket.
     *
     * @throws NoBaselineDataException if the bucket has never been observed
     */
    public BaselineCheck check(String metric, double value, long timestampMs, TimeContext context) {
        Baseline baseline = require(timestampMs, context);
        double threshold = baseline.getMean() + sensitivity * baseline.getStddev();
        return BaselineCheck.builder()
                .metric(metric)
                .value(value)
                .threshold(threshold)
                .confidence(baseline.getConfidence())
                .breached(value > threshold)
                .context(context)
                .bucket(bucketKey(timestampMs, context))
                .build();
    }

    public int bucketKey(long timestampMs, TimeContext context) {
        return bucketKey(toZoned(timestampMs), context);
    }

    public void reset() {
        buckets.values().forEach(Map::clear);
    }

    public double getSensitivity() {
        return sensitivity;
    }

    /** Applies to thresholds computed from now on; stored baselines are untouched. */
    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public double getLearningRate() {
        return learningRate;
    }

    /** Applies to future updates only. */
    public void setLearningRate(double learningRate) {
        validateLearningRate(learningRate);
        this.learningRate = learningRate;
    }

    public ZoneId getZone() {
        return zone;
    }

    private Baseline require(long timestampMs, TimeContext context) {
        int key = bucketKey(timestampMs, context);
        Baseline baseline = buckets.get(context).get(key);
        if (baseline == null) {
            throw new NoBaselineDataException(context, key);
        }
        return baseline;
    }

    private static void update(Baseline baseline, double value, double alpha) {
        double delta = value - baseline.getMean();
        baseline.setMean(baseline.getMean() + alpha * delta);
        double variance = (1 - alpha) * baseline.getStddev() * baseline.getStddev() + alpha * delta * delta;
        baseline.setStddev(Math.sqrt(variance));
        baseline.setCount(baseline.getCount() + 1);
        baseline.setConfidence(Math.min(1.0, baseline.getCount() / (double) FULL_CONFIDENCE_OBSERVATIONS));
    }

    private ZonedDateTime toZoned(long timestampMs) {
        return Instant.ofEpochMilli(timestampMs).atZone(zone);
    }

    private static int bucketKey(ZonedDateTime time, TimeContext context) {
        return switch (context) {
            case HOURLY -> time.getHour();
            // ISO Monday=1..Sunday=7 -> Sunday=0..Saturday=6
            case DAILY -> time.getDayOfWeek().getValue() % 7;
            case WEEKLY -> (time.getDayOfYear() - 1) / 7;
        };
    }

    private static void validateLearningRate(double learningRate) {
        if (learningRate <= 0 || learningRate > 1) {
            throw new IllegalArgumentException("learningRate must be in (0, 1], got " + learningRate);
        }
    }
}
