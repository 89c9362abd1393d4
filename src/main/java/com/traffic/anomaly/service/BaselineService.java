package com.traffic.anomaly.service;

import com.traffic.anomaly.baseline.SeasonalBaselineModel;
import com.traffic.anomaly.config.BaselineConfig;
import com.traffic.anomaly.config.MetricsConfig;
import com.traffic.anomaly.exception.NoBaselineDataException;
import com.traffic.anomaly.model.Baseline;
import com.traffic.anomaly.model.BaselineCheck;
import com.traffic.anomaly.model.BaselineSnapshot;
import com.traffic.anomaly.model.TimeContext;
import com.traffic.anomaly.window.SlidingWindow;
import com.traffic.anomaly.window.ValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local statistics per named metric: a seasonal baseline model plus a window of recent
 * observations. Every update to one metric runs under that metric's lock.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final BaselineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, MetricState> metrics = new ConcurrentHashMap<>();

    private volatile double sensitivity;
    private volatile double learningRate;

    @Autowired
    public BaselineService(BaselineConfig config, MetricsConfig metricsConfig) {
        this(config, metricsConfig, Clock.systemUTC());
    }

    public BaselineService(BaselineConfig config, MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.zone = config.resolveZone();
        this.sensitivity = config.getSensitivity();
        this.learningRate = config.getLearningRate();
        log.info("Seasonal baselines use calendar zone {} (sensitivity={}, learningRate={})",
                zone, sensitivity, learningRate);
    }

    private static final class MetricState {
        final SeasonalBaselineModel model;
        final SlidingWindow<Double> window;

        MetricState(SeasonalBaselineModel model, SlidingWindow<Double> window) {
            this.model = model;
            this.window = window;
        }
    }

    public void recordObservation(String metric, double value, long timestampMs) {
        MetricState state = metrics.computeIfAbsent(metric, this::newState);
        synchronized (state) {
            state.model.addObservation(value, timestampMs);

            OptionalLong newest = state.window.newestTimestamp();
            if (newest.isEmpty() || timestampMs >= newest.getAsLong()) {
                state.window.add(timestampMs, value);
                state.window.prune(timestampMs);
            } else {
                log.debug("Observation for {} at {} is older than the recent window, baseline only",
                        metric, timestampMs);
            }
        }
        metricsConfig.recordBaselineObservation(metric);
    }

    public Optional<Baseline> getBaseline(String metric, long timestampMs, TimeContext context) {
        MetricState state = metrics.get(metric);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return state.model.getBaseline(timestampMs, context);
        }
    }

    /**
     * Baseline and threshold of one bucket, read under a single lock so both describe
     * the same state.
     *
     * @return empty if the metric or the bucket has no observations
     */
    public Optional<BaselineSnapshot> describe(String metric, long timestampMs, TimeContext context) {
        MetricState state = metrics.get(metric);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return state.model.getBaseline(timestampMs, context).map(baseline -> BaselineSnapshot.builder()
                    .metric(metric)
                    .context(context)
                    .bucket(state.model.bucketKey(timestampMs, context))
                    .baseline(baseline)
                    .threshold(baseline.getMean() + state.model.getSensitivity() * baseline.getStddev())
                    .confidence(baseline.getConfidence())
                    .build());
        }
    }

    public double getThreshold(String metric, long timestampMs, TimeContext context) {
        MetricState state = require(metric);
        synchronized (state) {
            return state.model.getThreshold(timestampMs, context);
        }
    }

    public double getConfidence(String metric, long timestampMs, TimeContext context) {
        MetricState state = require(metric);
        synchronized (state) {
            return state.model.getConfidence(timestampMs, context);
        }
    }

    public BaselineCheck check(String metric, double value, long timestampMs, TimeContext context) {
        MetricState state = require(metric);
        synchronized (state) {
            return state.model.check(metric, value, timestampMs, context);
        }
    }

    /**
     * Values observed for {@code metric} that are still inside the window, oldest first.
     */
    public List<Double> recentValues(String metric) {
        MetricState state = require(metric);
        synchronized (state) {
            state.window.prune(clock.millis());
            return state.window.values();
        }
    }

    public byte[] exportWindow(String metric) {
        MetricState state = require(metric);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            synchronized (state) {
                state.window.writeTo(out, ValueCodec.DOUBLE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize window for " + metric, e);
        }
        return bytes.toByteArray();
    }

    /**
     * Replace the recent-observation window of {@code metric} with a serialized snapshot,
     * pruned to the configured bounds. The seasonal baselines are not touched.
     *
     * @throws IllegalArgumentException if the snapshot is malformed
     */
    public int importWindow(String metric, byte[] snapshot) {
        MetricState state = metrics.computeIfAbsent(metric, this::newState);
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(snapshot))) {
            synchronized (state) {
                state.window.readFrom(in, ValueCodec.DOUBLE);
                state.window.prune(clock.millis());
                return state.window.size();
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed window snapshot for " + metric + ": " + e.getMessage(), e);
        }
    }

    public boolean reset(String metric) {
        return metrics.remove(metric) != null;
    }

    public Set<String> getMetricNames() {
        return new TreeSet<>(metrics.keySet());
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Apply new tuning to every metric. Existing baselines are kept as they are; only
     * later thresholds and updates see the new values.
     */
    public void updateSettings(double sensitivity, double learningRate) {
        if (learningRate <= 0 || learningRate > 1) {
            throw new IllegalArgumentException("learningRate must be in (0, 1]");
        }
        if (sensitivity < 0) {
            throw new IllegalArgumentException("sensitivity must be >= 0");
        }
        this.sensitivity = sensitivity;
        this.learningRate = learningRate;
        for (MetricState state : metrics.values()) {
            synchronized (state) {
                state.model.setSensitivity(sensitivity);
                state.model.setLearningRate(learningRate);
            }
        }
        log.info("Baseline settings updated: sensitivity={}, learningRate={}", sensitivity, learningRate);
    }

    private MetricState require(String metric) {
        MetricState state = metrics.get(metric);
        if (state == null) {
            throw new NoBaselineDataException("No observations for metric " + metric);
        }
        return state;
    }

    private MetricState newState(String metric) {
        log.info("Tracking baselines for new metric {}", metric);
        return new MetricState(
                new SeasonalBaselineModel(sensitivity, learningRate, zone),
                new SlidingWindow<>(config.getWindowDuration().toMillis(), config.getWindowMaxElements()));
    }
}
