package com.traffic.anomaly.window;

import com.traffic.anomaly.model.TimestampedValue;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;

/**
 * Time- and/or count-bounded buffer of timestamped values, oldest first.
 *
 * <p>A bound of zero disables it. Timestamps must be non-decreasing: an insert older
 * than the newest retained entry is rejected, so the buffer is always sorted.
 *
 * <p>Not thread-safe. Concurrent writers must serialize access externally.
 */
public class SlidingWindow<T> {

    private final Deque<TimestampedValue<T>> entries = new ArrayDeque<>();
    private long durationMs;
    private int maxElements;

    public SlidingWindow(long durationMs, int maxElements) {
        if (durationMs < 0 || maxElements < 0) {
            throw new IllegalArgumentException("Window bounds must be >= 0");
        }
        this.durationMs = durationMs;
        this.maxElements = maxElements;
    }

    public SlidingWindow(long durationMs) {
        this(durationMs, 0);
    }

    /**
     * Append a value. Equal timestamps are kept in arrival order.
     *
     * @throws IllegalArgumentException if {@code timestamp} is older than the newest entry
     */
    public void add(long timestamp, T value) {
        TimestampedValue<T> last = entries.peekLast();
        if (last != null && timestamp < last.timestamp()) {
            throw new IllegalArgumentException(String.format(
                    "Out-of-order insert: timestamp %d is older than newest entry %d",
                    timestamp, last.timestamp()));
        }
        entries.addLast(new TimestampedValue<>(timestamp, value));
    }

    /**
     * Evict entries older than {@code now - duration}, then trim the oldest entries
     * until the count bound holds.
     */
    public void prune(long now) {
        if (durationMs > 0 && now >= durationMs) {
            long cutoff = now - durationMs;
            while (!entries.isEmpty() && entries.peekFirst().timestamp() < cutoff) {
                entries.pollFirst();
            }
        }
        if (maxElements > 0) {
            while (entries.size() > maxElements) {
                entries.pollFirst();
            }
        }
    }

    public List<T> values() {
        List<T> values = new ArrayList<>(entries.size());
        for (TimestampedValue<T> entry : entries) {
            values.add(entry.value());
        }
        return values;
    }

    public List<TimestampedValue<T>> entries() {
        return new ArrayList<>(entries);
    }

    public OptionalLong newestTimestamp() {
        TimestampedValue<T> last = entries.peekLast();
        return last == null ? OptionalLong.empty() : OptionalLong.of(last.timestamp());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getMaxElements() {
        return maxElements;
    }

    /**
     * Change the bounds. Takes effect on the next {@link #prune(long)}.
     */
    public void reconfigure(long durationMs, int maxElements) {
        if (durationMs < 0 || maxElements < 0) {
            throw new IllegalArgumentException("Window bounds must be >= 0");
        }
        this.durationMs = durationMs;
        this.maxElements = maxElements;
    }

    /**
     * Write {@code int count} followed by {@code count} (long timestamp, value) pairs.
     */
    public void writeTo(DataOutput out, ValueCodec<T> codec) throws IOException {
        out.writeInt(entries.size());
        for (TimestampedValue<T> entry : entries) {
            out.writeLong(entry.timestamp());
            codec.write(out, entry.value());
        }
    }

    /**
     * Replace the current contents with entries read from {@code in}.
     * On failure the window is left unchanged.
     */
    public void readFrom(DataInput in, ValueCodec<T> codec) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new IOException("Negative entry count: " + count);
        }
        Deque<TimestampedValue<T>> loaded = new ArrayDeque<>(Math.min(count, 1024));
        long previous = Long.MIN_VALUE;
        for (int i = 0; i < count; i++) {
            long timestamp = in.readLong();
            if (timestamp < previous) {
                throw new IOException("Serialized entries are not ordered by timestamp at index " + i);
            }
            previous = timestamp;
            loaded.addLast(new TimestampedValue<>(timestamp, codec.read(in)));
        }
        entries.clear();
        entries.addAll(loaded);
    }
}
