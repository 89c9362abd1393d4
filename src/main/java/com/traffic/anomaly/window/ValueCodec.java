package com.traffic.anomaly.window;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Binary encoding for the values held by a {@link SlidingWindow}.
 * Strings are length-prefixed, everything else is fixed width.
 */
public interface ValueCodec<T> {

    void write(DataOutput out, T value) throws IOException;

    T read(DataInput in) throws IOException;

    /** Longest string {@link #STRING} will read; longer length prefixes are rejected before allocating. */
    int MAX_STRING_BYTES = 1 << 20;

    ValueCodec<String> STRING = new ValueCodec<>() {
        @Override
        public void write(DataOutput out, String value) throws IOException {
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            out.writeInt(bytes.length);
            out.write(bytes);
        }

        @Override
        public String read(DataInput in) throws IOException {
            int length = in.readInt();
            if (length < 0) {
                throw new IOException("Negative string length: " + length);
            }
            if (length > MAX_STRING_BYTES) {
                throw new IOException("String length " + length + " exceeds limit of " + MAX_STRING_BYTES + " bytes");
            }
            byte[] bytes = new byte[length];
            in.readFully(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    ValueCodec<Long> LONG = new ValueCodec<>() {
        @Override
        public void write(DataOutput out, Long value) throws IOException {
            out.writeLong(value);
        }

        @Override
        public Long read(DataInput in) throws IOException {
            return in.readLong();
        }
    };

    ValueCodec<Integer> INTEGER = new ValueCodec<>() {
        @Override
        public void write(DataOutput out, Integer value) throws IOException {
            out.writeInt(value);
        }

        @Override
        public Integer read(DataInput in) throws IOException {
            return in.readInt();
        }
    };

    ValueCodec<Double> DOUBLE = new ValueCodec<>() {
        @Override
        public void write(DataOutput out, Double value) throws IOException {
            out.writeDouble(value);
        }

        @Override
        public Double read(DataInput in) throws IOException {
            return in.readDouble();
        }
    };
}
