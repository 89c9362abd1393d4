package com.traffic.anomaly.model;

public record TimestampedValue<T>(long timestamp, T value) {}
