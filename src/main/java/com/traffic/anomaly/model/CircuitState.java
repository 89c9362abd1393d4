package com.traffic.anomaly.model;

public enum CircuitState {
    CLOSED,
    OPEN
}
