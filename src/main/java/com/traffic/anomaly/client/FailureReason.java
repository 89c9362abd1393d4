package com.traffic.anomaly.client;

public enum FailureReason {
    /** Rejected without a network attempt because the circuit is open. */
    CIRCUIT_OPEN,
    /** Connect/read timeout, DNS failure, connection refused and similar. */
    TRANSPORT_FAILURE,
    /** The backend answered with a non-2xx status. */
    HTTP_STATUS
}
