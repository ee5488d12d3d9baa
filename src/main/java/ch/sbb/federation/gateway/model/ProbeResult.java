package ch.sbb.federation.gateway.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one health probe against a subgraph.
 */
public record ProbeResult(boolean success, Duration latency, String errorMessage, Instant checkedAt) {

    public static ProbeResult success(Duration latency) {
        return new ProbeResult(true, latency, null, Instant.now());
    }

    public static ProbeResult failure(String errorMessage) {
        return new ProbeResult(false, null, errorMessage, Instant.now());
    }
}
