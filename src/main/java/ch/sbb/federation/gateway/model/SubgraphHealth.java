package ch.sbb.federation.gateway.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Operational state of a subgraph as seen by the health monitor.
 *
 * <p>Immutable record; {@link #next(ProbeResult, Duration, int, int)} computes the
 * successor state for a probe outcome.</p>
 */
public record SubgraphHealth(
    HealthStatus status,
    Instant lastCheck,
    Duration latency,
    String errorMessage,
    int consecutiveFailures,
    int consecutiveBadProbes
) {

    /**
     * Health status enumeration.
     */
    public enum HealthStatus {
        HEALTHY,
        DEGRADED,
        DOWN
    }

    /**
     * State of a subgraph that has not been probed yet. Subgraphs are trusted until a
     * probe says otherwise.
     */
    public static SubgraphHealth initial() {
        return new SubgraphHealth(HealthStatus.HEALTHY, null, null, null, 0, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HealthStatus status = HealthStatus.HEALTHY;
        private Instant lastCheck = Instant.now();
        private Duration latency;
        private String errorMessage;
        private int consecutiveFailures = 0;
        private int consecutiveBadProbes = 0;

        public Builder status(HealthStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastCheck(Instant lastCheck) {
            this.lastCheck = lastCheck;
            return this;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder consecutiveBadProbes(int consecutiveBadProbes) {
            this.consecutiveBadProbes = consecutiveBadProbes;
            return this;
        }

        public SubgraphHealth build() {
            return new SubgraphHealth(status, lastCheck, latency, errorMessage,
                consecutiveFailures, consecutiveBadProbes);
        }
    }

    /**
     * Apply a probe result.
     *
     * <ul>
     *   <li>a fast success always returns to {@code HEALTHY};</li>
     *   <li>any success while {@code DOWN} returns straight to {@code HEALTHY};</li>
     *   <li>{@code HEALTHY -> DEGRADED} after {@code degradedAfter} consecutive slow or failed probes;</li>
     *   <li>{@code DEGRADED -> DOWN} after {@code downAfter} further consecutive failures.</li>
     * </ul>
     *
     * @param probe the probe outcome
     * @param slowThreshold latency above which a successful probe counts as slow
     * @param degradedAfter bad probes before degrading
     * @param downAfter failures while degraded before going down
     * @return the new state
     */
    public SubgraphHealth next(ProbeResult probe, Duration slowThreshold, int degradedAfter, int downAfter) {
        Builder next = builder()
            .lastCheck(probe.checkedAt())
            .latency(probe.latency())
            .errorMessage(probe.errorMessage());

        if (probe.success()) {
            boolean slow = probe.latency() != null && probe.latency().compareTo(slowThreshold) > 0;
            if (!slow || status == HealthStatus.DOWN) {
                return next.status(HealthStatus.HEALTHY).build();
            }
            int badProbes = consecutiveBadProbes + 1;
            HealthStatus newStatus = status == HealthStatus.HEALTHY && badProbes >= degradedAfter
                ? HealthStatus.DEGRADED : status;
            return next.status(newStatus)
                .consecutiveBadProbes(badProbes)
                .consecutiveFailures(0)
                .build();
        }

        int badProbes = consecutiveBadProbes + 1;
        return switch (status) {
            case HEALTHY -> badProbes >= degradedAfter
                ? next.status(HealthStatus.DEGRADED).consecutiveBadProbes(badProbes).consecutiveFailures(0).build()
                : next.status(HealthStatus.HEALTHY).consecutiveBadProbes(badProbes)
                    .consecutiveFailures(consecutiveFailures + 1).build();
            case DEGRADED -> {
                int failures = consecutiveFailures + 1;
                yield next.status(failures >= downAfter ? HealthStatus.DOWN : HealthStatus.DEGRADED)
                    .consecutiveBadProbes(badProbes)
                    .consecutiveFailures(failures)
                    .build();
            }
            case DOWN -> next.status(HealthStatus.DOWN)
                .consecutiveBadProbes(badProbes)
                .consecutiveFailures(consecutiveFailures + 1)
                .build();
        };
    }

    public boolean isDown() {
        return status == HealthStatus.DOWN;
    }
}
