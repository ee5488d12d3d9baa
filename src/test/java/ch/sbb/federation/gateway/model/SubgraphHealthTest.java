package ch.sbb.federation.gateway.model;

import ch.sbb.federation.gateway.model.SubgraphHealth.HealthStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SubgraphHealthTest {

    private static final Duration SLOW = Duration.ofMillis(500);

    @Test
    void singleFailureKeepsSubgraphHealthy() {
        SubgraphHealth health = apply(SubgraphHealth.initial(), failure());

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.consecutiveBadProbes()).isEqualTo(1);
        assertThat(health.errorMessage()).isEqualTo("Connection refused");
    }

    @Test
    void degradesAfterTwoBadProbesAndGoesDownAfterThreeMoreFailures() {
        SubgraphHealth health = SubgraphHealth.initial();
        health = apply(health, failure());
        health = apply(health, failure());
        assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);

        health = apply(health, failure());
        health = apply(health, failure());
        assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);

        health = apply(health, failure());
        assertThat(health.status()).isEqualTo(HealthStatus.DOWN);
        assertThat(health.isDown()).isTrue();
    }

    @Test
    void slowProbesDegrade() {
        SubgraphHealth health = SubgraphHealth.initial();
        health = apply(health, ProbeResult.success(Duration.ofMillis(800)));
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);

        health = apply(health, ProbeResult.success(Duration.ofMillis(900)));
        assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void fastSuccessRestoresHealthyFromDegraded() {
        SubgraphHealth degraded = apply(apply(SubgraphHealth.initial(), failure()), failure());

        SubgraphHealth health = apply(degraded, ProbeResult.success(Duration.ofMillis(20)));

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.consecutiveBadProbes()).isZero();
        assertThat(health.consecutiveFailures()).isZero();
    }

    @Test
    void anySuccessRestoresHealthyFromDown() {
        SubgraphHealth down = SubgraphHealth.builder()
            .status(HealthStatus.DOWN)
            .consecutiveFailures(3)
            .consecutiveBadProbes(5)
            .build();

        SubgraphHealth health = apply(down, ProbeResult.success(Duration.ofSeconds(1)));

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void staysDownWhileFailing() {
        SubgraphHealth down = SubgraphHealth.builder().status(HealthStatus.DOWN).consecutiveFailures(3).build();

        SubgraphHealth health = apply(down, failure());

        assertThat(health.status()).isEqualTo(HealthStatus.DOWN);
        assertThat(health.consecutiveFailures()).isEqualTo(4);
    }

    private static SubgraphHealth apply(SubgraphHealth health, ProbeResult probe) {
        return health.next(probe, SLOW, 2, 3);
    }

    private static ProbeResult failure() {
        return ProbeResult.failure("Connection refused");
    }
}
