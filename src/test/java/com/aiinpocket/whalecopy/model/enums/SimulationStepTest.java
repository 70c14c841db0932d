package com.aiinpocket.whalecopy.model.enums;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationStepTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void stepGrowsWithSpan() {
        assertThat(SimulationStep.forSpan(T0, T0)).isEqualTo(SimulationStep.ONE_MINUTE);
        assertThat(SimulationStep.forSpan(T0, T0.plus(Duration.ofDays(30)))).isEqualTo(SimulationStep.ONE_MINUTE);
        assertThat(SimulationStep.forSpan(T0, T0.plus(Duration.ofDays(31)))).isEqualTo(SimulationStep.FIVE_MINUTES);
        assertThat(SimulationStep.forSpan(T0, T0.plus(Duration.ofDays(365)))).isEqualTo(SimulationStep.FIVE_MINUTES);
        assertThat(SimulationStep.forSpan(T0, T0.plus(Duration.ofDays(400)))).isEqualTo(SimulationStep.FIFTEEN_MINUTES);
    }

    @Test
    void truncatesToStepBoundary() {
        Instant ts = Instant.parse("2024-01-01T10:17:42.500Z");

        assertThat(SimulationStep.ONE_MINUTE.truncate(ts)).isEqualTo(Instant.parse("2024-01-01T10:17:00Z"));
        assertThat(SimulationStep.FIVE_MINUTES.truncate(ts)).isEqualTo(Instant.parse("2024-01-01T10:15:00Z"));
        assertThat(SimulationStep.FIFTEEN_MINUTES.truncate(ts)).isEqualTo(Instant.parse("2024-01-01T10:15:00Z"));
    }
}
