package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.HandlingPath;
import me.golemcore.gateway.domain.model.RiskAssessment;
import me.golemcore.gateway.domain.model.RiskLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PathPolicyTest {

    private final PathPolicy policy = new PathPolicy();

    @ParameterizedTest
    @CsvSource({
            "LOW, false, FAST",
            "MEDIUM, false, FAST",
            "HIGH, false, SLOW",
            "LOW, true, SLOW",
            "MEDIUM, true, SLOW",
            "HIGH, true, SLOW"
    })
    void shouldDecidePath(RiskLevel level, boolean selfCheckRequired, HandlingPath expected) {
        RiskAssessment assessment = RiskAssessment.builder()
                .riskLevel(level)
                .selfCheckRequired(selfCheckRequired)
                .build();

        assertEquals(expected, policy.decide(assessment));
    }

    @Test
    void shouldTakeSlowPathWhenLevelMissing() {
        RiskAssessment assessment = RiskAssessment.builder().build();

        assertEquals(HandlingPath.SLOW, policy.decide(assessment));
    }

    @Test
    void shouldRejectNullAssessment() {
        assertThrows(NullPointerException.class, () -> policy.decide(null));
    }
}
