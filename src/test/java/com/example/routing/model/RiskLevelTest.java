package com.example.routing.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RiskLevelTest {

    @ParameterizedTest
    @CsvSource({
        "low,      medium,   low",
        "medium,   high,     low",
        "high,     critical, medium",
        "critical, critical, high",
    })
    void elevateAndReduceStayOnTheScale(String level, String elevated, String reduced) {
        RiskLevel risk = RiskLevel.fromString(level);

        assertEquals(RiskLevel.fromString(elevated), risk.elevate());
        assertEquals(RiskLevel.fromString(reduced), risk.reduce());
    }

    @Test
    void lowCannotBeReduced() {
        assertEquals(RiskLevel.LOW, RiskLevel.LOW.reduce());
    }

    @Test
    void ordering() {
        assertTrue(RiskLevel.HIGH.atLeast(RiskLevel.HIGH));
        assertTrue(RiskLevel.CRITICAL.atLeast(RiskLevel.HIGH));
        assertFalse(RiskLevel.MEDIUM.atLeast(RiskLevel.HIGH));
        assertEquals(RiskLevel.HIGH, RiskLevel.max(RiskLevel.LOW, RiskLevel.HIGH));
    }

    @Test
    void lenientParsingDefaultsToMedium() {
        assertEquals(RiskLevel.HIGH, RiskLevel.fromString(" HIGH "));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromString("bogus"));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromString(null));
    }

    @Test
    void baseScores() {
        assertEquals(0.25, RiskLevel.LOW.baseScore());
        assertEquals(1.0, RiskLevel.CRITICAL.baseScore());
    }
}
