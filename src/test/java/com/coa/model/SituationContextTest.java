package com.coa.model;

import com.coa.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SituationContext and CoaType label parsing.
 */
class SituationContextTest {

    @ParameterizedTest
    @DisplayName("Threat level is normalized into [0,1]")
    @CsvSource({
            "0.85, 0.85",
            "85,   0.85",
            "150,  1.0",
            "-0.2, 0.0",
            "1.0,  1.0",
            "1.01, 1.0",
            "1.49, 1.0",
            "1.5,  0.015"
    })
    void normalizesThreatLevel(double raw, double expected) {
        assertEquals(expected, SituationContext.builder("S").threatLevel(raw).build().threatLevel(), 1e-9);
    }

    @Test
    @DisplayName("Derived fields override attributes with the same name")
    void scalarFields() {
        SituationContext context = SituationContext.builder("S")
                .threatLevel(0.4)
                .axis(new AxisState("AX-1", 120, 80, 0.6))
                .axis(new AxisState("AX-2", 60, 40, null))
                .mission(new MissionProfile("M", "방어", 6, Set.of()))
                .attribute("threatLevel", 0.99)
                .attribute("readiness", "HIGH")
                .build();

        Map<String, Object> fields = context.scalarFields();

        assertEquals(0.4, (Double) fields.get("threatLevel"), 1e-9);
        assertEquals(1.5, (Double) fields.get("forceRatio"), 1e-9);
        assertEquals(0.6, (Double) fields.get("averageMobility"), 1e-9);
        assertEquals(2, fields.get("axisCount"));
        assertEquals("방어", fields.get("missionType"));
        assertEquals("HIGH", fields.get("readiness"));
        assertFalse(fields.containsKey("threatType"));
    }

    @Test
    @DisplayName("Force ratio is unknown without enemy combat power")
    void forceRatioUnknown() {
        assertNull(SituationContext.builder("S").build().forceRatio());
        assertNull(SituationContext.builder("S").axis(new AxisState("AX", 10, 0, null)).build().forceRatio());
    }

    @Test
    @DisplayName("Situation and COA ids are required")
    void idsRequired() {
        assertThrows(InvalidInputException.class, () -> SituationContext.builder(" ").build());
        assertThrows(InvalidInputException.class, () -> Coa.builder("", CoaType.DEFENSE).build());
        assertThrows(InvalidInputException.class, () -> Coa.builder("C", null).build());
    }

    @ParameterizedTest
    @DisplayName("COA type labels resolve in every accepted spelling")
    @CsvSource({
            "DefenseCOA,        DEFENSE",
            "counter_attack,    COUNTER_ATTACK",
            "CounterAttack,     COUNTER_ATTACK",
            "INFORMATION_OPS,   INFORMATION_OPS",
            "information-ops,   INFORMATION_OPS",
            "preemptive,        PREEMPTIVE"
    })
    void coaTypeLabels(String label, CoaType expected) {
        assertEquals(expected, CoaType.fromLabel(label).orElseThrow());
    }

    @Test
    @DisplayName("Unknown COA type labels resolve to empty")
    void unknownCoaTypeLabel() {
        assertTrue(CoaType.fromLabel("Blitz").isEmpty());
        assertTrue(CoaType.fromLabel(null).isEmpty());
    }
}
