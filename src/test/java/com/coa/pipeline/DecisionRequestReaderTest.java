package com.coa.pipeline;

import com.coa.diagnostics.DiagnosticType;
import com.coa.exception.InvalidInputException;
import com.coa.model.Coa;
import com.coa.model.CoaType;
import com.coa.model.Constraint;
import com.coa.model.SituationContext;
import com.coa.resource.PriorityTier;
import com.coa.resource.ResourceRequirement;
import com.coa.rule.ExpressionRuleEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DecisionRequestReader.
 */
class DecisionRequestReaderTest {

    private DecisionRequestReader reader;

    @BeforeEach
    void setUp() {
        reader = new DecisionRequestReader();
    }

    // =====================================================================
    // Reading
    // =====================================================================

    @Test
    @DisplayName("Should read the bundled demo request")
    void readDemoRequest() throws IOException {
        DecisionRequest request = reader.read(demoJson());
        SituationContext situation = request.situation();

        assertEquals("SIT-DEMO-01", situation.situationId());
        assertEquals(0.85, situation.threatLevel(), 1e-9);
        assertEquals("포격", situation.dominantThreatType());
        assertEquals("방어", situation.missionType());
        assertEquals(8, situation.mission().priority());
        assertEquals(2, situation.axisCount());
        assertEquals(3, situation.availableResources().size());
        assertEquals(1, situation.civilianAreas().size());
        assertTrue(situation.civilianAreas().get(0).hasCriticalFacilities());

        Constraint constraint = situation.constraints().get(0);
        assertTrue(constraint.timeCritical());
        assertEquals(40.0, constraint.maxDurationHours(), 1e-9);
        assertEquals(4, constraint.importance());

        assertEquals(5, request.candidates().size());
        Coa defense = request.candidates().get(0);
        assertEquals("COA-D1", defense.id());
        assertEquals(CoaType.DEFENSE, defense.type());
        assertEquals(List.of(PriorityTier.REQUIRED, PriorityTier.RECOMMENDED),
                defense.requiredResources().stream().map(ResourceRequirement::tier).toList());
        assertEquals(150.0, defense.requiredCombatPower(), 1e-9);
        assertNull(defense.requiredMobility());
        assertFalse(request.candidates().get(4).hasKnownDuration());
        assertTrue(request.warnings().isEmpty());
    }

    @Test
    @DisplayName("Percent threat levels and array resources are accepted")
    void percentThreatAndResourceArray() {
        DecisionRequest request = reader.read("""
                {"situation": {"id": "S1", "threatLevel": 70, "attributes": {"readiness": "HIGH"}},
                 "candidates": [{"id": "C1", "type": "counter_attack", "resources": ["포병대대(필수)", "전차"]}]}
                """);

        assertEquals(0.7, request.situation().threatLevel(), 1e-9);
        assertEquals("HIGH", request.situation().attributes().get("readiness"));
        Coa coa = request.candidates().get(0);
        assertEquals(CoaType.COUNTER_ATTACK, coa.type());
        assertEquals(1, coa.requiredResources().size());
        assertEquals(1, request.warnings().size());
        assertEquals(DiagnosticType.PARSE, request.warnings().get(0).type());
    }

    @Test
    @DisplayName("Missing candidates yield an empty list")
    void noCandidates() {
        DecisionRequest request = reader.read("{\"situation\": {\"id\": \"S1\"}}");

        assertTrue(request.candidates().isEmpty());
    }

    @Test
    @DisplayName("Invalid requests are rejected")
    void rejectsInvalidRequests() {
        assertThrows(InvalidInputException.class, () -> reader.read(" "));
        assertThrows(InvalidInputException.class, () -> reader.read("{not json"));
        assertThrows(InvalidInputException.class, () -> reader.read("[]"));
        assertThrows(InvalidInputException.class, () -> reader.read("{\"candidates\": []}"));
        assertThrows(InvalidInputException.class, () -> reader.read("{\"situation\": {\"threatLevel\": 0.5}}"));
    }

    @Test
    @DisplayName("Candidates without an id or with an unknown type are rejected")
    void rejectsInvalidCandidates() {
        InvalidInputException missingId = assertThrows(InvalidInputException.class, () -> reader.read(
                "{\"situation\": {\"id\": \"S1\"}, \"candidates\": [{\"type\": \"Defense\"}]}"));
        InvalidInputException unknownType = assertThrows(InvalidInputException.class, () -> reader.read(
                "{\"situation\": {\"id\": \"S1\"}, \"candidates\": [{\"id\": \"C1\", \"type\": \"Blitz\"}]}"));

        assertTrue(missingId.getMessage().contains("id"));
        assertTrue(unknownType.getMessage().contains("Blitz"));
    }

    @Test
    @DisplayName("Unknown restricted COA types are dropped with a DATA_GAP warning")
    void unknownRestrictedType() {
        DecisionRequest request = reader.read("""
                {"situation": {"id": "S1", "constraints": [
                    {"id": "ROE-1", "importance": 4, "restrictedCoaTypes": ["preemptive", "Blitz"]}]},
                 "candidates": [{"id": "C1", "type": "Defense"}]}
                """);

        Constraint constraint = request.situation().constraints().get(0);
        assertEquals(Set.of(CoaType.PREEMPTIVE), constraint.restrictedCoaTypes());
        assertEquals(1, request.candidates().size());
        assertEquals(1, request.warnings().size());
        assertEquals(DiagnosticType.DATA_GAP, request.warnings().get(0).type());
        assertTrue(request.warnings().get(0).message().contains("Blitz"));
    }

    // =====================================================================
    // Writing
    // =====================================================================

    @Test
    @DisplayName("Ranked demo request renders as JSON")
    void writeResult() throws IOException {
        DecisionPipeline pipeline = new DecisionPipeline(
                ScoringSnapshot.load("classpath:relevance.yaml", "classpath:coa-scoring.yaml"),
                new ExpressionRuleEngine("classpath:rules/defense-rules.yaml"));
        try {
            DecisionResult result = pipeline.rank(reader.read(demoJson()));
            String json = reader.write(result);

            assertEquals("high-threat-defense", result.appliedRule().ruleName());
            assertEquals(5, result.rankings().size());
            assertFalse(result.top().orElseThrow().excluded());
            assertTrue(json.contains("\"situationId\" : \"SIT-DEMO-01\""));
            assertTrue(json.contains("COA-D1"));
            assertTrue(json.contains("\"state\" : \"RANKED\""));
        } finally {
            pipeline.shutdown();
        }
    }

    private static String demoJson() throws IOException {
        return new ClassPathResource("demo-request.json").getContentAsString(StandardCharsets.UTF_8);
    }
}
