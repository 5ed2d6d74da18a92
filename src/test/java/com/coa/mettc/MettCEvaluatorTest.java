package com.coa.mettc;

import com.coa.config.ScoringConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.model.AxisState;
import com.coa.model.CivilianArea;
import com.coa.model.Coa;
import com.coa.model.CoaType;
import com.coa.model.Constraint;
import com.coa.model.MissionProfile;
import com.coa.model.SituationContext;
import com.coa.resource.AvailableResource;
import com.coa.resource.ResourcePriorityParser;
import com.coa.resource.ResourceRequirement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MettCEvaluator.
 */
class MettCEvaluatorTest {

    private MettCEvaluator evaluator;
    private List<Diagnostic> warnings;

    @BeforeEach
    void setUp() {
        evaluator = new MettCEvaluator(new ResourcePriorityParser(), ScoringConfig.defaults());
        warnings = new ArrayList<>();
    }

    // =====================================================================
    // Civilian
    // =====================================================================

    @Test
    @DisplayName("High-priority area on the impact cells drops civilian below the exclusion threshold")
    void civilianPenaltyOnIntersection() {
        Coa coa = Coa.builder("COA-1", CoaType.OFFENSIVE).impactTerrainCells("C-1", "C-2").build();
        SituationContext context = SituationContext.builder("SIT-1")
                .civilianArea(new CivilianArea("CIV-1", 0.8, 500, Set.of("C-2")))
                .build();

        double civilian = evaluator.evaluateCivilian(coa, context, warnings);

        // density factor 0.9 + 0.1 * 0.5
        assertEquals(1.0 - 0.8 * 0.95, civilian, 1e-9);
        assertTrue(civilian < ScoringConfig.defaults().civilian().exclusionThreshold());
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("Penalties multiply across areas and critical facilities use the full priority")
    void civilianPenaltiesMultiply() {
        Coa coa = Coa.builder("COA-1", CoaType.DEFENSE).impactTerrainCells("C-1", "C-2").build();
        SituationContext context = SituationContext.builder("SIT-1")
                .civilianArea(new CivilianArea("CIV-1", "Hospital district", 0.5, 0, Set.of("C-1"), List.of("병원")))
                .civilianArea(new CivilianArea("CIV-2", 0.2, 2000, Set.of("C-2")))
                .civilianArea(new CivilianArea("CIV-3", 1.0, 2000, Set.of("C-9")))
                .build();

        assertEquals((1.0 - 0.5) * (1.0 - 0.2), evaluator.evaluateCivilian(coa, context, warnings), 1e-9);
    }

    @Test
    @DisplayName("No civilian areas scores 1.0 with a DATA_GAP warning")
    void civilianUnknown() {
        Coa coa = Coa.builder("COA-1", CoaType.DEFENSE).impactTerrainCells("C-1").build();

        assertEquals(1.0, evaluator.evaluateCivilian(coa, SituationContext.builder("SIT-1").build(), warnings));
        assertEquals("civilian data unknown", warnings.get(0).code());
    }

    // =====================================================================
    // Time
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Duration against a budget")
    @CsvSource({
            "30, true,  20, 0.0",
            "30, false, 20, 0.5",
            "50, false, 20, 0.0",
            "20, true,  20, 1.0",
            "10, false, 20, 1.0"
    })
    void timeBudget(double duration, boolean timeCritical, double max, double expected) {
        Coa coa = Coa.builder("COA-1", CoaType.DEFENSE).estimatedDurationHours(duration).build();
        SituationContext context = SituationContext.builder("SIT-1")
                .constraint(Constraint.time("T-1", timeCritical, max))
                .build();

        assertEquals(expected, evaluator.evaluateTime(coa, context, warnings), 1e-9);
    }

    @Test
    @DisplayName("No duration budget scores 1.0")
    void timeWithoutBudget() {
        Coa coa = Coa.builder("COA-1", CoaType.OFFENSIVE).estimatedDurationHours(100).build();

        assertEquals(1.0, evaluator.evaluateTime(coa, SituationContext.builder("SIT-1").build(), warnings));
    }

    @Test
    @DisplayName("Unknown duration is estimated from the type default and axis count")
    void unknownDurationEstimate() {
        Coa coa = Coa.builder("COA-1", CoaType.DETERRENCE).build();
        SituationContext context = SituationContext.builder("SIT-1")
                .axis(new AxisState("AX-1", 100, 100, 0.5))
                .axis(new AxisState("AX-2", 100, 100, 0.5))
                .constraint(Constraint.time("T-1", true, 7))
                .build();

        assertEquals(7.2, MettCEvaluator.effectiveDuration(coa, context, new ArrayList<>()), 1e-9);
        assertEquals(0.0, evaluator.evaluateTime(coa, context, warnings));
        assertEquals("duration unknown", warnings.get(0).code());
    }

    // =====================================================================
    // Enemy, terrain, mission, troops
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Enemy score scales threat level by force ratio")
    @CsvSource({
            "150, 100, 0.85",
            "50,  100, 0.68",
            "100, 0,   0.85"
    })
    void enemyScore(double friendly, double enemy, double expected) {
        SituationContext context = SituationContext.builder("SIT-1")
                .threatLevel(0.85)
                .axis(new AxisState("AX-1", friendly, enemy, 0.5))
                .build();

        assertEquals(expected, evaluator.evaluateEnemy(context, warnings), 1e-9);
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("Enemy score without axes uses a neutral force ratio")
    void enemyWithoutAxes() {
        SituationContext context = SituationContext.builder("SIT-1").threatLevel(85).build();

        assertEquals(0.85 * 0.8, evaluator.evaluateEnemy(context, warnings), 1e-9);
        assertEquals("force ratio unknown", warnings.get(0).code());
    }

    @Test
    @DisplayName("Terrain adds compatible bonuses and subtracts incompatible penalties")
    void terrainFit() {
        SituationContext context = SituationContext.builder("SIT-1").terrainTags(Set.of("산악", "하천", "도시")).build();
        Coa mixed = Coa.builder("COA-1", CoaType.MANEUVER)
                .compatibleTerrain("산악").incompatibleTerrain("하천").build();
        Coa suited = Coa.builder("COA-2", CoaType.DEFENSE).compatibleTerrain("산악", "도시").build();
        Coa undeclared = Coa.builder("COA-3", CoaType.DEFENSE).build();

        assertEquals(0.45, evaluator.evaluateTerrain(mixed, context, warnings), 1e-9);
        assertEquals(0.7, evaluator.evaluateTerrain(suited, context, warnings), 1e-9);
        assertEquals(0.5, evaluator.evaluateTerrain(undeclared, context, warnings), 1e-9);
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("Declared terrain fit without situation tags falls back to the base score")
    void terrainUnknown() {
        Coa coa = Coa.builder("COA-1", CoaType.MANEUVER).compatibleTerrain("산악").build();

        assertEquals(0.5, evaluator.evaluateTerrain(coa, SituationContext.builder("SIT-1").build(), warnings), 1e-9);
        assertEquals("terrain data unknown", warnings.get(0).code());
    }

    @Test
    @DisplayName("Mission score is the share of objectives covered by purpose tags")
    void missionTagOverlap() {
        Coa coa = Coa.builder("COA-1", CoaType.DEFENSE).purposeTags("차단", "지연").build();
        SituationContext context = SituationContext.builder("SIT-1")
                .mission(new MissionProfile("M-1", "방어", 5, Set.of("거점확보", "차단")))
                .build();

        assertEquals(0.5, evaluator.evaluateMission(coa, context, warnings), 1e-9);
    }

    @ParameterizedTest
    @DisplayName("Mission score without tags uses type alignment scaled by priority")
    @CsvSource({
            "방어,    10, Defense,   1.0",
            "방어,    5,  Defense,   0.85",
            "defense, 5,  Offensive, 0.17"
    })
    void missionAlignmentFallback(String missionType, int priority, String coaType, double expected) {
        Coa coa = Coa.builder("COA-1", CoaType.fromLabel(coaType).orElseThrow()).build();
        SituationContext context = SituationContext.builder("SIT-1")
                .mission(new MissionProfile("M-1", missionType, priority, Set.of()))
                .build();

        assertEquals(expected, evaluator.evaluateMission(coa, context, warnings), 1e-9);
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("Unknown mission type or missing mission scores 0.5 with a warning")
    void missionUnknown() {
        Coa coa = Coa.builder("COA-1", CoaType.DEFENSE).build();
        SituationContext unknownType = SituationContext.builder("SIT-1")
                .mission(new MissionProfile("M-1", "정찰", 5, Set.of()))
                .build();

        assertEquals(0.5, evaluator.evaluateMission(coa, unknownType, warnings));
        assertEquals(0.5, evaluator.evaluateMission(coa, SituationContext.builder("SIT-2").build(), warnings));
        assertEquals(2, warnings.size());
        assertTrue(warnings.stream().allMatch(w -> w.code().equals("mission data unknown")));
    }

    @Test
    @DisplayName("Troops score is the weighted resource match")
    void troops() {
        Coa coa = Coa.builder("COA-1", CoaType.COUNTER_ATTACK)
                .requiredResources(List.of(ResourceRequirement.required("포병대대"),
                        ResourceRequirement.recommended("공격헬기")))
                .build();
        SituationContext context = SituationContext.builder("SIT-1")
                .resource(AvailableResource.of("포병대대"))
                .build();

        assertEquals(1.0 / 1.6, evaluator.evaluateTroops(coa, context, warnings), 1e-9);
    }

    // =====================================================================
    // Total
    // =====================================================================

    @Test
    @DisplayName("Total is the equal-weight mean of the six dimensions")
    void totalIsWeightedMean() {
        Coa coa = Coa.builder("COA-1", CoaType.DEFENSE)
                .estimatedDurationHours(10)
                .impactTerrainCells("C-1")
                .build();
        SituationContext context = SituationContext.builder("SIT-1")
                .threatLevel(0.85)
                .mission(new MissionProfile("M-1", "방어", 10, Set.of()))
                .axis(new AxisState("AX-1", 150, 100, 0.6))
                .civilianArea(new CivilianArea("CIV-1", 0.8, 500, Set.of("C-9")))
                .terrainTags(Set.of("산악"))
                .build();

        MettCScore score = evaluator.evaluate(coa, context);

        double mean = score.asMap().values().stream().mapToDouble(Double::doubleValue).sum() / 6.0;
        assertEquals(mean, score.total(), 1e-9);
        assertEquals(1.0, score.mission(), 1e-9);
        assertEquals(0.85, score.enemy(), 1e-9);
        assertEquals(1.0, score.civilian(), 1e-9);
        assertEquals(1.0, score.time(), 1e-9);
        assertEquals(score.troops(), score.get(MettCDimension.TROOPS));
        assertTrue(score.warnings().isEmpty());
    }
}
