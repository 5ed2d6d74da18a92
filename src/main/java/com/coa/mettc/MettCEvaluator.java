package com.coa.mettc;

import com.coa.config.ScoringConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.model.CivilianArea;
import com.coa.model.Coa;
import com.coa.model.Constraint;
import com.coa.model.SituationContext;
import com.coa.resource.ResourceMatch;
import com.coa.resource.ResourcePriorityParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the six METT-C sub-scores for one COA in one situation.
 * Missing inputs are replaced by documented fallbacks with a DATA_GAP diagnostic.
 */
public class MettCEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MettCEvaluator.class);

    static final double NEUTRAL = 0.5;
    static final double ENEMY_RATIO_BASE = 0.6;
    static final double ENEMY_RATIO_GAIN = 0.4;
    static final double DENSITY_FACTOR_BASE = 0.9;
    static final double AXIS_DURATION_STEP = 0.2;

    private final ResourcePriorityParser resourceParser;
    private final ScoringConfig config;

    public MettCEvaluator(ResourcePriorityParser resourceParser, ScoringConfig config) {
        this.resourceParser = resourceParser;
        this.config = config;
    }

    /**
     * Evaluate all six dimensions and their weighted total.
     *
     * @param coa     Candidate
     * @param context Situation
     * @return Sub-scores in [0,1]
     */
    public MettCScore evaluate(Coa coa, SituationContext context) {
        List<Diagnostic> warnings = new ArrayList<>();

        double mission = evaluateMission(coa, context, warnings);
        double enemy = evaluateEnemy(context, warnings);
        double terrain = evaluateTerrain(coa, context, warnings);
        double troops = evaluateTroops(coa, context, warnings);
        double civilian = evaluateCivilian(coa, context, warnings);
        double time = evaluateTime(coa, context, warnings);

        double total = config.weight(MettCDimension.MISSION) * mission
                + config.weight(MettCDimension.ENEMY) * enemy
                + config.weight(MettCDimension.TERRAIN) * terrain
                + config.weight(MettCDimension.TROOPS) * troops
                + config.weight(MettCDimension.CIVILIAN) * civilian
                + config.weight(MettCDimension.TIME) * time;

        log.debug("METT-C for {}: mission={} enemy={} terrain={} troops={} civilian={} time={} -> {}",
                coa.id(), mission, enemy, terrain, troops, civilian, time, total);
        return new MettCScore(mission, enemy, terrain, troops, civilian, time, clamp(total), warnings);
    }

    /**
     * Share of mission objectives covered by the COA's purpose tags. Without tags on
     * either side the mission-type alignment matrix is used instead.
     */
    double evaluateMission(Coa coa, SituationContext context, List<Diagnostic> warnings) {
        if (context.mission() == null) {
            warnings.add(Diagnostic.dataGap("mission data unknown", "No mission profile; mission score " + NEUTRAL));
            return NEUTRAL;
        }

        Set<String> objectives = lowerCase(context.mission().objectiveTags());
        Set<String> purposes = lowerCase(coa.purposeTags());
        if (!objectives.isEmpty() && !purposes.isEmpty()) {
            long covered = objectives.stream().filter(purposes::contains).count();
            return (double) covered / objectives.size();
        }

        return config.alignment(context.missionType(), coa.type())
                .map(alignment -> {
                    double priorityFactor = Math.min(1.0, Math.max(1, context.mission().priority()) / 10.0);
                    return clamp(alignment * (0.7 + 0.3 * priorityFactor));
                })
                .orElseGet(() -> {
                    warnings.add(Diagnostic.dataGap("mission data unknown",
                            "No objective tags and no alignment for mission type '" + context.missionType()
                                    + "'; mission score " + NEUTRAL));
                    return NEUTRAL;
                });
    }

    /**
     * {@code threatLevel * (0.6 + 0.4 * min(1, forceRatio))}. A higher value means an
     * aggressive response is more applicable.
     */
    double evaluateEnemy(SituationContext context, List<Diagnostic> warnings) {
        double ratioFactor;
        if (context.axisStates().isEmpty()) {
            warnings.add(Diagnostic.dataGap("force ratio unknown", "No axis data; force ratio factor " + NEUTRAL));
            ratioFactor = NEUTRAL;
        } else {
            Double forceRatio = context.forceRatio();
            // No enemy combat power on any axis
            ratioFactor = forceRatio == null ? 1.0 : Math.min(1.0, forceRatio);
        }
        return clamp(context.threatLevel() * (ENEMY_RATIO_BASE + ENEMY_RATIO_GAIN * ratioFactor));
    }

    double evaluateTerrain(Coa coa, SituationContext context, List<Diagnostic> warnings) {
        ScoringConfig.TerrainSettings terrain = config.terrain();
        boolean declaresFit = !coa.compatibleTerrain().isEmpty() || !coa.incompatibleTerrain().isEmpty();
        Set<String> present = lowerCase(context.terrainTags());

        if (declaresFit && present.isEmpty()) {
            warnings.add(Diagnostic.dataGap("terrain data unknown",
                    "No terrain tags in situation; terrain score " + terrain.base()));
            return clamp(terrain.base());
        }

        long compatible = lowerCase(coa.compatibleTerrain()).stream().filter(present::contains).count();
        long incompatible = lowerCase(coa.incompatibleTerrain()).stream().filter(present::contains).count();
        return clamp(terrain.base()
                + compatible * terrain.compatibleBonus()
                - incompatible * terrain.incompatiblePenalty());
    }

    double evaluateTroops(Coa coa, SituationContext context, List<Diagnostic> warnings) {
        ResourceMatch match = resourceParser.match(coa.requiredResources(), context.availableResources());
        warnings.addAll(match.warnings());
        return match.score();
    }

    /**
     * Product of {@code 1 - protectionPriority * densityFactor} over civilian areas whose
     * cells intersect the COA's impact cells.
     */
    double evaluateCivilian(Coa coa, SituationContext context, List<Diagnostic> warnings) {
        if (context.civilianAreas().isEmpty()) {
            warnings.add(Diagnostic.dataGap("civilian data unknown", "No civilian areas; civilian score 1.0"));
            return 1.0;
        }

        double score = 1.0;
        for (CivilianArea area : context.civilianAreas()) {
            if (intersects(area.cellIds(), coa.impactTerrainCellIds())) {
                double penalty = area.protectionPriority() * densityFactor(area);
                score *= 1.0 - penalty;
                log.debug("COA {} affects civilian area {} (priority {}, penalty {})",
                        coa.id(), area.id(), area.protectionPriority(), penalty);
            }
        }
        return clamp(score);
    }

    double densityFactor(CivilianArea area) {
        if (area.hasCriticalFacilities()) {
            return 1.0;
        }
        double reference = config.civilian().densityReference();
        return DENSITY_FACTOR_BASE + (1.0 - DENSITY_FACTOR_BASE) * Math.min(1.0, area.populationDensity() / reference);
    }

    /**
     * 0.0 for a hard violation of a time-critical budget, otherwise
     * {@code 1 - min(1, overrunRatio)} over the remaining budgets.
     */
    double evaluateTime(Coa coa, SituationContext context, List<Diagnostic> warnings) {
        List<Constraint> budgets = context.constraints().stream()
                .filter(Constraint::hasDurationBudget)
                .toList();
        if (budgets.isEmpty()) {
            return 1.0;
        }

        double duration = effectiveDuration(coa, context, warnings);
        double overrunRatio = 0.0;
        for (Constraint constraint : budgets) {
            double max = constraint.maxDurationHours();
            if (duration <= max) {
                continue;
            }
            if (constraint.timeCritical()) {
                log.debug("COA {} violates time-critical constraint {} ({}h > {}h)",
                        coa.id(), constraint.id(), duration, max);
                return 0.0;
            }
            overrunRatio = Math.max(overrunRatio, (duration - max) / max);
        }
        return clamp(1.0 - Math.min(1.0, overrunRatio));
    }

    /**
     * Declared duration, or the type default scaled by axis count when undeclared.
     */
    public static double effectiveDuration(Coa coa, SituationContext context, List<Diagnostic> warnings) {
        if (coa.hasKnownDuration()) {
            return coa.estimatedDurationHours();
        }
        int axes = Math.max(1, context.axisCount());
        double estimate = coa.type().defaultDurationHours() * (1.0 + AXIS_DURATION_STEP * (axes - 1));
        warnings.add(Diagnostic.dataGap("duration unknown",
                "COA " + coa.id() + " declares no duration; estimated " + estimate + "h"));
        return estimate;
    }

    private static boolean intersects(Set<String> left, Set<String> right) {
        for (String cell : left) {
            if (right.contains(cell)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> lowerCase(Set<String> values) {
        return values.stream().map(v -> v.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
