package com.coa.scoring;

import com.coa.config.ScoringConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.mettc.MettCEvaluator;
import com.coa.mettc.MettCScore;
import com.coa.model.Coa;
import com.coa.model.Constraint;
import com.coa.model.SituationContext;
import com.coa.relevance.RelevanceMapper;
import com.coa.relevance.RelevanceResult;
import com.coa.resource.ResourceMatch;
import com.coa.resource.ResourcePriorityParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a COA against a situation as a weighted sum of base factors.
 * <p>
 * Stateless apart from its injected, read-only collaborators; the same inputs always
 * produce an equal {@link ScoreBreakdown}.
 */
public class CoaScorer {

    private static final Logger log = LoggerFactory.getLogger(CoaScorer.class);

    static final double NEUTRAL = 0.5;

    /** constraintFit penalty by constraint importance (index = importance). */
    private static final double[] IMPORTANCE_PENALTY = {0.0, 0.1, 0.3, 0.5, 0.7, 1.0};

    private static final double CONFIDENCE_COMPLETENESS = 0.4;
    private static final double CONFIDENCE_SPREAD = 0.3;
    private static final double CONFIDENCE_CONTEXT = 0.3;

    private final RelevanceMapper relevanceMapper;
    private final ResourcePriorityParser resourceParser;
    private final ScoringConfig config;

    public CoaScorer(RelevanceMapper relevanceMapper, ResourcePriorityParser resourceParser, ScoringConfig config) {
        this.relevanceMapper = relevanceMapper;
        this.resourceParser = resourceParser;
        this.config = config;
    }

    /**
     * Compute base factors and their weighted total.
     *
     * @param coa     Candidate
     * @param context Situation
     * @return Breakdown without METT-C sub-scores or rule adjustment
     */
    public ScoreBreakdown score(Coa coa, SituationContext context) {
        List<Diagnostic> warnings = new ArrayList<>();
        Set<Factor> substituted = EnumSet.noneOf(Factor.class);
        Map<Factor, Double> factors = new EnumMap<>(Factor.class);

        factors.put(Factor.MISSION_ALIGNMENT, missionAlignment(coa, context, warnings, substituted));
        factors.put(Factor.COMBAT_POWER, combatPower(coa, context, warnings, substituted));
        factors.put(Factor.THREAT_RESPONSE, threatResponse(coa, context, warnings, substituted));
        factors.put(Factor.MOBILITY, mobility(coa, context, warnings, substituted));
        factors.put(Factor.CONSTRAINT_FIT, constraintFit(coa, context));
        factors.put(Factor.RESOURCES, resources(coa, context, warnings, substituted));
        factors.put(Factor.ASSETS, assets(coa, context, warnings, substituted));

        double total = 0.0;
        for (Map.Entry<Factor, Double> entry : factors.entrySet()) {
            total += config.weight(entry.getKey()) * entry.getValue();
        }

        List<Factor> strengths = new ArrayList<>();
        List<Factor> weaknesses = new ArrayList<>();
        for (Map.Entry<Factor, Double> entry : factors.entrySet()) {
            if (entry.getKey().isStrength(entry.getValue())) {
                strengths.add(entry.getKey());
            } else if (entry.getKey().isWeakness(entry.getValue())) {
                weaknesses.add(entry.getKey());
            }
        }

        double confidence = confidence(factors, substituted, context);
        log.debug("Scored COA {} ({}): total={}, confidence={}", coa.id(), coa.type(), total, confidence);

        return new ScoreBreakdown(coa.id(), coa.type(), coa.name(), factors, total, null, 0.0, null, total,
                false, null, false, confidence, strengths, weaknesses, warnings);
    }

    /**
     * Score and attach METT-C sub-scores, blending the METT-C total into the overall total
     * with the configured blend weight.
     */
    public ScoreBreakdown calculateScoreWithMettC(Coa coa, SituationContext context, MettCEvaluator evaluator) {
        ScoreBreakdown base = score(coa, context);
        MettCScore mettC = evaluator.evaluate(coa, context);
        return base.withMettC(mettC, config.pipeline().mettCBlendWeight());
    }

    double missionAlignment(Coa coa, SituationContext context, List<Diagnostic> warnings, Set<Factor> substituted) {
        String missionType = context.missionType();
        return config.alignment(missionType, coa.type()).orElseGet(() -> {
            warnings.add(Diagnostic.dataGap("unknown mission type",
                    "No alignment for mission type '" + missionType + "' and " + coa.type() + "; using " + NEUTRAL));
            substituted.add(Factor.MISSION_ALIGNMENT);
            return NEUTRAL;
        });
    }

    /**
     * Friendly combat power over the COA's requirement, or the force ratio when the COA
     * declares no requirement.
     */
    double combatPower(Coa coa, SituationContext context, List<Diagnostic> warnings, Set<Factor> substituted) {
        if (context.axisStates().isEmpty()) {
            warnings.add(Diagnostic.dataGap("combat power unknown", "No axis data; combat power " + NEUTRAL));
            substituted.add(Factor.COMBAT_POWER);
            return NEUTRAL;
        }
        Double required = coa.requiredCombatPower();
        if (required != null && required > 0) {
            return clamp(context.totalFriendlyCombatPower() / required);
        }
        Double forceRatio = context.forceRatio();
        return forceRatio == null ? 1.0 : clamp(forceRatio);
    }

    double threatResponse(Coa coa, SituationContext context, List<Diagnostic> warnings, Set<Factor> substituted) {
        RelevanceResult result = relevanceMapper.relevance(coa, context);
        if (result.isDefault()) {
            substituted.add(Factor.THREAT_RESPONSE);
        }
        warnings.addAll(result.warnings());
        return result.relevance();
    }

    /**
     * 1.0 when mean axis mobility meets the COA's requirement, otherwise available / required.
     * Without a requirement the available mobility itself is the score.
     */
    double mobility(Coa coa, SituationContext context, List<Diagnostic> warnings, Set<Factor> substituted) {
        Double available = context.averageMobility();
        if (available == null) {
            warnings.add(Diagnostic.dataGap("mobility unknown", "No axis mobility data; mobility " + NEUTRAL));
            substituted.add(Factor.MOBILITY);
            return NEUTRAL;
        }
        Double required = coa.requiredMobility();
        if (required == null || required <= 0) {
            return clamp(available);
        }
        return available >= required ? 1.0 : clamp(available / required);
    }

    /**
     * Multiplies {@code 1 - penalty(importance)} for every constraint that restricts the
     * COA's type or whose non-critical duration budget the COA exceeds. Time-critical
     * budgets are enforced by METT-C exclusion instead.
     */
    double constraintFit(Coa coa, SituationContext context) {
        double fit = 1.0;
        for (Constraint constraint : context.constraints()) {
            boolean violated = constraint.restricts(coa.type())
                    || (!constraint.timeCritical()
                    && constraint.hasDurationBudget()
                    && coa.hasKnownDuration()
                    && coa.estimatedDurationHours() > constraint.maxDurationHours());
            if (violated) {
                fit *= 1.0 - IMPORTANCE_PENALTY[constraint.importance()];
                log.debug("COA {} violates constraint {} (importance {})", coa.id(), constraint.id(), constraint.importance());
            }
        }
        return clamp(fit);
    }

    double resources(Coa coa, SituationContext context, List<Diagnostic> warnings, Set<Factor> substituted) {
        ResourceMatch match = resourceParser.match(coa.requiredResources(), context.availableResources());
        if (!match.warnings().isEmpty()) {
            substituted.add(Factor.RESOURCES);
        }
        warnings.addAll(match.warnings());
        return match.score();
    }

    double assets(Coa coa, SituationContext context, List<Diagnostic> warnings, Set<Factor> substituted) {
        if (coa.requiredAssets().isEmpty()) {
            return config.assetsNeutral();
        }
        ResourceMatch match = resourceParser.match(coa.requiredAssets(), context.availableResources());
        if (!match.warnings().isEmpty()) {
            substituted.add(Factor.ASSETS);
        }
        warnings.addAll(match.warnings());
        return match.score();
    }

    /**
     * Data completeness 40%, factor agreement 30%, situation completeness 30%.
     */
    double confidence(Map<Factor, Double> factors, Set<Factor> substituted, SituationContext context) {
        double completeness = 1.0 - (double) substituted.size() / Factor.values().length;

        double max = factors.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double min = factors.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double agreement = 1.0 - (max - min);

        int present = 0;
        present += context.dominantThreatType() != null ? 1 : 0;
        present += context.mission() != null ? 1 : 0;
        present += !context.axisStates().isEmpty() ? 1 : 0;
        present += !context.availableResources().isEmpty() ? 1 : 0;
        present += !context.terrainTags().isEmpty() ? 1 : 0;
        double contextCompleteness = present / 5.0;

        return clamp(CONFIDENCE_COMPLETENESS * completeness
                + CONFIDENCE_SPREAD * agreement
                + CONFIDENCE_CONTEXT * contextCompleteness);
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
