package com.coa.scoring;

import com.coa.diagnostics.Diagnostic;
import com.coa.mettc.MettCScore;
import com.coa.model.CoaType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Explainable score of one candidate. Immutable; the {@code with*} methods return copies.
 * <p>
 * An excluded breakdown always carries an exclusion reason. Scores are clamped to [0,1].
 *
 * @param coaId               COA identifier
 * @param coaType             COA type
 * @param coaName             COA display name
 * @param factors             Base factor scores
 * @param baseScore           Weighted sum of base factors
 * @param appliedRule         Name of the rule whose bonus or penalty was applied, or null
 * @param ruleAdjustment      Signed adjustment applied by the rule engine
 * @param mettC               METT-C sub-scores, or null before Pass 2
 * @param totalScore          Final score used for ranking
 * @param excluded            Whether Pass 2 excluded the candidate
 * @param exclusionReason     Reason for exclusion, or null
 * @param mettCFilterBypassed Whether the exclusion was bypassed by the fallback
 * @param confidence          Confidence in [0,1]
 * @param strengths           Factors scoring clearly above their reference threshold
 * @param weaknesses          Factors scoring clearly below their reference threshold
 * @param warnings            Recovered problems met while scoring this candidate
 */
public record ScoreBreakdown(
        String coaId,
        CoaType coaType,
        String coaName,
        Map<Factor, Double> factors,
        double baseScore,
        String appliedRule,
        double ruleAdjustment,
        MettCScore mettC,
        double totalScore,
        boolean excluded,
        ExclusionReason exclusionReason,
        boolean mettCFilterBypassed,
        double confidence,
        List<Factor> strengths,
        List<Factor> weaknesses,
        List<Diagnostic> warnings
) {
    public ScoreBreakdown {
        if (excluded && exclusionReason == null) {
            throw new IllegalArgumentException("Excluded breakdown for '" + coaId + "' must carry a reason");
        }
        factors = factors == null || factors.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(factors));
        baseScore = clamp(baseScore);
        totalScore = clamp(totalScore);
        confidence = clamp(confidence);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public double factor(Factor factor) {
        return factors.getOrDefault(factor, 0.0);
    }

    /**
     * Apply a rule bonus (positive) or penalty (negative) to the total. The recorded
     * adjustment is the change actually applied after clamping the total into [0, 1].
     */
    public ScoreBreakdown withRuleAdjustment(String ruleName, double delta) {
        double adjusted = clamp(totalScore + delta);
        return new ScoreBreakdown(coaId, coaType, coaName, factors, baseScore, ruleName,
                ruleAdjustment + (adjusted - totalScore), mettC, adjusted, excluded, exclusionReason,
                mettCFilterBypassed, confidence, strengths, weaknesses, warnings);
    }

    /**
     * Attach METT-C sub-scores and blend them into the total:
     * {@code total * (1 - blendWeight) + mettC.total * blendWeight}.
     */
    public ScoreBreakdown withMettC(MettCScore score, double blendWeight) {
        double blended = totalScore * (1.0 - blendWeight) + score.total() * blendWeight;
        return new ScoreBreakdown(coaId, coaType, coaName, factors, baseScore, appliedRule, ruleAdjustment,
                score, blended, excluded, exclusionReason, mettCFilterBypassed, confidence,
                strengths, weaknesses, concat(warnings, score.warnings()));
    }

    public ScoreBreakdown excluded(ExclusionReason reason) {
        return new ScoreBreakdown(coaId, coaType, coaName, factors, baseScore, appliedRule, ruleAdjustment,
                mettC, totalScore, true, reason, false, confidence, strengths, weaknesses, warnings);
    }

    /**
     * Lift an exclusion so the candidate can be ranked, keeping a record of it.
     */
    public ScoreBreakdown withExclusionBypassed(Diagnostic warning) {
        return new ScoreBreakdown(coaId, coaType, coaName, factors, baseScore, appliedRule, ruleAdjustment,
                mettC, totalScore, false, null, true, confidence, strengths, weaknesses,
                concat(warnings, List.of(warning)));
    }

    public ScoreBreakdown withWarnings(List<Diagnostic> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        return new ScoreBreakdown(coaId, coaType, coaName, factors, baseScore, appliedRule, ruleAdjustment,
                mettC, totalScore, excluded, exclusionReason, mettCFilterBypassed, confidence,
                strengths, weaknesses, concat(warnings, extra));
    }

    private static List<Diagnostic> concat(List<Diagnostic> first, List<Diagnostic> second) {
        List<Diagnostic> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }
}
