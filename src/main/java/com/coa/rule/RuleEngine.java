package com.coa.rule;

import com.coa.model.SituationContext;
import com.coa.scoring.ScoreBreakdown;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates declarative rules to recommend a COA type and adjust candidate scores.
 * Rule adjustment is optional: failures never abort scoring.
 */
public interface RuleEngine {

    /**
     * Find the first matching rule in ascending priority order.
     *
     * @param context Situation
     * @return First match, or empty when no rule matches
     */
    Optional<RuleMatch> evaluate(SituationContext context);

    /**
     * All matching rules in priority order, for diagnostics.
     */
    List<RuleMatch> findMatchingRules(SituationContext context);

    /**
     * Add the rule bonus to candidates of the recommended type and subtract the rule
     * penalty from all others. Totals are clamped to [0,1].
     *
     * @param breakdowns Scored candidates
     * @param context    Situation
     * @return Adjusted candidates, or the input unchanged with a warning
     */
    RuleAdjustment applyScoring(List<ScoreBreakdown> breakdowns, SituationContext context);

    /**
     * Re-read the rule source and swap in a new snapshot.
     */
    void reload();

    RuleSet currentRuleSet();
}
