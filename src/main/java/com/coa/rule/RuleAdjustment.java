package com.coa.rule;

import com.coa.diagnostics.Diagnostic;
import com.coa.scoring.ScoreBreakdown;

import java.util.List;
import java.util.Optional;

/**
 * Result of applying the rule bonus and penalty to a candidate list.
 *
 * @param breakdowns Adjusted breakdowns in input order (unchanged when no rule matched)
 * @param match      Matched rule, or null
 * @param warnings   Why no adjustment was applied, when none was
 */
public record RuleAdjustment(
        List<ScoreBreakdown> breakdowns,
        RuleMatch match,
        List<Diagnostic> warnings
) {
    public RuleAdjustment {
        breakdowns = List.copyOf(breakdowns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<RuleMatch> matchedRule() {
        return Optional.ofNullable(match);
    }

    public boolean applied() {
        return match != null;
    }
}
