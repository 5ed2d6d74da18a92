package com.coa.pipeline;

import com.coa.diagnostics.Diagnostic;
import com.coa.rule.RuleMatch;
import com.coa.scoring.AlternativesComparison;

import java.util.List;
import java.util.Optional;

/**
 * Pipeline output.
 *
 * @param situationId     Situation the ranking was produced for
 * @param rankings        Pass-2 survivors, then remaining Pass-1 candidates, then excluded candidates
 * @param appliedRule     Rule whose bonus and penalty were applied, or null
 * @param comparison      Spread of the non-excluded totals
 * @param fallbackApplied Whether the exclusion of the best Pass-1 candidate was bypassed
 * @param state           Final pipeline state
 * @param warnings        Run-level diagnostics (configuration, rule engine, request)
 */
public record DecisionResult(
        String situationId,
        List<RankedCoa> rankings,
        RuleMatch appliedRule,
        AlternativesComparison comparison,
        boolean fallbackApplied,
        PipelineState state,
        List<Diagnostic> warnings
) {
    public DecisionResult {
        rankings = rankings == null ? List.of() : List.copyOf(rankings);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Best ranked candidate, if any was supplied.
     */
    public Optional<RankedCoa> top() {
        return rankings.isEmpty() ? Optional.empty() : Optional.of(rankings.get(0));
    }

    public List<RankedCoa> excluded() {
        return rankings.stream().filter(RankedCoa::excluded).toList();
    }
}
