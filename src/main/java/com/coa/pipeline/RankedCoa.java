package com.coa.pipeline;

import com.coa.diagnostics.Diagnostic;
import com.coa.scoring.ScoreBreakdown;

import java.util.List;

/**
 * One entry of the final ranking.
 *
 * @param coaId         COA identifier
 * @param rank          1-based position in the output
 * @param totalScore    Final score
 * @param breakdown     Full score breakdown
 * @param excluded      Whether Pass 2 excluded the candidate
 * @param excludeReason Exclusion reason code, or null
 * @param warnings      Diagnostics raised while scoring this candidate
 */
public record RankedCoa(
        String coaId,
        int rank,
        double totalScore,
        ScoreBreakdown breakdown,
        boolean excluded,
        String excludeReason,
        List<Diagnostic> warnings
) {
    static RankedCoa of(int rank, ScoreBreakdown breakdown) {
        return new RankedCoa(breakdown.coaId(), rank, breakdown.totalScore(), breakdown, breakdown.excluded(),
                breakdown.exclusionReason() == null ? null : breakdown.exclusionReason().code(),
                breakdown.warnings());
    }
}
