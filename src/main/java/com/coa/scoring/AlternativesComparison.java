package com.coa.scoring;

import java.util.List;

/**
 * Spread of the ranked (non-excluded) totals and how clearly the top candidate wins.
 *
 * @param count     Number of ranked candidates compared
 * @param minScore  Lowest total
 * @param maxScore  Highest total
 * @param avgScore  Mean total
 * @param margin    Top-1 minus top-2 total (0 with fewer than two candidates)
 * @param closeCall Margin below {@value #CLOSE_CALL_MARGIN}
 * @param decisive  Margin above {@value #DECISIVE_MARGIN}
 */
public record AlternativesComparison(
        int count,
        double minScore,
        double maxScore,
        double avgScore,
        double margin,
        boolean closeCall,
        boolean decisive
) {
    public static final double CLOSE_CALL_MARGIN = 0.05;
    public static final double DECISIVE_MARGIN = 0.15;

    /**
     * Compare candidates already sorted best first.
     */
    public static AlternativesComparison of(List<ScoreBreakdown> ranked) {
        if (ranked.isEmpty()) {
            return new AlternativesComparison(0, 0.0, 0.0, 0.0, 0.0, false, false);
        }
        double min = ranked.stream().mapToDouble(ScoreBreakdown::totalScore).min().orElse(0.0);
        double max = ranked.stream().mapToDouble(ScoreBreakdown::totalScore).max().orElse(0.0);
        double avg = ranked.stream().mapToDouble(ScoreBreakdown::totalScore).average().orElse(0.0);
        double margin = ranked.size() < 2 ? 0.0 : ranked.get(0).totalScore() - ranked.get(1).totalScore();
        boolean comparable = ranked.size() >= 2;
        return new AlternativesComparison(ranked.size(), min, max, avg, margin,
                comparable && margin < CLOSE_CALL_MARGIN, comparable && margin > DECISIVE_MARGIN);
    }
}
