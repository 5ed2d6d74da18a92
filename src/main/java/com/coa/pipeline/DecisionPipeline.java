package com.coa.pipeline;

import com.coa.config.ScoringConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.exception.CoaException;
import com.coa.mettc.MettCScore;
import com.coa.model.Coa;
import com.coa.model.SituationContext;
import com.coa.rule.RuleAdjustment;
import com.coa.rule.RuleEngine;
import com.coa.scoring.AlternativesComparison;
import com.coa.scoring.ExclusionReason;
import com.coa.scoring.ScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-pass COA ranking.
 * <p>
 * Pass 1 scores every candidate, applies the rule adjustment and sorts by total. Pass 2
 * evaluates METT-C for the top K, excludes candidates that fail civilian protection or a
 * time-critical budget, and blends the METT-C total into the survivors. When every top-K
 * candidate is excluded the best Pass-1 candidate is brought back with
 * {@code mettCFilterBypassed} set.
 * <p>
 * Output order: Pass-2 survivors by blended total, then the remaining Pass-1 candidates in
 * Pass-1 order, then excluded candidates in Pass-1 order. Ties break on COA id.
 * <p>
 * Each run reads one {@link ScoringSnapshot}; {@link #reload(ScoringSnapshot)} swaps it
 * atomically without affecting runs in flight.
 */
public class DecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipeline.class);

    public static final String THREAD_NAME_PREFIX = "coa-scorer-";
    public static final String NO_CANDIDATES = "no candidates";
    public static final String FILTER_BYPASSED = "mett-c filter bypassed";

    static final Comparator<ScoreBreakdown> BY_TOTAL_THEN_ID =
            Comparator.comparingDouble(ScoreBreakdown::totalScore).reversed()
                    .thenComparing(ScoreBreakdown::coaId);

    private final AtomicReference<ScoringSnapshot> snapshot;
    private final RuleEngine ruleEngine;
    private final ExecutorService executor;

    public DecisionPipeline(ScoringSnapshot snapshot, RuleEngine ruleEngine) {
        this.snapshot = new AtomicReference<>(Objects.requireNonNull(snapshot, "snapshot"));
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        int poolSize = snapshot.config().pipeline().poolSize();
        this.executor = Executors.newFixedThreadPool(poolSize, new ScorerThreadFactory());
        log.info("DecisionPipeline initialized: topK={}, blend={}, parallel at >= {} candidates on {} threads",
                snapshot.config().pipeline().topK(), snapshot.config().pipeline().mettCBlendWeight(),
                snapshot.config().pipeline().parallelThreshold(), poolSize);
    }

    public DecisionResult rank(List<Coa> candidates, SituationContext situation) {
        return rank(new DecisionRequest(candidates, situation));
    }

    /**
     * Rank the candidates of one request.
     *
     * @param request Candidates and situation
     * @return Ranking; empty when there are no candidates
     */
    public DecisionResult rank(DecisionRequest request) {
        ScoringSnapshot current = snapshot.get();
        ScoringConfig config = current.config();
        SituationContext situation = request.situation();

        List<Diagnostic> warnings = new ArrayList<>(current.loadWarnings());
        warnings.addAll(request.warnings());

        List<Coa> candidates = request.candidates();
        if (candidates.isEmpty()) {
            log.info("Situation {}: no candidates to rank", situation.situationId());
            warnings.add(Diagnostic.dataGap(NO_CANDIDATES, "No candidate COAs supplied"));
            return new DecisionResult(situation.situationId(), List.of(), null,
                    AlternativesComparison.of(List.of()), false, PipelineState.RANKED, warnings);
        }
        PipelineState state = PipelineState.GENERATED;

        // Pass 1
        List<ScoreBreakdown> scored = scoreAll(current, candidates, situation);
        RuleAdjustment adjustment = ruleEngine.applyScoring(scored, situation);
        warnings.addAll(adjustment.warnings());

        List<Scored> pass1 = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            pass1.add(new Scored(candidates.get(i), adjustment.breakdowns().get(i)));
        }
        pass1.sort(Comparator.comparing(Scored::breakdown, BY_TOTAL_THEN_ID));
        state = PipelineState.PASS1_SCORED;

        // Pass 2
        int topK = Math.min(config.pipeline().topK(), pass1.size());
        double blendWeight = config.pipeline().mettCBlendWeight();
        double civilianThreshold = config.civilian().exclusionThreshold();

        List<ScoreBreakdown> filtered = new ArrayList<>(topK);
        for (int i = 0; i < topK; i++) {
            Scored entry = pass1.get(i);
            MettCScore mettC = current.mettCEvaluator().evaluate(entry.coa(), situation);
            ScoreBreakdown blended = entry.breakdown().withMettC(mettC, blendWeight);
            if (mettC.civilian() < civilianThreshold) {
                blended = blended.excluded(ExclusionReason.CIVILIAN_PROTECTION_BELOW_THRESHOLD);
            } else if (mettC.time() == 0.0) {
                blended = blended.excluded(ExclusionReason.TIME_CONSTRAINT_VIOLATED);
            }
            if (blended.excluded()) {
                log.debug("Situation {}: COA {} excluded ({})", situation.situationId(),
                        blended.coaId(), blended.exclusionReason().code());
            }
            filtered.add(blended);
        }
        state = PipelineState.PASS2_FILTERED;

        boolean fallbackApplied = filtered.stream().allMatch(ScoreBreakdown::excluded);
        if (fallbackApplied) {
            ScoreBreakdown best = filtered.get(0);
            log.warn("Situation {}: all top-{} candidates excluded, keeping {} ({})", situation.situationId(),
                    topK, best.coaId(), best.exclusionReason().code());
            filtered.set(0, best.withExclusionBypassed(Diagnostic.dataGap(FILTER_BYPASSED,
                    "Excluded for " + best.exclusionReason().code() + " but kept as the only remaining candidate")));
        }

        List<ScoreBreakdown> survivors = new ArrayList<>();
        List<ScoreBreakdown> excluded = new ArrayList<>();
        for (ScoreBreakdown breakdown : filtered) {
            (breakdown.excluded() ? excluded : survivors).add(breakdown);
        }
        survivors.sort(BY_TOTAL_THEN_ID);

        List<ScoreBreakdown> ordered = new ArrayList<>(survivors);
        for (int i = topK; i < pass1.size(); i++) {
            ordered.add(pass1.get(i).breakdown());
        }
        List<ScoreBreakdown> comparable = List.copyOf(ordered);
        ordered.addAll(excluded);

        List<RankedCoa> rankings = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            rankings.add(RankedCoa.of(i + 1, ordered.get(i)));
        }
        state = PipelineState.RANKED;

        log.info("Situation {}: ranked {} candidates ({} excluded, rule={}, fallback={}), top={}",
                situation.situationId(), rankings.size(), excluded.size(),
                adjustment.applied() ? adjustment.match().ruleName() : "none", fallbackApplied,
                rankings.get(0).coaId());
        return new DecisionResult(situation.situationId(), rankings, adjustment.match(),
                AlternativesComparison.of(comparable), fallbackApplied, state, warnings);
    }

    /**
     * Swap in a new scoring snapshot and reload the rule source. Runs already in progress
     * finish on the snapshot they started with.
     */
    public void reload(ScoringSnapshot next) {
        ScoringSnapshot previous = snapshot.getAndSet(Objects.requireNonNull(next, "snapshot"));
        ruleEngine.reload();
        log.info("Scoring snapshot replaced ({} -> {} load warnings)",
                previous.loadWarnings().size(), next.loadWarnings().size());
    }

    public ScoringSnapshot currentSnapshot() {
        return snapshot.get();
    }

    public RuleEngine ruleEngine() {
        return ruleEngine;
    }

    public void shutdown() {
        log.info("Shutting down DecisionPipeline scorer threads");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<ScoreBreakdown> scoreAll(ScoringSnapshot current, List<Coa> candidates, SituationContext situation) {
        if (candidates.size() < current.config().pipeline().parallelThreshold()) {
            return scoreSequentially(current, candidates, situation);
        }
        try {
            return scoreInParallel(current, candidates, situation);
        } catch (RejectedExecutionException e) {
            log.warn("Scorer pool unavailable, scoring {} candidates on the caller thread: {}",
                    candidates.size(), e.getMessage());
            return scoreSequentially(current, candidates, situation);
        }
    }

    private List<ScoreBreakdown> scoreSequentially(ScoringSnapshot current, List<Coa> candidates,
                                                   SituationContext situation) {
        List<ScoreBreakdown> scored = new ArrayList<>(candidates.size());
        for (Coa coa : candidates) {
            scored.add(current.scorer().score(coa, situation));
        }
        return scored;
    }

    // Futures are collected in submission order, so results line up with the input by index.
    private List<ScoreBreakdown> scoreInParallel(ScoringSnapshot current, List<Coa> candidates,
                                                 SituationContext situation) {
        List<Future<ScoreBreakdown>> futures = new ArrayList<>(candidates.size());
        for (Coa coa : candidates) {
            futures.add(executor.submit(() -> current.scorer().score(coa, situation)));
        }

        List<ScoreBreakdown> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                scored.add(futures.get(i).get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CoaException("Interrupted while scoring candidates for " + situation.situationId(), e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new CoaException("Scoring failed for COA " + candidates.get(i).id(), e.getCause());
            }
        }
        return scored;
    }

    private record Scored(Coa coa, ScoreBreakdown breakdown) {
    }

    private static final class ScorerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextId = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, THREAD_NAME_PREFIX + nextId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
