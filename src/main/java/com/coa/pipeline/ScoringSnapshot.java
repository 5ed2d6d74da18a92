package com.coa.pipeline;

import com.coa.config.ConfigLoader;
import com.coa.config.ScoringConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.exception.ConfigurationException;
import com.coa.mettc.MettCEvaluator;
import com.coa.relevance.RelevanceMapper;
import com.coa.relevance.RelevanceTable;
import com.coa.resource.ResourcePriorityParser;
import com.coa.scoring.CoaScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One consistent, read-only version of the scoring tables and the components built on them.
 * A reload builds a new snapshot; a running pipeline pass keeps the one it started with.
 *
 * @param relevanceMapper Relevance lookup
 * @param resourceParser  Resource parser with its memo cache
 * @param config          Scoring parameters
 * @param scorer          Base scorer over the above
 * @param mettCEvaluator  METT-C evaluator over the above
 * @param loadWarnings    CONFIGURATION diagnostics from building this snapshot
 */
public record ScoringSnapshot(
        RelevanceMapper relevanceMapper,
        ResourcePriorityParser resourceParser,
        ScoringConfig config,
        CoaScorer scorer,
        MettCEvaluator mettCEvaluator,
        List<Diagnostic> loadWarnings
) {
    private static final Logger log = LoggerFactory.getLogger(ScoringSnapshot.class);

    public ScoringSnapshot {
        loadWarnings = loadWarnings == null ? List.of() : List.copyOf(loadWarnings);
    }

    /**
     * Assemble a snapshot from already loaded tables.
     */
    public static ScoringSnapshot of(RelevanceTable relevanceTable, ScoringConfig config) {
        ResourcePriorityParser parser = new ResourcePriorityParser();
        RelevanceMapper mapper = new RelevanceMapper(relevanceTable);
        return new ScoringSnapshot(mapper, parser, config,
                new CoaScorer(mapper, parser, config),
                new MettCEvaluator(parser, config),
                relevanceTable.loadWarnings());
    }

    /**
     * Load a snapshot from files, falling back to defaults for any file that cannot be loaded.
     *
     * @param relevancePath Relevance table path
     * @param scoringPath   Scoring file path
     */
    public static ScoringSnapshot load(String relevancePath, String scoringPath) {
        List<Diagnostic> warnings = new ArrayList<>();

        RelevanceMapper mapper = RelevanceMapper.load(relevancePath);
        warnings.addAll(mapper.loadWarnings());

        ScoringConfig config;
        try {
            config = ConfigLoader.loadScoringConfig(scoringPath);
        } catch (ConfigurationException e) {
            log.warn("Scoring configuration unavailable, using defaults: {}", e.getMessage());
            warnings.add(Diagnostic.configuration("scoring configuration unavailable", e.getMessage()));
            config = ScoringConfig.defaults();
        }

        ResourcePriorityParser parser = new ResourcePriorityParser();
        log.info("Scoring snapshot loaded ({} relevance mappings, {} warnings)",
                mapper.stats().totalMappings(), warnings.size());
        return new ScoringSnapshot(mapper, parser, config,
                new CoaScorer(mapper, parser, config),
                new MettCEvaluator(parser, config),
                warnings);
    }
}
