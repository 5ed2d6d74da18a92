package com.coa.relevance;

import com.coa.config.ConfigLoader;
import com.coa.config.RelevanceTableConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.exception.ConfigurationException;
import com.coa.model.Coa;
import com.coa.model.CoaType;
import com.coa.model.SituationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.DoubleSummaryStatistics;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks up how relevant a COA type is against a threat.
 * <p>
 * Lookup order:
 * <ol>
 *   <li>critical (coaId, threatId) override</li>
 *   <li>type table (coaType, threatType), scaled by {@code 0.9 + 0.2 * jaccard} when both keyword sets exist</li>
 *   <li>keyword Jaccard similarity alone</li>
 *   <li>{@value #DEFAULT_RELEVANCE} with an "unmapped relevance pair" warning</li>
 * </ol>
 * Never throws for unknown inputs. Safe for concurrent use.
 */
public class RelevanceMapper {

    private static final Logger log = LoggerFactory.getLogger(RelevanceMapper.class);

    public static final double DEFAULT_RELEVANCE = 0.5;
    public static final String UNMAPPED_PAIR = "unmapped relevance pair";

    private final RelevanceTable table;

    public RelevanceMapper(RelevanceTable table) {
        this.table = table;
    }

    /**
     * Load a mapper from a relevance file, degrading to an empty table when the file
     * cannot be loaded.
     */
    public static RelevanceMapper load(String path) {
        try {
            return new RelevanceMapper(RelevanceTable.from(ConfigLoader.loadRelevanceTable(path)));
        } catch (ConfigurationException e) {
            log.warn("Relevance table unavailable, every pair will use {}: {}", DEFAULT_RELEVANCE, e.getMessage());
            return new RelevanceMapper(RelevanceTable.unavailable(
                    Diagnostic.configuration("relevance table unavailable", e.getMessage())));
        }
    }

    /**
     * Relevance of a type pair given as labels, e.g. {@code ("Defense", "침투")}.
     */
    public RelevanceResult relevance(String coaType, String threatType) {
        Optional<CoaType> type = CoaType.fromLabel(coaType);
        if (type.isEmpty()) {
            return fallback(coaType, threatType);
        }
        return relevance(type.get(), threatType);
    }

    public RelevanceResult relevance(CoaType coaType, String threatType) {
        return relevance(null, coaType, null, threatType, Set.of(), Set.of());
    }

    /**
     * Relevance of a COA against the dominant threat of a situation.
     */
    public RelevanceResult relevance(Coa coa, SituationContext context) {
        return relevance(coa.id(), coa.type(), context.threatId(), context.dominantThreatType(),
                coa.keywords(), context.threatKeywords());
    }

    /**
     * Full lookup.
     *
     * @param coaId          COA identifier for critical overrides, may be null
     * @param coaType        COA type
     * @param threatId       Threat identifier for critical overrides, may be null
     * @param threatType     Threat type or name, may be null
     * @param coaKeywords    COA keywords, may be empty
     * @param threatKeywords Threat keywords, may be empty
     * @return Relevance in [0,1] with provenance
     */
    public RelevanceResult relevance(String coaId, CoaType coaType, String threatId, String threatType,
                                     Set<String> coaKeywords, Set<String> threatKeywords) {
        Optional<RelevanceTableConfig.CriticalMapping> critical = table.critical(coaId, threatId);
        if (critical.isPresent()) {
            log.debug("Critical relevance override: COA={}, threat={}, score={}",
                    coaId, threatId, critical.get().relevance());
            return new RelevanceResult(critical.get().relevance(), RelevanceSource.CRITICAL_OVERRIDE,
                    critical.get().reason(), List.of());
        }

        boolean haveKeywords = coaKeywords != null && !coaKeywords.isEmpty()
                && threatKeywords != null && !threatKeywords.isEmpty();

        Optional<RelevanceTableConfig.Mapping> mapping = table.typeMapping(coaType, threatType);
        if (mapping.isPresent()) {
            double base = mapping.get().relevance();
            if (haveKeywords) {
                double similarity = jaccard(coaKeywords, threatKeywords);
                double adjusted = clamp(base * (0.9 + 0.2 * similarity));
                log.debug("Type relevance {} x {} = {} adjusted by keywords ({}) to {}",
                        coaType, threatType, base, similarity, adjusted);
                return new RelevanceResult(adjusted, RelevanceSource.TYPE_TABLE_KEYWORD_ADJUSTED,
                        mapping.get().description(), List.of());
            }
            log.debug("Type relevance {} x {} = {}", coaType, threatType, base);
            return new RelevanceResult(base, RelevanceSource.TYPE_TABLE, mapping.get().description(), List.of());
        }

        if (haveKeywords) {
            double similarity = jaccard(coaKeywords, threatKeywords);
            log.debug("Keyword-only relevance for {} x {}: {}", coaType, threatType, similarity);
            return new RelevanceResult(similarity, RelevanceSource.KEYWORD_SIMILARITY, null, List.of());
        }

        return fallback(coaType == null ? null : coaType.label(), threatType);
    }

    private RelevanceResult fallback(String coaType, String threatType) {
        log.warn("No relevance mapping for COA type '{}' x threat '{}', using {}", coaType, threatType, DEFAULT_RELEVANCE);
        return new RelevanceResult(DEFAULT_RELEVANCE, RelevanceSource.DEFAULT, null,
                List.of(Diagnostic.dataGap(UNMAPPED_PAIR,
                        "No relevance for (" + coaType + ", " + threatType + "); using " + DEFAULT_RELEVANCE)));
    }

    /**
     * Summary of the loaded type table.
     */
    public RelevanceStats stats() {
        List<RelevanceTableConfig.Mapping> rows = table.rows();
        DoubleSummaryStatistics summary = rows.stream()
                .mapToDouble(RelevanceTableConfig.Mapping::relevance)
                .summaryStatistics();
        Set<String> coaTypes = rows.stream()
                .map(row -> CoaType.fromLabel(row.coaType()).map(CoaType::label).orElse(row.coaType()))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> threatTypes = rows.stream()
                .map(RelevanceTableConfig.Mapping::threatType)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        boolean empty = rows.isEmpty();
        return new RelevanceStats(
                rows.size(),
                empty ? 0.0 : summary.getAverage(),
                empty ? 0.0 : summary.getMin(),
                empty ? 0.0 : summary.getMax(),
                Set.copyOf(coaTypes),
                Set.copyOf(threatTypes),
                table.criticalCount());
    }

    public List<Diagnostic> loadWarnings() {
        return table.loadWarnings();
    }

    static double jaccard(Set<String> left, Set<String> right) {
        Set<String> a = lowerCase(left);
        Set<String> b = lowerCase(right);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> lowerCase(Set<String> values) {
        return values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
