package com.coa.relevance;

import com.coa.config.RelevanceTableConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.model.CoaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable relevance lookup tables. A reload builds a new instance.
 */
public final class RelevanceTable {

    private static final Logger log = LoggerFactory.getLogger(RelevanceTable.class);

    private final Map<CoaType, Map<String, RelevanceTableConfig.Mapping>> typeTable;
    private final Map<String, String> threatAliases;
    private final Map<String, RelevanceTableConfig.CriticalMapping> critical;
    private final List<RelevanceTableConfig.Mapping> rows;
    private final List<Diagnostic> loadWarnings;

    private RelevanceTable(Map<CoaType, Map<String, RelevanceTableConfig.Mapping>> typeTable,
                           Map<String, String> threatAliases,
                           Map<String, RelevanceTableConfig.CriticalMapping> critical,
                           List<RelevanceTableConfig.Mapping> rows,
                           List<Diagnostic> loadWarnings) {
        this.typeTable = typeTable;
        this.threatAliases = threatAliases;
        this.critical = critical;
        this.rows = rows;
        this.loadWarnings = loadWarnings;
    }

    public static RelevanceTable empty() {
        return from(RelevanceTableConfig.empty());
    }

    /**
     * Build an empty table that records why the real one is missing.
     */
    public static RelevanceTable unavailable(Diagnostic reason) {
        RelevanceTable empty = empty();
        return new RelevanceTable(empty.typeTable, empty.threatAliases, empty.critical, empty.rows, List.of(reason));
    }

    /**
     * Build a table from configuration. Rows naming an unknown COA type are skipped
     * with a CONFIGURATION diagnostic; for duplicate rows the first one wins.
     */
    public static RelevanceTable from(RelevanceTableConfig config) {
        List<Diagnostic> warnings = new ArrayList<>();
        Map<CoaType, Map<String, RelevanceTableConfig.Mapping>> typeTable = new EnumMap<>(CoaType.class);
        List<RelevanceTableConfig.Mapping> rows = new ArrayList<>();

        for (RelevanceTableConfig.Mapping mapping : config.mappings()) {
            Optional<CoaType> type = CoaType.fromLabel(mapping.coaType());
            if (type.isEmpty()) {
                warnings.add(Diagnostic.configuration("unknown coa type",
                        "Relevance row names unknown COA type '" + mapping.coaType() + "'"));
                log.warn("Skipping relevance row with unknown COA type '{}'", mapping.coaType());
                continue;
            }
            RelevanceTableConfig.Mapping clamped = new RelevanceTableConfig.Mapping(mapping.coaType(),
                    mapping.threatType(), clamp(mapping.relevance()), mapping.description());
            Map<String, RelevanceTableConfig.Mapping> byThreat =
                    typeTable.computeIfAbsent(type.get(), t -> new LinkedHashMap<>());
            if (byThreat.putIfAbsent(normalize(mapping.threatType()), clamped) == null) {
                rows.add(clamped);
            } else {
                log.debug("Duplicate relevance row {} x {} ignored", mapping.coaType(), mapping.threatType());
            }
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        config.threatAliases().forEach((alias, threatType) -> aliases.put(normalize(alias), normalize(threatType)));

        Map<String, RelevanceTableConfig.CriticalMapping> critical = new LinkedHashMap<>();
        for (RelevanceTableConfig.CriticalMapping mapping : config.critical()) {
            critical.putIfAbsent(criticalKey(mapping.coaId(), mapping.threatId()),
                    new RelevanceTableConfig.CriticalMapping(mapping.coaId(), mapping.threatId(),
                            clamp(mapping.relevance()), mapping.reason()));
        }

        Map<CoaType, Map<String, RelevanceTableConfig.Mapping>> frozen = new EnumMap<>(CoaType.class);
        typeTable.forEach((type, byThreat) -> frozen.put(type, Map.copyOf(byThreat)));

        return new RelevanceTable(frozen, Map.copyOf(aliases), Map.copyOf(critical),
                List.copyOf(rows), List.copyOf(warnings));
    }

    Optional<RelevanceTableConfig.CriticalMapping> critical(String coaId, String threatId) {
        if (coaId == null || threatId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(critical.get(criticalKey(coaId, threatId)));
    }

    Optional<RelevanceTableConfig.Mapping> typeMapping(CoaType coaType, String threatType) {
        if (coaType == null || threatType == null) {
            return Optional.empty();
        }
        Map<String, RelevanceTableConfig.Mapping> byThreat = typeTable.get(coaType);
        if (byThreat == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byThreat.get(resolveThreatType(threatType)));
    }

    /**
     * Normalize a threat name through the alias table.
     */
    String resolveThreatType(String threatType) {
        String key = normalize(threatType);
        return threatAliases.getOrDefault(key, key);
    }

    List<RelevanceTableConfig.Mapping> rows() {
        return rows;
    }

    int criticalCount() {
        return critical.size();
    }

    public List<Diagnostic> loadWarnings() {
        return loadWarnings;
    }

    private static String criticalKey(String coaId, String threatId) {
        return coaId.trim() + "|" + threatId.trim();
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
