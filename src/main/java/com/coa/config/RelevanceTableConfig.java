package com.coa.config;

import java.util.List;
import java.util.Map;

/**
 * Contents of a relevance table file.
 *
 * @param threatAliases Threat names mapped to the threat type used in mappings
 * @param mappings      Type-level relevance rows
 * @param critical      COA / threat instance overrides
 */
public record RelevanceTableConfig(
        Map<String, String> threatAliases,
        List<Mapping> mappings,
        List<CriticalMapping> critical
) {
    public RelevanceTableConfig {
        threatAliases = threatAliases == null ? Map.of() : Map.copyOf(threatAliases);
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
        critical = critical == null ? List.of() : List.copyOf(critical);
    }

    public static RelevanceTableConfig empty() {
        return new RelevanceTableConfig(Map.of(), List.of(), List.of());
    }

    /**
     * A (coaType, threatType) row.
     */
    public record Mapping(String coaType, String threatType, double relevance, String description) {
    }

    /**
     * A (coaId, threatId) override.
     */
    public record CriticalMapping(String coaId, String threatId, double relevance, String reason) {
    }
}
