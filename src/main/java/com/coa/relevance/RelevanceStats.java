package com.coa.relevance;

import java.util.Set;

/**
 * Summary of a loaded relevance table.
 *
 * @param totalMappings     Type-level rows
 * @param avgRelevance      Mean relevance over type-level rows (0 when empty)
 * @param minRelevance      Minimum relevance (0 when empty)
 * @param maxRelevance      Maximum relevance (0 when empty)
 * @param coaTypes          Distinct COA types in the table
 * @param threatTypes       Distinct threat types in the table
 * @param criticalOverrides Instance-level overrides
 */
public record RelevanceStats(
        int totalMappings,
        double avgRelevance,
        double minRelevance,
        double maxRelevance,
        Set<String> coaTypes,
        Set<String> threatTypes,
        int criticalOverrides
) {
}
