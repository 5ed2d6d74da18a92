package com.coa.relevance;

import com.coa.diagnostics.Diagnostic;

import java.util.List;

/**
 * A relevance score with its provenance.
 *
 * @param relevance   Score in [0,1]
 * @param source      Lookup tier that produced the score
 * @param description Table description of the matched row, may be null
 * @param warnings    DATA_GAP diagnostics when the default was used
 */
public record RelevanceResult(
        double relevance,
        RelevanceSource source,
        String description,
        List<Diagnostic> warnings
) {
    public RelevanceResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isDefault() {
        return source == RelevanceSource.DEFAULT;
    }
}
