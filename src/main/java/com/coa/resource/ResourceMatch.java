package com.coa.resource;

import com.coa.diagnostics.Diagnostic;

import java.util.List;

/**
 * Weighted match of required against available resources.
 *
 * @param score    Matched weight / total weight, or a documented fallback
 * @param matched  Names of matched requirements
 * @param missing  Names of unmatched requirements (with reason when the asset exists but is unusable)
 * @param warnings DATA_GAP diagnostics for fallback results
 */
public record ResourceMatch(
        double score,
        List<String> matched,
        List<String> missing,
        List<Diagnostic> warnings
) {
    public ResourceMatch {
        matched = List.copyOf(matched);
        missing = List.copyOf(missing);
        warnings = List.copyOf(warnings);
    }

    static ResourceMatch unconstrained() {
        return new ResourceMatch(1.0, List.of(), List.of(), List.of());
    }
}
