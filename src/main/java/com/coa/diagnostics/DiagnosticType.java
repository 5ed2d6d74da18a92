package com.coa.diagnostics;

/**
 * Categories of recovered problems surfaced in scoring output.
 */
public enum DiagnosticType {
    /** Malformed or missing rule / relevance / scoring file; defaults were used. */
    CONFIGURATION,

    /** Missing mapping or situation data; a documented fallback constant was used. */
    DATA_GAP,

    /** Malformed resource-priority token; the token was skipped. */
    PARSE
}
