package com.coa.relevance;

/**
 * Which lookup tier produced a relevance score.
 */
public enum RelevanceSource {
    CRITICAL_OVERRIDE,
    TYPE_TABLE,
    TYPE_TABLE_KEYWORD_ADJUSTED,
    KEYWORD_SIMILARITY,
    DEFAULT
}
