package com.coa.condition;

/**
 * Supported rule condition types.
 */
public enum ConditionType {
    // Comparison
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    GREATER_THAN_OR_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUALS,

    // Logical
    AND,
    OR,
    NOT,

    // Special
    ALWAYS_TRUE
}
