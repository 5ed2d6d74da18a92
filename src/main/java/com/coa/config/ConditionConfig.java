package com.coa.config;

import com.coa.condition.ConditionType;

import java.util.List;

/**
 * Parsed form of a rule condition, compiled into a Condition at load time.
 *
 * @param type       Condition type
 * @param field      Context field name for comparisons
 * @param value      Literal to compare against
 * @param conditions Nested conditions for AND / OR / NOT
 */
public record ConditionConfig(
        ConditionType type,
        String field,
        Object value,
        List<ConditionConfig> conditions
) {
    public static ConditionConfig alwaysTrue() {
        return new ConditionConfig(ConditionType.ALWAYS_TRUE, null, null, null);
    }

    public static ConditionConfig comparison(ConditionType type, String field, Object value) {
        return new ConditionConfig(type, field, value, null);
    }

    public static ConditionConfig greaterThan(String field, Number value) {
        return comparison(ConditionType.GREATER_THAN, field, value);
    }

    public static ConditionConfig and(List<ConditionConfig> conditions) {
        return new ConditionConfig(ConditionType.AND, null, null, conditions);
    }

    public static ConditionConfig or(List<ConditionConfig> conditions) {
        return new ConditionConfig(ConditionType.OR, null, null, conditions);
    }

    public static ConditionConfig not(ConditionConfig condition) {
        return new ConditionConfig(ConditionType.NOT, null, null, List.of(condition));
    }
}
