package com.coa.config;

import com.coa.condition.ConditionType;
import com.coa.config.expression.ExpressionParser;
import com.coa.config.expression.ExpressionTokenizer;
import com.coa.config.expression.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Facade for parsing rule conditions into ConditionConfig trees.
 * <p>
 * Supports comparisons (==, =, !=, >, >=, <, <=), AND / OR / NOT and parentheses.
 * Precedence: NOT > AND > OR.
 */
public final class ConditionExpressionParser {

    private static final String OPERATOR_START = "<>=!(";

    private ConditionExpressionParser() {
    }

    /**
     * Parse a full expression such as {@code threatLevel > 0.7 and forceRatio < 1.0}.
     *
     * @param expression Expression string
     * @return Parsed condition; ALWAYS_TRUE for a blank expression
     */
    public static ConditionConfig parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return ConditionConfig.alwaysTrue();
        }
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        return new ExpressionParser(expression, tokens).parse();
    }

    /**
     * Parse an expression whose comparisons apply to one field, e.g. {@code "> 0.4 and <= 0.7"}.
     */
    public static ConditionConfig parseForField(String field, String expression) {
        if (expression == null || expression.isBlank()) {
            return ConditionConfig.alwaysTrue();
        }
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        return new ExpressionParser(expression, tokens, field).parse();
    }

    /**
     * Parse the map form of a condition. A string value starting with an operator is a
     * field bound expression; any other value is an equality test; a nested map is parsed
     * recursively. Entries are AND-ed.
     */
    @SuppressWarnings("unchecked")
    public static ConditionConfig parseFieldMap(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return ConditionConfig.alwaysTrue();
        }
        List<ConditionConfig> conditions = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                conditions.add(parseFieldMap((Map<String, Object>) nested));
            } else if (value instanceof String text && startsWithOperator(text)) {
                conditions.add(parseForField(entry.getKey(), text));
            } else {
                conditions.add(ConditionConfig.comparison(ConditionType.EQUALS, entry.getKey(), literal(value)));
            }
        }
        return conditions.size() == 1 ? conditions.get(0) : ConditionConfig.and(conditions);
    }

    private static boolean startsWithOperator(String text) {
        String trimmed = text.trim();
        return !trimmed.isEmpty() && OPERATOR_START.indexOf(trimmed.charAt(0)) >= 0;
    }

    private static Object literal(Object value) {
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return text.trim();
            }
        }
        return value;
    }
}
