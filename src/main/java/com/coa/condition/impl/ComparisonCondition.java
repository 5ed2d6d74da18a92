package com.coa.condition.impl;

import com.coa.condition.Condition;
import com.coa.condition.ConditionType;
import com.coa.model.SituationContext;
import com.coa.variable.VariableResolver;

import java.util.Optional;

/**
 * Numeric comparison (>, >=, <, <=) of a context field against a threshold.
 */
public class ComparisonCondition implements Condition {

    private final String field;
    private final Number threshold;
    private final ConditionType type;
    private final VariableResolver resolver;

    public ComparisonCondition(String field, Number threshold, ConditionType type, VariableResolver resolver) {
        this.field = field;
        this.threshold = threshold;
        this.type = type;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(SituationContext context) {
        Optional<Double> actual = resolver.resolveAsDouble(field, context);
        if (actual.isEmpty()) {
            return false;
        }

        double actualValue = actual.get();
        double thresholdValue = threshold.doubleValue();

        return switch (type) {
            case GREATER_THAN -> actualValue > thresholdValue;
            case GREATER_THAN_OR_EQUALS -> actualValue >= thresholdValue;
            case LESS_THAN -> actualValue < thresholdValue;
            case LESS_THAN_OR_EQUALS -> actualValue <= thresholdValue;
            default -> throw new IllegalStateException("Invalid comparison type: " + type);
        };
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        String op = switch (type) {
            case GREATER_THAN -> ">";
            case GREATER_THAN_OR_EQUALS -> ">=";
            case LESS_THAN -> "<";
            case LESS_THAN_OR_EQUALS -> "<=";
            default -> "?";
        };
        return field + " " + op + " " + threshold;
    }
}
