package com.coa.condition.impl;

import com.coa.condition.Condition;
import com.coa.condition.ConditionType;
import com.coa.model.SituationContext;
import com.coa.variable.VariableResolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Equality (or inequality) of a context field and a literal.
 * Numbers compare by value; booleans compare as 1 / 0 against numbers; other values by string form.
 */
public class EqualsCondition implements Condition {

    private final String field;
    private final Object expectedValue;
    private final boolean negated;
    private final VariableResolver resolver;

    public EqualsCondition(String field, Object expectedValue, boolean negated, VariableResolver resolver) {
        this.field = field;
        this.expectedValue = expectedValue;
        this.negated = negated;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(SituationContext context) {
        Optional<Object> actual = resolver.resolve(field, context);
        if (actual.isEmpty()) {
            return false;
        }
        return compareValues(actual.get(), expectedValue) != negated;
    }

    private boolean compareValues(Object actual, Object expected) {
        if (Objects.equals(actual, expected)) {
            return true;
        }
        if (expected instanceof Number number) {
            Optional<Double> actualNumber = VariableResolver.toDouble(actual);
            return actualNumber.isPresent() && actualNumber.get() == number.doubleValue();
        }
        return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
    }

    @Override
    public ConditionType getType() {
        return negated ? ConditionType.NOT_EQUALS : ConditionType.EQUALS;
    }

    @Override
    public String toString() {
        return field + (negated ? " != " : " == ") + expectedValue;
    }
}
