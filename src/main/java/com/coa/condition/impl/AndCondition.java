package com.coa.condition.impl;

import com.coa.condition.Condition;
import com.coa.condition.ConditionType;
import com.coa.model.SituationContext;

import java.util.List;

/**
 * Logical AND: all nested conditions must match.
 */
public class AndCondition implements Condition {

    private final List<Condition> conditions;

    public AndCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(SituationContext context) {
        return conditions.stream().allMatch(c -> c.evaluate(context));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public String toString() {
        return "AND(" + conditions + ")";
    }
}
