package com.coa.condition.impl;

import com.coa.condition.Condition;
import com.coa.condition.ConditionType;
import com.coa.model.SituationContext;

import java.util.List;

/**
 * Logical OR: at least one nested condition must match.
 */
public class OrCondition implements Condition {

    private final List<Condition> conditions;

    public OrCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(SituationContext context) {
        return conditions.stream().anyMatch(c -> c.evaluate(context));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.OR;
    }

    @Override
    public String toString() {
        return "OR(" + conditions + ")";
    }
}
