package com.coa.condition.impl;

import com.coa.condition.Condition;
import com.coa.condition.ConditionType;
import com.coa.model.SituationContext;

/**
 * Logical NOT of a nested condition.
 */
public class NotCondition implements Condition {

    private final Condition condition;

    public NotCondition(Condition condition) {
        this.condition = condition;
    }

    @Override
    public boolean evaluate(SituationContext context) {
        return !condition.evaluate(context);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
