package com.coa.condition.impl;

import com.coa.condition.Condition;
import com.coa.condition.ConditionType;
import com.coa.model.SituationContext;

/**
 * Condition that always matches. Used for rules without a condition.
 */
public final class AlwaysTrueCondition implements Condition {

    public static final AlwaysTrueCondition INSTANCE = new AlwaysTrueCondition();

    private AlwaysTrueCondition() {
    }

    @Override
    public boolean evaluate(SituationContext context) {
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_TRUE;
    }

    @Override
    public String toString() {
        return "ALWAYS_TRUE";
    }
}
