package com.coa.condition;

import com.coa.model.SituationContext;

/**
 * A compiled boolean condition over the scalar fields of a situation.
 */
public interface Condition {

    /**
     * Evaluate this condition. A field missing from the context makes a comparison false.
     *
     * @param context Situation to test
     * @return true if the condition matches
     */
    boolean evaluate(SituationContext context);

    ConditionType getType();
}
