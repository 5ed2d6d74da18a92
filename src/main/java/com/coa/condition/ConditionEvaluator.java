package com.coa.condition;

import com.coa.config.ConditionConfig;
import com.coa.model.SituationContext;

/**
 * Factory and evaluator for conditions.
 */
public interface ConditionEvaluator {

    /**
     * Compile a condition configuration.
     *
     * @param config Condition configuration
     * @return Reusable Condition instance
     */
    Condition create(ConditionConfig config);

    default boolean evaluate(ConditionConfig config, SituationContext context) {
        return create(config).evaluate(context);
    }
}
