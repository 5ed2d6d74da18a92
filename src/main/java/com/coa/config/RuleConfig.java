package com.coa.config;

import com.coa.model.CoaType;

/**
 * One rule of a rule file.
 *
 * @param name               Rule name
 * @param condition          Parsed condition
 * @param conditionSource    Condition as written in the file, for logging
 * @param recommendedCoaType COA type the rule recommends
 * @param priority           Precedence; lower wins
 * @param description        Optional description
 */
public record RuleConfig(
        String name,
        ConditionConfig condition,
        String conditionSource,
        CoaType recommendedCoaType,
        int priority,
        String description
) {
}
