package com.coa.rule;

import com.coa.model.CoaType;

/**
 * A rule that matched a situation.
 *
 * @param ruleName           Rule name
 * @param recommendedCoaType Recommended COA type
 * @param priority           Rule priority (lower wins)
 * @param condition          Condition source text
 */
public record RuleMatch(
        String ruleName,
        CoaType recommendedCoaType,
        int priority,
        String condition
) {
}
