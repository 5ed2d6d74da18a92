package com.coa.config;

import com.coa.diagnostics.Diagnostic;

import java.util.List;
import java.util.Map;

/**
 * Contents of a rule file.
 *
 * @param name     Rule set name
 * @param version  Rule set version
 * @param weights  Named scalar gains (rule-bonus, rule-penalty)
 * @param rules    Valid rules sorted by ascending priority
 * @param warnings CONFIGURATION diagnostics for rules that were skipped
 */
public record RuleSetConfig(
        String name,
        String version,
        Map<String, Double> weights,
        List<RuleConfig> rules,
        List<Diagnostic> warnings
) {
    public static final String RULE_BONUS = "rule-bonus";
    public static final String RULE_PENALTY = "rule-penalty";
    public static final double DEFAULT_RULE_BONUS = 0.1;
    public static final double DEFAULT_RULE_PENALTY = 0.05;

    public RuleSetConfig {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
        rules = rules == null ? List.of() : List.copyOf(rules);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RuleSetConfig empty() {
        return new RuleSetConfig("empty", "0", Map.of(), List.of(), List.of());
    }

    public double weight(String key, double defaultValue) {
        return weights.getOrDefault(key, defaultValue);
    }

    public double ruleBonus() {
        return weight(RULE_BONUS, DEFAULT_RULE_BONUS);
    }

    public double rulePenalty() {
        return weight(RULE_PENALTY, DEFAULT_RULE_PENALTY);
    }
}
