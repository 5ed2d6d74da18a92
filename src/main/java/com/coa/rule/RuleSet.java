package com.coa.rule;

import com.coa.condition.Condition;
import com.coa.condition.ConditionEvaluator;
import com.coa.condition.DefaultConditionEvaluator;
import com.coa.config.RuleConfig;
import com.coa.config.RuleSetConfig;
import com.coa.diagnostics.Diagnostic;
import com.coa.exception.ConfigurationException;
import com.coa.model.CoaType;
import com.coa.model.SituationContext;
import com.coa.variable.DefaultVariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable compiled rule snapshot. Rules keep the ascending-priority order of the file.
 */
public final class RuleSet {

    private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

    private final String name;
    private final String version;
    private final List<CompiledRule> rules;
    private final double ruleBonus;
    private final double rulePenalty;
    private final List<Diagnostic> loadWarnings;
    private final boolean available;

    private RuleSet(String name, String version, List<CompiledRule> rules, double ruleBonus,
                    double rulePenalty, List<Diagnostic> loadWarnings, boolean available) {
        this.name = name;
        this.version = version;
        this.rules = List.copyOf(rules);
        this.ruleBonus = ruleBonus;
        this.rulePenalty = rulePenalty;
        this.loadWarnings = List.copyOf(loadWarnings);
        this.available = available;
    }

    /**
     * Compile every rule condition once. A rule whose condition does not compile is
     * skipped with a CONFIGURATION diagnostic.
     */
    public static RuleSet compile(RuleSetConfig config, ConditionEvaluator evaluator) {
        List<CompiledRule> compiled = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>(config.warnings());

        for (RuleConfig rule : config.rules()) {
            try {
                Condition condition = evaluator.create(rule.condition());
                compiled.add(new CompiledRule(rule.name(), condition, rule.conditionSource(),
                        rule.recommendedCoaType(), rule.priority()));
                log.debug("Compiled rule '{}' -> {}", rule.name(), condition);
            } catch (ConfigurationException e) {
                warnings.add(Diagnostic.configuration("malformed rule",
                        "Rule '" + rule.name() + "': " + e.getMessage()));
                log.warn("Skipping rule '{}': {}", rule.name(), e.getMessage());
            }
        }

        return new RuleSet(config.name(), config.version(), compiled, config.ruleBonus(),
                config.rulePenalty(), warnings, true);
    }

    public static RuleSet compile(RuleSetConfig config) {
        return compile(config, new DefaultConditionEvaluator(new DefaultVariableResolver()));
    }

    /**
     * A rule set with no rules that records why the rule file could not be used.
     */
    public static RuleSet unavailable(Diagnostic reason) {
        return new RuleSet("unavailable", "0", List.of(), RuleSetConfig.DEFAULT_RULE_BONUS,
                RuleSetConfig.DEFAULT_RULE_PENALTY, List.of(reason), false);
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public int size() {
        return rules.size();
    }

    public double ruleBonus() {
        return ruleBonus;
    }

    public double rulePenalty() {
        return rulePenalty;
    }

    public List<Diagnostic> loadWarnings() {
        return loadWarnings;
    }

    public boolean available() {
        return available;
    }

    List<CompiledRule> rules() {
        return rules;
    }

    /**
     * A rule with its condition compiled.
     */
    record CompiledRule(String name, Condition condition, String conditionSource,
                        CoaType recommendedCoaType, int priority) {

        boolean matches(SituationContext context) {
            return condition.evaluate(context);
        }

        RuleMatch toMatch() {
            return new RuleMatch(name, recommendedCoaType, priority, conditionSource);
        }
    }
}
