package com.coa.rule;

import com.coa.condition.ConditionEvaluator;
import com.coa.condition.DefaultConditionEvaluator;
import com.coa.config.ConfigLoader;
import com.coa.diagnostics.Diagnostic;
import com.coa.exception.ConfigurationException;
import com.coa.model.SituationContext;
import com.coa.scoring.ScoreBreakdown;
import com.coa.variable.DefaultVariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rule engine over compiled condition expressions. Rules are evaluated sequentially in
 * ascending priority; the first match wins.
 * <p>
 * The compiled {@link RuleSet} is held in an atomic reference: every call reads one
 * snapshot, and {@link #reload()} swaps in a new one. A rule file that cannot be loaded
 * at startup yields an empty rule set; a failed reload keeps the previous snapshot.
 */
public class ExpressionRuleEngine implements RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(ExpressionRuleEngine.class);

    public static final String NO_RULE_MATCHED = "no rule matched";

    private final String rulesPath;
    private final ConditionEvaluator conditionEvaluator;
    private final AtomicReference<RuleSet> ruleSet;

    /**
     * Create an engine backed by a rule file.
     *
     * @param rulesPath Rule file path; {@code classpath:} prefix supported
     */
    public ExpressionRuleEngine(String rulesPath) {
        this.rulesPath = rulesPath;
        this.conditionEvaluator = new DefaultConditionEvaluator(new DefaultVariableResolver());
        this.ruleSet = new AtomicReference<>(loadOrDegrade(rulesPath));
        log.info("ExpressionRuleEngine initialized with {} rules from {}", ruleSet.get().size(), rulesPath);
    }

    /**
     * Create an engine over an already compiled rule set. {@link #reload()} is a no-op.
     */
    public ExpressionRuleEngine(RuleSet rules) {
        this.rulesPath = null;
        this.conditionEvaluator = new DefaultConditionEvaluator(new DefaultVariableResolver());
        this.ruleSet = new AtomicReference<>(rules);
    }

    private RuleSet loadOrDegrade(String path) {
        try {
            return RuleSet.compile(ConfigLoader.loadRuleSet(path), conditionEvaluator);
        } catch (ConfigurationException e) {
            log.warn("Rule file unavailable, rule adjustment disabled: {}", e.getMessage());
            return RuleSet.unavailable(Diagnostic.configuration("rule file unavailable", e.getMessage()));
        }
    }

    @Override
    public Optional<RuleMatch> evaluate(SituationContext context) {
        return evaluate(ruleSet.get(), context);
    }

    private Optional<RuleMatch> evaluate(RuleSet rules, SituationContext context) {
        for (RuleSet.CompiledRule rule : rules.rules()) {
            if (rule.matches(context)) {
                log.debug("Situation {} matched rule '{}' -> {}",
                        context.situationId(), rule.name(), rule.recommendedCoaType());
                return Optional.of(rule.toMatch());
            }
        }
        log.debug("Situation {} matched no rule", context.situationId());
        return Optional.empty();
    }

    @Override
    public List<RuleMatch> findMatchingRules(SituationContext context) {
        List<RuleMatch> matches = new ArrayList<>();
        for (RuleSet.CompiledRule rule : ruleSet.get().rules()) {
            if (rule.matches(context)) {
                matches.add(rule.toMatch());
            }
        }
        return matches;
    }

    @Override
    public RuleAdjustment applyScoring(List<ScoreBreakdown> breakdowns, SituationContext context) {
        RuleSet rules = ruleSet.get();

        if (!rules.available()) {
            return new RuleAdjustment(breakdowns, null, rules.loadWarnings());
        }

        Optional<RuleMatch> match = evaluate(rules, context);
        if (match.isEmpty()) {
            log.warn("No rule matched situation {}, scores left unadjusted", context.situationId());
            return new RuleAdjustment(breakdowns, null, List.of(Diagnostic.dataGap(NO_RULE_MATCHED,
                    "No rule in '" + rules.name() + "' matched; scores left unadjusted")));
        }

        RuleMatch matched = match.get();
        List<ScoreBreakdown> adjusted = new ArrayList<>(breakdowns.size());
        for (ScoreBreakdown breakdown : breakdowns) {
            double delta = breakdown.coaType() == matched.recommendedCoaType()
                    ? rules.ruleBonus()
                    : -rules.rulePenalty();
            adjusted.add(breakdown.withRuleAdjustment(matched.ruleName(), delta));
        }

        log.debug("Rule '{}' adjusted {} candidates (+{} for {}, -{} otherwise)", matched.ruleName(),
                adjusted.size(), rules.ruleBonus(), matched.recommendedCoaType(), rules.rulePenalty());
        return new RuleAdjustment(adjusted, matched, List.of());
    }

    @Override
    public void reload() {
        if (rulesPath == null) {
            log.info("ExpressionRuleEngine reload requested, no rule file configured");
            return;
        }
        try {
            RuleSet fresh = RuleSet.compile(ConfigLoader.loadRuleSet(rulesPath), conditionEvaluator);
            ruleSet.set(fresh);
            log.info("Reloaded rule set '{}' v{} with {} rules", fresh.name(), fresh.version(), fresh.size());
        } catch (ConfigurationException e) {
            log.warn("Rule reload failed, keeping '{}': {}", ruleSet.get().name(), e.getMessage());
        }
    }

    @Override
    public RuleSet currentRuleSet() {
        return ruleSet.get();
    }
}
