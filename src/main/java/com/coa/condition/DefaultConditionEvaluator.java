package com.coa.condition;

import com.coa.condition.impl.AlwaysTrueCondition;
import com.coa.condition.impl.AndCondition;
import com.coa.condition.impl.ComparisonCondition;
import com.coa.condition.impl.EqualsCondition;
import com.coa.condition.impl.NotCondition;
import com.coa.condition.impl.OrCondition;
import com.coa.config.ConditionConfig;
import com.coa.exception.ConfigurationException;
import com.coa.variable.VariableResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds Condition instances from ConditionConfig trees.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private final VariableResolver variableResolver;

    public DefaultConditionEvaluator(VariableResolver variableResolver) {
        this.variableResolver = variableResolver;
    }

    @Override
    public Condition create(ConditionConfig config) {
        if (config == null) {
            throw new ConfigurationException("Condition configuration cannot be null");
        }

        ConditionType type = config.type();
        if (type == null) {
            throw new ConfigurationException("Condition type cannot be null");
        }

        return switch (type) {
            case ALWAYS_TRUE -> AlwaysTrueCondition.INSTANCE;

            case EQUALS -> createEqualsCondition(config, false);
            case NOT_EQUALS -> createEqualsCondition(config, true);

            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS ->
                    createComparisonCondition(config, type);

            case AND -> new AndCondition(createNestedConditions(config));
            case OR -> new OrCondition(createNestedConditions(config));
            case NOT -> createNotCondition(config);
        };
    }

    private Condition createEqualsCondition(ConditionConfig config, boolean negated) {
        validateField(config);
        if (config.value() == null) {
            throw new ConfigurationException(config.type() + " condition requires a value");
        }
        return new EqualsCondition(config.field(), config.value(), negated, variableResolver);
    }

    private Condition createComparisonCondition(ConditionConfig config, ConditionType type) {
        validateField(config);
        if (!(config.value() instanceof Number threshold)) {
            throw new ConfigurationException(type + " condition requires a numeric value");
        }
        return new ComparisonCondition(config.field(), threshold, type, variableResolver);
    }

    private Condition createNotCondition(ConditionConfig config) {
        List<Condition> nested = createNestedConditions(config);
        if (nested.size() != 1) {
            throw new ConfigurationException("NOT condition must have exactly one nested condition");
        }
        return new NotCondition(nested.get(0));
    }

    private List<Condition> createNestedConditions(ConditionConfig config) {
        if (config.conditions() == null || config.conditions().isEmpty()) {
            throw new ConfigurationException(config.type() + " condition requires nested conditions");
        }
        List<Condition> conditions = new ArrayList<>();
        for (ConditionConfig cfg : config.conditions()) {
            conditions.add(create(cfg));
        }
        return conditions;
    }

    private void validateField(ConditionConfig config) {
        if (config.field() == null || config.field().isBlank()) {
            throw new ConfigurationException(config.type() + " condition requires a field");
        }
    }
}
