package com.coa.adapter.spring;

import com.coa.pipeline.DecisionPipeline;
import com.coa.pipeline.DecisionRequestReader;
import com.coa.pipeline.ScoringSnapshot;
import com.coa.rule.ExpressionRuleEngine;
import com.coa.rule.RuleEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for COA ranking.
 */
@Configuration
@ConditionalOnProperty(prefix = "coa", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CoaProperties.class)
public class CoaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoaAutoConfiguration.class);

    private DecisionPipeline decisionPipeline;

    @Bean
    @ConditionalOnMissingBean
    public ScoringSnapshot scoringSnapshot(CoaProperties properties) {
        log.info("Loading scoring tables from: {}, {}", properties.getRelevancePath(), properties.getScoringPath());
        return ScoringSnapshot.load(properties.getRelevancePath(), properties.getScoringPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine(CoaProperties properties) {
        log.info("Loading COA rules from: {}", properties.getRulesPath());
        return new ExpressionRuleEngine(properties.getRulesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionPipeline decisionPipeline(ScoringSnapshot snapshot, RuleEngine ruleEngine) {
        this.decisionPipeline = new DecisionPipeline(snapshot, ruleEngine);
        return this.decisionPipeline;
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionRequestReader decisionRequestReader(ScoringSnapshot snapshot) {
        return new DecisionRequestReader(snapshot.resourceParser());
    }

    @PreDestroy
    public void shutdown() {
        if (decisionPipeline != null) {
            decisionPipeline.shutdown();
        }
    }
}
