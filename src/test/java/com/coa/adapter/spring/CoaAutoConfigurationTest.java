package com.coa.adapter.spring;

import com.coa.pipeline.DecisionPipeline;
import com.coa.pipeline.DecisionRequestReader;
import com.coa.pipeline.ScoringSnapshot;
import com.coa.rule.RuleEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CoaAutoConfiguration.
 */
class CoaAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CoaAutoConfiguration.class));

    @Test
    @DisplayName("Registers the pipeline beans from bundled configuration")
    void registersBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(ScoringSnapshot.class));
            assertNotNull(context.getBean(DecisionRequestReader.class));
            assertEquals(5, context.getBean(RuleEngine.class).currentRuleSet().size());

            DecisionPipeline pipeline = context.getBean(DecisionPipeline.class);
            assertSame(context.getBean(ScoringSnapshot.class), pipeline.currentSnapshot());
            assertTrue(pipeline.currentSnapshot().loadWarnings().isEmpty());
        });
    }

    @Test
    @DisplayName("Honors configured file paths")
    void configuredPaths() {
        contextRunner
                .withPropertyValues("coa.rules-path=classpath:rules/threat-level-rules.yaml",
                        "coa.scoring-path=classpath:scoring-test.yaml")
                .run(context -> {
                    assertEquals("threat-level-rules", context.getBean(RuleEngine.class).currentRuleSet().name());
                    assertEquals(2, context.getBean(ScoringSnapshot.class).config().pipeline().topK());
                });
    }

    @Test
    @DisplayName("Backs off when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("coa.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(DecisionPipeline.class).isEmpty()));
    }
}
