package com.coa.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for COA ranking.
 */
@ConfigurationProperties(prefix = "coa")
public class CoaProperties {

    /**
     * Whether COA ranking is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rule file. Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:rules/defense-rules.yaml";

    /**
     * Path to the threat / COA relevance table.
     */
    private String relevancePath = "classpath:relevance.yaml";

    /**
     * Path to the scoring weights and pipeline parameters.
     */
    private String scoringPath = "classpath:coa-scoring.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }

    public String getRelevancePath() {
        return relevancePath;
    }

    public void setRelevancePath(String relevancePath) {
        this.relevancePath = relevancePath;
    }

    public String getScoringPath() {
        return scoringPath;
    }

    public void setScoringPath(String scoringPath) {
        this.scoringPath = scoringPath;
    }
}
