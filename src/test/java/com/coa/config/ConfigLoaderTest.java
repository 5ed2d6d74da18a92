package com.coa.config;

import com.coa.diagnostics.DiagnosticType;
import com.coa.exception.ConfigurationException;
import com.coa.mettc.MettCDimension;
import com.coa.model.CoaType;
import com.coa.pipeline.ScoringSnapshot;
import com.coa.relevance.RelevanceMapper;
import com.coa.scoring.Factor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    // =====================================================================
    // Rule files
    // =====================================================================

    @Test
    @DisplayName("Should load a rule list with weights")
    void loadRuleList() {
        RuleSetConfig config = ConfigLoader.loadRuleSet("classpath:rules/threat-level-rules.yaml");

        assertEquals("threat-level-rules", config.name());
        assertEquals("1.0", config.version());
        assertEquals(2, config.rules().size());
        assertEquals(0.1, config.ruleBonus(), 1e-9);
        assertEquals(0.05, config.rulePenalty(), 1e-9);

        RuleConfig first = config.rules().get(0);
        assertEquals("high-threat-defense", first.name());
        assertEquals(CoaType.DEFENSE, first.recommendedCoaType());
        assertEquals(1, first.priority());
        assertEquals("threatLevel > 0.7", first.conditionSource());
        assertTrue(config.warnings().isEmpty());
    }

    @Test
    @DisplayName("Should load map-keyed rules with field map conditions, sorted by priority")
    void loadMapFormRules() {
        RuleSetConfig config = ConfigLoader.loadRuleSet("classpath:rules/map-form-rules.yaml");

        assertEquals(List.of("medium-threat-counter-attack", "medium-threat-deterrence", "defense-mission"),
                config.rules().stream().map(RuleConfig::name).toList());
        assertEquals(CoaType.COUNTER_ATTACK, config.rules().get(0).recommendedCoaType());
        assertEquals(CoaType.DETERRENCE, config.rules().get(1).recommendedCoaType());
        assertEquals(0.2, config.ruleBonus(), 1e-9);
        assertEquals(RuleSetConfig.DEFAULT_RULE_PENALTY, config.rulePenalty(), 1e-9);
    }

    @Test
    @DisplayName("Malformed rules are skipped with CONFIGURATION warnings")
    void skipMalformedRules() {
        RuleSetConfig config = ConfigLoader.loadRuleSet("classpath:rules/malformed-rules.yaml");

        assertEquals(1, config.rules().size());
        assertEquals("valid-rule", config.rules().get(0).name());
        assertEquals(4, config.warnings().size());
        assertTrue(config.warnings().stream().allMatch(w -> w.type() == DiagnosticType.CONFIGURATION));
    }

    @Test
    @DisplayName("Missing file throws ConfigurationException")
    void missingFileThrows() {
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadRuleSet("classpath:rules/does-not-exist.yaml"));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadRuleSet("/no/such/dir/rules.yaml"));
    }

    @Test
    @DisplayName("Malformed YAML throws ConfigurationException")
    void malformedYamlThrows() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadRuleSet("classpath:rules/broken-yaml.yaml"));
        assertTrue(e.getMessage().contains("Malformed YAML"));
    }

    // =====================================================================
    // Relevance files
    // =====================================================================

    @Test
    @DisplayName("Should load mappings, matrix rows, aliases and critical overrides")
    void loadRelevanceTable() {
        RelevanceTableConfig config = ConfigLoader.loadRelevanceTable("classpath:relevance-test.yaml");

        // 3 list rows + 4 matrix cells
        assertEquals(7, config.mappings().size());
        assertEquals("포격", config.threatAliases().get("artillery"));
        assertEquals(1, config.critical().size());
        assertEquals(0.95, config.critical().get(0).relevance(), 1e-9);
        assertTrue(config.mappings().stream().anyMatch(m ->
                m.coaType().equals("counter_attack") && m.threatType().equals("포격") && m.relevance() == 1.0));
    }

    @Test
    @DisplayName("Bundled relevance table loads")
    void loadBundledRelevanceTable() {
        RelevanceTableConfig config = ConfigLoader.loadRelevanceTable("classpath:relevance.yaml");

        assertFalse(config.mappings().isEmpty());
        assertEquals("포격", config.threatAliases().get("artillery"));
    }

    // =====================================================================
    // Scoring files
    // =====================================================================

    @Test
    @DisplayName("Scoring weights are normalized and missing keys take defaults")
    void loadScoringConfig() {
        ScoringConfig config = ConfigLoader.loadScoringConfig("classpath:scoring-test.yaml");

        assertEquals(0.2, config.weight(Factor.MISSION_ALIGNMENT), 1e-9);
        assertEquals(0.2, config.weight(Factor.COMBAT_POWER), 1e-9);
        assertEquals(0.1, config.weight(Factor.ASSETS), 1e-9);
        assertEquals(1.0 / 6, config.weight(MettCDimension.CIVILIAN), 1e-9);

        assertEquals(2, config.pipeline().topK());
        assertEquals(0.5, config.pipeline().mettCBlendWeight(), 1e-9);
        assertEquals(8, config.pipeline().parallelThreshold());
        assertEquals(2, config.pipeline().poolSize());
        assertEquals(0.4, config.civilian().exclusionThreshold(), 1e-9);
        assertEquals(1000.0, config.civilian().densityReference(), 1e-9);
        assertEquals(0.5, config.terrain().base(), 1e-9);

        assertEquals(1.0, config.alignment("hold", CoaType.DEFENSE).orElseThrow(), 1e-9);
    }

    @Test
    @DisplayName("Bundled scoring file matches the built-in defaults")
    void bundledScoringMatchesDefaults() {
        ScoringConfig loaded = ConfigLoader.loadScoringConfig("classpath:coa-scoring.yaml");
        ScoringConfig defaults = ScoringConfig.defaults();

        for (Factor factor : Factor.values()) {
            assertEquals(defaults.weight(factor), loaded.weight(factor), 1e-9, factor.key());
        }
        assertEquals(defaults.pipeline(), loaded.pipeline());
        assertEquals(defaults.alignment("방어", CoaType.DETERRENCE), loaded.alignment("defense", CoaType.DETERRENCE));
    }

    @Test
    @DisplayName("Unknown scoring factor throws ConfigurationException")
    void unknownFactorThrows() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadScoringConfig("classpath:scoring-unknown-factor.yaml"));
        assertTrue(e.getMessage().contains("morale"));
    }

    // =====================================================================
    // Wrongly shaped sections
    // =====================================================================

    @Test
    @DisplayName("Rule weights given as a list throw ConfigurationException")
    void ruleWeightsAsList() throws IOException {
        Path file = write("rules.yaml", "rule-set: {weights: [0.1, 0.05], rules: []}\n");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadRuleSet(file.toString()));
        assertTrue(e.getMessage().contains("weights"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "relevance: {threat-aliases: [a, b]}   | threat-aliases",
            "relevance: {matrix: 3}                | matrix"
    })
    @DisplayName("Relevance sections of the wrong shape throw ConfigurationException")
    void relevanceSectionsWrongShape(String yaml, String key) throws IOException {
        Path file = write("relevance.yaml", yaml + "\n");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadRelevanceTable(file.toString()));
        assertTrue(e.getMessage().contains(key));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "scoring: {weights: 3}                      | weights",
            "scoring: {mett-c-weights: [0.5]}           | mett-c-weights",
            "scoring: {mission-alignment: hold}         | mission-alignment",
            "scoring: {mission-aliases: [defense, hold]} | mission-aliases"
    })
    @DisplayName("Scoring sections of the wrong shape throw ConfigurationException")
    void scoringSectionsWrongShape(String yaml, String key) throws IOException {
        Path file = write("scoring.yaml", yaml + "\n");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.loadScoringConfig(file.toString()));
        assertTrue(e.getMessage().contains(key));
    }

    @Test
    @DisplayName("Numeric YAML keys are read as strings")
    void numericKeys() throws IOException {
        Path file = write("relevance.yaml", "relevance: {threat-aliases: {7: 포격}}\n");

        assertEquals("포격", ConfigLoader.loadRelevanceTable(file.toString()).threatAliases().get("7"));
    }

    @Test
    @DisplayName("Wrongly shaped relevance and scoring files degrade to defaults")
    void wrongShapeDegrades() throws IOException {
        Path relevance = write("relevance.yaml", "relevance: {threat-aliases: [a, b]}\n");
        Path scoring = write("scoring.yaml", "scoring: {weights: 3}\n");

        RelevanceMapper mapper = RelevanceMapper.load(relevance.toString());
        assertEquals(DiagnosticType.CONFIGURATION, mapper.loadWarnings().get(0).type());
        assertEquals(0.5, mapper.relevance("Defense", "침투").relevance(), 1e-9);

        ScoringSnapshot snapshot = ScoringSnapshot.load(relevance.toString(), scoring.toString());
        assertEquals(2, snapshot.loadWarnings().size());
        assertEquals(ScoringConfig.defaults().weight(Factor.THREAT_RESPONSE),
                snapshot.config().weight(Factor.THREAT_RESPONSE), 1e-9);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
