package com.coa.config;

import com.coa.diagnostics.Diagnostic;
import com.coa.exception.ConfigurationException;
import com.coa.mettc.MettCDimension;
import com.coa.model.CoaType;
import com.coa.scoring.Factor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads rule, relevance and scoring files from YAML.
 * Paths support the {@code classpath:} prefix.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load a rule file. Malformed individual rules are skipped and reported in
     * {@link RuleSetConfig#warnings()}; a missing or unreadable file throws.
     *
     * @param path Path to the rule file
     * @return Rule set with rules sorted by ascending priority
     * @throws ConfigurationException if the file cannot be read or parsed
     */
    @SuppressWarnings("unchecked")
    public static RuleSetConfig loadRuleSet(String path) {
        log.info("Loading rule set from: {}", path);
        Map<String, Object> root = section(readYaml(path), "rule-set");

        String name = getString(root, "name", "default-rules");
        String version = getString(root, "version", "1.0");
        Map<String, Double> weights = parseDoubleMap(optionalMap(root, "weights"));

        List<RuleConfig> rules = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        Object rulesObj = root.get("rules");

        if (rulesObj instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                if (!(item instanceof Map<?, ?> ruleMap)) {
                    warnings.add(Diagnostic.configuration("malformed rule", "Rule #" + i + " is not a mapping"));
                    log.warn("Skipping rule #{}: not a mapping", i);
                    continue;
                }
                try {
                    rules.add(parseRule((Map<String, Object>) ruleMap, i));
                } catch (ConfigurationException e) {
                    warnings.add(Diagnostic.configuration("malformed rule", e.getMessage()));
                    log.warn("Skipping rule #{}: {}", i, e.getMessage());
                }
            }
        } else if (rulesObj instanceof Map<?, ?> ruleMap) {
            // Map form keyed by rule name
            int i = 0;
            for (Map.Entry<?, ?> entry : ruleMap.entrySet()) {
                if (!(entry.getValue() instanceof Map<?, ?> body)) {
                    warnings.add(Diagnostic.configuration("malformed rule",
                            "Rule '" + entry.getKey() + "' is not a mapping"));
                    log.warn("Skipping rule '{}': not a mapping", entry.getKey());
                    i++;
                    continue;
                }
                Map<String, Object> named = new LinkedHashMap<>((Map<String, Object>) body);
                named.putIfAbsent("name", String.valueOf(entry.getKey()));
                try {
                    rules.add(parseRule(named, i));
                } catch (ConfigurationException e) {
                    warnings.add(Diagnostic.configuration("malformed rule", e.getMessage()));
                    log.warn("Skipping rule '{}': {}", entry.getKey(), e.getMessage());
                }
                i++;
            }
        }

        // Stable sort: equal priorities keep file order
        rules.sort(Comparator.comparingInt(RuleConfig::priority));

        log.info("Loaded rule set: {} v{} with {} rules ({} skipped)", name, version, rules.size(), warnings.size());
        return new RuleSetConfig(name, version, weights, rules, warnings);
    }

    @SuppressWarnings("unchecked")
    private static RuleConfig parseRule(Map<String, Object> map, int index) {
        String name = getString(map, "name", "rule-" + index);

        ConditionConfig condition;
        String conditionSource;
        String conditionExpr = getString(map, "condition-expr", getString(map, "conditionExpr", null));
        Object conditionObj = map.get("condition");

        if (conditionExpr != null) {
            condition = ConditionExpressionParser.parse(conditionExpr);
            conditionSource = conditionExpr;
        } else if (conditionObj instanceof Map<?, ?> conditionMap) {
            condition = ConditionExpressionParser.parseFieldMap((Map<String, Object>) conditionMap);
            conditionSource = conditionMap.toString();
        } else if (conditionObj instanceof String text) {
            condition = ConditionExpressionParser.parse(text);
            conditionSource = text;
        } else {
            throw new ConfigurationException("Rule '" + name + "' has no condition");
        }

        Object actionObj = map.get("action");
        if (!(actionObj instanceof Map<?, ?> actionRaw)) {
            throw new ConfigurationException("Rule '" + name + "' has no action");
        }
        Map<String, Object> action = (Map<String, Object>) actionRaw;

        String typeText = getString(action, "coa-type", getString(action, "coaType", getString(action, "coa", null)));
        CoaType coaType = CoaType.fromLabel(typeText)
                .orElseThrow(() -> new ConfigurationException(
                        "Rule '" + name + "' recommends unknown COA type '" + typeText + "'"));

        int priority = getInt(action, "priority", getInt(map, "priority", Integer.MAX_VALUE));
        String description = getString(map, "description", null);

        log.debug("Parsed rule '{}': {} -> {} (priority {})", name, conditionSource, coaType, priority);
        return new RuleConfig(name, condition, conditionSource, coaType, priority, description);
    }

    /**
     * Load a relevance table file.
     *
     * @throws ConfigurationException if the file cannot be read or a row is malformed
     */
    public static RelevanceTableConfig loadRelevanceTable(String path) {
        log.info("Loading relevance table from: {}", path);
        Map<String, Object> root = section(readYaml(path), "relevance");

        Map<String, String> aliases = new LinkedHashMap<>();
        Map<String, Object> aliasMap = optionalMap(root, "threat-aliases");
        if (aliasMap != null) {
            aliasMap.forEach((alias, type) -> aliases.put(alias, String.valueOf(type)));
        }

        List<RelevanceTableConfig.Mapping> mappings = new ArrayList<>();
        for (Map<String, Object> row : listOfMaps(root.get("mappings"), "mappings")) {
            mappings.add(new RelevanceTableConfig.Mapping(
                    required(row, "coa-type"),
                    required(row, "threat-type"),
                    getDouble(row, "relevance", 0.5),
                    getString(row, "description", null)));
        }

        // Matrix form: threat type -> {coa type: relevance}
        Map<String, Object> matrix = optionalMap(root, "matrix");
        if (matrix != null) {
            for (Map.Entry<String, Object> threatRow : matrix.entrySet()) {
                if (!(threatRow.getValue() instanceof Map<?, ?> cells)) {
                    throw new ConfigurationException("Relevance matrix row '" + threatRow.getKey() + "' is not a mapping");
                }
                for (Map.Entry<?, ?> cell : cells.entrySet()) {
                    mappings.add(new RelevanceTableConfig.Mapping(
                            String.valueOf(cell.getKey()), threatRow.getKey(), toDouble(cell.getValue()), null));
                }
            }
        }

        List<RelevanceTableConfig.CriticalMapping> critical = new ArrayList<>();
        for (Map<String, Object> row : listOfMaps(root.get("critical"), "critical")) {
            critical.add(new RelevanceTableConfig.CriticalMapping(
                    required(row, "coa-id"),
                    required(row, "threat-id"),
                    getDouble(row, "relevance", 0.5),
                    getString(row, "reason", null)));
        }

        log.info("Loaded relevance table: {} mappings, {} critical overrides, {} threat aliases",
                mappings.size(), critical.size(), aliases.size());
        return new RelevanceTableConfig(aliases, mappings, critical);
    }

    /**
     * Load a scoring file. Missing keys take defaults from {@link ScoringConfig#defaults()}.
     *
     * @throws ConfigurationException if the file cannot be read or holds unknown keys
     */
    public static ScoringConfig loadScoringConfig(String path) {
        log.info("Loading scoring configuration from: {}", path);
        Map<String, Object> root = section(readYaml(path), "scoring");
        ScoringConfig defaults = ScoringConfig.defaults();

        Map<Factor, Double> weights = defaults.weights();
        Map<String, Object> weightMap = optionalMap(root, "weights");
        if (weightMap != null) {
            weights = new EnumMap<>(Factor.class);
            for (Map.Entry<String, Object> entry : weightMap.entrySet()) {
                Factor factor = Factor.fromKey(entry.getKey())
                        .orElseThrow(() -> new ConfigurationException("Unknown scoring factor '" + entry.getKey() + "'"));
                weights.put(factor, toDouble(entry.getValue()));
            }
        }

        Map<MettCDimension, Double> mettCWeights = defaults.mettCWeights();
        Map<String, Object> mettCMap = optionalMap(root, "mett-c-weights");
        if (mettCMap != null) {
            mettCWeights = new EnumMap<>(MettCDimension.class);
            for (Map.Entry<String, Object> entry : mettCMap.entrySet()) {
                MettCDimension dimension = MettCDimension.fromKey(entry.getKey())
                        .orElseThrow(() -> new ConfigurationException("Unknown METT-C dimension '" + entry.getKey() + "'"));
                mettCWeights.put(dimension, toDouble(entry.getValue()));
            }
        }

        Map<String, Map<CoaType, Double>> alignment = defaults.missionAlignment();
        Map<String, Object> alignmentMap = optionalMap(root, "mission-alignment");
        if (alignmentMap != null) {
            alignment = new LinkedHashMap<>();
            for (Map.Entry<String, Object> missionRow : alignmentMap.entrySet()) {
                if (!(missionRow.getValue() instanceof Map<?, ?> cells)) {
                    throw new ConfigurationException("Mission alignment row '" + missionRow.getKey() + "' is not a mapping");
                }
                Map<CoaType, Double> row = new EnumMap<>(CoaType.class);
                for (Map.Entry<?, ?> cell : cells.entrySet()) {
                    CoaType type = CoaType.fromLabel(String.valueOf(cell.getKey()))
                            .orElseThrow(() -> new ConfigurationException("Unknown COA type '" + cell.getKey() + "'"));
                    row.put(type, toDouble(cell.getValue()));
                }
                alignment.put(missionRow.getKey(), row);
            }
        }

        Map<String, String> aliases = defaults.missionAliases();
        Map<String, Object> aliasMap = optionalMap(root, "mission-aliases");
        if (aliasMap != null) {
            aliases = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : aliasMap.entrySet()) {
                aliases.put(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }

        Map<String, Object> pipelineMap = mapOrEmpty(root.get("pipeline"));
        ScoringConfig.PipelineSettings pipelineDefaults = defaults.pipeline();
        ScoringConfig.PipelineSettings pipeline = new ScoringConfig.PipelineSettings(
                getInt(pipelineMap, "top-k", pipelineDefaults.topK()),
                getDouble(pipelineMap, "mett-c-blend-weight", pipelineDefaults.mettCBlendWeight()),
                getInt(pipelineMap, "parallel-threshold", pipelineDefaults.parallelThreshold()),
                getInt(pipelineMap, "pool-size", pipelineDefaults.poolSize()));

        Map<String, Object> terrainMap = mapOrEmpty(root.get("terrain"));
        ScoringConfig.TerrainSettings terrainDefaults = defaults.terrain();
        ScoringConfig.TerrainSettings terrain = new ScoringConfig.TerrainSettings(
                getDouble(terrainMap, "base", terrainDefaults.base()),
                getDouble(terrainMap, "compatible-bonus", terrainDefaults.compatibleBonus()),
                getDouble(terrainMap, "incompatible-penalty", terrainDefaults.incompatiblePenalty()));

        Map<String, Object> civilianMap = mapOrEmpty(root.get("civilian"));
        ScoringConfig.CivilianSettings civilianDefaults = defaults.civilian();
        ScoringConfig.CivilianSettings civilian = new ScoringConfig.CivilianSettings(
                getDouble(civilianMap, "exclusion-threshold", civilianDefaults.exclusionThreshold()),
                getDouble(civilianMap, "density-reference", civilianDefaults.densityReference()));

        double assetsNeutral = getDouble(root, "assets-neutral", defaults.assetsNeutral());

        ScoringConfig config = new ScoringConfig(weights, mettCWeights, alignment, aliases, assetsNeutral,
                pipeline, terrain, civilian);
        log.info("Loaded scoring configuration: topK={}, blend={}, {} mission types",
                pipeline.topK(), pipeline.mettCBlendWeight(), config.missionAlignment().size());
        return config;
    }

    // YAML access

    private static Map<String, Object> readYaml(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Configuration path is empty");
        }
        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                Object loaded = new Yaml().load(inputStream);
                if (loaded == null) {
                    throw new ConfigurationException("Configuration file is empty: " + path);
                }
                if (!(loaded instanceof Map<?, ?>)) {
                    throw new ConfigurationException("Configuration root is not a mapping: " + path);
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> root = (Map<String, Object>) loaded;
                return root;
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    // The section may be at root or under its key
    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object nested = root.get(key);
        if (nested instanceof Map<?, ?>) {
            return (Map<String, Object>) nested;
        }
        return root;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapOrEmpty(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    // Null when absent; keys are stringified since YAML may load numeric keys
    private static Map<String, Object> optionalMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new ConfigurationException("'" + key + "' must be a mapping, got '" + value + "'");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value, String key) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new ConfigurationException("'" + key + "' entries must be mappings");
            }
            rows.add((Map<String, Object>) item);
        }
        return rows;
    }

    private static Map<String, Double> parseDoubleMap(Map<String, Object> map) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (map != null) {
            map.forEach((key, value) -> result.put(key, toDouble(value)));
        }
        return result;
    }

    // Helper methods

    private static String required(Map<String, Object> map, String key) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required key '" + key + "' in " + map);
        }
        return value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Key '" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        return toDouble(value);
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected a number, got '" + value + "'", e);
        }
    }
}
