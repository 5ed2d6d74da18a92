package com.coa.config;

import com.coa.mettc.MettCDimension;
import com.coa.model.CoaType;
import com.coa.scoring.Factor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scoring parameters. Weight maps are normalized to sum to 1.0 on construction.
 *
 * @param weights           Base factor weights
 * @param mettCWeights      METT-C dimension weights
 * @param missionAlignment  Mission type to per-COA-type alignment
 * @param missionAliases    Alternative mission type names (e.g. "defense" for "방어")
 * @param assetsNeutral     Assets score when a COA declares no specific assets
 * @param pipeline          Two-pass pipeline settings
 * @param terrain           Terrain adjustment settings
 * @param civilian          Civilian protection settings
 */
public record ScoringConfig(
        Map<Factor, Double> weights,
        Map<MettCDimension, Double> mettCWeights,
        Map<String, Map<CoaType, Double>> missionAlignment,
        Map<String, String> missionAliases,
        double assetsNeutral,
        PipelineSettings pipeline,
        TerrainSettings terrain,
        CivilianSettings civilian
) {
    public ScoringConfig {
        weights = normalize(weights, Factor.class, defaultWeights());
        mettCWeights = normalize(mettCWeights, MettCDimension.class, equalMettCWeights());
        missionAlignment = missionAlignment == null ? Map.of() : copyAlignment(missionAlignment);
        missionAliases = missionAliases == null ? Map.of() : lowerCaseKeys(missionAliases);
        pipeline = pipeline == null ? PipelineSettings.defaults() : pipeline;
        terrain = terrain == null ? TerrainSettings.defaults() : terrain;
        civilian = civilian == null ? CivilianSettings.defaults() : civilian;
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(defaultWeights(), equalMettCWeights(), defaultMissionAlignment(),
                defaultMissionAliases(), 0.5, PipelineSettings.defaults(), TerrainSettings.defaults(),
                CivilianSettings.defaults());
    }

    public double weight(Factor factor) {
        return weights.getOrDefault(factor, 0.0);
    }

    public double weight(MettCDimension dimension) {
        return mettCWeights.getOrDefault(dimension, 0.0);
    }

    /**
     * Look up mission alignment, resolving mission aliases first.
     *
     * @return Alignment, or empty when the mission type or COA type is not in the matrix
     */
    public Optional<Double> alignment(String missionType, CoaType coaType) {
        if (missionType == null || coaType == null) {
            return Optional.empty();
        }
        String key = missionType.trim();
        Map<CoaType, Double> row = missionAlignment.get(key);
        if (row == null) {
            String alias = missionAliases.get(key.toLowerCase(Locale.ROOT));
            row = alias == null ? null : missionAlignment.get(alias);
        }
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(coaType));
    }

    /**
     * Pipeline settings.
     *
     * @param topK              Candidates re-evaluated in Pass 2
     * @param mettCBlendWeight  Share of the METT-C total in the blended score
     * @param parallelThreshold Minimum candidate count for parallel Pass 1
     * @param poolSize          Worker threads for parallel Pass 1
     */
    public record PipelineSettings(int topK, double mettCBlendWeight, int parallelThreshold, int poolSize) {
        public PipelineSettings {
            topK = Math.max(1, topK);
            mettCBlendWeight = Math.min(1.0, Math.max(0.0, mettCBlendWeight));
            parallelThreshold = Math.max(1, parallelThreshold);
            poolSize = Math.max(1, poolSize);
        }

        public static PipelineSettings defaults() {
            return new PipelineSettings(3, 0.3, 16, 4);
        }
    }

    /**
     * @param base                Score with no terrain tag information
     * @param compatibleBonus     Added per compatible tag present
     * @param incompatiblePenalty Subtracted per incompatible tag present
     */
    public record TerrainSettings(double base, double compatibleBonus, double incompatiblePenalty) {
        public static TerrainSettings defaults() {
            return new TerrainSettings(0.5, 0.1, 0.15);
        }
    }

    /**
     * @param exclusionThreshold Civilian scores below this exclude a COA in Pass 2
     * @param densityReference   Population density at which the density factor saturates
     */
    public record CivilianSettings(double exclusionThreshold, double densityReference) {
        public CivilianSettings {
            densityReference = densityReference <= 0 ? 1000.0 : densityReference;
        }

        public static CivilianSettings defaults() {
            return new CivilianSettings(0.3, 1000.0);
        }
    }

    static Map<Factor, Double> defaultWeights() {
        Map<Factor, Double> weights = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            weights.put(factor, factor.defaultWeight());
        }
        return weights;
    }

    static Map<MettCDimension, Double> equalMettCWeights() {
        Map<MettCDimension, Double> weights = new EnumMap<>(MettCDimension.class);
        for (MettCDimension dimension : MettCDimension.values()) {
            weights.put(dimension, 1.0 / MettCDimension.values().length);
        }
        return weights;
    }

    private static <K extends Enum<K>> Map<K, Double> normalize(Map<K, Double> raw, Class<K> keyType,
                                                               Map<K, Double> fallback) {
        Map<K, Double> source = raw == null || raw.isEmpty() ? fallback : raw;
        double sum = source.values().stream().mapToDouble(v -> Math.max(0.0, v)).sum();
        if (sum <= 0.0) {
            source = fallback;
            sum = source.values().stream().mapToDouble(Double::doubleValue).sum();
        }
        Map<K, Double> normalized = new EnumMap<>(keyType);
        for (K key : keyType.getEnumConstants()) {
            normalized.put(key, Math.max(0.0, source.getOrDefault(key, 0.0)) / sum);
        }
        return Map.copyOf(normalized);
    }

    private static Map<String, Map<CoaType, Double>> copyAlignment(Map<String, Map<CoaType, Double>> source) {
        Map<String, Map<CoaType, Double>> copy = new LinkedHashMap<>();
        source.forEach((mission, row) -> copy.put(mission, Map.copyOf(row)));
        return Map.copyOf(copy);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((alias, mission) -> copy.put(alias.toLowerCase(Locale.ROOT), mission));
        return Map.copyOf(copy);
    }

    private static Map<String, Map<CoaType, Double>> defaultMissionAlignment() {
        Map<String, Map<CoaType, Double>> matrix = new LinkedHashMap<>();
        matrix.put("공격", row(0.2, 1.0, 0.6, 0.5, 0.1, 0.8, 0.4));
        matrix.put("방어", row(1.0, 0.2, 0.7, 0.5, 0.9, 0.3, 0.5));
        matrix.put("반격", row(0.6, 0.8, 1.0, 0.5, 0.3, 0.4, 0.4));
        matrix.put("기동", row(0.4, 0.7, 0.6, 1.0, 0.3, 0.5, 0.5));
        matrix.put("지연", row(0.9, 0.1, 0.5, 0.8, 0.6, 0.2, 0.4));
        matrix.put("기만", row(0.4, 0.3, 0.2, 0.8, 0.6, 0.3, 1.0));
        matrix.put("방공", row(1.0, 0.2, 0.6, 0.4, 0.7, 0.9, 0.2));
        matrix.put("지원", row(0.6, 0.4, 0.4, 0.8, 0.5, 0.3, 0.7));
        return matrix;
    }

    // Values in CoaType declaration order
    private static Map<CoaType, Double> row(double defense, double offensive, double counterAttack,
                                            double maneuver, double deterrence, double preemptive,
                                            double informationOps) {
        Map<CoaType, Double> row = new EnumMap<>(CoaType.class);
        row.put(CoaType.DEFENSE, defense);
        row.put(CoaType.OFFENSIVE, offensive);
        row.put(CoaType.COUNTER_ATTACK, counterAttack);
        row.put(CoaType.MANEUVER, maneuver);
        row.put(CoaType.DETERRENCE, deterrence);
        row.put(CoaType.PREEMPTIVE, preemptive);
        row.put(CoaType.INFORMATION_OPS, informationOps);
        return row;
    }

    private static Map<String, String> defaultMissionAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("attack", "공격");
        aliases.put("offense", "공격");
        aliases.put("offensive", "공격");
        aliases.put("defense", "방어");
        aliases.put("counterattack", "반격");
        aliases.put("counter_attack", "반격");
        aliases.put("maneuver", "기동");
        aliases.put("delay", "지연");
        aliases.put("deception", "기만");
        aliases.put("air_defense", "방공");
        aliases.put("airdefense", "방공");
        aliases.put("support", "지원");
        return aliases;
    }
}
