package com.coa.mettc;

import com.coa.diagnostics.Diagnostic;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * METT-C sub-scores of one (COA, situation) pair. Every value lies in [0,1].
 *
 * @param mission  Purpose / objective tag overlap
 * @param enemy    Applicability against the threat and force ratio
 * @param terrain  Terrain fit
 * @param troops   Resource match
 * @param civilian Civilian protection
 * @param time     Time budget fit
 * @param total    Weighted sum of the six sub-scores
 * @param warnings DATA_GAP diagnostics for substituted values
 */
public record MettCScore(
        double mission,
        double enemy,
        double terrain,
        double troops,
        double civilian,
        double time,
        double total,
        List<Diagnostic> warnings
) {
    public MettCScore {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public double get(MettCDimension dimension) {
        return switch (dimension) {
            case MISSION -> mission;
            case ENEMY -> enemy;
            case TERRAIN -> terrain;
            case TROOPS -> troops;
            case CIVILIAN -> civilian;
            case TIME -> time;
        };
    }

    public Map<MettCDimension, Double> asMap() {
        Map<MettCDimension, Double> values = new EnumMap<>(MettCDimension.class);
        for (MettCDimension dimension : MettCDimension.values()) {
            values.put(dimension, get(dimension));
        }
        return values;
    }
}
