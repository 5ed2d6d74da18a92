package com.coa.model;

/**
 * Per-axis battlefield state.
 *
 * @param axisId              Axis identifier
 * @param friendlyCombatPower Friendly combat power on this axis
 * @param enemyCombatPower    Enemy combat power on this axis
 * @param mobility            Mobility grade normalized to 0-1, or null when unknown
 */
public record AxisState(
        String axisId,
        double friendlyCombatPower,
        double enemyCombatPower,
        Double mobility
) {
}
