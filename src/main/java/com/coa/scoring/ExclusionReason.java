package com.coa.scoring;

/**
 * Why a candidate was excluded in Pass 2.
 */
public enum ExclusionReason {
    CIVILIAN_PROTECTION_BELOW_THRESHOLD("civilian_protection_below_threshold"),
    TIME_CONSTRAINT_VIOLATED("time_constraint_violated");

    private final String code;

    ExclusionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
