package com.coa.pipeline;

/**
 * Stages of one ranking run.
 */
public enum PipelineState {
    GENERATED,
    PASS1_SCORED,
    PASS2_FILTERED,
    RANKED
}
