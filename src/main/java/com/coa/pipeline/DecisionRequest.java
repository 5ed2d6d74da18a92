package com.coa.pipeline;

import com.coa.diagnostics.Diagnostic;
import com.coa.model.Coa;
import com.coa.model.SituationContext;

import java.util.List;
import java.util.Objects;

/**
 * Pipeline input: candidate COAs and the situation they are ranked against.
 *
 * @param candidates Candidate COAs
 * @param situation  Situation context
 * @param warnings   Diagnostics raised while building the request (e.g. skipped resource tokens)
 */
public record DecisionRequest(
        List<Coa> candidates,
        SituationContext situation,
        List<Diagnostic> warnings
) {
    public DecisionRequest {
        Objects.requireNonNull(situation, "situation");
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public DecisionRequest(List<Coa> candidates, SituationContext situation) {
        this(candidates, situation, List.of());
    }
}
