package com.coa.resource;

import com.coa.diagnostics.Diagnostic;

import java.util.List;

/**
 * Result of parsing a resource-priority string.
 *
 * @param requirements Valid requirements in input order
 * @param warnings     One PARSE diagnostic per skipped token
 */
public record ParsedRequirements(
        List<ResourceRequirement> requirements,
        List<Diagnostic> warnings
) {
    public static final ParsedRequirements EMPTY = new ParsedRequirements(List.of(), List.of());

    public ParsedRequirements {
        requirements = List.copyOf(requirements);
        warnings = List.copyOf(warnings);
    }
}
