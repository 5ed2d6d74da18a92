package com.coa.diagnostics;

import java.util.Objects;

/**
 * A recovered problem attached to a score breakdown or a decision result.
 *
 * @param type    Diagnostic category
 * @param code    Stable machine-readable code (e.g. "unmapped relevance pair")
 * @param message Human-readable detail
 */
public record Diagnostic(
        DiagnosticType type,
        String code,
        String message
) {
    public Diagnostic {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(code, "code");
        if (message == null) {
            message = code;
        }
    }

    public static Diagnostic configuration(String code, String message) {
        return new Diagnostic(DiagnosticType.CONFIGURATION, code, message);
    }

    public static Diagnostic dataGap(String code, String message) {
        return new Diagnostic(DiagnosticType.DATA_GAP, code, message);
    }

    public static Diagnostic parse(String code, String message) {
        return new Diagnostic(DiagnosticType.PARSE, code, message);
    }

    @Override
    public String toString() {
        return type + "[" + code + "]: " + message;
    }
}
