package com.coa.variable;

import com.coa.model.SituationContext;

import java.util.Optional;

/**
 * Resolves rule field names to values of a situation.
 */
public interface VariableResolver {

    /**
     * Resolve a field.
     *
     * @param field   Field name, camelCase or snake_case (e.g. "threatLevel", "threat_level")
     * @param context Situation to read from
     * @return Resolved value, or empty if the situation has no such field
     */
    Optional<Object> resolve(String field, SituationContext context);

    /**
     * Resolve a field as a double. Booleans resolve to 1.0 / 0.0.
     *
     * @return Double value, or empty if missing or not numeric
     */
    default Optional<Double> resolveAsDouble(String field, SituationContext context) {
        return resolve(field, context).flatMap(VariableResolver::toDouble);
    }

    static Optional<Double> toDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
