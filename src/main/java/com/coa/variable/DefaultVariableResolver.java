package com.coa.variable;

import com.coa.model.SituationContext;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves fields against {@link SituationContext#scalarFields()}.
 * Names match ignoring case and underscores, so {@code threat_level} finds {@code threatLevel}.
 */
public class DefaultVariableResolver implements VariableResolver {

    @Override
    public Optional<Object> resolve(String field, SituationContext context) {
        if (field == null || field.isEmpty() || context == null) {
            return Optional.empty();
        }

        Map<String, Object> fields = context.scalarFields();
        Object direct = fields.get(field);
        if (direct != null) {
            return Optional.of(direct);
        }

        String key = normalize(field);
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (normalize(entry.getKey()).equals(key)) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    }
}
