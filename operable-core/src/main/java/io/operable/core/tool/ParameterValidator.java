package io.operable.core.tool;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Checks an argument map against a {@link ParameterSchema}. Stops at the first violated parameter, in schema order.
 *
 * <p>Present values must match the declared kind; nothing is coerced, so an empty string is never accepted for a
 * number or boolean. Required parameters must be present and, for strings, non-empty. Absent optional parameters
 * take their declared default, and so does a non-positive value supplied for an optional number with a default.
 * Arguments the schema does not name are ignored.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    public static ToolArguments validate(ParameterSchema schema, Map<String, ArgumentValue> arguments)
        throws ArgumentValidationException {
        Map<String, ArgumentValue> input = arguments == null ? Map.of() : arguments;
        Map<String, ArgumentValue> resolved = new LinkedHashMap<>();
        Set<String> supplied = new LinkedHashSet<>();

        for (ParameterSpec spec : schema.parameters()) {
            ArgumentValue value = input.get(spec.name());
            if (value != null && value.kind() != spec.kind()) {
                throw new ArgumentValidationException(
                    spec.name(),
                    "must be a " + spec.kind().jsonType() + " but was a " + value.kind().jsonType()
                );
            }

            if (value == null || isEmptyString(value)) {
                if (spec.required()) {
                    throw new ArgumentValidationException(spec.name(), "must be a non-empty " + spec.kind().jsonType());
                }
                if (value != null) {
                    resolved.put(spec.name(), value);
                } else if (spec.defaultValue() != null) {
                    resolved.put(spec.name(), spec.defaultValue());
                }
                continue;
            }

            if (!spec.required() && spec.defaultValue() != null && isNonPositive(value)) {
                resolved.put(spec.name(), spec.defaultValue());
                continue;
            }

            resolved.put(spec.name(), value);
            supplied.add(spec.name());
        }
        return new ToolArguments(resolved, supplied);
    }

    private static boolean isEmptyString(ArgumentValue value) {
        return value instanceof ArgumentValue.StringValue text && text.value().isEmpty();
    }

    private static boolean isNonPositive(ArgumentValue value) {
        return value instanceof ArgumentValue.NumberValue number && !(number.value() > 0);
    }
}
