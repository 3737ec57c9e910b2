package com.metagov.schema;

import com.metagov.errors.InvalidParametersException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validated parameter values: raw input coerced against a schema with declared defaults filled in.
 * Used for process start parameters and plugin config.
 */
public final class Parameters {

    private final Map<String, Object> values;

    private Parameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Fills defaults, then validates.
     *
     * @param raw     caller values (null = empty)
     * @param schema  schema; null = accept values as given
     * @param subject name used in the error message (e.g. "poll.vote")
     * @throws InvalidParametersException if the values do not match the schema
     */
    public static Parameters coerce(Map<String, Object> raw, JsonSchema schema, String subject) {
        Map<String, Object> input = raw != null ? raw : Map.of();
        if (schema == null) {
            return new Parameters(input);
        }
        Map<String, Object> withDefaults = schema.applyDefaults(input);
        requireValid(schema, withDefaults, subject);
        return new Parameters(withDefaults);
    }

    /**
     * Validates a value against a schema.
     *
     * @throws InvalidParametersException listing every violation
     */
    public static void requireValid(JsonSchema schema, Object value, String subject) {
        Objects.requireNonNull(schema, "schema");
        List<SchemaViolation> violations = schema.validate(value);
        if (!violations.isEmpty()) {
            throw new InvalidParametersException(subject,
                    violations.stream().map(SchemaViolation::toString).collect(Collectors.toList()));
        }
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object v = values.get(name);
        return v != null ? v.toString() : null;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** Read-only view of all values. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Parameters" + values;
    }
}
