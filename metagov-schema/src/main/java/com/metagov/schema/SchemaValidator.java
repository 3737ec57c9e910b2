package com.metagov.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Keyword evaluation for {@link JsonSchema}. */
final class SchemaValidator {

    private SchemaValidator() {
    }

    static void validate(JsonNode schema, JsonNode instance, String path, List<SchemaViolation> out) {
        if (schema == null || !schema.isObject()) {
            return;
        }
        JsonNode type = schema.get("type");
        if (type != null && !matchesType(type, instance)) {
            out.add(new SchemaViolation(path, "expected type " + typeLabel(type) + " but was " + describe(instance)));
            return;
        }
        JsonNode constValue = schema.get("const");
        if (constValue != null && !constValue.equals(instance)) {
            out.add(new SchemaViolation(path, "must equal " + constValue));
        }
        JsonNode enumValues = schema.get("enum");
        if (enumValues != null && enumValues.isArray() && !contains(enumValues, instance)) {
            out.add(new SchemaViolation(path, "must be one of " + enumValues));
        }
        JsonNode anyOf = schema.get("anyOf");
        if (anyOf != null && anyOf.isArray() && !matchesAny(anyOf, instance, path)) {
            out.add(new SchemaViolation(path, "does not match any allowed schema"));
        }
        if (instance.isObject()) {
            validateObject(schema, instance, path, out);
        } else if (instance.isArray()) {
            validateArray(schema, instance, path, out);
        } else if (instance.isTextual()) {
            validateString(schema, instance.asText(), path, out);
        } else if (instance.isNumber()) {
            validateNumber(schema, instance, path, out);
        }
    }

    private static void validateObject(JsonNode schema, JsonNode instance, String path, List<SchemaViolation> out) {
        JsonNode required = schema.get("required");
        if (required != null && required.isArray()) {
            for (JsonNode name : required) {
                if (!instance.has(name.asText())) {
                    out.add(new SchemaViolation(path, "missing required property '" + name.asText() + "'"));
                }
            }
        }
        JsonNode properties = schema.get("properties");
        JsonNode additional = schema.get("additionalProperties");
        Iterator<Map.Entry<String, JsonNode>> fields = instance.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String childPath = path + "." + field.getKey();
            JsonNode propertySchema = properties != null ? properties.get(field.getKey()) : null;
            if (propertySchema != null) {
                validate(propertySchema, field.getValue(), childPath, out);
            } else if (additional != null) {
                if (additional.isBoolean() && !additional.asBoolean()) {
                    out.add(new SchemaViolation(childPath, "additional property not allowed"));
                } else if (additional.isObject()) {
                    validate(additional, field.getValue(), childPath, out);
                }
            }
        }
    }

    private static void validateArray(JsonNode schema, JsonNode instance, String path, List<SchemaViolation> out) {
        JsonNode minItems = schema.get("minItems");
        if (minItems != null && instance.size() < minItems.asInt()) {
            out.add(new SchemaViolation(path, "must have at least " + minItems.asInt() + " items"));
        }
        JsonNode maxItems = schema.get("maxItems");
        if (maxItems != null && instance.size() > maxItems.asInt()) {
            out.add(new SchemaViolation(path, "must have at most " + maxItems.asInt() + " items"));
        }
        JsonNode items = schema.get("items");
        if (items != null && items.isObject()) {
            for (int i = 0; i < instance.size(); i++) {
                validate(items, instance.get(i), path + "[" + i + "]", out);
            }
        }
    }

    private static void validateString(JsonNode schema, String value, String path, List<SchemaViolation> out) {
        int length = value.codePointCount(0, value.length());
        JsonNode minLength = schema.get("minLength");
        if (minLength != null && length < minLength.asInt()) {
            out.add(new SchemaViolation(path, "must be at least " + minLength.asInt() + " characters"));
        }
        JsonNode maxLength = schema.get("maxLength");
        if (maxLength != null && length > maxLength.asInt()) {
            out.add(new SchemaViolation(path, "must be at most " + maxLength.asInt() + " characters"));
        }
        JsonNode pattern = schema.get("pattern");
        if (pattern != null) {
            try {
                if (!Pattern.compile(pattern.asText()).matcher(value).find()) {
                    out.add(new SchemaViolation(path, "must match pattern " + pattern.asText()));
                }
            } catch (PatternSyntaxException e) {
                out.add(new SchemaViolation(path, "schema pattern is invalid: " + pattern.asText()));
            }
        }
    }

    private static void validateNumber(JsonNode schema, JsonNode instance, String path, List<SchemaViolation> out) {
        double value = instance.asDouble();
        JsonNode minimum = schema.get("minimum");
        if (minimum != null && value < minimum.asDouble()) {
            out.add(new SchemaViolation(path, "must be >= " + minimum.asText()));
        }
        JsonNode maximum = schema.get("maximum");
        if (maximum != null && value > maximum.asDouble()) {
            out.add(new SchemaViolation(path, "must be <= " + maximum.asText()));
        }
        JsonNode exclusiveMinimum = schema.get("exclusiveMinimum");
        if (exclusiveMinimum != null && exclusiveMinimum.isNumber() && value <= exclusiveMinimum.asDouble()) {
            out.add(new SchemaViolation(path, "must be > " + exclusiveMinimum.asText()));
        }
        JsonNode exclusiveMaximum = schema.get("exclusiveMaximum");
        if (exclusiveMaximum != null && exclusiveMaximum.isNumber() && value >= exclusiveMaximum.asDouble()) {
            out.add(new SchemaViolation(path, "must be < " + exclusiveMaximum.asText()));
        }
    }

    private static boolean matchesAny(JsonNode anyOf, JsonNode instance, String path) {
        for (JsonNode candidate : anyOf) {
            List<SchemaViolation> scratch = new ArrayList<>();
            validate(candidate, instance, path, scratch);
            if (scratch.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesType(JsonNode type, JsonNode instance) {
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (matchesSingleType(t.asText(), instance)) return true;
            }
            return false;
        }
        return matchesSingleType(type.asText(), instance);
    }

    private static boolean matchesSingleType(String type, JsonNode instance) {
        return switch (type) {
            case "object" -> instance.isObject();
            case "array" -> instance.isArray();
            case "string" -> instance.isTextual();
            case "boolean" -> instance.isBoolean();
            case "null" -> instance.isNull();
            case "number" -> instance.isNumber();
            case "integer" -> instance.isIntegralNumber()
                    || (instance.isNumber() && instance.asDouble() == Math.rint(instance.asDouble()));
            default -> true;
        };
    }

    private static boolean contains(JsonNode values, JsonNode instance) {
        for (JsonNode v : values) {
            if (v.equals(instance)) return true;
            if (v.isNumber() && instance.isNumber() && v.asDouble() == instance.asDouble()) return true;
        }
        return false;
    }

    private static String typeLabel(JsonNode type) {
        return type.isArray() ? type.toString() : type.asText();
    }

    private static String describe(JsonNode instance) {
        if (instance.isObject()) return "object";
        if (instance.isArray()) return "array";
        if (instance.isTextual()) return "string";
        if (instance.isBoolean()) return "boolean";
        if (instance.isNull() || instance.isMissingNode()) return "null";
        if (instance.isIntegralNumber()) return "integer";
        if (instance.isNumber()) return "number";
        return instance.getNodeType().name().toLowerCase();
    }
}
