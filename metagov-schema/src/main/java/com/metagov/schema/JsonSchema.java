package com.metagov.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable JSON schema used for action input/output, process start parameters and plugin config.
 * Supports the subset of JSON Schema that integrations declare: {@code type} (single or list),
 * {@code enum}, {@code const}, {@code properties}, {@code required}, {@code additionalProperties},
 * {@code items}, {@code minItems}/{@code maxItems}, {@code minLength}/{@code maxLength}, {@code pattern},
 * {@code minimum}/{@code maximum}, {@code exclusiveMinimum}/{@code exclusiveMaximum}, {@code anyOf}
 * and {@code default}. Unknown keywords are ignored.
 */
public final class JsonSchema {

    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JsonNode root;

    private JsonSchema(JsonNode root) {
        this.root = root;
    }

    /**
     * Parses a schema from JSON text.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static JsonSchema parse(String json) {
        Objects.requireNonNull(json, "json");
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid schema JSON: " + e.getOriginalMessage(), e);
        }
        return of(node);
    }

    /** Wraps a schema given as a map (e.g. loaded from config). */
    public static JsonSchema of(Map<String, Object> schema) {
        JsonNode node = MAPPER.valueToTree(Objects.requireNonNull(schema, "schema"));
        return of(node);
    }

    static JsonSchema of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Schema must be a JSON object");
        }
        return new JsonSchema(node.deepCopy());
    }

    /**
     * Validates a value (maps, lists, scalars or any Jackson-convertible object).
     *
     * @return violations; empty when the value conforms
     */
    public List<SchemaViolation> validate(Object value) {
        JsonNode instance = value != null ? MAPPER.valueToTree(value) : NullNode.getInstance();
        List<SchemaViolation> violations = new ArrayList<>();
        SchemaValidator.validate(root, instance, "$", violations);
        return violations;
    }

    /**
     * Returns a copy of the object with declared {@code default}s filled in for absent properties,
     * recursively for nested objects that are present. Does not validate.
     */
    public Map<String, Object> applyDefaults(Map<String, Object> values) {
        JsonNode instance = MAPPER.valueToTree(values != null ? values : Map.of());
        if (instance.isObject()) {
            fillDefaults(root, (ObjectNode) instance);
        }
        return MAPPER.convertValue(instance, MAP_TYPE);
    }

    private static void fillDefaults(JsonNode schema, ObjectNode instance) {
        JsonNode properties = schema.get("properties");
        if (properties == null || !properties.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> property = it.next();
            JsonNode propertySchema = property.getValue();
            JsonNode present = instance.get(property.getKey());
            if (present == null && propertySchema.has("default")) {
                instance.set(property.getKey(), propertySchema.get("default").deepCopy());
            } else if (present != null && present.isObject()) {
                fillDefaults(propertySchema, (ObjectNode) present);
            }
        }
    }

    /** Schema as a plain map (for listing plugin capabilities to the driver). */
    public Map<String, Object> toMap() {
        return MAPPER.convertValue(root, MAP_TYPE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return root.equals(((JsonSchema) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
