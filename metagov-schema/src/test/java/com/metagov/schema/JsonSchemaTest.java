package com.metagov.schema;

import com.metagov.errors.InvalidParametersException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonSchemaTest {

    private static final JsonSchema VOTE_SCHEMA = JsonSchema.parse("""
            {
              "type": "object",
              "properties": {
                "title": { "type": "string", "minLength": 1 },
                "options": { "type": "array", "items": { "type": "string" }, "minItems": 2, "default": ["yes", "no"] },
                "closing_at": { "type": ["string", "null"] },
                "max_votes": { "type": "integer", "minimum": 1, "default": 1 },
                "visibility": { "enum": ["public", "private"], "default": "public" },
                "settings": {
                  "type": "object",
                  "properties": { "anonymous": { "type": "boolean", "default": false } }
                }
              },
              "required": ["title"],
              "additionalProperties": false
            }
            """);

    @Test
    void validate_acceptsConformingValue() {
        List<SchemaViolation> violations = VOTE_SCHEMA.validate(Map.of(
                "title", "Lunch",
                "options", List.of("pizza", "tacos"),
                "max_votes", 2));

        assertTrue(violations.isEmpty(), violations.toString());
    }

    @Test
    void validate_reportsEveryViolationWithPath() {
        List<SchemaViolation> violations = VOTE_SCHEMA.validate(Map.of(
                "options", List.of("pizza", 3),
                "max_votes", 0,
                "visibility", "secret",
                "extra", true));

        List<String> rendered = violations.stream().map(SchemaViolation::toString).toList();
        assertTrue(rendered.contains("$: missing required property 'title'"), rendered.toString());
        assertTrue(rendered.contains("$.options[1]: expected type string but was integer"), rendered.toString());
        assertTrue(rendered.contains("$.max_votes: must be >= 1"), rendered.toString());
        assertTrue(rendered.stream().anyMatch(v -> v.startsWith("$.visibility: must be one of")), rendered.toString());
        assertTrue(rendered.contains("$.extra: additional property not allowed"), rendered.toString());
    }

    @Test
    void validate_integerAcceptsWholeDoubles() {
        JsonSchema schema = JsonSchema.parse("{\"type\":\"integer\"}");

        assertTrue(schema.validate(3.0).isEmpty());
        assertEquals(1, schema.validate(3.5).size());
    }

    @Test
    void validate_anyOf() {
        JsonSchema schema = JsonSchema.parse("{\"anyOf\":[{\"type\":\"string\"},{\"type\":\"integer\"}]}");

        assertTrue(schema.validate("x").isEmpty());
        assertTrue(schema.validate(1).isEmpty());
        assertEquals(1, schema.validate(true).size());
    }

    @Test
    void applyDefaults_fillsTopLevelAndNestedDefaults() {
        Map<String, Object> filled = VOTE_SCHEMA.applyDefaults(Map.of("title", "T", "settings", Map.of()));

        assertEquals(List.of("yes", "no"), filled.get("options"));
        assertEquals(1, filled.get("max_votes"));
        assertEquals("public", filled.get("visibility"));
        assertEquals(Map.of("anonymous", false), filled.get("settings"));
    }

    @Test
    void coerce_fillsDefaultsThenValidates() {
        Parameters params = Parameters.coerce(Map.of("title", "T"), VOTE_SCHEMA, "poll.vote");

        assertEquals("T", params.getString("title"));
        assertEquals(List.of("yes", "no"), params.get("options"));

        InvalidParametersException e = assertThrows(InvalidParametersException.class,
                () -> Parameters.coerce(Map.of("options", List.of("a", "b")), VOTE_SCHEMA, "poll.vote"));
        assertEquals(List.of("$: missing required property 'title'"), e.getViolations());
    }

    @Test
    void parse_rejectsNonObjectSchema() {
        assertThrows(IllegalArgumentException.class, () -> JsonSchema.parse("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> JsonSchema.parse("{not json"));
    }
}
