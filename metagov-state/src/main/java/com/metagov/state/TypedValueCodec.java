package com.metagov.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding for state values that keeps the Java type of every scalar.
 * <p>
 * {@code String}, {@code Boolean}, {@code Integer} and {@code Double} are written as plain JSON. Other
 * numbers are written as a one-field object whose name is a tag ({@code {"@long": 5}}). Map keys that
 * start with {@code @} are written with a second {@code @} so they never read back as a tag. Maps decode
 * to {@link LinkedHashMap}, lists, sets and arrays to {@link ArrayList}. Any other object is converted
 * with Jackson first and decodes as its JSON shape.
 */
final class TypedValueCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final String TAG = "@";
    private static final String LONG = "@long";
    private static final String FLOAT = "@float";
    private static final String SHORT = "@short";
    private static final String BYTE = "@byte";
    private static final String BIG_INTEGER = "@bigint";
    private static final String BIG_DECIMAL = "@decimal";

    private TypedValueCodec() {
    }

    /**
     * @throws IllegalArgumentException if the value cannot be represented as JSON
     */
    static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(toNode(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-encodable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalStateException if the document is not valid typed JSON
     */
    static Object decode(String json) {
        try {
            return fromNode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt state document: " + e.getOriginalMessage(), e);
        }
    }

    /** Converts a decoded value to the requested type. */
    static <T> T convert(Object decoded, Class<T> type) {
        if (decoded == null || type.isInstance(decoded)) {
            return type.cast(decoded);
        }
        return MAPPER.convertValue(decoded, type);
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof String) {
            return NODES.textNode((String) value);
        }
        if (value instanceof Boolean) {
            return NODES.booleanNode((Boolean) value);
        }
        if (value instanceof Integer) {
            return NODES.numberNode((Integer) value);
        }
        if (value instanceof Double) {
            return NODES.numberNode((Double) value);
        }
        if (value instanceof Long) {
            return tagged(LONG, NODES.numberNode((Long) value));
        }
        if (value instanceof Float) {
            return tagged(FLOAT, NODES.numberNode((Float) value));
        }
        if (value instanceof Short) {
            return tagged(SHORT, NODES.numberNode((Short) value));
        }
        if (value instanceof Byte) {
            return tagged(BYTE, NODES.numberNode((Byte) value));
        }
        if (value instanceof BigInteger) {
            return tagged(BIG_INTEGER, NODES.textNode(value.toString()));
        }
        if (value instanceof BigDecimal) {
            return tagged(BIG_DECIMAL, NODES.textNode(value.toString()));
        }
        if (value instanceof Map) {
            ObjectNode node = NODES.objectNode();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                node.set(escape(String.valueOf(e.getKey())), toNode(e.getValue()));
            }
            return node;
        }
        if (value instanceof Iterable) {
            ArrayNode node = NODES.arrayNode();
            for (Object item : (Iterable<?>) value) {
                node.add(toNode(item));
            }
            return node;
        }
        if (value.getClass().isArray()) {
            ArrayNode node = NODES.arrayNode();
            for (int i = 0; i < Array.getLength(value); i++) {
                node.add(toNode(Array.get(value, i)));
            }
            return node;
        }
        return fromPlainTree(MAPPER.valueToTree(value));
    }

    /** Re-encodes a tree produced by Jackson for an arbitrary object. */
    private static JsonNode fromPlainTree(JsonNode plain) {
        if (plain.isObject()) {
            ObjectNode node = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = plain.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                node.set(escape(field.getKey()), fromPlainTree(field.getValue()));
            }
            return node;
        }
        if (plain.isArray()) {
            ArrayNode node = NODES.arrayNode();
            for (JsonNode item : plain) {
                node.add(fromPlainTree(item));
            }
            return node;
        }
        if (plain.isLong()) {
            return tagged(LONG, plain);
        }
        if (plain.isFloat()) {
            return tagged(FLOAT, plain);
        }
        if (plain.isBigInteger()) {
            return tagged(BIG_INTEGER, NODES.textNode(plain.bigIntegerValue().toString()));
        }
        if (plain.isBigDecimal()) {
            return tagged(BIG_DECIMAL, NODES.textNode(plain.decimalValue().toString()));
        }
        return plain;
    }

    private static Object fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isNumber()) {
            return node.isIntegralNumber() ? node.numberValue() : node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                list.add(fromNode(item));
            }
            return list;
        }
        if (node.size() == 1) {
            String name = node.fieldNames().next();
            if (isTag(name)) {
                return fromTagged(name, node.get(name));
            }
        }
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(unescape(field.getKey()), fromNode(field.getValue()));
        }
        return map;
    }

    private static Object fromTagged(String tag, JsonNode value) {
        switch (tag) {
            case LONG:
                return value.longValue();
            case FLOAT:
                return value.floatValue();
            case SHORT:
                return value.shortValue();
            case BYTE:
                return (byte) value.intValue();
            case BIG_INTEGER:
                return new BigInteger(value.textValue());
            case BIG_DECIMAL:
                return new BigDecimal(value.textValue());
            default:
                throw new IllegalStateException("Unknown type tag " + tag);
        }
    }

    private static ObjectNode tagged(String tag, JsonNode value) {
        ObjectNode node = NODES.objectNode();
        node.set(tag, value);
        return node;
    }

    private static boolean isTag(String name) {
        return name.startsWith(TAG) && !name.startsWith(TAG + TAG);
    }

    private static String escape(String key) {
        return key.startsWith(TAG) ? TAG + key : key;
    }

    private static String unescape(String key) {
        return key.startsWith(TAG + TAG) ? key.substring(1) : key;
    }
}
