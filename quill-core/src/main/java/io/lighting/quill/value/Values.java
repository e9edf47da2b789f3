package io.lighting.quill.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conversions between {@link Value} and JSON / plain Java objects.
 */
public final class Values {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Values() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Converts maps, lists, records, beans, strings, numbers and booleans into a value.
     */
    public static Value of(Object source) {
        if (source == null) {
            return Value.NULL;
        }
        if (source instanceof Value value) {
            return value;
        }
        if (source instanceof JsonNode node) {
            return fromJsonNode(node);
        }
        if (source instanceof CharSequence text) {
            return Value.of(text.toString());
        }
        if (source instanceof Boolean bool) {
            return Value.of(bool);
        }
        if (source instanceof Number number) {
            return Value.of(number.doubleValue());
        }
        try {
            return fromJsonNode(MAPPER.valueToTree(source));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                "Cannot convert " + source.getClass().getName() + " to a template value", ex
            );
        }
    }

    public static Value fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return fromJsonNode(MAPPER.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Value fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.NULL;
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJsonNode(item));
            }
            return Value.array(items);
        }
        if (node.isObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJsonNode(field.getValue()));
            }
            return Value.object(entries);
        }
        // binary and POJO nodes
        return Value.of(node.asText());
    }

    public static JsonNode toJsonNode(Value value) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (value instanceof Value.NullValue) {
            return factory.nullNode();
        }
        if (value instanceof Value.BoolValue bool) {
            return factory.booleanNode(bool.value());
        }
        if (value instanceof Value.NumberValue number) {
            double d = number.value();
            if (d == Math.rint(d) && Math.abs(d) < 1.0e15) {
                return factory.numberNode((long) d);
            }
            return factory.numberNode(d);
        }
        if (value instanceof Value.StringValue text) {
            return factory.textNode(text.value());
        }
        if (value instanceof Value.ArrayValue array) {
            ArrayNode node = factory.arrayNode();
            for (Value item : array.items()) {
                node.add(toJsonNode(item));
            }
            return node;
        }
        ObjectNode node = factory.objectNode();
        for (Map.Entry<String, Value> entry : ((Value.ObjectValue) value).entries().entrySet()) {
            node.set(entry.getKey(), toJsonNode(entry.getValue()));
        }
        return node;
    }

    public static String toJson(Value value) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize value", ex);
        }
    }

    /**
     * Builds an object value from alternating key/value pairs.
     */
    public static Value.ObjectValue objectOf(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain pairs");
        }
        Map<String, Value> entries = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object key = keyValues[i];
            if (!(key instanceof String name)) {
                throw new IllegalArgumentException("Key must be a String at index " + i);
            }
            entries.put(name, of(keyValues[i + 1]));
        }
        return new Value.ObjectValue(entries);
    }
}
