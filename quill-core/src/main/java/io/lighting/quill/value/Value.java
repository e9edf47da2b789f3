package io.lighting.quill.value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dynamic value flowing through templates.
 * <p>
 * Values are immutable: arrays and objects copy their input, and every
 * transformation produces a new instance. Object entries keep insertion order.
 */
public sealed interface Value permits Value.NullValue, Value.BoolValue, Value.NumberValue,
    Value.StringValue, Value.ArrayValue, Value.ObjectValue {

    NullValue NULL = new NullValue();
    BoolValue TRUE = new BoolValue(true);
    BoolValue FALSE = new BoolValue(false);

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value of(double value) {
        return new NumberValue(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static Value array(List<Value> items) {
        return new ArrayValue(items);
    }

    static Value object(Map<String, Value> entries) {
        return new ObjectValue(entries);
    }

    /**
     * False for null, {@code false}, zero, the empty string, the empty array and the empty object.
     */
    boolean isTruthy();

    /**
     * Display form used by template output, before any escaping.
     */
    String asText();

    default boolean isNull() {
        return this instanceof NullValue;
    }

    record NullValue() implements Value {
        @Override
        public boolean isTruthy() {
            return false;
        }

        @Override
        public String asText() {
            return "";
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public boolean isTruthy() {
            return value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record NumberValue(double value) implements Value {
        @Override
        public boolean isTruthy() {
            return value != 0.0d && !Double.isNaN(value);
        }

        @Override
        public String asText() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            if (value == Math.rint(value) && Math.abs(value) < 1.0e15) {
                return Long.toString((long) value);
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }

        public long asLong() {
            return (long) value;
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isTruthy() {
            return !value.isEmpty();
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record ArrayValue(List<Value> items) implements Value {
        public ArrayValue {
            Objects.requireNonNull(items, "items");
            items = List.copyOf(items);
        }

        @Override
        public boolean isTruthy() {
            return !items.isEmpty();
        }

        @Override
        public String asText() {
            return Values.toJson(this);
        }

        public Value get(int index) {
            if (index < 0 || index >= items.size()) {
                return NULL;
            }
            return items.get(index);
        }

        public int size() {
            return items.size();
        }
    }

    record ObjectValue(Map<String, Value> entries) implements Value {
        public ObjectValue {
            Objects.requireNonNull(entries, "entries");
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public boolean isTruthy() {
            return !entries.isEmpty();
        }

        @Override
        public String asText() {
            return Values.toJson(this);
        }

        public Value get(String key) {
            Value value = entries.get(key);
            return value == null ? NULL : value;
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        /**
         * Returns a copy with {@code key} set to {@code value}.
         */
        public ObjectValue with(String key, Value value) {
            Map<String, Value> copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new ObjectValue(copy);
        }
    }
}
