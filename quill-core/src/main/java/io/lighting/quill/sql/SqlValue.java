package io.lighting.quill.sql;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A value bound to, or embedded in, generated SQL.
 */
public sealed interface SqlValue permits SqlValue.NullValue, SqlValue.DefaultValue, SqlValue.BoolValue,
    SqlValue.IntValue, SqlValue.DoubleValue, SqlValue.DecimalValue, SqlValue.TextValue, SqlValue.BytesValue,
    SqlValue.EnumValue, SqlValue.UuidValue, SqlValue.JsonValue, SqlValue.DateValue, SqlValue.TimeValue,
    SqlValue.DateTimeValue, SqlValue.TimestampValue, SqlValue.ArrayValue {

    NullValue NULL = new NullValue();
    DefaultValue DEFAULT = new DefaultValue();

    /**
     * Converts a plain Java value. Strings become text; use {@link #enumValue(String)} for typed enums.
     *
     * @throws IllegalArgumentException for unsupported types
     */
    static SqlValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof SqlValue sqlValue) {
            return sqlValue;
        }
        if (value instanceof Boolean bool) {
            return new BoolValue(bool);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new IntValue(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return new DoubleValue(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new DecimalValue(decimal);
        }
        if (value instanceof BigInteger integer) {
            return new DecimalValue(new BigDecimal(integer));
        }
        if (value instanceof CharSequence text) {
            return new TextValue(text.toString());
        }
        if (value instanceof byte[] bytes) {
            return new BytesValue(bytes);
        }
        if (value instanceof UUID uuid) {
            return new UuidValue(uuid);
        }
        if (value instanceof JsonNode json) {
            return new JsonValue(json);
        }
        if (value instanceof LocalDate date) {
            return new DateValue(date);
        }
        if (value instanceof LocalTime time) {
            return new TimeValue(time);
        }
        if (value instanceof LocalDateTime dateTime) {
            return new DateTimeValue(dateTime);
        }
        if (value instanceof OffsetDateTime timestamp) {
            return new TimestampValue(timestamp);
        }
        if (value instanceof Instant instant) {
            return new TimestampValue(instant.atOffset(ZoneOffset.UTC));
        }
        if (value instanceof Enum<?> constant) {
            return new EnumValue(constant.name());
        }
        if (value instanceof Collection<?> items) {
            List<SqlValue> converted = new ArrayList<>(items.size());
            for (Object item : items) {
                converted.add(of(item));
            }
            return new ArrayValue(converted);
        }
        throw new IllegalArgumentException("Unsupported SQL value type: " + value.getClass().getName());
    }

    /**
     * A typed enum, optionally carrying its PostgreSQL type as {@code value::type_name}.
     */
    static EnumValue enumValue(String encoded) {
        return new EnumValue(encoded);
    }

    /**
     * Literal SQL text for embedding in a statement. Text goes through {@link SqlDialect#quoteLiteral(String)}.
     */
    String toSqlLiteral(SqlDialect dialect);

    /**
     * The object handed to {@link java.sql.PreparedStatement#setObject(int, Object)}; null for SQL NULL.
     */
    Object jdbcValue();

    record NullValue() implements SqlValue {
        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return "NULL";
        }

        @Override
        public Object jdbcValue() {
            return null;
        }
    }

    /**
     * The column default in INSERT and UPDATE; never bound.
     */
    record DefaultValue() implements SqlValue {
        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return "DEFAULT";
        }

        @Override
        public Object jdbcValue() {
            throw new IllegalStateException("DEFAULT cannot be bound as a parameter");
        }
    }

    record BoolValue(boolean value) implements SqlValue {
        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return Boolean.toString(value);
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record IntValue(long value) implements SqlValue {
        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return Long.toString(value);
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record DoubleValue(double value) implements SqlValue {
        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return Double.toString(value);
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record DecimalValue(BigDecimal value) implements SqlValue {
        public DecimalValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return value.toPlainString();
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record TextValue(String value) implements SqlValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value);
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record BytesValue(byte[] value) implements SqlValue {
        private static final char[] HEX = "0123456789ABCDEF".toCharArray();

        public BytesValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            StringBuilder hex = new StringBuilder(value.length * 2 + 3).append("X'");
            for (byte b : value) {
                hex.append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
            return hex.append('\'').toString();
        }

        @Override
        public Object jdbcValue() {
            return value.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof BytesValue bytes && Arrays.equals(value, bytes.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[" + value.length + " bytes]";
        }
    }

    /**
     * {@code active::user_status} binds {@code active} and, on PostgreSQL, casts to {@code user_status}.
     */
    record EnumValue(String encoded) implements SqlValue {
        public EnumValue {
            Objects.requireNonNull(encoded, "encoded");
        }

        public String value() {
            int split = encoded.indexOf("::");
            return split < 0 ? encoded : encoded.substring(0, split);
        }

        /**
         * The PostgreSQL type name, or null when none was encoded.
         */
        public String typeName() {
            int split = encoded.indexOf("::");
            return split < 0 ? null : encoded.substring(split + 2);
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value());
        }

        @Override
        public Object jdbcValue() {
            return value();
        }
    }

    record UuidValue(UUID value) implements SqlValue {
        public UuidValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value.toString());
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record JsonValue(JsonNode value) implements SqlValue {
        public JsonValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value.toString());
        }

        @Override
        public Object jdbcValue() {
            return value.toString();
        }
    }

    record DateValue(LocalDate value) implements SqlValue {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value.toString());
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record TimeValue(LocalTime value) implements SqlValue {
        public TimeValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value.toString());
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record DateTimeValue(LocalDateTime value) implements SqlValue {
        public DateTimeValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value.toString().replace('T', ' '));
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record TimestampValue(OffsetDateTime value) implements SqlValue {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            return dialect.quoteLiteral(value.toString());
        }

        @Override
        public Object jdbcValue() {
            return value;
        }
    }

    record ArrayValue(List<SqlValue> items) implements SqlValue {
        public ArrayValue {
            items = List.copyOf(items);
        }

        @Override
        public String toSqlLiteral(SqlDialect dialect) {
            List<String> literals = new ArrayList<>(items.size());
            for (SqlValue item : items) {
                literals.add(item.toSqlLiteral(dialect));
            }
            return "ARRAY[" + String.join(", ", literals) + "]";
        }

        @Override
        public Object jdbcValue() {
            Object[] values = new Object[items.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = items.get(i).jdbcValue();
            }
            return values;
        }
    }
}
