package io.lighting.quill.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {

    record Book(String title, int pages) {
    }

    @Test
    void convertsPlainJavaObjects() {
        Value.ObjectValue book = assertInstanceOf(Value.ObjectValue.class, Values.of(new Book("Dune", 412)));
        assertEquals(Value.of("Dune"), book.get("title"));
        assertEquals(Value.of(412), book.get("pages"));

        Value.ArrayValue list = assertInstanceOf(Value.ArrayValue.class, Values.of(List.of(1, "two", true)));
        assertEquals(3, list.size());
        assertEquals(Value.TRUE, list.get(2));
        assertEquals(Value.NULL, list.get(7));
        assertEquals(Value.NULL, Values.of(null));
    }

    @Test
    void parsesJsonKeepingKeyOrder() {
        Value value = Values.fromJson("{\"z\":1,\"a\":{\"b\":[null,2.5]}}");
        Value.ObjectValue object = assertInstanceOf(Value.ObjectValue.class, value);
        assertEquals(List.of("z", "a"), List.copyOf(object.entries().keySet()));
        assertEquals("{\"z\":1,\"a\":{\"b\":[null,2.5]}}", Values.toJson(value));
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> Values.fromJson("{oops"));
    }

    @Test
    void followsTruthinessRules() {
        assertFalse(Value.NULL.isTruthy());
        assertFalse(Value.of(0).isTruthy());
        assertFalse(Value.of("").isTruthy());
        assertFalse(Value.array(List.of()).isTruthy());
        assertFalse(Value.object(Map.of()).isTruthy());
        assertTrue(Value.of("0").isTruthy());
        assertTrue(Value.of(-1).isTruthy());
        assertTrue(Values.objectOf("a", null).isTruthy());
    }

    @Test
    void formatsNumbersForDisplay() {
        assertEquals("42", Value.of(42).asText());
        assertEquals("0.1", Value.of(0.1).asText());
        assertEquals("-3.25", Value.of(-3.25).asText());
        assertEquals("", Value.NULL.asText());
    }

    @Test
    void withReturnsModifiedCopy() {
        Value.ObjectValue original = Values.objectOf("a", 1);
        Value.ObjectValue updated = original.with("b", Value.of("x"));
        assertFalse(original.containsKey("b"));
        assertEquals(Value.of("x"), updated.get("b"));
    }

    @Test
    void objectOfRequiresStringKeyPairs() {
        assertThrows(IllegalArgumentException.class, () -> Values.objectOf("a"));
        assertThrows(IllegalArgumentException.class, () -> Values.objectOf(1, "a"));
    }
}
