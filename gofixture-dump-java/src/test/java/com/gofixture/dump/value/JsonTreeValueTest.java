package com.gofixture.dump.value;

import com.google.gson.JsonNull;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonTreeValueTest {

    @Test
    void objectIsStringKeyedInterfaceMap() {
        Value v = JsonTreeValue.of(JsonParser.parseString("{\"a\": 1, \"b\": null}"));
        assertEquals(Shape.MAP, v.shape());
        assertEquals("map[string]interface{}", v.type().toString());
        assertEquals(2, v.entries().size());
        Value.Entry first = v.entries().get(0);
        assertEquals("a", first.key().stringValue());
        assertEquals(Shape.INTERFACE, first.value().shape());
        assertEquals(1.0, first.value().unpack().floatValue());
        assertTrue(v.entries().get(1).value().isNil());
    }

    @Test
    void arrayIsInterfaceSlice() {
        Value v = JsonTreeValue.of(JsonParser.parseString("[true, \"s\"]"));
        assertEquals(Shape.SLICE, v.shape());
        assertEquals(2, v.length());
        assertTrue(v.index(0).unpack().boolValue());
        assertEquals("s", v.index(1).unpack().stringValue());
        assertNull(v.bytes());
    }

    @Test
    void numbersAreFloat64() {
        Value v = JsonTreeValue.of(JsonParser.parseString("42"));
        assertEquals(GoType.FLOAT64, v.type());
        assertEquals(42, v.intValue());
    }

    @Test
    void jsonNullHasNoValue() {
        assertNull(JsonTreeValue.of(JsonNull.INSTANCE));
        assertNull(Values.of(JsonNull.INSTANCE));
    }
}
