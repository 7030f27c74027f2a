package com.gofixture.dump.value;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link Value} over an untyped Gson tree, shaped the way Go's encoding/json decodes into
 * {@code interface{}}: objects become {@code map[string]interface{}}, arrays {@code []interface{}},
 * numbers {@code float64}. Every map value and array element is an interface slot.
 */
public final class JsonTreeValue implements Value {

    private static final GoType OBJECT = GoType.mapOf(GoType.STRING, GoType.INTERFACE);
    private static final GoType ARRAY = GoType.sliceOf(GoType.INTERFACE);

    private final JsonElement element;
    private final Shape shape;
    private final GoType type;

    private JsonTreeValue(JsonElement element, Shape shape, GoType type) {
        this.element = element;
        this.shape = shape;
        this.type = type;
    }

    /** The concrete value of {@code element}, or {@code null} for JSON null. */
    public static Value of(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonObject()) {
            return new JsonTreeValue(element, Shape.MAP, OBJECT);
        }
        if (element.isJsonArray()) {
            return new JsonTreeValue(element, Shape.SLICE, ARRAY);
        }
        JsonPrimitive p = element.getAsJsonPrimitive();
        if (p.isBoolean()) {
            return new JsonTreeValue(p, Shape.BOOL, GoType.BOOL);
        }
        if (p.isNumber()) {
            return new JsonTreeValue(p, Shape.FLOAT, GoType.FLOAT64);
        }
        return new JsonTreeValue(p, Shape.STRING, GoType.STRING);
    }

    private static Value slot(JsonElement element) {
        return new JsonTreeValue(element, Shape.INTERFACE, GoType.INTERFACE);
    }

    private static Value key(String name) {
        return new JsonTreeValue(new JsonPrimitive(name), Shape.STRING, GoType.STRING);
    }

    @Override
    public Shape shape() {
        return shape;
    }

    @Override
    public GoType type() {
        return type;
    }

    @Override
    public boolean isNil() {
        return shape == Shape.INTERFACE && (element == null || element.isJsonNull());
    }

    @Override
    public boolean boolValue() {
        return shape == Shape.BOOL && element.getAsBoolean();
    }

    @Override
    public long intValue() {
        return (long) floatValue();
    }

    @Override
    public long uintValue() {
        return (long) floatValue();
    }

    @Override
    public double floatValue() {
        return shape == Shape.FLOAT ? element.getAsDouble() : 0;
    }

    @Override
    public Complex complexValue() {
        return new Complex(0, 0);
    }

    @Override
    public String stringValue() {
        return shape == Shape.STRING ? element.getAsString() : "";
    }

    @Override
    public byte[] bytes() {
        return null;
    }

    @Override
    public Value elem() {
        if (shape != Shape.INTERFACE || isNil()) {
            return ReflectedValue.invalid();
        }
        return of(element);
    }

    @Override
    public Object address() {
        return null;
    }

    @Override
    public int length() {
        return shape == Shape.SLICE ? element.getAsJsonArray().size() : 0;
    }

    @Override
    public Value index(int i) {
        if (shape != Shape.SLICE) {
            return ReflectedValue.invalid();
        }
        JsonArray array = element.getAsJsonArray();
        return slot(array.get(i));
    }

    @Override
    public List<Entry> entries() {
        if (shape != Shape.MAP) {
            return List.of();
        }
        JsonObject object = element.getAsJsonObject();
        List<Entry> entries = new ArrayList<>(object.size());
        for (Map.Entry<String, JsonElement> e : object.entrySet()) {
            entries.add(new Entry(key(e.getKey()), slot(e.getValue())));
        }
        return entries;
    }

    @Override
    public int numFields() {
        return 0;
    }

    @Override
    public String fieldName(int i) {
        throw new IndexOutOfBoundsException("JSON values have no struct fields");
    }

    @Override
    public Value field(int i) {
        return ReflectedValue.invalid();
    }

    @Override
    public Object unwrap() {
        return element;
    }

    @Override
    public String toString() {
        return shape + " " + type;
    }
}
