package com.gofixture.dump.value;

import com.gofixture.dump.value.JavaTypeMapper.Slot;
import com.google.gson.annotations.SerializedName;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Value} over a plain Java object, read through reflection.
 *
 * A value remembers the slot it was read from (struct field, container element, or a
 * runtime value such as a top-level argument or an interface's content), since the same
 * Java object maps to different shapes depending on where it sits: an {@code Integer}
 * field is a nullable {@code *int32}, an {@code Integer} list element is an {@code int32}.
 */
public final class ReflectedValue implements Value {

    private static final ReflectedValue INVALID =
            new ReflectedValue(null, Object.class, Shape.INVALID, GoType.INVALID, new Type[0]);

    private final Object value;
    private final Class<?> raw;
    private final Shape shape;
    private final GoType type;
    private final Type[] args;

    private List<?> elements;
    private List<Field> fields;

    private ReflectedValue(Object value, Class<?> raw, Shape shape, GoType type, Type[] args) {
        this.value = value;
        this.raw = raw;
        this.shape = shape;
        this.type = type;
        this.args = args;
    }

    /** Wraps a runtime value, classified by its own class. {@code null} yields a nil interface. */
    public static Value of(Object value) {
        if (value == null) {
            return new ReflectedValue(null, Object.class, Shape.INTERFACE, GoType.INTERFACE, new Type[0]);
        }
        return slot(value, value.getClass(), Slot.RUNTIME);
    }

    public static Value invalid() {
        return INVALID;
    }

    static Value slot(Object value, Type declared, Slot slot) {
        Class<?> raw = JavaTypeMapper.rawClass(declared);
        Shape shape = JavaTypeMapper.classify(raw, slot);
        Type[] args = JavaTypeMapper.typeArguments(declared, raw, shape, slot, value);
        return new ReflectedValue(value, raw, shape, JavaTypeMapper.goType(raw, shape, args), args);
    }

    private static Value struct(Object value, Class<?> cls) {
        return new ReflectedValue(value, cls, Shape.STRUCT, JavaTypeMapper.named(cls, Shape.STRUCT), new Type[0]);
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
        return (shape.isNillable() || shape == Shape.OTHER) && value == null;
    }

    @Override
    public boolean boolValue() {
        return value instanceof Boolean b && b;
    }

    @Override
    public long intValue() {
        if (value instanceof Number n) return n.longValue();
        if (value instanceof Character c) return c;
        return 0;
    }

    @Override
    public long uintValue() {
        if (value instanceof Byte b) return b & 0xFF;
        if (value instanceof Number n) return n.longValue();
        if (value instanceof Character c) return c;
        return 0;
    }

    @Override
    public double floatValue() {
        return value instanceof Number n ? n.doubleValue() : 0;
    }

    @Override
    public Complex complexValue() {
        return value instanceof Complex c ? c : new Complex(0, 0);
    }

    @Override
    public String stringValue() {
        if (value instanceof String s) return s;
        if (value instanceof Enum<?> e) return wireName(e);
        return "";
    }

    /** Enum constants keep the wire name Gson would use for them. */
    private static String wireName(Enum<?> e) {
        try {
            SerializedName name = e.getDeclaringClass().getField(e.name()).getAnnotation(SerializedName.class);
            return name != null ? name.value() : e.name();
        } catch (NoSuchFieldException ex) {
            return e.name();
        }
    }

    @Override
    public byte[] bytes() {
        return value instanceof byte[] b ? b : null;
    }

    @Override
    public Value elem() {
        if (value == null) {
            return INVALID;
        }
        return switch (shape) {
            case INTERFACE -> of(value);
            case POINTER -> {
                if (value instanceof AtomicReference<?> ref) {
                    yield slot(ref.get(), args[0], Slot.ELEMENT);
                }
                if (JavaTypeMapper.isBoxed(raw)) {
                    yield of(value);
                }
                yield struct(value, value.getClass());
            }
            default -> INVALID;
        };
    }

    @Override
    public Object address() {
        return switch (shape) {
            case POINTER, CHAN, FUNC -> value;
            default -> null;
        };
    }

    @Override
    public int length() {
        if (shape != Shape.SLICE || value == null) {
            return 0;
        }
        return value.getClass().isArray() ? Array.getLength(value) : elements().size();
    }

    @Override
    public Value index(int i) {
        if (shape != Shape.SLICE || value == null) {
            return INVALID;
        }
        Object element = value.getClass().isArray() ? Array.get(value, i) : elements().get(i);
        return slot(element, args[0], Slot.ELEMENT);
    }

    private List<?> elements() {
        if (elements == null) {
            elements = value instanceof List<?> list ? list : new ArrayList<>((Collection<?>) value);
        }
        return elements;
    }

    @Override
    public List<Entry> entries() {
        if (shape != Shape.MAP || !(value instanceof Map<?, ?> map)) {
            return List.of();
        }
        List<Entry> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> e : map.entrySet()) {
            entries.add(new Entry(slot(e.getKey(), args[0], Slot.ELEMENT), slot(e.getValue(), args[1], Slot.ELEMENT)));
        }
        return entries;
    }

    @Override
    public int numFields() {
        return shape == Shape.STRUCT ? fields().size() : 0;
    }

    @Override
    public String fieldName(int i) {
        return JavaTypeMapper.fieldName(fields().get(i));
    }

    @Override
    public Value field(int i) {
        Field field = fields().get(i);
        try {
            if (!field.trySetAccessible()) {
                System.err.println("[gofixture] WARNING: field not accessible: "
                        + field.getDeclaringClass().getName() + "." + field.getName());
                return INVALID;
            }
            Object fieldValue = value == null ? null : field.get(value);
            return slot(fieldValue, field.getGenericType(), Slot.FIELD);
        } catch (IllegalAccessException | RuntimeException e) {
            System.err.println("[gofixture] WARNING: could not read field "
                    + field.getDeclaringClass().getName() + "." + field.getName() + ": " + e);
            return INVALID;
        }
    }

    private List<Field> fields() {
        if (fields == null) {
            fields = JavaTypeMapper.fields(raw);
        }
        return fields;
    }

    @Override
    public Object unwrap() {
        return value;
    }

    @Override
    public String toString() {
        return shape + " " + type;
    }
}
