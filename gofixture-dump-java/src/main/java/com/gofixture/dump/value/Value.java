package com.gofixture.dump.value;

import java.util.List;

/**
 * Opaque handle to a runtime value plus its shape.
 *
 * Accessors are only meaningful for the shapes they name; calling one on another shape
 * returns a neutral result (zero, empty, {@code null}) rather than throwing, so the dumper
 * can always degrade to a best-effort rendering.
 */
public interface Value {

    Shape shape();

    GoType type();

    /** True for a nil pointer, slice, map, interface, chan or func, or a null opaque value. */
    boolean isNil();

    boolean boolValue();

    long intValue();

    /** Unsigned integer value, already widened (a Java byte {@code -1} reads as 255). */
    long uintValue();

    double floatValue();

    Complex complexValue();

    String stringValue();

    /**
     * Zero-copy view of a byte slice, or {@code null} when the elements have to be
     * converted one by one.
     */
    byte[] bytes();

    /** Pointee of a pointer, or content of an interface. */
    Value elem();

    /** Identity of a pointer, chan or func; {@code null} when nil. */
    Object address();

    int length();

    Value index(int i);

    List<Entry> entries();

    int numFields();

    String fieldName(int i);

    Value field(int i);

    /** The underlying Java object, or {@code null}. */
    Object unwrap();

    /** Content of a non-nil interface; this value for every other shape. */
    default Value unpack() {
        return shape() == Shape.INTERFACE && !isNil() ? elem() : this;
    }

    /** One key/value pair of a map. */
    record Entry(Value key, Value value) {}
}
