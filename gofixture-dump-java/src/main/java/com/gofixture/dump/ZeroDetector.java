package com.gofixture.dump;

import com.gofixture.dump.value.Value;

/**
 * Decides whether a value equals its Go type's zero value. Zero struct fields are left out
 * of the emitted literal.
 *
 * Values whose zero-ness cannot be decided (invalid handles, complex numbers, chans, funcs
 * and non-null opaque values) count as non-zero so they are never silently dropped.
 */
public final class ZeroDetector {

    private ZeroDetector() {}

    public static boolean isZero(Value v) {
        return switch (v.shape()) {
            case POINTER, SLICE, MAP, INTERFACE -> v.isNil();
            case BOOL -> !v.boolValue();
            case INT -> v.intValue() == 0;
            case UINT -> v.uintValue() == 0;
            case FLOAT -> v.floatValue() == 0;
            case STRING -> v.stringValue().isEmpty();
            case STRUCT -> {
                for (int i = 0; i < v.numFields(); i++) {
                    if (!isZero(v.field(i).unpack())) {
                        yield false;
                    }
                }
                yield true;
            }
            case OTHER -> v.isNil();
            case INVALID, COMPLEX, CHAN, FUNC -> false;
        };
    }
}
