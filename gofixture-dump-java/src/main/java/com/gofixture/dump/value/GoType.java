package com.gofixture.dump.value;

import java.util.Objects;

/**
 * Descriptor of the Go type a value is emitted as.
 *
 * Builtin types carry only a name. Named types additionally carry the import path and
 * package name of the Go package declaring them ({@code pkgPath} is non-null, possibly empty
 * for types without a package). Pointer, slice and chan types carry {@code elem}; map types
 * carry {@code key} and {@code elem}.
 */
public record GoType(Shape kind, String name, String pkgPath, String pkgName, GoType elem, GoType key) {

    public static final GoType INVALID = builtin("invalid", Shape.INVALID);
    public static final GoType BOOL = builtin("bool", Shape.BOOL);
    public static final GoType BYTE = builtin("byte", Shape.UINT);
    public static final GoType INT16 = builtin("int16", Shape.INT);
    public static final GoType RUNE = builtin("rune", Shape.INT);
    public static final GoType INT32 = builtin("int32", Shape.INT);
    public static final GoType INT64 = builtin("int64", Shape.INT);
    public static final GoType FLOAT32 = builtin("float32", Shape.FLOAT);
    public static final GoType FLOAT64 = builtin("float64", Shape.FLOAT);
    public static final GoType COMPLEX128 = builtin("complex128", Shape.COMPLEX);
    public static final GoType STRING = builtin("string", Shape.STRING);
    public static final GoType INTERFACE = builtin("interface{}", Shape.INTERFACE);
    public static final GoType FUNC = builtin("func()", Shape.FUNC);
    public static final GoType OTHER = builtin("interface{}", Shape.OTHER);

    public GoType {
        Objects.requireNonNull(kind, "kind");
    }

    public static GoType builtin(String name, Shape kind) {
        return new GoType(kind, name, null, null, null, null);
    }

    public static GoType named(String pkgPath, String pkgName, String name, Shape kind) {
        return new GoType(kind, name, pkgPath == null ? "" : pkgPath, pkgName == null ? "" : pkgName, null, null);
    }

    public static GoType pointerTo(GoType elem) {
        return new GoType(Shape.POINTER, null, null, null, elem, null);
    }

    public static GoType sliceOf(GoType elem) {
        return new GoType(Shape.SLICE, null, null, null, elem, null);
    }

    public static GoType mapOf(GoType key, GoType elem) {
        return new GoType(Shape.MAP, null, null, null, elem, key);
    }

    public static GoType chanOf(GoType elem) {
        return new GoType(Shape.CHAN, null, null, null, elem, null);
    }

    /** True for types declared in a package (including the empty package). */
    public boolean isNamed() {
        return pkgPath != null && name != null;
    }

    /** True for {@code byte}/{@code uint8}, the element type of byte blocks. */
    public boolean isByte() {
        return kind == Shape.UINT && ("byte".equals(name) || "uint8".equals(name));
    }

    /** Bit size used when formatting floats: 32 for float32, 64 otherwise. */
    public int bitSize() {
        return "float32".equals(name) ? 32 : 64;
    }

    /** The unqualified-by-rules Go spelling, e.g. {@code v1.Deployment}. */
    public String qualifiedName() {
        if (!isNamed()) {
            return name;
        }
        return pkgName.isEmpty() ? name : pkgName + "." + name;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case POINTER -> "*" + elem;
            case SLICE -> "[]" + elem;
            case MAP -> "map[" + key + "]" + elem;
            case CHAN -> "chan " + elem;
            default -> qualifiedName();
        };
    }
}
