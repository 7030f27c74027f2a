package com.gofixture.dump.value;

/**
 * Runtime classification of a value, discovered at every recursion step.
 *
 * The set is closed: anything a value adapter cannot place elsewhere is {@link #OTHER},
 * and a slot whose content could not be read at all is {@link #INVALID}.
 */
public enum Shape {
    INVALID,
    BOOL,
    /** Signed integer family (int8 … int64, rune). */
    INT,
    /** Unsigned integer family; {@code byte} is the only member Java produces. */
    UINT,
    FLOAT,
    COMPLEX,
    STRING,
    POINTER,
    SLICE,
    MAP,
    STRUCT,
    INTERFACE,
    CHAN,
    FUNC,
    OTHER;

    /** Shapes whose nil state is meaningful. */
    public boolean isNillable() {
        return switch (this) {
            case POINTER, SLICE, MAP, INTERFACE, CHAN, FUNC -> true;
            default -> false;
        };
    }
}
