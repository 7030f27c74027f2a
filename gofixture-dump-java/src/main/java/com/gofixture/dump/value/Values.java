package com.gofixture.dump.value;

import com.google.gson.JsonElement;

/**
 * Picks the {@link Value} adapter for an object handed to the dumper.
 */
public final class Values {

    private Values() {}

    /**
     * Returns {@code object} itself if it already is a {@link Value}, a {@link JsonTreeValue}
     * for Gson trees, a {@link ReflectedValue} otherwise. Returns {@code null} for
     * {@code null} and JSON null, which the dumper skips.
     */
    public static Value of(Object object) {
        if (object == null) {
            return null;
        }
        if (object instanceof Value v) {
            return v;
        }
        if (object instanceof JsonElement json) {
            return JsonTreeValue.of(json);
        }
        return ReflectedValue.of(object);
    }
}
