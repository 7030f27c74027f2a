package com.gofixture.dump;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of a dump session: the Go source text and the imports it needs (path → alias,
 * {@code ""} for a bare import), ordered by path.
 */
public record DumpResult(String text, Map<String, String> dependencies) {

    public DumpResult {
        dependencies = Collections.unmodifiableMap(new TreeMap<>(dependencies));
    }
}
