package com.gofixture.dump.naming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Go packages a literal needs imported: import path → alias ({@code ""} for a bare import).
 *
 * Adding a path that is already present has no effect, so the first alias recorded wins.
 */
public final class DependencySet {

    private static final Pattern VENDOR_PREFIX = Pattern.compile("^.*/vendor/");

    private final Map<String, String> imports = new LinkedHashMap<>();

    public void add(String pkgPath, String alias) {
        if (pkgPath == null || pkgPath.isEmpty()) {
            return;
        }
        String path = VENDOR_PREFIX.matcher(pkgPath).replaceFirst("");
        imports.putIfAbsent(path, alias == null ? "" : alias);
    }

    /** Merges {@code other} into this set; aliases already present are kept. */
    public void addAll(DependencySet other) {
        other.imports.forEach(this::add);
    }

    public boolean contains(String pkgPath) {
        return imports.containsKey(pkgPath);
    }

    /** Alias recorded for {@code pkgPath}, {@code ""} for a bare import, {@code null} if absent. */
    public String alias(String pkgPath) {
        return imports.get(pkgPath);
    }

    public boolean isEmpty() {
        return imports.isEmpty();
    }

    public int size() {
        return imports.size();
    }

    /** Entries in insertion order. */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(imports));
    }

    /** Entries ordered by import path, the order they are emitted in. */
    public SortedMap<String, String> sorted() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(imports));
    }

    @Override
    public String toString() {
        return imports.toString();
    }
}
