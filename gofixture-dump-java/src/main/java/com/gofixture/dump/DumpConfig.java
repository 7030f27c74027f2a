package com.gofixture.dump;

/**
 * Options of a dump session. Immutable; build variants with the {@code with*} methods.
 */
public final class DumpConfig {

    public static final String DEFAULT_INDENT = "\t";

    /** Text repeated once per nesting level. */
    public final String indent;

    /** Deepest nesting level whose contents are rendered; 0 means unlimited. */
    public final int maxDepth;

    /** Emit map entries in sorted key order. */
    public final boolean sortKeys;

    /** Render values that know their own text form as quoted strings. */
    public final boolean invokeStringers;

    /** Go package clause for the generated file; empty to omit it. */
    public final String packageName;

    public DumpConfig(String indent, int maxDepth, boolean sortKeys, boolean invokeStringers, String packageName) {
        this.indent = indent == null ? DEFAULT_INDENT : indent;
        this.maxDepth = Math.max(0, maxDepth);
        this.sortKeys = sortKeys;
        this.invokeStringers = invokeStringers;
        this.packageName = packageName == null ? "" : packageName;
    }

    public static DumpConfig defaults() {
        return new DumpConfig(DEFAULT_INDENT, 0, true, false, "");
    }

    public DumpConfig withIndent(String indent) {
        return new DumpConfig(indent, maxDepth, sortKeys, invokeStringers, packageName);
    }

    public DumpConfig withMaxDepth(int maxDepth) {
        return new DumpConfig(indent, maxDepth, sortKeys, invokeStringers, packageName);
    }

    public DumpConfig withSortKeys(boolean sortKeys) {
        return new DumpConfig(indent, maxDepth, sortKeys, invokeStringers, packageName);
    }

    public DumpConfig withInvokeStringers(boolean invokeStringers) {
        return new DumpConfig(indent, maxDepth, sortKeys, invokeStringers, packageName);
    }

    public DumpConfig withPackageName(String packageName) {
        return new DumpConfig(indent, maxDepth, sortKeys, invokeStringers, packageName);
    }

    public static DumpConfig parse(String options) {
        return parse(options, defaults());
    }

    /**
     * Applies comma-separated {@code key=value} options on top of {@code base}.
     *
     * Keys: {@code indent} ({@code tab}, a number of spaces, or literal text),
     * {@code depth}, {@code sort}, {@code stringers}, {@code package}.
     * Unknown keys and malformed numbers are reported and skipped.
     */
    public static DumpConfig parse(String options, DumpConfig base) {
        DumpConfig config = base;
        if (options == null || options.isBlank()) {
            return config;
        }
        for (String part : options.split(",")) {
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String value = kv[1].trim();
            switch (kv[0].trim()) {
                case "indent"    -> config = config.withIndent(parseIndent(kv[1]));
                case "depth"     -> {
                    try {
                        config = config.withMaxDepth(Integer.parseInt(value));
                    } catch (NumberFormatException e) {
                        System.err.println("[gofixture] WARNING: ignoring depth=" + value + ": not a number");
                    }
                }
                case "sort"      -> config = config.withSortKeys(!"false".equalsIgnoreCase(value));
                case "stringers" -> config = config.withInvokeStringers("true".equalsIgnoreCase(value));
                case "package"   -> config = config.withPackageName(value);
                default -> System.err.println("[gofixture] WARNING: unknown option " + kv[0].trim());
            }
        }
        return config;
    }

    /** {@code tab}, a number of spaces, or literal text with {@code \t} standing for a tab. */
    public static String parseIndent(String raw) {
        String value = raw.trim();
        if ("tab".equalsIgnoreCase(value)) {
            return "\t";
        }
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return " ".repeat(Integer.parseInt(value));
        }
        return raw.replace("\\t", "\t");
    }

    @Override
    public String toString() {
        return "indent=" + indent.replace("\t", "\\t") + " depth=" + maxDepth + " sort=" + sortKeys
                + " stringers=" + invokeStringers + " package=" + packageName;
    }
}
