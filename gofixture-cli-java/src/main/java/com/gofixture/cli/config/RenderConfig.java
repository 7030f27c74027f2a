package com.gofixture.cli.config;

import com.gofixture.dump.DumpConfig;
import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional render.json passed with {@code --config}.
 * Every field is optional; absent fields keep the value of the configuration they are applied to.
 */
public class RenderConfig {

    /** Go package clause of the generated file. */
    @SerializedName("package")
    private String packageName;

    /** Indentation: {@code "tab"}, a number of spaces, or the literal text. */
    @SerializedName("indent")
    private String indent;

    /** Deepest nesting level rendered (0 = unlimited). */
    @SerializedName("max_depth")
    private Integer maxDepth;

    @SerializedName("sort_keys")
    private Boolean sortKeys;

    @SerializedName("invoke_stringers")
    private Boolean invokeStringers;

    /** Fully-qualified class every input document is bound to; raw JSON trees when absent. */
    @SerializedName("type")
    private String type;

    public String getPackageName()     { return packageName; }
    public String getIndent()          { return indent; }
    public Integer getMaxDepth()       { return maxDepth; }
    public Boolean getSortKeys()       { return sortKeys; }
    public Boolean getInvokeStringers() { return invokeStringers; }
    public String getType()            { return type; }

    /** {@code base} with every field present in this file applied on top. */
    public DumpConfig applyTo(DumpConfig base) {
        DumpConfig config = base;
        if (indent != null)          config = config.withIndent(DumpConfig.parseIndent(indent));
        if (maxDepth != null)        config = config.withMaxDepth(maxDepth);
        if (sortKeys != null)        config = config.withSortKeys(sortKeys);
        if (invokeStringers != null) config = config.withInvokeStringers(invokeStringers);
        if (packageName != null)     config = config.withPackageName(packageName);
        return config;
    }
}
