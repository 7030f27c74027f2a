package com.gofixture.dump;

import com.gofixture.dump.naming.DependencySet;
import com.gofixture.dump.naming.LiteralOverride;
import com.gofixture.dump.naming.MarshaledConstructorOverride;
import com.gofixture.dump.naming.QualifierRule;
import com.gofixture.dump.naming.TypeNamer;
import com.gofixture.dump.naming.VersionedPackageRule;
import com.gofixture.dump.value.Value;
import com.gofixture.dump.value.Values;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns Java objects into a Go source fragment declaring each one as {@code var _ = <literal>}.
 *
 * <pre>{@code
 * DumpResult result = new FixtureDumper(DumpConfig.defaults().withPackageName("fixtures"))
 *         .dump(deployment, service);
 * }</pre>
 *
 * The fragment starts with an optional package clause and an import block covering every
 * package the literals reference. {@code null} arguments are skipped. An array passed alone
 * is spread by varargs; cast it to {@code Object} to dump it as one slice.
 */
public final class FixtureDumper {

    private final DumpConfig config;
    private final TypeNamer namer;
    private final List<LiteralOverride> overrides;

    public FixtureDumper() {
        this(DumpConfig.defaults());
    }

    public FixtureDumper(DumpConfig config) {
        this(config, List.of(new VersionedPackageRule()), List.of(MarshaledConstructorOverride.quantity()));
    }

    public FixtureDumper(DumpConfig config, List<QualifierRule> rules, List<LiteralOverride> overrides) {
        this.config = config;
        this.namer = new TypeNamer(rules);
        this.overrides = List.copyOf(overrides);
    }

    public DumpConfig config() {
        return config;
    }

    public DumpResult dump(Object... values) {
        Object[] args = values == null ? new Object[] {null} : values;
        DependencySet imports = new DependencySet();
        List<String> literals = new ArrayList<>(args.length);
        for (Object arg : args) {
            Value value = Values.of(arg);
            if (value == null) {
                continue;
            }
            DependencySet literalImports = new DependencySet();
            StringBuilder literal = new StringBuilder("var _ = ");
            new ValueDumper(config, namer, overrides, literal, literalImports).dump(value);
            literal.append('\n');
            imports.addAll(literalImports);
            literals.add(literal.toString());
        }

        StringBuilder text = new StringBuilder();
        if (!config.packageName.isEmpty()) {
            text.append("package ").append(config.packageName).append("\n\n");
        }
        if (!imports.isEmpty()) {
            text.append("import (");
            for (Map.Entry<String, String> e : imports.sorted().entrySet()) {
                text.append("\n\t");
                if (!e.getValue().isEmpty()) {
                    text.append(e.getValue()).append(' ');
                }
                text.append('"').append(e.getKey()).append('"');
            }
            text.append("\n)\n\n");
        }
        literals.forEach(text::append);
        return new DumpResult(text.toString(), imports.asMap());
    }

    /** Writes the fragment to {@code sink}. */
    public void fdump(Appendable sink, Object... values) {
        String text = dump(values).text();
        try {
            sink.append(text);
        } catch (IOException e) {
            throw new DumpException("failed to write fixture: " + e.getMessage(), e);
        }
    }

    /** The fragment as a string. */
    public String sdump(Object... values) {
        return dump(values).text();
    }
}
