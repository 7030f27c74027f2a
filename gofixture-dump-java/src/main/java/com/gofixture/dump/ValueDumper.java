package com.gofixture.dump;

import com.gofixture.dump.naming.DependencySet;
import com.gofixture.dump.naming.LiteralOverride;
import com.gofixture.dump.naming.TypeNamer;
import com.gofixture.dump.value.GoType;
import com.gofixture.dump.value.Shape;
import com.gofixture.dump.value.Value;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Writes one value as a Go composite literal.
 *
 * Struct fields holding zero values are omitted. Pointers are written as {@code &T{...}},
 * pointers to values that cannot take {@code &} (scalars, strings, byte blocks, nil
 * composites) through an inline {@code func(x T) *T {return &x }(v)} helper. A pointer, slice,
 * map or struct already on the current path is written as its type followed by
 * {@value #CIRCULAR_MARKER}. Every package a type name
 * references is added to the dependency set given at construction.
 *
 * Not thread-safe; use one instance per literal.
 */
public final class ValueDumper {

    static final String INVALID_MARKER = "<invalid>";
    static final String CIRCULAR_MARKER = "<already shown>";
    static final String MAX_DEPTH_MARKER = "<max depth reached>";

    private final DumpConfig config;
    private final TypeNamer namer;
    private final List<LiteralOverride> overrides;
    private final Appendable out;
    private final DependencySet dependencies;
    private final PointerChain pointers = new PointerChain();

    private int depth;

    public ValueDumper(DumpConfig config, TypeNamer namer, List<LiteralOverride> overrides,
                       Appendable out, DependencySet dependencies) {
        this.config = config;
        this.namer = namer;
        this.overrides = List.copyOf(overrides);
        this.out = out;
        this.dependencies = dependencies;
    }

    public void dump(Value value) {
        dump(value, false, false);
    }

    int depth() {
        return depth;
    }

    // -------------------------------------------------------------------------
    // Traversal
    // -------------------------------------------------------------------------

    /**
     * @param typeShown the type name was already written (after a pointer's {@code &T})
     * @param inline    the cursor is mid-line, so no indentation is written first
     */
    private void dump(Value v, boolean typeShown, boolean inline) {
        Shape shape = v.shape();
        if (shape == Shape.INVALID) {
            indent(inline);
            write(INVALID_MARKER);
            return;
        }
        if (shape == Shape.POINTER) {
            indent(inline);
            dumpPointer(v);
            return;
        }

        boolean byteBlock = shape == Shape.SLICE && isByteBlock(v);
        if (!typeShown) {
            indent(inline);
            switch (shape) {
                case SLICE, MAP -> {
                    if (!v.isNil()) {
                        write(byteBlock ? "[]byte" : typeName(v.type()));
                    }
                }
                case STRUCT -> {
                    String override = override(v);
                    if (override != null) {
                        write(override);
                        return;
                    }
                    write(typeName(v.type()));
                }
                default -> {
                }
            }
        }

        if (config.invokeStringers && shape != Shape.INTERFACE && writeRenderedText(v)) {
            return;
        }
        if (isCircular(v, byteBlock, typeShown)) {
            write(CIRCULAR_MARKER);
            return;
        }

        switch (shape) {
            case BOOL -> write(Boolean.toString(v.boolValue()));
            case INT -> write(Long.toString(v.intValue()));
            case UINT -> write(Long.toUnsignedString(v.uintValue()));
            case FLOAT -> writeFloat(v);
            case COMPLEX -> write(GoSyntax.formatComplex(v.complexValue()));
            case STRING -> write(GoSyntax.stringLiteral(v.stringValue()));
            case SLICE -> dumpSlice(v, byteBlock);
            case MAP -> dumpMap(v);
            case STRUCT -> dumpStruct(v);
            case INTERFACE -> {
                if (v.isNil()) {
                    write("nil");
                } else {
                    dump(v.elem(), typeShown, true);
                }
            }
            case CHAN, FUNC -> write(v.isNil() ? "nil" : GoSyntax.hexAddress(v.address()));
            case OTHER -> write(v.isNil() ? "nil" : textOf(v.unwrap()));
            case POINTER, INVALID -> {
                // handled above
            }
        }
    }

    private void dumpPointer(Value v) {
        pointers.purgeFrom(depth);

        Set<Object> walked = Collections.newSetFromMap(new IdentityHashMap<>());
        boolean nilFound = false;
        boolean cycleFound = false;
        int indirects = 0;
        Value ve = v;
        while (ve.shape() == Shape.POINTER) {
            if (ve.isNil()) {
                nilFound = true;
                break;
            }
            indirects++;
            Object address = ve.address();
            boolean repeated = !walked.add(address);
            if (pointers.enter(address, depth) || repeated) {
                cycleFound = true;
                indirects--;
                break;
            }
            ve = ve.elem();
            if (ve.shape() == Shape.INTERFACE) {
                if (ve.isNil()) {
                    nilFound = true;
                    break;
                }
                ve = ve.elem();
            }
        }

        if (nilFound) {
            write("nil");
            return;
        }
        if (ve.shape() == Shape.INVALID) {
            write(INVALID_MARKER);
            return;
        }

        String override = !cycleFound && ve.shape() == Shape.STRUCT ? override(ve) : null;
        boolean addressable = cycleFound || override == null && isAddressable(ve);
        if (addressable) {
            write("&".repeat(indirects));
            write(typeName(ve.type()));
        } else {
            String t = typeName(ve.type());
            write("func(x " + t + ") *" + t + " {return &x }(");
        }

        if (cycleFound) {
            write(CIRCULAR_MARKER);
        } else if (override != null) {
            write(override);
        } else {
            dump(ve, addressable, true);
        }

        if (!addressable) {
            write(")");
        }
    }

    /**
     * Records a non-nil slice, map or struct on the current path. Behind a pointer the chain
     * was already purged at this depth and holds the pointer's own entries.
     */
    private boolean isCircular(Value v, boolean byteBlock, boolean behindPointer) {
        Object identity = v.unwrap();
        boolean composite = switch (v.shape()) {
            case SLICE -> !byteBlock && !v.isNil();
            case MAP -> !v.isNil();
            case STRUCT -> true;
            default -> false;
        };
        if (!composite || identity == null) {
            return false;
        }
        if (!behindPointer) {
            pointers.purgeFrom(depth);
        }
        return pointers.enter(identity, depth);
    }

    /** Whether {@code &T} can prefix the value's literal: non-nil composites except byte blocks. */
    private static boolean isAddressable(Value v) {
        return switch (v.shape()) {
            case STRUCT -> true;
            case MAP, INTERFACE -> !v.isNil();
            case SLICE -> !v.isNil() && !isByteBlock(v);
            default -> false;
        };
    }

    private void dumpSlice(Value v, boolean byteBlock) {
        if (v.isNil()) {
            write("nil");
            return;
        }
        if (byteBlock) {
            write("(");
            write(GoSyntax.byteLiteral(bytesOf(v)));
            write(")");
            return;
        }
        write("{\n");
        depth++;
        if (maxDepthExceeded()) {
            writeMaxDepthMarker();
        } else {
            for (int i = 0; i < v.length(); i++) {
                dump(v.index(i).unpack(), false, false);
                write(",\n");
            }
        }
        closeBlock();
    }

    private void dumpMap(Value v) {
        if (v.isNil()) {
            write("nil");
            return;
        }
        write("{\n");
        depth++;
        if (maxDepthExceeded()) {
            writeMaxDepthMarker();
        } else {
            List<Value.Entry> entries = new ArrayList<>(v.entries());
            if (config.sortKeys) {
                entries.sort((a, b) -> compareKeys(a.key().unpack(), b.key().unpack()));
            }
            for (Value.Entry e : entries) {
                dump(e.key().unpack(), false, false);
                write(": ");
                dump(e.value().unpack(), false, true);
                write(",\n");
            }
        }
        closeBlock();
    }

    private void dumpStruct(Value v) {
        write("{\n");
        depth++;
        if (maxDepthExceeded()) {
            writeMaxDepthMarker();
        } else {
            for (int i = 0; i < v.numFields(); i++) {
                Value field = v.field(i);
                if (ZeroDetector.isZero(field)) {
                    continue;
                }
                indent(false);
                write(v.fieldName(i));
                write(": ");
                dump(field.unpack(), false, true);
                write(",\n");
            }
        }
        closeBlock();
    }

    private void closeBlock() {
        depth--;
        indent(false);
        write("}");
    }

    // -------------------------------------------------------------------------
    // Leaves
    // -------------------------------------------------------------------------

    private void writeFloat(Value v) {
        double f = v.floatValue();
        if (!Double.isNaN(f) && !Double.isInfinite(f)) {
            write(GoSyntax.formatFloat(f, v.type().bitSize()));
            return;
        }
        dependencies.add("math", "");
        String expr = Double.isNaN(f) ? "math.NaN()" : f > 0 ? "math.Inf(1)" : "math.Inf(-1)";
        write(v.type().bitSize() == 32 ? "float32(" + expr + ")" : expr);
    }

    private boolean writeRenderedText(Value v) {
        Object target = v.unwrap();
        String text;
        try {
            if (target instanceof TextRenderable renderable) {
                text = renderable.renderText();
            } else if (target instanceof Throwable t) {
                text = t.getMessage() != null ? t.getMessage() : t.toString();
            } else {
                return false;
            }
        } catch (RuntimeException e) {
            System.err.println("[gofixture] WARNING: renderText failed for " + target.getClass().getName() + ": " + e);
            return false;
        }
        if (text == null) {
            return false;
        }
        write(GoSyntax.quote(text));
        return true;
    }

    private static boolean isByteBlock(Value v) {
        GoType elem = v.type().elem();
        return elem != null && elem.isByte();
    }

    private static byte[] bytesOf(Value v) {
        byte[] view = v.bytes();
        if (view != null) {
            return view;
        }
        byte[] copy = new byte[v.length()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = (byte) v.index(i).unpack().uintValue();
        }
        return copy;
    }

    private static String textOf(Object o) {
        try {
            return String.valueOf(o);
        } catch (RuntimeException e) {
            System.err.println("[gofixture] WARNING: toString failed for " + o.getClass().getName() + ": " + e);
            return INVALID_MARKER;
        }
    }

    /** Go's map key order: booleans, numbers and strings by value, anything else by its text. */
    static int compareKeys(Value a, Value b) {
        if (a.shape() != b.shape()) {
            return a.shape().compareTo(b.shape());
        }
        return switch (a.shape()) {
            case BOOL -> Boolean.compare(a.boolValue(), b.boolValue());
            case INT -> Long.compare(a.intValue(), b.intValue());
            case UINT -> Long.compareUnsigned(a.uintValue(), b.uintValue());
            case FLOAT -> Double.compare(a.floatValue(), b.floatValue());
            case STRING -> a.stringValue().compareTo(b.stringValue());
            default -> textOf(a.unwrap()).compareTo(textOf(b.unwrap()));
        };
    }

    private String override(Value v) {
        if (overrides.isEmpty() || ZeroDetector.isZero(v)) {
            return null;
        }
        for (LiteralOverride o : overrides) {
            String rendered = o.render(v, namer, dependencies);
            if (rendered != null) {
                return rendered;
            }
        }
        return null;
    }

    // -------------------------------------------------------------------------
    // Output
    // -------------------------------------------------------------------------

    private boolean maxDepthExceeded() {
        return config.maxDepth != 0 && depth > config.maxDepth;
    }

    private void writeMaxDepthMarker() {
        indent(false);
        write(MAX_DEPTH_MARKER + "\n");
    }

    private String typeName(GoType type) {
        return namer.name(type, dependencies);
    }

    private void indent(boolean inline) {
        if (!inline) {
            write(config.indent.repeat(depth));
        }
    }

    private void write(String s) {
        try {
            out.append(s);
        } catch (IOException e) {
            throw new DumpException("failed to write literal: " + e.getMessage(), e);
        }
    }
}
