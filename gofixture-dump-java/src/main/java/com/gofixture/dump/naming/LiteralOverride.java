package com.gofixture.dump.naming;

import com.gofixture.dump.value.Value;

/**
 * Replaces the structural literal of selected struct types with a custom Go expression.
 * Consulted only for non-zero struct values; the first override returning text wins.
 */
@FunctionalInterface
public interface LiteralOverride {

    /**
     * @return the Go expression to emit for {@code value}, or {@code null} if this override
     *         does not handle it. Packages the expression references must be recorded in
     *         {@code dependencies}, typically through {@link TypeNamer#qualify}.
     */
    String render(Value value, TypeNamer namer, DependencySet dependencies);
}
