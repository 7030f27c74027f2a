package com.gofixture.dump.naming;

/**
 * Decides the qualifier a package's types are written with.
 *
 * Rules are consulted in order; the first one returning an alias wins and the package is
 * imported under that alias. When no rule applies the package name is used with a bare
 * import.
 */
@FunctionalInterface
public interface QualifierRule {

    /**
     * @param pkgPath Go import path, never empty
     * @param pkgName Go package name
     * @return the alias to import and qualify with, or {@code null} to defer to the next rule
     */
    String alias(String pkgPath, String pkgName);
}
