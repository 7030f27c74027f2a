package com.gofixture.dump.naming;

import com.gofixture.dump.value.GoType;

import java.util.List;

/**
 * Spells Go type expressions and records the packages they reference.
 *
 * Every named type met while spelling a type (including the element types of pointers,
 * slices, maps and chans) is qualified through the {@link QualifierRule}s and its package
 * is added to the caller's {@link DependencySet}.
 */
public final class TypeNamer {

    private final List<QualifierRule> rules;

    public TypeNamer(List<QualifierRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public String name(GoType type, DependencySet dependencies) {
        return switch (type.kind()) {
            case POINTER -> "*" + name(type.elem(), dependencies);
            case SLICE -> "[]" + name(type.elem(), dependencies);
            case MAP -> "map[" + name(type.key(), dependencies) + "]" + name(type.elem(), dependencies);
            case CHAN -> "chan " + name(type.elem(), dependencies);
            default -> {
                if (!type.isNamed()) {
                    yield type.name();
                }
                String qualifier = qualify(type.pkgPath(), type.pkgName(), dependencies);
                yield qualifier.isEmpty() ? type.name() : qualifier + "." + type.name();
            }
        };
    }

    /**
     * Qualifier for identifiers of the given package; records the import.
     * Types without an import path are written unqualified.
     */
    public String qualify(String pkgPath, String pkgName, DependencySet dependencies) {
        if (pkgPath.isEmpty()) {
            return "";
        }
        for (QualifierRule rule : rules) {
            String alias = rule.alias(pkgPath, pkgName);
            if (alias != null) {
                dependencies.add(pkgPath, alias);
                return alias;
            }
        }
        dependencies.add(pkgPath, "");
        return pkgName;
    }
}
