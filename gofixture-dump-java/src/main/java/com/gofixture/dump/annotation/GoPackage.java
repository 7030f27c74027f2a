package com.gofixture.dump.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the Go package that classes mirror.
 *
 * Placed on a {@code package-info.java} it applies to every class of the Java package;
 * placed on a class it overrides the package-level declaration.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.PACKAGE, ElementType.TYPE})
public @interface GoPackage {

    /** Go import path, e.g. {@code k8s.io/api/apps/v1}. */
    String value();

    /** Go package name; defaults to the last element of the import path. */
    String name() default "";
}
