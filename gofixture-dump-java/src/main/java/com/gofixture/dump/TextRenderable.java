package com.gofixture.dump;

/**
 * Implemented by values that have their own text form. When
 * {@link DumpConfig#invokeStringers} is set, such values are written as a quoted string
 * instead of being traversed.
 */
@FunctionalInterface
public interface TextRenderable {

    String renderText();
}
