package com.gofixture.dump.value;

/**
 * A complex number. Rendered as a Go {@code complex128} literal.
 */
public record Complex(double real, double imag) {
}
