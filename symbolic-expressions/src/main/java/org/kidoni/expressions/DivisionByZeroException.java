package org.kidoni.expressions;

/**
 * Thrown when an integer {@link Numerical} is divided by zero, or when integer zero is raised to a
 * negative integer power. Float and complex values never throw; they produce infinities or NaN.
 */
public class DivisionByZeroException extends RuntimeException {
    public DivisionByZeroException(final String message) {
        super(message);
    }
}
