package org.kidoni.expressions;

import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * A numeric literal: a 64-bit integer, a 64-bit float or a complex pair of 64-bit floats.
 * <p>
 * Mixed-kind arithmetic lifts both operands to the higher {@link Kind} first, so {@code Int + Real}
 * is a {@link Real} and anything combined with a {@link Complex} is a {@link Complex}. Integer
 * arithmetic stays integer: division truncates toward zero and powers are truncated from the
 * floating point result.
 */
public sealed interface Numerical {

    /**
     * The promotion lattice, lowest first.
     */
    enum Kind {
        INT,
        FLOAT,
        COMPLEX;

        public Kind max(final Kind other) {
            return compareTo(other) >= 0 ? this : other;
        }
    }

    static Numerical ofInt(final long value) {
        return new Int(value);
    }

    static Numerical ofFloat(final double value) {
        return new Real(value);
    }

    static Numerical ofComplex(final double re, final double im) {
        return new Complex(re, im);
    }

    Kind kind();

    /**
     * Represents this value as {@code target}, which must not be lower than {@link #kind()}.
     */
    Numerical promote(Kind target);

    String display();

    Numerical negate();

    boolean isZero();

    boolean isOne();

    default Numerical add(final Numerical other) {
        return apply(this, other, (a, b) -> a + b, Double::sum, Complex::plus);
    }

    default Numerical sub(final Numerical other) {
        return apply(this, other, (a, b) -> a - b, (a, b) -> a - b, Complex::minus);
    }

    default Numerical mul(final Numerical other) {
        return apply(this, other, (a, b) -> a * b, (a, b) -> a * b, Complex::times);
    }

    /**
     * @throws DivisionByZeroException if both operands are integers and {@code other} is zero
     */
    default Numerical div(final Numerical other) {
        return apply(this, other, IntegerArithmetic::divide, (a, b) -> a / b, Complex::dividedBy);
    }

    /**
     * @throws DivisionByZeroException if both operands are integers, this is zero and {@code exponent}
     * is negative
     */
    default Numerical pow(final Numerical exponent) {
        return apply(this, exponent, IntegerArithmetic::power, Math::pow, Complex::pow);
    }

    private static Numerical apply(final Numerical lhs,
                                   final Numerical rhs,
                                   final LongBinaryOperator ints,
                                   final DoubleBinaryOperator floats,
                                   final BinaryOperator<Complex> complexes) {
        final Kind kind = lhs.kind().max(rhs.kind());
        final Numerical left = lhs.promote(kind);
        final Numerical right = rhs.promote(kind);

        return switch (kind) {
            case INT -> new Int(ints.applyAsLong(((Int) left).value(), ((Int) right).value()));
            case FLOAT -> new Real(floats.applyAsDouble(((Real) left).value(), ((Real) right).value()));
            case COMPLEX -> complexes.apply((Complex) left, (Complex) right);
        };
    }

    record Int(long value) implements Numerical {
        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public Numerical promote(final Kind target) {
            return switch (target) {
                case INT -> this;
                case FLOAT -> new Real(value);
                case COMPLEX -> new Complex(value, 0.0);
            };
        }

        @Override
        public Numerical negate() {
            return new Int(-value);
        }

        @Override
        public boolean isZero() {
            return value == 0;
        }

        @Override
        public boolean isOne() {
            return value == 1;
        }

        @Override
        public String display() {
            return Long.toString(value);
        }

        @Override
        public String toString() {
            return display();
        }
    }

    record Real(double value) implements Numerical {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public Numerical promote(final Kind target) {
            return switch (target) {
                case INT -> throw new IllegalArgumentException("cannot demote a float to an integer");
                case FLOAT -> this;
                case COMPLEX -> new Complex(value, 0.0);
            };
        }

        @Override
        public Numerical negate() {
            return new Real(-value);
        }

        @Override
        public boolean isZero() {
            return value == 0.0;
        }

        @Override
        public boolean isOne() {
            return value == 1.0;
        }

        @Override
        public String display() {
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return display();
        }
    }

    record Complex(double re, double im) implements Numerical {
        @Override
        public Kind kind() {
            return Kind.COMPLEX;
        }

        @Override
        public Numerical promote(final Kind target) {
            if (target != Kind.COMPLEX) {
                throw new IllegalArgumentException("cannot demote a complex value to " + target);
            }
            return this;
        }

        @Override
        public Numerical negate() {
            return new Complex(-re, -im);
        }

        @Override
        public boolean isZero() {
            return re == 0.0 && im == 0.0;
        }

        @Override
        public boolean isOne() {
            return re == 1.0 && im == 0.0;
        }

        Complex plus(final Complex other) {
            return new Complex(re + other.re, im + other.im);
        }

        Complex minus(final Complex other) {
            return new Complex(re - other.re, im - other.im);
        }

        Complex times(final Complex other) {
            return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
        }

        Complex dividedBy(final Complex other) {
            final double norm = other.re * other.re + other.im * other.im;
            return new Complex((re * other.re + im * other.im) / norm, (im * other.re - re * other.im) / norm);
        }

        /**
         * Principal value of {@code this^exponent}, i.e. {@code exp(exponent * log(this))}.
         */
        Complex pow(final Complex exponent) {
            if (re == 0.0 && im == 0.0) {
                if (exponent.re == 0.0 && exponent.im == 0.0) {
                    return new Complex(1.0, 0.0);
                }
                if (exponent.re > 0.0) {
                    return new Complex(0.0, 0.0);
                }
                return new Complex(Double.NaN, Double.NaN);
            }

            final double logModulus = Math.log(Math.hypot(re, im));
            final double argument = Math.atan2(im, re);

            final double x = exponent.re * logModulus - exponent.im * argument;
            final double y = exponent.re * argument + exponent.im * logModulus;
            final double scale = Math.exp(x);

            return new Complex(scale * Math.cos(y), scale * Math.sin(y));
        }

        @Override
        public String display() {
            return re + " + " + im + "i";
        }

        @Override
        public String toString() {
            return display();
        }
    }
}
