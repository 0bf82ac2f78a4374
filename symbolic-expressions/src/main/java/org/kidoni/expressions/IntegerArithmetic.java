package org.kidoni.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class IntegerArithmetic {
    private static final Logger log = LoggerFactory.getLogger(IntegerArithmetic.class);

    private IntegerArithmetic() {
    }

    /**
     * Truncating signed division. {@code Long.MIN_VALUE / -1} wraps around to {@code Long.MIN_VALUE}.
     */
    static long divide(final long dividend, final long divisor) {
        if (divisor == 0) {
            log.debug("integer division by zero: {} / {}", dividend, divisor);
            throw new DivisionByZeroException("integer division by zero: " + dividend + " / 0");
        }
        return dividend / divisor;
    }

    /**
     * Computed in floating point and truncated, so negative exponents of anything but 1 and -1 give 0.
     */
    static long power(final long base, final long exponent) {
        if (base == 0 && exponent < 0) {
            log.debug("integer zero raised to negative power: 0 ^ {}", exponent);
            throw new DivisionByZeroException("integer zero raised to negative power: 0 ^ " + exponent);
        }
        return (long) Math.pow(base, exponent);
    }
}
