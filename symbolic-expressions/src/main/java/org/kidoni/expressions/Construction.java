package org.kidoni.expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.kidoni.expressions.Expression.Node;
import org.kidoni.expressions.Expression.Value;

/**
 * Arithmetic on {@link Expression}s.
 * <p>
 * Every operation returns a new expression in canonical form:
 * <ul>
 *     <li>two numeric {@link Value}s are folded into one {@link Value}, never a {@link Node};</li>
 *     <li>{@link Operator#ADD} and {@link Operator#MUL} nodes are flattened: {@code (x + y) + z} and
 *     {@code x + (y + z)} both give {@code +[x, y, z]};</li>
 *     <li>subtraction and division are rewritten, {@code a - b} as {@code a + (-1 * b)} and
 *     {@code a / b} as {@code a * b^-1};</li>
 *     <li>a power whose base is already a power gets the new exponent appended,
 *     {@code (x^a)^b} gives {@code ^[x, a, b]}.</li>
 * </ul>
 * Operands are never reordered and symbols are never simplified.
 */
public final class Construction {
    private static final Logger log = LoggerFactory.getLogger(Construction.class);

    private static final Expression MINUS_ONE = Expression.ofInt(-1);

    private Construction() {
    }

    public static Expression combine(final ArithmeticOp op, final Expression lhs, final Expression rhs) {
        return switch (op) {
            case ADD -> add(lhs, rhs);
            case SUB -> sub(lhs, rhs);
            case MUL -> mul(lhs, rhs);
            case DIV -> div(lhs, rhs);
            case POWER -> power(lhs, rhs);
        };
    }

    public static Expression add(final Expression lhs, final Expression rhs) {
        return flatten(Operator.ADD, headedBy(Operator.ADD), Numerical::add, lhs, rhs);
    }

    public static Expression mul(final Expression lhs, final Expression rhs) {
        return flatten(Operator.MUL, headedBy(Operator.MUL), Numerical::mul, lhs, rhs);
    }

    /**
     * Like {@link #mul(Expression, Expression)} but with head {@link Operator#NON_COMMUTATIVE_MUL}.
     * Numeric values still fold.
     */
    public static Expression nonCommutativeMul(final Expression lhs, final Expression rhs) {
        return flatten(Operator.NON_COMMUTATIVE_MUL, headedBy(Operator.NON_COMMUTATIVE_MUL), Numerical::mul, lhs, rhs);
    }

    public static Expression sub(final Expression lhs, final Expression rhs) {
        return foldOrRewrite("-", Numerical::sub, lhs, rhs, Construction::subtraction);
    }

    /**
     * @throws DivisionByZeroException if {@code rhs} is the integer value zero, whatever {@code lhs} is
     */
    public static Expression div(final Expression lhs, final Expression rhs) {
        return foldOrRewrite("/", Numerical::div, lhs, rhs, Construction::division);
    }

    public static Expression negate(final Expression operand) {
        return mul(MINUS_ONE, operand);
    }

    /**
     * @throws DivisionByZeroException if {@code base} is the integer value zero and {@code exponent} is a
     * negative integer value
     */
    public static Expression power(final Expression base, final Expression exponent) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(exponent, "exponent");

        if (base instanceof Value b && exponent instanceof Value e) {
            return fold("^", Numerical::pow, b, e);
        }

        if (base instanceof Node node && node.head() == Operator.POWER) {
            log.trace("chaining exponent {} onto {}", exponent, base);
            return new Node(Operator.POWER, appended(node.args(), exponent));
        }

        return new Node(Operator.POWER, List.of(base, exponent));
    }

    private static Expression subtraction(final Expression lhs, final Expression rhs) {
        return add(lhs, negate(rhs));
    }

    private static Expression division(final Expression lhs, final Expression rhs) {
        if (rhs instanceof Value divisor && divisor.number() instanceof Numerical.Int i && i.value() == 0) {
            log.debug("division by integer zero: {} / 0", lhs);
            throw new DivisionByZeroException("division by zero: " + lhs + " / 0");
        }
        return mul(lhs, power(rhs, MINUS_ONE));
    }

    private static Predicate<Expression> headedBy(final Operator op) {
        return expression -> expression.hasHead(op);
    }

    private static Expression flatten(final Operator op,
                                      final Predicate<Expression> isSameOpNode,
                                      final BinaryOperator<Numerical> numeric,
                                      final Expression lhs,
                                      final Expression rhs) {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");

        if (lhs instanceof Value l && rhs instanceof Value r) {
            return fold(op.display(), numeric, l, r);
        }

        final boolean left = isSameOpNode.test(lhs);
        final boolean right = isSameOpNode.test(rhs);

        if (left && right) {
            final List<Expression> args = new ArrayList<>(((Node) lhs).args());
            args.addAll(((Node) rhs).args());
            log.trace("merging '{}' nodes {} and {}", op, lhs, rhs);
            return new Node(op, args);
        }
        if (left) {
            log.trace("appending {} to {}", rhs, lhs);
            return new Node(op, appended(((Node) lhs).args(), rhs));
        }
        if (right) {
            final List<Expression> args = new ArrayList<>(((Node) rhs).arity() + 1);
            args.add(lhs);
            args.addAll(((Node) rhs).args());
            log.trace("prepending {} to {}", lhs, rhs);
            return new Node(op, args);
        }

        return new Node(op, List.of(lhs, rhs));
    }

    private static Expression foldOrRewrite(final String symbol,
                                            final BinaryOperator<Numerical> numeric,
                                            final Expression lhs,
                                            final Expression rhs,
                                            final BinaryOperator<Expression> rewrite) {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(rhs, "rhs");

        if (lhs instanceof Value l && rhs instanceof Value r) {
            return fold(symbol, numeric, l, r);
        }

        log.trace("rewriting {} {} {}", lhs, symbol, rhs);
        return rewrite.apply(lhs, rhs);
    }

    private static Expression fold(final String symbol,
                                   final BinaryOperator<Numerical> numeric,
                                   final Value lhs,
                                   final Value rhs) {
        final Numerical result = numeric.apply(lhs.number(), rhs.number());
        log.trace("folded {} {} {} to {}", lhs, symbol, rhs, result);
        return new Value(result);
    }

    private static List<Expression> appended(final List<Expression> args, final Expression last) {
        final List<Expression> result = new ArrayList<>(args.size() + 1);
        result.addAll(args);
        result.add(last);
        return result;
    }
}
