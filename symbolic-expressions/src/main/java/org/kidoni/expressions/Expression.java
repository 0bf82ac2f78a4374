package org.kidoni.expressions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable symbolic expression tree.
 * <p>
 * Leaves are {@link Symbol}s and numeric {@link Value}s; everything else is a {@link Node} holding an
 * {@link Operator} and its ordered arguments. Equality is structural. Trees are built bottom-up with
 * the arithmetic methods below (see {@link Construction}) and never change afterwards, so they can be
 * shared freely, between threads as well.
 */
public sealed interface Expression {
    record Symbol(String name) implements Expression {
        public Symbol {
            Objects.requireNonNull(name, "name");
            name = name.intern();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Value(Numerical number) implements Expression {
        public Value {
            Objects.requireNonNull(number, "number");
        }

        @Override
        public String toString() {
            return number.display();
        }
    }

    /**
     * An operator applied to one or more arguments. A {@link Operator#CALL} node keeps the name of the
     * callee as a {@link Symbol} in front of the call arguments.
     */
    record Node(Operator head, List<Expression> args) implements Expression {
        public Node {
            Objects.requireNonNull(head, "head");
            args = List.copyOf(args);

            if (args.isEmpty()) {
                throw new IllegalArgumentException("'" + head.display() + "' node without arguments");
            }
            if (head == Operator.CALL && !(args.get(0) instanceof Symbol)) {
                throw new IllegalArgumentException("call node must start with the callee name: " + args.get(0));
            }
        }

        public int arity() {
            return args.size();
        }

        public Expression arg(final int index) {
            return args.get(index);
        }

        @Override
        public String toString() {
            if (head == Operator.CALL) {
                return args.get(0) + args.subList(1, args.size()).stream()
                        .map(Expression::toString)
                        .collect(Collectors.joining(", ", "(", ")"));
            }

            if (head == Operator.ADD) {
                final StringBuilder sum = new StringBuilder(args.get(0).toString());
                for (final Expression term : args.subList(1, args.size())) {
                    final String text = term.toString();
                    if (isNegativeTerm(term)) {
                        sum.append(" - ").append(text, 1, text.length());
                    }
                    else {
                        sum.append(" + ").append(text);
                    }
                }
                return sum.toString();
            }

            final String separator = " " + head.display() + " ";
            if (head == Operator.MUL && args.size() > 1 && isMinusOne(args.get(0))) {
                return "-" + args.subList(1, args.size()).stream()
                        .map(Node::bracketed)
                        .collect(Collectors.joining(separator));
            }

            return args.stream()
                    .map(Node::bracketed)
                    .collect(Collectors.joining(separator));
        }

        private static String bracketed(final Expression arg) {
            if (arg.hasHead(Operator.ADD) || arg.hasHead(Operator.MUL) || arg.hasHead(Operator.NON_COMMUTATIVE_MUL)) {
                return "(" + arg + ")";
            }
            return arg.toString();
        }

        // rendered with a leading '-' that a sum turns into " - "
        private static boolean isNegativeTerm(final Expression term) {
            if (term instanceof Value value) {
                final Numerical number = value.number();
                return number instanceof Numerical.Int i && i.value() < 0
                        || number instanceof Numerical.Real r && r.value() < 0.0;
            }
            return term instanceof Node node
                    && node.head() == Operator.MUL
                    && node.arity() > 1
                    && isMinusOne(node.arg(0));
        }

        private static boolean isMinusOne(final Expression arg) {
            if (arg instanceof Value value) {
                final Numerical number = value.number();
                return number instanceof Numerical.Int i && i.value() == -1
                        || number instanceof Numerical.Real r && r.value() == -1.0;
            }
            return false;
        }
    }

    static Expression symbol(final String name) {
        return new Symbol(name);
    }

    static Expression value(final Numerical number) {
        return new Value(number);
    }

    static Expression ofInt(final long value) {
        return new Value(Numerical.ofInt(value));
    }

    static Expression ofFloat(final double value) {
        return new Value(Numerical.ofFloat(value));
    }

    static Expression ofComplex(final double re, final double im) {
        return new Value(Numerical.ofComplex(re, im));
    }

    static Expression zero() {
        return ofInt(0);
    }

    static Expression one() {
        return ofInt(1);
    }

    /**
     * A call of the function {@code name}, e.g. {@code call("sin", x)} for {@code sin(x)}.
     */
    static Expression call(final String name, final Expression... args) {
        final List<Expression> callArgs = new ArrayList<>(args.length + 1);
        callArgs.add(new Symbol(name));
        callArgs.addAll(Arrays.asList(args));
        return new Node(Operator.CALL, callArgs);
    }

    default boolean isSymbol() {
        return this instanceof Symbol;
    }

    default boolean isValue() {
        return this instanceof Value;
    }

    /**
     * @return true for a numeric zero of any kind, {@code 0}, {@code 0.0} or {@code 0.0 + 0.0i}
     */
    default boolean isZero() {
        return this instanceof Value value && value.number().isZero();
    }

    default boolean isOne() {
        return this instanceof Value value && value.number().isOne();
    }

    default boolean isNode() {
        return this instanceof Node;
    }

    default boolean hasHead(final Operator operator) {
        return this instanceof Node node && node.head() == operator;
    }

    default boolean isAddition() {
        return hasHead(Operator.ADD);
    }

    default boolean isMultiplication() {
        return hasHead(Operator.MUL);
    }

    default boolean isPower() {
        return hasHead(Operator.POWER);
    }

    default boolean isCall() {
        return hasHead(Operator.CALL);
    }

    default Expression add(final Expression other) {
        return Construction.add(this, other);
    }

    default Expression sub(final Expression other) {
        return Construction.sub(this, other);
    }

    default Expression mul(final Expression other) {
        return Construction.mul(this, other);
    }

    default Expression div(final Expression other) {
        return Construction.div(this, other);
    }

    default Expression pow(final Expression exponent) {
        return Construction.power(this, exponent);
    }

    default Expression negate() {
        return Construction.negate(this);
    }

    /**
     * Non-commutative product, {@code this @ other}.
     */
    default Expression kron(final Expression other) {
        return Construction.nonCommutativeMul(this, other);
    }
}
