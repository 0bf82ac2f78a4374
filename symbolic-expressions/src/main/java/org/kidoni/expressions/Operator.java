package org.kidoni.expressions;

/**
 * Heads of {@link Expression.Node}s.
 */
public enum Operator {
    ADD("+"),
    MUL("*"),
    NON_COMMUTATIVE_MUL("@"),
    POWER("^"),
    CALL("call");

    private final String token;

    Operator(final String token) {
        this.token = token;
    }

    /**
     * @return the canonical token of this operator, e.g. {@code "+"} for {@link #ADD}
     */
    public String display() {
        return token;
    }

    @Override
    public String toString() {
        return token;
    }
}
