package org.kidoni.expressions;

/**
 * The binary operations accepted by {@link Construction#combine(ArithmeticOp, Expression, Expression)}.
 * Only {@link #ADD}, {@link #MUL} and {@link #POWER} ever appear as node heads; {@link #SUB} and
 * {@link #DIV} are rewritten in terms of them.
 */
public enum ArithmeticOp {
    ADD,
    SUB,
    MUL,
    DIV,
    POWER
}
