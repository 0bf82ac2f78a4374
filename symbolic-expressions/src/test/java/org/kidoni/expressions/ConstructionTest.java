package org.kidoni.expressions;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.kidoni.expressions.Expression.Node;
import org.kidoni.expressions.Expression.Value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kidoni.expressions.Expression.ofComplex;
import static org.kidoni.expressions.Expression.ofFloat;
import static org.kidoni.expressions.Expression.ofInt;
import static org.kidoni.expressions.Expression.symbol;

class ConstructionTest {
    private final Expression x = symbol("x");
    private final Expression y = symbol("y");
    private final Expression z = symbol("z");

    private static Node node(final Operator head, final Expression... args) {
        return new Node(head, List.of(args));
    }

    @Test
    void constantFolding() {
        assertEquals(ofInt(3), Construction.add(ofInt(1), ofInt(2)));
        assertEquals(ofComplex(3.0, 4.0), Construction.add(ofFloat(1.0), ofComplex(2.0, 4.0)));
        assertEquals(ofFloat(2.5), Construction.mul(ofInt(5), ofFloat(0.5)));
        assertEquals(ofInt(-1), Construction.sub(ofInt(1), ofInt(2)));
        assertEquals(ofInt(3), Construction.div(ofInt(7), ofInt(2)));
        assertEquals(ofInt(-3), Construction.div(ofInt(-7), ofInt(2)));
        assertEquals(ofInt(9), Construction.power(ofInt(3), ofInt(2)));
        assertEquals(ofInt(-4), Construction.negate(ofInt(4)));
        assertEquals(ofFloat(-0.5), Construction.negate(ofFloat(0.5)));
    }

    @ParameterizedTest
    @EnumSource(ArithmeticOp.class)
    void foldingNeverProducesANode(final ArithmeticOp op) {
        assertInstanceOf(Value.class, Construction.combine(op, ofInt(6), ofInt(3)));
        assertInstanceOf(Value.class, Construction.combine(op, ofFloat(6.0), ofComplex(1.0, 1.0)));
    }

    @Test
    void symbolAndValueKeepTheirOrder() {
        assertEquals(node(Operator.ADD, x, ofInt(1)), x.add(ofInt(1)));
        assertEquals(node(Operator.ADD, ofInt(1), x), ofInt(1).add(x));
        assertEquals(node(Operator.MUL, x, ofFloat(2.0)), x.mul(ofFloat(2.0)));
    }

    @Test
    void additionFlattens() {
        var expected = node(Operator.ADD, x, y, z);

        assertEquals(expected, x.add(y).add(z));
        assertEquals(expected, x.add(y.add(z)));
    }

    @Test
    void multiplicationFlattens() {
        var expected = node(Operator.MUL, x, y, z);

        assertEquals(expected, x.mul(y).mul(z));
        assertEquals(expected, x.mul(y.mul(z)));
    }

    @Test
    void twoSumsConcatenateLeftFirst() {
        var w = symbol("w");

        assertEquals(node(Operator.ADD, w, x, y, z), w.add(x).add(y.add(z)));
        assertEquals(node(Operator.ADD, y, z, w, x), y.add(z).add(w.add(x)));
    }

    @Test
    void differentHeadsNest() {
        var product = x.mul(y);

        assertEquals(node(Operator.ADD, product, z), product.add(z));
        assertEquals(node(Operator.MUL, z, x.add(y)), z.mul(x.add(y)));
    }

    @Test
    void subtractionRewrite() {
        assertEquals(node(Operator.ADD, x, ofInt(-1)), x.sub(ofInt(1)));
        assertEquals(node(Operator.ADD, x, node(Operator.MUL, ofInt(-1), y)), x.sub(y));
        assertEquals(node(Operator.ADD, ofInt(1), node(Operator.MUL, ofInt(-1), x)), ofInt(1).sub(x));
    }

    @Test
    void negationRewrite() {
        assertEquals(node(Operator.MUL, ofInt(-1), x), x.negate());
        assertEquals(node(Operator.MUL, ofInt(-1), x, y), x.mul(y).negate());
    }

    @Test
    void divisionRewrite() {
        assertEquals(node(Operator.MUL, ofInt(1), node(Operator.POWER, x, ofInt(-1))), ofInt(1).div(x));
        assertEquals(node(Operator.MUL, x, ofFloat(0.5)), x.div(ofFloat(2.0)));
        assertEquals(node(Operator.MUL, x, ofInt(0)), x.div(ofInt(2)));
        assertEquals(node(Operator.MUL, x, node(Operator.POWER, y, ofInt(-1))), x.div(y));
    }

    @Test
    void powerChainsOnTheLeftOnly() {
        assertEquals(node(Operator.POWER, x, ofInt(2), ofInt(3)), Construction.power(Construction.power(x, ofInt(2)), ofInt(3)));
        assertEquals(node(Operator.POWER, x, node(Operator.POWER, y, ofInt(2))), x.pow(y.pow(ofInt(2))));
        assertEquals(node(Operator.MUL, ofInt(1), node(Operator.POWER, x, ofInt(2), ofInt(-1))), ofInt(1).div(x.pow(ofInt(2))));
    }

    @Test
    void combineDispatches() {
        assertEquals(x.add(y), Construction.combine(ArithmeticOp.ADD, x, y));
        assertEquals(x.sub(y), Construction.combine(ArithmeticOp.SUB, x, y));
        assertEquals(x.mul(y), Construction.combine(ArithmeticOp.MUL, x, y));
        assertEquals(x.div(y), Construction.combine(ArithmeticOp.DIV, x, y));
        assertEquals(x.pow(y), Construction.combine(ArithmeticOp.POWER, x, y));
    }

    @Test
    void nonCommutativeProduct() {
        assertEquals(node(Operator.NON_COMMUTATIVE_MUL, y, x), y.kron(x));
        assertEquals(node(Operator.NON_COMMUTATIVE_MUL, x, y, z), x.kron(y).kron(z));
        assertEquals(ofInt(6), ofInt(2).kron(ofInt(3)));
    }

    @Test
    void operandsAreNotModified() {
        var sum = x.add(y);
        var bigger = sum.add(z);

        assertEquals(node(Operator.ADD, x, y), sum);
        assertEquals(node(Operator.ADD, x, y, z), bigger);
        assertEquals(node(Operator.ADD, x, y, x, y), sum.add(sum));
    }

    @Test
    void integerDivisionByZero() {
        assertThrows(DivisionByZeroException.class, () -> Construction.div(ofInt(1), ofInt(0)));
        assertThrows(DivisionByZeroException.class, () -> Construction.power(ofInt(0), ofInt(-2)));
        assertEquals(ofFloat(Double.POSITIVE_INFINITY), Construction.div(ofFloat(1.0), ofInt(0)));
    }

    @Test
    void symbolicDivisionByIntegerZero() {
        var ex = assertThrows(DivisionByZeroException.class, () -> x.div(ofInt(0)));
        assertEquals("division by zero: x / 0", ex.getMessage());

        var sum = assertThrows(DivisionByZeroException.class, () -> x.add(y).div(ofInt(0)));
        assertEquals("division by zero: x + y / 0", sum.getMessage());

        assertEquals(node(Operator.MUL, x, ofFloat(Double.POSITIVE_INFINITY)), x.div(ofFloat(0.0)));
    }
}
