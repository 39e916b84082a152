package analysis.dataflow.numeric;

import java.util.Arrays;
import java.util.TreeSet;

import junit.framework.TestCase;
import ast.ExprKind;

/**
 * Operations of the individual numeric domains
 */
public class TestNumericDomains extends TestCase {

    private static final double INF = Double.POSITIVE_INFINITY;

    private static final IntervalDomain INTERVALS = new IntervalDomain();

    public static void testIntervalArithmetic() {
        assertEquals(Interval.of(4, 6), INTERVALS.arithmetic(ExprKind.ADD, Interval.of(1, 2), Interval.of(3, 4)));
        assertEquals(Interval.of(-3, -1), INTERVALS.arithmetic(ExprKind.SUB, Interval.of(1, 2), Interval.of(3, 4)));
        assertEquals(Interval.of(-10, 15), INTERVALS.arithmetic(ExprKind.MUL, Interval.of(-2, 3), Interval.of(4, 5)));
        assertEquals(Interval.of(-2, -1), INTERVALS.negate(Interval.of(1, 2)));
        assertTrue(INTERVALS.arithmetic(ExprKind.ADD, Interval.BOTTOM_ELEMENT, Interval.of(1, 1)).isBottom());
    }

    public static void testIntervalDivisionIsEuclidean() {
        assertEquals(Interval.constant(3), INTERVALS.arithmetic(ExprKind.DIV, Interval.constant(7), Interval.constant(2)));
        assertEquals(Interval.constant(-4),
                     INTERVALS.arithmetic(ExprKind.DIV, Interval.constant(-7), Interval.constant(2)));
        assertEquals(Interval.constant(-3),
                     INTERVALS.arithmetic(ExprKind.DIV, Interval.constant(7), Interval.constant(-2)));
        assertEquals(Interval.constant(4),
                     INTERVALS.arithmetic(ExprKind.DIV, Interval.constant(-7), Interval.constant(-2)));
        assertTrue(INTERVALS.arithmetic(ExprKind.DIV, Interval.constant(7), Interval.constant(0)).isBottom());
        assertEquals(Interval.of(-100, 100),
                     INTERVALS.arithmetic(ExprKind.DIV, Interval.constant(100), Interval.TOP_ELEMENT));
    }

    public static void testIntervalRemainder() {
        assertEquals(Interval.of(0, 2), INTERVALS.arithmetic(ExprKind.MOD, Interval.TOP_ELEMENT, Interval.constant(3)));
        assertEquals(Interval.of(0, 2), INTERVALS.arithmetic(ExprKind.MOD, Interval.of(0, 2), Interval.constant(10)));
        assertTrue(INTERVALS.arithmetic(ExprKind.MOD, Interval.of(0, 2), Interval.constant(0)).isBottom());
    }

    public static void testIntervalWidenAndNarrow() {
        assertEquals(Interval.of(0, INF), Interval.of(0, 1).widen(Interval.of(0, 2)));
        assertEquals(Interval.of(-INF, 1), Interval.of(0, 1).widen(Interval.of(-1, 1)));
        assertEquals(Interval.of(0, 1), Interval.of(0, 1).widen(Interval.of(0, 1)));
        assertEquals(Interval.of(0, 10), Interval.of(0, INF).narrow(Interval.of(0, 10)));
        // finite bounds are kept
        assertEquals(Interval.of(0, 5), Interval.of(0, 5).narrow(Interval.of(1, 3)));
    }

    public static void testIntervalOrder() {
        assertTrue(Interval.BOTTOM_ELEMENT.leq(Interval.of(1, 1)));
        assertTrue(Interval.of(1, 2).leq(Interval.TOP_ELEMENT));
        assertFalse(Interval.of(1, 3).leq(Interval.of(1, 2)));
        assertTrue(Interval.of(3, 1).isBottom());
        assertEquals(Interval.of(-1, 1), Interval.constant(-1).join(Interval.constant(1)));
        assertEquals("[0,+inf]", Interval.of(0, INF).toString());
        assertEquals(Interval.constant(0), Interval.of(-0.0, 0.0));
    }

    public static void testIntervalAssume() {
        assertEquals(Interval.of(0, 4), INTERVALS.assume(ExprKind.LT, Interval.of(0, 10), Interval.constant(5)));
        assertEquals(Interval.of(6, 10), INTERVALS.assume(ExprKind.GT, Interval.of(0, 10), Interval.constant(5)));
        assertEquals(Interval.of(1, 10), INTERVALS.assume(ExprKind.NE, Interval.of(0, 10), Interval.constant(0)));
        assertTrue(INTERVALS.assume(ExprKind.EQ, Interval.of(0, 10), Interval.constant(11)).isBottom());
        assertEquals(Long.valueOf(5), INTERVALS.getConstant(Interval.constant(5)));
        assertNull(INTERVALS.getConstant(Interval.of(5, 6)));
    }

    public static void testSigns() {
        SignDomain d = new SignDomain();
        SignValue pos = SignValue.of(3);
        SignValue neg = SignValue.of(-3);
        SignValue zero = SignValue.of(0);
        assertEquals(SignValue.TOP, d.arithmetic(ExprKind.SUB, pos, pos));
        assertEquals(pos, d.arithmetic(ExprKind.MUL, neg, neg));
        assertEquals(zero, d.arithmetic(ExprKind.MUL, zero, SignValue.TOP));
        assertTrue(d.arithmetic(ExprKind.DIV, pos, zero).isBottom());
        assertEquals(neg, d.arithmetic(ExprKind.DIV, neg, pos));
        assertEquals(neg, d.negate(pos));
        assertEquals(pos, d.assume(ExprKind.GT, SignValue.TOP, zero));
        SignValue nonZero = pos.join(neg);
        assertTrue(nonZero.mayBeNegative());
        assertFalse(nonZero.mayBeZero());
        assertTrue(d.contains(nonZero, -17));
        assertFalse(d.contains(nonZero, 0));
        assertTrue(d.isFiniteHeight());
    }

    public static void testConstants() {
        ConstantPropagationDomain d = new ConstantPropagationDomain();
        assertEquals(ConstantValue.of(5), d.arithmetic(ExprKind.ADD, ConstantValue.of(2), ConstantValue.of(3)));
        assertEquals(ConstantValue.of(-1), d.arithmetic(ExprKind.DIV, ConstantValue.of(-1), ConstantValue.of(3)));
        assertEquals(ConstantValue.TOP, d.arithmetic(ExprKind.ADD, ConstantValue.TOP, ConstantValue.of(3)));
        assertEquals(ConstantValue.of(0), d.arithmetic(ExprKind.MUL, ConstantValue.TOP, ConstantValue.of(0)));
        assertTrue(d.arithmetic(ExprKind.MOD, ConstantValue.of(4), ConstantValue.of(0)).isBottom());
        assertEquals(ConstantValue.TOP, ConstantValue.of(1).join(ConstantValue.of(2)));
        assertEquals(ConstantValue.of(1), ConstantValue.of(1).join(ConstantValue.BOTTOM));
        assertTrue(d.assume(ExprKind.LT, ConstantValue.of(4), ConstantValue.of(3)).isBottom());
    }

    public static void testConstantSets() {
        ConstantSetDomain d = new ConstantSetDomain(3);
        ConstantSetValue oneTwo = ConstantSetValue.of(Arrays.asList(1L, 2L), 3);
        ConstantSetValue sums = d.arithmetic(ExprKind.ADD, oneTwo, d.constant(10));
        assertEquals(new TreeSet<>(Arrays.asList(11L, 12L)), sums.getElements());
        assertTrue(d.arithmetic(ExprKind.MUL, oneTwo, ConstantSetValue.of(Arrays.asList(3L, 5L), 3)).isTop());
        assertEquals(new TreeSet<>(Arrays.asList(1L)), d.assume(ExprKind.LT, oneTwo, d.constant(2)).getElements());
        assertTrue(d.arithmetic(ExprKind.DIV, oneTwo, d.constant(0)).isBottom());
        assertTrue(oneTwo.join(ConstantSetValue.of(Arrays.asList(3L, 4L), 3)).isTop());
        assertEquals(Long.valueOf(10), d.getConstant(d.constant(10)));
        assertNull(d.getConstant(oneTwo));
    }
}
