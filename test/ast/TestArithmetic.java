package ast;

import junit.framework.TestCase;

/**
 * Euclidean division and remainder
 */
public class TestArithmetic extends TestCase {

    public static void testRemainderIsNeverNegative() {
        assertEquals(1, Arithmetic.mod(7, 3));
        assertEquals(2, Arithmetic.mod(-7, 3));
        assertEquals(1, Arithmetic.mod(7, -3));
        assertEquals(2, Arithmetic.mod(-7, -3));
    }

    public static void testQuotientMatchesRemainder() {
        long[] values = { -9, -7, -1, 0, 1, 5, 7, 12 };
        long[] divisors = { -4, -3, -1, 1, 2, 3, 5 };
        for (long a : values) {
            for (long b : divisors) {
                long q = Arithmetic.div(a, b);
                long r = Arithmetic.mod(a, b);
                assertEquals(a, b * q + r);
                assertTrue(r >= 0 && r < Math.abs(b));
            }
        }
    }

    public static void testSpecificQuotients() {
        assertEquals(-3, Arithmetic.div(-7, 3));
        assertEquals(-2, Arithmetic.div(7, -3));
        assertEquals(3, Arithmetic.div(-7, -3));
    }

    public static void testMinValueDivisor() {
        assertEquals(0, Arithmetic.div(0, Long.MIN_VALUE));
        assertEquals(0, Arithmetic.div(1, Long.MIN_VALUE));
        assertEquals(0, Arithmetic.div(Long.MAX_VALUE, Long.MIN_VALUE));
        assertEquals(1, Arithmetic.div(-1, Long.MIN_VALUE));
        assertEquals(1, Arithmetic.div(Long.MIN_VALUE, Long.MIN_VALUE));
        assertEquals(1, Arithmetic.mod(1, Long.MIN_VALUE));
        assertEquals(Long.MAX_VALUE, Arithmetic.mod(-1, Long.MIN_VALUE));
        assertEquals(0, Arithmetic.mod(Long.MIN_VALUE, Long.MIN_VALUE));
    }

    public static void testMinValueByMinusOneWraps() {
        assertEquals(Long.MIN_VALUE, Arithmetic.div(Long.MIN_VALUE, -1));
        assertEquals(0, Arithmetic.mod(Long.MIN_VALUE, -1));
    }

    public static void testDivisionByZero() {
        try {
            Arithmetic.div(1, 0);
        } catch (ArithmeticException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testCompare() {
        assertTrue(Arithmetic.compare(ExprKind.LE, 3, 3));
        assertFalse(Arithmetic.compare(ExprKind.LT, 3, 3));
        assertTrue(Arithmetic.compare(ExprKind.NE, 3, 4));
        assertEquals(ExprKind.GE, ExprKind.LT.negateComparison());
        assertEquals(ExprKind.GT, ExprKind.LT.swapOperands());
    }
}
