package ast;

/**
 * Integer semantics shared by the concrete interpreter, the constant folder and the abstract domains. Values are 64-bit
 * two's complement and wrap on overflow. Division and remainder are Euclidean: the remainder is never negative.
 */
public final class Arithmetic {

    private Arithmetic() {
        // static helpers only
    }

    /**
     * Euclidean quotient, <code>a == b * div(a, b) + mod(a, b)</code> with <code>0 &lt;= mod(a, b) &lt; |b|</code>
     *
     * @param a dividend
     * @param b non-zero divisor
     * @return quotient
     * @throws ArithmeticException if b is zero
     */
    public static long div(long a, long b) {
        if (b == 0) {
            throw new ArithmeticException("division by zero");
        }
        if (b > 0) {
            return Math.floorDiv(a, b);
        }
        if (b == Long.MIN_VALUE) {
            // -b overflows, and |a| < |b| unless a is MIN_VALUE too
            return a >= 0 ? 0 : 1;
        }
        return -Math.floorDiv(a, -b);
    }

    /**
     * Euclidean remainder, always in <code>[0, |b|)</code>
     *
     * @param a dividend
     * @param b non-zero divisor
     * @return remainder
     * @throws ArithmeticException if b is zero
     */
    public static long mod(long a, long b) {
        return a - b * div(a, b);
    }

    /**
     * Apply a binary arithmetic operator to two concrete values
     *
     * @param kind one of ADD, SUB, MUL, DIV, MOD
     * @param a left operand
     * @param b right operand
     * @return result
     * @throws ArithmeticException if a division by zero occurs
     */
    public static long apply(ExprKind kind, long a, long b) {
        switch (kind) {
        case ADD:
            return a + b;
        case SUB:
            return a - b;
        case MUL:
            return a * b;
        case DIV:
            return div(a, b);
        case MOD:
            return mod(a, b);
        default:
            throw new IllegalArgumentException(kind + " is not an arithmetic operator");
        }
    }

    /**
     * Evaluate a comparison on two concrete values
     *
     * @param kind comparison operator
     * @param a left operand
     * @param b right operand
     * @return truth value of the comparison
     */
    public static boolean compare(ExprKind kind, long a, long b) {
        switch (kind) {
        case LT:
            return a < b;
        case LE:
            return a <= b;
        case GT:
            return a > b;
        case GE:
            return a >= b;
        case EQ:
            return a == b;
        case NE:
            return a != b;
        default:
            throw new IllegalArgumentException(kind + " is not a comparison");
        }
    }
}
