package analysis.dataflow.numeric;

import java.util.Arrays;

import ast.ExprKind;

/**
 * Interval domain, infinite height so the fixpoint engine widens at loop heads
 */
public class IntervalDomain implements NumericDomain<Interval> {

    @Override
    public String getName() {
        return "interval";
    }

    @Override
    public Interval top() {
        return Interval.TOP_ELEMENT;
    }

    @Override
    public Interval bottom() {
        return Interval.BOTTOM_ELEMENT;
    }

    @Override
    public Interval constant(long c) {
        return Interval.constant(c);
    }

    @Override
    public Interval negate(Interval v) {
        return v.neg();
    }

    @Override
    public Interval arithmetic(ExprKind op, Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Interval.BOTTOM_ELEMENT;
        }
        switch (op) {
        case ADD:
            return fromCorners(left.min + right.min, left.max + right.max);
        case SUB:
            return fromCorners(left.min - right.max, left.max - right.min);
        case MUL:
            return fromCorners(left.min * right.min,
                               left.min * right.max,
                               left.max * right.min,
                               left.max * right.max);
        case DIV:
            return divide(left, right);
        case MOD:
            return remainder(left, right);
        default:
            throw new IllegalArgumentException(op + " is not an arithmetic operator");
        }
    }

    /**
     * Smallest interval containing all the given corner values. Any NaN (e.g. infinity times zero) gives top.
     */
    private static Interval fromCorners(double... corners) {
        for (double d : corners) {
            if (Double.isNaN(d)) {
                return Interval.TOP_ELEMENT;
            }
        }
        double[] sorted = corners.clone();
        Arrays.sort(sorted);
        return Interval.of(sorted[0], sorted[sorted.length - 1]);
    }

    /**
     * The divisor is split into its negative and positive parts, zero is excluded since dividing by it faults
     */
    private static Interval divide(Interval left, Interval right) {
        Interval result = Interval.BOTTOM_ELEMENT;
        Interval negative = right.lte(-1);
        if (!negative.isBottom()) {
            result = result.join(divideBySameSign(left, negative, false));
        }
        Interval positive = right.gte(1);
        if (!positive.isBottom()) {
            result = result.join(divideBySameSign(left, positive, true));
        }
        return result;
    }

    /**
     * Divide by an interval that does not contain zero. Euclidean division rounds the real quotient down for a positive
     * divisor and up for a negative one.
     */
    private static Interval divideBySameSign(Interval left, Interval divisor, boolean positive) {
        double[] corners = new double[] { quotient(left.min, divisor.min),
                                          quotient(left.min, divisor.max),
                                          quotient(left.max, divisor.min),
                                          quotient(left.max, divisor.max) };
        for (double d : corners) {
            if (Double.isNaN(d)) {
                return Interval.TOP_ELEMENT;
            }
        }
        Arrays.sort(corners);
        if (positive) {
            return Interval.of(Math.floor(corners[0]), Math.floor(corners[3]));
        }
        return Interval.of(Math.ceil(corners[0]), Math.ceil(corners[3]));
    }

    private static double quotient(double a, double b) {
        if (Double.isInfinite(b)) {
            // a finite dividend over an unbounded divisor approaches zero
            return Double.isInfinite(a) ? Double.NaN : 0;
        }
        return a / b;
    }

    /**
     * The Euclidean remainder lies in [0, |b| - 1]
     */
    private static Interval remainder(Interval left, Interval right) {
        if (right.min == 0 && right.max == 0) {
            return Interval.BOTTOM_ELEMENT;
        }
        double maxAbs = Math.max(Math.abs(right.min), Math.abs(right.max));
        double hi = maxAbs - 1;
        if (left.min >= 0) {
            // a non-negative dividend is never increased
            hi = Math.min(hi, left.max);
        }
        return Interval.of(0, hi);
    }

    @Override
    public Interval assume(ExprKind comparison, Interval left, Interval right) {
        if (left.isBottom() || right.isBottom()) {
            return Interval.BOTTOM_ELEMENT;
        }
        switch (comparison) {
        case LT:
            return left.lte(right.max - 1);
        case LE:
            return left.lte(right.max);
        case GT:
            return left.gte(right.min + 1);
        case GE:
            return left.gte(right.min);
        case EQ:
            return left.meet(right);
        case NE:
            if (right.min.equals(right.max)) {
                double c = right.min;
                if (left.min == c && left.max == c) {
                    return Interval.BOTTOM_ELEMENT;
                }
                if (left.min == c) {
                    return Interval.of(c + 1, left.max);
                }
                if (left.max == c) {
                    return Interval.of(left.min, c - 1);
                }
            }
            return left;
        default:
            throw new IllegalArgumentException(comparison + " is not a comparison");
        }
    }

    @Override
    public boolean isFiniteHeight() {
        return false;
    }

    @Override
    public Long getConstant(Interval v) {
        if (v.isBottom() || !v.min.equals(v.max)) {
            return null;
        }
        return (long) v.getMin();
    }

    @Override
    public boolean contains(Interval v, long c) {
        return v.contains(c);
    }

    @Override
    public String toString() {
        return getName();
    }
}
