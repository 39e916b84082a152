package analysis.dataflow.numeric;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import ast.Arithmetic;
import ast.ExprKind;

/**
 * Bounded sets of constants. Precise for branchy code that assigns a few different literals, such as a variable set to
 * 1 on one side of a conditional and -1 on the other.
 */
public class ConstantSetDomain implements NumericDomain<ConstantSetValue> {

    /**
     * Default bound on the number of constants tracked per variable
     */
    public static final int DEFAULT_LIMIT = 8;

    private final int limit;
    private final ConstantSetValue top;
    private final ConstantSetValue bottom;

    public ConstantSetDomain() {
        this(DEFAULT_LIMIT);
    }

    /**
     * @param limit
     *            maximum set size, larger sets are replaced by top
     */
    public ConstantSetDomain(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Set limit must be positive: " + limit);
        }
        this.limit = limit;
        this.top = ConstantSetValue.top(limit);
        this.bottom = ConstantSetValue.of(Collections.<Long> emptySet(), limit);
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String getName() {
        return "constset";
    }

    @Override
    public ConstantSetValue top() {
        return top;
    }

    @Override
    public ConstantSetValue bottom() {
        return bottom;
    }

    @Override
    public ConstantSetValue constant(long c) {
        return ConstantSetValue.of(Collections.singleton(c), limit);
    }

    @Override
    public ConstantSetValue negate(ConstantSetValue v) {
        if (v.isTop()) {
            return v;
        }
        Set<Long> result = new TreeSet<>();
        for (Long l : v.getElements()) {
            result.add(-l);
        }
        return ConstantSetValue.of(result, limit);
    }

    @Override
    public ConstantSetValue arithmetic(ExprKind op, ConstantSetValue left, ConstantSetValue right) {
        if (left.isBottom() || right.isBottom()) {
            return bottom;
        }
        boolean faultsOnZero = op == ExprKind.DIV || op == ExprKind.MOD;
        if (!right.isTop() && faultsOnZero && right.getElements().equals(Collections.singleton(0L))) {
            return bottom;
        }
        if (left.isTop() || right.isTop()) {
            if (op == ExprKind.MUL && (isZero(left) || isZero(right))) {
                return constant(0);
            }
            return top;
        }
        Set<Long> result = new TreeSet<>();
        for (Long a : left.getElements()) {
            for (Long b : right.getElements()) {
                if (faultsOnZero && b == 0) {
                    continue;
                }
                result.add(Arithmetic.apply(op, a, b));
                if (result.size() > limit) {
                    return top;
                }
            }
        }
        return ConstantSetValue.of(result, limit);
    }

    private static boolean isZero(ConstantSetValue v) {
        return !v.isTop() && v.getElements().equals(Collections.singleton(0L));
    }

    @Override
    public ConstantSetValue assume(ExprKind comparison, ConstantSetValue left, ConstantSetValue right) {
        if (left.isBottom() || right.isBottom()) {
            return bottom;
        }
        if (left.isTop()) {
            // only equality with a known set can be expressed
            return comparison == ExprKind.EQ ? right : left;
        }
        if (right.isTop()) {
            return left;
        }
        Set<Long> result = new TreeSet<>();
        for (Long a : left.getElements()) {
            for (Long b : right.getElements()) {
                if (Arithmetic.compare(comparison, a, b)) {
                    result.add(a);
                    break;
                }
            }
        }
        return ConstantSetValue.of(result, limit);
    }

    @Override
    public boolean isFiniteHeight() {
        // an ascending chain grows one set at a time up to the limit, then reaches top
        return true;
    }

    @Override
    public Long getConstant(ConstantSetValue v) {
        if (v.isTop() || v.getElements().size() != 1) {
            return null;
        }
        return v.getElements().first();
    }

    @Override
    public boolean contains(ConstantSetValue v, long c) {
        return v.isTop() || v.getElements().contains(c);
    }

    @Override
    public String toString() {
        return getName();
    }
}
