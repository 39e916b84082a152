package analysis.dataflow.numeric;

import ast.Arithmetic;
import ast.ExprKind;

/**
 * Constant propagation: each variable is either a known integer or unknown
 */
public class ConstantPropagationDomain implements NumericDomain<ConstantValue> {

    @Override
    public String getName() {
        return "constant";
    }

    @Override
    public ConstantValue top() {
        return ConstantValue.TOP;
    }

    @Override
    public ConstantValue bottom() {
        return ConstantValue.BOTTOM;
    }

    @Override
    public ConstantValue constant(long c) {
        return ConstantValue.of(c);
    }

    @Override
    public ConstantValue negate(ConstantValue v) {
        if (v.isConstant()) {
            return ConstantValue.of(-v.getValue());
        }
        return v;
    }

    @Override
    public ConstantValue arithmetic(ExprKind op, ConstantValue left, ConstantValue right) {
        if (left.isBottom() || right.isBottom()) {
            return ConstantValue.BOTTOM;
        }
        if ((op == ExprKind.DIV || op == ExprKind.MOD) && right.isConstant() && right.getValue() == 0) {
            return ConstantValue.BOTTOM;
        }
        if (op == ExprKind.MUL
                && ((left.isConstant() && left.getValue() == 0) || (right.isConstant() && right.getValue() == 0))) {
            return ConstantValue.of(0);
        }
        if (left.isConstant() && right.isConstant()) {
            return ConstantValue.of(Arithmetic.apply(op, left.getValue(), right.getValue()));
        }
        return ConstantValue.TOP;
    }

    @Override
    public ConstantValue assume(ExprKind comparison, ConstantValue left, ConstantValue right) {
        if (left.isBottom() || right.isBottom()) {
            return ConstantValue.BOTTOM;
        }
        if (comparison == ExprKind.EQ) {
            return left.meet(right);
        }
        if (left.isConstant() && right.isConstant()
                && !Arithmetic.compare(comparison, left.getValue(), right.getValue())) {
            return ConstantValue.BOTTOM;
        }
        return left;
    }

    @Override
    public boolean isFiniteHeight() {
        return true;
    }

    @Override
    public Long getConstant(ConstantValue v) {
        return v.isConstant() ? v.getValue() : null;
    }

    @Override
    public boolean contains(ConstantValue v, long c) {
        return v.isTop() || (v.isConstant() && v.getValue() == c);
    }

    @Override
    public String toString() {
        return getName();
    }
}
