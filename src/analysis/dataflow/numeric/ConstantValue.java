package analysis.dataflow.numeric;

import analysis.dataflow.util.AbstractValue;

/**
 * Element of the flat constant lattice: bottom, a single integer, or top
 */
public final class ConstantValue implements AbstractValue<ConstantValue> {

    public static final ConstantValue TOP = new ConstantValue(false, 0);
    public static final ConstantValue BOTTOM = new ConstantValue(true, 0);

    private final boolean bottom;
    /**
     * Constant, only meaningful if {@link #isConstant()}
     */
    private final long value;
    private final boolean constant;

    private ConstantValue(boolean bottom, long value) {
        this.bottom = bottom;
        this.value = value;
        this.constant = false;
    }

    private ConstantValue(long value) {
        this.bottom = false;
        this.value = value;
        this.constant = true;
    }

    public static ConstantValue of(long value) {
        return new ConstantValue(value);
    }

    public boolean isConstant() {
        return constant;
    }

    public boolean isTop() {
        return !bottom && !constant;
    }

    public long getValue() {
        assert constant : "Not a constant " + this;
        return value;
    }

    @Override
    public boolean leq(ConstantValue that) {
        return this.bottom || that.isTop() || this.equals(that);
    }

    @Override
    public boolean isBottom() {
        return bottom;
    }

    @Override
    public ConstantValue join(ConstantValue that) {
        if (this.leq(that)) {
            return that;
        }
        if (that.leq(this)) {
            return this;
        }
        return TOP;
    }

    @Override
    public ConstantValue meet(ConstantValue that) {
        if (this.leq(that)) {
            return this;
        }
        if (that.leq(this)) {
            return that;
        }
        return BOTTOM;
    }

    @Override
    public ConstantValue widen(ConstantValue that) {
        return join(that);
    }

    @Override
    public ConstantValue narrow(ConstantValue that) {
        return that;
    }

    @Override
    public String toString() {
        if (bottom) {
            return "BOTTOM";
        }
        return constant ? Long.toString(value) : "TOP";
    }

    @Override
    public int hashCode() {
        if (!constant) {
            return bottom ? 1 : 2;
        }
        return (int) (value ^ (value >>> 32));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConstantValue)) {
            return false;
        }
        ConstantValue other = (ConstantValue) obj;
        return bottom == other.bottom && constant == other.constant && value == other.value;
    }
}
