package analysis.dataflow.numeric;

import analysis.dataflow.util.AbstractValue;

/**
 * Set of signs {-, 0, +}, stored as a bit mask. The empty set is bottom and the full set is top.
 */
public final class SignValue implements AbstractValue<SignValue> {

    static final int NEG = 1;
    static final int ZERO = 2;
    static final int POS = 4;
    private static final int ALL = NEG | ZERO | POS;

    private static final SignValue[] VALUES = new SignValue[ALL + 1];
    static {
        for (int i = 0; i <= ALL; i++) {
            VALUES[i] = new SignValue(i);
        }
    }

    public static final SignValue BOTTOM = VALUES[0];
    public static final SignValue TOP = VALUES[ALL];

    private final int mask;

    private SignValue(int mask) {
        this.mask = mask;
    }

    static SignValue fromMask(int mask) {
        return VALUES[mask & ALL];
    }

    public static SignValue of(long c) {
        return VALUES[signOf(c)];
    }

    static int signOf(long c) {
        if (c < 0) {
            return NEG;
        }
        return c == 0 ? ZERO : POS;
    }

    int getMask() {
        return mask;
    }

    public boolean mayBeNegative() {
        return (mask & NEG) != 0;
    }

    public boolean mayBeZero() {
        return (mask & ZERO) != 0;
    }

    public boolean mayBePositive() {
        return (mask & POS) != 0;
    }

    @Override
    public boolean leq(SignValue that) {
        return (this.mask & ~that.mask) == 0;
    }

    @Override
    public boolean isBottom() {
        return mask == 0;
    }

    @Override
    public SignValue join(SignValue that) {
        return VALUES[this.mask | that.mask];
    }

    @Override
    public SignValue meet(SignValue that) {
        return VALUES[this.mask & that.mask];
    }

    @Override
    public SignValue widen(SignValue that) {
        return join(that);
    }

    @Override
    public SignValue narrow(SignValue that) {
        return that;
    }

    @Override
    public String toString() {
        if (mask == 0) {
            return "BOTTOM";
        }
        if (mask == ALL) {
            return "TOP";
        }
        StringBuilder sb = new StringBuilder("{");
        if (mayBeNegative()) {
            sb.append("-");
        }
        if (mayBeZero()) {
            sb.append(sb.length() > 1 ? "," : "").append("0");
        }
        if (mayBePositive()) {
            sb.append(sb.length() > 1 ? "," : "").append("+");
        }
        return sb.append("}").toString();
    }

    @Override
    public int hashCode() {
        return mask;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SignValue && ((SignValue) obj).mask == mask;
    }
}
