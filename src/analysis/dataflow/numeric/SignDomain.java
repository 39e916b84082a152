package analysis.dataflow.numeric;

import ast.ExprKind;

/**
 * Sign analysis. Abstract operations are computed sign by sign: each pair of single signs maps to the set of possible
 * result signs, and the results are joined.
 */
public class SignDomain implements NumericDomain<SignValue> {

    private static final int[] SINGLE_SIGNS = { SignValue.NEG, SignValue.ZERO, SignValue.POS };
    private static final int ALL = SignValue.NEG | SignValue.ZERO | SignValue.POS;

    @Override
    public String getName() {
        return "sign";
    }

    @Override
    public SignValue top() {
        return SignValue.TOP;
    }

    @Override
    public SignValue bottom() {
        return SignValue.BOTTOM;
    }

    @Override
    public SignValue constant(long c) {
        return SignValue.of(c);
    }

    @Override
    public SignValue negate(SignValue v) {
        int mask = v.getMask() & SignValue.ZERO;
        if (v.mayBeNegative()) {
            mask |= SignValue.POS;
        }
        if (v.mayBePositive()) {
            mask |= SignValue.NEG;
        }
        return SignValue.fromMask(mask);
    }

    @Override
    public SignValue arithmetic(ExprKind op, SignValue left, SignValue right) {
        int result = 0;
        for (int s : SINGLE_SIGNS) {
            if ((left.getMask() & s) == 0) {
                continue;
            }
            for (int t : SINGLE_SIGNS) {
                if ((right.getMask() & t) == 0) {
                    continue;
                }
                result |= apply(op, s, t);
            }
        }
        return SignValue.fromMask(result);
    }

    /**
     * Possible signs of s op t for single signs s and t
     */
    private static int apply(ExprKind op, int s, int t) {
        switch (op) {
        case ADD:
            return add(s, t);
        case SUB:
            return add(s, negateSign(t));
        case MUL:
            if (s == SignValue.ZERO || t == SignValue.ZERO) {
                return SignValue.ZERO;
            }
            return s == t ? SignValue.POS : SignValue.NEG;
        case DIV:
            if (t == SignValue.ZERO) {
                // faults
                return 0;
            }
            if (s == SignValue.ZERO) {
                return SignValue.ZERO;
            }
            if (s == SignValue.POS) {
                // rounds toward zero for a positive dividend
                return t == SignValue.POS ? SignValue.ZERO | SignValue.POS : SignValue.ZERO | SignValue.NEG;
            }
            // a negative dividend is rounded away from zero
            return t == SignValue.POS ? SignValue.NEG : SignValue.POS;
        case MOD:
            if (t == SignValue.ZERO) {
                return 0;
            }
            return s == SignValue.ZERO ? SignValue.ZERO : SignValue.ZERO | SignValue.POS;
        default:
            throw new IllegalArgumentException(op + " is not an arithmetic operator");
        }
    }

    private static int add(int s, int t) {
        if (s == SignValue.ZERO) {
            return t;
        }
        if (t == SignValue.ZERO || s == t) {
            return s;
        }
        return ALL;
    }

    private static int negateSign(int s) {
        if (s == SignValue.NEG) {
            return SignValue.POS;
        }
        return s == SignValue.POS ? SignValue.NEG : s;
    }

    @Override
    public SignValue assume(ExprKind comparison, SignValue left, SignValue right) {
        int result = 0;
        for (int s : SINGLE_SIGNS) {
            if ((left.getMask() & s) == 0) {
                continue;
            }
            for (int t : SINGLE_SIGNS) {
                if ((right.getMask() & t) != 0 && satisfiable(comparison, s, t)) {
                    result |= s;
                    break;
                }
            }
        }
        return SignValue.fromMask(result);
    }

    /**
     * Whether some x of sign s and y of sign t satisfy x comparison y. Signs are ordered NEG &lt; ZERO &lt; POS and
     * only ZERO is a single integer.
     */
    private static boolean satisfiable(ExprKind comparison, int s, int t) {
        switch (comparison) {
        case LT:
            return s < t || (s == t && s != SignValue.ZERO);
        case LE:
            return s <= t;
        case GT:
            return s > t || (s == t && s != SignValue.ZERO);
        case GE:
            return s >= t;
        case EQ:
            return s == t;
        case NE:
            return s != t || s != SignValue.ZERO;
        default:
            throw new IllegalArgumentException(comparison + " is not a comparison");
        }
    }

    @Override
    public boolean isFiniteHeight() {
        return true;
    }

    @Override
    public Long getConstant(SignValue v) {
        return v.getMask() == SignValue.ZERO ? Long.valueOf(0) : null;
    }

    @Override
    public boolean contains(SignValue v, long c) {
        return (v.getMask() & SignValue.signOf(c)) != 0;
    }

    @Override
    public String toString() {
        return getName();
    }
}
