package analysis.optimizer;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Set;

import ast.Arithmetic;
import ast.Expr;
import ast.ExprKind;

/**
 * Bottom-up constant folding and algebraic simplification of expressions. Simplification never changes the value of
 * an expression and never removes an operand whose evaluation could fault: x * 0 is only folded to 0 when x divides by
 * nothing and reads only variables known to be bound, and a division by the constant 0 is left in place.
 */
public class ExprSimplifier {

    /**
     * Variables known to be bound, null if every variable is
     */
    private final Set<String> definitelyBound;

    private ExprSimplifier(Set<String> definitelyBound) {
        this.definitelyBound = definitelyBound;
    }

    /**
     * Simplify an expression about whose variables nothing is known; a read of any variable may fault
     *
     * @param e
     *            expression to simplify
     * @return equivalent expression, e itself if nothing could be simplified
     */
    public static Expr simplify(Expr e) {
        return simplify(e, Collections.<String> emptySet());
    }

    /**
     * Simplify an expression evaluated where some variables are known to be bound
     *
     * @param e
     *            expression to simplify
     * @param definitelyBound
     *            variables that have a value wherever e is evaluated
     * @return equivalent expression, e itself if nothing could be simplified
     */
    public static Expr simplify(Expr e, Set<String> definitelyBound) {
        return new ExprSimplifier(definitelyBound).run(e);
    }

    /**
     * Simplify an expression over input symbols, which always have a value
     *
     * @param e
     *            expression to simplify
     * @return equivalent expression, e itself if nothing could be simplified
     */
    public static Expr simplifyOverInputs(Expr e) {
        return new ExprSimplifier(null).run(e);
    }

    private Expr run(Expr e) {
        Deque<Expr> results = new ArrayDeque<>();
        for (Expr next : e.postorder()) {
            switch (next.getKind().getArity()) {
            case 0:
                results.push(next);
                break;
            case 1:
                Expr operand = results.pop();
                results.push(simplifyUnary(next.getKind(), operand, operand == next.getLeft() ? next : null));
                break;
            default:
                Expr right = results.pop();
                Expr left = results.pop();
                Expr unchanged = left == next.getLeft() && right == next.getRight() ? next : null;
                results.push(simplifyBinary(next.getKind(), left, right, unchanged));
                break;
            }
        }
        return results.pop();
    }

    private boolean mayFault(Expr e) {
        return definitelyBound == null ? e.containsDivision() : e.canFault(definitelyBound);
    }

    /**
     * @param original
     *            expression to return if no rule applies, null to build a new one
     */
    private static Expr simplifyUnary(ExprKind kind, Expr operand, Expr original) {
        if (kind == ExprKind.NEG) {
            if (operand.getKind() == ExprKind.INT_CONST) {
                return Expr.constant(-operand.getValue());
            }
            if (operand.getKind() == ExprKind.NEG) {
                return operand.getLeft();
            }
        } else {
            if (operand.getKind() == ExprKind.BOOL_CONST) {
                return Expr.bool(!operand.getBooleanValue());
            }
            if (operand.getKind() == ExprKind.NOT) {
                return operand.getLeft();
            }
            if (operand.getKind().isComparison()) {
                return Expr.binary(operand.getKind().negateComparison(), operand.getLeft(), operand.getRight());
            }
        }
        return original != null ? original : Expr.unary(kind, operand);
    }

    private Expr simplifyBinary(ExprKind kind, Expr left, Expr right, Expr original) {
        Expr result = null;
        if (kind.isArithmetic()) {
            result = simplifyArithmetic(kind, left, right);
        } else if (kind.isComparison()) {
            if (isInt(left) && isInt(right)) {
                result = Expr.bool(Arithmetic.compare(kind, left.getValue(), right.getValue()));
            } else if (left.equals(right) && !mayFault(left)) {
                result = Expr.bool(Arithmetic.compare(kind, 0, 0));
            }
        } else {
            result = simplifyLogical(kind, left, right);
        }
        if (result != null) {
            return result;
        }
        return original != null ? original : Expr.binary(kind, left, right);
    }

    private Expr simplifyArithmetic(ExprKind kind, Expr left, Expr right) {
        if (isInt(left) && isInt(right)) {
            if ((kind == ExprKind.DIV || kind == ExprKind.MOD) && right.getValue() == 0) {
                // faults at run time
                return null;
            }
            return Expr.constant(Arithmetic.apply(kind, left.getValue(), right.getValue()));
        }
        switch (kind) {
        case ADD:
            if (isInt(left, 0)) {
                return right;
            }
            if (isInt(right, 0)) {
                return left;
            }
            return null;
        case SUB:
            if (isInt(right, 0)) {
                return left;
            }
            if (isInt(left, 0)) {
                return simplifyUnary(ExprKind.NEG, right, null);
            }
            if (left.equals(right) && !mayFault(left)) {
                return Expr.constant(0);
            }
            return null;
        case MUL:
            if (isInt(left, 1)) {
                return right;
            }
            if (isInt(right, 1)) {
                return left;
            }
            if ((isInt(left, 0) && !mayFault(right)) || (isInt(right, 0) && !mayFault(left))) {
                return Expr.constant(0);
            }
            return null;
        case DIV:
            return isInt(right, 1) ? left : null;
        case MOD:
            if ((isInt(right, 1) || isInt(right, -1)) && !mayFault(left)) {
                return Expr.constant(0);
            }
            return null;
        default:
            return null;
        }
    }

    /**
     * Both operands of a logical operator are evaluated, so an operand is only dropped if it cannot fault
     */
    private Expr simplifyLogical(ExprKind kind, Expr left, Expr right) {
        boolean identity = kind == ExprKind.AND;
        if (isBool(left, identity)) {
            return right;
        }
        if (isBool(right, identity)) {
            return left;
        }
        if ((isBool(left, !identity) && !mayFault(right)) || (isBool(right, !identity) && !mayFault(left))) {
            return Expr.bool(!identity);
        }
        if (left.equals(right)) {
            return left;
        }
        return null;
    }

    private static boolean isInt(Expr e) {
        return e.getKind() == ExprKind.INT_CONST;
    }

    private static boolean isInt(Expr e, long value) {
        return isInt(e) && e.getValue() == value;
    }

    private static boolean isBool(Expr e, boolean value) {
        return e.getKind() == ExprKind.BOOL_CONST && e.getBooleanValue() == value;
    }
}
