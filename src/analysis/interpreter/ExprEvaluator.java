package analysis.interpreter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

import ast.Arithmetic;
import ast.Expr;
import ast.ExprKind;

/**
 * Concrete evaluation of expressions. Both operands of <code>and</code> and <code>or</code> are always evaluated, so a
 * fault in either operand is a fault of the whole expression (the symbolic executor makes the same assumption).
 */
public class ExprEvaluator {

    private ExprEvaluator() {
        // static methods only
    }

    /**
     * Evaluate an integer expression
     *
     * @param e
     *            expression to evaluate
     * @param env
     *            variable bindings
     * @return value of e
     * @throws EvaluationException
     *             if a variable is unbound, a division by zero occurs or e is not an integer expression
     */
    public static long evalInt(Expr e, Map<String, Long> env) throws EvaluationException {
        if (e.isBoolean()) {
            throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, "boolean " + e + " used as an integer");
        }
        return eval(e, env);
    }

    /**
     * Evaluate a boolean expression
     *
     * @param e
     *            expression to evaluate
     * @param env
     *            variable bindings
     * @return truth value of e
     * @throws EvaluationException
     *             if a variable is unbound, a division by zero occurs or e is not a boolean expression
     */
    public static boolean evalBool(Expr e, Map<String, Long> env) throws EvaluationException {
        if (!e.isBoolean()) {
            throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, "integer " + e + " used as a condition");
        }
        return eval(e, env) != 0;
    }

    /**
     * Evaluate operands before operators with an explicit value stack. Booleans are 0 or 1.
     */
    private static long eval(Expr e, Map<String, Long> env) throws EvaluationException {
        Deque<Long> values = new ArrayDeque<>();
        for (Expr next : e.postorder()) {
            ExprKind kind = next.getKind();
            switch (kind) {
            case INT_CONST:
            case BOOL_CONST:
                values.push(next.getValue());
                break;
            case VAR:
                Long v = env.get(next.getName());
                if (v == null) {
                    throw new EvaluationException(FaultKind.UNDEFINED_VARIABLE, "undefined variable " + next.getName());
                }
                values.push(v);
                break;
            case NEG:
                checkOperand(next, next.getLeft(), false);
                values.push(-values.pop());
                break;
            case NOT:
                checkOperand(next, next.getLeft(), true);
                values.push(values.pop() != 0 ? 0L : 1L);
                break;
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case LT:
            case LE:
            case GT:
            case GE:
            case EQ:
            case NE:
            case AND:
            case OR: {
                boolean logical = kind.isLogical();
                checkOperand(next, next.getLeft(), logical);
                checkOperand(next, next.getRight(), logical);
                long r = values.pop();
                long l = values.pop();
                if (logical) {
                    boolean result = kind == ExprKind.AND ? l != 0 && r != 0 : l != 0 || r != 0;
                    values.push(result ? 1L : 0L);
                } else if (kind.isComparison()) {
                    values.push(Arithmetic.compare(kind, l, r) ? 1L : 0L);
                } else {
                    if (r == 0 && (kind == ExprKind.DIV || kind == ExprKind.MOD)) {
                        throw new EvaluationException(FaultKind.DIVISION_BY_ZERO, "division by zero in " + next);
                    }
                    values.push(Arithmetic.apply(kind, l, r));
                }
                break;
            }
            default:
                throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, "unknown expression kind " + kind);
            }
        }
        return values.pop();
    }

    private static void checkOperand(Expr operator, Expr operand, boolean wantBoolean) throws EvaluationException {
        if (operand.isBoolean() != wantBoolean) {
            throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, (wantBoolean ? "integer " : "boolean ")
                    + operand + " used as an operand of " + operator.getKind());
        }
    }
}
