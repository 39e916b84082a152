package ast;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable Turtle expression. A single class tagged by {@link ExprKind}; the payload fields that are meaningful depend
 * on the tag:
 * <ul>
 * <li>{@link ExprKind#INT_CONST}, {@link ExprKind#BOOL_CONST}: {@link #getValue()} (booleans are 0 or 1)</li>
 * <li>{@link ExprKind#VAR}: {@link #getName()}</li>
 * <li>unary kinds: {@link #getLeft()}</li>
 * <li>binary kinds: {@link #getLeft()} and {@link #getRight()}</li>
 * </ul>
 * Expressions are shared between the AST and the IR, and the symbolic executor uses them as symbolic values over
 * input symbols.
 */
public final class Expr implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Expr TRUE = new Expr(ExprKind.BOOL_CONST, 1, null, null, null);
    public static final Expr FALSE = new Expr(ExprKind.BOOL_CONST, 0, null, null, null);

    private final ExprKind kind;
    private final long value;
    private final String name;
    private final Expr left;
    private final Expr right;
    private final int memoizedHashCode;
    private final int size;
    private final boolean containsDivision;

    private Expr(ExprKind kind, long value, String name, Expr left, Expr right) {
        this.kind = kind;
        this.value = value;
        this.name = name;
        this.left = left;
        this.right = right;
        this.memoizedHashCode = computeHashCode();
        this.size = saturatedAdd(1, saturatedAdd(left == null ? 0 : left.size, right == null ? 0 : right.size));
        this.containsDivision = kind == ExprKind.DIV || kind == ExprKind.MOD
                || (left != null && left.containsDivision) || (right != null && right.containsDivision);
    }

    private static int saturatedAdd(int a, int b) {
        long sum = (long) a + b;
        return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
    }

    /**
     * Integer literal
     *
     * @param value literal value
     * @return constant expression
     */
    public static Expr constant(long value) {
        return new Expr(ExprKind.INT_CONST, value, null, null, null);
    }

    /**
     * Boolean literal
     *
     * @param value literal value
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static Expr bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Read of a variable
     *
     * @param name variable name (Chiron programs use a leading ':' but this is not required)
     * @return variable expression
     */
    public static Expr var(String name) {
        return new Expr(ExprKind.VAR, 0, name, null, null);
    }

    public static Expr neg(Expr e) {
        return new Expr(ExprKind.NEG, 0, null, e, null);
    }

    public static Expr not(Expr e) {
        return new Expr(ExprKind.NOT, 0, null, e, null);
    }

    /**
     * Create a unary expression
     *
     * @param kind NEG or NOT
     * @param operand sub-expression
     * @return new expression
     */
    public static Expr unary(ExprKind kind, Expr operand) {
        if (kind.getArity() != 1) {
            throw new IllegalArgumentException(kind + " is not a unary operator");
        }
        return new Expr(kind, 0, null, operand, null);
    }

    /**
     * Create a binary expression. No type checking is performed here, ill-typed trees are rejected when the program is
     * lowered to IR.
     *
     * @param kind binary operator
     * @param left left operand
     * @param right right operand
     * @return new expression
     */
    public static Expr binary(ExprKind kind, Expr left, Expr right) {
        if (kind.getArity() != 2) {
            throw new IllegalArgumentException(kind + " is not a binary operator");
        }
        return new Expr(kind, 0, null, left, right);
    }

    public static Expr add(Expr l, Expr r) {
        return binary(ExprKind.ADD, l, r);
    }

    public static Expr sub(Expr l, Expr r) {
        return binary(ExprKind.SUB, l, r);
    }

    public static Expr mul(Expr l, Expr r) {
        return binary(ExprKind.MUL, l, r);
    }

    public static Expr div(Expr l, Expr r) {
        return binary(ExprKind.DIV, l, r);
    }

    public static Expr mod(Expr l, Expr r) {
        return binary(ExprKind.MOD, l, r);
    }

    public static Expr lt(Expr l, Expr r) {
        return binary(ExprKind.LT, l, r);
    }

    public static Expr le(Expr l, Expr r) {
        return binary(ExprKind.LE, l, r);
    }

    public static Expr gt(Expr l, Expr r) {
        return binary(ExprKind.GT, l, r);
    }

    public static Expr ge(Expr l, Expr r) {
        return binary(ExprKind.GE, l, r);
    }

    public static Expr eq(Expr l, Expr r) {
        return binary(ExprKind.EQ, l, r);
    }

    public static Expr ne(Expr l, Expr r) {
        return binary(ExprKind.NE, l, r);
    }

    public static Expr and(Expr l, Expr r) {
        return binary(ExprKind.AND, l, r);
    }

    public static Expr or(Expr l, Expr r) {
        return binary(ExprKind.OR, l, r);
    }

    public ExprKind getKind() {
        return kind;
    }

    /**
     * Value of a literal
     *
     * @return integer value, or 0/1 for boolean literals
     */
    public long getValue() {
        assert kind == ExprKind.INT_CONST || kind == ExprKind.BOOL_CONST : "No value for " + kind;
        return value;
    }

    /**
     * @return value of a boolean literal
     */
    public boolean getBooleanValue() {
        assert kind == ExprKind.BOOL_CONST : "No boolean value for " + kind;
        return value != 0;
    }

    /**
     * @return variable name for a {@link ExprKind#VAR}, null otherwise
     */
    public String getName() {
        return name;
    }

    /**
     * @return first (or only) operand, null for leaves
     */
    public Expr getLeft() {
        return left;
    }

    /**
     * @return second operand of a binary expression, null otherwise
     */
    public Expr getRight() {
        return right;
    }

    /**
     * @return true if this expression produces a boolean
     */
    public boolean isBoolean() {
        return kind.isBooleanResult();
    }

    /**
     * @return true if this is an integer or boolean literal
     */
    public boolean isConstant() {
        return kind == ExprKind.INT_CONST || kind == ExprKind.BOOL_CONST;
    }

    /**
     * Whether this expression contains a division or remainder, i.e. whether evaluating it could fail even when every
     * variable it reads is bound
     *
     * @return true if some sub-expression is a DIV or MOD
     */
    public boolean containsDivision() {
        return containsDivision;
    }

    /**
     * Whether evaluating this expression could fail: it divides, or it reads a variable that may be unbound
     *
     * @param definitelyBound
     *            variables known to have a value where the expression is evaluated
     * @return true if evaluation may fault
     */
    public boolean canFault(Set<String> definitelyBound) {
        if (containsDivision) {
            return true;
        }
        for (String var : getVariables()) {
            if (!definitelyBound.contains(var)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sub-expressions in evaluation order: operands left to right, each before the operator that uses it. The
     * expression itself is last.
     *
     * @return every node of the tree, shared sub-trees once per occurrence
     */
    public List<Expr> postorder() {
        List<Expr> order = new ArrayList<>(size);
        Deque<Expr> work = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        work.push(this);
        expanded.push(false);
        while (!work.isEmpty()) {
            Expr next = work.pop();
            if (expanded.pop() || next.left == null) {
                order.add(next);
                continue;
            }
            work.push(next);
            expanded.push(true);
            if (next.right != null) {
                work.push(next.right);
                expanded.push(false);
            }
            work.push(next.left);
            expanded.push(false);
        }
        return order;
    }

    /**
     * Variables read by this expression, in the order they are first encountered
     *
     * @return set of variable names
     */
    public Set<String> getVariables() {
        Set<String> vars = new LinkedHashSet<>();
        Deque<Expr> work = new ArrayDeque<>();
        work.push(this);
        while (!work.isEmpty()) {
            Expr next = work.pop();
            if (next.kind == ExprKind.VAR) {
                vars.add(next.name);
            }
            if (next.right != null) {
                work.push(next.right);
            }
            if (next.left != null) {
                work.push(next.left);
            }
        }
        return vars;
    }

    /**
     * Replace variables by expressions
     *
     * @param replacements map from variable name to the expression that replaces it, variables not in the map are
     *            left alone
     * @return new expression (or this one if nothing changed)
     */
    public Expr substitute(Map<String, Expr> replacements) {
        Deque<Expr> results = new ArrayDeque<>();
        for (Expr next : postorder()) {
            switch (next.kind.getArity()) {
            case 0:
                if (next.kind == ExprKind.VAR && replacements.containsKey(next.name)) {
                    results.push(replacements.get(next.name));
                } else {
                    results.push(next);
                }
                break;
            case 1:
                Expr newOperand = results.pop();
                results.push(newOperand == next.left ? next : unary(next.kind, newOperand));
                break;
            default:
                Expr newRight = results.pop();
                Expr newLeft = results.pop();
                results.push(newLeft == next.left && newRight == next.right ? next
                        : binary(next.kind, newLeft, newRight));
                break;
            }
        }
        return results.pop();
    }

    /**
     * Number of nodes in the expression tree
     *
     * @return size of this expression
     */
    public int size() {
        return size;
    }

    private int computeHashCode() {
        final int prime = 31;
        int result = kind.hashCode();
        result = prime * result + (int) (value ^ (value >>> 32));
        result = prime * result + (name == null ? 0 : name.hashCode());
        result = prime * result + (left == null ? 0 : left.hashCode());
        result = prime * result + (right == null ? 0 : right.hashCode());
        return result;
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Expr)) {
            return false;
        }
        Deque<Expr> mine = new ArrayDeque<>();
        Deque<Expr> theirs = new ArrayDeque<>();
        mine.push(this);
        theirs.push((Expr) obj);
        while (!mine.isEmpty()) {
            Expr a = mine.pop();
            Expr b = theirs.pop();
            if (a == b) {
                continue;
            }
            if (a.memoizedHashCode != b.memoizedHashCode || a.kind != b.kind || a.value != b.value
                    || a.size != b.size) {
                return false;
            }
            if (a.name == null ? b.name != null : !a.name.equals(b.name)) {
                return false;
            }
            if (a.left != null) {
                mine.push(a.left);
                theirs.push(b.left);
            }
            if (a.right != null) {
                mine.push(a.right);
                theirs.push(b.right);
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        // pending pieces, either text or expressions still to print
        Deque<Object> work = new ArrayDeque<>();
        work.push(this);
        while (!work.isEmpty()) {
            Object next = work.pop();
            if (next instanceof String) {
                sb.append((String) next);
                continue;
            }
            Expr e = (Expr) next;
            switch (e.kind) {
            case INT_CONST:
                sb.append(e.value);
                break;
            case BOOL_CONST:
                sb.append(e.value != 0 ? "true" : "false");
                break;
            case VAR:
                sb.append(e.name);
                break;
            case NEG:
                // keep -(5) distinct from the literal -5
                if (e.left.kind == ExprKind.INT_CONST) {
                    work.push(")");
                    work.push(e.left);
                    sb.append("-(");
                } else {
                    work.push(e.left);
                    sb.append("-");
                }
                break;
            case NOT:
                work.push(e.left);
                sb.append("not ");
                break;
            default:
                work.push(")");
                work.push(e.right);
                work.push(" " + e.kind.getSymbol() + " ");
                work.push(e.left);
                sb.append("(");
                break;
            }
        }
        return sb.toString();
    }
}
