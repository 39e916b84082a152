package analysis.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ast.Expr;

/**
 * Immutable conjunction of branch and division constraints collected along a path. Extending a path condition shares
 * the prefix with the original, so forked states do not copy their constraints.
 */
public final class PathCondition {

    public static final PathCondition EMPTY = new PathCondition(null, null, 0);

    private final PathCondition prefix;
    private final Expr last;
    private final int size;

    private PathCondition(PathCondition prefix, Expr last, int size) {
        this.prefix = prefix;
        this.last = last;
        this.size = size;
    }

    /**
     * @param constraint
     *            boolean expression over symbols
     * @return this path condition with one more conjunct, or this one if the constraint is trivially true
     */
    public PathCondition and(Expr constraint) {
        if (constraint.equals(Expr.TRUE)) {
            return this;
        }
        return new PathCondition(this, constraint, size + 1);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return conjuncts in the order they were added
     */
    public List<Expr> getConstraints() {
        List<Expr> constraints = new ArrayList<>(size);
        for (PathCondition pc = this; pc.size > 0; pc = pc.prefix) {
            constraints.add(pc.last);
        }
        Collections.reverse(constraints);
        return constraints;
    }

    /**
     * @return the conjunction as a single expression
     */
    public Expr toExpr() {
        Expr result = Expr.TRUE;
        for (Expr c : getConstraints()) {
            result = result == Expr.TRUE ? c : Expr.and(result, c);
        }
        return result;
    }

    @Override
    public String toString() {
        return getConstraints().toString();
    }
}
