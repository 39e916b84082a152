package analysis.dataflow.numeric;

import analysis.dataflow.util.AbstractValue;
import ast.ExprKind;

/**
 * Abstract domain for integer variables. Supplies the abstract counterparts of the Turtle operators; the
 * {@link NumericAnalysis} lifts them to states and transfer functions.
 *
 * @param <V>
 *            type of abstract values
 */
public interface NumericDomain<V extends AbstractValue<V>> {

    /**
     * @return short name used on the command line and in output
     */
    String getName();

    /**
     * @return value representing every integer
     */
    V top();

    /**
     * @return value representing no integer
     */
    V bottom();

    /**
     * Abstraction of a single integer
     *
     * @param c
     *            integer
     * @return smallest abstract value containing c
     */
    V constant(long c);

    /**
     * Abstract arithmetic negation
     *
     * @param v
     *            operand
     * @return value containing -x for every x in v
     */
    V negate(V v);

    /**
     * Abstract binary arithmetic. Division or remainder by zero stops execution, so a divisor that can only be zero
     * gives bottom.
     *
     * @param op
     *            one of ADD, SUB, MUL, DIV, MOD
     * @param left
     *            left operand
     * @param right
     *            right operand
     * @return value containing the result for every pair of concrete operands
     */
    V arithmetic(ExprKind op, V left, V right);

    /**
     * Refine a value knowing that a comparison holds
     *
     * @param comparison
     *            comparison operator
     * @param left
     *            value being refined
     * @param right
     *            value it is compared against
     * @return value containing every x in left for which some y in right satisfies x comparison y
     */
    V assume(ExprKind comparison, V left, V right);

    /**
     * @return true if the domain has no infinite ascending chains (no widening needed)
     */
    boolean isFiniteHeight();

    /**
     * @param v
     *            abstract value
     * @return the integer if v represents exactly one, null otherwise
     */
    Long getConstant(V v);

    /**
     * Membership test, used to check soundness
     *
     * @param v
     *            abstract value
     * @param c
     *            integer
     * @return true if c is represented by v
     */
    boolean contains(V v, long c);
}
