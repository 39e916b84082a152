package analysis.dataflow.util;

/**
 * Element of a lattice of abstract values used for data-flow analysis and abstract interpretation
 *
 * @param <T>
 *            Type of the implementing class (e.g. MyAbsVal implements AbstractValue&lt;MyAbsVal&gt;)
 */
public interface AbstractValue<T> {

    /**
     * Is this abstract value less than or equal to the given abstract value
     *
     * @param that
     *            value to compare
     * @return true if this is less than or equal to that
     */
    boolean leq(T that);

    /**
     * Is this the bottom element
     *
     * @return true if this is the bottom element
     */
    boolean isBottom();

    /**
     * Take the upper bound of this abstract value and the given abstract value
     *
     * @param that
     *            value to take the upper bound with
     * @return the upper bound of this and that
     */
    T join(T that);

    /**
     * Take the lower bound of this abstract value and the given abstract value
     *
     * @param that
     *            value to take the lower bound with
     * @return the lower bound of this and that
     */
    T meet(T that);

    /**
     * Widening of this (the previous value) by that (the new value). The result is above both, and any sequence
     * <code>x0, x1 = x0.widen(y1), x2 = x1.widen(y2), ...</code> is eventually stationary. For lattices of finite height
     * this is the join.
     *
     * @param that
     *            new value
     * @return widened value
     */
    T widen(T that);

    /**
     * Narrowing of this (a post-fixpoint) by that (the value recomputed from it). The result lies between that and
     * this, and repeated narrowing is eventually stationary. For lattices of finite height this may simply return
     * that.
     *
     * @param that
     *            recomputed value
     * @return narrowed value
     */
    T narrow(T that);
}
