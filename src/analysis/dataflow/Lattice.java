package analysis.dataflow;

/**
 * Lattice of data-flow states handed to the {@link FixpointEngine}. States are compared for equality with
 * {@link Object#equals(Object)}.
 *
 * @param <S>
 *            type of states
 */
public interface Lattice<S> {

    /**
     * @return least element, identity of {@link MergeOp#JOIN}
     */
    S bottom();

    /**
     * @return greatest element, identity of {@link MergeOp#MEET}
     */
    S top();

    /**
     * Partial order
     *
     * @param a
     *            first state
     * @param b
     *            second state
     * @return true if a is below or equal to b
     */
    boolean leq(S a, S b);

    S join(S a, S b);

    S meet(S a, S b);

    /**
     * Widening of the previous state by the new one, see {@link analysis.dataflow.util.AbstractValue#widen(Object)}
     *
     * @param previous
     *            state from the last iteration
     * @param next
     *            newly computed state
     * @return widened state
     */
    S widen(S previous, S next);

    /**
     * Narrowing of a post-fixpoint by a recomputed state
     *
     * @param previous
     *            current (post-fixpoint) state
     * @param next
     *            recomputed state
     * @return narrowed state
     */
    S narrow(S previous, S next);

    /**
     * Whether every ascending and descending chain is finite. The engine only widens and narrows for lattices where
     * this is false.
     *
     * @return true if the lattice has finite height
     */
    boolean isFiniteHeight();
}
