package analysis.dataflow;

import ir.Edge;
import ir.Instruction;

/**
 * Transfer functions of an analysis. Must be monotone: applied to states a &lt;= b they give results f(a) &lt;= f(b).
 *
 * @param <S>
 *            type of states
 */
public interface TransferFunction<S> {

    /**
     * State entering the graph: at the entry for a forward analysis, at every exit for a backward one
     *
     * @return boundary state
     */
    S boundary();

    /**
     * Effect of one instruction. For backward analyses this maps the state after the instruction to the state before.
     *
     * @param i
     *            instruction
     * @param in
     *            state flowing into the instruction
     * @return state flowing out of the instruction
     */
    S instruction(Instruction i, S in);

    /**
     * Effect of following an edge, e.g. refining a variable tested by a branch
     *
     * @param e
     *            edge being followed
     * @param state
     *            state at the end of the edge's source (forward) or start of its target (backward)
     * @return state propagated along the edge
     */
    S edge(Edge e, S state);
}
