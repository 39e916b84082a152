package ir;

/**
 * Label on a control-flow edge
 */
public enum EdgeKind {
    /**
     * Unconditional edge, either falling through to the next block or following a JUMP
     */
    FALL_THROUGH,
    /**
     * Taken when the guard of the source block's BRANCH holds
     */
    BRANCH_TRUE,
    /**
     * Taken when the guard of the source block's BRANCH does not hold
     */
    BRANCH_FALSE,
    /**
     * Unconditional edge from the end of a loop body back to the loop header
     */
    BACK_EDGE;

    /**
     * @return true for the two edges leaving a conditional branch
     */
    public boolean isConditional() {
        return this == BRANCH_TRUE || this == BRANCH_FALSE;
    }
}
