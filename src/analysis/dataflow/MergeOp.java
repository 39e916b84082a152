package analysis.dataflow;

/**
 * How facts arriving on different edges are combined
 */
public enum MergeOp {
    /**
     * Least upper bound, facts that hold on some path ("may" analyses). Initial value is bottom.
     */
    JOIN,
    /**
     * Greatest lower bound, facts that hold on all paths ("must" analyses). Initial value is top.
     */
    MEET;
}
