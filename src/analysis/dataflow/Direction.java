package analysis.dataflow;

/**
 * Direction in which facts flow through the control flow graph
 */
public enum Direction {
    /**
     * From the entry towards the exits, blocks are visited in reverse postorder
     */
    FORWARD,
    /**
     * From the exits towards the entry, blocks are visited in postorder
     */
    BACKWARD;
}
