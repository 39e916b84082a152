package analysis.dataflow;

import ir.BasicBlock;

/**
 * The fixpoint engine could not produce a result
 */
public class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Block being processed when the problem was detected
     */
    private final transient BasicBlock block;

    public AnalysisException(String message, BasicBlock block) {
        super(message);
        this.block = block;
    }

    public BasicBlock getBlock() {
        return block;
    }
}
