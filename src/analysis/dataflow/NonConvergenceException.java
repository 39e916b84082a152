package analysis.dataflow;

import ir.BasicBlock;

/**
 * A block was processed more times than {@link FixpointOptions#getMaxVisitsPerBlock()} allows
 */
public class NonConvergenceException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * States computed before the engine gave up, not a fixpoint
     */
    private final transient FixpointResult<?> partialResult;

    public NonConvergenceException(String message, BasicBlock block, FixpointResult<?> partialResult) {
        super(message, block);
        this.partialResult = partialResult;
    }

    public FixpointResult<?> getPartialResult() {
        return partialResult;
    }
}
