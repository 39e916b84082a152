package analysis.dataflow;

import ir.BasicBlock;

/**
 * A transfer function or merge operator was seen to be non-monotone. Only detected when
 * {@link FixpointOptions#isCheckMonotonicity()} is set.
 */
public class NonMonotonicException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public NonMonotonicException(String message, BasicBlock block) {
        super(message, block);
    }
}
