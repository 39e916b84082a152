package analysis.dataflow;

import ir.BasicBlock;

import java.util.Collections;
import java.util.Map;

/**
 * States computed by the {@link FixpointEngine}. "Input" and "output" follow the direction of the analysis: for a
 * backward analysis the input of a block is the state at its end.
 *
 * @param <S>
 *            type of states
 */
public class FixpointResult<S> {

    private final Direction direction;
    private final Map<BasicBlock, S> input;
    private final Map<BasicBlock, S> output;
    /**
     * Number of times blocks were processed, narrowing included
     */
    private final int iterations;
    /**
     * False if the deadline passed before a fixpoint was reached
     */
    private final boolean complete;

    FixpointResult(Direction direction, Map<BasicBlock, S> input, Map<BasicBlock, S> output, int iterations,
                   boolean complete) {
        this.direction = direction;
        this.input = Collections.unmodifiableMap(input);
        this.output = Collections.unmodifiableMap(output);
        this.iterations = iterations;
        this.complete = complete;
    }

    /**
     * @param bb
     *            block
     * @return merged state flowing into bb (in the direction of the analysis)
     */
    public S getInput(BasicBlock bb) {
        return input.get(bb);
    }

    /**
     * @param bb
     *            block
     * @return state flowing out of bb (in the direction of the analysis)
     */
    public S getOutput(BasicBlock bb) {
        return output.get(bb);
    }

    /**
     * @param bb
     *            block
     * @return state holding before the first instruction of bb
     */
    public S getStateAtEntry(BasicBlock bb) {
        return direction == Direction.FORWARD ? input.get(bb) : output.get(bb);
    }

    /**
     * @param bb
     *            block
     * @return state holding after the last instruction of bb
     */
    public S getStateAtExit(BasicBlock bb) {
        return direction == Direction.FORWARD ? output.get(bb) : input.get(bb);
    }

    public Direction getDirection() {
        return direction;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * @return true if the states are a fixpoint, false if the deadline stopped the computation
     */
    public boolean isComplete() {
        return complete;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(direction).append(complete ? "" : " (incomplete)").append(", ").append(iterations)
          .append(" iterations\n");
        for (Map.Entry<BasicBlock, S> e : input.entrySet()) {
            sb.append(e.getKey()).append(": in ").append(e.getValue()).append(" out ").append(output.get(e.getKey()))
              .append("\n");
        }
        return sb.toString();
    }
}
