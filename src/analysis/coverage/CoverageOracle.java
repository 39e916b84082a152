package analysis.coverage;

import ir.ControlFlowGraph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;

/**
 * Runs a program on inputs chosen by a fuzzer and reports block coverage. The oracle remembers every block covered so
 * far, so the number of newly covered blocks can serve as a fitness signal.
 */
public class CoverageOracle {

    private final ControlFlowGraph cfg;
    private final ConcreteInterpreter interpreter;
    private final Set<Integer> covered = new LinkedHashSet<>();
    private int runs = 0;

    public CoverageOracle(ControlFlowGraph cfg, ConcreteInterpreter interpreter) {
        this.cfg = cfg;
        this.interpreter = interpreter;
    }

    /**
     * Execute the program once
     *
     * @param inputs
     *            initial variable bindings
     * @return trace, covered blocks and fault status of the run
     */
    public CoverageResult run(Map<String, Long> inputs) {
        ExecutionResult execution = interpreter.run(cfg, inputs);
        runs++;
        int before = covered.size();
        covered.addAll(execution.getTrace());
        return new CoverageResult(execution, covered.size() - before);
    }

    /**
     * @return ids of all blocks covered by some run so far
     */
    public Set<Integer> getCumulativeCoverage() {
        return Collections.unmodifiableSet(covered);
    }

    /**
     * @return fraction of the blocks of the graph covered so far
     */
    public double getCoverageRatio() {
        return (double) covered.size() / cfg.getNumberOfBlocks();
    }

    public int getRuns() {
        return runs;
    }

    public ControlFlowGraph getGraph() {
        return cfg;
    }
}
