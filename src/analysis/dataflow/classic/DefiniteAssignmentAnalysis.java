package analysis.dataflow.classic;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import analysis.dataflow.Direction;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.MergeOp;
import analysis.dataflow.TransferFunction;

/**
 * Forward must-analysis computing the variables assigned on every path from the entry. Reading any other variable
 * may be an undefined-variable fault, unless the program is given that variable as an input.
 */
public class DefiniteAssignmentAnalysis implements TransferFunction<Set<String>> {

    /**
     * Run the analysis
     *
     * @param cfg
     *            graph to analyze
     * @param engine
     *            fixpoint engine
     * @return definitely assigned variables at the start and end of every block
     */
    public FixpointResult<Set<String>> analyze(ControlFlowGraph cfg, FixpointEngine engine) {
        return engine.run(cfg, new SetLattice<>(cfg.getVariables()), this, Direction.FORWARD, MergeOp.MEET);
    }

    @Override
    public Set<String> boundary() {
        return Collections.emptySet();
    }

    @Override
    public Set<String> instruction(Instruction i, Set<String> in) {
        if (i.getDef() == null) {
            return in;
        }
        return SetLattice.killGen(in, Collections.<String> emptySet(), Collections.singleton(i.getDef()));
    }

    @Override
    public Set<String> edge(Edge e, Set<String> state) {
        return state;
    }

    /**
     * Variables definitely assigned right before an instruction
     *
     * @param result
     *            result of {@link #analyze(ControlFlowGraph, FixpointEngine)}
     * @param bb
     *            block containing i
     * @param i
     *            instruction
     * @return variables assigned on every path to i
     */
    public Set<String> assignedBefore(FixpointResult<Set<String>> result, BasicBlock bb, Instruction i) {
        Set<String> assigned = result.getStateAtEntry(bb);
        List<Instruction> instructions = bb.getInstructions();
        for (Instruction current : instructions) {
            if (current.equals(i)) {
                return assigned;
            }
            assigned = instruction(current, assigned);
        }
        throw new IllegalArgumentException(i + " is not in " + bb);
    }
}
