package analysis.dataflow.classic;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import analysis.dataflow.Direction;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.MergeOp;
import analysis.dataflow.TransferFunction;

/**
 * Backward may-analysis computing the variables whose current value may be read later
 */
public class LiveVariableAnalysis implements TransferFunction<Set<String>> {

    /**
     * Variables live at the exits
     */
    private final Set<String> liveAtExit;

    /**
     * Nothing is read after the program ends
     */
    public LiveVariableAnalysis() {
        this(Collections.<String> emptySet());
    }

    /**
     * @param liveAtExit
     *            variables that are observed when the program ends
     */
    public LiveVariableAnalysis(Set<String> liveAtExit) {
        this.liveAtExit = Collections.unmodifiableSet(new LinkedHashSet<>(liveAtExit));
    }

    /**
     * Run the analysis
     *
     * @param cfg
     *            graph to analyze
     * @param engine
     *            fixpoint engine
     * @return live variables at the start (state at entry) and end (state at exit) of every block
     */
    public FixpointResult<Set<String>> analyze(ControlFlowGraph cfg, FixpointEngine engine) {
        Set<String> universe = new LinkedHashSet<>(cfg.getVariables());
        universe.addAll(liveAtExit);
        return engine.run(cfg, new SetLattice<>(universe), this, Direction.BACKWARD, MergeOp.JOIN);
    }

    @Override
    public Set<String> boundary() {
        return liveAtExit;
    }

    @Override
    public Set<String> instruction(Instruction i, Set<String> liveAfter) {
        Set<String> kill = i.getDef() == null ? Collections.<String> emptySet() : Collections.singleton(i.getDef());
        return SetLattice.killGen(liveAfter, kill, uses(i));
    }

    /**
     * Variables treated as read by an instruction
     *
     * @param i
     *            instruction
     * @return {@link Instruction#getUses()} unless overridden
     */
    protected Set<String> uses(Instruction i) {
        return i.getUses();
    }

    @Override
    public Set<String> edge(Edge e, Set<String> state) {
        return state;
    }

    /**
     * Variables live right after an instruction
     *
     * @param result
     *            result of {@link #analyze(ControlFlowGraph, FixpointEngine)}
     * @param bb
     *            block containing i
     * @param i
     *            instruction
     * @return live variables after i executes
     */
    public Set<String> liveAfter(FixpointResult<Set<String>> result, BasicBlock bb, Instruction i) {
        Set<String> live = result.getStateAtExit(bb);
        List<Instruction> instructions = bb.getInstructions();
        for (int k = instructions.size() - 1; k >= 0; k--) {
            Instruction current = instructions.get(k);
            if (current.equals(i)) {
                return live;
            }
            live = instruction(current, live);
        }
        throw new IllegalArgumentException(i + " is not in " + bb);
    }
}
