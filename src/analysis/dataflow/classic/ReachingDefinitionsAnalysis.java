package analysis.dataflow.classic;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import analysis.dataflow.Direction;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.MergeOp;
import analysis.dataflow.TransferFunction;

/**
 * Forward may-analysis computing which assignments (identified by instruction id) may reach each point
 */
public class ReachingDefinitionsAnalysis implements TransferFunction<Set<Integer>> {

    /**
     * Ids of the assignments to each variable
     */
    private final Map<String, Set<Integer>> definitionsOf = new HashMap<>();
    /**
     * Every assignment in the graph
     */
    private final Set<Integer> allDefinitions = new LinkedHashSet<>();

    public ReachingDefinitionsAnalysis(ControlFlowGraph cfg) {
        for (BasicBlock bb : cfg) {
            for (Instruction i : bb.getInstructions()) {
                if (i.getDef() != null) {
                    Set<Integer> defs = definitionsOf.get(i.getDef());
                    if (defs == null) {
                        defs = new LinkedHashSet<>();
                        definitionsOf.put(i.getDef(), defs);
                    }
                    defs.add(i.getId());
                    allDefinitions.add(i.getId());
                }
            }
        }
    }

    /**
     * Run the analysis
     *
     * @param cfg
     *            graph given to the constructor
     * @param engine
     *            fixpoint engine
     * @return definitions reaching the start and end of every block
     */
    public FixpointResult<Set<Integer>> analyze(ControlFlowGraph cfg, FixpointEngine engine) {
        return engine.run(cfg, new SetLattice<>(allDefinitions), this, Direction.FORWARD, MergeOp.JOIN);
    }

    @Override
    public Set<Integer> boundary() {
        return Collections.emptySet();
    }

    @Override
    public Set<Integer> instruction(Instruction i, Set<Integer> in) {
        if (i.getDef() == null) {
            return in;
        }
        return SetLattice.killGen(in, definitionsOf.get(i.getDef()), Collections.singleton(i.getId()));
    }

    @Override
    public Set<Integer> edge(Edge e, Set<Integer> state) {
        return state;
    }
}
