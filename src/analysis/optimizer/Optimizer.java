package analysis.optimizer;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.EdgeKind;
import ir.Instruction;
import ir.InstructionType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.Logger;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.classic.DefiniteAssignmentAnalysis;
import analysis.dataflow.classic.LiveVariableAnalysis;
import analysis.dataflow.numeric.ConstantPropagationDomain;
import analysis.dataflow.numeric.ConstantValue;
import analysis.dataflow.numeric.NumericAnalysis;
import analysis.dataflow.util.AbstractState;
import ast.Expr;

/**
 * Optimizes a CFG, producing a new one and leaving the original alone. The passes are
 * <ol>
 * <li>constant folding: variables known to be constant (by constant propagation) are replaced by their value and
 * expressions are simplified with {@link ExprSimplifier}, which keeps every read of a variable that may be unassigned
 * (by {@link DefiniteAssignmentAnalysis})</li>
 * <li>branch folding: a branch whose guard folds to a constant becomes a jump to the taken successor, the other
 * successor may become unreachable and is dropped</li>
 * <li>dead store elimination: assignments whose value cannot fault and is never read are removed; every variable is
 * observed at the end of the program and wherever it may stop on a fault, including reads of variables that may be
 * unassigned</li>
 * <li>empty block bypass: edges into a block left empty are redirected to its successor</li>
 * </ol>
 * The final value of every variable is the same as in the original program for every input.
 */
public class Optimizer {

    private final FixpointEngine engine;
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    private int foldedExpressions;
    private int foldedBranches;
    private int removedStores;
    private int bypassedBlocks;

    public Optimizer() {
        this(new FixpointEngine());
    }

    /**
     * @param engine
     *            engine used to run constant propagation and liveness
     */
    public Optimizer(FixpointEngine engine) {
        this.engine = engine;
    }

    /**
     * Optimize a CFG
     *
     * @param cfg
     *            graph to optimize, not modified
     * @return new optimized graph
     */
    public ControlFlowGraph optimize(ControlFlowGraph cfg) {
        foldedExpressions = 0;
        foldedBranches = 0;
        removedStores = 0;
        bypassedBlocks = 0;

        ControlFlowGraph result = foldConstants(cfg);
        result = removeDeadStores(result);
        result = bypassEmptyBlocks(result);
        if (outputLevel >= 1) {
            Logger.println("OPTIMIZED " + cfg.getName() + ": folded " + foldedExpressions + " expressions and "
                                            + foldedBranches + " branches, removed " + removedStores
                                            + " stores, bypassed " + bypassedBlocks + " blocks, "
                                            + cfg.getNumberOfBlocks() + " -> " + result.getNumberOfBlocks()
                                            + " blocks");
        }
        if (outputLevel >= 2) {
            Logger.println(result.toString());
        }
        return result;
    }

    /**
     * Constant folding and branch folding
     */
    private ControlFlowGraph foldConstants(ControlFlowGraph cfg) {
        NumericAnalysis<ConstantValue> cp = new NumericAnalysis<>(new ConstantPropagationDomain());
        FixpointResult<AbstractState<ConstantValue>> facts = cp.analyze(cfg, engine);
        DefiniteAssignmentAnalysis da = new DefiniteAssignmentAnalysis();
        FixpointResult<Set<String>> assigned = da.analyze(cfg, engine);

        Map<BasicBlock, BasicBlock> newBlocks = new LinkedHashMap<>();
        Map<BasicBlock, Boolean> takenBranch = new HashMap<>();
        for (BasicBlock bb : cfg) {
            AbstractState<ConstantValue> state = facts.getStateAtEntry(bb);
            Set<String> bound = assigned.getStateAtEntry(bb);
            List<Instruction> instructions = new ArrayList<>();
            for (Instruction i : bb.getInstructions()) {
                Instruction folded = fold(i, state, bound);
                if (folded.getType() == InstructionType.BRANCH && folded.getExpr().isConstant()) {
                    takenBranch.put(bb, folded.getExpr().getBooleanValue());
                    folded = Instruction.jump(i.getId());
                    foldedBranches++;
                } else if (folded != i) {
                    foldedExpressions++;
                }
                instructions.add(folded);
                state = cp.instruction(i, state);
                bound = da.instruction(i, bound);
            }
            newBlocks.put(bb, new BasicBlock(bb.getId(), bb.getLabel(), instructions));
        }

        List<Edge> edges = new ArrayList<>();
        for (Edge e : cfg.getEdges()) {
            Boolean taken = takenBranch.get(e.getSource());
            if (taken != null) {
                if (e.getKind() != (taken ? EdgeKind.BRANCH_TRUE : EdgeKind.BRANCH_FALSE)) {
                    continue;
                }
                edges.add(new Edge(newBlocks.get(e.getSource()), newBlocks.get(e.getTarget()), EdgeKind.FALL_THROUGH));
            } else {
                edges.add(new Edge(newBlocks.get(e.getSource()), newBlocks.get(e.getTarget()), e.getKind()));
            }
        }
        ControlFlowGraph folded = new ControlFlowGraph(cfg.getName(), newBlocks.values(),
                                                       newBlocks.get(cfg.getEntry()), edges);
        if (outputLevel >= 2 && folded.getRemovedBlockCount() > 0) {
            Logger.println("Branch folding made " + folded.getRemovedBlockCount() + " blocks unreachable");
        }
        return folded;
    }

    /**
     * Replace constant variables and simplify the expressions of one instruction
     *
     * @param state
     *            constant propagation facts before i
     * @param bound
     *            variables assigned on every path to i
     */
    private static Instruction fold(Instruction i, AbstractState<ConstantValue> state, Set<String> bound) {
        if (state.isUnreachable()) {
            return i;
        }
        switch (i.getType()) {
        case ASSIGN:
        case BRANCH:
            return i.withExpr(fold(i.getExpr(), state, bound));
        case CALL:
            List<Expr> args = new ArrayList<>();
            for (Expr arg : i.getArguments()) {
                args.add(fold(arg, state, bound));
            }
            return i.withArguments(args);
        default:
            return i;
        }
    }

    private static Expr fold(Expr e, AbstractState<ConstantValue> state, Set<String> bound) {
        Map<String, Expr> constants = new HashMap<>();
        for (String var : e.getVariables()) {
            ConstantValue v = state.get(var);
            if (v.isConstant()) {
                constants.put(var, Expr.constant(v.getValue()));
            }
        }
        // a variable with a constant value has been assigned
        Set<String> known = new HashSet<>(bound);
        known.addAll(constants.keySet());
        return ExprSimplifier.simplify(e.substitute(constants), known);
    }

    /**
     * Remove assignments that cannot fault and whose value is never read, until none is left
     */
    private ControlFlowGraph removeDeadStores(ControlFlowGraph cfg) {
        final Set<String> observed = cfg.getVariables();
        final Set<Integer> mayFault = new HashSet<>();
        // the bindings are also observed wherever the program may stop early
        LiveVariableAnalysis liveness = new LiveVariableAnalysis(observed) {
            @Override
            protected Set<String> uses(Instruction i) {
                if (mayFault.contains(i.getId()) || i.getType() == InstructionType.CALL) {
                    return observed;
                }
                return i.getUses();
            }
        };
        ControlFlowGraph current = cfg;
        boolean changed = true;
        while (changed) {
            changed = false;
            mayFault.clear();
            mayFault.addAll(mayFault(current));
            FixpointResult<Set<String>> live = liveness.analyze(current, engine);
            Map<BasicBlock, BasicBlock> newBlocks = new LinkedHashMap<>();
            for (BasicBlock bb : current) {
                List<Instruction> kept = new ArrayList<>();
                for (Instruction i : bb.getInstructions()) {
                    if (i.getType() == InstructionType.ASSIGN && !mayFault.contains(i.getId())
                            && !liveness.liveAfter(live, bb, i).contains(i.getTarget())) {
                        if (outputLevel >= 3) {
                            Logger.println("DEAD STORE " + i + " in " + bb);
                        }
                        removedStores++;
                        changed = true;
                        continue;
                    }
                    kept.add(i);
                }
                newBlocks.put(bb, kept.size() == bb.getInstructions().size() ? bb
                        : new BasicBlock(bb.getId(), bb.getLabel(), kept));
            }
            if (changed) {
                current = rebuild(current, newBlocks);
            }
        }
        return current;
    }

    /**
     * Ids of the instructions that may divide by zero or read a variable that may be unassigned
     */
    private Set<Integer> mayFault(ControlFlowGraph cfg) {
        DefiniteAssignmentAnalysis da = new DefiniteAssignmentAnalysis();
        FixpointResult<Set<String>> assigned = da.analyze(cfg, engine);
        Set<Integer> ids = new HashSet<>();
        for (BasicBlock bb : cfg) {
            Set<String> bound = assigned.getStateAtEntry(bb);
            for (Instruction i : bb.getInstructions()) {
                if (i.canFault(bound)) {
                    ids.add(i.getId());
                }
                bound = da.instruction(i, bound);
            }
        }
        return ids;
    }

    /**
     * Redirect edges entering empty blocks (other than the entry) to the block they fall through to
     */
    private ControlFlowGraph bypassEmptyBlocks(ControlFlowGraph cfg) {
        List<Edge> edges = new ArrayList<>();
        for (Edge e : cfg.getEdges()) {
            BasicBlock target = e.getTarget();
            EdgeKind kind = e.getKind();
            Set<BasicBlock> seen = new HashSet<>();
            while (target.isEmpty() && !target.equals(cfg.getEntry()) && seen.add(target)) {
                Edge next = cfg.getOutgoingEdges(target).get(0);
                if (next.getTarget().equals(target)) {
                    break;
                }
                if (!kind.isConditional()) {
                    kind = next.getKind();
                }
                target = next.getTarget();
            }
            edges.add(new Edge(e.getSource(), target, kind));
        }
        ControlFlowGraph bypassed = new ControlFlowGraph(cfg.getName(), cfg.getBlocks(), cfg.getEntry(), edges);
        bypassedBlocks += bypassed.getRemovedBlockCount();
        return bypassed;
    }

    /**
     * Graph with some blocks replaced, edges are carried over
     */
    private static ControlFlowGraph rebuild(ControlFlowGraph cfg, Map<BasicBlock, BasicBlock> newBlocks) {
        List<Edge> edges = new ArrayList<>();
        for (Edge e : cfg.getEdges()) {
            edges.add(new Edge(newBlocks.get(e.getSource()), newBlocks.get(e.getTarget()), e.getKind()));
        }
        return new ControlFlowGraph(cfg.getName(), newBlocks.values(), newBlocks.get(cfg.getEntry()), edges);
    }

    /**
     * @return expressions changed by the last call to {@link #optimize(ControlFlowGraph)}
     */
    public int getFoldedExpressions() {
        return foldedExpressions;
    }

    /**
     * @return branches turned into jumps by the last call to {@link #optimize(ControlFlowGraph)}
     */
    public int getFoldedBranches() {
        return foldedBranches;
    }

    /**
     * @return assignments removed by the last call to {@link #optimize(ControlFlowGraph)}
     */
    public int getRemovedStores() {
        return removedStores;
    }

    /**
     * @return empty blocks bypassed by the last call to {@link #optimize(ControlFlowGraph)}
     */
    public int getBypassedBlocks() {
        return bypassedBlocks;
    }

    /**
     * Set the level of console output, higher means more output
     *
     * @param outputLevel
     *            new output level
     */
    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }
}
