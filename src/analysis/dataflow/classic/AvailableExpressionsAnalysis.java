package analysis.dataflow.classic;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import analysis.dataflow.Direction;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.MergeOp;
import analysis.dataflow.TransferFunction;
import ast.Expr;

/**
 * Forward must-analysis computing the compound integer expressions that have been evaluated on every path and whose
 * operands have not changed since
 */
public class AvailableExpressionsAnalysis implements TransferFunction<Set<Expr>> {

    /**
     * Run the analysis
     *
     * @param cfg
     *            graph to analyze
     * @param engine
     *            fixpoint engine
     * @return available expressions at the start and end of every block
     */
    public FixpointResult<Set<Expr>> analyze(ControlFlowGraph cfg, FixpointEngine engine) {
        Set<Expr> universe = new LinkedHashSet<>();
        for (BasicBlock bb : cfg) {
            for (Instruction i : bb.getInstructions()) {
                for (Expr e : i.getEvaluatedExpressions()) {
                    universe.addAll(compoundSubexpressions(e));
                }
            }
        }
        return engine.run(cfg, new SetLattice<>(universe), this, Direction.FORWARD, MergeOp.MEET);
    }

    /**
     * Integer sub-expressions of e that are not constants or variables
     *
     * @param e
     *            expression
     * @return compound integer sub-expressions
     */
    static Set<Expr> compoundSubexpressions(Expr e) {
        Set<Expr> result = new LinkedHashSet<>();
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(e);
        while (!stack.isEmpty()) {
            Expr next = stack.pop();
            if (next.getKind().getArity() > 0 && !next.isBoolean()) {
                result.add(next);
            }
            if (next.getLeft() != null) {
                stack.push(next.getLeft());
            }
            if (next.getRight() != null) {
                stack.push(next.getRight());
            }
        }
        return result;
    }

    @Override
    public Set<Expr> boundary() {
        return Collections.emptySet();
    }

    @Override
    public Set<Expr> instruction(Instruction i, Set<Expr> in) {
        Set<Expr> gen = new LinkedHashSet<>();
        for (Expr e : i.getEvaluatedExpressions()) {
            gen.addAll(compoundSubexpressions(e));
        }
        Set<Expr> kill = new LinkedHashSet<>();
        if (i.getDef() != null) {
            for (Expr e : in) {
                if (e.getVariables().contains(i.getDef())) {
                    kill.add(e);
                }
            }
            for (Expr e : gen) {
                if (e.getVariables().contains(i.getDef())) {
                    kill.add(e);
                }
            }
        }
        Set<Expr> out = SetLattice.killGen(in, Collections.<Expr> emptySet(), gen);
        return SetLattice.killGen(out, kill, Collections.<Expr> emptySet());
    }

    @Override
    public Set<Expr> edge(Edge e, Set<Expr> state) {
        return state;
    }
}
