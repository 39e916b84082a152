package analysis.dataflow.numeric;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.EdgeKind;
import ir.Instruction;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;

import analysis.dataflow.Direction;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.MergeOp;
import analysis.dataflow.TransferFunction;
import analysis.dataflow.util.AbstractState;
import analysis.dataflow.util.AbstractValue;
import ast.Expr;
import ast.ExprKind;

/**
 * Forward abstract interpretation over a {@link NumericDomain}. Assignments evaluate their right hand side in the
 * domain, and conditional edges refine the variables compared by the branch guard. A state becomes unreachable when an
 * expression is certain to fault (e.g. division by a divisor that can only be zero) or a guard cannot hold.
 *
 * @param <V>
 *            type of abstract values
 */
public class NumericAnalysis<V extends AbstractValue<V>> implements TransferFunction<AbstractState<V>> {

    private final NumericDomain<V> domain;
    private final StateLattice<V> lattice;

    public NumericAnalysis(NumericDomain<V> domain) {
        this.domain = domain;
        this.lattice = new StateLattice<>(domain);
    }

    public NumericDomain<V> getDomain() {
        return domain;
    }

    public StateLattice<V> getLattice() {
        return lattice;
    }

    /**
     * Run the analysis to a fixpoint. Variables start at top since inputs are unconstrained.
     *
     * @param cfg
     *            graph to analyze
     * @param engine
     *            fixpoint engine
     * @return abstract state at the start and end of every block
     */
    public FixpointResult<AbstractState<V>> analyze(ControlFlowGraph cfg, FixpointEngine engine) {
        return engine.run(cfg, lattice, this, Direction.FORWARD, MergeOp.JOIN);
    }

    /**
     * Abstract values of the variables at the end of the exit blocks
     *
     * @param cfg
     *            analyzed graph
     * @param result
     *            result of {@link #analyze}
     * @return map from every variable of the graph to its value, sorted by name
     */
    public Map<String, V> getExitValues(ControlFlowGraph cfg, FixpointResult<AbstractState<V>> result) {
        AbstractState<V> exit = lattice.bottom();
        for (BasicBlock bb : cfg.getExits()) {
            exit = exit.join(result.getStateAtExit(bb));
        }
        Map<String, V> values = new TreeMap<>();
        for (String var : cfg.getVariables()) {
            values.put(var, exit.get(var));
        }
        return values;
    }

    @Override
    public AbstractState<V> boundary() {
        return lattice.top();
    }

    @Override
    public AbstractState<V> instruction(Instruction i, AbstractState<V> in) {
        if (in.isUnreachable()) {
            return in;
        }
        switch (i.getType()) {
        case ASSIGN:
            return in.set(i.getTarget(), evaluate(i.getExpr(), in));
        case CALL:
            for (Expr arg : i.getArguments()) {
                if (evaluate(arg, in).isBottom()) {
                    return lattice.bottom();
                }
            }
            return in;
        case BRANCH:
            if (i.getExpr().containsDivision() && faults(i.getExpr(), in)) {
                return lattice.bottom();
            }
            return in;
        case JUMP:
        case RETURN:
            return in;
        default:
            throw new IllegalArgumentException("Unknown instruction type " + i.getType());
        }
    }

    @Override
    public AbstractState<V> edge(Edge e, AbstractState<V> state) {
        if (state.isUnreachable() || !e.getKind().isConditional()) {
            return state;
        }
        Instruction branch = e.getSource().getTerminator();
        return refine(branch.getExpr(), e.getKind() == EdgeKind.BRANCH_TRUE, state);
    }

    /**
     * Abstract value of an integer expression
     *
     * @param e
     *            integer expression
     * @param state
     *            values of the variables
     * @return abstract value, bottom if evaluation always faults
     */
    public V evaluate(Expr e, AbstractState<V> state) {
        Deque<V> values = new ArrayDeque<>();
        for (Expr next : e.postorder()) {
            switch (next.getKind()) {
            case INT_CONST:
                values.push(domain.constant(next.getValue()));
                break;
            case VAR:
                values.push(state.get(next.getName()));
                break;
            case NEG:
                values.push(domain.negate(values.pop()));
                break;
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
                V right = values.pop();
                V left = values.pop();
                values.push(domain.arithmetic(next.getKind(), left, right));
                break;
            default:
                throw new IllegalArgumentException("Not an integer expression: " + next);
            }
        }
        return values.pop();
    }

    /**
     * Whether every evaluation of a boolean expression faults. Both operands of <code>and</code> and <code>or</code>
     * are always evaluated, so one comparison that always faults is enough.
     */
    private boolean faults(Expr e, AbstractState<V> state) {
        for (Expr next : e.postorder()) {
            if (next.getKind().isComparison()
                    && (evaluate(next.getLeft(), state).isBottom() || evaluate(next.getRight(), state).isBottom())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Refine a state assuming a guard evaluates to the given truth value
     *
     * @param guard
     *            boolean expression
     * @param truth
     *            value the guard is assumed to have
     * @param state
     *            state before the assumption
     * @return refined state, unreachable if the assumption cannot hold
     */
    public AbstractState<V> refine(Expr guard, boolean truth, AbstractState<V> state) {
        if (state.isUnreachable()) {
            return state;
        }
        ExprKind kind = guard.getKind();
        if (kind.isComparison()) {
            ExprKind cmp = truth ? kind : kind.negateComparison();
            return assume(cmp, guard.getLeft(), guard.getRight(), state);
        }
        switch (kind) {
        case BOOL_CONST:
            return guard.getBooleanValue() == truth ? state : lattice.bottom();
        case NOT:
            return refine(guard.getLeft(), !truth, state);
        case AND:
            if (truth) {
                return refine(guard.getRight(), true, refine(guard.getLeft(), true, state));
            }
            return refine(guard.getLeft(), false, state).join(refine(guard.getRight(), false, state));
        case OR:
            if (truth) {
                return refine(guard.getLeft(), true, state).join(refine(guard.getRight(), true, state));
            }
            return refine(guard.getRight(), false, refine(guard.getLeft(), false, state));
        default:
            return state;
        }
    }

    /**
     * Assume <code>left cmp right</code>; variables on either side are refined
     */
    private AbstractState<V> assume(ExprKind cmp, Expr left, Expr right, AbstractState<V> state) {
        V l = evaluate(left, state);
        V r = evaluate(right, state);
        if (l.isBottom() || r.isBottom()) {
            return lattice.bottom();
        }
        V refinedLeft = domain.assume(cmp, l, r);
        V refinedRight = domain.assume(cmp.swapOperands(), r, l);
        if (refinedLeft.isBottom() || refinedRight.isBottom()) {
            return lattice.bottom();
        }
        AbstractState<V> result = state;
        if (left.getKind() == ExprKind.VAR) {
            result = result.set(left.getName(), refinedLeft);
        }
        if (right.getKind() == ExprKind.VAR) {
            result = result.set(right.getName(), refinedRight);
        }
        return result;
    }
}
