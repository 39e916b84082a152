package analysis.dataflow;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.Logger;
import util.WorkQueue;

/**
 * Worklist fixpoint solver shared by the classic data-flow analyses and abstract interpretation. The analysis is
 * given by a {@link Lattice} of states, a {@link TransferFunction}, a {@link Direction} and a {@link MergeOp}.
 * <p>
 * Every block starts at the identity of the merge operator and the work queue is seeded with all blocks in reverse
 * postorder (forward) or postorder (backward). A block's input is the merge of what its neighbours send along the
 * connecting edges; the transfer function is folded over its instructions to get the output, and when the output
 * changes the blocks downstream are queued again.
 * <p>
 * For lattices of infinite height the merge at widening points (targets of back edges for forward analyses, sources
 * for backward ones) is replaced by widening once the block has been visited more than
 * {@link FixpointOptions#getWideningDelay()} times. After convergence, up to
 * {@link FixpointOptions#getNarrowingPasses()} sweeps recover precision with narrowing.
 */
public class FixpointEngine {

    private final FixpointOptions options;
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    public FixpointEngine() {
        this(new FixpointOptions());
    }

    public FixpointEngine(FixpointOptions options) {
        this.options = options;
    }

    /**
     * Compute the fixpoint
     *
     * @param cfg
     *            graph to analyze
     * @param lattice
     *            lattice of states
     * @param transfer
     *            transfer functions
     * @param direction
     *            direction of the analysis
     * @param mergeOp
     *            operator combining states from different edges
     * @return states for every block, possibly marked incomplete if the deadline passed
     * @throws NonConvergenceException
     *             if a block is processed more often than the options allow
     * @throws NonMonotonicException
     *             if monotonicity checking is on and a state moved the wrong way
     */
    public <S> FixpointResult<S> run(ControlFlowGraph cfg, Lattice<S> lattice, TransferFunction<S> transfer,
                                     Direction direction, MergeOp mergeOp) {
        Run<S> run = new Run<>(cfg, lattice, transfer, direction, mergeOp);
        return run.solve();
    }

    /**
     * State of one call to {@link FixpointEngine#run}
     */
    private class Run<S> {
        private final ControlFlowGraph cfg;
        private final Lattice<S> lattice;
        private final TransferFunction<S> transfer;
        private final Direction direction;
        private final MergeOp mergeOp;
        private final S identity;
        private final Map<BasicBlock, S> in = new LinkedHashMap<>();
        private final Map<BasicBlock, S> out = new LinkedHashMap<>();
        private final Map<BasicBlock, Integer> visits = new HashMap<>();
        private final Set<BasicBlock> boundary;
        private final Set<BasicBlock> wideningPoints = new LinkedHashSet<>();
        private final List<BasicBlock> order;
        private final boolean useWidening;
        private int iterations = 0;

        Run(ControlFlowGraph cfg, Lattice<S> lattice, TransferFunction<S> transfer, Direction direction,
            MergeOp mergeOp) {
            this.cfg = cfg;
            this.lattice = lattice;
            this.transfer = transfer;
            this.direction = direction;
            this.mergeOp = mergeOp;
            this.identity = mergeOp == MergeOp.JOIN ? lattice.bottom() : lattice.top();
            boolean forward = direction == Direction.FORWARD;
            this.order = forward ? cfg.getReversePostorder() : cfg.getPostorder();
            this.boundary = forward ? Collections.singleton(cfg.getEntry()) : cfg.getExits();
            for (Edge e : cfg.getBackEdges()) {
                wideningPoints.add(forward ? e.getTarget() : e.getSource());
            }
            this.useWidening = options.isWidening() && !lattice.isFiniteHeight();
            for (BasicBlock bb : order) {
                in.put(bb, identity);
                out.put(bb, identity);
            }
        }

        FixpointResult<S> solve() {
            WorkQueue<BasicBlock> q = new WorkQueue<>(order);
            while (!q.isEmpty()) {
                if (options.getDeadline().isExpired()) {
                    if (outputLevel >= 1) {
                        Logger.println("DEADLINE reached after " + iterations + " iterations, result is incomplete");
                    }
                    return result(false);
                }
                BasicBlock bb = q.poll();
                int count = visit(bb);
                S oldIn = in.get(bb);
                S oldOut = out.get(bb);

                S newIn = mergeInputs(bb);
                if (useWidening && count > options.getWideningDelay() && wideningPoints.contains(bb)) {
                    if (outputLevel >= 2) {
                        Logger.println("WIDENING at " + bb + " visit " + count);
                    }
                    newIn = lattice.widen(oldIn, merge(oldIn, newIn));
                }
                S newOut = flow(bb, newIn);
                if (options.isCheckMonotonicity()) {
                    checkMonotone(bb, oldIn, newIn, oldOut, newOut);
                }
                if (outputLevel >= 3) {
                    Logger.println("FLOWING " + bb + ": in " + newIn + " out " + newOut);
                }
                in.put(bb, newIn);
                if (!newOut.equals(oldOut)) {
                    out.put(bb, newOut);
                    for (BasicBlock succ : flowSuccessors(bb)) {
                        q.add(succ);
                    }
                }
            }
            if (useWidening && !wideningPoints.isEmpty()) {
                if (!narrow()) {
                    return result(false);
                }
            }
            if (outputLevel >= 2) {
                Logger.println("FIXPOINT after " + iterations + " iterations for " + cfg.getName());
            }
            return result(true);
        }

        /**
         * Descending sweeps from the widened post-fixpoint
         *
         * @return false if the deadline stopped narrowing
         */
        private boolean narrow() {
            for (int pass = 0; pass < options.getNarrowingPasses(); pass++) {
                boolean changed = false;
                for (BasicBlock bb : order) {
                    if (options.getDeadline().isExpired()) {
                        return false;
                    }
                    iterations++;
                    S newIn = mergeInputs(bb);
                    if (wideningPoints.contains(bb)) {
                        newIn = lattice.narrow(in.get(bb), newIn);
                    }
                    S newOut = flow(bb, newIn);
                    if (!newIn.equals(in.get(bb)) || !newOut.equals(out.get(bb))) {
                        changed = true;
                        in.put(bb, newIn);
                        out.put(bb, newOut);
                    }
                }
                if (outputLevel >= 2) {
                    Logger.println("NARROWING pass " + pass + (changed ? " changed" : " stable"));
                }
                if (!changed) {
                    break;
                }
            }
            return true;
        }

        /**
         * Record a visit to bb, failing if there have been too many
         *
         * @return number of visits including this one
         */
        private int visit(BasicBlock bb) {
            Integer previous = visits.get(bb);
            int count = previous == null ? 1 : previous + 1;
            visits.put(bb, count);
            iterations++;
            if (count > options.getMaxVisitsPerBlock()) {
                throw new NonConvergenceException("Processed " + bb + " " + options.getMaxVisitsPerBlock()
                                                + " times without reaching a fixpoint in " + cfg.getName(), bb,
                                                result(false));
            }
            return count;
        }

        private void checkMonotone(BasicBlock bb, S oldIn, S newIn, S oldOut, S newOut) {
            boolean up = mergeOp == MergeOp.JOIN;
            if (!(up ? lattice.leq(oldIn, newIn) : lattice.leq(newIn, oldIn))) {
                throw new NonMonotonicException("Input of " + bb + " moved " + (up ? "down" : "up") + " from "
                                                + oldIn + " to " + newIn, bb);
            }
            if (!(up ? lattice.leq(oldOut, newOut) : lattice.leq(newOut, oldOut))) {
                throw new NonMonotonicException("Transfer function of " + bb + " is not monotone: input " + oldIn
                                                + " gave " + oldOut + " but larger input " + newIn + " gave "
                                                + newOut, bb);
            }
        }

        private S merge(S a, S b) {
            return mergeOp == MergeOp.JOIN ? lattice.join(a, b) : lattice.meet(a, b);
        }

        /**
         * Merge of the states sent to bb by its neighbours (and the boundary state if bb is on the boundary)
         */
        private S mergeInputs(BasicBlock bb) {
            S result = identity;
            if (boundary.contains(bb)) {
                result = merge(result, transfer.boundary());
            }
            if (direction == Direction.FORWARD) {
                for (Edge e : cfg.getIncomingEdges(bb)) {
                    result = merge(result, transfer.edge(e, out.get(e.getSource())));
                }
            } else {
                for (Edge e : cfg.getOutgoingEdges(bb)) {
                    result = merge(result, transfer.edge(e, out.get(e.getTarget())));
                }
            }
            return result;
        }

        /**
         * Fold the transfer function over the instructions of bb
         */
        private S flow(BasicBlock bb, S input) {
            S state = input;
            List<Instruction> instructions = bb.getInstructions();
            if (direction == Direction.FORWARD) {
                for (Instruction i : instructions) {
                    state = transfer.instruction(i, state);
                }
            } else {
                for (int k = instructions.size() - 1; k >= 0; k--) {
                    state = transfer.instruction(instructions.get(k), state);
                }
            }
            return state;
        }

        private Set<BasicBlock> flowSuccessors(BasicBlock bb) {
            return direction == Direction.FORWARD ? cfg.getSuccessors(bb) : cfg.getPredecessors(bb);
        }

        private FixpointResult<S> result(boolean complete) {
            return new FixpointResult<>(direction, new LinkedHashMap<>(in), new LinkedHashMap<>(out), iterations,
                                        complete);
        }
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
