package analysis.dataflow;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;
import ir.InstructionType;
import ir.SamplePrograms;
import junit.framework.TestCase;
import util.Deadline;

/**
 * Convergence, widening and failure modes of {@link FixpointEngine}, using a lattice that counts assignments
 */
public class TestFixpointEngine extends TestCase {

    private static final int BOTTOM = -1;
    private static final int TOP = Integer.MAX_VALUE;

    /**
     * Naturals ordered as usual, -1 below them and Integer.MAX_VALUE standing for infinity
     */
    private static final Lattice<Integer> COUNTS = new Lattice<Integer>() {
        @Override
        public Integer bottom() {
            return BOTTOM;
        }

        @Override
        public Integer top() {
            return TOP;
        }

        @Override
        public boolean leq(Integer a, Integer b) {
            return a <= b;
        }

        @Override
        public Integer join(Integer a, Integer b) {
            return Math.max(a, b);
        }

        @Override
        public Integer meet(Integer a, Integer b) {
            return Math.min(a, b);
        }

        @Override
        public Integer widen(Integer previous, Integer next) {
            return next > previous ? TOP : previous;
        }

        @Override
        public Integer narrow(Integer previous, Integer next) {
            return previous == TOP ? next : previous;
        }

        @Override
        public boolean isFiniteHeight() {
            return false;
        }
    };

    /**
     * Number of assignments executed so far
     */
    private static class CountAssignments implements TransferFunction<Integer> {
        @Override
        public Integer boundary() {
            return 0;
        }

        @Override
        public Integer instruction(Instruction i, Integer in) {
            if (i.getType() != InstructionType.ASSIGN || in == BOTTOM || in == TOP) {
                return in;
            }
            return in + 1;
        }

        @Override
        public Integer edge(Edge e, Integer state) {
            return state;
        }
    }

    private static BasicBlock header(ControlFlowGraph cfg) {
        return cfg.getLoopHeaders().iterator().next();
    }

    public static void testStraightLine() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.straightLine());
        FixpointResult<Integer> r = new FixpointEngine().run(cfg, COUNTS, new CountAssignments(), Direction.FORWARD,
                                                             MergeOp.JOIN);
        assertTrue(r.isComplete());
        BasicBlock exit = cfg.getExits().iterator().next();
        assertEquals(Integer.valueOf(2), r.getInput(exit));
        assertEquals(Integer.valueOf(0), r.getInput(cfg.getEntry()));
    }

    public static void testBackwardBoundaryIsAtExit() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.straightLine());
        FixpointResult<Integer> r = new FixpointEngine().run(cfg, COUNTS, new CountAssignments(), Direction.BACKWARD,
                                                             MergeOp.JOIN);
        assertEquals(Integer.valueOf(2), r.getOutput(cfg.getEntry()));
        assertEquals(Integer.valueOf(2), r.getStateAtEntry(cfg.getUniqueSuccessor(cfg.getEntry())));
    }

    public static void testWideningReachesInfinity() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.forever());
        FixpointResult<Integer> r = new FixpointEngine().run(cfg, COUNTS, new CountAssignments(), Direction.FORWARD,
                                                             MergeOp.JOIN);
        assertTrue(r.isComplete());
        assertEquals(Integer.valueOf(TOP), r.getInput(header(cfg)));
    }

    public static void testNoWideningDoesNotConverge() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.forever());
        FixpointOptions options = new FixpointOptions().setWidening(false).setMaxVisitsPerBlock(20);
        try {
            new FixpointEngine(options).run(cfg, COUNTS, new CountAssignments(), Direction.FORWARD, MergeOp.JOIN);
        } catch (NonConvergenceException e) {
            assertNotNull(e.getPartialResult());
            assertFalse(e.getPartialResult().isComplete());
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testNonMonotoneTransferIsDetected() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.forever());
        TransferFunction<Integer> wraps = new CountAssignments() {
            @Override
            public Integer instruction(Instruction i, Integer in) {
                Integer next = super.instruction(i, in);
                return next > 3 && next != TOP ? 0 : next;
            }
        };
        FixpointOptions options = new FixpointOptions().setWidening(false).setCheckMonotonicity(true);
        try {
            new FixpointEngine(options).run(cfg, COUNTS, wraps, Direction.FORWARD, MergeOp.JOIN);
        } catch (NonMonotonicException e) {
            assertNotNull(e.getMessage());
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testExpiredDeadlineGivesIncompleteResult() throws InterruptedException {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.countdown());
        Deadline deadline = Deadline.afterMillis(1);
        Thread.sleep(20);
        FixpointResult<Integer> r = new FixpointEngine(new FixpointOptions().setDeadline(deadline))
                                        .run(cfg, COUNTS, new CountAssignments(), Direction.FORWARD, MergeOp.JOIN);
        assertFalse(r.isComplete());
    }

    public static void testMeetStartsFromTop() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        FixpointResult<Integer> r = new FixpointEngine().run(cfg, COUNTS, new CountAssignments(), Direction.FORWARD,
                                                             MergeOp.MEET);
        BasicBlock exit = cfg.getExits().iterator().next();
        assertEquals(Integer.valueOf(1), r.getInput(exit));
    }
}
