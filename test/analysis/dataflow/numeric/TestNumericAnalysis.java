package analysis.dataflow.numeric;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.SamplePrograms;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeSet;

import junit.framework.TestCase;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointOptions;
import analysis.dataflow.FixpointResult;
import analysis.dataflow.NonConvergenceException;
import analysis.dataflow.util.AbstractState;
import analysis.dataflow.util.AbstractValue;

/**
 * Abstract interpretation of whole programs
 */
public class TestNumericAnalysis extends TestCase {

    private static final double INF = Double.POSITIVE_INFINITY;

    private static <V extends AbstractValue<V>> Map<String, V> exitValues(NumericDomain<V> domain, ControlFlowGraph cfg) {
        NumericAnalysis<V> analysis = new NumericAnalysis<>(domain);
        FixpointResult<AbstractState<V>> r = analysis.analyze(cfg, new FixpointEngine());
        assertTrue(r.isComplete());
        return analysis.getExitValues(cfg, r);
    }

    public static void testBranchesJoinAtExit() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        assertEquals(Interval.of(-1, 1), exitValues(new IntervalDomain(), cfg).get(":y"));
        ConstantSetValue y = exitValues(new ConstantSetDomain(), cfg).get(":y");
        assertEquals(new TreeSet<>(Arrays.asList(-1L, 1L)), y.getElements());
        SignValue sign = exitValues(new SignDomain(), cfg).get(":y");
        assertFalse(sign.mayBeZero());
        assertEquals(ConstantValue.TOP, exitValues(new ConstantPropagationDomain(), cfg).get(":y"));
    }

    public static void testBranchRefinesInput() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        NumericAnalysis<Interval> analysis = new NumericAnalysis<>(new IntervalDomain());
        FixpointResult<AbstractState<Interval>> r = analysis.analyze(cfg, new FixpointEngine());
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        assertEquals(Interval.of(1, INF), r.getStateAtEntry(cfg.getTrueSuccessor(branch)).get(":x"));
        assertEquals(Interval.of(-INF, 0), r.getStateAtEntry(cfg.getFalseSuccessor(branch)).get(":x"));
    }

    public static void testWideningThenNarrowing() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.countdown());
        Map<String, Interval> exit = exitValues(new IntervalDomain(), cfg);
        assertEquals(Interval.constant(0), exit.get(":i"));
        assertEquals(Interval.of(0, INF), exit.get(":s"));

        NumericAnalysis<Interval> analysis = new NumericAnalysis<>(new IntervalDomain());
        FixpointResult<AbstractState<Interval>> r = analysis.analyze(cfg, new FixpointEngine());
        BasicBlock header = cfg.getLoopHeaders().iterator().next();
        assertEquals(Interval.of(0, 10), r.getStateAtEntry(header).get(":i"));
    }

    public static void testInfiniteLoopIsUnbounded() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.forever());
        NumericAnalysis<Interval> analysis = new NumericAnalysis<>(new IntervalDomain());
        FixpointResult<AbstractState<Interval>> r = analysis.analyze(cfg, new FixpointEngine());
        BasicBlock header = cfg.getLoopHeaders().iterator().next();
        assertEquals(Interval.of(0, INF), r.getStateAtEntry(header).get(":x"));
        BasicBlock exit = cfg.getExits().iterator().next();
        assertTrue(r.getStateAtEntry(exit).isUnreachable());
    }

    public static void testIntervalsNeedWidening() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.forever());
        FixpointEngine engine = new FixpointEngine(new FixpointOptions().setWidening(false).setMaxVisitsPerBlock(50));
        try {
            new NumericAnalysis<>(new IntervalDomain()).analyze(cfg, engine);
        } catch (NonConvergenceException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testConstantSetOverflowsToTop() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.countdown());
        Map<String, ConstantSetValue> exit = exitValues(new ConstantSetDomain(), cfg);
        assertTrue(exit.get(":s").isTop());
    }

    public static void testDivisionByUnknown() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.division());
        assertEquals(Interval.of(-100, 100), exitValues(new IntervalDomain(), cfg).get(":y"));
    }

    public static void testConstantsFold() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.foldable());
        Map<String, ConstantValue> exit = exitValues(new ConstantPropagationDomain(), cfg);
        assertEquals(ConstantValue.of(5), exit.get(":a"));
        assertEquals(ConstantValue.of(10), exit.get(":b"));
        assertEquals(ConstantValue.TOP, exit.get(":r"));
    }

    public static void testInfeasibleBranchIsUnreachable() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.foldable());
        NumericAnalysis<ConstantValue> analysis = new NumericAnalysis<>(new ConstantPropagationDomain());
        FixpointResult<AbstractState<ConstantValue>> r = analysis.analyze(cfg, new FixpointEngine());
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        assertTrue(r.getStateAtEntry(cfg.getFalseSuccessor(branch)).isUnreachable());
        assertFalse(r.getStateAtEntry(cfg.getTrueSuccessor(branch)).isUnreachable());
    }
}
