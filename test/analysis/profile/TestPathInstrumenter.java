package analysis.profile;

import static ir.SamplePrograms.block;
import static ir.SamplePrograms.e;
import ir.ControlFlowGraph;
import ir.Instruction;
import ir.SamplePrograms;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import junit.framework.TestCase;
import analysis.interpreter.AssignmentListener;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;
import ast.Program;
import ast.Statement;

/**
 * Profiles computed by the instrumented graph must match the ones computed from traces
 */
public class TestPathInstrumenter extends TestCase {

    private static Map<String, Long> withoutRegisters(Map<String, Long> bindings) {
        Map<String, Long> result = new LinkedHashMap<>(bindings);
        result.remove(PathInstrumenter.PATH_REGISTER);
        result.remove(PathInstrumenter.PATH_RECORD);
        return result;
    }

    /**
     * Run both profilers on the same inputs and compare the counts
     */
    private static PathProfiler assertSameProfile(Program p, String input, long... values) {
        ControlFlowGraph cfg = SamplePrograms.build(p);
        PathProfiler fromTraces = new PathProfiler(cfg);
        PathProfiler fromRegister = new PathProfiler(fromTraces.getNumbering());
        ControlFlowGraph instrumented = new PathInstrumenter(fromRegister.getNumbering()).instrument();
        ConcreteInterpreter interpreter = new ConcreteInterpreter();
        for (long v : values) {
            Map<String, Long> inputs = Collections.singletonMap(input, v);
            ExecutionResult plain = interpreter.run(cfg, inputs);
            fromTraces.addRun(plain);
            ExecutionResult run = interpreter.run(instrumented, inputs, fromRegister.recorder());
            assertEquals(input + " = " + v, plain.isFault(), run.isFault());
            assertEquals(input + " = " + v, plain.getBindings(), withoutRegisters(run.getBindings()));
        }
        assertEquals(fromTraces.getCounts(), fromRegister.getCounts());
        return fromRegister;
    }

    public static void testBranches() {
        assertSameProfile(SamplePrograms.sign(), ":x", -5, 0, 1, 2, 9);
        assertEquals(4, assertSameProfile(SamplePrograms.twoDiamonds(), ":x", -20, 7, 9, 13, 15, 40).getCounts()
                                        .size());
    }

    public static void testLoops() {
        assertSameProfile(SamplePrograms.countdown(), ":unused", 0);
        assertSameProfile(SamplePrograms.sumToN(), ":n", -1, 0, 1, 3, 8);
    }

    public static void testNestedLoopsWithBranch() {
        Program p = Program.of("nested",
                               Statement.assign(":s", e("0")),
                               Statement.assign(":i", e(":n")),
                               Statement.whileLoop(e(":i > 0"),
                                                   block(Statement.assign(":j", e(":i")),
                                                         Statement.whileLoop(e(":j > 0"),
                                                                             block(Statement.ifElse(e(":j % 2 == 0"),
                                                                                                    block(Statement.assign(":s", e(":s + 1"))),
                                                                                                    block(Statement.assign(":s", e(":s + 2")))),
                                                                                   Statement.assign(":j", e(":j - 1")))),
                                                         Statement.assign(":i", e(":i - 1")))));
        PathProfiler profile = assertSameProfile(p, ":n", 0, 1, 2, 5);
        assertTrue(profile.getCounts().size() > 4);
    }

    public static void testFaultingRunRecordsCompletedPathsOnly() {
        Program p = Program.of("divideInLoop",
                               Statement.assign(":i", e("3")),
                               Statement.whileLoop(e(":i > 0"),
                                                   block(Statement.assign(":y", e("10 / (:x - :i)")),
                                                         Statement.assign(":i", e(":i - 1")))));
        // :x = 2 divides by zero on the second trip around the loop
        assertSameProfile(p, ":x", 2, 7);
    }

    public static void testChordsComplementSpanningTree() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.twoDiamonds());
        BallLarusNumbering numbering = new BallLarusNumbering(cfg);
        PathInstrumenter instrumenter = new PathInstrumenter(numbering);
        // the tree spans the blocks and the virtual exit, one of its edges is exit->entry
        assertEquals(numbering.getAcyclicEdges().size() - cfg.getNumberOfBlocks() + 1, instrumenter.getChordCount());
    }

    public static void testStraightLineNeedsNoUpdates() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.straightLine());
        ControlFlowGraph instrumented = new PathInstrumenter(new BallLarusNumbering(cfg)).instrument();
        assertEquals(cfg.getNumberOfBlocks(), instrumented.getNumberOfBlocks());
    }

    public static void testLoopBodyIsOnTree() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.countdown());
        ControlFlowGraph instrumented = new PathInstrumenter(new BallLarusNumbering(cfg)).instrument();
        final int[] registerWrites = { 0 };
        AssignmentListener counter = new AssignmentListener() {
            @Override
            public void assigned(Instruction i, long value) {
                if (PathInstrumenter.PATH_REGISTER.equals(i.getTarget())) {
                    registerWrites[0]++;
                }
            }
        };
        Map<String, Long> none = Collections.emptyMap();
        ExecutionResult plain = new ConcreteInterpreter().run(cfg, none);
        new ConcreteInterpreter().run(instrumented, none, counter);
        // one restart per trip around the loop, fewer writes than edges taken
        assertTrue(registerWrites[0] + " writes", registerWrites[0] >= 11);
        assertTrue(registerWrites[0] + " writes", registerWrites[0] < plain.getTrace().size() - 1);
    }
}
