package analysis.profile;

import ir.ControlFlowGraph;
import ir.SamplePrograms;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;
import analysis.interpreter.InterpreterOptions;

public class TestPathProfiler extends TestCase {

    public static void testLoopIsCutAtBackEdges() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.countdown());
        PathProfiler profiler = new PathProfiler(cfg);
        ExecutionResult run = new ConcreteInterpreter().run(cfg, Collections.<String, Long> emptyMap());
        List<Long> paths = profiler.addTrace(run.getTrace(), run.isTerminated());
        // into the loop, nine more trips around it, then out
        assertEquals(11, paths.size());
        assertEquals(3, profiler.getCounts().size());
        assertEquals(9, profiler.getCount(paths.get(1)));
        assertEquals(1, profiler.getCount(paths.get(0)));
        assertEquals(1, profiler.getCount(paths.get(10)));
        assertTrue(profiler.report().startsWith("4 acyclic paths, 3 executed"));
    }

    public static void testRunsAccumulate() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        PathProfiler profiler = new PathProfiler(cfg);
        ConcreteInterpreter interpreter = new ConcreteInterpreter();
        for (long x : new long[] { 1, 2, 3, -1 }) {
            Map<String, Long> inputs = new HashMap<>();
            inputs.put(":x", x);
            profiler.addRun(interpreter.run(cfg, inputs));
        }
        assertEquals(2, profiler.getCounts().size());
        int total = 0;
        for (int c : profiler.getCounts().values()) {
            total += c;
        }
        assertEquals(4, total);
        assertEquals(0, profiler.getCount(7));
    }

    public static void testUnfinishedPathIsDropped() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.forever());
        PathProfiler profiler = new PathProfiler(cfg);
        ExecutionResult run = new ConcreteInterpreter(new InterpreterOptions().setMaxSteps(20))
                                        .run(cfg, Collections.<String, Long> emptyMap());
        assertTrue(run.isStepLimitReached());
        List<Long> paths = profiler.addTrace(run.getTrace(), run.isTerminated());
        int headerVisits = 0;
        for (Integer id : run.getTrace()) {
            if (cfg.getLoopHeaders().contains(cfg.getBlock(id))) {
                headerVisits++;
            }
        }
        assertEquals(headerVisits - 1, paths.size());
    }
}
