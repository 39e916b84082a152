package analysis.coverage;

import ir.ControlFlowGraph;
import ir.SamplePrograms;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import junit.framework.TestCase;
import analysis.interpreter.ConcreteInterpreter;

public class TestCoverageOracle extends TestCase {

    public static void testCoverageAccumulates() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        CoverageOracle oracle = new CoverageOracle(cfg, new ConcreteInterpreter());

        CoverageResult first = oracle.run(Collections.singletonMap(":x", 5L));
        assertEquals(new HashSet<>(Arrays.asList(0, 1, 2, 4)), first.getCoveredBlocks());
        assertEquals(4, first.getNewBlocks());
        assertEquals(0.8, oracle.getCoverageRatio(), 1e-9);

        CoverageResult second = oracle.run(Collections.singletonMap(":x", -5L));
        assertEquals(1, second.getNewBlocks());
        assertEquals(1.0, oracle.getCoverageRatio(), 1e-9);

        assertEquals(0, oracle.run(Collections.singletonMap(":x", 1L)).getNewBlocks());
        assertEquals(3, oracle.getRuns());
        assertEquals(5, oracle.getCumulativeCoverage().size());
    }

    public static void testFaultingRunStillCovers() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.division());
        CoverageOracle oracle = new CoverageOracle(cfg, new ConcreteInterpreter());
        CoverageResult r = oracle.run(Collections.singletonMap(":x", 0L));
        assertTrue(r.isFault());
        assertEquals(2, r.getCoveredBlocks().size());
        assertTrue(oracle.getCoverageRatio() < 1.0);
    }
}
