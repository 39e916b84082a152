package analysis.coverage;

import static ir.SamplePrograms.block;
import static ir.SamplePrograms.e;
import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.SamplePrograms;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import junit.framework.TestCase;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;
import ast.Program;
import ast.Statement;

/**
 * Ochiai ranking of blocks from passing and failing runs
 */
public class TestSuspiciousness extends TestCase {

    public static void testOchiai() {
        assertEquals(0.0, SuspiciousnessRanking.ochiai(0, 0, 0), 0);
        assertEquals(1.0, SuspiciousnessRanking.ochiai(1, 0, 1), 1e-9);
        assertEquals(0.5, SuspiciousnessRanking.ochiai(1, 3, 1), 1e-9);
        assertEquals(0.0, SuspiciousnessRanking.ochiai(0, 4, 2), 0);
    }

    /**
     * Absolute value with the negation missing from the else arm
     */
    public static void testFaultyArmRanksFirst() {
        Program abs = Program.of("abs",
                                 Statement.ifElse(e(":x > 0"),
                                                  block(Statement.assign(":y", e(":x"))),
                                                  block(Statement.assign(":y", e(":x")))));
        ControlFlowGraph cfg = SamplePrograms.build(abs);
        CoverageOracle oracle = new CoverageOracle(cfg, new ConcreteInterpreter());
        Spectrum spectrum = new Spectrum(cfg);
        for (long x : new long[] { 5, 3, -2, -7 }) {
            CoverageResult run = oracle.run(Collections.singletonMap(":x", x));
            ExecutionResult execution = run.getExecution();
            boolean passed = !execution.isFault() && execution.getBindings().get(":y") == Math.abs(x);
            spectrum.addTest(run, passed);
        }
        assertEquals(2, spectrum.getFailedCount());

        SuspiciousnessRanking ranking = new SuspiciousnessRanking(spectrum);
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        BasicBlock elseArm = cfg.getFalseSuccessor(branch);
        BasicBlock thenArm = cfg.getTrueSuccessor(branch);
        assertEquals(1, ranking.getRank(elseArm));
        assertEquals(1.0, ranking.getEntries().get(0).getScore(), 1e-9);
        assertEquals(cfg.getNumberOfBlocks(), ranking.getRank(thenArm));
        assertEquals(cfg.getNumberOfBlocks(), ranking.getEntries().size());
    }

    public static void testUnknownBlockIsRejected() {
        Spectrum spectrum = new Spectrum(SamplePrograms.build(SamplePrograms.sign()));
        try {
            spectrum.addTest(new HashSet<>(Arrays.asList(0, 99)), true);
        } catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
