package analysis.profile;

import static ir.SamplePrograms.block;
import static ir.SamplePrograms.e;
import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.SamplePrograms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import junit.framework.TestCase;
import analysis.dataflow.AnalysisException;
import ast.Program;
import ast.Statement;

/**
 * Path counts and numbering of acyclic paths
 */
public class TestBallLarus extends TestCase {

    private static BallLarusNumbering number(Program p) {
        return new BallLarusNumbering(SamplePrograms.build(p));
    }

    public static void testPathCounts() {
        assertEquals(1, number(SamplePrograms.straightLine()).getNumPaths());
        assertEquals(2, number(SamplePrograms.sign()).getNumPaths());
        assertEquals(4, number(SamplePrograms.twoDiamonds()).getNumPaths());
        // from the entry or from the loop header, then through the body or out of the loop
        assertEquals(4, number(SamplePrograms.countdown()).getNumPaths());
    }

    public static void testNumbersIdentifyPaths() {
        BallLarusNumbering n = number(SamplePrograms.twoDiamonds());
        Set<List<BasicBlock>> paths = new HashSet<>();
        for (long k = 0; k < n.getNumPaths(); k++) {
            List<BasicBlock> path = n.regeneratePath(k);
            assertEquals(k, n.getPathNumber(path));
            assertEquals(n.getGraph().getEntry(), path.get(0));
            assertTrue(path.get(path.size() - 1).isExit());
            paths.add(path);
        }
        assertEquals(4, paths.size());
    }

    public static void testLoopPaths() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.countdown());
        BallLarusNumbering n = new BallLarusNumbering(cfg);
        BasicBlock init = cfg.getUniqueSuccessor(cfg.getEntry());
        BasicBlock header = cfg.getUniqueSuccessor(init);
        BasicBlock body = cfg.getTrueSuccessor(header);
        BasicBlock exit = cfg.getFalseSuccessor(header);

        Set<Long> numbers = new HashSet<>();
        numbers.add(n.getPathNumber(Arrays.asList(cfg.getEntry(), init, header, body)));
        numbers.add(n.getPathNumber(Arrays.asList(cfg.getEntry(), init, header, exit)));
        numbers.add(n.getPathNumber(Arrays.asList(header, body)));
        numbers.add(n.getPathNumber(Arrays.asList(header, exit)));
        assertEquals(new HashSet<>(Arrays.asList(0L, 1L, 2L, 3L)), numbers);

        assertEquals(Arrays.asList(header, body), n.regeneratePath(n.getPathNumber(Arrays.asList(header, body))));
        Edge back = cfg.getBackEdges().iterator().next();
        try {
            n.getIncrement(back);
        } catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testNotAPath() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        BallLarusNumbering n = new BallLarusNumbering(cfg);
        BasicBlock exit = cfg.getExits().iterator().next();
        try {
            n.getPathNumber(Arrays.asList(cfg.getEntry(), exit));
        } catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testOutOfRange() {
        BallLarusNumbering n = number(SamplePrograms.sign());
        try {
            n.regeneratePath(2);
        } catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testTooManyPaths() {
        List<Statement> statements = new ArrayList<>();
        for (int k = 0; k < 70; k++) {
            statements.add(Statement.ifThen(e(":x > " + k), block(Statement.assign(":y", e(":y + 1")))));
        }
        try {
            new BallLarusNumbering(SamplePrograms.build(new Program("wide", statements)));
        } catch (AnalysisException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
