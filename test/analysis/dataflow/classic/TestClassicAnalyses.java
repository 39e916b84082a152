package analysis.dataflow.classic;

import static ir.SamplePrograms.block;
import static ir.SamplePrograms.build;
import static ir.SamplePrograms.e;
import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Instruction;
import ir.SamplePrograms;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import junit.framework.TestCase;
import analysis.dataflow.FixpointEngine;
import analysis.dataflow.FixpointResult;
import ast.Expr;
import ast.Program;
import ast.Statement;

/**
 * Live variables, reaching definitions, available expressions and definite assignment on small programs
 */
public class TestClassicAnalyses extends TestCase {

    private static Set<String> vars(String... names) {
        return new HashSet<>(Arrays.asList(names));
    }

    private static BasicBlock exit(ControlFlowGraph cfg) {
        return cfg.getExits().iterator().next();
    }

    public static void testLivenessInLoop() {
        ControlFlowGraph cfg = build(SamplePrograms.countdown());
        FixpointResult<Set<String>> r = new LiveVariableAnalysis(vars(":s")).analyze(cfg, new FixpointEngine());
        assertTrue(r.isComplete());
        BasicBlock header = cfg.getLoopHeaders().iterator().next();
        assertEquals(vars(":i", ":s"), r.getStateAtEntry(header));
        assertEquals(vars(":s"), r.getStateAtEntry(exit(cfg)));
        assertEquals(Collections.<String> emptySet(), r.getStateAtEntry(cfg.getEntry()));
    }

    public static void testLiveInputs() {
        ControlFlowGraph cfg = build(SamplePrograms.sumToN());
        FixpointResult<Set<String>> r = new LiveVariableAnalysis().analyze(cfg, new FixpointEngine());
        assertEquals(vars(":n"), r.getStateAtEntry(cfg.getEntry()));
    }

    public static void testLiveAfterInstruction() {
        ControlFlowGraph cfg = build(SamplePrograms.straightLine());
        LiveVariableAnalysis live = new LiveVariableAnalysis();
        FixpointResult<Set<String>> r = live.analyze(cfg, new FixpointEngine());
        BasicBlock body = cfg.getUniqueSuccessor(cfg.getEntry());
        Instruction first = body.getInstructions().get(0);
        Instruction second = body.getInstructions().get(1);
        assertEquals(vars(":x"), live.liveAfter(r, body, first));
        assertTrue(live.liveAfter(r, body, second).isEmpty());
        try {
            live.liveAfter(r, cfg.getEntry(), first);
        } catch (IllegalArgumentException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testReachingDefinitionsThroughLoop() {
        ControlFlowGraph cfg = build(SamplePrograms.countdown());
        Set<Integer> assignments = new LinkedHashSet<>();
        for (BasicBlock bb : cfg) {
            for (Instruction i : bb.getInstructions()) {
                if (i.getDef() != null) {
                    assignments.add(i.getId());
                }
            }
        }
        assertEquals(4, assignments.size());
        FixpointResult<Set<Integer>> r = new ReachingDefinitionsAnalysis(cfg).analyze(cfg, new FixpointEngine());
        BasicBlock header = cfg.getLoopHeaders().iterator().next();
        assertEquals(assignments, r.getStateAtEntry(header));
        assertEquals(assignments, r.getStateAtEntry(exit(cfg)));
        assertTrue(r.getStateAtEntry(cfg.getEntry()).isEmpty());
    }

    public static void testReachingDefinitionsKill() {
        ControlFlowGraph cfg = build(SamplePrograms.foldable());
        FixpointResult<Set<Integer>> r = new ReachingDefinitionsAnalysis(cfg).analyze(cfg, new FixpointEngine());
        BasicBlock body = cfg.getUniqueSuccessor(cfg.getEntry());
        Instruction firstT = body.getInstructions().get(2);
        Instruction secondT = body.getInstructions().get(3);
        assertEquals(":t", firstT.getDef());
        Set<Integer> out = r.getStateAtExit(body);
        assertFalse(out.contains(firstT.getId()));
        assertTrue(out.contains(secondT.getId()));
    }

    public static void testAvailableExpressions() {
        Program p = Program.of("avail",
                               Statement.assign(":a", e(":x + 1")),
                               Statement.ifElse(e(":x > 0"),
                                                block(Statement.assign(":b", e(":x * 2"))),
                                                block(Statement.assign(":b", e(":x * 2")),
                                                      Statement.assign(":x", e("5")))));
        ControlFlowGraph cfg = build(p);
        FixpointResult<Set<Expr>> r = new AvailableExpressionsAnalysis().analyze(cfg, new FixpointEngine());
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        assertEquals(Collections.singleton(e(":x + 1")), r.getStateAtEntry(cfg.getTrueSuccessor(branch)));
        assertTrue(r.getStateAtEntry(exit(cfg)).isEmpty());
        Set<Expr> thenExit = new HashSet<>(Arrays.asList(e(":x + 1"), e(":x * 2")));
        assertEquals(thenExit, r.getStateAtExit(cfg.getTrueSuccessor(branch)));
        assertTrue(r.getStateAtExit(cfg.getFalseSuccessor(branch)).isEmpty());
    }

    public static void testAvailableInLoopHeader() {
        ControlFlowGraph cfg = build(SamplePrograms.countdown());
        FixpointResult<Set<Expr>> r = new AvailableExpressionsAnalysis().analyze(cfg, new FixpointEngine());
        BasicBlock header = cfg.getLoopHeaders().iterator().next();
        assertTrue(r.getStateAtEntry(header).isEmpty());
    }

    public static void testDefiniteAssignmentMeetsAtJoin() {
        Program p = Program.of("partial",
                               Statement.ifElse(e(":c > 0"),
                                                block(Statement.assign(":u", e("1")), Statement.assign(":v", e("1"))),
                                                block(Statement.assign(":u", e("2")))));
        ControlFlowGraph cfg = build(p);
        FixpointResult<Set<String>> r = new DefiniteAssignmentAnalysis().analyze(cfg, new FixpointEngine());
        assertTrue(r.getStateAtEntry(cfg.getEntry()).isEmpty());
        assertEquals(vars(":u"), r.getStateAtEntry(exit(cfg)));
    }

    public static void testDefiniteAssignmentInLoop() {
        ControlFlowGraph cfg = build(SamplePrograms.sumToN());
        FixpointResult<Set<String>> r = new DefiniteAssignmentAnalysis().analyze(cfg, new FixpointEngine());
        BasicBlock header = cfg.getLoopHeaders().iterator().next();
        // :n is only assigned inside the loop
        assertEquals(vars(":s"), r.getStateAtEntry(header));
        assertEquals(vars(":s"), r.getStateAtEntry(exit(cfg)));
    }

    public static void testAssignedBeforeInstruction() {
        ControlFlowGraph cfg = build(SamplePrograms.straightLine());
        DefiniteAssignmentAnalysis da = new DefiniteAssignmentAnalysis();
        FixpointResult<Set<String>> r = da.analyze(cfg, new FixpointEngine());
        BasicBlock body = cfg.getUniqueSuccessor(cfg.getEntry());
        assertTrue(da.assignedBefore(r, body, body.getInstructions().get(0)).isEmpty());
        assertEquals(vars(":x"), da.assignedBefore(r, body, body.getInstructions().get(1)));
    }
}
