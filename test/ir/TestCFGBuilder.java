package ir;

import static ir.SamplePrograms.block;
import static ir.SamplePrograms.build;
import static ir.SamplePrograms.e;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.ExecutionResult;
import ast.Expr;
import ast.MalformedProgramException;
import ast.Program;
import ast.Statement;
import ast.TurtleOp;

/**
 * Shapes of the graphs produced by {@link CFGBuilder}
 */
public class TestCFGBuilder extends TestCase {

    public static void testStraightLineSharesOneBlock() {
        ControlFlowGraph cfg = build(SamplePrograms.straightLine());
        assertEquals(3, cfg.getNumberOfBlocks());
        BasicBlock entry = cfg.getEntry();
        assertTrue(entry.isEmpty());
        BasicBlock body = cfg.getUniqueSuccessor(entry);
        assertEquals(2, body.getInstructions().size());
        BasicBlock exit = cfg.getUniqueSuccessor(body);
        assertTrue(exit.isExit());
        assertEquals(Collections.singleton(exit), cfg.getExits());
        assertEquals(InstructionType.RETURN, exit.getTerminator().getType());
    }

    public static void testEmptyProgram() {
        ControlFlowGraph cfg = build(new Program("empty", SamplePrograms.none()));
        assertEquals(2, cfg.getNumberOfBlocks());
        assertTrue(cfg.getUniqueSuccessor(cfg.getEntry()).isExit());
    }

    public static void testIfElseDiamond() {
        ControlFlowGraph cfg = build(SamplePrograms.sign());
        assertEquals(5, cfg.getNumberOfBlocks());
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        assertTrue(branch.endsInBranch());
        BasicBlock thenBlock = cfg.getTrueSuccessor(branch);
        BasicBlock elseBlock = cfg.getFalseSuccessor(branch);
        assertNotSame(thenBlock, elseBlock);
        assertEquals(cfg.getUniqueSuccessor(thenBlock), cfg.getUniqueSuccessor(elseBlock));
        assertTrue(cfg.getUniqueSuccessor(thenBlock).isExit());
        assertTrue(cfg.getBackEdges().isEmpty());
        assertTrue(cfg.getLoopHeaders().isEmpty());
    }

    public static void testIfWithoutElse() {
        Program p = Program.of("ifThen", Statement.ifThen(e(":x > 0"), block(Statement.assign(":y", e("1")))));
        ControlFlowGraph cfg = build(p);
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        BasicBlock join = cfg.getFalseSuccessor(branch);
        assertEquals(join, cfg.getUniqueSuccessor(cfg.getTrueSuccessor(branch)));
    }

    public static void testEmptyArmsStillHaveBothEdges() {
        Program p = Program.of("emptyIf", Statement.ifElse(e(":x > 0"), SamplePrograms.none(), SamplePrograms.none()));
        ControlFlowGraph cfg = build(p);
        BasicBlock branch = cfg.getUniqueSuccessor(cfg.getEntry());
        assertEquals(2, cfg.getOutgoingEdges(branch).size());
        assertEquals(cfg.getTrueSuccessor(branch), cfg.getFalseSuccessor(branch));
    }

    public static void testWhileLoop() {
        ControlFlowGraph cfg = build(SamplePrograms.countdown());
        assertEquals(5, cfg.getNumberOfBlocks());
        BasicBlock init = cfg.getUniqueSuccessor(cfg.getEntry());
        BasicBlock header = cfg.getUniqueSuccessor(init);
        assertTrue(header.endsInBranch());
        BasicBlock body = cfg.getTrueSuccessor(header);
        assertEquals(Collections.singleton(header), cfg.getLoopHeaders());
        assertEquals(1, cfg.getBackEdges().size());
        Edge back = cfg.getBackEdges().iterator().next();
        assertEquals(body, back.getSource());
        assertEquals(header, back.getTarget());
        assertEquals(EdgeKind.BACK_EDGE, back.getKind());
        assertTrue(cfg.isBackEdge(back));
        assertTrue(cfg.getFalseSuccessor(header).isExit());
    }

    public static void testRepeatIntroducesCounter() {
        ControlFlowGraph cfg = build(SamplePrograms.square());
        BasicBlock init = cfg.getUniqueSuccessor(cfg.getEntry());
        Instruction counterInit = init.getInstructions().get(0);
        assertEquals(InstructionType.ASSIGN, counterInit.getType());
        assertTrue(counterInit.getTarget().startsWith(CFGBuilder.REPEAT_COUNTER_PREFIX));
        assertEquals(Expr.constant(4), counterInit.getExpr());
        BasicBlock header = cfg.getUniqueSuccessor(init);
        assertEquals(Expr.gt(Expr.var(counterInit.getTarget()), Expr.constant(0)), header.getTerminator().getExpr());
        BasicBlock body = cfg.getTrueSuccessor(header);
        List<Instruction> bodyInstructions = body.getInstructions();
        assertEquals(InstructionType.CALL, bodyInstructions.get(0).getType());
        assertEquals(TurtleOp.FORWARD, bodyInstructions.get(0).getTurtleOp());
        Instruction decrement = bodyInstructions.get(bodyInstructions.size() - 2);
        assertEquals(counterInit.getTarget(), decrement.getTarget());
        assertEquals(InstructionType.JUMP, body.getTerminator().getType());
    }

    public static void testNestedRepeatsUseDistinctCounters() {
        Program p = Program.of("nested",
                               Statement.repeat(e("2"), block(Statement.repeat(e("3"), block(Statement.pause())))));
        ControlFlowGraph cfg = build(p);
        assertTrue(cfg.getVariables().contains(CFGBuilder.REPEAT_COUNTER_PREFIX + "0"));
        assertTrue(cfg.getVariables().contains(CFGBuilder.REPEAT_COUNTER_PREFIX + "1"));
        assertEquals(2, cfg.getLoopHeaders().size());
    }

    public static void testInstructionIdsAreUnique() {
        ControlFlowGraph cfg = build(SamplePrograms.twoDiamonds());
        List<Integer> ids = new ArrayList<>();
        for (BasicBlock bb : cfg) {
            for (Instruction i : bb.getInstructions()) {
                assertFalse(ids.contains(i.getId()));
                ids.add(i.getId());
                assertEquals(bb, cfg.getBlockForInstruction(i.getId()));
            }
        }
    }

    public static void testReversePostorderStartsAtEntry() {
        ControlFlowGraph cfg = build(SamplePrograms.countdown());
        assertEquals(cfg.getEntry(), cfg.getReversePostorder().get(0));
        assertEquals(cfg.getEntry(), cfg.getPostorder().get(cfg.getNumberOfBlocks() - 1));
    }

    public static void testDeepNestingDoesNotOverflow() {
        List<Statement> body = block(Statement.assign(":x", e(":x + 1")));
        for (int k = 0; k < 2000; k++) {
            body = block(Statement.ifThen(e(":x > " + k), body));
        }
        ControlFlowGraph cfg = build(new Program("deep", body));
        assertTrue(cfg.getNumberOfBlocks() > 2000);
    }

    public static void testBooleanAssignmentIsMalformed() {
        try {
            build(Program.of("bad", Statement.assign(":x", e(":y > 1"))));
        } catch (MalformedProgramException e) {
            assertNotNull(e.getOffendingStatement());
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testIntegerGuardIsMalformed() {
        try {
            build(Program.of("bad", Statement.whileLoop(e(":x + 1"), SamplePrograms.none())));
        } catch (MalformedProgramException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testTurtleArityIsChecked() {
        try {
            build(Program.of("bad", Statement.turtle(TurtleOp.GOTO, e("1"))));
        } catch (MalformedProgramException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testVariableNamedLikeCounter() {
        Program p = Program.of("repeated",
                               Statement.assign(":repeat0", e("5")),
                               Statement.assign(":repeated", e("1")),
                               Statement.repeat(e("2"), block(Statement.assign(":repeat0", e(":repeat0 + 1")))));
        ControlFlowGraph cfg = build(p);
        assertTrue(cfg.getVariables().contains(":repeat0"));
        assertTrue(cfg.getVariables().contains(CFGBuilder.REPEAT_COUNTER_PREFIX + "0"));
        ExecutionResult run = new ConcreteInterpreter().run(cfg, Collections.<String, Long> emptyMap());
        assertEquals(Long.valueOf(7), run.getBindings().get(":repeat0"));
        assertEquals(Long.valueOf(1), run.getBindings().get(":repeated"));
    }

    public static void testGeneratedNameIsReserved() {
        try {
            build(Program.of("bad", Statement.assign(CFGBuilder.REPEAT_COUNTER_PREFIX + "7", e("1"))));
        } catch (MalformedProgramException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
