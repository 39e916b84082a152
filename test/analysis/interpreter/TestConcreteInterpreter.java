package analysis.interpreter;

import ir.ControlFlowGraph;
import ir.SamplePrograms;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import junit.framework.TestCase;
import ast.Expr;
import ast.Program;
import ast.Statement;

/**
 * Concrete runs: traces, bindings, faults and the step limit
 */
public class TestConcreteInterpreter extends TestCase {

    private static Map<String, Long> inputs(Object... nameValue) {
        Map<String, Long> m = new HashMap<>();
        for (int k = 0; k < nameValue.length; k += 2) {
            m.put((String) nameValue[k], ((Number) nameValue[k + 1]).longValue());
        }
        return m;
    }

    public static void testTraceFollowsBranch() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.sign());
        ConcreteInterpreter interpreter = new ConcreteInterpreter();

        ExecutionResult positive = interpreter.run(cfg, inputs(":x", 5));
        assertTrue(positive.isTerminated());
        assertEquals(Long.valueOf(1), positive.getBindings().get(":y"));
        assertEquals(Arrays.asList(0, 1, 2, 4), positive.getTrace());

        ExecutionResult negative = interpreter.run(cfg, inputs(":x", -5));
        assertEquals(Long.valueOf(-1), negative.getBindings().get(":y"));
        assertEquals(Arrays.asList(0, 1, 3, 4), negative.getTrace());
    }

    public static void testLoop() {
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(SamplePrograms.countdown()),
                                                          Collections.<String, Long> emptyMap());
        assertTrue(r.isTerminated());
        assertEquals(Long.valueOf(55), r.getBindings().get(":s"));
        assertEquals(Long.valueOf(0), r.getBindings().get(":i"));
    }

    public static void testInputsAreNotModified() {
        Map<String, Long> in = inputs(":n", 3);
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(SamplePrograms.sumToN()), in);
        assertEquals(Long.valueOf(6), r.getBindings().get(":s"));
        assertEquals(Long.valueOf(3), in.get(":n"));
    }

    public static void testDivisionByZeroIsAFault() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.division());
        ExecutionResult r = new ConcreteInterpreter().run(cfg, inputs(":x", 0));
        assertTrue(r.isFault());
        assertFalse(r.isTerminated());
        assertEquals(FaultKind.DIVISION_BY_ZERO, r.getFault().getKind());
        assertEquals(cfg.getBlockForInstruction(r.getFault().getInstruction().getId()), r.getFault().getBlock());
        assertNull(r.getBindings().get(":y"));
    }

    public static void testEuclideanDivision() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.division());
        assertEquals(Long.valueOf(14), new ConcreteInterpreter().run(cfg, inputs(":x", 7)).getBindings().get(":y"));
        assertEquals(Long.valueOf(-14), new ConcreteInterpreter().run(cfg, inputs(":x", -7)).getBindings().get(":y"));
        Program p = Program.of("neg", Statement.assign(":q", SamplePrograms.e("-100 / 7")),
                               Statement.assign(":r", SamplePrograms.e("-100 % 7")));
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(p), inputs());
        assertEquals(Long.valueOf(-15), r.getBindings().get(":q"));
        assertEquals(Long.valueOf(5), r.getBindings().get(":r"));
    }

    public static void testUndefinedVariable() {
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(SamplePrograms.division()), inputs());
        assertTrue(r.isFault());
        assertEquals(FaultKind.UNDEFINED_VARIABLE, r.getFault().getKind());
    }

    public static void testStepLimitIsNotAFault() {
        InterpreterOptions options = new InterpreterOptions().setMaxSteps(100);
        ExecutionResult r = new ConcreteInterpreter(options).run(SamplePrograms.build(SamplePrograms.forever()),
                                                                 inputs());
        assertTrue(r.isStepLimitReached());
        assertFalse(r.isFault());
        assertFalse(r.isTerminated());
        assertTrue(r.getSteps() <= 100);
        assertTrue(r.getBindings().get(":x") > 10);
    }

    public static void testTurtleDrawsSquare() {
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(SamplePrograms.square()),
                                                          inputs(":len", 100));
        assertTrue(r.isTerminated());
        assertEquals(8, r.getTurtleLog().size());
        assertEquals("forward(100)", r.getTurtleLog().get(0));
        assertEquals("right(90)", r.getTurtleLog().get(1));
        assertEquals(0.0, r.getTurtle().getX(), 1e-6);
        assertEquals(0.0, r.getTurtle().getY(), 1e-6);
    }

    public static void testTurtleGuard() {
        ControlFlowGraph cfg = SamplePrograms.build(SamplePrograms.square());
        ExecutionResult guarded = new ConcreteInterpreter().run(cfg, inputs(":len", 2000));
        assertTrue(guarded.isFault());
        assertEquals(FaultKind.TURTLE_GUARD_VIOLATION, guarded.getFault().getKind());

        InterpreterOptions unguarded = new InterpreterOptions().setTurtleGuard(false);
        assertTrue(new ConcreteInterpreter(unguarded).run(cfg, inputs(":len", 2000)).isTerminated());
    }

    public static void testAndOrEvaluateBothOperands() {
        Program p = Program.of("strict",
                               Statement.ifElse(SamplePrograms.e("false and 1 / :z == 0"),
                                                SamplePrograms.block(Statement.assign(":r", SamplePrograms.e("1"))),
                                                SamplePrograms.block(Statement.assign(":r", SamplePrograms.e("2")))));
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(p), inputs(":z", 0));
        assertTrue(r.isFault());
        assertEquals(FaultKind.DIVISION_BY_ZERO, r.getFault().getKind());
    }

    public static void testDeeplyNestedExpression() throws EvaluationException {
        Expr leftDeep = Expr.var(":x");
        Expr rightDeep = Expr.var(":x");
        for (int k = 0; k < 200000; k++) {
            leftDeep = Expr.add(leftDeep, Expr.constant(1));
            rightDeep = Expr.sub(Expr.constant(1), rightDeep);
        }
        assertEquals(200005L, ExprEvaluator.evalInt(leftDeep, inputs(":x", 5)));
        // an even number of 1 - (...) gives :x back
        assertEquals(5L, ExprEvaluator.evalInt(rightDeep, inputs(":x", 5)));

        Program p = Program.of("deep", Statement.assign(":y", leftDeep), Statement.assign(":z", rightDeep));
        ExecutionResult r = new ConcreteInterpreter().run(SamplePrograms.build(p), inputs(":x", -3));
        assertTrue(r.isTerminated());
        assertEquals(Long.valueOf(199997), r.getBindings().get(":y"));
        assertEquals(Long.valueOf(-3), r.getBindings().get(":z"));
    }
}
