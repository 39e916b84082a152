package analysis.interpreter;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Instruction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import util.Logger;
import ast.Expr;

/**
 * Executes a control flow graph on concrete integer inputs. Execution starts at the entry and stops at a RETURN, at a
 * runtime fault, or when the step limit is reached. Faults are reported in the {@link ExecutionResult}, they never
 * propagate as exceptions, so callers running many inputs can carry on after a faulting one.
 */
public class ConcreteInterpreter {

    private final InterpreterOptions options;
    /**
     * Higher means more console output
     */
    private int outputLevel = 0;

    public ConcreteInterpreter() {
        this(new InterpreterOptions());
    }

    public ConcreteInterpreter(InterpreterOptions options) {
        this.options = options;
    }

    /**
     * Run the program
     *
     * @param cfg
     *            program to run
     * @param inputs
     *            initial variable bindings, not modified
     * @return trace, final bindings and fault status
     */
    public ExecutionResult run(ControlFlowGraph cfg, Map<String, Long> inputs) {
        return run(cfg, inputs, null);
    }

    /**
     * Run the program, reporting every assignment
     *
     * @param cfg
     *            program to run
     * @param inputs
     *            initial variable bindings, not modified
     * @param listener
     *            notified after each assignment, may be null
     * @return trace, final bindings and fault status
     */
    public ExecutionResult run(ControlFlowGraph cfg, Map<String, Long> inputs, AssignmentListener listener) {
        Map<String, Long> env = new LinkedHashMap<>(inputs);
        List<Integer> trace = new ArrayList<>();
        List<String> turtleLog = new ArrayList<>();
        TurtleState turtle = TurtleState.INITIAL;
        int steps = 0;

        BasicBlock current = cfg.getEntry();
        while (true) {
            trace.add(current.getId());
            if (outputLevel >= 3) {
                Logger.println("EXECUTING " + current + " " + env);
            }
            if (current.isEmpty()) {
                // empty blocks still count, otherwise a cycle of them would never stop
                steps++;
            }
            BasicBlock next = null;
            for (Instruction i : current.getInstructions()) {
                if (steps >= options.getMaxSteps()) {
                    return new ExecutionResult(trace, env, turtleLog, turtle, null, true, steps);
                }
                steps++;
                try {
                    switch (i.getType()) {
                    case ASSIGN:
                        long value = ExprEvaluator.evalInt(i.getExpr(), env);
                        env.put(i.getTarget(), value);
                        if (listener != null) {
                            listener.assigned(i, value);
                        }
                        break;
                    case CALL:
                        turtle = call(i, env, turtle, turtleLog);
                        break;
                    case BRANCH:
                        boolean taken = ExprEvaluator.evalBool(i.getExpr(), env);
                        next = taken ? cfg.getTrueSuccessor(current) : cfg.getFalseSuccessor(current);
                        break;
                    case JUMP:
                        next = cfg.getUniqueSuccessor(current);
                        break;
                    case RETURN:
                        return new ExecutionResult(trace, env, turtleLog, turtle, null, false, steps);
                    default:
                        throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, "unknown instruction type "
                                                        + i.getType());
                    }
                } catch (EvaluationException e) {
                    RuntimeFault fault = new RuntimeFault(e.getKind(), i, current, e.getMessage());
                    if (outputLevel >= 1) {
                        Logger.println("FAULT " + fault);
                    }
                    return new ExecutionResult(trace, env, turtleLog, turtle, fault, false, steps);
                }
            }
            if (next == null) {
                if (steps >= options.getMaxSteps()) {
                    return new ExecutionResult(trace, env, turtleLog, turtle, null, true, steps);
                }
                next = cfg.getUniqueSuccessor(current);
            }
            current = next;
        }
    }

    /**
     * Execute a turtle command
     */
    private TurtleState call(Instruction i, Map<String, Long> env, TurtleState turtle, List<String> turtleLog)
                                    throws EvaluationException {
        List<Expr> args = i.getArguments();
        if (args.size() != i.getTurtleOp().getArity()) {
            throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, i.getTurtleOp().getCommandName()
                                            + " called with " + args.size() + " arguments");
        }
        long[] values = new long[args.size()];
        StringBuilder sb = new StringBuilder(i.getTurtleOp().getCommandName()).append("(");
        for (int k = 0; k < values.length; k++) {
            values[k] = ExprEvaluator.evalInt(args.get(k), env);
            sb.append(k > 0 ? ", " : "").append(values[k]);
        }
        turtleLog.add(sb.append(")").toString());

        TurtleState next;
        switch (i.getTurtleOp()) {
        case FORWARD:
            next = turtle.move(values[0]);
            break;
        case BACKWARD:
            next = turtle.move(-values[0]);
            break;
        case LEFT:
            next = turtle.turn(values[0]);
            break;
        case RIGHT:
            next = turtle.turn(-values[0]);
            break;
        case PEN_UP:
            next = turtle.setPen(false);
            break;
        case PEN_DOWN:
            next = turtle.setPen(true);
            break;
        case GOTO:
            next = turtle.moveTo(values[0], values[1]);
            break;
        case PAUSE:
            next = turtle;
            break;
        default:
            throw new EvaluationException(FaultKind.UNSUPPORTED_OPERATION, "unknown turtle command "
                                            + i.getTurtleOp());
        }
        if (options.isTurtleGuard() && !next.isWithin(options.getCanvasHalfWidth())) {
            throw new EvaluationException(FaultKind.TURTLE_GUARD_VIOLATION, "turtle left the canvas at " + next);
        }
        return next;
    }

    /**
     * Set the level of console output, higher means more output
     *
     * @param outputLevel
     *            new output level
     */
    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }
}
