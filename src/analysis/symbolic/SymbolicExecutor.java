package analysis.symbolic;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Instruction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.Deadline;
import util.Logger;
import analysis.interpreter.ConcreteInterpreter;
import analysis.interpreter.EvaluationException;
import analysis.interpreter.ExecutionResult;
import analysis.interpreter.ExprEvaluator;
import analysis.interpreter.FaultKind;
import analysis.optimizer.ExprSimplifier;
import ast.Expr;
import ast.ExprKind;

/**
 * Path-sensitive symbolic execution of a CFG. Variables hold expressions over input symbols; every branch whose guard
 * depends on the inputs forks the state and the solver decides which sides are feasible. Each feasible path that ends
 * (at an exit or in a division by zero) produces a {@link TestCase} whose inputs drive the concrete interpreter down
 * the same blocks.
 * <p>
 * A division or remainder by a value that is not a known constant forks a path where the divisor is zero, which ends
 * there and expects a fault, from a path where it is not. A move that may take the turtle off the canvas forks the
 * same way. Loops are cut off by bounding how many times a path may enter each loop header.
 * <p>
 * The turtle position is tracked as long as it moves along the axes (see {@link SymbolicTurtle}). Every test case is
 * replayed on the concrete interpreter; if the run leaves the explored path, which can only happen after the position
 * was lost, the test case records the run's trace and fault and the result is flagged incomplete.
 */
public class SymbolicExecutor {

    private final ExplorationOptions options;
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    public SymbolicExecutor() {
        this(new ExplorationOptions());
    }

    public SymbolicExecutor(ExplorationOptions options) {
        this.options = options;
    }

    /**
     * Explore the paths of a CFG
     *
     * @param cfg
     *            graph to explore
     * @param initialSymbolicBindings
     *            integer expressions over symbols giving variables their initial values, variables not bound here get
     *            a fresh symbol named after the variable when they are first read
     * @param pathBound
     *            number of times a path may go around any loop, i.e. enter a loop header at most pathBound + 1 times
     * @param timeBudgetMillis
     *            time after which exploration stops and reports what it has, non-positive for none
     * @param solver
     *            decision procedure for path conditions
     * @return test cases, flagged incomplete if some path may have been missed
     */
    public ExplorationResult explore(ControlFlowGraph cfg, Map<String, Expr> initialSymbolicBindings, int pathBound,
                                     long timeBudgetMillis, ConstraintSolver solver) {
        if (pathBound < 0) {
            throw new IllegalArgumentException("Negative path bound " + pathBound);
        }
        Map<String, Expr> bindings = initialSymbolicBindings == null ? Collections.<String, Expr> emptyMap()
                : initialSymbolicBindings;
        for (Map.Entry<String, Expr> e : bindings.entrySet()) {
            if (e.getValue().isBoolean() || e.getValue().containsDivision()) {
                throw new IllegalArgumentException("Initial value of " + e.getKey()
                                                + " must be an integer expression without division: " + e.getValue());
            }
        }
        long start = System.currentTimeMillis();
        try (SolverSession session = solver.openSession(options.getQueryTimeoutMillis())) {
            Exploration exploration = new Exploration(cfg, pathBound, Deadline.afterMillis(timeBudgetMillis), session);
            ExplorationResult result = exploration.run(new ExecutionState(cfg.getEntry(), bindings));
            result.getStatistics().setElapsedMillis(System.currentTimeMillis() - start);
            if (outputLevel >= 1) {
                Logger.println("SYMBOLIC " + cfg.getName() + ": " + result);
            }
            return result;
        }
    }

    /**
     * State of one call to {@link SymbolicExecutor#explore}
     */
    private class Exploration {
        private final ControlFlowGraph cfg;
        private final int pathBound;
        private final Deadline deadline;
        private final SolverSession session;
        private final Set<BasicBlock> loopHeaders;
        private final ConcreteInterpreter replayer;
        private final Deque<ExecutionState> frontier = new ArrayDeque<>();
        /**
         * Test cases keyed by trace and fault flag
         */
        private final Map<String, TestCase> testCases = new LinkedHashMap<>();
        private final ExplorationStatistics stats = new ExplorationStatistics();
        private boolean incomplete = false;

        Exploration(ControlFlowGraph cfg, int pathBound, Deadline deadline, SolverSession session) {
            this.cfg = cfg;
            this.pathBound = pathBound;
            this.deadline = deadline;
            this.session = session;
            this.loopHeaders = cfg.getLoopHeaders();
            this.replayer = new ConcreteInterpreter(options.toInterpreterOptions());
        }

        ExplorationResult run(ExecutionState initial) {
            frontier.add(initial);
            while (!frontier.isEmpty()) {
                if (deadline.isExpired()) {
                    if (outputLevel >= 1) {
                        Logger.println("DEADLINE reached with " + frontier.size() + " pending states");
                    }
                    incomplete = true;
                    break;
                }
                if (options.getMaxPaths() > 0 && testCases.size() >= options.getMaxPaths()) {
                    if (outputLevel >= 1) {
                        Logger.println("PATH LIMIT of " + options.getMaxPaths() + " reached");
                    }
                    incomplete = true;
                    break;
                }
                ExecutionState s = options.getOrder() == ExplorationOptions.SearchOrder.BFS ? frontier.pollFirst()
                        : frontier.pollLast();
                step(s);
            }
            stats.setSolverQueries(session.getQueryCount());
            return new ExplorationResult(new ArrayList<>(testCases.values()), incomplete, stats);
        }

        /**
         * Run a state until it ends or reaches a branch. States to continue with are added to the frontier.
         */
        private void step(ExecutionState s) {
            if (s.getIndex() == 0 && !enterBlock(s)) {
                return;
            }
            BasicBlock bb = s.getBlock();
            List<Instruction> instructions = bb.getInstructions();
            while (s.getIndex() < instructions.size()) {
                Instruction i = instructions.get(s.getIndex());
                if (outputLevel >= 4) {
                    Logger.println("SYMBOLIC STEP " + i + " in " + s);
                }
                switch (i.getType()) {
                case ASSIGN:
                    if (!checkDivisors(s, i.getExpr())) {
                        return;
                    }
                    s.assign(i.getTarget(), s.evaluate(i.getExpr()));
                    break;
                case CALL:
                    if (i.getArguments().size() != i.getTurtleOp().getArity()) {
                        finish(s, FaultKind.UNSUPPORTED_OPERATION);
                        return;
                    }
                    List<Expr> args = new ArrayList<>();
                    for (Expr arg : i.getArguments()) {
                        if (!checkDivisors(s, arg)) {
                            return;
                        }
                        args.add(s.evaluate(arg));
                    }
                    if (!moveTurtle(s, i, args)) {
                        return;
                    }
                    break;
                case BRANCH:
                    if (checkDivisors(s, i.getExpr())) {
                        branch(s, bb, i.getExpr());
                    }
                    return;
                case JUMP:
                    s.moveTo(cfg.getUniqueSuccessor(bb));
                    frontier.add(s);
                    return;
                case RETURN:
                    finish(s, null);
                    return;
                default:
                    throw new IllegalArgumentException("Unknown instruction type " + i.getType());
                }
                s.advance();
            }
            s.moveTo(cfg.getUniqueSuccessor(bb));
            frontier.add(s);
        }

        /**
         * Record entering the current block of s
         *
         * @return false if the path has to stop here
         */
        private boolean enterBlock(ExecutionState s) {
            s.recordVisit();
            if (loopHeaders.contains(s.getBlock()) && s.countHeaderVisit() > pathBound + 1) {
                if (outputLevel >= 2) {
                    Logger.println("BOUND reached at loop header " + s.getBlock());
                }
                stats.recordBounded();
                incomplete = true;
                return false;
            }
            return true;
        }

        /**
         * Fork off a faulting path for every division in e whose divisor may be zero, in evaluation order
         *
         * @return false if s cannot continue past e
         */
        private boolean checkDivisors(ExecutionState s, Expr e) {
            if (!e.containsDivision()) {
                return true;
            }
            for (Expr d : divisors(e)) {
                Expr divisor = s.evaluate(d);
                if (divisor.getKind() == ExprKind.INT_CONST) {
                    if (divisor.getValue() == 0) {
                        finish(s, FaultKind.DIVISION_BY_ZERO);
                        return false;
                    }
                    continue;
                }
                ExecutionState faulting = s.fork();
                faulting.assume(ExprSimplifier.simplifyOverInputs(Expr.eq(divisor, Expr.constant(0))));
                finish(faulting, FaultKind.DIVISION_BY_ZERO);

                s.assume(ExprSimplifier.simplifyOverInputs(Expr.ne(divisor, Expr.constant(0))));
                if (!isFeasible(s)) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Divisors of the divisions in e, innermost and leftmost first
         */
        private List<Expr> divisors(Expr e) {
            List<Expr> divisors = new ArrayList<>();
            for (Expr sub : e.postorder()) {
                if (sub.getKind() == ExprKind.DIV || sub.getKind() == ExprKind.MOD) {
                    divisors.add(sub.getRight());
                }
            }
            return divisors;
        }

        /**
         * Apply a turtle command to s, forking off a faulting path if the turtle may leave the canvas
         *
         * @param args
         *            symbolic argument values
         * @return false if s cannot continue past the command
         */
        private boolean moveTurtle(ExecutionState s, Instruction i, List<Expr> args) {
            SymbolicTurtle before = s.getTurtle();
            SymbolicTurtle after;
            switch (i.getTurtleOp()) {
            case FORWARD:
                after = before.move(args.get(0));
                break;
            case BACKWARD:
                after = before.move(ExprSimplifier.simplifyOverInputs(Expr.neg(args.get(0))));
                break;
            case LEFT:
                after = before.turn(args.get(0));
                break;
            case RIGHT:
                after = before.turn(ExprSimplifier.simplifyOverInputs(Expr.neg(args.get(0))));
                break;
            case GOTO:
                after = before.moveTo(args.get(0), args.get(1));
                break;
            default:
                after = before;
                break;
            }
            s.setTurtle(after);
            if (!options.isTurtleGuard() || !after.isPositionKnown()) {
                return true;
            }
            Expr inside = Expr.TRUE;
            for (Expr c : new Expr[] { after.getX() == before.getX() ? null : after.getX(),
                                      after.getY() == before.getY() ? null : after.getY() }) {
                if (c == null) {
                    continue;
                }
                if (c.getKind() == ExprKind.INT_CONST) {
                    if (Math.abs((double) c.getValue()) > options.getCanvasHalfWidth()) {
                        finish(s, FaultKind.TURTLE_GUARD_VIOLATION);
                        return false;
                    }
                    continue;
                }
                Expr bounds = Expr.and(Expr.ge(c, Expr.constant(-options.getCanvasHalfWidth())),
                                       Expr.le(c, Expr.constant(options.getCanvasHalfWidth())));
                inside = inside == Expr.TRUE ? bounds : Expr.and(inside, bounds);
            }
            if (inside == Expr.TRUE) {
                return true;
            }
            ExecutionState faulting = s.fork();
            faulting.assume(ExprSimplifier.simplifyOverInputs(Expr.not(inside)));
            finish(faulting, FaultKind.TURTLE_GUARD_VIOLATION);

            s.assume(inside);
            return isFeasible(s);
        }

        private void branch(ExecutionState s, BasicBlock bb, Expr guard) {
            Expr g = s.evaluate(guard);
            BasicBlock trueTarget = cfg.getTrueSuccessor(bb);
            BasicBlock falseTarget = cfg.getFalseSuccessor(bb);
            if (g.getKind() == ExprKind.BOOL_CONST) {
                s.moveTo(g.getBooleanValue() ? trueTarget : falseTarget);
                frontier.add(s);
                return;
            }
            ExecutionState other = s.fork();
            s.assume(g);
            other.assume(ExprSimplifier.simplifyOverInputs(Expr.not(g)));
            if (isFeasible(s)) {
                s.moveTo(trueTarget);
                frontier.add(s);
            }
            if (isFeasible(other)) {
                other.moveTo(falseTarget);
                frontier.add(other);
            }
        }

        /**
         * Ask the solver about the path condition of s
         *
         * @return true if SAT
         */
        private boolean isFeasible(ExecutionState s) {
            return query(s) != null;
        }

        /**
         * @return the solver's answer if SAT, null otherwise
         */
        private SolverResult query(ExecutionState s) {
            SolverResult r = session.check(s.getPathCondition().getConstraints());
            switch (r.getStatus()) {
            case SAT:
                return r;
            case UNSAT:
                stats.recordPruned();
                return null;
            default:
                if (outputLevel >= 1) {
                    Logger.println("UNKNOWN from solver, dropping path " + s.getPathCondition() + ": "
                                                    + r.getReason());
                }
                stats.recordUnknown();
                incomplete = true;
                return null;
            }
        }

        /**
         * End a path, producing a test case if it is feasible
         *
         * @param fault
         *            fault the path ends in, null if it reaches an exit
         */
        private void finish(ExecutionState s, FaultKind fault) {
            SolverResult r = query(s);
            if (r == null) {
                return;
            }
            Map<String, Long> model = new LinkedHashMap<>();
            for (String symbol : s.getSymbols()) {
                Long v = r.getModel().get(symbol);
                model.put(symbol, v == null ? 0L : v);
            }
            Map<String, Long> inputs = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> e : s.getInputs().entrySet()) {
                try {
                    inputs.put(e.getKey(), ExprEvaluator.evalInt(e.getValue(), model));
                } catch (EvaluationException ex) {
                    // every symbol has a value and initial bindings were checked not to divide
                    throw new RuntimeException("Could not evaluate input " + e.getKey() + " under " + model, ex);
                }
            }
            List<Integer> trace = s.getTrace();
            FaultKind expected = fault;
            ExecutionResult run = replayer.run(cfg, inputs);
            FaultKind observed = run.isFault() ? run.getFault().getKind() : null;
            if (!run.isStepLimitReached() && (!run.getTrace().equals(trace) || observed != fault)) {
                if (outputLevel >= 1) {
                    Logger.println("REPLAY of " + inputs + " left the path " + trace + ": " + run);
                }
                trace = run.getTrace();
                expected = observed;
                stats.recordDiverged();
                incomplete = true;
            }
            TestCase tc = new TestCase(inputs, model, trace, expected, s.getPathCondition(), s.getStore());
            String key = trace + (expected == null ? "" : " " + expected);
            if (testCases.containsKey(key)) {
                return;
            }
            testCases.put(key, tc);
            if (expected != null) {
                stats.recordFault();
            } else {
                stats.recordCompleted();
            }
            if (outputLevel >= 2) {
                Logger.println("TEST CASE " + tc);
            }
        }
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
