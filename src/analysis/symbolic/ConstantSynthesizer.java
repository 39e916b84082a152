package analysis.symbolic;

import ir.ControlFlowGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.Logger;
import ast.Expr;

/**
 * Finds values for constant parameters of a program so that it agrees with a set of input/output examples. Each
 * example is explored symbolically with its inputs fixed and the parameters symbolic; the example holds if some path
 * reaches an exit with the expected outputs, so the solver is asked for parameters satisfying, for every example, the
 * disjunction over its paths of the path condition and the output equalities.
 */
public class ConstantSynthesizer {

    private final SymbolicExecutor executor;
    private final int pathBound;
    private final long timeBudgetMillis;
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    /**
     * @param executor
     *            executor used for each example
     * @param pathBound
     *            loop bound for each exploration
     * @param timeBudgetMillis
     *            time budget for each exploration, non-positive for none
     */
    public ConstantSynthesizer(SymbolicExecutor executor, int pathBound, long timeBudgetMillis) {
        this.executor = executor;
        this.pathBound = pathBound;
        this.timeBudgetMillis = timeBudgetMillis;
    }

    /**
     * Synthesize parameter values
     *
     * @param cfg
     *            program with parameters
     * @param parameters
     *            names of the variables to solve for, they keep one value across all examples
     * @param examples
     *            examples the program must satisfy
     * @param solver
     *            solver for the final query
     * @return SAT with the parameter values, UNSAT if no values satisfy every example on the explored paths, UNKNOWN
     *         if the solver gave up
     */
    public SolverResult synthesize(ControlFlowGraph cfg, Set<String> parameters, List<SynthesisExample> examples,
                                   ConstraintSolver solver) {
        List<Expr> constraints = new ArrayList<>();
        int k = 0;
        for (SynthesisExample ex : examples) {
            Map<String, Expr> bindings = new LinkedHashMap<>();
            for (String var : cfg.getVariables()) {
                // each example gets its own symbols, only the parameters are shared
                bindings.put(var, parameters.contains(var) ? Expr.var(var) : Expr.var("ex" + k + "!" + var));
            }
            for (Map.Entry<String, Long> in : ex.getInputs().entrySet()) {
                if (parameters.contains(in.getKey())) {
                    throw new IllegalArgumentException(in.getKey() + " is both a parameter and an input");
                }
                bindings.put(in.getKey(), Expr.constant(in.getValue()));
            }
            ExplorationResult result = executor.explore(cfg, bindings, pathBound, timeBudgetMillis, solver);
            if (outputLevel >= 2) {
                Logger.println("SYNTHESIS example " + k + " " + ex + ": " + result);
            }
            Expr anyPath = Expr.FALSE;
            for (TestCase tc : result.getTestCases()) {
                if (tc.expectsFault()) {
                    continue;
                }
                Expr path = tc.getPathCondition().toExpr();
                for (Map.Entry<String, Long> out : ex.getExpectedOutputs().entrySet()) {
                    Expr actual = tc.getFinalStore().get(out.getKey());
                    if (actual == null) {
                        path = Expr.FALSE;
                        break;
                    }
                    path = Expr.and(path, Expr.eq(actual, Expr.constant(out.getValue())));
                }
                anyPath = anyPath == Expr.FALSE ? path : Expr.or(anyPath, path);
            }
            constraints.add(anyPath);
            k++;
        }
        try (SolverSession session = solver.openSession(0)) {
            SolverResult r = session.check(constraints);
            if (!r.isSat()) {
                return r;
            }
            Map<String, Long> values = new LinkedHashMap<>();
            for (String p : parameters) {
                Long v = r.getModel().get(p);
                values.put(p, v == null ? 0L : v);
            }
            if (outputLevel >= 1) {
                Logger.println("SYNTHESIZED " + values);
            }
            return SolverResult.sat(values);
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
