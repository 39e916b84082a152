package analysis.symbolic;

import java.util.List;

import ast.Expr;

/**
 * Resources held by a solver for a series of queries
 */
public interface SolverSession extends AutoCloseable {

    /**
     * Check whether a conjunction of boolean expressions is satisfiable. Variables in the expressions are integer
     * symbols.
     *
     * @param constraints
     *            boolean expressions, all of which must hold
     * @return SAT with a model, UNSAT, or UNKNOWN
     */
    SolverResult check(List<Expr> constraints);

    /**
     * @return number of queries answered so far
     */
    int getQueryCount();

    @Override
    void close();
}
