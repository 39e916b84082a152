package analysis.symbolic;

/**
 * Decision procedure for path conditions over integer symbols
 */
public interface ConstraintSolver {

    /**
     * Start a session. The caller must close it.
     *
     * @param queryTimeoutMillis
     *            time limit for each query, non-positive for none; a query that runs out of time is UNKNOWN
     * @return new session
     */
    SolverSession openSession(long queryTimeoutMillis);

    String getName();
}
