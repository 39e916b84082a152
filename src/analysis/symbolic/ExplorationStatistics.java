package analysis.symbolic;

/**
 * Counters collected during one exploration
 */
public class ExplorationStatistics {

    private int completedPaths;
    private int faultPaths;
    private int prunedPaths;
    private int boundedPaths;
    private int unknownQueries;
    private int divergedPaths;
    private int solverQueries;
    private long elapsedMillis;

    void recordCompleted() {
        completedPaths++;
    }

    void recordFault() {
        faultPaths++;
    }

    void recordPruned() {
        prunedPaths++;
    }

    void recordBounded() {
        boundedPaths++;
    }

    void recordUnknown() {
        unknownQueries++;
    }

    void recordDiverged() {
        divergedPaths++;
    }

    void setSolverQueries(int solverQueries) {
        this.solverQueries = solverQueries;
    }

    void setElapsedMillis(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }

    /**
     * @return paths that reached an exit with a satisfiable path condition
     */
    public int getCompletedPaths() {
        return completedPaths;
    }

    /**
     * @return feasible paths ending in a fault
     */
    public int getFaultPaths() {
        return faultPaths;
    }

    /**
     * @return states dropped because their path condition was unsatisfiable
     */
    public int getPrunedPaths() {
        return prunedPaths;
    }

    /**
     * @return paths stopped because a loop header was entered too often
     */
    public int getBoundedPaths() {
        return boundedPaths;
    }

    /**
     * @return queries the solver could not decide
     */
    public int getUnknownQueries() {
        return unknownQueries;
    }

    /**
     * @return test cases whose concrete run left the explored path, they record the run instead
     */
    public int getDivergedPaths() {
        return divergedPaths;
    }

    public int getSolverQueries() {
        return solverQueries;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return "completed=" + completedPaths + " faults=" + faultPaths + " pruned=" + prunedPaths + " bounded="
                                        + boundedPaths + " unknown=" + unknownQueries + " diverged=" + divergedPaths + " queries=" + solverQueries
                                        + " time=" + elapsedMillis + "ms";
    }
}
