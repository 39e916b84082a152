package analysis.symbolic;

import java.util.Collections;
import java.util.List;

/**
 * Test cases found by the {@link SymbolicExecutor}
 */
public final class ExplorationResult {

    private final List<TestCase> testCases;
    private final boolean incomplete;
    private final ExplorationStatistics statistics;

    ExplorationResult(List<TestCase> testCases, boolean incomplete, ExplorationStatistics statistics) {
        this.testCases = Collections.unmodifiableList(testCases);
        this.incomplete = incomplete;
        this.statistics = statistics;
    }

    /**
     * @return one test case per distinct path found, in the order they were found
     */
    public List<TestCase> getTestCases() {
        return testCases;
    }

    /**
     * Whether some paths may be missing: a loop bound was hit, the time budget or path limit ran out, or the solver
     * could not decide a query
     *
     * @return true if exploration did not cover every feasible path
     */
    public boolean isIncomplete() {
        return incomplete;
    }

    public ExplorationStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return testCases.size() + " test cases" + (incomplete ? " (incomplete)" : "") + ", " + statistics;
    }
}
