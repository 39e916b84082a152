package analysis.coverage;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import analysis.interpreter.ExecutionResult;

/**
 * What one run covered, reported to the fuzzer
 */
public final class CoverageResult {

    private final ExecutionResult execution;
    private final Set<Integer> coveredBlocks;
    private final int newBlocks;

    CoverageResult(ExecutionResult execution, int newBlocks) {
        this.execution = execution;
        this.coveredBlocks = Collections.unmodifiableSet(new LinkedHashSet<>(execution.getTrace()));
        this.newBlocks = newBlocks;
    }

    /**
     * @return ids of the blocks visited, in order
     */
    public List<Integer> getTrace() {
        return execution.getTrace();
    }

    /**
     * @return ids of the blocks visited at least once
     */
    public Set<Integer> getCoveredBlocks() {
        return coveredBlocks;
    }

    /**
     * @return number of covered blocks no earlier run of the same oracle covered
     */
    public int getNewBlocks() {
        return newBlocks;
    }

    public boolean isFault() {
        return execution.isFault();
    }

    public ExecutionResult getExecution() {
        return execution;
    }

    @Override
    public String toString() {
        return (isFault() ? "FAULT " : "") + coveredBlocks.size() + " blocks (" + newBlocks + " new) " + getTrace();
    }
}
