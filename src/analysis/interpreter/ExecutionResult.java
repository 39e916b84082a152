package analysis.interpreter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one concrete execution
 */
public final class ExecutionResult {

    /**
     * Ids of the visited blocks in order, starting with the entry
     */
    private final List<Integer> trace;
    /**
     * Variable values when execution stopped
     */
    private final Map<String, Long> bindings;
    /**
     * Turtle commands executed, with evaluated arguments
     */
    private final List<String> turtleLog;
    private final TurtleState turtle;
    /**
     * Fault that stopped execution, null if it stopped normally
     */
    private final RuntimeFault fault;
    private final boolean stepLimitReached;
    private final int steps;

    ExecutionResult(List<Integer> trace, Map<String, Long> bindings, List<String> turtleLog, TurtleState turtle,
                    RuntimeFault fault, boolean stepLimitReached, int steps) {
        this.trace = Collections.unmodifiableList(trace);
        this.bindings = Collections.unmodifiableMap(bindings);
        this.turtleLog = Collections.unmodifiableList(turtleLog);
        this.turtle = turtle;
        this.fault = fault;
        this.stepLimitReached = stepLimitReached;
        this.steps = steps;
    }

    public List<Integer> getTrace() {
        return trace;
    }

    public Map<String, Long> getBindings() {
        return bindings;
    }

    public List<String> getTurtleLog() {
        return turtleLog;
    }

    public TurtleState getTurtle() {
        return turtle;
    }

    /**
     * @return the fault, or null if execution did not fault
     */
    public RuntimeFault getFault() {
        return fault;
    }

    public boolean isFault() {
        return fault != null;
    }

    /**
     * @return true if execution was stopped after the maximum number of steps
     */
    public boolean isStepLimitReached() {
        return stepLimitReached;
    }

    /**
     * @return true if execution reached a RETURN
     */
    public boolean isTerminated() {
        return fault == null && !stepLimitReached;
    }

    /**
     * @return number of instructions executed
     */
    public int getSteps() {
        return steps;
    }

    @Override
    public String toString() {
        String status = fault != null ? "fault " + fault : stepLimitReached ? "step limit reached" : "terminated";
        return status + ", trace " + trace + ", bindings " + bindings;
    }
}
