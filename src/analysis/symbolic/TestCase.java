package analysis.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import analysis.interpreter.FaultKind;
import ast.Expr;

/**
 * Concrete inputs driving the program down one explored path
 */
public final class TestCase {

    private final Map<String, Long> inputs;
    private final Map<String, Long> model;
    private final List<Integer> trace;
    private final FaultKind expectedFault;
    private final PathCondition pathCondition;
    private final Map<String, Expr> finalStore;

    TestCase(Map<String, Long> inputs, Map<String, Long> model, List<Integer> trace, FaultKind expectedFault,
             PathCondition pathCondition, Map<String, Expr> finalStore) {
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.model = Collections.unmodifiableMap(new LinkedHashMap<>(model));
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        this.expectedFault = expectedFault;
        this.pathCondition = pathCondition;
        this.finalStore = Collections.unmodifiableMap(new LinkedHashMap<>(finalStore));
    }

    /**
     * Initial value of every variable the path reads before assigning it
     *
     * @return map from variable name to value, suitable as interpreter input
     */
    public Map<String, Long> getInputs() {
        return inputs;
    }

    /**
     * @return value of every symbol, 0 for symbols the solver left unconstrained
     */
    public Map<String, Long> getModel() {
        return model;
    }

    /**
     * @return ids of the blocks visited, in order, starting at the entry
     */
    public List<Integer> getTrace() {
        return trace;
    }

    /**
     * @return true if the path ends in a fault rather than at an exit
     */
    public boolean expectsFault() {
        return expectedFault != null;
    }

    /**
     * @return fault the path ends in, null if it reaches an exit
     */
    public FaultKind getExpectedFault() {
        return expectedFault;
    }

    public PathCondition getPathCondition() {
        return pathCondition;
    }

    /**
     * @return symbolic value of every variable where the path ends
     */
    public Map<String, Expr> getFinalStore() {
        return finalStore;
    }

    @Override
    public String toString() {
        return (expectedFault != null ? expectedFault + " " : "") + inputs + " -> " + trace;
    }
}
