package analysis.symbolic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answer to a satisfiability query. A satisfiable answer carries a model for the symbols of the query.
 */
public final class SolverResult {

    public enum Status {
        SAT, UNSAT, UNKNOWN
    }

    private static final SolverResult UNSAT = new SolverResult(Status.UNSAT, Collections.<String, Long> emptyMap(),
                                                               null);

    private final Status status;
    private final Map<String, Long> model;
    /**
     * Why the solver gave up, for UNKNOWN
     */
    private final String reason;

    private SolverResult(Status status, Map<String, Long> model, String reason) {
        this.status = status;
        this.model = model;
        this.reason = reason;
    }

    public static SolverResult sat(Map<String, Long> model) {
        return new SolverResult(Status.SAT, Collections.unmodifiableMap(new LinkedHashMap<>(model)), null);
    }

    public static SolverResult unsat() {
        return UNSAT;
    }

    public static SolverResult unknown(String reason) {
        return new SolverResult(Status.UNKNOWN, Collections.<String, Long> emptyMap(), reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSat() {
        return status == Status.SAT;
    }

    /**
     * Values of the symbols the solver assigned. Symbols missing from the model can take any value.
     *
     * @return model, empty unless SAT
     */
    public Map<String, Long> getModel() {
        return model;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (status) {
        case SAT:
            return "SAT " + model;
        case UNKNOWN:
            return "UNKNOWN (" + reason + ")";
        default:
            return "UNSAT";
        }
    }
}
