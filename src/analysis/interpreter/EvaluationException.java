package analysis.interpreter;

/**
 * Evaluating an expression failed. Only used inside evaluation, the interpreter turns it into a {@link RuntimeFault}.
 */
public class EvaluationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FaultKind kind;

    public EvaluationException(FaultKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FaultKind getKind() {
        return kind;
    }
}
