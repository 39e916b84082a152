package ast;

/**
 * Thrown when an AST has a shape that cannot be lowered to the IR, e.g. a boolean assigned to a variable or a statement
 * kind the CFG builder does not handle.
 */
public class MalformedProgramException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Statement containing the offending construct, may be null if the problem is not tied to one statement
     */
    private final Statement offending;

    /**
     * @param message description of the problem
     * @param offending statement containing the offending construct (may be null)
     */
    public MalformedProgramException(String message, Statement offending) {
        super(offending == null ? message : message + " in statement: " + offending);
        this.offending = offending;
    }

    /**
     * @return statement that could not be lowered, or null
     */
    public Statement getOffendingStatement() {
        return offending;
    }
}
