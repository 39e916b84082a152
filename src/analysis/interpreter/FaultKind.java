package analysis.interpreter;

/**
 * Reasons a concrete execution can stop abnormally
 */
public enum FaultKind {
    /**
     * A variable was read before any value was bound to it
     */
    UNDEFINED_VARIABLE,
    /**
     * Division or remainder by zero
     */
    DIVISION_BY_ZERO,
    /**
     * The instruction or expression cannot be executed, e.g. an integer where a boolean is needed
     */
    UNSUPPORTED_OPERATION,
    /**
     * The turtle left the canvas
     */
    TURTLE_GUARD_VIOLATION;
}
