package ast;

/**
 * Turtle drawing primitives. These are the only side effects of a Turtle program apart from variable assignment.
 */
public enum TurtleOp {
    FORWARD("forward", 1),
    BACKWARD("backward", 1),
    /**
     * Turn counter-clockwise by a number of degrees
     */
    LEFT("left", 1),
    /**
     * Turn clockwise by a number of degrees
     */
    RIGHT("right", 1),
    PEN_UP("penup", 0),
    PEN_DOWN("pendown", 0),
    /**
     * Move to the absolute position given by two arguments
     */
    GOTO("goto", 2),
    PAUSE("pause", 0);

    /**
     * Name used in Turtle source and when printing
     */
    private final String commandName;
    /**
     * Number of integer arguments
     */
    private final int arity;

    private TurtleOp(String commandName, int arity) {
        this.commandName = commandName;
        this.arity = arity;
    }

    public String getCommandName() {
        return commandName;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Find the operation with the given command name
     *
     * @param name command name, e.g. "forward"
     * @return operation
     * @throws IllegalArgumentException if there is no such command
     */
    public static TurtleOp forCommandName(String name) {
        for (TurtleOp op : values()) {
            if (op.commandName.equals(name)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown turtle command: " + name);
    }
}
