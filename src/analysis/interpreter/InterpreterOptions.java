package analysis.interpreter;

/**
 * Settings for {@link ConcreteInterpreter}
 */
public class InterpreterOptions {

    /**
     * Default bound on executed instructions
     */
    public static final int DEFAULT_MAX_STEPS = 100000;
    /**
     * Default half width of the canvas
     */
    public static final long DEFAULT_CANVAS_HALF_WIDTH = 1000;

    private int maxSteps = DEFAULT_MAX_STEPS;
    private long canvasHalfWidth = DEFAULT_CANVAS_HALF_WIDTH;
    private boolean turtleGuard = true;

    /**
     * Number of instructions after which execution is stopped. Reaching it is not a fault.
     *
     * @param maxSteps
     *            positive bound
     * @return this
     */
    public InterpreterOptions setMaxSteps(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
        return this;
    }

    /**
     * The turtle must stay within [-halfWidth, halfWidth] on both axes
     *
     * @param canvasHalfWidth
     *            non-negative half width
     * @return this
     */
    public InterpreterOptions setCanvasHalfWidth(long canvasHalfWidth) {
        if (canvasHalfWidth < 0) {
            throw new IllegalArgumentException("canvasHalfWidth must not be negative: " + canvasHalfWidth);
        }
        this.canvasHalfWidth = canvasHalfWidth;
        return this;
    }

    /**
     * Whether leaving the canvas is a {@link FaultKind#TURTLE_GUARD_VIOLATION}
     *
     * @param turtleGuard
     *            true to check the canvas bounds
     * @return this
     */
    public InterpreterOptions setTurtleGuard(boolean turtleGuard) {
        this.turtleGuard = turtleGuard;
        return this;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public long getCanvasHalfWidth() {
        return canvasHalfWidth;
    }

    public boolean isTurtleGuard() {
        return turtleGuard;
    }
}
