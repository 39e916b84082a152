package analysis.interpreter;

/**
 * Immutable position, heading and pen of the turtle. The turtle starts at the origin facing up (heading 90 degrees,
 * measured counter-clockwise from the positive x axis) with the pen down.
 */
public final class TurtleState {

    public static final TurtleState INITIAL = new TurtleState(0, 0, 90, true);

    private final double x;
    private final double y;
    private final double heading;
    private final boolean penDown;

    private TurtleState(double x, double y, double heading, boolean penDown) {
        this.x = x;
        this.y = y;
        this.heading = heading;
        this.penDown = penDown;
    }

    /**
     * Move along the current heading
     *
     * @param distance
     *            distance to move, negative moves backwards
     * @return new state
     */
    public TurtleState move(long distance) {
        // exact along the axes, where cos and sin of the rounded radians are off by an ulp
        if (heading == 0) {
            return new TurtleState(x + distance, y, heading, penDown);
        } else if (heading == 90) {
            return new TurtleState(x, y + distance, heading, penDown);
        } else if (heading == 180) {
            return new TurtleState(x - distance, y, heading, penDown);
        } else if (heading == 270) {
            return new TurtleState(x, y - distance, heading, penDown);
        }
        double radians = Math.toRadians(heading);
        return new TurtleState(x + distance * Math.cos(radians), y + distance * Math.sin(radians), heading, penDown);
    }

    /**
     * Turn left (counter-clockwise)
     *
     * @param degrees
     *            angle, negative turns right
     * @return new state
     */
    public TurtleState turn(long degrees) {
        return new TurtleState(x, y, turnedHeading(heading, degrees), penDown);
    }

    /**
     * @param heading
     *            heading in [0, 360)
     * @param degrees
     *            counter-clockwise turn
     * @return heading after the turn, in [0, 360)
     */
    public static double turnedHeading(double heading, long degrees) {
        double h = (heading + degrees) % 360;
        return h < 0 ? h + 360 : h;
    }

    public TurtleState moveTo(long newX, long newY) {
        return new TurtleState(newX, newY, heading, penDown);
    }

    public TurtleState setPen(boolean down) {
        return new TurtleState(x, y, heading, down);
    }

    /**
     * Is the turtle inside the square canvas centred at the origin
     *
     * @param halfWidth
     *            half the side of the canvas
     * @return true if both coordinates are within the canvas (up to rounding)
     */
    public boolean isWithin(long halfWidth) {
        double limit = halfWidth + 1e-9;
        return Math.abs(x) <= limit && Math.abs(y) <= limit;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getHeading() {
        return heading;
    }

    public boolean isPenDown() {
        return penDown;
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f) heading %.1f pen %s", x, y, heading, penDown ? "down" : "up");
    }
}
