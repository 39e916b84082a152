package analysis.symbolic;

import analysis.interpreter.TurtleState;
import analysis.optimizer.ExprSimplifier;
import ast.Expr;
import ast.ExprKind;

/**
 * Position of the turtle as expressions over input symbols. Only turns by constant angles and moves along the axes
 * are tracked exactly: a turn by a symbolic angle forgets the heading, and a move while the heading is forgotten or
 * not a multiple of 90 degrees forgets the position until the next goto.
 */
final class SymbolicTurtle {

    static final SymbolicTurtle INITIAL = new SymbolicTurtle(Expr.constant(0), Expr.constant(0),
                                                             TurtleState.INITIAL.getHeading(), true);

    /**
     * null if unknown
     */
    private final Expr x;
    private final Expr y;
    private final double heading;
    private final boolean headingKnown;

    private SymbolicTurtle(Expr x, Expr y, double heading, boolean headingKnown) {
        this.x = x;
        this.y = y;
        this.heading = heading;
        this.headingKnown = headingKnown;
    }

    /**
     * @return true if both coordinates are known
     */
    boolean isPositionKnown() {
        return x != null && y != null;
    }

    /**
     * @return x coordinate, null if unknown
     */
    Expr getX() {
        return x;
    }

    /**
     * @return y coordinate, null if unknown
     */
    Expr getY() {
        return y;
    }

    /**
     * @param distance
     *            symbolic distance, negative moves backwards
     */
    SymbolicTurtle move(Expr distance) {
        if (!headingKnown || !isPositionKnown()) {
            return forget();
        }
        if (heading == 0) {
            return new SymbolicTurtle(ExprSimplifier.simplifyOverInputs(Expr.add(x, distance)), y, heading, true);
        } else if (heading == 90) {
            return new SymbolicTurtle(x, ExprSimplifier.simplifyOverInputs(Expr.add(y, distance)), heading, true);
        } else if (heading == 180) {
            return new SymbolicTurtle(ExprSimplifier.simplifyOverInputs(Expr.sub(x, distance)), y, heading, true);
        } else if (heading == 270) {
            return new SymbolicTurtle(x, ExprSimplifier.simplifyOverInputs(Expr.sub(y, distance)), heading, true);
        }
        return forget();
    }

    /**
     * @param degrees
     *            symbolic counter-clockwise angle
     */
    SymbolicTurtle turn(Expr degrees) {
        if (headingKnown && degrees.getKind() == ExprKind.INT_CONST) {
            return new SymbolicTurtle(x, y, TurtleState.turnedHeading(heading, degrees.getValue()), true);
        }
        return new SymbolicTurtle(x, y, heading, false);
    }

    SymbolicTurtle moveTo(Expr newX, Expr newY) {
        return new SymbolicTurtle(newX, newY, heading, headingKnown);
    }

    private SymbolicTurtle forget() {
        return new SymbolicTurtle(null, null, heading, headingKnown);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ") heading " + (headingKnown ? String.valueOf(heading) : "?");
    }
}
