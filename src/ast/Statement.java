package ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Turtle statement, tagged by {@link StatementKind}. Payload by kind:
 * <ul>
 * <li>ASSIGN: {@link #getTarget()}, {@link #getExpr()}</li>
 * <li>IF: {@link #getExpr()} (guard), {@link #getBody()} (then), {@link #getElseBody()}</li>
 * <li>WHILE: {@link #getExpr()} (guard), {@link #getBody()}</li>
 * <li>REPEAT: {@link #getExpr()} (iteration count), {@link #getBody()}</li>
 * <li>TURTLE: {@link #getTurtleOp()}, {@link #getArguments()}</li>
 * </ul>
 * Nothing is validated here, the CFG builder rejects malformed statements.
 */
public final class Statement {

    private final StatementKind kind;
    private final String target;
    private final Expr expr;
    private final List<Statement> body;
    private final List<Statement> elseBody;
    private final TurtleOp turtleOp;
    private final List<Expr> arguments;

    private Statement(StatementKind kind, String target, Expr expr, List<Statement> body, List<Statement> elseBody,
                      TurtleOp turtleOp, List<Expr> arguments) {
        this.kind = kind;
        this.target = target;
        this.expr = expr;
        this.body = body == null ? null : Collections.unmodifiableList(new ArrayList<>(body));
        this.elseBody = elseBody == null ? null : Collections.unmodifiableList(new ArrayList<>(elseBody));
        this.turtleOp = turtleOp;
        this.arguments = arguments == null ? null : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static Statement assign(String target, Expr value) {
        return new Statement(StatementKind.ASSIGN, target, value, null, null, null, null);
    }

    public static Statement ifThen(Expr guard, List<Statement> thenBody) {
        return new Statement(StatementKind.IF, null, guard, thenBody, Collections.<Statement> emptyList(), null, null);
    }

    public static Statement ifElse(Expr guard, List<Statement> thenBody, List<Statement> elseBody) {
        return new Statement(StatementKind.IF, null, guard, thenBody, elseBody, null, null);
    }

    public static Statement whileLoop(Expr guard, List<Statement> body) {
        return new Statement(StatementKind.WHILE, null, guard, body, null, null, null);
    }

    public static Statement repeat(Expr count, List<Statement> body) {
        return new Statement(StatementKind.REPEAT, null, count, body, null, null, null);
    }

    /**
     * Turtle command
     *
     * @param op command
     * @param args integer arguments, as many as {@link TurtleOp#getArity()}
     * @return new statement
     */
    public static Statement turtle(TurtleOp op, Expr... args) {
        return new Statement(StatementKind.TURTLE, null, null, null, null, op, Arrays.asList(args));
    }

    public static Statement forward(Expr distance) {
        return turtle(TurtleOp.FORWARD, distance);
    }

    public static Statement backward(Expr distance) {
        return turtle(TurtleOp.BACKWARD, distance);
    }

    public static Statement left(Expr degrees) {
        return turtle(TurtleOp.LEFT, degrees);
    }

    public static Statement right(Expr degrees) {
        return turtle(TurtleOp.RIGHT, degrees);
    }

    public static Statement penUp() {
        return turtle(TurtleOp.PEN_UP);
    }

    public static Statement penDown() {
        return turtle(TurtleOp.PEN_DOWN);
    }

    public static Statement gotoPoint(Expr x, Expr y) {
        return turtle(TurtleOp.GOTO, x, y);
    }

    public static Statement pause() {
        return turtle(TurtleOp.PAUSE);
    }

    public StatementKind getKind() {
        return kind;
    }

    /**
     * @return assigned variable for ASSIGN
     */
    public String getTarget() {
        return target;
    }

    /**
     * @return assigned value, guard or repeat count depending on the kind
     */
    public Expr getExpr() {
        return expr;
    }

    /**
     * @return then-branch or loop body
     */
    public List<Statement> getBody() {
        return body;
    }

    /**
     * @return else-branch of an IF (possibly empty)
     */
    public List<Statement> getElseBody() {
        return elseBody;
    }

    public TurtleOp getTurtleOp() {
        return turtleOp;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        switch (kind) {
        case ASSIGN:
            return target + " = " + expr;
        case IF:
            return "if " + expr + " [...]" + (elseBody != null && !elseBody.isEmpty() ? " else [...]" : "");
        case WHILE:
            return "while " + expr + " [...]";
        case REPEAT:
            return "repeat " + expr + " [...]";
        case TURTLE:
            StringBuilder sb = new StringBuilder();
            sb.append(turtleOp == null ? "?" : turtleOp.getCommandName());
            if (arguments != null) {
                for (Expr arg : arguments) {
                    sb.append(" ").append(arg);
                }
            }
            return sb.toString();
        default:
            return kind.toString();
        }
    }
}
