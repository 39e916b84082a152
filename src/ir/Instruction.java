package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ast.Expr;
import ast.TurtleOp;

/**
 * One IR operation. A single immutable class tagged by {@link InstructionType}, payload by type:
 * <ul>
 * <li>ASSIGN: {@link #getTarget()} and {@link #getExpr()} (the assigned value)</li>
 * <li>BRANCH: {@link #getExpr()} (the boolean guard)</li>
 * <li>CALL: {@link #getTurtleOp()} and {@link #getArguments()}</li>
 * <li>JUMP, RETURN: nothing, the targets are the edges leaving the block</li>
 * </ul>
 */
public final class Instruction {

    /**
     * Identifier, unique within the control flow graph that contains this instruction
     */
    private final int id;
    /**
     * Type tag
     */
    private final InstructionType type;
    /**
     * Assigned variable for ASSIGN, null otherwise
     */
    private final String target;
    /**
     * Assigned value for ASSIGN, guard for BRANCH, null otherwise
     */
    private final Expr expr;
    /**
     * Turtle primitive for CALL, null otherwise
     */
    private final TurtleOp turtleOp;
    /**
     * Arguments for CALL, empty otherwise
     */
    private final List<Expr> arguments;

    private Instruction(int id, InstructionType type, String target, Expr expr, TurtleOp turtleOp,
                        List<Expr> arguments) {
        this.id = id;
        this.type = type;
        this.target = target;
        this.expr = expr;
        this.turtleOp = turtleOp;
        this.arguments = arguments == null ? Collections.<Expr> emptyList()
                                        : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static Instruction assign(int id, String target, Expr value) {
        return new Instruction(id, InstructionType.ASSIGN, target, value, null, null);
    }

    public static Instruction branch(int id, Expr guard) {
        return new Instruction(id, InstructionType.BRANCH, null, guard, null, null);
    }

    public static Instruction jump(int id) {
        return new Instruction(id, InstructionType.JUMP, null, null, null, null);
    }

    public static Instruction call(int id, TurtleOp op, List<Expr> arguments) {
        return new Instruction(id, InstructionType.CALL, null, null, op, arguments);
    }

    public static Instruction ret(int id) {
        return new Instruction(id, InstructionType.RETURN, null, null, null, null);
    }

    /**
     * Copy of this instruction with a different value or guard (ASSIGN and BRANCH only)
     *
     * @param newExpr
     *            replacement expression
     * @return new instruction with the same id, or this one if the expression is unchanged
     */
    public Instruction withExpr(Expr newExpr) {
        if (newExpr.equals(expr)) {
            return this;
        }
        switch (type) {
        case ASSIGN:
            return assign(id, target, newExpr);
        case BRANCH:
            return branch(id, newExpr);
        case CALL:
        case JUMP:
        case RETURN:
            throw new IllegalStateException(type + " has no expression: " + this);
        default:
            throw new IllegalStateException("Unknown instruction type " + type);
        }
    }

    /**
     * Copy of a CALL with different arguments
     *
     * @param newArguments
     *            replacement arguments
     * @return new instruction with the same id, or this one if the arguments are unchanged
     */
    public Instruction withArguments(List<Expr> newArguments) {
        if (type != InstructionType.CALL) {
            throw new IllegalStateException(type + " has no arguments: " + this);
        }
        if (newArguments.equals(arguments)) {
            return this;
        }
        return call(id, turtleOp, newArguments);
    }

    public int getId() {
        return id;
    }

    public InstructionType getType() {
        return type;
    }

    public String getTarget() {
        return target;
    }

    /**
     * @return assigned value for ASSIGN, guard for BRANCH, null otherwise
     */
    public Expr getExpr() {
        return expr;
    }

    public TurtleOp getTurtleOp() {
        return turtleOp;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    /**
     * Variables read when this instruction executes
     *
     * @return set of variable names, in order of first use
     */
    public Set<String> getUses() {
        Set<String> uses = new LinkedHashSet<>();
        if (expr != null) {
            uses.addAll(expr.getVariables());
        }
        for (Expr arg : arguments) {
            uses.addAll(arg.getVariables());
        }
        return uses;
    }

    /**
     * Variable written when this instruction executes
     *
     * @return assigned variable, or null if this is not an ASSIGN
     */
    public String getDef() {
        return type == InstructionType.ASSIGN ? target : null;
    }

    /**
     * All expressions evaluated by this instruction
     *
     * @return value or guard followed by call arguments
     */
    public List<Expr> getEvaluatedExpressions() {
        List<Expr> exprs = new ArrayList<>();
        if (expr != null) {
            exprs.add(expr);
        }
        exprs.addAll(arguments);
        return exprs;
    }

    /**
     * Could executing this instruction divide by zero
     *
     * @return true if an evaluated expression contains a division or remainder
     */
    public boolean containsDivision() {
        for (Expr e : getEvaluatedExpressions()) {
            if (e.containsDivision()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Could executing this instruction raise a runtime fault other than a turtle guard violation
     *
     * @param definitelyBound
     *            variables known to have a value before this instruction
     * @return true if an evaluated expression divides or reads a variable that may be unbound
     */
    public boolean canFault(Set<String> definitelyBound) {
        for (Expr e : getEvaluatedExpressions()) {
            if (e.canFault(definitelyBound)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = id;
        result = prime * result + type.hashCode();
        result = prime * result + (target == null ? 0 : target.hashCode());
        result = prime * result + (expr == null ? 0 : expr.hashCode());
        result = prime * result + (turtleOp == null ? 0 : turtleOp.hashCode());
        result = prime * result + arguments.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Instruction)) {
            return false;
        }
        Instruction other = (Instruction) obj;
        if (id != other.id || type != other.type || turtleOp != other.turtleOp) {
            return false;
        }
        if (target == null ? other.target != null : !target.equals(other.target)) {
            return false;
        }
        if (expr == null ? other.expr != null : !expr.equals(other.expr)) {
            return false;
        }
        return arguments.equals(other.arguments);
    }

    @Override
    public String toString() {
        switch (type) {
        case ASSIGN:
            return target + " = " + expr;
        case BRANCH:
            return "branch " + expr;
        case JUMP:
            return "jump";
        case CALL:
            StringBuilder sb = new StringBuilder();
            sb.append(turtleOp.getCommandName()).append("(");
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(arguments.get(i));
            }
            return sb.append(")").toString();
        case RETURN:
            return "return";
        default:
            throw new IllegalStateException("Unknown instruction type " + type);
        }
    }
}
