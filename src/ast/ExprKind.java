package ast;

/**
 * Enumeration of the kinds of Turtle expressions. Every {@link Expr} carries exactly one of these tags and consumers
 * dispatch on it with a <code>switch</code>.
 */
public enum ExprKind {
    /**
     * Integer literal
     */
    INT_CONST("", 0, false),
    /**
     * <code>true</code> or <code>false</code>
     */
    BOOL_CONST("", 0, true),
    /**
     * Read of an integer variable
     */
    VAR("", 0, false),
    /**
     * Arithmetic negation, -e
     */
    NEG("-", 1, false),
    /**
     * Logical negation, not e
     */
    NOT("not", 1, true),
    ADD("+", 2, false),
    SUB("-", 2, false),
    MUL("*", 2, false),
    /**
     * Euclidean division, see {@link Arithmetic#div(long, long)}
     */
    DIV("/", 2, false),
    /**
     * Euclidean remainder, see {@link Arithmetic#mod(long, long)}
     */
    MOD("%", 2, false),
    LT("<", 2, true),
    LE("<=", 2, true),
    GT(">", 2, true),
    GE(">=", 2, true),
    EQ("==", 2, true),
    NE("!=", 2, true),
    AND("and", 2, true),
    OR("or", 2, true);

    /**
     * Operator symbol used when printing
     */
    private final String symbol;
    /**
     * Number of sub-expressions
     */
    private final int arity;
    /**
     * Whether expressions of this kind produce a boolean
     */
    private final boolean booleanResult;

    private ExprKind(String symbol, int arity, boolean booleanResult) {
        this.symbol = symbol;
        this.arity = arity;
        this.booleanResult = booleanResult;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Whether an expression with this tag evaluates to a boolean
     *
     * @return true for comparisons, logical operators and boolean literals
     */
    public boolean isBooleanResult() {
        return booleanResult;
    }

    /**
     * @return true if this is an integer comparison (&lt;, &lt;=, &gt;, &gt;=, ==, !=)
     */
    public boolean isComparison() {
        switch (this) {
        case LT:
        case LE:
        case GT:
        case GE:
        case EQ:
        case NE:
            return true;
        default:
            return false;
        }
    }

    /**
     * @return true if this is a binary arithmetic operator
     */
    public boolean isArithmetic() {
        switch (this) {
        case ADD:
        case SUB:
        case MUL:
        case DIV:
        case MOD:
            return true;
        default:
            return false;
        }
    }

    /**
     * @return true for the binary logical connectives
     */
    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * Comparison that holds exactly when this one does not, e.g. &lt; becomes &gt;=
     *
     * @return negated comparison
     */
    public ExprKind negateComparison() {
        switch (this) {
        case LT:
            return GE;
        case LE:
            return GT;
        case GT:
            return LE;
        case GE:
            return LT;
        case EQ:
            return NE;
        case NE:
            return EQ;
        default:
            throw new IllegalArgumentException(this + " is not a comparison");
        }
    }

    /**
     * Comparison with the operands swapped, e.g. a &lt; b is b &gt; a
     *
     * @return comparison for swapped operands
     */
    public ExprKind swapOperands() {
        switch (this) {
        case LT:
            return GT;
        case LE:
            return GE;
        case GT:
            return LT;
        case GE:
            return LE;
        case EQ:
        case NE:
            return this;
        default:
            throw new IllegalArgumentException(this + " is not a comparison");
        }
    }
}
