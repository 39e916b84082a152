package ir;

import ir.io.ExprParser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ast.Expr;
import ast.Program;
import ast.Statement;

/**
 * Small Turtle programs shared by the tests
 */
public final class SamplePrograms {

    private SamplePrograms() {
        // static only
    }

    public static Expr e(String text) {
        return ExprParser.parse(text);
    }

    public static List<Statement> block(Statement... statements) {
        return Arrays.asList(statements);
    }

    public static ControlFlowGraph build(Program p) {
        return new CFGBuilder().build(p);
    }

    /**
     * <pre>
     * :x = 1
     * :y = :x + 2
     * </pre>
     */
    public static Program straightLine() {
        return Program.of("straight", Statement.assign(":x", e("1")), Statement.assign(":y", e(":x + 2")));
    }

    /**
     * <pre>
     * if :x > 0 [ :y = 1 ] else [ :y = -1 ]
     * </pre>
     */
    public static Program sign() {
        return Program.of("sign",
                          Statement.ifElse(e(":x > 0"),
                                           block(Statement.assign(":y", e("1"))),
                                           block(Statement.assign(":y", e("-1")))));
    }

    /**
     * <pre>
     * :i = 10
     * :s = 0
     * while :i > 0 [ :s = :s + :i  :i = :i - 1 ]
     * </pre>
     */
    public static Program countdown() {
        return Program.of("countdown",
                          Statement.assign(":i", e("10")),
                          Statement.assign(":s", e("0")),
                          Statement.whileLoop(e(":i > 0"),
                                              block(Statement.assign(":s", e(":s + :i")),
                                                    Statement.assign(":i", e(":i - 1")))));
    }

    /**
     * <pre>
     * :s = 0
     * while :n > 0 [ :s = :s + :n  :n = :n - 1 ]
     * </pre>
     */
    public static Program sumToN() {
        return Program.of("sumToN",
                          Statement.assign(":s", e("0")),
                          Statement.whileLoop(e(":n > 0"),
                                              block(Statement.assign(":s", e(":s + :n")),
                                                    Statement.assign(":n", e(":n - 1")))));
    }

    /**
     * <pre>
     * :y = 100 / :x
     * </pre>
     */
    public static Program division() {
        return Program.of("division", Statement.assign(":y", e("100 / :x")));
    }

    /**
     * <pre>
     * :x = 0
     * while true [ :x = :x + 1 ]
     * </pre>
     */
    public static Program forever() {
        return Program.of("forever",
                          Statement.assign(":x", e("0")),
                          Statement.whileLoop(Expr.TRUE, block(Statement.assign(":x", e(":x + 1")))));
    }

    /**
     * <pre>
     * repeat 4 [ forward :len  right 90 ]
     * </pre>
     */
    public static Program square() {
        return Program.of("square",
                          Statement.repeat(e("4"),
                                           block(Statement.forward(e(":len")), Statement.right(e("90")))));
    }

    /**
     * <pre>
     * :a = 5
     * :b = :a * 2
     * :t = :x + 1
     * :t = :x + 2
     * if :b > 3 [ :r = :b + :x ] else [ :r = 0 ]
     * </pre>
     */
    public static Program foldable() {
        return Program.of("foldable",
                          Statement.assign(":a", e("5")),
                          Statement.assign(":b", e(":a * 2")),
                          Statement.assign(":t", e(":x + 1")),
                          Statement.assign(":t", e(":x + 2")),
                          Statement.ifElse(e(":b > 3"),
                                           block(Statement.assign(":r", e(":b + :x"))),
                                           block(Statement.assign(":r", e("0")))));
    }

    /**
     * <pre>
     * if :x > 10 [ :y = :x - 10 ] else [ :y = 10 - :x ]
     * if :y == 3 [ :z = 1 ]
     * </pre>
     */
    public static Program twoDiamonds() {
        return Program.of("twoDiamonds",
                          Statement.ifElse(e(":x > 10"),
                                           block(Statement.assign(":y", e(":x - 10"))),
                                           block(Statement.assign(":y", e("10 - :x")))),
                          Statement.ifThen(e(":y == 3"), block(Statement.assign(":z", e("1")))));
    }

    public static List<Statement> none() {
        return Collections.emptyList();
    }
}
