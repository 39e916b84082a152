package ir.io;

import junit.framework.TestCase;
import ast.Expr;
import ast.ExprKind;

/**
 * Parsing expressions written by {@link Expr#toString()} and by hand
 */
public class TestExprParser extends TestCase {

    public static void testPrecedence() {
        Expr e = ExprParser.parse(":a + :b * 2 > 3 and not :c == 1 or false");
        assertEquals(ExprKind.OR, e.getKind());
        Expr and = e.getLeft();
        assertEquals(ExprKind.AND, and.getKind());
        Expr gt = and.getLeft();
        assertEquals(ExprKind.GT, gt.getKind());
        assertEquals(ExprKind.ADD, gt.getLeft().getKind());
        assertEquals(ExprKind.MUL, gt.getLeft().getRight().getKind());
    }

    public static void testLeftAssociative() {
        assertEquals(Expr.sub(Expr.sub(Expr.constant(10), Expr.constant(3)), Expr.constant(2)),
                     ExprParser.parse("10 - 3 - 2"));
    }

    public static void testNegativeLiteralAndNegation() {
        assertEquals(Expr.constant(-5), ExprParser.parse("-5"));
        assertEquals(Expr.neg(Expr.var(":x")), ExprParser.parse("-:x"));
        assertEquals(Expr.neg(Expr.constant(5)), ExprParser.parse("-(5)"));
    }

    public static void testPrintedFormParsesBack() {
        Expr e = Expr.and(Expr.lt(Expr.mod(Expr.var(":x"), Expr.constant(3)), Expr.neg(Expr.constant(5))),
                          Expr.not(Expr.eq(Expr.div(Expr.var("y"), Expr.var(":z")), Expr.constant(-1))));
        assertEquals(e, ExprParser.parse(e.toString()));
    }

    public static void testBooleans() {
        assertSame(Expr.TRUE, ExprParser.parse("true"));
        assertEquals(Expr.not(Expr.FALSE), ExprParser.parse("not false"));
    }

    public static void testUnbalancedParenthesis() {
        try {
            ExprParser.parse("(:x + 1");
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testTrailingGarbage() {
        try {
            ExprParser.parse(":x + 1 )");
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testBadCharacter() {
        try {
            ExprParser.parse(":x # 1");
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testLiteralOutOfRange() {
        try {
            ExprParser.parse("99999999999999999999");
        } catch (ParseException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
