package analysis.optimizer;

import static ir.SamplePrograms.e;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import junit.framework.TestCase;
import ast.Expr;
import ast.ExprKind;

public class TestExprSimplifier extends TestCase {

    private static Expr simplify(String text) {
        return ExprSimplifier.simplify(e(text));
    }

    public static void testConstantsFold() {
        assertEquals(Expr.constant(7), simplify("1 + 2 * 3"));
        assertEquals(Expr.constant(-4), simplify("-7 / 2"));
        assertEquals(Expr.TRUE, simplify("3 < 4"));
        assertEquals(Expr.FALSE, simplify("not (3 < 4)"));
    }

    public static void testIdentities() {
        assertEquals(e(":x"), simplify(":x + 0"));
        assertEquals(e(":x"), simplify("1 * :x"));
        assertEquals(e(":x"), simplify(":x / 1"));
        assertEquals(Expr.constant(0), ExprSimplifier.simplify(e(":x * 0"), Collections.singleton(":x")));
        assertEquals(Expr.constant(0), ExprSimplifier.simplify(e(":x - :x"), Collections.singleton(":x")));
        assertEquals(Expr.constant(0), ExprSimplifier.simplifyOverInputs(e(":x % 1")));
        assertEquals(e(":x > 1"), simplify("true and :x > 1"));
        assertEquals(e(":x >= 3"), simplify("not (:x < 3)"));
    }

    public static void testFaultsArePreserved() {
        Expr divByZero = simplify("10 / 0");
        assertEquals(ExprKind.DIV, divByZero.getKind());
        Expr product = simplify("(1 / :y) * 0");
        assertEquals(ExprKind.MUL, product.getKind());
        Expr guard = simplify("false and 1 / :y > 0");
        assertEquals(ExprKind.AND, guard.getKind());
    }

    public static void testUnboundReadsAreKept() {
        assertEquals(ExprKind.MUL, simplify(":u * 0").getKind());
        assertEquals(ExprKind.SUB, simplify(":u - :u").getKind());
        assertEquals(ExprKind.MOD, simplify(":u % 1").getKind());
        assertEquals(ExprKind.OR, simplify("true or :u > 0").getKind());
        Set<String> bound = new HashSet<>(Arrays.asList(":x"));
        assertEquals(ExprKind.MUL, ExprSimplifier.simplify(e(":u * 0"), bound).getKind());
        assertEquals(Expr.TRUE, ExprSimplifier.simplify(e("true or :x > 0"), bound));
    }

    public static void testDeepExpression() {
        Expr e = Expr.var(":x");
        for (int k = 0; k < 200000; k++) {
            e = Expr.add(e, Expr.constant(0));
        }
        assertEquals(Expr.var(":x"), ExprSimplifier.simplify(e));
    }

    public static void testUnchangedExpressionIsReturned() {
        Expr original = e(":x + :y");
        assertSame(original, ExprSimplifier.simplify(original));
    }

    public static void testDeeplyNestedIdentities() {
        Expr deep = Expr.var(":x");
        for (int k = 0; k < 200000; k++) {
            deep = Expr.add(Expr.constant(0), Expr.mul(deep, Expr.constant(1)));
        }
        assertEquals(e(":x"), ExprSimplifier.simplifyOverInputs(deep));
    }
}
