package ir.io;

import java.util.ArrayList;
import java.util.List;

import ast.Expr;
import ast.ExprKind;

/**
 * Reads expressions in the form produced by {@link Expr#toString()}. Parentheses are optional, usual precedence
 * applies: <code>or</code> binds loosest, then <code>and</code>, comparisons, <code>+ -</code>, <code>* / %</code> and
 * finally the prefix operators <code>-</code> and <code>not</code>. A <code>-</code> directly followed by a number is a
 * negative literal.
 */
public class ExprParser {

    private final String text;
    private final List<String> tokens;
    private int pos;

    private ExprParser(String text) {
        this.text = text;
        this.tokens = tokenize(text);
        this.pos = 0;
    }

    /**
     * Parse an expression
     *
     * @param text
     *            expression text
     * @return parsed expression
     * @throws ParseException
     *             if the text is not a single well-formed expression
     */
    public static Expr parse(String text) {
        if (text == null) {
            throw new ParseException("Missing expression");
        }
        ExprParser p = new ExprParser(text);
        Expr e = p.parseOr();
        if (p.pos != p.tokens.size()) {
            throw p.error("unexpected '" + p.tokens.get(p.pos) + "'");
        }
        return e;
    }

    private static List<String> tokenize(String text) {
        List<String> toks = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < text.length() && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                toks.add(text.substring(start, i));
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < text.length() && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                toks.add(text.substring(start, i));
            } else if (i + 1 < text.length() && isTwoCharOperator(text.substring(i, i + 2))) {
                toks.add(text.substring(i, i + 2));
                i += 2;
            } else if ("+-*/%<>()".indexOf(c) >= 0) {
                toks.add(String.valueOf(c));
                i++;
            } else {
                throw new ParseException("Unexpected character '" + c + "' at " + i + " in \"" + text + "\"");
            }
        }
        return toks;
    }

    /**
     * '$' starts the variables the CFG builder generates
     */
    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == ':' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }

    private static boolean isTwoCharOperator(String s) {
        return s.equals("<=") || s.equals(">=") || s.equals("==") || s.equals("!=");
    }

    private String peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private String next() {
        if (pos >= tokens.size()) {
            throw error("unexpected end of input");
        }
        return tokens.get(pos++);
    }

    private void expect(String tok) {
        String actual = next();
        if (!actual.equals(tok)) {
            throw error("expected '" + tok + "' but found '" + actual + "'");
        }
    }

    private ParseException error(String message) {
        return new ParseException("Bad expression \"" + text + "\": " + message);
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while ("or".equals(peek())) {
            next();
            e = Expr.or(e, parseAnd());
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseComparison();
        while ("and".equals(peek())) {
            next();
            e = Expr.and(e, parseComparison());
        }
        return e;
    }

    private Expr parseComparison() {
        Expr e = parseAdditive();
        ExprKind kind = comparisonKind(peek());
        while (kind != null) {
            next();
            e = Expr.binary(kind, e, parseAdditive());
            kind = comparisonKind(peek());
        }
        return e;
    }

    private static ExprKind comparisonKind(String tok) {
        if (tok == null) {
            return null;
        }
        switch (tok) {
        case "<":
            return ExprKind.LT;
        case "<=":
            return ExprKind.LE;
        case ">":
            return ExprKind.GT;
        case ">=":
            return ExprKind.GE;
        case "==":
            return ExprKind.EQ;
        case "!=":
            return ExprKind.NE;
        default:
            return null;
        }
    }

    private Expr parseAdditive() {
        Expr e = parseMultiplicative();
        while ("+".equals(peek()) || "-".equals(peek())) {
            ExprKind kind = next().equals("+") ? ExprKind.ADD : ExprKind.SUB;
            e = Expr.binary(kind, e, parseMultiplicative());
        }
        return e;
    }

    private Expr parseMultiplicative() {
        Expr e = parseUnary();
        while ("*".equals(peek()) || "/".equals(peek()) || "%".equals(peek())) {
            String op = next();
            ExprKind kind = op.equals("*") ? ExprKind.MUL : op.equals("/") ? ExprKind.DIV : ExprKind.MOD;
            e = Expr.binary(kind, e, parseUnary());
        }
        return e;
    }

    private Expr parseUnary() {
        String tok = peek();
        if ("-".equals(tok)) {
            next();
            String after = peek();
            if (after != null && Character.isDigit(after.charAt(0))) {
                next();
                return Expr.constant(parseLong("-" + after));
            }
            return Expr.neg(parseUnary());
        }
        if ("not".equals(tok)) {
            next();
            return Expr.not(parseUnary());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        String tok = next();
        if (tok.equals("(")) {
            Expr e = parseOr();
            expect(")");
            return e;
        }
        if (tok.equals("true")) {
            return Expr.TRUE;
        }
        if (tok.equals("false")) {
            return Expr.FALSE;
        }
        if (Character.isDigit(tok.charAt(0))) {
            return Expr.constant(parseLong(tok));
        }
        if (isIdentifierStart(tok.charAt(0)) && !tok.equals("and") && !tok.equals("or")) {
            return Expr.var(tok);
        }
        throw error("unexpected '" + tok + "'");
    }

    private long parseLong(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new ParseException("Integer literal out of range in \"" + text + "\": " + digits, e);
        }
    }
}
