package ir.io;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import ast.Expr;
import ast.Program;
import ast.Statement;
import ast.TurtleOp;

/**
 * Read a Turtle AST from JSON. The format is
 *
 * <pre>
 * {"name": "p", "statements": [
 *     {"kind": "assign", "target": ":x", "value": "(:x + 1)"},
 *     {"kind": "if", "guard": "(:x > 0)", "then": [...], "else": [...]},
 *     {"kind": "while", "guard": "...", "body": [...]},
 *     {"kind": "repeat", "count": "...", "body": [...]},
 *     {"kind": "forward", "args": ["10"]}, ...]}
 * </pre>
 *
 * Turtle statements use the command name as their kind. Expressions are written in the syntax accepted by
 * {@link ExprParser}. Statements are not checked here, the CFG builder rejects malformed programs.
 */
public class JsonProgramReader {

    /**
     * Methods are static
     */
    private JsonProgramReader() {
        // intentionally blank
    }

    /**
     * Whether a JSON document is an AST rather than a serialized graph
     *
     * @param json
     *            parsed document
     * @return true if the document has a "statements" array
     */
    public static boolean isProgram(JSONObject json) {
        return json.has("statements");
    }

    /**
     * Read a program
     *
     * @param in
     *            source, not closed
     * @return the AST
     * @throws ParseException
     *             if the input is not well-formed
     */
    public static Program read(Reader in) {
        try {
            return fromJSON(new JSONObject(new JSONTokener(in)));
        } catch (JSONException e) {
            throw new ParseException("Bad JSON program: " + e.getMessage(), e);
        }
    }

    /**
     * Convert a parsed JSON document to a program
     *
     * @param json
     *            document with a "statements" array
     * @return the AST
     * @throws ParseException
     *             if the document is not well-formed
     */
    public static Program fromJSON(JSONObject json) {
        try {
            return new Program(json.optString("name", "program"), statements(json.getJSONArray("statements")));
        } catch (JSONException e) {
            throw new ParseException("Bad JSON program: " + e.getMessage(), e);
        }
    }

    private static List<Statement> statements(JSONArray array) {
        List<Statement> result = new ArrayList<>();
        for (int k = 0; k < array.length(); k++) {
            result.add(statement(array.getJSONObject(k)));
        }
        return result;
    }

    private static Statement statement(JSONObject json) {
        String kind = json.getString("kind");
        switch (kind) {
        case "assign":
            return Statement.assign(json.getString("target"), expr(json, "value"));
        case "if":
            List<Statement> elseBody = json.has("else") ? statements(json.getJSONArray("else"))
                    : new ArrayList<Statement>();
            return Statement.ifElse(expr(json, "guard"), statements(json.getJSONArray("then")), elseBody);
        case "while":
            return Statement.whileLoop(expr(json, "guard"), statements(json.getJSONArray("body")));
        case "repeat":
            return Statement.repeat(expr(json, "count"), statements(json.getJSONArray("body")));
        default:
            TurtleOp op;
            try {
                op = TurtleOp.forCommandName(kind);
            } catch (IllegalArgumentException e) {
                throw new ParseException("Unknown statement kind " + kind, e);
            }
            List<Expr> args = new ArrayList<>();
            JSONArray argArray = json.optJSONArray("args");
            if (argArray != null) {
                for (int k = 0; k < argArray.length(); k++) {
                    args.add(ExprParser.parse(argArray.getString(k)));
                }
            }
            return Statement.turtle(op, args.toArray(new Expr[args.size()]));
        }
    }

    private static Expr expr(JSONObject json, String key) {
        return ExprParser.parse(json.getString(key));
    }
}
