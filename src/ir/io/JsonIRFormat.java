package ir.io;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.EdgeKind;
import ir.Instruction;
import ir.InstructionType;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import ast.Expr;
import ast.TurtleOp;

/**
 * Human readable JSON form of a {@link ControlFlowGraph}. Expressions are stored as text, in the syntax accepted by
 * {@link ExprParser}, e.g.
 *
 * <pre>
 * {"name": "p", "version": 1, "entry": 0,
 *  "blocks": [{"id": 1, "label": "BB1", "instructions": [{"id": 0, "type": "ASSIGN", "target": "x", "value": "(x + 1)"}]}],
 *  "edges": [{"source": 0, "target": 1, "kind": "FALL_THROUGH"}]}
 * </pre>
 */
public class JsonIRFormat {

    private static final int VERSION = 1;
    /**
     * Indentation used when writing
     */
    private static final int INDENT = 2;

    /**
     * Serialize a graph
     *
     * @param cfg
     *            graph to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(ControlFlowGraph cfg) {
        JSONObject json = new JSONObject();
        json.put("name", cfg.getName() == null ? "" : cfg.getName());
        json.put("version", VERSION);
        json.put("entry", cfg.getEntry().getId());
        JSONArray blocks = new JSONArray();
        for (BasicBlock bb : cfg) {
            JSONObject block = new JSONObject();
            block.put("id", bb.getId());
            block.put("label", bb.getLabel());
            JSONArray instructions = new JSONArray();
            for (Instruction i : bb.getInstructions()) {
                instructions.put(toJSON(i));
            }
            block.put("instructions", instructions);
            blocks.put(block);
        }
        json.put("blocks", blocks);
        JSONArray edges = new JSONArray();
        for (Edge e : cfg.getEdges()) {
            JSONObject edge = new JSONObject();
            edge.put("source", e.getSource().getId());
            edge.put("target", e.getTarget().getId());
            edge.put("kind", e.getKind().toString());
            edges.put(edge);
        }
        json.put("edges", edges);
        return json;
    }

    private static JSONObject toJSON(Instruction i) {
        JSONObject json = new JSONObject();
        json.put("id", i.getId());
        json.put("type", i.getType().toString());
        switch (i.getType()) {
        case ASSIGN:
            json.put("target", i.getTarget());
            json.put("value", i.getExpr().toString());
            break;
        case BRANCH:
            json.put("guard", i.getExpr().toString());
            break;
        case CALL:
            json.put("op", i.getTurtleOp().getCommandName());
            JSONArray args = new JSONArray();
            for (Expr arg : i.getArguments()) {
                args.put(arg.toString());
            }
            json.put("args", args);
            break;
        case JUMP:
        case RETURN:
            break;
        default:
            throw new IllegalArgumentException("Unknown instruction type " + i.getType());
        }
        return json;
    }

    /**
     * Write a graph as indented JSON
     *
     * @param cfg
     *            graph to write
     * @param out
     *            destination, not closed
     * @throws IOException
     *             if writing fails
     */
    public static void write(ControlFlowGraph cfg, Writer out) throws IOException {
        out.write(toJSON(cfg).toString(INDENT));
        out.write("\n");
        out.flush();
    }

    /**
     * Read a graph written by {@link #write(ControlFlowGraph, Writer)}
     *
     * @param in
     *            source, not closed
     * @return the graph
     * @throws ParseException
     *             if the input is not a well-formed graph
     */
    public static ControlFlowGraph read(Reader in) {
        try {
            return fromJSON(new JSONObject(new JSONTokener(in)));
        } catch (JSONException e) {
            throw new ParseException("Bad JSON IR: " + e.getMessage(), e);
        }
    }

    /**
     * Deserialize a graph
     *
     * @param json
     *            serialized form produced by {@link #toJSON(ControlFlowGraph)}
     * @return the graph
     * @throws ParseException
     *             if the object is not a well-formed graph
     */
    public static ControlFlowGraph fromJSON(JSONObject json) {
        try {
            int version = json.getInt("version");
            if (version != VERSION) {
                throw new ParseException("Unsupported IR version " + version);
            }
            Map<Integer, BasicBlock> blocks = new LinkedHashMap<>();
            JSONArray blockArray = json.getJSONArray("blocks");
            for (int b = 0; b < blockArray.length(); b++) {
                JSONObject block = blockArray.getJSONObject(b);
                int id = block.getInt("id");
                JSONArray instrArray = block.getJSONArray("instructions");
                List<Instruction> instructions = new ArrayList<>();
                for (int k = 0; k < instrArray.length(); k++) {
                    instructions.add(instructionFromJSON(instrArray.getJSONObject(k)));
                }
                if (blocks.put(id, IRReading.newBlock(id, block.getString("label"), instructions)) != null) {
                    throw new ParseException("Duplicate block id " + id);
                }
            }
            List<Edge> edges = new ArrayList<>();
            JSONArray edgeArray = json.getJSONArray("edges");
            for (int k = 0; k < edgeArray.length(); k++) {
                JSONObject edge = edgeArray.getJSONObject(k);
                BasicBlock source = IRReading.lookup(blocks, edge.getInt("source"));
                BasicBlock target = IRReading.lookup(blocks, edge.getInt("target"));
                edges.add(new Edge(source, target, enumValue(EdgeKind.class, edge.getString("kind"))));
            }
            return IRReading.newGraph(json.optString("name", ""), blocks, json.getInt("entry"), edges);
        } catch (JSONException e) {
            throw new ParseException("Bad JSON IR: " + e.getMessage(), e);
        }
    }

    private static Instruction instructionFromJSON(JSONObject json) {
        int id = json.getInt("id");
        InstructionType type = enumValue(InstructionType.class, json.getString("type"));
        switch (type) {
        case ASSIGN:
            return Instruction.assign(id, json.getString("target"), ExprParser.parse(json.getString("value")));
        case BRANCH:
            return Instruction.branch(id, ExprParser.parse(json.getString("guard")));
        case CALL:
            TurtleOp op;
            try {
                op = TurtleOp.forCommandName(json.getString("op"));
            } catch (IllegalArgumentException e) {
                throw new ParseException(e.getMessage(), e);
            }
            List<Expr> args = new ArrayList<>();
            JSONArray argArray = json.getJSONArray("args");
            for (int k = 0; k < argArray.length(); k++) {
                args.add(ExprParser.parse(argArray.getString(k)));
            }
            return Instruction.call(id, op, args);
        case JUMP:
            return Instruction.jump(id);
        case RETURN:
            return Instruction.ret(id);
        default:
            throw new ParseException("Unknown instruction type " + type);
        }
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new ParseException("Bad " + type.getSimpleName() + " " + name, e);
        }
    }
}
