package ir.io;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.EdgeKind;
import ir.Instruction;
import ir.InstructionType;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ast.Expr;
import ast.ExprKind;
import ast.TurtleOp;

/**
 * Compact binary form of a {@link ControlFlowGraph}. Layout, all integers big-endian:
 *
 * <pre>
 * int     magic "CHIR"
 * short   version
 * UTF     program name
 * int     entry block id
 * int     number of blocks, then per block: int id, UTF label, int count, instructions
 * int     number of edges, then per edge: int source id, int target id, byte kind
 * </pre>
 *
 * An instruction is its id, a type byte and its payload. Expressions are written in postfix order, preceded by their
 * node count, so they can be read back with a value stack.
 */
public class BinaryIRFormat {

    private static final int MAGIC = 0x43484952;
    private static final short VERSION = 1;

    /**
     * Write a graph
     *
     * @param cfg
     *            graph to write
     * @param out
     *            destination, not closed
     * @throws IOException
     *             if writing fails
     */
    public static void write(ControlFlowGraph cfg, OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        data.writeInt(MAGIC);
        data.writeShort(VERSION);
        data.writeUTF(cfg.getName() == null ? "" : cfg.getName());
        data.writeInt(cfg.getEntry().getId());
        data.writeInt(cfg.getNumberOfBlocks());
        for (BasicBlock bb : cfg) {
            data.writeInt(bb.getId());
            data.writeUTF(bb.getLabel());
            data.writeInt(bb.getInstructions().size());
            for (Instruction i : bb.getInstructions()) {
                writeInstruction(i, data);
            }
        }
        List<Edge> edges = cfg.getEdges();
        data.writeInt(edges.size());
        for (Edge e : edges) {
            data.writeInt(e.getSource().getId());
            data.writeInt(e.getTarget().getId());
            data.writeByte(e.getKind().ordinal());
        }
        data.flush();
    }

    private static void writeInstruction(Instruction i, DataOutputStream data) throws IOException {
        data.writeInt(i.getId());
        data.writeByte(i.getType().ordinal());
        switch (i.getType()) {
        case ASSIGN:
            data.writeUTF(i.getTarget());
            writeExpr(i.getExpr(), data);
            break;
        case BRANCH:
            writeExpr(i.getExpr(), data);
            break;
        case CALL:
            data.writeByte(i.getTurtleOp().ordinal());
            data.writeByte(i.getArguments().size());
            for (Expr arg : i.getArguments()) {
                writeExpr(arg, data);
            }
            break;
        case JUMP:
        case RETURN:
            break;
        default:
            throw new IllegalArgumentException("Unknown instruction type " + i.getType());
        }
    }

    private static void writeExpr(Expr e, DataOutputStream data) throws IOException {
        // reverse of a (node, right, left) preorder is the postorder
        List<Expr> order = new ArrayList<>();
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(e);
        while (!stack.isEmpty()) {
            Expr n = stack.pop();
            order.add(n);
            if (n.getLeft() != null) {
                stack.push(n.getLeft());
            }
            if (n.getRight() != null) {
                stack.push(n.getRight());
            }
        }
        Collections.reverse(order);
        data.writeInt(order.size());
        for (Expr n : order) {
            data.writeByte(n.getKind().ordinal());
            switch (n.getKind()) {
            case INT_CONST:
            case BOOL_CONST:
                data.writeLong(n.getValue());
                break;
            case VAR:
                data.writeUTF(n.getName());
                break;
            default:
                break;
            }
        }
    }

    /**
     * Read a graph written by {@link #write(ControlFlowGraph, OutputStream)}
     *
     * @param in
     *            source, not closed
     * @return the graph
     * @throws IOException
     *             if reading fails
     * @throws ParseException
     *             if the data is not a well-formed graph
     */
    public static ControlFlowGraph read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        try {
            if (data.readInt() != MAGIC) {
                throw new ParseException("Not a Chiron IR file");
            }
            short version = data.readShort();
            if (version != VERSION) {
                throw new ParseException("Unsupported IR version " + version);
            }
            String name = data.readUTF();
            int entryId = data.readInt();
            int blockCount = checkCount(data.readInt(), "blocks");
            Map<Integer, BasicBlock> blocks = new LinkedHashMap<>();
            for (int b = 0; b < blockCount; b++) {
                int id = data.readInt();
                String label = data.readUTF();
                int count = checkCount(data.readInt(), "instructions");
                List<Instruction> instructions = new ArrayList<>(count);
                for (int k = 0; k < count; k++) {
                    instructions.add(readInstruction(data));
                }
                if (blocks.put(id, IRReading.newBlock(id, label, instructions)) != null) {
                    throw new ParseException("Duplicate block id " + id);
                }
            }
            int edgeCount = checkCount(data.readInt(), "edges");
            List<Edge> edges = new ArrayList<>(edgeCount);
            for (int k = 0; k < edgeCount; k++) {
                BasicBlock source = IRReading.lookup(blocks, data.readInt());
                BasicBlock target = IRReading.lookup(blocks, data.readInt());
                edges.add(new Edge(source, target, enumValue(EdgeKind.values(), data.readByte(), "edge kind")));
            }
            return IRReading.newGraph(name, blocks, entryId, edges);
        } catch (EOFException e) {
            throw new ParseException("Truncated IR file", e);
        }
    }

    private static Instruction readInstruction(DataInputStream data) throws IOException {
        int id = data.readInt();
        InstructionType type = enumValue(InstructionType.values(), data.readByte(), "instruction type");
        switch (type) {
        case ASSIGN:
            String target = data.readUTF();
            return Instruction.assign(id, target, readExpr(data));
        case BRANCH:
            return Instruction.branch(id, readExpr(data));
        case CALL:
            TurtleOp op = enumValue(TurtleOp.values(), data.readByte(), "turtle operation");
            int argc = data.readByte();
            List<Expr> args = new ArrayList<>();
            for (int k = 0; k < argc; k++) {
                args.add(readExpr(data));
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

    private static Expr readExpr(DataInputStream data) throws IOException {
        int size = checkCount(data.readInt(), "expression nodes");
        Deque<Expr> values = new ArrayDeque<>();
        for (int k = 0; k < size; k++) {
            ExprKind kind = enumValue(ExprKind.values(), data.readByte(), "expression kind");
            switch (kind) {
            case INT_CONST:
                values.push(Expr.constant(data.readLong()));
                break;
            case BOOL_CONST:
                values.push(Expr.bool(data.readLong() != 0));
                break;
            case VAR:
                values.push(Expr.var(data.readUTF()));
                break;
            default:
                if (values.size() < kind.getArity()) {
                    throw new ParseException("Missing operand for " + kind);
                }
                if (kind.getArity() == 1) {
                    values.push(Expr.unary(kind, values.pop()));
                } else {
                    Expr right = values.pop();
                    Expr left = values.pop();
                    values.push(Expr.binary(kind, left, right));
                }
            }
        }
        if (values.size() != 1) {
            throw new ParseException("Malformed expression, " + values.size() + " values left");
        }
        return values.pop();
    }

    private static int checkCount(int count, String what) {
        if (count < 0) {
            throw new ParseException("Negative number of " + what + ": " + count);
        }
        return count;
    }

    private static <E extends Enum<E>> E enumValue(E[] values, int ordinal, String what) {
        if (ordinal < 0 || ordinal >= values.length) {
            throw new ParseException("Bad " + what + " " + ordinal);
        }
        return values[ordinal];
    }
}
