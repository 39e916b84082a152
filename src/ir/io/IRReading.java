package ir.io;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.List;
import java.util.Map;

/**
 * Construction steps shared by the IR readers, turning structural errors into {@link ParseException}s
 */
final class IRReading {

    private IRReading() {
        // static helpers only
    }

    static BasicBlock lookup(Map<Integer, BasicBlock> blocks, int id) {
        BasicBlock bb = blocks.get(id);
        if (bb == null) {
            throw new ParseException("Edge refers to unknown block " + id);
        }
        return bb;
    }

    static BasicBlock newBlock(int id, String label, List<Instruction> instructions) {
        try {
            return new BasicBlock(id, label, instructions);
        } catch (IllegalArgumentException e) {
            throw new ParseException("Malformed block " + label + ": " + e.getMessage(), e);
        }
    }

    static ControlFlowGraph newGraph(String name, Map<Integer, BasicBlock> blocks, int entryId, List<Edge> edges) {
        BasicBlock entry = blocks.get(entryId);
        if (entry == null) {
            throw new ParseException("Unknown entry block " + entryId);
        }
        try {
            return new ControlFlowGraph(name, blocks.values(), entry, edges);
        } catch (IllegalArgumentException e) {
            throw new ParseException("Malformed control flow graph: " + e.getMessage(), e);
        }
    }
}
