package util.print;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.EdgeKind;
import ir.Instruction;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

/**
 * Human readable listing of a control flow graph, one block at a time with explicit successors
 */
public class PrettyPrinter {

    /**
     * Graph being printed
     */
    private final ControlFlowGraph cfg;

    public PrettyPrinter(ControlFlowGraph cfg) {
        this.cfg = cfg;
    }

    /**
     * String for an instruction including where control goes next if it ends a block
     *
     * @param i
     *            instruction to print
     * @return string for the instruction
     */
    public String instructionString(Instruction i) {
        BasicBlock bb = cfg.getBlockForInstruction(i.getId());
        switch (i.getType()) {
        case ASSIGN:
        case CALL:
        case RETURN:
            return i.toString();
        case BRANCH:
            return "if " + i.getExpr() + " goto " + cfg.getTrueSuccessor(bb) + " else " + cfg.getFalseSuccessor(bb);
        case JUMP:
            return "goto " + cfg.getUniqueSuccessor(bb);
        default:
            throw new IllegalArgumentException("Unknown instruction type " + i.getType());
        }
    }

    /**
     * Write the listing
     *
     * @param writer
     *            destination, not closed
     * @param prefix
     *            prepended to each instruction (e.g. "\t" to indent)
     * @param postfix
     *            appended to each line
     * @throws IOException
     *             writer issues
     */
    public void write(Writer writer, String prefix, String postfix) throws IOException {
        writer.write("program " + cfg.getName() + postfix);
        for (BasicBlock bb : cfg.getReversePostorder()) {
            writer.write(bb.getLabel() + ":" + (bb == cfg.getEntry() ? " (entry)" : "") + postfix);
            for (Instruction i : bb.getInstructions()) {
                writer.write(prefix + i.getId() + ": " + instructionString(i) + postfix);
            }
            Instruction last = bb.getTerminator();
            if (last == null) {
                // falls through, make the successor explicit
                List<Edge> out = cfg.getOutgoingEdges(bb);
                if (!out.isEmpty()) {
                    Edge e = out.get(0);
                    writer.write(prefix + (e.getKind() == EdgeKind.BACK_EDGE ? "loop to " : "continue to ")
                                                    + e.getTarget() + postfix);
                }
            }
        }
    }

    /**
     * Listing of a whole graph as a string
     *
     * @param cfg
     *            graph to print
     * @return multi-line listing
     */
    public static String cfgString(ControlFlowGraph cfg) {
        StringWriter sw = new StringWriter();
        try {
            new PrettyPrinter(cfg).write(sw, "    ", "\n");
        } catch (IOException e) {
            throw new RuntimeException("StringWriter threw IOException", e);
        }
        return sw.toString();
    }
}
