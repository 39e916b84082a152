package util.print;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

/**
 * Write out a control flow graph in graphviz dot format
 */
public class CFGWriter {

    /**
     * Graph to be written
     */
    private final ControlFlowGraph cfg;
    /**
     * If true then code will be included in CFG, otherwise it will just be block labels
     */
    private boolean verbose;
    /**
     * Extra text shown under each block, e.g. analysis results
     */
    private final Map<BasicBlock, String> annotations = new HashMap<>();
    /**
     * Pretty printer
     */
    private final PrettyPrinter pp;

    /**
     * Create a writer for the given graph
     *
     * @param cfg
     *            graph to be printed
     */
    public CFGWriter(ControlFlowGraph cfg) {
        assert cfg != null : "Cannot print null CFG";
        this.cfg = cfg;
        this.pp = new PrettyPrinter(cfg);
    }

    /**
     * Show extra text in the node for a block
     *
     * @param bb
     *            block to annotate
     * @param text
     *            text to show below the code
     */
    public void annotate(BasicBlock bb, String text) {
        annotations.put(bb, text);
    }

    /**
     * Write out the graph to the given writer
     *
     * @param writer
     *            writer to write the graph to
     * @param prefix
     *            prepended to each instruction (e.g. "\t" to indent)
     * @param postfix
     *            appended to each instruction (e.g. "\\l" to left-justify each instruction on its own line)
     * @throws IOException
     *             writer issues
     */
    public final void write(Writer writer, String prefix, String postfix) throws IOException {
        double spread = 1.0;
        writer.write("digraph G {\n" + "node [shape=record];\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread
                                        + ";\n" + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n"
                                        + "edge [fontsize=10]" + ";\n");
        for (BasicBlock bb : cfg) {
            writer.write("\t" + nodeName(bb) + " [label=\"" + nodeLabel(bb, prefix, postfix) + "\"];\n");
        }
        for (Edge e : cfg.getEdges()) {
            String style = cfg.isBackEdge(e) ? ", style=dashed" : "";
            writer.write("\t" + nodeName(e.getSource()) + " -> " + nodeName(e.getTarget()) + " [label=\""
                                            + e.getKind() + "\"" + style + "];\n");
        }
        writer.write("\n};\n");
    }

    /**
     * Write out the graph with the code of each block written on its node
     *
     * @param writer
     *            writer to write the graph to
     * @param prefix
     *            prepended to each instruction
     * @param postfix
     *            appended to each instruction
     * @throws IOException
     *             writer issues
     */
    public final void writeVerbose(Writer writer, String prefix, String postfix) throws IOException {
        this.verbose = true;
        write(writer, prefix, postfix);
    }

    /**
     * Write the graph with code to a dot file with the given name
     *
     * @param cfg
     *            graph to write
     * @param filename
     *            file name, ".dot" is appended
     */
    public static final void writeToFile(ControlFlowGraph cfg, String filename) {
        CFGWriter w = new CFGWriter(cfg);
        String fullFilename = filename + ".dot";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            w.writeVerbose(out, "", "\\l");
            System.err.println("DOT written to: " + fullFilename);
        } catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
        }
    }

    private static String nodeName(BasicBlock bb) {
        return "\"" + bb.getLabel() + "\"";
    }

    private String nodeLabel(BasicBlock bb, String prefix, String postfix) {
        StringBuilder sb = new StringBuilder();
        sb.append(escape(bb.getLabel()));
        if (verbose && !bb.isEmpty()) {
            sb.append("|");
            for (Instruction i : bb.getInstructions()) {
                sb.append(prefix).append(escape(pp.instructionString(i))).append(postfix);
            }
        }
        String note = annotations.get(bb);
        if (note != null) {
            sb.append("|").append(escape(note)).append(postfix);
        }
        return sb.toString();
    }

    /**
     * Escape characters that have a meaning inside a record label
     */
    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("{", "\\{").replace("}", "\\}")
                                        .replace("<", "\\<").replace(">", "\\>").replace("|", "\\|");
    }
}
