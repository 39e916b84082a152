package analysis.profile;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import util.Logger;
import analysis.interpreter.AssignmentListener;
import analysis.interpreter.ExecutionResult;

/**
 * Counts how often each Ball-Larus path is executed. Traces come from the concrete interpreter; each one is split at
 * its back edges and every complete acyclic path is numbered with {@link BallLarusNumbering}. Alternatively the graph
 * instrumented by {@link PathInstrumenter} computes the numbers itself and {@link #recorder()} counts them.
 */
public class PathProfiler {

    private final ControlFlowGraph cfg;
    private final BallLarusNumbering numbering;
    private final Map<Long, Integer> counts = new TreeMap<>();
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    public PathProfiler(ControlFlowGraph cfg) {
        this(new BallLarusNumbering(cfg));
    }

    public PathProfiler(BallLarusNumbering numbering) {
        this.cfg = numbering.getGraph();
        this.numbering = numbering;
    }

    /**
     * Record the paths of an interpreter run. The last path is only recorded if the run reached an exit.
     *
     * @param run
     *            result of running the profiled graph
     */
    public void addRun(ExecutionResult run) {
        addTrace(run.getTrace(), run.isTerminated());
    }

    /**
     * Record the paths of a block trace
     *
     * @param trace
     *            ids of the blocks executed, starting at the entry
     * @param reachedExit
     *            true if the trace ends at an exit block
     * @return numbers of the recorded paths, in execution order
     */
    public List<Long> addTrace(List<Integer> trace, boolean reachedExit) {
        List<Long> numbers = new ArrayList<>();
        List<BasicBlock> current = new ArrayList<>();
        BasicBlock previous = null;
        for (Integer id : trace) {
            BasicBlock bb = cfg.getBlock(id);
            if (previous != null && isBackEdge(previous, bb)) {
                numbers.add(record(current));
                current = new ArrayList<>();
            }
            current.add(bb);
            previous = bb;
        }
        if (reachedExit && !current.isEmpty()) {
            numbers.add(record(current));
        }
        return numbers;
    }

    private boolean isBackEdge(BasicBlock source, BasicBlock target) {
        for (Edge e : cfg.getOutgoingEdges(source)) {
            if (e.getTarget().equals(target) && cfg.isBackEdge(e)) {
                return true;
            }
        }
        return false;
    }

    private long record(List<BasicBlock> path) {
        long n = numbering.getPathNumber(path);
        count(n);
        if (outputLevel >= 3) {
            Logger.println("PATH " + n + " " + path);
        }
        return n;
    }

    private void count(long pathNumber) {
        Integer c = counts.get(pathNumber);
        counts.put(pathNumber, c == null ? 1 : c + 1);
    }

    /**
     * Listener to pass to the interpreter running the graph instrumented for this profiler's numbering. It counts
     * every path number stored in {@link PathInstrumenter#PATH_RECORD}.
     *
     * @return listener adding to this profile
     */
    public AssignmentListener recorder() {
        return new AssignmentListener() {
            @Override
            public void assigned(Instruction i, long value) {
                if (PathInstrumenter.PATH_RECORD.equals(i.getTarget())) {
                    count(value);
                    if (outputLevel >= 3) {
                        Logger.println("PATH " + value + " recorded by " + i);
                    }
                }
            }
        };
    }

    /**
     * @return execution count of every path seen, by path number
     */
    public Map<Long, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    /**
     * @param pathNumber
     *            Ball-Larus path number
     * @return number of times the path was executed
     */
    public int getCount(long pathNumber) {
        Integer c = counts.get(pathNumber);
        return c == null ? 0 : c;
    }

    public BallLarusNumbering getNumbering() {
        return numbering;
    }

    /**
     * Human readable profile, one line per executed path with its blocks
     *
     * @return profile report
     */
    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append(numbering.getNumPaths()).append(" acyclic paths, ").append(counts.size()).append(" executed\n");
        for (Map.Entry<Long, Integer> e : counts.entrySet()) {
            sb.append("  path ").append(e.getKey()).append(" x").append(e.getValue()).append(": ")
              .append(numbering.regeneratePath(e.getKey())).append("\n");
        }
        return sb.toString();
    }

    /**
     * Set the level of console output, higher means more output
     *
     * @param outputLevel
     *            new output level
     */
    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }
}
