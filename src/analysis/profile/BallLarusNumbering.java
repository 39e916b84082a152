package analysis.profile;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.dataflow.AnalysisException;

/**
 * Ball-Larus numbering of the acyclic paths of a CFG. The graph is made acyclic by replacing every back edge v-&gt;w
 * with two dummy edges, entry-&gt;w and v-&gt;exit, where exit is a virtual node every exit block also flows to. Each
 * node gets NumPaths, the number of paths from it to the virtual exit, and each edge an increment such that the
 * increments along any path from the entry to the virtual exit sum to a distinct number in [0, NumPaths(entry)).
 * <p>
 * An execution is cut into such paths at its back edges: the first path starts at the entry, each later one at the
 * target of the back edge that ended the previous one. Parallel edges (a branch with both sides going to the same
 * block) are numbered as one, so numbers identify block sequences.
 */
public class BallLarusNumbering {

    /**
     * Edge of the acyclic graph
     */
    static final class PathEdge {
        final BasicBlock source;
        /**
         * null for the virtual exit
         */
        final BasicBlock target;
        /**
         * True for the dummy edge from the entry to a back edge target
         */
        final boolean restart;
        long increment;

        PathEdge(BasicBlock source, BasicBlock target, boolean restart) {
            this.source = source;
            this.target = target;
            this.restart = restart;
        }

        @Override
        public String toString() {
            return source + " -> " + (target == null ? "EXIT*" : target.toString()) + " +" + increment;
        }
    }

    private final ControlFlowGraph cfg;
    private final Map<BasicBlock, List<PathEdge>> out = new LinkedHashMap<>();
    private final Map<BasicBlock, Long> numPaths = new HashMap<>();
    /**
     * Edge to the virtual exit from exit blocks and back edge sources
     */
    private final Map<BasicBlock, PathEdge> toExit = new HashMap<>();
    /**
     * Dummy edge from the entry for every back edge target other than the entry itself
     */
    private final Map<BasicBlock, PathEdge> fromEntry = new HashMap<>();

    /**
     * Number the paths of a CFG
     *
     * @param cfg
     *            graph to number
     * @throws AnalysisException
     *             if there are too many paths to number with a long
     */
    public BallLarusNumbering(ControlFlowGraph cfg) {
        this.cfg = cfg;
        BasicBlock entry = cfg.getEntry();
        for (BasicBlock bb : cfg.getReversePostorder()) {
            out.put(bb, new ArrayList<PathEdge>());
        }
        for (BasicBlock bb : cfg.getReversePostorder()) {
            for (Edge e : cfg.getOutgoingEdges(bb)) {
                if (cfg.isBackEdge(e)) {
                    if (!toExit.containsKey(bb)) {
                        addEdge(new PathEdge(bb, null, false));
                    }
                    BasicBlock w = e.getTarget();
                    if (!w.equals(entry) && !fromEntry.containsKey(w)) {
                        addEdge(new PathEdge(entry, w, true));
                    }
                } else if (find(bb, e.getTarget()) == null) {
                    addEdge(new PathEdge(bb, e.getTarget(), false));
                }
            }
            if (bb.isExit()) {
                addEdge(new PathEdge(bb, null, false));
            }
        }
        assignIncrements();
    }

    private void addEdge(PathEdge pe) {
        out.get(pe.source).add(pe);
        if (pe.target == null) {
            toExit.put(pe.source, pe);
        } else if (pe.restart) {
            fromEntry.put(pe.target, pe);
        }
    }

    /**
     * Non-dummy edge from source to target, or null
     */
    private PathEdge find(BasicBlock source, BasicBlock target) {
        for (PathEdge pe : out.get(source)) {
            if (!pe.restart && target.equals(pe.target)) {
                return pe;
            }
        }
        return null;
    }

    /**
     * Compute NumPaths and the increments, visiting nodes in reverse topological order of the acyclic graph
     */
    private void assignIncrements() {
        for (BasicBlock v : acyclicPostorder()) {
            long val = 0;
            for (PathEdge pe : out.get(v)) {
                pe.increment = val;
                long paths = pe.target == null ? 1 : numPaths.get(pe.target);
                try {
                    val = Math.addExact(val, paths);
                } catch (ArithmeticException e) {
                    throw new AnalysisException("Too many acyclic paths to number in " + cfg.getName(), v);
                }
            }
            numPaths.put(v, val);
        }
    }

    /**
     * Iterative depth-first postorder over the acyclic graph from the entry
     */
    private List<BasicBlock> acyclicPostorder() {
        List<BasicBlock> postorder = new ArrayList<>();
        Set<BasicBlock> visited = new HashSet<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        Deque<Iterator<PathEdge>> iterators = new ArrayDeque<>();
        visited.add(cfg.getEntry());
        stack.push(cfg.getEntry());
        iterators.push(out.get(cfg.getEntry()).iterator());
        while (!stack.isEmpty()) {
            Iterator<PathEdge> iter = iterators.peek();
            if (iter.hasNext()) {
                BasicBlock succ = iter.next().target;
                if (succ != null && visited.add(succ)) {
                    stack.push(succ);
                    iterators.push(out.get(succ).iterator());
                }
            } else {
                iterators.pop();
                postorder.add(stack.pop());
            }
        }
        return postorder;
    }

    /**
     * @return number of distinct acyclic paths, path numbers range from 0 to this minus one
     */
    public long getNumPaths() {
        return numPaths.get(cfg.getEntry());
    }

    /**
     * @param bb
     *            block
     * @return number of acyclic paths from bb to the virtual exit
     */
    public long getNumPaths(BasicBlock bb) {
        return numPaths.get(bb);
    }

    /**
     * Increment of a CFG edge
     *
     * @param e
     *            edge that is not a back edge
     * @return value added to the path register when e is followed
     */
    public long getIncrement(Edge e) {
        if (cfg.isBackEdge(e)) {
            throw new IllegalArgumentException(e + " is a back edge");
        }
        return find(e.getSource(), e.getTarget()).increment;
    }

    /**
     * Value added when a path ends at bb, either because bb is an exit or because a back edge leaves it
     *
     * @param bb
     *            exit block or back edge source
     * @return increment of the edge from bb to the virtual exit
     */
    public long getEndIncrement(BasicBlock bb) {
        PathEdge pe = toExit.get(bb);
        if (pe == null) {
            throw new IllegalArgumentException("No path ends at " + bb);
        }
        return pe.increment;
    }

    /**
     * Initial value of the path register for a path starting at bb
     *
     * @param bb
     *            entry or back edge target
     * @return increment of the dummy edge from the entry to bb, 0 for the entry
     */
    public long getStartValue(BasicBlock bb) {
        if (bb.equals(cfg.getEntry())) {
            return 0;
        }
        PathEdge pe = fromEntry.get(bb);
        if (pe == null) {
            throw new IllegalArgumentException("No path starts at " + bb);
        }
        return pe.increment;
    }

    /**
     * Number of a path given by its blocks
     *
     * @param path
     *            blocks from the start of a path (entry or back edge target) to its end (exit or back edge source)
     * @return path number
     * @throws IllegalArgumentException
     *             if the blocks do not form an acyclic path of the graph
     */
    public long getPathNumber(List<BasicBlock> path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Empty path");
        }
        long n = getStartValue(path.get(0));
        for (int k = 1; k < path.size(); k++) {
            PathEdge pe = find(path.get(k - 1), path.get(k));
            if (pe == null) {
                throw new IllegalArgumentException("No acyclic edge " + path.get(k - 1) + " -> " + path.get(k));
            }
            n += pe.increment;
        }
        return n + getEndIncrement(path.get(path.size() - 1));
    }

    /**
     * Blocks of the path with the given number
     *
     * @param number
     *            path number in [0, {@link #getNumPaths()})
     * @return blocks of the path, from its start to its end
     */
    public List<BasicBlock> regeneratePath(long number) {
        if (number < 0 || number >= getNumPaths()) {
            throw new IllegalArgumentException("Path number " + number + " out of range [0, " + getNumPaths() + ")");
        }
        List<BasicBlock> path = new ArrayList<>();
        long remaining = number;
        BasicBlock v = cfg.getEntry();
        PathEdge pe = choose(v, remaining);
        if (!pe.restart) {
            path.add(v);
        }
        while (pe.target != null) {
            remaining -= pe.increment;
            v = pe.target;
            path.add(v);
            pe = choose(v, remaining);
        }
        return path;
    }

    /**
     * The edge out of v with the largest increment not above the remaining value
     */
    private PathEdge choose(BasicBlock v, long remaining) {
        PathEdge chosen = null;
        for (PathEdge pe : out.get(v)) {
            if (pe.increment <= remaining) {
                chosen = pe;
            }
        }
        return chosen;
    }

    public ControlFlowGraph getGraph() {
        return cfg;
    }

    /**
     * @return every edge of the acyclic graph, dummy edges included, grouped by source in reverse postorder
     */
    List<PathEdge> getAcyclicEdges() {
        List<PathEdge> all = new ArrayList<>();
        for (List<PathEdge> edges : out.values()) {
            all.addAll(edges);
        }
        return all;
    }

    /**
     * @return acyclic edge standing for the CFG edge source-&gt;target, null if there is none
     */
    PathEdge getEdge(BasicBlock source, BasicBlock target) {
        return find(source, target);
    }

    /**
     * @return edge to the virtual exit from an exit block or back edge source
     */
    PathEdge getEndEdge(BasicBlock bb) {
        return toExit.get(bb);
    }

    /**
     * @return dummy edge from the entry to a back edge target, null for the entry itself
     */
    PathEdge getRestartEdge(BasicBlock bb) {
        return fromEntry.get(bb);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Ball-Larus numbering of ").append(cfg.getName()).append(", ").append(getNumPaths())
          .append(" paths\n");
        for (List<PathEdge> edges : out.values()) {
            for (PathEdge pe : edges) {
                sb.append("  ").append(pe).append("\n");
            }
        }
        return sb.toString();
    }
}
