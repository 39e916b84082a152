package analysis.profile;

import ir.BasicBlock;
import ir.ControlFlowGraph;
import ir.Edge;
import ir.EdgeKind;
import ir.Instruction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.Logger;
import analysis.profile.BallLarusNumbering.PathEdge;
import ast.Expr;

/**
 * Inserts Ball-Larus path profiling code into a copy of a CFG. The path register {@link #PATH_REGISTER} is set to 0
 * at the entry and its value when a path ends, at an exit or on a back edge, is stored in {@link #PATH_RECORD}: that
 * value is the number the {@link BallLarusNumbering} gives the path. A back edge then restarts the register for the
 * path beginning at its target.
 * <p>
 * Register updates are only placed on chords. A maximum spanning tree of the acyclic graph (plus an edge from the
 * virtual exit back to the entry) is chosen with edges weighted by loop depth, so the edges expected to run most often
 * end up in the tree. Each node gets a potential from the increments along tree edges, and a chord u-&gt;v gets
 * increment(u-&gt;v) + potential(u) - potential(v). The updates along any path from the entry to the virtual exit still
 * add up to its path number, and chords whose increment comes out as 0 need no code at all.
 */
public class PathInstrumenter {

    /**
     * Variable holding the number of the current path so far
     */
    public static final String PATH_REGISTER = "$blPath";
    /**
     * Variable assigned the number of each path as it ends
     */
    public static final String PATH_RECORD = "$blPathRecord";

    private final BallLarusNumbering numbering;
    private final ControlFlowGraph cfg;
    /**
     * Register update for every chord, keyed by identity
     */
    private final Map<PathEdge, Long> chordIncrements = new IdentityHashMap<>();
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    public PathInstrumenter(BallLarusNumbering numbering) {
        this.numbering = numbering;
        this.cfg = numbering.getGraph();
        placeChords();
    }

    /**
     * Choose the spanning tree and compute the chord increments
     */
    private void placeChords() {
        List<BasicBlock> nodes = cfg.getReversePostorder();
        final Map<BasicBlock, Integer> index = new HashMap<>();
        for (BasicBlock bb : nodes) {
            index.put(bb, index.size());
        }
        final int virtualExit = nodes.size();
        final Map<BasicBlock, Integer> depth = loopDepths();

        List<PathEdge> edges = new ArrayList<>(numbering.getAcyclicEdges());
        final Map<PathEdge, Integer> weight = new IdentityHashMap<>();
        for (PathEdge pe : edges) {
            int w;
            if (pe.target == null) {
                w = depth.get(pe.source);
            } else if (pe.restart) {
                w = depth.get(pe.target);
            } else {
                w = Math.min(depth.get(pe.source), depth.get(pe.target));
            }
            weight.put(pe, w);
        }
        // heaviest first, stable so ties keep the reverse postorder
        Collections.sort(edges, new Comparator<PathEdge>() {
            @Override
            public int compare(PathEdge a, PathEdge b) {
                return Integer.compare(weight.get(b), weight.get(a));
            }
        });

        int[] parent = new int[nodes.size() + 1];
        for (int k = 0; k < parent.length; k++) {
            parent[k] = k;
        }
        int entry = index.get(cfg.getEntry());
        // the edge from the virtual exit back to the entry is always in the tree
        union(parent, entry, virtualExit);

        List<List<long[]>> tree = new ArrayList<>();
        for (int k = 0; k < parent.length; k++) {
            tree.add(new ArrayList<long[]>());
        }
        tree.get(entry).add(new long[] { virtualExit, 0 });
        tree.get(virtualExit).add(new long[] { entry, 0 });
        List<PathEdge> chords = new ArrayList<>();
        for (PathEdge pe : edges) {
            int u = index.get(pe.source);
            int v = pe.target == null ? virtualExit : index.get(pe.target);
            if (union(parent, u, v)) {
                tree.get(u).add(new long[] { v, pe.increment });
                tree.get(v).add(new long[] { u, -pe.increment });
            } else {
                chords.add(pe);
            }
        }

        long[] potential = new long[parent.length];
        boolean[] seen = new boolean[parent.length];
        Deque<Integer> work = new ArrayDeque<>();
        seen[entry] = true;
        work.add(entry);
        while (!work.isEmpty()) {
            int u = work.poll();
            for (long[] link : tree.get(u)) {
                int v = (int) link[0];
                if (!seen[v]) {
                    seen[v] = true;
                    potential[v] = potential[u] + link[1];
                    work.add(v);
                }
            }
        }

        for (PathEdge pe : chords) {
            int u = index.get(pe.source);
            int v = pe.target == null ? virtualExit : index.get(pe.target);
            chordIncrements.put(pe, pe.increment + potential[u] - potential[v]);
        }
    }

    /**
     * Union-find with path halving
     *
     * @return true if a and b were in different sets
     */
    private static boolean union(int[] parent, int a, int b) {
        int ra = root(parent, a);
        int rb = root(parent, b);
        if (ra == rb) {
            return false;
        }
        parent[ra] = rb;
        return true;
    }

    private static int root(int[] parent, int a) {
        while (parent[a] != a) {
            parent[a] = parent[parent[a]];
            a = parent[a];
        }
        return a;
    }

    /**
     * Number of natural loops containing each block
     */
    private Map<BasicBlock, Integer> loopDepths() {
        Map<BasicBlock, Set<BasicBlock>> bodies = new LinkedHashMap<>();
        for (Edge back : cfg.getBackEdges()) {
            BasicBlock header = back.getTarget();
            Set<BasicBlock> body = bodies.get(header);
            if (body == null) {
                body = new LinkedHashSet<>();
                body.add(header);
                bodies.put(header, body);
            }
            Deque<BasicBlock> work = new ArrayDeque<>();
            if (body.add(back.getSource())) {
                work.push(back.getSource());
            }
            while (!work.isEmpty()) {
                for (BasicBlock pred : cfg.getPredecessors(work.pop())) {
                    if (body.add(pred)) {
                        work.push(pred);
                    }
                }
            }
        }
        Map<BasicBlock, Integer> depth = new HashMap<>();
        for (BasicBlock bb : cfg) {
            depth.put(bb, 0);
        }
        for (Set<BasicBlock> body : bodies.values()) {
            for (BasicBlock bb : body) {
                depth.put(bb, depth.get(bb) + 1);
            }
        }
        return depth;
    }

    /**
     * @return register update on an acyclic edge, 0 for tree edges
     */
    private long updateOn(PathEdge pe) {
        Long inc = pe == null ? null : chordIncrements.get(pe);
        return inc == null ? 0 : inc;
    }

    /**
     * @return number of acyclic edges that are not in the spanning tree
     */
    public int getChordCount() {
        return chordIncrements.size();
    }

    /**
     * Copy the graph with the profiling code inserted. Updates on an edge go in a new block splitting that edge, the
     * record at an exit goes right before its RETURN.
     *
     * @return instrumented graph, block and instruction ids of the original are kept
     */
    public ControlFlowGraph instrument() {
        int nextBlockId = 0;
        for (BasicBlock bb : cfg) {
            nextBlockId = Math.max(nextBlockId, bb.getId() + 1);
        }
        int nextInstructionId = cfg.getMaxInstructionId() + 1;

        Map<BasicBlock, BasicBlock> copies = new LinkedHashMap<>();
        for (BasicBlock bb : cfg) {
            List<Instruction> instructions = new ArrayList<>(bb.getInstructions());
            if (bb.isExit()) {
                instructions.add(instructions.size() - 1, record(nextInstructionId++, bb));
            }
            if (bb.equals(cfg.getEntry())) {
                instructions.add(0, Instruction.assign(nextInstructionId++, PATH_REGISTER, Expr.constant(0)));
            }
            copies.put(bb, new BasicBlock(bb.getId(), bb.getLabel(), instructions));
        }

        List<BasicBlock> blocks = new ArrayList<>(copies.values());
        List<Edge> edges = new ArrayList<>();
        int splits = 0;
        for (Edge e : cfg.getEdges()) {
            List<Instruction> onEdge = new ArrayList<>();
            if (cfg.isBackEdge(e)) {
                onEdge.add(record(nextInstructionId++, e.getSource()));
                long start = updateOn(numbering.getRestartEdge(e.getTarget()));
                onEdge.add(Instruction.assign(nextInstructionId++, PATH_REGISTER, Expr.constant(start)));
            } else {
                long inc = updateOn(numbering.getEdge(e.getSource(), e.getTarget()));
                if (inc != 0) {
                    onEdge.add(Instruction.assign(nextInstructionId++, PATH_REGISTER,
                                                  Expr.add(Expr.var(PATH_REGISTER), Expr.constant(inc))));
                }
            }
            BasicBlock source = copies.get(e.getSource());
            BasicBlock target = copies.get(e.getTarget());
            if (onEdge.isEmpty()) {
                edges.add(new Edge(source, target, e.getKind()));
                continue;
            }
            BasicBlock split = new BasicBlock(nextBlockId++, "path", onEdge);
            blocks.add(split);
            splits++;
            edges.add(new Edge(source, split, e.getKind().isConditional() ? e.getKind() : EdgeKind.FALL_THROUGH));
            edges.add(new Edge(split, target, e.getKind() == EdgeKind.BACK_EDGE ? EdgeKind.BACK_EDGE
                    : EdgeKind.FALL_THROUGH));
        }
        if (outputLevel >= 1) {
            Logger.println("INSTRUMENTED " + cfg.getName() + ": " + getChordCount() + " chords, " + splits
                                            + " edges split");
        }
        if (outputLevel >= 2) {
            Logger.println("CHORD INCREMENTS " + chordIncrements);
        }
        return new ControlFlowGraph(cfg.getName(), blocks, copies.get(cfg.getEntry()), edges);
    }

    /**
     * Store the number of the path ending at bb
     */
    private Instruction record(int id, BasicBlock bb) {
        long inc = updateOn(numbering.getEndEdge(bb));
        Expr value = inc == 0 ? Expr.var(PATH_REGISTER) : Expr.add(Expr.var(PATH_REGISTER), Expr.constant(inc));
        return Instruction.assign(id, PATH_RECORD, value);
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
