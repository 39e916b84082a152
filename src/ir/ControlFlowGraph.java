package ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ibm.wala.util.graph.NumberedGraph;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.DFS;

/**
 * Immutable control flow graph for a Turtle program. Blocks are the nodes of a WALA {@link NumberedGraph}; the
 * labelled edges are kept alongside it. Every block is reachable from the entry: blocks that are not are dropped when
 * the graph is created. Reverse postorder, postorder and back edges are computed once, on creation.
 */
public class ControlFlowGraph implements Iterable<BasicBlock> {

    /**
     * Name of the program
     */
    private final String name;
    /**
     * Unlabelled graph structure, one node per block
     */
    private final NumberedGraph<BasicBlock> graph;
    /**
     * Blocks in increasing id order
     */
    private final List<BasicBlock> blocks;
    /**
     * Blocks by id
     */
    private final Map<Integer, BasicBlock> blocksById;
    /**
     * Entry block
     */
    private final BasicBlock entry;
    /**
     * Reachable blocks ending in RETURN
     */
    private final Set<BasicBlock> exits;
    /**
     * Outgoing edges for each block, in insertion order
     */
    private final Map<BasicBlock, List<Edge>> outEdges;
    /**
     * Incoming edges for each block, in insertion order
     */
    private final Map<BasicBlock, List<Edge>> inEdges;
    /**
     * Block containing each instruction, keyed by instruction id
     */
    private final Map<Integer, BasicBlock> blockForInstruction;
    /**
     * Postorder of a depth-first traversal from the entry
     */
    private final List<BasicBlock> postorder;
    /**
     * Reverse of {@link #postorder}
     */
    private final List<BasicBlock> reversePostorder;
    /**
     * Edges whose target is on the depth-first stack when the edge is explored, these close every cycle
     */
    private final Set<Edge> backEdges;
    /**
     * Number of blocks that were dropped because they could not be reached from the entry
     */
    private final int removedBlockCount;

    /**
     * Create a control flow graph. Blocks (and their edges) not reachable from the entry are dropped.
     *
     * @param name
     *            name of the program
     * @param allBlocks
     *            blocks, ids must be distinct
     * @param entry
     *            entry block, must be one of the blocks
     * @param edges
     *            labelled edges between the blocks
     * @throws IllegalArgumentException
     *             if the edges do not match the block terminators, or ids are duplicated
     */
    public ControlFlowGraph(String name, Collection<BasicBlock> allBlocks, BasicBlock entry, Collection<Edge> edges) {
        this.name = name;
        this.entry = entry;

        SlowSparseNumberedGraph<BasicBlock> full = SlowSparseNumberedGraph.make();
        Set<Integer> ids = new HashSet<>();
        for (BasicBlock bb : allBlocks) {
            if (!ids.add(bb.getId())) {
                throw new IllegalArgumentException("Duplicate block id " + bb.getId());
            }
            full.addNode(bb);
        }
        if (!full.containsNode(entry)) {
            throw new IllegalArgumentException("Entry block " + entry + " is not in the graph");
        }
        for (Edge e : edges) {
            if (!full.containsNode(e.getSource()) || !full.containsNode(e.getTarget())) {
                throw new IllegalArgumentException("Edge " + e + " has an endpoint outside the graph");
            }
            full.addEdge(e.getSource(), e.getTarget());
        }

        Set<BasicBlock> reachable = DFS.getReachableNodes(full, Collections.singleton(entry));
        List<BasicBlock> sorted = new ArrayList<>(reachable);
        Collections.sort(sorted, new Comparator<BasicBlock>() {
            @Override
            public int compare(BasicBlock o1, BasicBlock o2) {
                return Integer.compare(o1.getId(), o2.getId());
            }
        });
        this.blocks = Collections.unmodifiableList(sorted);
        this.removedBlockCount = allBlocks.size() - sorted.size();

        this.graph = SlowSparseNumberedGraph.make();
        this.blocksById = new LinkedHashMap<>();
        this.outEdges = new LinkedHashMap<>();
        this.inEdges = new LinkedHashMap<>();
        this.blockForInstruction = new HashMap<>();
        Set<BasicBlock> exitBlocks = new LinkedHashSet<>();
        for (BasicBlock bb : blocks) {
            graph.addNode(bb);
            blocksById.put(bb.getId(), bb);
            outEdges.put(bb, new ArrayList<Edge>(2));
            inEdges.put(bb, new ArrayList<Edge>(2));
            for (Instruction i : bb.getInstructions()) {
                if (blockForInstruction.put(i.getId(), bb) != null) {
                    throw new IllegalArgumentException("Duplicate instruction id " + i.getId() + " in " + bb);
                }
            }
            if (bb.isExit()) {
                exitBlocks.add(bb);
            }
        }
        this.exits = Collections.unmodifiableSet(exitBlocks);

        Set<Edge> seen = new HashSet<>();
        for (Edge e : edges) {
            if (reachable.contains(e.getSource()) && seen.add(e)) {
                outEdges.get(e.getSource()).add(e);
                inEdges.get(e.getTarget()).add(e);
                graph.addEdge(e.getSource(), e.getTarget());
            }
        }
        for (BasicBlock bb : blocks) {
            checkEdges(bb, outEdges.get(bb));
        }

        this.postorder = new ArrayList<>(blocks.size());
        this.backEdges = new LinkedHashSet<>();
        computeDepthFirstOrder();
        List<BasicBlock> rpo = new ArrayList<>(postorder);
        Collections.reverse(rpo);
        this.reversePostorder = Collections.unmodifiableList(rpo);
    }

    /**
     * Make sure the edges leaving a block agree with its terminator
     *
     * @param bb
     *            block
     * @param out
     *            edges leaving bb
     */
    private static void checkEdges(BasicBlock bb, List<Edge> out) {
        Instruction term = bb.getTerminator();
        InstructionType type = term == null ? null : term.getType();
        if (type == InstructionType.RETURN) {
            if (!out.isEmpty()) {
                throw new IllegalArgumentException("Exit block " + bb + " has successors " + out);
            }
            return;
        }
        if (type == InstructionType.BRANCH) {
            int trueEdges = 0;
            int falseEdges = 0;
            for (Edge e : out) {
                if (e.getKind() == EdgeKind.BRANCH_TRUE) {
                    trueEdges++;
                } else if (e.getKind() == EdgeKind.BRANCH_FALSE) {
                    falseEdges++;
                }
            }
            if (out.size() != 2 || trueEdges != 1 || falseEdges != 1) {
                throw new IllegalArgumentException("Branch block " + bb + " needs one true and one false edge, found "
                                                + out);
            }
            return;
        }
        // JUMP or fall through
        if (out.size() != 1) {
            throw new IllegalArgumentException("Block " + bb + " needs exactly one successor, found " + out);
        }
        if (out.get(0).getKind().isConditional()) {
            throw new IllegalArgumentException("Conditional edge " + out.get(0) + " from a block with no branch");
        }
    }

    /**
     * Iterative depth-first traversal from the entry computing the postorder and the back edges
     */
    private void computeDepthFirstOrder() {
        Set<BasicBlock> visited = new HashSet<>();
        Set<BasicBlock> onStack = new HashSet<>();
        Deque<BasicBlock> stack = new ArrayDeque<>();
        Deque<Iterator<Edge>> edgeIterators = new ArrayDeque<>();

        visited.add(entry);
        onStack.add(entry);
        stack.push(entry);
        edgeIterators.push(outEdges.get(entry).iterator());
        while (!stack.isEmpty()) {
            Iterator<Edge> iter = edgeIterators.peek();
            if (iter.hasNext()) {
                Edge e = iter.next();
                BasicBlock succ = e.getTarget();
                if (onStack.contains(succ)) {
                    backEdges.add(e);
                } else if (visited.add(succ)) {
                    onStack.add(succ);
                    stack.push(succ);
                    edgeIterators.push(outEdges.get(succ).iterator());
                }
            } else {
                BasicBlock done = stack.pop();
                edgeIterators.pop();
                onStack.remove(done);
                postorder.add(done);
            }
        }
    }

    public String getName() {
        return name;
    }

    public BasicBlock getEntry() {
        return entry;
    }

    /**
     * Reachable blocks that end the program, may be empty if the program never terminates
     *
     * @return exit blocks
     */
    public Set<BasicBlock> getExits() {
        return exits;
    }

    /**
     * @return all blocks in increasing id order
     */
    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public int getNumberOfBlocks() {
        return blocks.size();
    }

    /**
     * Get a block by id
     *
     * @param id
     *            block identifier
     * @return the block, or null if there is none with that id
     */
    public BasicBlock getBlock(int id) {
        return blocksById.get(id);
    }

    /**
     * Block containing the instruction with the given id
     *
     * @param instructionId
     *            id of the instruction
     * @return containing block or null if the instruction is not in this graph
     */
    public BasicBlock getBlockForInstruction(int instructionId) {
        return blockForInstruction.get(instructionId);
    }

    /**
     * Largest instruction id used in this graph
     *
     * @return maximum id, or -1 if the graph has no instructions
     */
    public int getMaxInstructionId() {
        int max = -1;
        for (Integer id : blockForInstruction.keySet()) {
            max = Math.max(max, id);
        }
        return max;
    }

    public List<Edge> getOutgoingEdges(BasicBlock bb) {
        return Collections.unmodifiableList(outEdges.get(bb));
    }

    public List<Edge> getIncomingEdges(BasicBlock bb) {
        return Collections.unmodifiableList(inEdges.get(bb));
    }

    /**
     * Distinct successors of a block
     *
     * @param bb
     *            block
     * @return successors in edge order
     */
    public Set<BasicBlock> getSuccessors(BasicBlock bb) {
        Set<BasicBlock> succs = new LinkedHashSet<>();
        for (Edge e : outEdges.get(bb)) {
            succs.add(e.getTarget());
        }
        return succs;
    }

    /**
     * Distinct predecessors of a block
     *
     * @param bb
     *            block
     * @return predecessors in edge order
     */
    public Set<BasicBlock> getPredecessors(BasicBlock bb) {
        Set<BasicBlock> preds = new LinkedHashSet<>();
        for (Edge e : inEdges.get(bb)) {
            preds.add(e.getSource());
        }
        return preds;
    }

    /**
     * Edge of the given kind leaving a block
     *
     * @param bb
     *            source block
     * @param kind
     *            edge label
     * @return the edge, or null if there is none
     */
    public Edge getOutgoingEdge(BasicBlock bb, EdgeKind kind) {
        for (Edge e : outEdges.get(bb)) {
            if (e.getKind() == kind) {
                return e;
            }
        }
        return null;
    }

    /**
     * Successor taken when the branch at the end of bb is true
     *
     * @param bb
     *            block ending in a BRANCH
     * @return target of the BRANCH_TRUE edge
     */
    public BasicBlock getTrueSuccessor(BasicBlock bb) {
        return getOutgoingEdge(bb, EdgeKind.BRANCH_TRUE).getTarget();
    }

    /**
     * Successor taken when the branch at the end of bb is false
     *
     * @param bb
     *            block ending in a BRANCH
     * @return target of the BRANCH_FALSE edge
     */
    public BasicBlock getFalseSuccessor(BasicBlock bb) {
        return getOutgoingEdge(bb, EdgeKind.BRANCH_FALSE).getTarget();
    }

    /**
     * Single successor of a block that does not branch
     *
     * @param bb
     *            block ending in a JUMP or falling through
     * @return the successor
     */
    public BasicBlock getUniqueSuccessor(BasicBlock bb) {
        List<Edge> out = outEdges.get(bb);
        assert out.size() == 1 : "No unique successor for " + bb;
        return out.get(0).getTarget();
    }

    /**
     * Blocks in reverse postorder, the iteration order for forward analyses
     *
     * @return unmodifiable list starting with the entry
     */
    public List<BasicBlock> getReversePostorder() {
        return reversePostorder;
    }

    /**
     * Blocks in postorder, the iteration order for backward analyses
     *
     * @return unmodifiable list ending with the entry
     */
    public List<BasicBlock> getPostorder() {
        return Collections.unmodifiableList(postorder);
    }

    /**
     * Does this edge close a cycle. The edges labelled {@link EdgeKind#BACK_EDGE} always do, a branch edge does when
     * the loop body ends in a conditional.
     *
     * @param e
     *            edge of this graph
     * @return true if the target is an ancestor of the source in the depth-first tree
     */
    public boolean isBackEdge(Edge e) {
        return backEdges.contains(e);
    }

    /**
     * @return all edges closing a cycle
     */
    public Set<Edge> getBackEdges() {
        return Collections.unmodifiableSet(backEdges);
    }

    /**
     * Targets of back edges
     *
     * @return loop header blocks
     */
    public Set<BasicBlock> getLoopHeaders() {
        Set<BasicBlock> headers = new LinkedHashSet<>();
        for (Edge e : backEdges) {
            headers.add(e.getTarget());
        }
        return headers;
    }

    /**
     * @return every edge of the graph, grouped by source block
     */
    public List<Edge> getEdges() {
        List<Edge> all = new ArrayList<>();
        for (BasicBlock bb : blocks) {
            all.addAll(outEdges.get(bb));
        }
        return all;
    }

    /**
     * Variables read or written anywhere in the program
     *
     * @return variable names in order of first appearance
     */
    public Set<String> getVariables() {
        Set<String> vars = new LinkedHashSet<>();
        for (BasicBlock bb : blocks) {
            for (Instruction i : bb.getInstructions()) {
                if (i.getDef() != null) {
                    vars.add(i.getDef());
                }
                vars.addAll(i.getUses());
            }
        }
        return vars;
    }

    /**
     * Variables read before any assignment on some path from the entry, i.e. the program inputs
     *
     * @return variables that are read but never assigned
     */
    public Set<String> getInputVariables() {
        Set<String> defined = new HashSet<>();
        for (BasicBlock bb : blocks) {
            for (Instruction i : bb.getInstructions()) {
                if (i.getDef() != null) {
                    defined.add(i.getDef());
                }
            }
        }
        Set<String> inputs = new LinkedHashSet<>(getVariables());
        inputs.removeAll(defined);
        return inputs;
    }

    /**
     * Number of blocks that were not reachable from the entry and were therefore dropped
     *
     * @return count of removed blocks
     */
    public int getRemovedBlockCount() {
        return removedBlockCount;
    }

    /**
     * Underlying WALA graph, for use with WALA graph algorithms. Callers must not modify it.
     *
     * @return graph with one node per block
     */
    public NumberedGraph<BasicBlock> getGraph() {
        return graph;
    }

    /**
     * Structural equality: same entry id, same blocks (id, label and instructions) and the same labelled edges
     *
     * @param other
     *            graph to compare against
     * @return true if the two graphs are structurally equal
     */
    public boolean structurallyEquals(ControlFlowGraph other) {
        if (other == null || blocks.size() != other.blocks.size() || entry.getId() != other.entry.getId()) {
            return false;
        }
        for (BasicBlock bb : blocks) {
            BasicBlock otherBB = other.getBlock(bb.getId());
            if (otherBB == null || !bb.getLabel().equals(otherBB.getLabel())
                                            || !bb.getInstructions().equals(otherBB.getInstructions())) {
                return false;
            }
            Set<String> mine = edgeSignatures(outEdges.get(bb));
            Set<String> theirs = edgeSignatures(other.outEdges.get(otherBB));
            if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> edgeSignatures(List<Edge> edges) {
        Set<String> sigs = new HashSet<>();
        for (Edge e : edges) {
            sigs.add(e.getSource().getId() + ":" + e.getTarget().getId() + ":" + e.getKind());
        }
        return sigs;
    }

    @Override
    public Iterator<BasicBlock> iterator() {
        return blocks.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("CFG ").append(name).append(" (").append(blocks.size()).append(" blocks)\n");
        for (BasicBlock bb : blocks) {
            sb.append(bb).append(":\n");
            for (Instruction i : bb.getInstructions()) {
                sb.append("\t").append(i.getId()).append(": ").append(i).append("\n");
            }
            for (Edge e : outEdges.get(bb)) {
                sb.append("\t-> ").append(e.getTarget()).append(" [").append(e.getKind()).append("]\n");
            }
        }
        return sb.toString();
    }
}
