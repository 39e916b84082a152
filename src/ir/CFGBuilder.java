package ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import util.Logger;
import ast.Expr;
import ast.ExprKind;
import ast.MalformedProgramException;
import ast.Program;
import ast.Statement;

/**
 * Lowers a Turtle {@link Program} to a {@link ControlFlowGraph}.
 * <p>
 * Straight-line statements share a block. An IF ends the current block with a BRANCH whose true and false edges lead
 * to the two arms, which meet again at a merge block. A WHILE gets its own header block holding the guard, the body
 * loops back to the header and the false edge leaves the loop. <code>repeat n [body]</code> is lowered to a fresh
 * counter variable initialized to <code>n</code>, a loop guarded by <code>counter &gt; 0</code> and a decrement at the
 * end of the body.
 * <p>
 * Nesting is handled with an explicit work stack so deeply nested programs do not exhaust the Java stack. Blocks are
 * created lazily: the edges that will enter the next block are kept "pending" until an instruction needs a place to
 * go.
 */
public class CFGBuilder {

    /**
     * Prefix of the counter variables introduced for REPEAT loops. Turtle variables start with ':', so they never
     * start with '$'.
     */
    public static final String REPEAT_COUNTER_PREFIX = "$repeat";

    /**
     * Higher means more console output
     */
    private int outputLevel = 0;

    /**
     * Block under construction
     */
    private static class BlockInProgress {
        final int id;
        final String label;
        final List<Instruction> instructions = new ArrayList<>();

        BlockInProgress(int id, String label) {
            this.id = id;
            this.label = label;
        }
    }

    /**
     * Edge whose source is known but whose target has not been created yet
     */
    private static class PendingEdge {
        final BlockInProgress source;
        final EdgeKind kind;

        PendingEdge(BlockInProgress source, EdgeKind kind) {
            this.source = source;
            this.kind = kind;
        }
    }

    /**
     * Finished edge between blocks under construction
     */
    private static class EdgeInProgress {
        final BlockInProgress source;
        final BlockInProgress target;
        final EdgeKind kind;

        EdgeInProgress(BlockInProgress source, BlockInProgress target, EdgeKind kind) {
            this.source = source;
            this.target = target;
            this.kind = kind;
        }
    }

    private static enum TaskKind {
        /**
         * Lower one statement
         */
        STATEMENT,
        /**
         * Then-branch finished, start the else-branch
         */
        START_ELSE,
        /**
         * Both arms of an IF finished
         */
        END_IF,
        /**
         * Loop body finished, close the loop
         */
        END_LOOP
    }

    /**
     * Entry on the work stack
     */
    private static class Task {
        final TaskKind kind;
        final Statement statement;
        final Frame frame;

        Task(TaskKind kind, Statement statement, Frame frame) {
            this.kind = kind;
            this.statement = statement;
            this.frame = frame;
        }
    }

    /**
     * Information about an IF or loop whose lowering is in progress
     */
    private static class Frame {
        /**
         * Block ending in the BRANCH for the guard (loop header for loops)
         */
        final BlockInProgress branchBlock;
        /**
         * REPEAT counter to decrement at the end of the body, null for WHILE and IF
         */
        final String counter;
        /**
         * Edges leaving the end of the then-branch
         */
        List<PendingEdge> thenExits;

        Frame(BlockInProgress branchBlock, String counter) {
            this.branchBlock = branchBlock;
            this.counter = counter;
        }
    }

    /**
     * All blocks created so far
     */
    private List<BlockInProgress> blocks;
    /**
     * All edges created so far
     */
    private List<EdgeInProgress> edges;
    /**
     * Block that straight-line code is appended to, if null the next instruction starts a new block
     */
    private BlockInProgress current;
    /**
     * Edges entering the next block, only non-empty when current is null
     */
    private List<PendingEdge> pending;
    private int nextInstructionId;
    private int nextRepeatCounter;

    /**
     * Build the control flow graph for a program
     *
     * @param program
     *            well-formed Turtle program
     * @return new control flow graph
     * @throws MalformedProgramException
     *             if the program contains a construct the IR cannot express
     */
    public ControlFlowGraph build(Program program) {
        blocks = new ArrayList<>();
        edges = new ArrayList<>();
        nextInstructionId = 0;
        nextRepeatCounter = 0;

        BlockInProgress entry = newBlock("ENTRY");
        current = null;
        pending = new ArrayList<>();
        pending.add(new PendingEdge(entry, EdgeKind.FALL_THROUGH));

        Deque<Task> work = new ArrayDeque<>();
        pushStatements(work, program.getStatements(), null);
        while (!work.isEmpty()) {
            Task t = work.pop();
            switch (t.kind) {
            case STATEMENT:
                lower(t.statement, work);
                break;
            case START_ELSE:
                startElse(t.frame, t.statement);
                break;
            case END_IF:
                pending = takeExits();
                pending.addAll(0, t.frame.thenExits);
                break;
            case END_LOOP:
                endLoop(t.frame);
                break;
            default:
                throw new IllegalStateException("Unknown task " + t.kind);
            }
        }

        List<PendingEdge> last = takeExits();
        BlockInProgress exit = newBlock("EXIT");
        exit.instructions.add(Instruction.ret(nextInstructionId++));
        connect(last, exit);

        ControlFlowGraph cfg = assemble(program.getName(), entry);
        if (cfg.getRemovedBlockCount() > 0 && outputLevel >= 1) {
            Logger.println("Removed " + cfg.getRemovedBlockCount() + " unreachable blocks from " + program.getName());
        }
        if (outputLevel >= 2) {
            Logger.println(cfg.toString());
        }
        blocks = null;
        edges = null;
        current = null;
        pending = null;
        return cfg;
    }

    /**
     * Push statements so that the first one is on top of the stack
     */
    private static void pushStatements(Deque<Task> work, List<Statement> statements, Statement parent) {
        if (statements == null) {
            throw new MalformedProgramException("missing statement list", parent);
        }
        List<Statement> reversed = new ArrayList<>(statements);
        Collections.reverse(reversed);
        for (Statement s : reversed) {
            work.push(new Task(TaskKind.STATEMENT, s, null));
        }
    }

    /**
     * Lower a single statement, pushing follow-up work for compound statements
     */
    private void lower(Statement s, Deque<Task> work) {
        if (s == null || s.getKind() == null) {
            throw new MalformedProgramException("missing statement", s);
        }
        switch (s.getKind()) {
        case ASSIGN:
            checkVariableName(s.getTarget(), s);
            checkExpr(s.getExpr(), false, s);
            append(Instruction.assign(nextInstructionId++, s.getTarget(), s.getExpr()));
            break;
        case TURTLE:
            if (s.getTurtleOp() == null || s.getArguments() == null) {
                throw new MalformedProgramException("turtle command without an operation", s);
            }
            if (s.getArguments().size() != s.getTurtleOp().getArity()) {
                throw new MalformedProgramException(s.getTurtleOp().getCommandName() + " expects "
                                                + s.getTurtleOp().getArity() + " arguments", s);
            }
            for (Expr arg : s.getArguments()) {
                checkExpr(arg, false, s);
            }
            append(Instruction.call(nextInstructionId++, s.getTurtleOp(), s.getArguments()));
            break;
        case IF: {
            checkExpr(s.getExpr(), true, s);
            BlockInProgress b = ensureBlock();
            b.instructions.add(Instruction.branch(nextInstructionId++, s.getExpr()));
            current = null;
            pending = new ArrayList<>();
            pending.add(new PendingEdge(b, EdgeKind.BRANCH_TRUE));
            Frame f = new Frame(b, null);
            List<Statement> elseBody = s.getElseBody() == null ? Collections.<Statement> emptyList()
                                            : s.getElseBody();
            work.push(new Task(TaskKind.END_IF, s, f));
            pushStatements(work, elseBody, s);
            work.push(new Task(TaskKind.START_ELSE, s, f));
            pushStatements(work, s.getBody(), s);
            break;
        }
        case WHILE:
            checkExpr(s.getExpr(), true, s);
            startLoop(s.getExpr(), null, s, work);
            break;
        case REPEAT: {
            checkExpr(s.getExpr(), false, s);
            String counter = REPEAT_COUNTER_PREFIX + nextRepeatCounter++;
            append(Instruction.assign(nextInstructionId++, counter, s.getExpr()));
            startLoop(Expr.gt(Expr.var(counter), Expr.constant(0)), counter, s, work);
            break;
        }
        default:
            throw new MalformedProgramException("unsupported statement kind " + s.getKind(), s);
        }
    }

    /**
     * Create the loop header and push the work for the body
     */
    private void startLoop(Expr guard, String counter, Statement s, Deque<Task> work) {
        List<PendingEdge> into = takeExits();
        BlockInProgress header = newBlock(null);
        connect(into, header);
        header.instructions.add(Instruction.branch(nextInstructionId++, guard));
        pending = new ArrayList<>();
        pending.add(new PendingEdge(header, EdgeKind.BRANCH_TRUE));
        work.push(new Task(TaskKind.END_LOOP, s, new Frame(header, counter)));
        pushStatements(work, s.getBody(), s);
    }

    private void startElse(Frame f, Statement s) {
        boolean hasElse = s.getElseBody() != null && !s.getElseBody().isEmpty();
        if (hasElse && current != null) {
            current.instructions.add(Instruction.jump(nextInstructionId++));
        }
        f.thenExits = takeExits();
        pending = new ArrayList<>();
        pending.add(new PendingEdge(f.branchBlock, EdgeKind.BRANCH_FALSE));
    }

    private void endLoop(Frame f) {
        if (f.counter != null) {
            Expr decrement = Expr.sub(Expr.var(f.counter), Expr.constant(1));
            append(Instruction.assign(nextInstructionId++, f.counter, decrement));
        }
        if (current != null) {
            current.instructions.add(Instruction.jump(nextInstructionId++));
            edges.add(new EdgeInProgress(current, f.branchBlock, EdgeKind.BACK_EDGE));
            current = null;
        } else {
            connect(pending, f.branchBlock);
        }
        pending = new ArrayList<>();
        pending.add(new PendingEdge(f.branchBlock, EdgeKind.BRANCH_FALSE));
    }

    private BlockInProgress newBlock(String label) {
        int id = blocks.size();
        BlockInProgress b = new BlockInProgress(id, label == null ? "BB" + id : label);
        blocks.add(b);
        return b;
    }

    /**
     * Block to append straight-line code to, creating it (and connecting the pending edges) if needed
     */
    private BlockInProgress ensureBlock() {
        if (current == null) {
            current = newBlock(null);
            connect(pending, current);
            pending = new ArrayList<>();
        }
        return current;
    }

    private void append(Instruction i) {
        ensureBlock().instructions.add(i);
    }

    /**
     * Close the current block (if any) and return the edges that leave the code lowered so far
     */
    private List<PendingEdge> takeExits() {
        List<PendingEdge> exits;
        if (current != null) {
            exits = new ArrayList<>();
            exits.add(new PendingEdge(current, EdgeKind.FALL_THROUGH));
            current = null;
        } else {
            exits = pending;
        }
        pending = new ArrayList<>();
        return exits;
    }

    private void connect(List<PendingEdge> from, BlockInProgress to) {
        for (PendingEdge p : from) {
            edges.add(new EdgeInProgress(p.source, to, p.kind));
        }
    }

    /**
     * Turn the blocks and edges under construction into an immutable graph
     */
    private ControlFlowGraph assemble(String name, BlockInProgress entry) {
        List<BasicBlock> finished = new ArrayList<>(blocks.size());
        for (BlockInProgress b : blocks) {
            finished.add(new BasicBlock(b.id, b.label, b.instructions));
        }
        List<Edge> finishedEdges = new ArrayList<>(edges.size());
        for (EdgeInProgress e : edges) {
            finishedEdges.add(new Edge(finished.get(e.source.id), finished.get(e.target.id), e.kind));
        }
        return new ControlFlowGraph(name, finished, finished.get(entry.id), finishedEdges);
    }

    private static void checkVariableName(String name, Statement s) {
        if (name == null || name.isEmpty()) {
            throw new MalformedProgramException("missing variable name", s);
        }
        if (name.charAt(0) == '$') {
            throw new MalformedProgramException("variable name " + name + " is reserved for generated variables", s);
        }
    }

    /**
     * Type check an expression
     *
     * @param e
     *            expression to check
     * @param wantBoolean
     *            true if e must be a boolean, false if it must be an integer
     * @param s
     *            enclosing statement, for error messages
     */
    private static void checkExpr(Expr e, boolean wantBoolean, Statement s) {
        Deque<Expr> exprs = new ArrayDeque<>();
        Deque<Boolean> expected = new ArrayDeque<>();
        if (e == null) {
            throw new MalformedProgramException("missing expression", s);
        }
        exprs.push(e);
        expected.push(wantBoolean);
        while (!exprs.isEmpty()) {
            Expr next = exprs.pop();
            boolean wantBool = expected.pop();
            if (next.isBoolean() != wantBool) {
                throw new MalformedProgramException("expected " + (wantBool ? "a boolean" : "an integer")
                                                + " expression but found " + next, s);
            }
            ExprKind kind = next.getKind();
            switch (kind) {
            case INT_CONST:
            case BOOL_CONST:
                break;
            case VAR:
                if (next.getName() == null || next.getName().isEmpty()) {
                    throw new MalformedProgramException("missing variable name", s);
                }
                break;
            case NEG:
            case NOT:
                pushOperand(exprs, expected, next.getLeft(), kind == ExprKind.NOT, s);
                break;
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case LT:
            case LE:
            case GT:
            case GE:
            case EQ:
            case NE:
            case AND:
            case OR:
                boolean operandsBoolean = kind.isLogical();
                pushOperand(exprs, expected, next.getRight(), operandsBoolean, s);
                pushOperand(exprs, expected, next.getLeft(), operandsBoolean, s);
                break;
            default:
                throw new MalformedProgramException("unsupported expression kind " + kind, s);
            }
        }
    }

    private static void pushOperand(Deque<Expr> exprs, Deque<Boolean> expected, Expr operand, boolean wantBoolean,
                                    Statement s) {
        if (operand == null) {
            throw new MalformedProgramException("missing sub-expression", s);
        }
        exprs.push(operand);
        expected.push(wantBoolean);
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
