package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line sequence of instructions. Only the last instruction may be a terminator (BRANCH, JUMP or RETURN). A
 * block belongs to exactly one {@link ControlFlowGraph}, which holds the edges; blocks compare by identity.
 */
public final class BasicBlock {

    /**
     * Identifier, unique within the graph
     */
    private final int id;
    /**
     * Human readable name for printing
     */
    private final String label;
    /**
     * Instructions in execution order
     */
    private final List<Instruction> instructions;

    /**
     * Create a block
     *
     * @param id
     *            unique identifier within the graph
     * @param label
     *            name used when printing
     * @param instructions
     *            instructions in execution order, only the last may be a terminator
     */
    public BasicBlock(int id, String label, List<Instruction> instructions) {
        this.id = id;
        this.label = label;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        for (int i = 0; i < this.instructions.size() - 1; i++) {
            if (this.instructions.get(i).getType().isTerminator()) {
                throw new IllegalArgumentException("Terminator " + this.instructions.get(i)
                                                + " is not the last instruction of block " + label);
            }
        }
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /**
     * @return the last instruction, or null for an empty block
     */
    public Instruction getLastInstruction() {
        return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
    }

    /**
     * @return the terminating BRANCH, JUMP or RETURN, or null if the block falls through
     */
    public Instruction getTerminator() {
        Instruction last = getLastInstruction();
        return last != null && last.getType().isTerminator() ? last : null;
    }

    /**
     * @return true if this block ends in a conditional branch
     */
    public boolean endsInBranch() {
        Instruction t = getTerminator();
        return t != null && t.getType() == InstructionType.BRANCH;
    }

    /**
     * @return true if this block ends the program
     */
    public boolean isExit() {
        Instruction t = getTerminator();
        return t != null && t.getType() == InstructionType.RETURN;
    }

    /**
     * Position of an instruction in this block
     *
     * @param i
     *            instruction
     * @return index of i, or -1 if it is not in this block
     */
    public int indexOf(Instruction i) {
        return instructions.indexOf(i);
    }

    @Override
    public String toString() {
        return label;
    }
}
