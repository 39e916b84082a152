package ir;

/**
 * Enumeration of IR instruction types. Every consumer of {@link Instruction} dispatches on this tag with a
 * <code>switch</code> whose default case fails, so a new type shows up as an explicit error rather than being ignored.
 */
public enum InstructionType {
    /**
     * x = e, e is an integer expression
     */
    ASSIGN,
    /**
     * Conditional branch on a boolean guard, always the last instruction of its block. The block has one
     * {@link EdgeKind#BRANCH_TRUE} and one {@link EdgeKind#BRANCH_FALSE} successor.
     */
    BRANCH,
    /**
     * Unconditional jump, always the last instruction of its block. The target is the single successor edge.
     */
    JUMP,
    /**
     * Call to a turtle primitive with integer arguments
     */
    CALL,
    /**
     * End of the program, only found in exit blocks
     */
    RETURN;

    /**
     * Does an instruction of this type end its basic block
     *
     * @return true for BRANCH, JUMP and RETURN
     */
    public boolean isTerminator() {
        return this == BRANCH || this == JUMP || this == RETURN;
    }
}
