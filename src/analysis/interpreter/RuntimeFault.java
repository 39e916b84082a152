package analysis.interpreter;

import ir.BasicBlock;
import ir.Instruction;

/**
 * A concrete execution stopped abnormally. This is a value carried by {@link ExecutionResult}, never thrown.
 */
public final class RuntimeFault {

    private final FaultKind kind;
    /**
     * Instruction that was executing
     */
    private final Instruction instruction;
    /**
     * Block containing the instruction
     */
    private final BasicBlock block;
    private final String message;

    public RuntimeFault(FaultKind kind, Instruction instruction, BasicBlock block, String message) {
        this.kind = kind;
        this.instruction = instruction;
        this.block = block;
        this.message = message;
    }

    public FaultKind getKind() {
        return kind;
    }

    public Instruction getInstruction() {
        return instruction;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + " at " + block + " instruction " + instruction.getId() + " (" + instruction + "): " + message;
    }
}
