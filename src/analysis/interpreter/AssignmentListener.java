package analysis.interpreter;

import ir.Instruction;

/**
 * Notified by the {@link ConcreteInterpreter} after every assignment it executes
 */
public interface AssignmentListener {

    /**
     * @param i
     *            the ASSIGN instruction
     * @param value
     *            value stored in the target of i
     */
    void assigned(Instruction i, long value);
}
