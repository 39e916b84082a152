package analysis.symbolic;

import ir.BasicBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.optimizer.ExprSimplifier;
import ast.Expr;

/**
 * One path being explored: the next instruction to execute, the symbolic value of every variable, the path condition,
 * the blocks visited so far, how often each loop header was entered and where the turtle is. States are forked by
 * copying, so two states never share mutable structure.
 */
public final class ExecutionState {

    private BasicBlock block;
    /**
     * Index of the next instruction in {@link #block}
     */
    private int index;
    private final Map<String, Expr> store;
    /**
     * Variables read before being assigned, and the expression over symbols they started with
     */
    private final Map<String, Expr> inputs;
    private PathCondition pathCondition;
    private final List<Integer> trace;
    private final Map<BasicBlock, Integer> headerVisits;
    private SymbolicTurtle turtle;

    /**
     * Initial state
     *
     * @param entry
     *            first block to execute
     * @param initialBindings
     *            symbolic values of variables that are defined before the program starts
     */
    ExecutionState(BasicBlock entry, Map<String, Expr> initialBindings) {
        this.block = entry;
        this.index = 0;
        this.store = new LinkedHashMap<>(initialBindings);
        this.inputs = new LinkedHashMap<>(initialBindings);
        this.pathCondition = PathCondition.EMPTY;
        this.trace = new ArrayList<>();
        this.headerVisits = new HashMap<>();
        this.turtle = SymbolicTurtle.INITIAL;
    }

    private ExecutionState(ExecutionState other) {
        this.block = other.block;
        this.index = other.index;
        this.store = new LinkedHashMap<>(other.store);
        this.inputs = new LinkedHashMap<>(other.inputs);
        this.pathCondition = other.pathCondition;
        this.trace = new ArrayList<>(other.trace);
        this.headerVisits = new HashMap<>(other.headerVisits);
        this.turtle = other.turtle;
    }

    /**
     * @return independent copy of this state
     */
    ExecutionState fork() {
        return new ExecutionState(this);
    }

    /**
     * Symbolic value of a variable. A variable with no value yet is an input: it gets a fresh symbol named after it.
     *
     * @param var
     *            variable name
     * @return expression over symbols
     */
    Expr lookup(String var) {
        Expr value = store.get(var);
        if (value == null) {
            value = Expr.var(var);
            store.put(var, value);
            inputs.put(var, value);
        }
        return value;
    }

    /**
     * Symbolic value of a program expression in this state
     *
     * @param e
     *            expression over program variables
     * @return simplified expression over symbols
     */
    Expr evaluate(Expr e) {
        Set<String> vars = e.getVariables();
        if (vars.isEmpty()) {
            return ExprSimplifier.simplifyOverInputs(e);
        }
        Map<String, Expr> values = new HashMap<>();
        for (String var : vars) {
            values.put(var, lookup(var));
        }
        return ExprSimplifier.simplifyOverInputs(e.substitute(values));
    }

    void assign(String var, Expr value) {
        store.put(var, value);
    }

    SymbolicTurtle getTurtle() {
        return turtle;
    }

    void setTurtle(SymbolicTurtle turtle) {
        this.turtle = turtle;
    }

    void assume(Expr constraint) {
        pathCondition = pathCondition.and(constraint);
    }

    void moveTo(BasicBlock next) {
        block = next;
        index = 0;
    }

    void advance() {
        index++;
    }

    /**
     * Record entering the current block
     */
    void recordVisit() {
        trace.add(block.getId());
    }

    /**
     * Count an entry into a loop header
     *
     * @return number of entries so far, including this one
     */
    int countHeaderVisit() {
        Integer previous = headerVisits.get(block);
        int count = previous == null ? 1 : previous + 1;
        headerVisits.put(block, count);
        return count;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    public PathCondition getPathCondition() {
        return pathCondition;
    }

    public List<Integer> getTrace() {
        return Collections.unmodifiableList(trace);
    }

    public Map<String, Expr> getStore() {
        return Collections.unmodifiableMap(store);
    }

    public Map<String, Expr> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    /**
     * @return every symbol the inputs are expressed in
     */
    public Set<String> getSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        for (Expr e : inputs.values()) {
            symbols.addAll(e.getVariables());
        }
        return symbols;
    }

    @Override
    public String toString() {
        return "state at " + block + "[" + index + "] pc " + pathCondition;
    }
}
