package ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Root of a Turtle AST, as produced by the parser
 */
public final class Program {

    /**
     * Name of the program, used when printing and writing files
     */
    private final String name;
    /**
     * Top level statements in order
     */
    private final List<Statement> statements;

    public Program(String name, List<Statement> statements) {
        this.name = name;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public static Program of(String name, Statement... statements) {
        return new Program(name, Arrays.asList(statements));
    }

    public String getName() {
        return name;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public String toString() {
        return "program " + name + " (" + statements.size() + " statements)";
    }
}
