package ast;

/**
 * Kinds of Turtle statements
 */
public enum StatementKind {
    /**
     * :x = e
     */
    ASSIGN,
    /**
     * if c [ ... ] else [ ... ], the else branch may be empty
     */
    IF,
    /**
     * while c [ ... ]
     */
    WHILE,
    /**
     * repeat n [ ... ], n is evaluated once before the first iteration
     */
    REPEAT,
    /**
     * forward, backward, left, right, penup, pendown, goto and pause
     */
    TURTLE
}
