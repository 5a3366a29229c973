package org.dice.logicgraph.parsing;

/**
 * How the {@link Lexer} treats whitespace in an expression.
 */
public enum WhitespaceMode {
    /** strip leading and trailing whitespace, reject it anywhere else */
    TRIM,
    /** skip whitespace between tokens */
    IGNORE,
    /** any whitespace is an invalid character */
    REJECT
}
