package org.dice.logicgraph.parsing;

/**
 * Error codes reported by {@link RecursiveDescentParser} through {@link ExpressionSyntaxException}.
 */
public enum  ParserErrors {
    MissingLeftParen(1, "expected '('"),
    MissingRightParen(2, "expected ')'"),
    EmptyExpression(3, "expression is empty"),
    MissingDot(4, "expected '.'"),
    MissingOperand(5, "expected an identifier or a NAND expression"),
    InvalidCharacter(6, "invalid character"),
    TrailingCharacters(7, "unexpected characters after the end of the expression"),
    NestingNotAllowed(8, "nested expressions are not allowed in strict mode"),
    NestingTooDeep(9, "NAND expressions are nested deeper than the configured maximum");

    public int value;
    public String description;
    ParserErrors(int value, String description){
        this.value = value;
        this.description = description;
    }
}
