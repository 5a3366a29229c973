package org.dice.logicgraph.parsing;

import org.apache.commons.lang.StringUtils;

/**
 * Thrown when an expression does not match the gate grammar. Carries the error code,
 * the zero-based character position and the offending token (empty at end of input).
 */
public class ExpressionSyntaxException extends IllegalArgumentException {

    private final ParserErrors error;
    private final int position;
    private final String token;

    public ExpressionSyntaxException(ParserErrors error, int position, String token, String expression) {
        super(buildMessage(error, position, token, expression));
        this.error = error;
        this.position = position;
        this.token = token == null ? "" : token;
    }

    public ParserErrors getError() {
        return error;
    }

    /**
     * @return numeric code of {@link #getError()}
     */
    public int getErrorCode() {
        return error.value;
    }

    public int getPosition() {
        return position;
    }

    public String getToken() {
        return token;
    }

    private static String buildMessage(ParserErrors error, int position, String token, String expression){
        String found = StringUtils.isEmpty(token) ? "end of input" : String.format("'%s'", token);
        return String.format("%s at position %d (found %s) in expression \"%s\"",
                error.description, position, found, StringUtils.defaultString(expression));
    }
}
