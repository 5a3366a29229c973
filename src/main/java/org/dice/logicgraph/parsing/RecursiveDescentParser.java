package org.dice.logicgraph.parsing;

import com.google.common.base.Preconditions;
import org.dice.logicgraph.parsing.ast.Expression;
import org.dice.logicgraph.parsing.ast.operands.Input;
import org.dice.logicgraph.parsing.ast.operators.And;
import org.dice.logicgraph.parsing.ast.operators.Nand;

/**
 * Parses gate expressions made of identifiers, AND ({@code A.B}) and NAND ({@code !(A.B)}).
 * <p>
 * By default NAND expressions may be nested as operands, e.g. {@code !(C.D).!(!(A.B).C)}.
 * In strict mode every operand must be an identifier, so only {@code A}, {@code A.B} and
 * {@code !(A.B)} are accepted.
 * <p>
 * Unlike a query parser there is no error recovery: the first deviation from the grammar
 * throws {@link ExpressionSyntaxException}. NAND nesting is limited to {@code maxDepth} levels,
 * which keeps parsing, graph building and evaluation within the thread stack.
 */
public class RecursiveDescentParser {

    public static final int DEFAULT_MAX_DEPTH = 500;

    private final Lexer lexer;
    private final boolean strictGrammar;
    private final int maxDepth;
    private int symbol;
    private int depth;
    private Expression root;

    public RecursiveDescentParser(Lexer lexer) {
        this(lexer, false);
    }

    public RecursiveDescentParser(Lexer lexer, boolean strictGrammar) {
        this(lexer, strictGrammar, DEFAULT_MAX_DEPTH);
    }

    public RecursiveDescentParser(Lexer lexer, boolean strictGrammar, int maxDepth) {
        Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive, was %s", maxDepth);
        this.lexer  = lexer;
        this.strictGrammar = strictGrammar;
        this.maxDepth = maxDepth;
        this.symbol = Lexer.NONE;
    }

    public Expression parse() {
        symbol = lexer.nextSymbol();
        if(symbol == Lexer.EOF){
            throw error(ParserErrors.EmptyExpression);
        }

        andExpression();
        if(symbol != Lexer.EOF){
            // unbalanced parens
            if(symbol == Lexer.RIGHT){
                throw error(ParserErrors.MissingLeftParen);
            }
            throw error(ParserErrors.TrailingCharacters);
        }
        return root;
    }

    private void andExpression() {
        final boolean leftIsNand = symbol == Lexer.BANG;
        operand(true);
        if (symbol == Lexer.DOT) {
            if(strictGrammar && leftIsNand){
                throw error(ParserErrors.NestingNotAllowed);
            }
            Expression left = root;
            symbol = lexer.nextSymbol();
            operand(false);
            Expression right = root;
            root = new And(left, right);
        }
    }

    private void nandExpression() {
        if(++depth > maxDepth){
            throw error(ParserErrors.NestingTooDeep);
        }
        symbol = lexer.nextSymbol();
        if(symbol != Lexer.LEFT){
            throw error(ParserErrors.MissingLeftParen);
        }

        symbol = lexer.nextSymbol();
        operand(false);
        Expression left = root;

        if(symbol != Lexer.DOT){
            throw error(ParserErrors.MissingDot);
        }
        symbol = lexer.nextSymbol();
        operand(false);
        Expression right = root;

        if(symbol != Lexer.RIGHT){
            throw error(ParserErrors.MissingRightParen);
        }
        symbol = lexer.nextSymbol();
        root = new Nand(left, right);
        depth--;
    }

    /**
     * @param topLevel true for the leftmost operand of the whole expression, the only place a
     *                 NAND may appear in strict mode
     */
    private void operand(boolean topLevel) {
        switch (symbol){
            case Lexer.IDENTIFIER:
                root = new Input(lexer.toString());
                symbol = lexer.nextSymbol();
                break;

            case Lexer.BANG:
                if(strictGrammar && !topLevel){
                    throw error(ParserErrors.NestingNotAllowed);
                }
                nandExpression();
                break;

            default:
                throw error(ParserErrors.MissingOperand);
        }
    }

    private ExpressionSyntaxException error(ParserErrors error){
        // a disallowed character is reported as such, whatever was expected in its place
        ParserErrors reported = symbol == Lexer.INVALID ? ParserErrors.InvalidCharacter : error;
        return new ExpressionSyntaxException(reported, lexer.getPosition(), lexer.toString(), lexer.getInputString());
    }
}
