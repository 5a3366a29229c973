package org.dice.logicgraph.parsing.ast;

/**
 * <expression>::=<operand>[<and><operand>]
 * <operand>::=<nand>|<identifier>
 * <nand>::=<not><lparen><operand><and><operand><rparen>
 * <identifier>::=[A-Za-z0-9]+
 * <and>::='.'
 * <not>::='!'
 */
public interface Expression {
	/**
	 * Writes this subtree back in the input syntax, e.g. {@code !(A.B).C}. Parsing the result
	 * gives back an equal tree for anything the parser produced. Trees built by hand may have
	 * no such text: {@code new And(new And(A, B), C)} renders as {@code A.B.C}, which does not parse.
	 */
	public String render();
}
