package org.dice.logicgraph.parsing.ast.operators;

import org.dice.logicgraph.parsing.ast.Expression;

/**
 * Negated conjunction, always written {@code !(left.right)}.
 */
public class Nand extends BinaryOperator {
	public Nand(Expression left, Expression right){
		super(left, right);
	}

	public String render() {
		return String.format("!(%s.%s)", left.render(), right.render());
	}
}
