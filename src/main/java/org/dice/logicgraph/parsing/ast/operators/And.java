package org.dice.logicgraph.parsing.ast.operators;

import org.dice.logicgraph.parsing.ast.Expression;

public class And extends BinaryOperator {
	public And(Expression left, Expression right){
		super(left, right);
	}

	public String render() {
		return String.format("%s.%s", left.render(), right.render());
	}
}
