package org.dice.logicgraph.parsing.ast.operators;

import com.google.common.base.Objects;
import org.dice.logicgraph.parsing.ast.Expression;

public abstract class BinaryOperator implements Expression {
	protected final Expression left, right;

    BinaryOperator(Expression left, Expression right){
        this.left = left;
        this.right = right;
    }

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		BinaryOperator other = (BinaryOperator) o;
		return Objects.equal(left, other.left) && Objects.equal(right, other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(getClass(), left, right);
	}

	@Override
	public String toString(){
		return this.render();
	}
}
