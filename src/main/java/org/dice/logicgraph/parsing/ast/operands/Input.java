package org.dice.logicgraph.parsing.ast.operands;

import com.google.common.base.Objects;
import org.dice.logicgraph.parsing.ast.Expression;

/**
 * A named boolean signal.
 */
public class Input implements Expression {
	protected final String name;

	public Input(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public String render() {
		return String.format("%s", name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equal(name, ((Input) o).name);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(name);
	}

	@Override
	public String toString(){
		return this.render();
	}
}
