package bclift.ast;

import java.util.List;
import java.util.Objects;

/**
 * Base class for AST nodes, with structural equality that ignores node ids.
 */
abstract class AbstractNode implements AstNode {
	private final int id;

	AbstractNode(int id) {
		this.id = id;
	}

	@Override
	public int getId() {
		return this.id;
	}

	/**
	 * @return The structural parts of this node, in a fixed order.
	 */
	abstract List<?> components();

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj == null || obj.getClass() != getClass()) {
			return false;
		}

		var other = (AbstractNode) obj;
		return components().equals(other.components());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), components());
	}

	@Override
	public String toString() {
		return CPrinter.print(this);
	}
}
