package bclift.ast;

import java.util.List;
import java.util.Optional;

/**
 * An array type, with an optional size expression.
 */
public final class ArrayType extends AbstractNode implements Typ {
	private final Typ element;
	private final Optional<Expr> size;

	ArrayType(int id, Typ element, Optional<Expr> size) {
		super(id);
		this.element = element;
		this.size = size;
	}

	/**
	 * @return The element type.
	 */
	public Typ getElement() {
		return this.element;
	}

	/**
	 * @return The declared number of elements, if any.
	 */
	public Optional<Expr> getSize() {
		return this.size;
	}

	@Override
	List<?> components() {
		return List.of(this.element, this.size);
	}
}
