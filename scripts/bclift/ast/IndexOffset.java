package bclift.ast;

import java.util.List;

/**
 * {@code [index]} followed by more offsets.
 */
public final class IndexOffset extends AbstractNode implements Offset {
	private final Expr index;
	private final Offset rest;

	IndexOffset(int id, Expr index, Offset rest) {
		super(id);
		this.index = index;
		this.rest = rest;
	}

	public Expr getIndex() {
		return this.index;
	}

	public Offset getRest() {
		return this.rest;
	}

	@Override
	List<?> components() {
		return List.of(this.index, this.rest);
	}
}
