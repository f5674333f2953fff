package bclift.ast;

import java.util.List;

/**
 * {@code sizeof(type)}.
 */
public final class SizeOf extends AbstractNode implements Expr {
	private final Typ type;

	SizeOf(int id, Typ type) {
		super(id);
		this.type = type;
	}

	public Typ getType() {
		return this.type;
	}

	@Override
	List<?> components() {
		return List.of(this.type);
	}
}
