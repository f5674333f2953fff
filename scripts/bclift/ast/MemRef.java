package bclift.ast;

import java.util.List;

/**
 * A dereference lvalue host, {@code *expr}.
 */
public final class MemRef extends AbstractNode implements LHost {
	private final Expr address;

	MemRef(int id, Expr address) {
		super(id);
		this.address = address;
	}

	public Expr getAddress() {
		return this.address;
	}

	@Override
	List<?> components() {
		return List.of(this.address);
	}
}
