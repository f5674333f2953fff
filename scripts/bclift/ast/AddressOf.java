package bclift.ast;

import java.util.List;

/**
 * {@code &lval}.
 */
public final class AddressOf extends AbstractNode implements Expr {
	private final Lval lval;

	AddressOf(int id, Lval lval) {
		super(id);
		this.lval = lval;
	}

	public Lval getLval() {
		return this.lval;
	}

	@Override
	List<?> components() {
		return List.of(this.lval);
	}
}
