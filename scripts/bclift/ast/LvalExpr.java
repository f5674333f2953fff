package bclift.ast;

import java.util.List;

/**
 * The value stored in an lvalue.
 */
public final class LvalExpr extends AbstractNode implements Expr {
	private final Lval lval;

	LvalExpr(int id, Lval lval) {
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
