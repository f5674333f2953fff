package bclift.ast;

import java.util.List;

/**
 * {@code (type) expr}.
 */
public final class CastExpr extends AbstractNode implements Expr {
	private final Typ type;
	private final Expr expr;

	CastExpr(int id, Typ type, Expr expr) {
		super(id);
		this.type = type;
		this.expr = expr;
	}

	public Typ getType() {
		return this.type;
	}

	public Expr getExpr() {
		return this.expr;
	}

	@Override
	List<?> components() {
		return List.of(this.type, this.expr);
	}
}
