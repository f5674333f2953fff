package bclift.ast;

import java.util.List;

/**
 * A unary operator application.
 */
public final class UnaryOp extends AbstractNode implements Expr {
	private final UnOp op;
	private final Expr operand;

	UnaryOp(int id, UnOp op, Expr operand) {
		super(id);
		this.op = op;
		this.operand = operand;
	}

	public UnOp getOp() {
		return this.op;
	}

	public Expr getOperand() {
		return this.operand;
	}

	@Override
	List<?> components() {
		return List.of(this.op, this.operand);
	}
}
