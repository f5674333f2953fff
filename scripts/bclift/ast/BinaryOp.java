package bclift.ast;

import java.util.List;

/**
 * A binary operator application.
 */
public final class BinaryOp extends AbstractNode implements Expr {
	private final BinOp op;
	private final Expr left;
	private final Expr right;

	BinaryOp(int id, BinOp op, Expr left, Expr right) {
		super(id);
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public BinOp getOp() {
		return this.op;
	}

	public Expr getLeft() {
		return this.left;
	}

	public Expr getRight() {
		return this.right;
	}

	@Override
	List<?> components() {
		return List.of(this.op, this.left, this.right);
	}
}
