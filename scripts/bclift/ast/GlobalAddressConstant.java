package bclift.ast;

import java.util.List;

/**
 * An integer constant known to be the address of a global, annotated with the
 * expression that denotes it (usually {@code &gv}).
 */
public final class GlobalAddressConstant extends AbstractNode implements Expr {
	private final long value;
	private final Expr addressExpr;

	GlobalAddressConstant(int id, long value, Expr addressExpr) {
		super(id);
		this.value = value;
		this.addressExpr = addressExpr;
	}

	public long getValue() {
		return this.value;
	}

	/**
	 * @return The symbolic form of this address.
	 */
	public Expr getAddressExpr() {
		return this.addressExpr;
	}

	@Override
	List<?> components() {
		return List.of(this.value, this.addressExpr);
	}
}
