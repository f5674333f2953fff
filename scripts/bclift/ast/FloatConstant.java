package bclift.ast;

import java.util.List;

/**
 * A floating point literal.
 */
public final class FloatConstant extends AbstractNode implements Expr {
	private final double value;
	private final FKind kind;

	FloatConstant(int id, double value, FKind kind) {
		super(id);
		this.value = value;
		this.kind = kind;
	}

	public double getValue() {
		return this.value;
	}

	public FKind getKind() {
		return this.kind;
	}

	@Override
	List<?> components() {
		return List.of(this.value, this.kind);
	}
}
