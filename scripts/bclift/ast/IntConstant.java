package bclift.ast;

import java.util.List;

/**
 * An integer literal.
 */
public final class IntConstant extends AbstractNode implements Expr {
	private final long value;
	private final IKind kind;

	IntConstant(int id, long value, IKind kind) {
		super(id);
		this.value = value;
		this.kind = kind;
	}

	public long getValue() {
		return this.value;
	}

	public IKind getKind() {
		return this.kind;
	}

	@Override
	List<?> components() {
		return List.of(this.value, this.kind);
	}
}
