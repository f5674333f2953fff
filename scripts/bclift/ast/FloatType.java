package bclift.ast;

import java.util.List;

/**
 * A floating point type.
 */
public final class FloatType extends AbstractNode implements Typ {
	private final FKind kind;

	FloatType(int id, FKind kind) {
		super(id);
		this.kind = kind;
	}

	public FKind getKind() {
		return this.kind;
	}

	@Override
	List<?> components() {
		return List.of(this.kind);
	}
}
