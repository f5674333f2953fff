package bclift.ast;

import java.util.List;

/**
 * An integer type.
 */
public final class IntType extends AbstractNode implements Typ {
	private final IKind kind;

	IntType(int id, IKind kind) {
		super(id);
		this.kind = kind;
	}

	public IKind getKind() {
		return this.kind;
	}

	@Override
	List<?> components() {
		return List.of(this.kind);
	}
}
