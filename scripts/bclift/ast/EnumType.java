package bclift.ast;

import java.util.List;

/**
 * A reference to an enum definition.
 */
public final class EnumType extends AbstractNode implements Typ {
	private final String name;
	private final IKind kind;

	EnumType(int id, String name, IKind kind) {
		super(id);
		this.name = name;
		this.kind = kind;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The underlying integer kind.
	 */
	public IKind getKind() {
		return this.kind;
	}

	@Override
	List<?> components() {
		return List.of(this.name, this.kind);
	}
}
