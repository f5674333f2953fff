package bclift.ast;

import java.util.List;

/**
 * A reference to a typedef by name.
 */
public final class NamedType extends AbstractNode implements Typ {
	private final String name;

	NamedType(int id, String name) {
		super(id);
		this.name = name;
	}

	public String getName() {
		return this.name;
	}

	@Override
	List<?> components() {
		return List.of(this.name);
	}
}
