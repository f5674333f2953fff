package bclift.ast;

import java.util.List;

/**
 * {@code .name} followed by more offsets.
 */
public final class FieldOffset extends AbstractNode implements Offset {
	private final String name;
	private final int compKey;
	private final Offset rest;

	FieldOffset(int id, String name, int compKey, Offset rest) {
		super(id);
		this.name = name;
		this.compKey = compKey;
		this.rest = rest;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The key of the composite that declares this field.
	 */
	public int getCompKey() {
		return this.compKey;
	}

	public Offset getRest() {
		return this.rest;
	}

	@Override
	List<?> components() {
		return List.of(this.name, this.compKey, this.rest);
	}
}
