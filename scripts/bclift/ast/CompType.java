package bclift.ast;

import java.util.List;

/**
 * A reference to a struct or union definition, by name and key.
 */
public final class CompType extends AbstractNode implements Typ {
	private final String name;
	private final int key;

	CompType(int id, String name, int key) {
		super(id);
		this.name = name;
		this.key = key;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The key of the composite definition in the global symbol table.
	 */
	public int getKey() {
		return this.key;
	}

	@Override
	List<?> components() {
		return List.of(this.name, this.key);
	}
}
