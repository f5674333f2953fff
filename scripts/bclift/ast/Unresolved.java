package bclift.ast;

import java.util.List;

/**
 * Placeholder for a value that could not be lifted.
 */
public final class Unresolved extends AbstractNode implements Expr {
	private final String description;

	Unresolved(int id, String description) {
		super(id);
		this.description = description;
	}

	/**
	 * @return What could not be resolved.
	 */
	public String getDescription() {
		return this.description;
	}

	@Override
	List<?> components() {
		return List.of(this.description);
	}
}
