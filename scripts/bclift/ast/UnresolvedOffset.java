package bclift.ast;

import java.util.List;

/**
 * Placeholder for an offset that could not be navigated.
 */
public final class UnresolvedOffset extends AbstractNode implements Offset {
	private final String description;

	UnresolvedOffset(int id, String description) {
		super(id);
		this.description = description;
	}

	public String getDescription() {
		return this.description;
	}

	@Override
	List<?> components() {
		return List.of(this.description);
	}
}
