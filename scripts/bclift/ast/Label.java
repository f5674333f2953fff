package bclift.ast;

import java.util.List;

/**
 * {@code name:}
 */
public final class Label extends AbstractNode implements StmtLabel {
	private final String name;

	Label(int id, String name) {
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
