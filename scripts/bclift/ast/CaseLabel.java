package bclift.ast;

import java.util.List;

/**
 * {@code case value:}
 */
public final class CaseLabel extends AbstractNode implements StmtLabel {
	private final Expr value;

	CaseLabel(int id, Expr value) {
		super(id);
		this.value = value;
	}

	public Expr getValue() {
		return this.value;
	}

	@Override
	List<?> components() {
		return List.of(this.value);
	}
}
