package bclift.ast;

import java.util.List;

/**
 * {@code default:}
 */
public final class DefaultLabel extends AbstractNode implements StmtLabel {
	DefaultLabel(int id) {
		super(id);
	}

	@Override
	List<?> components() {
		return List.of();
	}
}
