package bclift.ast;

import java.util.List;

/**
 * {@code break;}
 */
public final class BreakStmt extends AbstractStmt implements Stmt {
	BreakStmt(int id, int locationId, List<StmtLabel> labels) {
		super(id, locationId, labels);
	}

	@Override
	List<?> stmtComponents() {
		return List.of();
	}
}
