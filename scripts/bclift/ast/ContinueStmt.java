package bclift.ast;

import java.util.List;

/**
 * {@code continue;}
 */
public final class ContinueStmt extends AbstractStmt implements Stmt {
	ContinueStmt(int id, int locationId, List<StmtLabel> labels) {
		super(id, locationId, labels);
	}

	@Override
	List<?> stmtComponents() {
		return List.of();
	}
}
