package bclift.ast;

import java.util.List;

/**
 * {@code while (1) body}
 */
public final class LoopStmt extends AbstractStmt implements Stmt {
	private final Stmt body;

	LoopStmt(int id, int locationId, List<StmtLabel> labels, Stmt body) {
		super(id, locationId, labels);
		this.body = body;
	}

	public Stmt getBody() {
		return this.body;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.body);
	}
}
