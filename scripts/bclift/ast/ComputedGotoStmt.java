package bclift.ast;

import java.util.List;

/**
 * {@code goto *expr;}
 */
public final class ComputedGotoStmt extends AbstractStmt implements Stmt {
	private final Expr target;

	ComputedGotoStmt(int id, int locationId, List<StmtLabel> labels, Expr target) {
		super(id, locationId, labels);
		this.target = target;
	}

	public Expr getTarget() {
		return this.target;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.target);
	}
}
