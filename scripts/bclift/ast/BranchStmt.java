package bclift.ast;

import java.util.List;

/**
 * {@code if (cond) then else otherwise}
 */
public final class BranchStmt extends AbstractStmt implements Stmt {
	private final Expr condition;
	private final Stmt then;
	private final Stmt otherwise;

	BranchStmt(int id, int locationId, List<StmtLabel> labels, Expr condition, Stmt then, Stmt otherwise) {
		super(id, locationId, labels);
		this.condition = condition;
		this.then = then;
		this.otherwise = otherwise;
	}

	public Expr getCondition() {
		return this.condition;
	}

	public Stmt getThen() {
		return this.then;
	}

	public Stmt getOtherwise() {
		return this.otherwise;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.condition, this.then, this.otherwise);
	}
}
