package bclift.ast;

import java.util.List;

/**
 * {@code switch (expr) body}
 */
public final class SwitchStmt extends AbstractStmt implements Stmt {
	private final Expr selector;
	private final Stmt body;

	SwitchStmt(int id, int locationId, List<StmtLabel> labels, Expr selector, Stmt body) {
		super(id, locationId, labels);
		this.selector = selector;
		this.body = body;
	}

	public Expr getSelector() {
		return this.selector;
	}

	public Stmt getBody() {
		return this.body;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.selector, this.body);
	}
}
