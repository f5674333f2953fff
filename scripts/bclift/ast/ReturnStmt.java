package bclift.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code return [expr];}
 */
public final class ReturnStmt extends AbstractStmt implements Stmt {
	private final Optional<Expr> value;

	ReturnStmt(int id, int locationId, List<StmtLabel> labels, Optional<Expr> value) {
		super(id, locationId, labels);
		this.value = value;
	}

	public Optional<Expr> getValue() {
		return this.value;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.value);
	}
}
