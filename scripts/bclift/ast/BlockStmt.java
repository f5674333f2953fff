package bclift.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * {@code { stmts... }}
 */
public final class BlockStmt extends AbstractStmt implements Stmt {
	private final ImmutableList<Stmt> stmts;

	BlockStmt(int id, int locationId, List<StmtLabel> labels, List<Stmt> stmts) {
		super(id, locationId, labels);
		this.stmts = ImmutableList.copyOf(stmts);
	}

	public ImmutableList<Stmt> getStmts() {
		return this.stmts;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.stmts);
	}
}
