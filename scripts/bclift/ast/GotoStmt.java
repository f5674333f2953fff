package bclift.ast;

import java.util.List;

/**
 * {@code goto label;}
 */
public final class GotoStmt extends AbstractStmt implements Stmt {
	private final String target;

	GotoStmt(int id, int locationId, List<StmtLabel> labels, String target) {
		super(id, locationId, labels);
		this.target = target;
	}

	/**
	 * @return The name of the target label.
	 */
	public String getTarget() {
		return this.target;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.target);
	}
}
