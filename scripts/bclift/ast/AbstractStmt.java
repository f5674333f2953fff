package bclift.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Base class for statements.
 */
abstract class AbstractStmt extends AbstractNode {
	private final int locationId;
	private final ImmutableList<StmtLabel> labels;

	AbstractStmt(int id, int locationId, List<StmtLabel> labels) {
		super(id);
		this.locationId = locationId;
		this.labels = ImmutableList.copyOf(labels);
	}

	public int getLocationId() {
		return this.locationId;
	}

	public ImmutableList<StmtLabel> getLabels() {
		return this.labels;
	}

	/**
	 * @return The statement-specific structural parts.
	 */
	abstract List<?> stmtComponents();

	@Override
	final List<?> components() {
		return List.of(this.locationId, this.labels, stmtComponents());
	}
}
