package bclift.ast;

import com.google.common.collect.ImmutableList;

/**
 * A C statement.
 */
public interface Stmt extends AstNode {
	/**
	 * @return The location id of this statement.
	 */
	int getLocationId();

	/**
	 * @return The labels attached to this statement.
	 */
	ImmutableList<StmtLabel> getLabels();
}
