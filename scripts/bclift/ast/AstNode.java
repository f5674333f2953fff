package bclift.ast;

/**
 * Common interface of every AST node.
 *
 * Node ids are process-unique and only index provenance tables; they take no
 * part in equality.
 */
public interface AstNode {
	/**
	 * @return This node's id.
	 */
	int getId();
}
