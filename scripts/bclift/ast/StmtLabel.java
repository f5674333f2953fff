package bclift.ast;

/**
 * A label attached to a statement.
 */
public interface StmtLabel extends AstNode {
}
