package bclift.ast;

/**
 * The base of an lvalue.
 */
public interface LHost extends AstNode {
}
