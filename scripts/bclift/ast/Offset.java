package bclift.ast;

/**
 * A chain of field and index selectors applied to an lvalue host.
 */
public interface Offset extends AstNode {
	/**
	 * @return Whether any part of this chain is a placeholder.
	 */
	default boolean isUnresolved() {
		if (this instanceof UnresolvedOffset) {
			return true;
		} else if (this instanceof FieldOffset f) {
			return f.getRest().isUnresolved();
		} else if (this instanceof IndexOffset i) {
			return i.getRest().isUnresolved();
		} else {
			return false;
		}
	}
}
