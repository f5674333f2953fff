package bclift.ast;

/**
 * A C type.
 */
public interface Typ extends AstNode {
	/**
	 * @return Whether this is an integral type (integers and enums).
	 */
	default boolean isIntegral() {
		return this instanceof IntType || this instanceof EnumType;
	}

	/**
	 * @return Whether this is a pointer type.
	 */
	default boolean isPointer() {
		return this instanceof PtrType;
	}
}
