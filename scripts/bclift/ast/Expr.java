package bclift.ast;

import java.util.OptionalLong;

/**
 * A C expression.
 */
public interface Expr extends AstNode {
	/**
	 * @return The integer value of this expression, if it is an integer constant.
	 */
	default OptionalLong constantValue() {
		if (this instanceof IntConstant c) {
			return OptionalLong.of(c.getValue());
		} else if (this instanceof GlobalAddressConstant g) {
			return OptionalLong.of(g.getValue());
		} else {
			return OptionalLong.empty();
		}
	}
}
