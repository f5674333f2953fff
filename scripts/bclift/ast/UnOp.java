package bclift.ast;

/**
 * C unary operators.
 */
public enum UnOp {
	NEG("-"),
	BNOT("~"),
	LNOT("!");

	private final String symbol;

	UnOp(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return this.symbol;
	}
}
