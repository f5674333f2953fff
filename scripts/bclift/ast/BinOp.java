package bclift.ast;

/**
 * C binary operators, with their printing precedence (higher binds tighter).
 */
public enum BinOp {
	PLUS("+", 12),
	MINUS("-", 12),
	MULT("*", 13),
	DIV("/", 13),
	MOD("%", 13),
	SHIFTLEFT("<<", 11),
	SHIFTRIGHT(">>", 11),
	LT("<", 10),
	LE("<=", 10),
	GT(">", 10),
	GE(">=", 10),
	EQ("==", 9),
	NE("!=", 9),
	BAND("&", 8),
	BXOR("^", 7),
	BOR("|", 6),
	LAND("&&", 5),
	LOR("||", 4);

	private final String symbol;
	private final int precedence;

	BinOp(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol() {
		return this.symbol;
	}

	public int getPrecedence() {
		return this.precedence;
	}

	/**
	 * @return Whether this operator yields a truth value.
	 */
	public boolean isComparison() {
		return this.precedence == 10 || this.precedence == 9;
	}
}
