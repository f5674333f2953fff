package bclift.value;

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * The operators of symbolic compound expressions.
 */
public enum XOperator {
	PLUS("plus", "+", 2),
	MINUS("minus", "-", 2),
	MULT("mult", "*", 2),
	DIV("div", "/", 2),
	MOD("mod", "%", 2),
	BAND("band", "&", 2),
	BOR("bor", "|", 2),
	BXOR("bxor", "^", 2),
	LSL("lsl", "<<", 2),
	LSR("lsr", ">>", 2),
	ASR("asr", "s>>", 2),
	LAND("land", "&&", 2),
	LOR("lor", "||", 2),
	EQ("eq", "==", 2),
	NE("ne", "!=", 2),
	LT("lt", "<", 2),
	LE("le", "<=", 2),
	GT("gt", ">", 2),
	GE("ge", ">=", 2),
	XBYTE("xbyte", "xbyte", 2),
	NEG("neg", "-", 1),
	BNOT("bnot", "~", 1),
	LNOT("lnot", "!", 1),
	LSB("lsb", "lsb", 1),
	LSH("lsh", "lsh", 1);

	private static final ImmutableMap<String, XOperator> BY_NAME = Arrays.stream(values())
		.collect(ImmutableMap.toImmutableMap(XOperator::getName, Function.identity()));

	private final String name;
	private final String symbol;
	private final int arity;

	XOperator(String name, String symbol, int arity) {
		this.name = name;
		this.symbol = symbol;
		this.arity = arity;
	}

	/**
	 * @return The operator with the given wire name.
	 */
	public static Optional<XOperator> lookup(String name) {
		return Optional.ofNullable(BY_NAME.get(name));
	}

	/**
	 * @return The wire name of this operator.
	 */
	public String getName() {
		return this.name;
	}

	public String getSymbol() {
		return this.symbol;
	}

	public int getArity() {
		return this.arity;
	}

	/**
	 * @return Whether this operator yields 1 or 0.
	 */
	public boolean isComparison() {
		switch (this) {
			case EQ:
			case NE:
			case LT:
			case LE:
			case GT:
			case GE:
			case LAND:
			case LOR:
			case LNOT:
				return true;
			default:
				return false;
		}
	}
}
