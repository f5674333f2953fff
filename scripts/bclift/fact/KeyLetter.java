package bclift.fact;

import java.util.Optional;

/**
 * The single-letter codes of a per-instruction record's key, each selecting
 * the field list that consumes the next argument.
 */
public enum KeyLetter {
	/** Operand variable, or result variable in the "ar:" form. */
	VAR('v'),
	/** Committed variable. */
	COMMITTED_VAR('w'),
	/** Expression, or result expression in the "ar:" form. */
	XPR('x'),
	/** Committed expression. */
	COMMITTED_XPR('c'),
	/** Aggregated expression; never a result. */
	AGGREGATE_XPR('a'),
	STRING('s'),
	INTERVAL('i'),
	INT('l'),
	TYPE('t'),
	REACHING_DEF('r'),
	DEF_USE('d'),
	DEF_USE_HIGH('h'),
	FLAG_REACHING_DEF('f');

	private final char code;

	KeyLetter(char code) {
		this.code = code;
	}

	/**
	 * @return The letter for the given code, if there is one.
	 */
	public static Optional<KeyLetter> lookup(char code) {
		for (var letter : values()) {
			if (letter.code == code) {
				return Optional.of(letter);
			}
		}
		return Optional.empty();
	}
}
