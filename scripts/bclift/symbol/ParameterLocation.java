package bclift.symbol;

/**
 * Where (part of) a formal parameter is passed.
 */
public interface ParameterLocation {
	/**
	 * @return The byte offset of this part within the formal.
	 */
	int offset();

	/**
	 * @return The byte size of this part.
	 */
	int size();

	/** Passed in a register. */
	record Register(String register, int offset, int size) implements ParameterLocation {
	}

	/** Passed on the stack, at an offset from the frame base. */
	record Stack(long stackOffset, int offset, int size) implements ParameterLocation {
	}

	/**
	 * @return A whole parameter passed in a register.
	 */
	static ParameterLocation register(String register, int size) {
		return new Register(register, 0, size);
	}

	/**
	 * @return A whole parameter passed on the stack.
	 */
	static ParameterLocation stack(long stackOffset, int size) {
		return new Stack(stackOffset, 0, size);
	}
}
