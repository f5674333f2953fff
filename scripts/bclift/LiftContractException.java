package bclift;

/**
 * A violated programmer contract: an index out of bounds, a value read from an
 * error-valued fact, a double type refinement, and the like.  Aborts the lift
 * of the current function.
 */
public class LiftContractException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public LiftContractException(String message) {
		super(message);
	}

	public LiftContractException(String format, Object... args) {
		super(String.format(format, args));
	}
}
