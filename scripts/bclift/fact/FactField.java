package bclift.fact;

/**
 * The argument fields that may carry an upstream error marker, each with its
 * own named sentinel.
 */
public enum FactField {
	VAR(-2),
	XPR(-2),
	COMMITTED_VAR(-2),
	COMMITTED_XPR(-2);

	private final int errorSentinel;

	FactField(int errorSentinel) {
		this.errorSentinel = errorSentinel;
	}

	/**
	 * @return The argument value that marks this field as an error.
	 */
	public int getErrorSentinel() {
		return this.errorSentinel;
	}

	/**
	 * @return Whether an argument for this field is the error marker.
	 */
	public boolean isError(int arg) {
		return arg == this.errorSentinel;
	}
}
