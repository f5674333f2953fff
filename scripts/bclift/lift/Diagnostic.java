package bclift.lift;

/**
 * A recoverable problem found while lifting, keyed by instruction address.
 */
public record Diagnostic(String site, Kind kind, String message) {
	/**
	 * Kinds of diagnostics.
	 */
	public enum Kind {
		/** A value with no concrete AST form. */
		RESOLUTION_GAP,
		/** An offset that cannot be navigated through the known types. */
		UNSUPPORTED_OFFSET,
		/** A return value with more than one SSA candidate. */
		AMBIGUOUS_SSA,
		/** A register use reached by more than one definition. */
		MULTIPLE_DEFINITIONS,
		/** A low-level node re-mapped to a different high-level node. */
		PROVENANCE_OVERWRITE,
		/** A record kind the lifter does not handle. */
		UNSUPPORTED_RECORD,
	}

	@Override
	public String toString() {
		return this.site + ": " + this.kind + ": " + this.message;
	}
}
