package bclift.fact;

import bclift.LiftContractException;

/**
 * A lookup of an index that an {@link IndexedTable} never handed out, or a
 * conflicting reuse of one.
 */
public class IndexedTableException extends LiftContractException {
	private static final long serialVersionUID = 1L;

	public IndexedTableException(String format, Object... args) {
		super(format, args);
	}
}
