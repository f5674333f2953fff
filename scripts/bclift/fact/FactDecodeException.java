package bclift.fact;

/**
 * A fact record that cannot be decoded: an unknown key letter or variant tag,
 * a missing tag or argument, or an opcode record that breaks its declared
 * shape.  Fatal to the record, not to other records.
 */
public class FactDecodeException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final int recordIndex;

	public FactDecodeException(int recordIndex, String format, Object... args) {
		super(String.format(format, args));
		this.recordIndex = recordIndex;
	}

	/**
	 * @return The index of the offending record in its table.
	 */
	public int getRecordIndex() {
		return this.recordIndex;
	}
}
