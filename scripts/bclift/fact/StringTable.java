package bclift.fact;

/**
 * Lookup of interned strings.
 */
public interface StringTable {
	/**
	 * @return The string with the given index.
	 * @throws bclift.LiftContractException If the index is out of range.
	 */
	String string(int index);
}
