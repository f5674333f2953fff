package bclift.fact;

import bclift.ast.Typ;

/**
 * Lookup of interned types.
 */
public interface TypeTable {
	/**
	 * @return The type with the given index.
	 * @throws bclift.LiftContractException If the index is out of range.
	 */
	Typ type(int index);
}
