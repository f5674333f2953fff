package bclift.ast;

/**
 * An instruction: the unit that assigns, calls, or does nothing.
 */
public interface Instr extends AstNode {
	/**
	 * @return The location id shared by all instructions lifted from one address.
	 */
	int getLocationId();
}
