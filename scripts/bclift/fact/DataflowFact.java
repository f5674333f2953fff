package bclift.fact;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A dataflow fact from the upstream analysis: the definition or use sites of
 * one variable.
 *
 * @param kind What the locations are.
 * @param variable The name of the variable.
 * @param locations The instruction addresses involved.
 */
public record DataflowFact(Kind kind, String variable, List<String> locations) {
	public DataflowFact {
		locations = ImmutableList.copyOf(locations);
	}

	/**
	 * Kinds of dataflow facts.
	 */
	public enum Kind {
		/** Definitions that reach a use. */
		REACHING_DEF,
		/** Uses of a definition, in low-level terms. */
		DEF_USE,
		/** Uses of a definition, in high-level terms. */
		DEF_USE_HIGH,
		/** Definitions of a flag that reach a use. */
		FLAG_REACHING_DEF,
	}

	@Override
	public String toString() {
		return this.kind.name().toLowerCase() + "(" + this.variable + ": " + String.join(", ", this.locations) + ")";
	}
}
