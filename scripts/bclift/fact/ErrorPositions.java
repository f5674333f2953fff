package bclift.fact;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The positions of error-valued entries in a record's result and committed
 * fields.
 */
public record ErrorPositions(List<Integer> varsResult, List<Integer> xprsResult, List<Integer> committedXprs) {
	public ErrorPositions {
		varsResult = ImmutableList.copyOf(varsResult);
		xprsResult = ImmutableList.copyOf(xprsResult);
		committedXprs = ImmutableList.copyOf(committedXprs);
	}

	public boolean isEmpty() {
		return this.varsResult.isEmpty() && this.xprsResult.isEmpty() && this.committedXprs.isEmpty();
	}
}
