package bclift.fact;

import bclift.ast.Typ;
import bclift.value.Interval;
import bclift.value.XVariable;
import bclift.value.XXpr;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The immutable field lists decoded from one per-instruction record.
 */
public final class DecodedFacts {
	/**
	 * The shape of a record's key.
	 */
	public enum Form {
		/** {@code "nop"}: no semantic content. */
		NOP,
		/** {@code "subsumes"}: folded into another instruction; unsupported. */
		SUBSUMES,
		/** {@code "a:<letters>"}. */
		PLAIN,
		/** {@code "ar:<letters>"}: variables and expressions are results. */
		RESULT,
	}

	private final Form form;
	final ImmutableList<FactValue<XVariable>> vars;
	final ImmutableList<FactValue<XVariable>> varsResult;
	final ImmutableList<FactValue<XVariable>> committedVars;
	final ImmutableList<FactValue<XXpr>> xprs;
	final ImmutableList<FactValue<XXpr>> xprsResult;
	final ImmutableList<FactValue<XXpr>> committedXprs;
	final ImmutableList<Interval> intervals;
	final ImmutableList<String> strings;
	final ImmutableList<Integer> ints;
	final ImmutableList<Typ> types;
	final ImmutableList<Optional<DataflowFact>> reachingDefs;
	final ImmutableList<Optional<DataflowFact>> defUses;
	final ImmutableList<Optional<DataflowFact>> defUsesHigh;
	final ImmutableList<Optional<DataflowFact>> flagReachingDefs;

	private DecodedFacts(Builder builder) {
		this.form = builder.form;
		this.vars = ImmutableList.copyOf(builder.vars);
		this.varsResult = ImmutableList.copyOf(builder.varsResult);
		this.committedVars = ImmutableList.copyOf(builder.committedVars);
		this.xprs = ImmutableList.copyOf(builder.xprs);
		this.xprsResult = ImmutableList.copyOf(builder.xprsResult);
		this.committedXprs = ImmutableList.copyOf(builder.committedXprs);
		this.intervals = ImmutableList.copyOf(builder.intervals);
		this.strings = ImmutableList.copyOf(builder.strings);
		this.ints = ImmutableList.copyOf(builder.ints);
		this.types = ImmutableList.copyOf(builder.types);
		this.reachingDefs = ImmutableList.copyOf(builder.reachingDefs);
		this.defUses = ImmutableList.copyOf(builder.defUses);
		this.defUsesHigh = ImmutableList.copyOf(builder.defUsesHigh);
		this.flagReachingDefs = ImmutableList.copyOf(builder.flagReachingDefs);
	}

	static Builder builder(Form form) {
		return new Builder(form);
	}

	public Form getForm() {
		return this.form;
	}

	/**
	 * @return Whether every result variable, result expression and committed
	 *         expression is present.
	 */
	public boolean isOk() {
		return getErrorPositions().isEmpty();
	}

	/**
	 * @return The positions of the error-valued result and committed entries.
	 */
	public ErrorPositions getErrorPositions() {
		return new ErrorPositions(errors(this.varsResult), errors(this.xprsResult), errors(this.committedXprs));
	}

	private static List<Integer> errors(List<? extends FactValue<?>> values) {
		List<Integer> positions = new ArrayList<>();
		for (int i = 0; i < values.size(); ++i) {
			if (values.get(i).isError()) {
				positions.add(i);
			}
		}
		return positions;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof DecodedFacts)) {
			return false;
		}

		var other = (DecodedFacts) obj;
		return this.form == other.form
			&& this.vars.equals(other.vars)
			&& this.varsResult.equals(other.varsResult)
			&& this.committedVars.equals(other.committedVars)
			&& this.xprs.equals(other.xprs)
			&& this.xprsResult.equals(other.xprsResult)
			&& this.committedXprs.equals(other.committedXprs)
			&& this.intervals.equals(other.intervals)
			&& this.strings.equals(other.strings)
			&& this.ints.equals(other.ints)
			&& this.types.equals(other.types)
			&& this.reachingDefs.equals(other.reachingDefs)
			&& this.defUses.equals(other.defUses)
			&& this.defUsesHigh.equals(other.defUsesHigh)
			&& this.flagReachingDefs.equals(other.flagReachingDefs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.form, this.vars, this.varsResult, this.xprs, this.xprsResult, this.committedXprs);
	}

	@Override
	public String toString() {
		return String.format("%s{vars=%s, varsResult=%s, xprs=%s, xprsResult=%s, committedXprs=%s}",
			this.form, this.vars, this.varsResult, this.xprs, this.xprsResult, this.committedXprs);
	}

	/**
	 * Accumulates field lists during a decode.
	 */
	static final class Builder {
		private final Form form;
		final List<FactValue<XVariable>> vars = new ArrayList<>();
		final List<FactValue<XVariable>> varsResult = new ArrayList<>();
		final List<FactValue<XVariable>> committedVars = new ArrayList<>();
		final List<FactValue<XXpr>> xprs = new ArrayList<>();
		final List<FactValue<XXpr>> xprsResult = new ArrayList<>();
		final List<FactValue<XXpr>> committedXprs = new ArrayList<>();
		final List<Interval> intervals = new ArrayList<>();
		final List<String> strings = new ArrayList<>();
		final List<Integer> ints = new ArrayList<>();
		final List<Typ> types = new ArrayList<>();
		final List<Optional<DataflowFact>> reachingDefs = new ArrayList<>();
		final List<Optional<DataflowFact>> defUses = new ArrayList<>();
		final List<Optional<DataflowFact>> defUsesHigh = new ArrayList<>();
		final List<Optional<DataflowFact>> flagReachingDefs = new ArrayList<>();

		private Builder(Form form) {
			this.form = form;
		}

		DecodedFacts build() {
			return new DecodedFacts(this);
		}
	}
}
