package bclift.fact;

import bclift.LiftContractException;
import bclift.ast.Typ;
import bclift.util.Lazy;
import bclift.value.FunctionDictionary;
import bclift.value.Interval;
import bclift.value.XVariable;
import bclift.value.XXpr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * The semantic facts of one instruction.
 *
 * The record is decoded on first access and the result is cached, so every
 * accessor sees the same immutable field lists.
 */
public final class InstrFacts {
	private final FactRecord record;
	private final Lazy<DecodedFacts> decoded;

	/**
	 * @param record The per-instruction record.
	 * @param dictionary The function dictionary its arguments index into.
	 * @param strings The string table, for {@code s} letters.
	 * @param types The type table, for {@code t} letters.
	 * @param store The invariant store, for architectures that have one.  It is
	 *        only consulted for {@code r d h f} letters.
	 */
	public InstrFacts(FactRecord record, FunctionDictionary dictionary, StringTable strings, TypeTable types, Optional<InvariantStore> store) {
		this.record = record;
		var decoder = new TaggedArgDecoder(record, dictionary, strings, types, store);
		this.decoded = new Lazy<>(decoder::decode);
	}

	public FactRecord getRecord() {
		return this.record;
	}

	/**
	 * @return The record's key, e.g. {@code "ar:vxc"}.
	 */
	public String getKey() {
		return this.record.getKey();
	}

	/**
	 * @return The form of the record's key.  Does not decode.
	 */
	public DecodedFacts.Form getForm() {
		return TaggedArgDecoder.formOf(this.record);
	}

	public boolean isNop() {
		return getForm() == DecodedFacts.Form.NOP;
	}

	public boolean isSubsumes() {
		return getForm() == DecodedFacts.Form.SUBSUMES;
	}

	/**
	 * @return Whether the record has been decoded yet.
	 */
	public boolean isDecoded() {
		return this.decoded.isInitialized();
	}

	/**
	 * @return The decoded field lists.
	 * @throws FactDecodeException If the record cannot be decoded.
	 */
	public DecodedFacts decoded() {
		return this.decoded.get();
	}

	public ImmutableList<FactValue<XVariable>> getVars() {
		return decoded().vars;
	}

	public ImmutableList<FactValue<XVariable>> getVarsResult() {
		return decoded().varsResult;
	}

	public ImmutableList<FactValue<XVariable>> getCommittedVars() {
		return decoded().committedVars;
	}

	public ImmutableList<FactValue<XXpr>> getXprs() {
		return decoded().xprs;
	}

	public ImmutableList<FactValue<XXpr>> getXprsResult() {
		return decoded().xprsResult;
	}

	public ImmutableList<FactValue<XXpr>> getCommittedXprs() {
		return decoded().committedXprs;
	}

	public ImmutableList<Interval> getIntervals() {
		return decoded().intervals;
	}

	public ImmutableList<String> getStrings() {
		return decoded().strings;
	}

	public ImmutableList<Integer> getInts() {
		return decoded().ints;
	}

	public ImmutableList<Typ> getTypes() {
		return decoded().types;
	}

	public ImmutableList<Optional<DataflowFact>> getReachingDefs() {
		return decoded().reachingDefs;
	}

	public ImmutableList<Optional<DataflowFact>> getDefUses() {
		return decoded().defUses;
	}

	public ImmutableList<Optional<DataflowFact>> getDefUsesHigh() {
		return decoded().defUsesHigh;
	}

	public ImmutableList<Optional<DataflowFact>> getFlagReachingDefs() {
		return decoded().flagReachingDefs;
	}

	/**
	 * @return Whether no result or committed entry is error-valued.
	 */
	public boolean isOk() {
		return decoded().isOk();
	}

	public ErrorPositions getErrorPositions() {
		return decoded().getErrorPositions();
	}

	/**
	 * @return The definition sites that reach a use of the named variable.
	 */
	public List<String> reachingDefLocations(String variable) {
		return getReachingDefs()
			.stream()
			.flatMap(Optional::stream)
			.filter(fact -> fact.variable().equals(variable))
			.flatMap(fact -> fact.locations().stream())
			.distinct()
			.collect(ImmutableList.toImmutableList());
	}

	/**
	 * @return The variable at a position, or empty if it is error-valued.
	 * @throws LiftContractException If there is no such position.
	 */
	public Optional<XVariable> var(int i) {
		return positional(getVars(), i);
	}

	public Optional<XVariable> varResult(int i) {
		return positional(getVarsResult(), i);
	}

	public Optional<XXpr> xpr(int i) {
		return positional(getXprs(), i);
	}

	public Optional<XXpr> xprResult(int i) {
		return positional(getXprsResult(), i);
	}

	public Optional<XXpr> committedXpr(int i) {
		return positional(getCommittedXprs(), i);
	}

	private <T> Optional<T> positional(List<FactValue<T>> values, int i) {
		if (i < 0 || i >= values.size()) {
			throw new LiftContractException("Position %d out of bounds for %d entries in %s", i, values.size(), this.record);
		}
		return values.get(i).toOptional();
	}

	@Override
	public String toString() {
		return this.record.toString();
	}
}
