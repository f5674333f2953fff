package bclift.lift;

import bclift.LiftConfig;
import bclift.LiftContractException;
import bclift.ast.AstNode;
import bclift.ast.Expr;
import bclift.ast.Instr;
import bclift.ast.Lval;
import bclift.fact.DataflowFact;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The correspondence between low- and high-level nodes of one function lift,
 * the dataflow facts attached to nodes, and the addresses instructions came
 * from.  All tables are keyed by node id.
 *
 * Each low-level node has at most one high-level counterpart; a high-level
 * node may stand for several low-level ones.  Missing entries read as empty.
 */
public final class Provenance {
	private final Diagnostics diagnostics;
	private final boolean strict;
	private final boolean frozen;

	private final Map<Integer, AstNode> nodes;
	private final Map<Integer, Integer> instrLowToHigh;
	private final ListMultimap<Integer, Integer> instrHighToLow;
	private final Map<Integer, Integer> exprLowToHigh;
	private final ListMultimap<Integer, Integer> exprHighToLow;
	private final Map<Integer, Integer> lvalLowToHigh;
	private final ListMultimap<Integer, Integer> lvalHighToLow;

	private final ListMultimap<Integer, DataflowFact> exprReachingDefs;
	private final ListMultimap<Integer, DataflowFact> exprFlagReachingDefs;
	private final ListMultimap<Integer, DataflowFact> lvalDefUses;
	private final ListMultimap<Integer, DataflowFact> lvalDefUsesHigh;

	private final Map<Integer, Span> instrSpans;
	private final ListMultimap<Integer, String> instrAddresses;

	public Provenance(Diagnostics diagnostics) {
		this(diagnostics, LiftConfig.STRICT_PROVENANCE);
	}

	public Provenance(Diagnostics diagnostics, boolean strict) {
		this.diagnostics = diagnostics;
		this.strict = strict;
		this.frozen = false;
		this.nodes = new HashMap<>();
		this.instrLowToHigh = new HashMap<>();
		this.instrHighToLow = ArrayListMultimap.create();
		this.exprLowToHigh = new HashMap<>();
		this.exprHighToLow = ArrayListMultimap.create();
		this.lvalLowToHigh = new HashMap<>();
		this.lvalHighToLow = ArrayListMultimap.create();
		this.exprReachingDefs = ArrayListMultimap.create();
		this.exprFlagReachingDefs = ArrayListMultimap.create();
		this.lvalDefUses = ArrayListMultimap.create();
		this.lvalDefUsesHigh = ArrayListMultimap.create();
		this.instrSpans = new HashMap<>();
		this.instrAddresses = ArrayListMultimap.create();
	}

	private Provenance(Provenance other) {
		this.diagnostics = other.diagnostics.snapshot();
		this.strict = other.strict;
		this.frozen = true;
		this.nodes = ImmutableMap.copyOf(other.nodes);
		this.instrLowToHigh = ImmutableMap.copyOf(other.instrLowToHigh);
		this.instrHighToLow = ImmutableListMultimap.copyOf(other.instrHighToLow);
		this.exprLowToHigh = ImmutableMap.copyOf(other.exprLowToHigh);
		this.exprHighToLow = ImmutableListMultimap.copyOf(other.exprHighToLow);
		this.lvalLowToHigh = ImmutableMap.copyOf(other.lvalLowToHigh);
		this.lvalHighToLow = ImmutableListMultimap.copyOf(other.lvalHighToLow);
		this.exprReachingDefs = ImmutableListMultimap.copyOf(other.exprReachingDefs);
		this.exprFlagReachingDefs = ImmutableListMultimap.copyOf(other.exprFlagReachingDefs);
		this.lvalDefUses = ImmutableListMultimap.copyOf(other.lvalDefUses);
		this.lvalDefUsesHigh = ImmutableListMultimap.copyOf(other.lvalDefUsesHigh);
		this.instrSpans = ImmutableMap.copyOf(other.instrSpans);
		this.instrAddresses = ImmutableListMultimap.copyOf(other.instrAddresses);
	}

	/**
	 * @return An immutable copy of these tables.
	 */
	public Provenance snapshot() {
		return this.frozen ? this : new Provenance(this);
	}

	public boolean isFrozen() {
		return this.frozen;
	}

	/**
	 * @return Where re-mappings are reported; frozen along with a snapshot.
	 */
	public Diagnostics getDiagnostics() {
		return this.diagnostics;
	}

	private void checkMutable() {
		if (this.frozen) {
			throw new LiftContractException("Provenance snapshot is immutable");
		}
	}

	/**
	 * Record that a low-level node corresponds to a high-level one.  Mapping a
	 * low-level node again to a different high-level node replaces the old
	 * mapping and records a diagnostic, or fails in strict mode.
	 */
	private void map(String what, String site, Map<Integer, Integer> lowToHigh, ListMultimap<Integer, Integer> highToLow,
			AstNode low, AstNode high) {
		checkMutable();

		int lowId = low.getId();
		int highId = high.getId();
		var old = lowToHigh.get(lowId);
		if (old != null && old != highId) {
			var message = String.format("%s %d re-mapped from %d to %d", what, lowId, old, highId);
			if (this.strict) {
				throw new LiftContractException("%s: %s", site, message);
			}
			this.diagnostics.report(site, Diagnostic.Kind.PROVENANCE_OVERWRITE, "%s", message);
			highToLow.remove(old, lowId);
		}

		this.nodes.put(lowId, low);
		this.nodes.put(highId, high);
		lowToHigh.put(lowId, highId);
		if (!highToLow.containsEntry(highId, lowId)) {
			highToLow.put(highId, lowId);
		}
	}

	public void mapInstrs(String site, Instr low, Instr high) {
		map("instruction", site, this.instrLowToHigh, this.instrHighToLow, low, high);
	}

	public void mapExprs(String site, Expr low, Expr high) {
		map("expression", site, this.exprLowToHigh, this.exprHighToLow, low, high);
	}

	public void mapLvals(String site, Lval low, Lval high) {
		map("lvalue", site, this.lvalLowToHigh, this.lvalHighToLow, low, high);
	}

	private <T extends AstNode> Optional<T> high(Map<Integer, Integer> lowToHigh, AstNode low, Class<T> type) {
		return Optional.ofNullable(lowToHigh.get(low.getId()))
			.map(this.nodes::get)
			.map(type::cast);
	}

	private <T extends AstNode> List<T> lows(ListMultimap<Integer, Integer> highToLow, AstNode high, Class<T> type) {
		return highToLow.get(high.getId())
			.stream()
			.map(this.nodes::get)
			.map(type::cast)
			.collect(ImmutableList.toImmutableList());
	}

	private static <T> Optional<T> last(List<T> list) {
		return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
	}

	/**
	 * @return The high-level counterpart of a low-level instruction.
	 */
	public Optional<Instr> highInstr(Instr low) {
		return high(this.instrLowToHigh, low, Instr.class);
	}

	/**
	 * @return The most recently mapped low-level counterpart of a high-level instruction.
	 */
	public Optional<Instr> lowInstr(Instr high) {
		return last(lowInstrs(high));
	}

	/**
	 * @return All low-level counterparts of a high-level instruction.
	 */
	public List<Instr> lowInstrs(Instr high) {
		return lows(this.instrHighToLow, high, Instr.class);
	}

	public Optional<Expr> highExpr(Expr low) {
		return high(this.exprLowToHigh, low, Expr.class);
	}

	public Optional<Expr> lowExpr(Expr high) {
		return last(lows(this.exprHighToLow, high, Expr.class));
	}

	public Optional<Lval> highLval(Lval low) {
		return high(this.lvalLowToHigh, low, Lval.class);
	}

	public Optional<Lval> lowLval(Lval high) {
		return last(lows(this.lvalHighToLow, high, Lval.class));
	}

	public void addReachingDefs(Expr expr, List<DataflowFact> facts) {
		checkMutable();
		if (!facts.isEmpty()) {
			this.nodes.put(expr.getId(), expr);
		}
		this.exprReachingDefs.putAll(expr.getId(), facts);
	}

	public List<DataflowFact> getReachingDefs(Expr expr) {
		return this.exprReachingDefs.get(expr.getId());
	}

	public void addFlagReachingDefs(Expr expr, List<DataflowFact> facts) {
		checkMutable();
		if (!facts.isEmpty()) {
			this.nodes.put(expr.getId(), expr);
		}
		this.exprFlagReachingDefs.putAll(expr.getId(), facts);
	}

	public List<DataflowFact> getFlagReachingDefs(Expr expr) {
		return this.exprFlagReachingDefs.get(expr.getId());
	}

	public void addDefUses(Lval lval, List<DataflowFact> facts) {
		checkMutable();
		if (!facts.isEmpty()) {
			this.nodes.put(lval.getId(), lval);
		}
		this.lvalDefUses.putAll(lval.getId(), facts);
	}

	public List<DataflowFact> getDefUses(Lval lval) {
		return this.lvalDefUses.get(lval.getId());
	}

	public void addDefUsesHigh(Lval lval, List<DataflowFact> facts) {
		checkMutable();
		if (!facts.isEmpty()) {
			this.nodes.put(lval.getId(), lval);
		}
		this.lvalDefUsesHigh.putAll(lval.getId(), facts);
	}

	public List<DataflowFact> getDefUsesHigh(Lval lval) {
		return this.lvalDefUsesHigh.get(lval.getId());
	}

	public void recordSpan(Instr instr, Span span) {
		checkMutable();
		this.nodes.put(instr.getId(), instr);
		this.instrSpans.put(instr.getId(), span);
	}

	public Optional<Span> getSpan(Instr instr) {
		return Optional.ofNullable(this.instrSpans.get(instr.getId()));
	}

	/**
	 * Record that an instruction was lifted from the instruction at an address.
	 */
	public void addAddress(Instr instr, String address) {
		checkMutable();
		this.nodes.put(instr.getId(), instr);
		if (!this.instrAddresses.containsEntry(instr.getId(), address)) {
			this.instrAddresses.put(instr.getId(), address);
		}
	}

	/**
	 * @return The addresses of the instructions an instruction was lifted from.
	 */
	public List<String> getAddresses(Instr instr) {
		return this.instrAddresses.get(instr.getId());
	}

	public int getInstrMappingCount() {
		return this.instrLowToHigh.size();
	}

	/**
	 * @return Every node these tables refer to, by id.
	 */
	ImmutableMap<Integer, AstNode> getNodes() {
		return ImmutableMap.copyOf(this.nodes);
	}

	ImmutableListMultimap<Integer, Integer> getInstrHighToLow() {
		return ImmutableListMultimap.copyOf(this.instrHighToLow);
	}

	ImmutableListMultimap<Integer, Integer> getExprHighToLow() {
		return ImmutableListMultimap.copyOf(this.exprHighToLow);
	}

	ImmutableListMultimap<Integer, Integer> getLvalHighToLow() {
		return ImmutableListMultimap.copyOf(this.lvalHighToLow);
	}

	/**
	 * @return The dataflow facts attached to nodes, by node id.
	 */
	ImmutableListMultimap<Integer, DataflowFact> getFacts(DataflowFact.Kind kind) {
		switch (kind) {
			case REACHING_DEF:
				return ImmutableListMultimap.copyOf(this.exprReachingDefs);
			case FLAG_REACHING_DEF:
				return ImmutableListMultimap.copyOf(this.exprFlagReachingDefs);
			case DEF_USE:
				return ImmutableListMultimap.copyOf(this.lvalDefUses);
			case DEF_USE_HIGH:
				return ImmutableListMultimap.copyOf(this.lvalDefUsesHigh);
			default:
				throw new IllegalArgumentException("Unknown fact kind " + kind);
		}
	}

	ImmutableMap<Integer, Span> getSpans() {
		return ImmutableMap.copyOf(this.instrSpans);
	}

	ImmutableListMultimap<Integer, String> getAddresses() {
		return ImmutableListMultimap.copyOf(this.instrAddresses);
	}
}
