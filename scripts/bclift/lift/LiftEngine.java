package bclift.lift;

import bclift.ast.Expr;
import bclift.ast.Instr;
import bclift.ast.Lval;
import bclift.ast.Nodes;
import bclift.ast.Offset;
import bclift.ast.Typ;
import bclift.ast.VarHost;
import bclift.fact.DataflowFact;
import bclift.fact.DecodedFacts;
import bclift.fact.InstrFacts;
import bclift.type.CompInfo;
import bclift.value.XMemoryOffset;
import bclift.value.XVariable;
import bclift.value.XXpr;

import java.util.List;
import java.util.Optional;

/**
 * Lifts the symbolic values of one function into its dual-level AST.
 *
 * Every entry point is total: what cannot be resolved becomes a placeholder
 * node and a diagnostic, never an exception.
 */
public final class LiftEngine {
	/** The stack pointer register, when none is given. */
	public static final String DEFAULT_STACK_POINTER = "SP";

	private final AstBuilder builder;
	private final String stackPointer;
	private final OffsetResolver offsets;
	private final ExprLifter exprs;
	private final LvalLifter lvals;

	public LiftEngine(AstBuilder builder) {
		this(builder, DEFAULT_STACK_POINTER);
	}

	public LiftEngine(AstBuilder builder, String stackPointer) {
		this.builder = builder;
		this.stackPointer = stackPointer;
		this.offsets = new OffsetResolver(this, builder);
		this.exprs = new ExprLifter(this, builder, this.offsets);
		this.lvals = new LvalLifter(this, builder, this.offsets);
	}

	public AstBuilder getBuilder() {
		return this.builder;
	}

	public String getStackPointer() {
		return this.stackPointer;
	}

	public Expr liftExpr(XXpr xpr, String site) {
		return liftExpr(xpr, Optional.empty(), site, Optional.empty());
	}

	/**
	 * Lift an expression, resolving register uses through the reaching
	 * definitions of an instruction.
	 */
	public Expr liftExpr(XXpr xpr, InstrFacts facts, String site) {
		return liftExpr(xpr, Optional.of(facts), site, Optional.empty());
	}

	/**
	 * @param expected The static type the context expects, which decides how
	 *                 narrow constants are widened.
	 */
	public Expr liftExpr(XXpr xpr, Optional<InstrFacts> facts, String site, Optional<Typ> expected) {
		return this.exprs.lift(xpr, facts, expected, site);
	}

	public Lval liftLval(XVariable variable, String site) {
		return liftLval(variable, Optional.empty(), site, Optional.empty());
	}

	/**
	 * @param addressHint The address of the variable, for memory that cannot
	 *                    be resolved to a location of its own.
	 */
	public Lval liftLval(XVariable variable, Optional<InstrFacts> facts, String site, Optional<XXpr> addressHint) {
		return this.lvals.lift(variable, addressHint, facts, site);
	}

	public Offset liftOffset(XMemoryOffset offset, String site) {
		return liftOffset(offset, Optional.empty(), site);
	}

	/**
	 * Lift an offset into a value of the given type.  Constant offsets are
	 * navigated through the type's layout.
	 */
	public Offset liftOffset(XMemoryOffset offset, Optional<Typ> hostType, String site) {
		return this.offsets.lift(offset, hostType, Optional.empty(), site);
	}

	/**
	 * @return The offset of the field of a composite at a byte offset.
	 */
	public Offset fieldAtOffset(CompInfo comp, long offset, String site) {
		return this.offsets.fieldAtOffset(comp, offset, site);
	}

	/**
	 * Lift the target of a definition.  A register definition gets the SSA
	 * variable of its site, and remembers a constant value.
	 */
	public Lval liftDefinition(XVariable variable, Optional<XXpr> value, String site) {
		var lval = liftLval(variable, Optional.empty(), site, Optional.empty());
		if (variable instanceof XVariable.Register && lval.getHost() instanceof VarHost v) {
			var constant = value.map(XXpr::evaluate);
			if (constant.isPresent() && constant.get().isPresent()) {
				this.builder.getLocals().recordSsaConstant(v.getVarInfo(), constant.get().getAsLong());
			}
		}
		return lval;
	}

	/**
	 * @return The low-level lvalue of a machine register.
	 */
	public Lval lowRegister(String register) {
		return Nodes.varLval(this.builder.getLocals().local(register));
	}

	/**
	 * @return The low-level rendering of an expression.
	 */
	public Expr lowExpr(XXpr xpr, String site) {
		return this.exprs.lower(xpr, site);
	}

	/**
	 * @return The low-level lvalue of the memory at an address.
	 */
	public Lval lowMemory(XXpr address, String site) {
		return Nodes.memLval(lowExpr(address, site), Nodes.noOffset());
	}

	/**
	 * @return The low-level lvalue of a variable.
	 */
	public Lval lowLval(XVariable variable, String site) {
		if (variable instanceof XVariable.Register r) {
			return lowRegister(r.getRegister());
		} else if (variable instanceof XVariable.Flag f) {
			return lowRegister(f.getFlag());
		}
		return liftLval(variable, Optional.empty(), site, Optional.empty());
	}

	/**
	 * Lift the variable at a position of an instruction's facts at both
	 * levels, and attach its def-use facts.
	 *
	 * @param address The address written, if known.
	 */
	public LvalPair liftLhs(InstrFacts facts, int index, String site, Optional<XXpr> address) {
		var variable = facts.getForm() == DecodedFacts.Form.RESULT ? facts.varResult(index) : facts.var(index);
		if (variable.isEmpty()) {
			var description = "error-valued variable " + index + " of " + facts.getKey();
			var high = this.lvals.placeholder(site, Diagnostic.Kind.RESOLUTION_GAP, description);
			return new LvalPair(high, high);
		}

		var high = liftLval(variable.get(), Optional.of(facts), site, address);
		Lval low;
		if (variable.get() instanceof XVariable.Register || variable.get() instanceof XVariable.Flag || address.isEmpty()) {
			low = lowLval(variable.get(), site);
		} else {
			low = lowMemory(address.get(), site);
		}
		pairLvals(site, low, high);

		var provenance = this.builder.getProvenance();
		provenance.addDefUses(high, at(facts.getDefUses(), index));
		provenance.addDefUsesHigh(high, at(facts.getDefUsesHigh(), index));
		return new LvalPair(low, high);
	}

	public ExprPair liftRhs(InstrFacts facts, int index, String site) {
		return liftRhs(facts, index, site, Optional.empty());
	}

	/**
	 * Lift the expression at a position of an instruction's facts at both
	 * levels, and attach its reaching definitions.  For result records, a
	 * committed expression is preferred over the raw one.
	 */
	public ExprPair liftRhs(InstrFacts facts, int index, String site, Optional<Typ> expected) {
		var xpr = rhsXpr(facts, index);
		if (xpr.isEmpty()) {
			this.builder.getDiagnostics().report(site, Diagnostic.Kind.RESOLUTION_GAP,
				"error-valued expression %d of %s", index, facts.getKey());
			var description = "error value " + index;
			return new ExprPair(Nodes.unresolved(description), Nodes.unresolved(description));
		}

		var low = lowExpr(xpr.get(), site);
		var high = liftExpr(xpr.get(), Optional.of(facts), site, expected);
		pairExprs(site, low, high);
		this.builder.getProvenance().addReachingDefs(high, at(facts.getReachingDefs(), index));
		return new ExprPair(low, high);
	}

	/**
	 * Lift a branch condition, attaching the flag definitions that reach it.
	 */
	public ExprPair liftCondition(InstrFacts facts, int index, String site) {
		var pair = liftRhs(facts, index, site);
		var flags = facts.getFlagReachingDefs()
			.stream()
			.flatMap(Optional::stream)
			.toList();
		this.builder.getProvenance().addFlagReachingDefs(pair.high(), flags);
		return pair;
	}

	/**
	 * Lift {@code lhs := rhs} at both levels and pair the two assignments.
	 */
	public InstrPair liftAssignment(InstrFacts facts, int lhsIndex, int rhsIndex, String site) {
		var lhs = liftLhs(facts, lhsIndex, site, Optional.empty());
		var rhs = liftRhs(facts, rhsIndex, site, this.builder.getTyper().typeOf(lhs.high()));

		var variable = facts.getForm() == DecodedFacts.Form.RESULT ? facts.varResult(lhsIndex) : facts.var(lhsIndex);
		if (variable.isPresent() && variable.get() instanceof XVariable.Register && lhs.high().getHost() instanceof VarHost v) {
			var value = rhsXpr(facts, rhsIndex).map(XXpr::evaluate);
			if (value.isPresent() && value.get().isPresent()) {
				this.builder.getLocals().recordSsaConstant(v.getVarInfo(), value.get().getAsLong());
			}
		}

		var low = this.builder.mkAssign(site, lhs.low(), rhs.low());
		var high = this.builder.mkAssign(site, lhs.high(), rhs.high());
		pairInstrs(site, low, high);
		return new InstrPair(low, high);
	}

	private Optional<XXpr> rhsXpr(InstrFacts facts, int index) {
		if (facts.getForm() != DecodedFacts.Form.RESULT) {
			return facts.xpr(index);
		}
		if (index < facts.getCommittedXprs().size()) {
			var committed = facts.committedXpr(index);
			if (committed.isPresent()) {
				return committed;
			}
		}
		return facts.xprResult(index);
	}

	private static List<DataflowFact> at(List<Optional<DataflowFact>> facts, int index) {
		if (index < facts.size() && facts.get(index).isPresent()) {
			return List.of(facts.get(index).get());
		}
		return List.of();
	}

	public void pairInstrs(String site, Instr low, Instr high) {
		if (low != high) {
			this.builder.getProvenance().mapInstrs(site, low, high);
		}
	}

	public void pairExprs(String site, Expr low, Expr high) {
		if (low != high) {
			this.builder.getProvenance().mapExprs(site, low, high);
		}
	}

	public void pairLvals(String site, Lval low, Lval high) {
		if (low != high) {
			this.builder.getProvenance().mapLvals(site, low, high);
		}
	}

	/** A low-level expression and its high-level counterpart. */
	public record ExprPair(Expr low, Expr high) {
	}

	/** A low-level lvalue and its high-level counterpart. */
	public record LvalPair(Lval low, Lval high) {
	}

	/** A low-level instruction and its high-level counterpart. */
	public record InstrPair(Instr low, Instr high) {
	}
}
