package bclift.lift;

import bclift.ast.BinOp;
import bclift.ast.Lval;
import bclift.ast.Nodes;
import bclift.ast.Offset;
import bclift.ast.Typ;
import bclift.fact.InstrFacts;
import bclift.symbol.LocalSymbolTable.FormalLocation;
import bclift.value.IntArith;
import bclift.value.XMemoryOffset;
import bclift.value.XVariable;
import bclift.value.XXpr;

import java.util.Optional;

/**
 * Lifts symbolic variables to high-level lvalues.
 */
final class LvalLifter {
	private final LiftEngine engine;
	private final AstBuilder builder;
	private final OffsetResolver offsets;

	LvalLifter(LiftEngine engine, AstBuilder builder, OffsetResolver offsets) {
		this.engine = engine;
		this.builder = builder;
		this.offsets = offsets;
	}

	Lval lift(XVariable variable, Optional<XXpr> addressHint, Optional<InstrFacts> facts, String site) {
		var locals = this.builder.getLocals();

		if (variable instanceof XVariable.Register r) {
			return Nodes.varLval(locals.ssaVar(r.getRegister(), site, Optional.empty()));
		} else if (variable instanceof XVariable.Flag f) {
			return Nodes.varLval(locals.local(f.getFlag()));
		} else if (variable instanceof XVariable.Temporary t) {
			return Nodes.varLval(locals.local(t.toString()));
		} else if (variable instanceof XVariable.LocalStack s) {
			return stackLval(s.getOffset(), s.getRest(), facts, site);
		} else if (variable instanceof XVariable.Global g) {
			return globalLval(g.getAddress(), g.getRest(), facts, site);
		} else if (variable instanceof XVariable.BaseMemory b) {
			return baseMemoryLval(b, facts, site);
		} else if (variable instanceof XVariable.Memory m) {
			if (addressHint.isPresent()) {
				this.builder.getDiagnostics().report(site, Diagnostic.Kind.RESOLUTION_GAP,
					"memory variable %s lifted through its address %s", m, addressHint.get());
				var address = this.engine.liftExpr(addressHint.get(), facts, site, Optional.empty());
				return Nodes.memLval(address, Nodes.noOffset());
			}
			return placeholder(site, Diagnostic.Kind.RESOLUTION_GAP, "memory " + m);
		} else if (variable instanceof XVariable.InitialRegisterValue i) {
			var formal = locals.formalInRegister(i.getRegister());
			if (formal.isPresent()) {
				return formalLval(formal.get(), site);
			}
			return Nodes.varLval(locals.local(i.toString(), Optional.empty(), Optional.of("initial value of " + i.getRegister())));
		} else if (variable instanceof XVariable.InitialMemoryValue i) {
			if (i.getVariable() instanceof XVariable.LocalStack s && s.getRest().isNone()) {
				var formal = locals.formalOnStack(s.getOffset());
				if (formal.isPresent()) {
					return formalLval(formal.get(), site);
				}
			}
			return lift(i.getVariable(), addressHint, facts, site);
		} else if (variable instanceof XVariable.ReturnValue r) {
			var defined = locals.ssaVarsAt(r.getCallSite());
			if (defined.size() == 1) {
				return Nodes.varLval(defined.get(0));
			} else if (defined.size() > 1) {
				return placeholder(site, Diagnostic.Kind.AMBIGUOUS_SSA,
					String.format("return value of call at %s (%d definitions)", r.getCallSite(), defined.size()));
			}
			return Nodes.varLval(locals.local(r.toString(), Optional.empty(), Optional.of("return value of call at " + r.getCallSite())));
		} else {
			var s = (XVariable.SymbolicValue) variable;
			return Nodes.varLval(locals.local(s.toString(), Optional.empty(), Optional.of("symbolic value " + s.getXpr())));
		}
	}

	Lval placeholder(String site, Diagnostic.Kind kind, String description) {
		this.builder.getDiagnostics().report(site, kind, "unresolved %s", description);
		return Nodes.varLval(this.builder.getLocals().placeholder(description));
	}

	/**
	 * @return The lvalue of a formal, or of the part of it held in one location.
	 */
	Lval formalLval(FormalLocation location, String site) {
		var formal = location.formal();
		var varInfo = formal.getVarInfo();
		if (!formal.isPacked() && location.location().offset() == 0) {
			return Nodes.varLval(varInfo);
		}

		var type = varInfo.getType();
		Offset offset;
		if (type.isPresent()) {
			offset = this.offsets.offsetInType(type.get(), location.location().offset(), site);
		} else {
			offset = this.offsets.lift(new XMemoryOffset.Constant(location.location().offset(), XMemoryOffset.none()),
				Optional.empty(), Optional.empty(), site);
		}
		return Nodes.lval(Nodes.varHost(varInfo), offset);
	}

	private Lval stackLval(long offset, XMemoryOffset rest, Optional<InstrFacts> facts, String site) {
		var locals = this.builder.getLocals();
		if (offset > 0) {
			var formal = locals.formalOnStack(offset);
			if (formal.isPresent()) {
				return withRest(formalLval(formal.get(), site), rest, facts, site);
			}
		}

		var slot = locals.stackVar(offset, Optional.empty());
		return withRest(Nodes.varLval(slot), rest, facts, site);
	}

	private Lval withRest(Lval base, XMemoryOffset rest, Optional<InstrFacts> facts, String site) {
		if (rest.isNone()) {
			return base;
		}
		var baseType = this.builder.getTyper().typeOf(base);
		var lifted = this.offsets.lift(rest, baseType, facts, site);
		return Nodes.lval(base.getHost(), Nodes.appendOffset(base.getOffset(), lifted));
	}

	private Lval globalLval(long address, XMemoryOffset rest, Optional<InstrFacts> facts, String site) {
		var globals = this.builder.getGlobals();
		var containing = globals.globalContaining(address, this.builder.getSizes());
		if (containing.isEmpty()) {
			var fresh = globals.addGlobal("gv_" + IntArith.toHex(address, 64), Optional.empty(), address);
			return withRest(Nodes.varLval(fresh), rest, facts, site);
		}

		var global = containing.get().global();
		Lval base = Nodes.varLval(global);
		if (containing.get().offset() != 0) {
			var inner = this.offsets.offsetInType(global.getType().get(), containing.get().offset(), site);
			base = Nodes.lval(Nodes.varHost(global), inner);
		}
		return withRest(base, rest, facts, site);
	}

	private Lval baseMemoryLval(XVariable.BaseMemory memory, Optional<InstrFacts> facts, String site) {
		var base = this.engine.liftExpr(XXpr.var(memory.getBase()), facts, site, Optional.empty());
		var typer = this.builder.getTyper();
		Optional<Typ> pointee = typer.typeOf(base).flatMap(typer::pointee);

		if (memory.getOffset() instanceof XMemoryOffset.Constant c && c.getValue() != 0) {
			var comp = pointee.flatMap(typer::compInfo);
			if (comp.isPresent()) {
				var field = this.offsets.fieldAtOffset(comp.get(), c.getValue(), site);
				var deref = Nodes.memLval(base, field);
				return field.isUnresolved() ? deref : withRest(deref, c.getRest(), facts, site);
			}

			// No layout to navigate: dereference the byte address.
			var address = Nodes.binary(BinOp.PLUS, base, Nodes.intConstant(c.getValue()));
			return withRest(Nodes.memLval(address, Nodes.noOffset()), c.getRest(), facts, site);
		}

		return Nodes.memLval(base, this.offsets.lift(memory.getOffset(), pointee, facts, site));
	}
}
