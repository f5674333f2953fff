package bclift.lift;

import bclift.ast.ArrayType;
import bclift.ast.BinOp;
import bclift.ast.Expr;
import bclift.ast.IKind;
import bclift.ast.IntType;
import bclift.ast.Lval;
import bclift.ast.Nodes;
import bclift.ast.Typ;
import bclift.ast.UnOp;
import bclift.ast.VarHost;
import bclift.fact.InstrFacts;
import bclift.value.IntArith;
import bclift.value.XOperator;
import bclift.value.XVariable;
import bclift.value.XXpr;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Lifts symbolic expressions to high-level expressions.
 */
final class ExprLifter {
	private static final ImmutableMap<XOperator, BinOp> BINARY = ImmutableMap.<XOperator, BinOp>builder()
		.put(XOperator.PLUS, BinOp.PLUS)
		.put(XOperator.MINUS, BinOp.MINUS)
		.put(XOperator.MULT, BinOp.MULT)
		.put(XOperator.DIV, BinOp.DIV)
		.put(XOperator.MOD, BinOp.MOD)
		.put(XOperator.BAND, BinOp.BAND)
		.put(XOperator.BOR, BinOp.BOR)
		.put(XOperator.BXOR, BinOp.BXOR)
		.put(XOperator.LSL, BinOp.SHIFTLEFT)
		.put(XOperator.LSR, BinOp.SHIFTRIGHT)
		.put(XOperator.ASR, BinOp.SHIFTRIGHT)
		.put(XOperator.LAND, BinOp.LAND)
		.put(XOperator.LOR, BinOp.LOR)
		.put(XOperator.EQ, BinOp.EQ)
		.put(XOperator.NE, BinOp.NE)
		.put(XOperator.LT, BinOp.LT)
		.put(XOperator.LE, BinOp.LE)
		.put(XOperator.GT, BinOp.GT)
		.put(XOperator.GE, BinOp.GE)
		.build();

	private static final ImmutableMap<XOperator, UnOp> UNARY = ImmutableMap.of(
		XOperator.NEG, UnOp.NEG,
		XOperator.BNOT, UnOp.BNOT,
		XOperator.LNOT, UnOp.LNOT);

	private final LiftEngine engine;
	private final AstBuilder builder;
	private final OffsetResolver offsets;

	ExprLifter(LiftEngine engine, AstBuilder builder, OffsetResolver offsets) {
		this.engine = engine;
		this.builder = builder;
		this.offsets = offsets;
	}

	Expr lift(XXpr xpr, Optional<InstrFacts> facts, Optional<Typ> expected, String site) {
		var simplified = xpr.simplify();
		if (simplified instanceof XXpr.Constant c) {
			return liftConstant(c, expected, site);
		} else if (simplified instanceof XXpr.Var v) {
			return liftVariable(v.getVariable(), facts, site);
		} else {
			return liftCompound((XXpr.Compound) simplified, facts, site);
		}
	}

	/**
	 * The low-level rendering: registers and operators as they are, with no
	 * symbol resolution.
	 */
	Expr lower(XXpr xpr, String site) {
		var locals = this.builder.getLocals();
		if (xpr instanceof XXpr.Constant c) {
			return Nodes.intConstant(c.getValue(), kindOf(c.getValue()));
		} else if (xpr instanceof XXpr.Var v) {
			var variable = v.getVariable();
			if (variable instanceof XVariable.Register r) {
				return Nodes.lvalExpr(Nodes.varLval(locals.local(r.getRegister())));
			} else if (variable instanceof XVariable.Flag f) {
				return Nodes.lvalExpr(Nodes.varLval(locals.local(f.getFlag())));
			} else if (variable instanceof XVariable.InitialRegisterValue r) {
				return Nodes.lvalExpr(Nodes.varLval(locals.local(r.getRegister())));
			}
			return Nodes.lvalExpr(this.engine.lowLval(variable, site));
		}

		var compound = (XXpr.Compound) xpr;
		var op = compound.getOperator();
		if (op.isEmpty() || op.get().getArity() != compound.getOperands().size()) {
			return unknownOperator(compound, site);
		}
		List<Expr> operands = new ArrayList<>();
		for (var operand : compound.getOperands()) {
			operands.add(lower(operand, site));
		}
		return apply(op.get(), operands);
	}

	private Expr liftConstant(XXpr.Constant c, Optional<Typ> expected, String site) {
		if (c.isGlobalAddress()) {
			var address = IntArith.zeroExtend(c.getValue(), c.getWidth());
			var addressExpr = globalAddress(address, site);
			if (addressExpr.isPresent()) {
				return Nodes.globalAddressConstant(address, addressExpr.get());
			}
		}

		var typer = this.builder.getTyper();
		long value = IntArith.widen(c.getValue(), c.getWidth(), typer.isSigned(expected));
		var kind = expected.map(typer::unroll)
			.filter(t -> t instanceof IntType)
			.map(t -> ((IntType) t).getKind())
			.orElse(kindOf(value));
		return Nodes.intConstant(value, kind);
	}

	private static IKind kindOf(long value) {
		return value > Integer.MAX_VALUE ? IKind.UINT : IKind.INT;
	}

	/**
	 * @return The address of the global at or containing an address, minting
	 *         a global for an address no known global covers.
	 */
	private Optional<Expr> globalAddress(long address, String site) {
		var globals = this.builder.getGlobals();
		var containing = globals.globalContaining(address, this.builder.getSizes());
		if (containing.isEmpty()) {
			var fresh = globals.addGlobal("gv_" + IntArith.toHex(address, 64), Optional.empty(), address);
			return Optional.of(Nodes.addressOf(Nodes.varLval(fresh)));
		}

		var global = containing.get().global();
		if (containing.get().offset() == 0) {
			return Optional.of(Nodes.addressOf(Nodes.varLval(global)));
		}
		var offset = this.offsets.offsetInType(global.getType().get(), containing.get().offset(), site);
		if (offset.isUnresolved()) {
			return Optional.empty();
		}
		return Optional.of(Nodes.addressOf(Nodes.lval(Nodes.varHost(global), offset)));
	}

	private Expr liftVariable(XVariable variable, Optional<InstrFacts> facts, String site) {
		if (variable instanceof XVariable.Register r) {
			return registerUse(r.getRegister(), facts, site);
		}

		var lval = this.engine.liftLval(variable, facts, site, Optional.empty());
		if (lval.getHost() instanceof VarHost v && v.getVarInfo().isPlaceholder()) {
			return Nodes.unresolved(v.getVarInfo().getDescription().orElse(variable.toString()));
		}
		return Nodes.lvalExpr(lval);
	}

	/**
	 * A register use resolves to the SSA variable of its unique reaching
	 * definition, when one was introduced.
	 */
	private Expr registerUse(String register, Optional<InstrFacts> facts, String site) {
		var locals = this.builder.getLocals();
		List<String> locations = facts.map(f -> f.reachingDefLocations(register)).orElse(List.of());
		if (locations.size() == 1) {
			var ssa = locals.ssaVarAt(register, locations.get(0));
			if (ssa.isPresent()) {
				return Nodes.lvalExpr(Nodes.varLval(ssa.get()));
			}
		} else if (locations.size() > 1) {
			this.builder.getDiagnostics().report(site, Diagnostic.Kind.MULTIPLE_DEFINITIONS,
				"%s is reached by %d definitions: %s", register, locations.size(), locations);
		}
		return Nodes.lvalExpr(Nodes.varLval(locals.local(register)));
	}

	private Expr unknownOperator(XXpr.Compound compound, String site) {
		this.builder.getDiagnostics().report(site, Diagnostic.Kind.RESOLUTION_GAP,
			"cannot lift operator %s with %d operands", compound.getOperatorName(), compound.getOperands().size());
		return Nodes.unresolved(compound.toString());
	}

	private Expr liftCompound(XXpr.Compound compound, Optional<InstrFacts> facts, String site) {
		var op = compound.getOperator();
		if (op.isEmpty() || op.get().getArity() != compound.getOperands().size()) {
			return unknownOperator(compound, site);
		}

		if (op.get() == XOperator.PLUS || op.get() == XOperator.MINUS) {
			var stack = stackAddress(compound, op.get());
			if (stack.isPresent()) {
				return stack.get();
			}
		}

		if (op.get() == XOperator.PLUS) {
			var indexed = globalElementAddress(compound, facts, site);
			if (indexed.isPresent()) {
				return indexed.get();
			}
		}

		List<Expr> operands = new ArrayList<>();
		for (var operand : compound.getOperands()) {
			operands.add(lift(operand, facts, Optional.empty(), site));
		}

		if (op.get() == XOperator.PLUS) {
			var field = fieldAddress(operands.get(0), compound.getOperand(1), site);
			if (field.isPresent()) {
				return field.get();
			}
		}

		return apply(op.get(), operands);
	}

	/**
	 * Offsets from the initial stack pointer become the address of a stack slot.
	 */
	private Optional<Expr> stackAddress(XXpr.Compound compound, XOperator op) {
		if (!(compound.getOperand(0) instanceof XXpr.Var v)
				|| !(v.getVariable() instanceof XVariable.InitialRegisterValue r)
				|| !r.getRegister().equals(this.engine.getStackPointer())) {
			return Optional.empty();
		}

		OptionalLong delta = compound.getOperand(1).evaluate();
		if (delta.isEmpty()) {
			return Optional.empty();
		}

		long offset = op == XOperator.PLUS ? delta.getAsLong() : -delta.getAsLong();
		var slot = this.builder.getLocals().stackVar(offset, Optional.empty());
		return Optional.of(Nodes.addressOf(Nodes.varLval(slot)));
	}

	/**
	 * {@code gv + size * i}, for a global array of elements of that size,
	 * becomes {@code &gv[i]}.
	 */
	private Optional<Expr> globalElementAddress(XXpr.Compound compound, Optional<InstrFacts> facts, String site) {
		if (!(compound.getOperand(0) instanceof XXpr.Constant base)
				|| !(compound.getOperand(1) instanceof XXpr.Compound scaled)
				|| scaled.getOperator().orElse(null) != XOperator.MULT
				|| scaled.getOperands().size() != 2) {
			return Optional.empty();
		}

		XXpr index;
		OptionalLong scale;
		if (scaled.getOperand(0).isConstant()) {
			scale = scaled.getOperand(0).evaluate();
			index = scaled.getOperand(1);
		} else {
			scale = scaled.getOperand(1).evaluate();
			index = scaled.getOperand(0);
		}
		if (scale.isEmpty()) {
			return Optional.empty();
		}

		var global = this.builder.getGlobals().globalAt(IntArith.zeroExtend(base.getValue(), base.getWidth()));
		if (global.isEmpty() || global.get().getType().isEmpty()) {
			return Optional.empty();
		}
		var type = this.builder.getTyper().unroll(global.get().getType().get());
		if (!(type instanceof ArrayType array)) {
			return Optional.empty();
		}
		var elemSize = this.builder.getSizes().sizeOf(array.getElement());
		if (elemSize.isEmpty() || elemSize.getAsInt() != scale.getAsLong()) {
			return Optional.empty();
		}

		var liftedIndex = lift(index, facts, Optional.empty(), site);
		Lval element = Nodes.lval(Nodes.varHost(global.get()), Nodes.indexOffset(liftedIndex, Nodes.noOffset()));
		return Optional.of(Nodes.addressOf(element));
	}

	/**
	 * {@code p + c}, for a pointer to a composite with a field at offset c,
	 * becomes {@code &p->field}.
	 */
	private Optional<Expr> fieldAddress(Expr pointer, XXpr addend, String site) {
		var delta = addend.evaluate();
		if (delta.isEmpty() || delta.getAsLong() <= 0 || delta.getAsLong() > Integer.MAX_VALUE) {
			return Optional.empty();
		}

		var typer = this.builder.getTyper();
		var comp = typer.typeOf(pointer)
			.flatMap(typer::pointee)
			.flatMap(typer::compInfo);
		if (comp.isEmpty() || !comp.get().hasFieldOffsets()) {
			return Optional.empty();
		}

		var found = comp.get().fieldAt((int) delta.getAsLong());
		if (found.isEmpty() || found.get().rest() != 0) {
			return Optional.empty();
		}
		var field = Nodes.fieldOffset(found.get().field().getName(), comp.get().getKey(), Nodes.noOffset());
		return Optional.of(Nodes.addressOf(Nodes.memLval(pointer, field)));
	}

	private static Expr apply(XOperator op, List<Expr> operands) {
		switch (op) {
			case LSB:
				return Nodes.binary(BinOp.BAND, operands.get(0), Nodes.intConstant(0xff));
			case LSH:
				return Nodes.binary(BinOp.BAND, operands.get(0), Nodes.intConstant(0xff00));
			case XBYTE:
				return extractByte(operands.get(0), operands.get(1));
			case LSR:
				return Nodes.binary(BinOp.SHIFTRIGHT, Nodes.cast(Nodes.intType(IKind.UINT), operands.get(0)), operands.get(1));
			case ASR:
				return Nodes.binary(BinOp.SHIFTRIGHT, Nodes.cast(Nodes.intType(IKind.INT), operands.get(0)), operands.get(1));
			default:
				break;
		}

		var unary = UNARY.get(op);
		if (unary != null) {
			return Nodes.unary(unary, operands.get(0));
		}
		return Nodes.binary(BINARY.get(op), operands.get(0), operands.get(1));
	}

	private static Expr extractByte(Expr which, Expr value) {
		var k = which.constantValue();
		if (k.isPresent() && k.getAsLong() == 0) {
			return Nodes.binary(BinOp.BAND, value, Nodes.intConstant(0xff));
		} else if (k.isPresent() && k.getAsLong() == 1) {
			var masked = Nodes.binary(BinOp.BAND, value, Nodes.intConstant(0xff00));
			return Nodes.binary(BinOp.SHIFTRIGHT, masked, Nodes.intConstant(8));
		}

		Expr shift = k.isPresent()
			? Nodes.intConstant(8 * k.getAsLong())
			: Nodes.binary(BinOp.MULT, which, Nodes.intConstant(8));
		return Nodes.binary(BinOp.BAND, Nodes.binary(BinOp.SHIFTRIGHT, value, shift), Nodes.intConstant(0xff));
	}
}
