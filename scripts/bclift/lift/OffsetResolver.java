package bclift.lift;

import bclift.ast.ArrayType;
import bclift.ast.Nodes;
import bclift.ast.Offset;
import bclift.ast.Typ;
import bclift.fact.InstrFacts;
import bclift.type.CompInfo;
import bclift.value.XMemoryOffset;
import bclift.value.XXpr;

import java.util.Optional;

/**
 * Lifts symbolic memory offsets to AST offsets, navigating constant byte
 * offsets through composite layouts.
 */
final class OffsetResolver {
	private final LiftEngine engine;
	private final AstBuilder builder;

	OffsetResolver(LiftEngine engine, AstBuilder builder) {
		this.engine = engine;
		this.builder = builder;
	}

	private Offset unsupported(String site, String format, Object... args) {
		var message = String.format(format, args);
		this.builder.getDiagnostics().report(site, Diagnostic.Kind.UNSUPPORTED_OFFSET, "%s", message);
		return Nodes.unresolvedOffset(message);
	}

	/**
	 * Lift an offset applied to a value of a known (or unknown) type.  Never
	 * throws; offsets that cannot be navigated become diagnosed placeholders.
	 */
	Offset lift(XMemoryOffset offset, Optional<Typ> hostType, Optional<InstrFacts> facts, String site) {
		if (offset instanceof XMemoryOffset.None) {
			return Nodes.noOffset();
		} else if (offset instanceof XMemoryOffset.Field f) {
			var comp = this.builder.getGlobals().getCompInfo(f.getCompKey());
			if (comp.isEmpty()) {
				return unsupported(site, "field %s of unknown composite %d", f.getName(), f.getCompKey());
			} else if (!comp.get().hasFieldOffsets()) {
				return unsupported(site, "field %s of %s, which has no field offsets", f.getName(), comp.get());
			}
			var field = comp.get().getField(f.getName());
			if (field.isEmpty()) {
				return unsupported(site, "%s has no field %s", comp.get(), f.getName());
			}
			var fieldType = Optional.of(field.get().getType());
			return Nodes.fieldOffset(f.getName(), f.getCompKey(), lift(f.getRest(), fieldType, facts, site));
		} else if (offset instanceof XMemoryOffset.Index i) {
			var index = this.engine.liftExpr(i.getIndex(), facts, site, Optional.empty());
			return Nodes.indexOffset(index, lift(i.getRest(), elementType(hostType), facts, site));
		} else if (offset instanceof XMemoryOffset.IndexByVariable i) {
			var index = this.engine.liftExpr(XXpr.var(i.getVariable()), facts, site, Optional.empty());
			return Nodes.indexOffset(index, lift(i.getRest(), elementType(hostType), facts, site));
		} else if (offset instanceof XMemoryOffset.Constant c) {
			if (c.getValue() == 0) {
				return lift(c.getRest(), hostType, facts, site);
			} else if (hostType.isEmpty()) {
				return unsupported(site, "constant offset %d into a value of unknown type", c.getValue());
			}
			var inner = offsetInType(hostType.get(), c.getValue(), site);
			if (inner.isUnresolved() || c.getRest().isNone()) {
				return inner;
			}
			var innerType = this.builder.getTyper().typeOf(hostType.get(), inner);
			return Nodes.appendOffset(inner, lift(c.getRest(), innerType, facts, site));
		} else {
			return unsupported(site, "unknown memory offset");
		}
	}

	private Optional<Typ> elementType(Optional<Typ> hostType) {
		return hostType.map(t -> this.builder.getTyper().unroll(t))
			.filter(t -> t instanceof ArrayType)
			.map(t -> ((ArrayType) t).getElement());
	}

	/**
	 * Navigate a constant byte offset into a value of the given type.
	 */
	Offset offsetInType(Typ type, long offset, String site) {
		var typer = this.builder.getTyper();
		var comp = typer.compInfo(type);
		if (comp.isPresent()) {
			return fieldAtOffset(comp.get(), offset, site);
		}

		var unrolled = typer.unroll(type);
		if (unrolled instanceof ArrayType a) {
			var elemSize = this.builder.getSizes().sizeOf(a.getElement());
			if (elemSize.isEmpty() || elemSize.getAsInt() == 0) {
				return unsupported(site, "offset %d into an array of unsized elements", offset);
			}
			int size = elemSize.getAsInt();
			long index = Math.floorDiv(offset, size);
			long rest = Math.floorMod(offset, size);
			Offset sub = Nodes.noOffset();
			if (rest != 0) {
				var elemComp = typer.compInfo(a.getElement());
				if (elemComp.isEmpty()) {
					return unsupported(site, "offset %d into an element of %s", rest, a.getElement());
				}
				sub = fieldAtOffset(elemComp.get(), rest, site);
				if (sub.isUnresolved()) {
					return sub;
				}
			}
			return Nodes.indexOffset(Nodes.intConstant(index), sub);
		}

		return unsupported(site, "offset %d into non-composite type %s", offset, type);
	}

	/**
	 * Find the field at a byte offset of a composite.  A residual offset into
	 * that field is resolved one more level, through the field's own composite
	 * or array type; anything left over after that is unsupported.
	 */
	Offset fieldAtOffset(CompInfo comp, long offset, String site) {
		if (!comp.hasFieldOffsets()) {
			return unsupported(site, "%s has no field offsets", comp);
		}

		if (offset < 0 || offset > Integer.MAX_VALUE) {
			return unsupported(site, "no field of %s at offset %d", comp, offset);
		}
		var found = comp.fieldAt((int) offset);
		if (found.isEmpty()) {
			return unsupported(site, "no field of %s at offset %d", comp, offset);
		}

		var field = found.get().field();
		int rest = found.get().rest();
		if (rest == 0) {
			return Nodes.fieldOffset(field.getName(), comp.getKey(), Nodes.noOffset());
		}

		var typer = this.builder.getTyper();
		var inner = typer.compInfo(field.getType());
		Offset sub;
		if (inner.isPresent()) {
			sub = innerField(inner.get(), rest, site);
		} else if (typer.unroll(field.getType()) instanceof ArrayType a) {
			sub = innerIndex(a, rest, site);
		} else {
			sub = unsupported(site, "offset %d into scalar field %s.%s", rest, comp.getName(), field.getName());
		}

		if (sub.isUnresolved()) {
			return sub;
		}
		return Nodes.fieldOffset(field.getName(), comp.getKey(), sub);
	}

	private Offset innerField(CompInfo inner, int rest, String site) {
		if (!inner.hasFieldOffsets()) {
			return unsupported(site, "%s has no field offsets", inner);
		}

		var found = inner.fieldAt(rest);
		if (found.isEmpty()) {
			return unsupported(site, "no field of %s at offset %d", inner, rest);
		} else if (found.get().rest() != 0) {
			return unsupported(site, "residual offset %d into %s.%s", found.get().rest(), inner.getName(), found.get().field().getName());
		}
		return Nodes.fieldOffset(found.get().field().getName(), inner.getKey(), Nodes.noOffset());
	}

	private Offset innerIndex(ArrayType array, int rest, String site) {
		var elemSize = this.builder.getSizes().sizeOf(array.getElement());
		if (elemSize.isEmpty() || elemSize.getAsInt() == 0) {
			return unsupported(site, "offset %d into an array of unsized elements", rest);
		} else if (rest % elemSize.getAsInt() != 0) {
			return unsupported(site, "offset %d is not a multiple of element size %d", rest, elemSize.getAsInt());
		}
		return Nodes.indexOffset(Nodes.intConstant(rest / elemSize.getAsInt()), Nodes.noOffset());
	}
}
