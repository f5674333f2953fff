package bclift.type;

import bclift.LiftConfig;
import bclift.ast.ArrayType;
import bclift.ast.CompType;
import bclift.ast.EnumType;
import bclift.ast.Expr;
import bclift.ast.FloatType;
import bclift.ast.IntType;
import bclift.ast.PtrType;
import bclift.ast.Typ;

import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Byte sizes of types on the target.
 */
public final class TypeSizes {
	private final TypeDefinitions defs;
	private final int pointerSize;

	public TypeSizes(TypeDefinitions defs) {
		this(defs, LiftConfig.POINTER_SIZE);
	}

	public TypeSizes(TypeDefinitions defs, int pointerSize) {
		this.defs = defs;
		this.pointerSize = pointerSize;
	}

	/**
	 * @return The size of a pointer in bytes.
	 */
	public int getPointerSize() {
		return this.pointerSize;
	}

	/**
	 * @return The size of the given type in bytes, if it is known.
	 */
	public OptionalInt sizeOf(Typ type) {
		type = this.defs.unroll(type);

		if (type instanceof IntType i) {
			return OptionalInt.of(i.getKind().getSize());
		} else if (type instanceof EnumType e) {
			return OptionalInt.of(e.getKind().getSize());
		} else if (type instanceof FloatType f) {
			return OptionalInt.of(f.getKind().getSize());
		} else if (type instanceof PtrType) {
			return OptionalInt.of(this.pointerSize);
		} else if (type instanceof ArrayType a) {
			var count = a.getSize()
				.map(Expr::constantValue)
				.orElse(OptionalLong.empty());
			var elem = sizeOf(a.getElement());
			if (count.isEmpty() || elem.isEmpty()) {
				return OptionalInt.empty();
			}
			return OptionalInt.of((int) (count.getAsLong() * elem.getAsInt()));
		} else if (type instanceof CompType c) {
			return this.defs.getCompInfo(c.getKey())
				.map(CompInfo::getByteSize)
				.orElse(OptionalInt.empty());
		} else {
			return OptionalInt.empty();
		}
	}
}
