package bclift.lift;

import bclift.ast.AddressOf;
import bclift.ast.ArrayType;
import bclift.ast.BinOp;
import bclift.ast.BinaryOp;
import bclift.ast.CastExpr;
import bclift.ast.CompType;
import bclift.ast.EnumType;
import bclift.ast.Expr;
import bclift.ast.FieldOffset;
import bclift.ast.FloatConstant;
import bclift.ast.GlobalAddressConstant;
import bclift.ast.IKind;
import bclift.ast.IndexOffset;
import bclift.ast.IntConstant;
import bclift.ast.IntType;
import bclift.ast.Lval;
import bclift.ast.LvalExpr;
import bclift.ast.MemRef;
import bclift.ast.Nodes;
import bclift.ast.NoOffset;
import bclift.ast.Offset;
import bclift.ast.PtrType;
import bclift.ast.Question;
import bclift.ast.SizeOf;
import bclift.ast.StringConstant;
import bclift.ast.Typ;
import bclift.ast.UnOp;
import bclift.ast.UnaryOp;
import bclift.ast.VarHost;
import bclift.type.CompInfo;
import bclift.type.FieldInfo;
import bclift.type.TypeDefinitions;

import java.util.Optional;

/**
 * Computes the static C types of lifted expressions and lvalues.
 */
public final class AstTyper {
	private final TypeDefinitions defs;

	public AstTyper(TypeDefinitions defs) {
		this.defs = defs;
	}

	/**
	 * @return The type with typedefs resolved.
	 */
	public Typ unroll(Typ type) {
		return this.defs.unroll(type);
	}

	/**
	 * @return The struct or union definition a type refers to, if any.
	 */
	public Optional<CompInfo> compInfo(Typ type) {
		if (unroll(type) instanceof CompType c) {
			return this.defs.getCompInfo(c.getKey());
		}
		return Optional.empty();
	}

	/**
	 * @return The type pointed to, if this is a pointer type.
	 */
	public Optional<Typ> pointee(Typ type) {
		if (unroll(type) instanceof PtrType p) {
			return Optional.of(p.getTarget());
		}
		return Optional.empty();
	}

	/**
	 * @return Whether values of this type are sign-extended when widened.
	 *         Unknown and non-integral types are zero-extended.
	 */
	public boolean isSigned(Optional<Typ> type) {
		var unrolled = type.map(this::unroll);
		if (unrolled.isPresent() && unrolled.get() instanceof IntType i) {
			return i.getKind().isSigned();
		} else if (unrolled.isPresent() && unrolled.get() instanceof EnumType e) {
			return e.getKind().isSigned();
		}
		return false;
	}

	public Optional<Typ> typeOf(Expr expr) {
		if (expr instanceof IntConstant c) {
			return Optional.of(Nodes.intType(c.getKind()));
		} else if (expr instanceof FloatConstant f) {
			return Optional.of(Nodes.floatType(f.getKind()));
		} else if (expr instanceof GlobalAddressConstant g) {
			return typeOf(g.getAddressExpr());
		} else if (expr instanceof StringConstant) {
			return Optional.of(Nodes.ptrType(Nodes.intType(IKind.CHAR)));
		} else if (expr instanceof LvalExpr l) {
			return typeOf(l.getLval());
		} else if (expr instanceof SizeOf) {
			return Optional.of(Nodes.intType(IKind.UINT));
		} else if (expr instanceof CastExpr c) {
			return Optional.of(c.getType());
		} else if (expr instanceof UnaryOp u) {
			if (u.getOp() == UnOp.LNOT) {
				return Optional.of(Nodes.intType(IKind.INT));
			}
			return typeOf(u.getOperand());
		} else if (expr instanceof BinaryOp b) {
			return typeOfBinary(b);
		} else if (expr instanceof Question q) {
			return typeOf(q.getThen()).or(() -> typeOf(q.getOtherwise()));
		} else if (expr instanceof AddressOf a) {
			return typeOf(a.getLval()).map(Nodes::ptrType);
		} else {
			return Optional.empty();
		}
	}

	private Optional<Typ> typeOfBinary(BinaryOp b) {
		var op = b.getOp();
		if (op.isComparison() || op == BinOp.LAND || op == BinOp.LOR) {
			return Optional.of(Nodes.intType(IKind.INT));
		}

		var left = typeOf(b.getLeft());
		var right = typeOf(b.getRight());
		boolean leftPtr = left.map(t -> unroll(t).isPointer()).orElse(false);
		boolean rightPtr = right.map(t -> unroll(t).isPointer()).orElse(false);
		if (op == BinOp.MINUS && leftPtr && rightPtr) {
			return Optional.of(Nodes.intType(IKind.INT));
		} else if ((op == BinOp.PLUS || op == BinOp.MINUS) && leftPtr) {
			return left;
		} else if (op == BinOp.PLUS && rightPtr) {
			return right;
		}
		return left.or(() -> right);
	}

	public Optional<Typ> typeOf(Lval lval) {
		Optional<Typ> hostType;
		if (lval.getHost() instanceof VarHost v) {
			hostType = v.getVarInfo().getType();
		} else {
			var address = ((MemRef) lval.getHost()).getAddress();
			hostType = typeOf(address).flatMap(this::pointee);
		}
		return hostType.flatMap(t -> typeOf(t, lval.getOffset()));
	}

	/**
	 * @return The type reached by applying an offset to a value of a type.
	 */
	public Optional<Typ> typeOf(Typ type, Offset offset) {
		if (offset instanceof NoOffset) {
			return Optional.of(type);
		} else if (offset instanceof FieldOffset f) {
			return this.defs.getCompInfo(f.getCompKey())
				.flatMap(c -> c.getField(f.getName()))
				.map(FieldInfo::getType)
				.flatMap(t -> typeOf(t, f.getRest()));
		} else if (offset instanceof IndexOffset i) {
			var unrolled = unroll(type);
			Optional<Typ> elem = Optional.empty();
			if (unrolled instanceof ArrayType a) {
				elem = Optional.of(a.getElement());
			} else if (unrolled instanceof PtrType p) {
				elem = Optional.of(p.getTarget());
			}
			return elem.flatMap(t -> typeOf(t, i.getRest()));
		} else {
			return Optional.empty();
		}
	}
}
