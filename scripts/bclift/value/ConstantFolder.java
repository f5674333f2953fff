package bclift.value;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Evaluation and simplification of symbolic expressions.
 *
 * Each compound is computed at the widest constant width found beneath it,
 * so that folding a tree bottom-up agrees with evaluating it whole.
 */
public final class ConstantFolder {
	private ConstantFolder() {
	}

	/**
	 * @return The bit width at which an expression is computed.
	 */
	public static int widthOf(XXpr xpr) {
		if (xpr instanceof XXpr.Constant c) {
			return c.getWidth();
		} else if (xpr instanceof XXpr.Compound c) {
			return c.getOperands()
				.stream()
				.mapToInt(ConstantFolder::widthOf)
				.max()
				.orElse(IntArith.DEFAULT_WIDTH);
		} else {
			return IntArith.DEFAULT_WIDTH;
		}
	}

	/**
	 * Evaluate a constant-only expression directly.
	 *
	 * @return The value, or empty for variable leaves, division by zero, and
	 *         unknown operators.
	 */
	public static OptionalLong evaluate(XXpr xpr) {
		if (xpr instanceof XXpr.Constant c) {
			return OptionalLong.of(c.getValue());
		} else if (xpr instanceof XXpr.Var) {
			return OptionalLong.empty();
		}

		var compound = (XXpr.Compound) xpr;
		var op = compound.getOperator();
		if (op.isEmpty() || op.get().getArity() != compound.getOperands().size()) {
			return OptionalLong.empty();
		}

		int width = widthOf(xpr);
		long[] values = new long[compound.getOperands().size()];
		for (int i = 0; i < values.length; ++i) {
			var operand = compound.getOperand(i);
			var value = evaluate(operand);
			if (value.isEmpty()) {
				return OptionalLong.empty();
			}
			values[i] = widenTo(value.getAsLong(), widthOf(operand), width);
		}

		return apply(op.get(), values, width);
	}

	/**
	 * Widen an operand to the width of its compound.  With no static type to
	 * say otherwise, narrower operands are zero-extended.
	 */
	static long widenTo(long value, int fromWidth, int toWidth) {
		if (fromWidth < toWidth) {
			return IntArith.zeroExtend(value, fromWidth);
		}
		return value;
	}

	/**
	 * Apply an operator to constant operands.
	 */
	static OptionalLong apply(XOperator op, long[] v, int width) {
		switch (op) {
			case PLUS:
				return OptionalLong.of(IntArith.add(v[0], v[1], width));
			case MINUS:
				return OptionalLong.of(IntArith.sub(v[0], v[1], width));
			case MULT:
				return OptionalLong.of(IntArith.mul(v[0], v[1], width));
			case DIV:
				if (IntArith.wrap(v[1], width) == 0) {
					return OptionalLong.empty();
				}
				return OptionalLong.of(IntArith.div(v[0], v[1], width));
			case MOD:
				if (IntArith.wrap(v[1], width) == 0) {
					return OptionalLong.empty();
				}
				return OptionalLong.of(IntArith.mod(v[0], v[1], width));
			case BAND:
				return OptionalLong.of(IntArith.wrap(v[0] & v[1], width));
			case BOR:
				return OptionalLong.of(IntArith.wrap(v[0] | v[1], width));
			case BXOR:
				return OptionalLong.of(IntArith.wrap(v[0] ^ v[1], width));
			case LSL:
				return OptionalLong.of(IntArith.shiftLeft(v[0], v[1], width));
			case LSR:
				return OptionalLong.of(IntArith.shiftRightLogical(v[0], v[1], width));
			case ASR:
				return OptionalLong.of(IntArith.shiftRightArithmetic(v[0], v[1], width));
			case LAND:
				return truth(IntArith.wrap(v[0], width) != 0 && IntArith.wrap(v[1], width) != 0);
			case LOR:
				return truth(IntArith.wrap(v[0], width) != 0 || IntArith.wrap(v[1], width) != 0);
			case EQ:
				return truth(IntArith.wrap(v[0], width) == IntArith.wrap(v[1], width));
			case NE:
				return truth(IntArith.wrap(v[0], width) != IntArith.wrap(v[1], width));
			case LT:
				return truth(IntArith.wrap(v[0], width) < IntArith.wrap(v[1], width));
			case LE:
				return truth(IntArith.wrap(v[0], width) <= IntArith.wrap(v[1], width));
			case GT:
				return truth(IntArith.wrap(v[0], width) > IntArith.wrap(v[1], width));
			case GE:
				return truth(IntArith.wrap(v[0], width) >= IntArith.wrap(v[1], width));
			case XBYTE:
				return OptionalLong.of(extractByte(v[0], v[1], width));
			case NEG:
				return OptionalLong.of(IntArith.wrap(-v[0], width));
			case BNOT:
				return OptionalLong.of(IntArith.wrap(~v[0], width));
			case LNOT:
				return truth(IntArith.wrap(v[0], width) == 0);
			case LSB:
				return OptionalLong.of(IntArith.wrap(v[0] & 0xff, width));
			case LSH:
				return OptionalLong.of(IntArith.wrap(v[0] & 0xff00, width));
			default:
				return OptionalLong.empty();
		}
	}

	private static OptionalLong truth(boolean b) {
		return OptionalLong.of(b ? 1 : 0);
	}

	/**
	 * @return Byte number {@code k} (little-endian) of {@code x}.
	 */
	private static long extractByte(long k, long x, int width) {
		long shift = 8 * k;
		if (k < 0 || shift >= width) {
			return 0;
		}
		return (IntArith.zeroExtend(x, width) >>> shift) & 0xff;
	}

	/**
	 * Simplify an expression without modifying it.
	 *
	 * Constant-only compounds fold to constants; {@code x + 0} and {@code x - 0}
	 * become {@code x}; and constant addends are reassociated, e.g.
	 * {@code (x + 4) + 8} becomes {@code x + 12}.
	 */
	public static XXpr simplify(XXpr xpr) {
		if (!(xpr instanceof XXpr.Compound)) {
			return xpr;
		}

		var compound = (XXpr.Compound) xpr;
		List<XXpr> operands = new ArrayList<>();
		for (var operand : compound.getOperands()) {
			operands.add(simplify(operand));
		}
		var simplified = new XXpr.Compound(compound.getOperatorName(), operands);

		var op = simplified.getOperator();
		if (op.isEmpty() || op.get().getArity() != operands.size()) {
			return simplified;
		}

		var value = evaluate(simplified);
		if (value.isPresent()) {
			return new XXpr.Constant(value.getAsLong(), widthOf(simplified), false);
		}

		if (op.get() == XOperator.PLUS || op.get() == XOperator.MINUS) {
			return simplifyAdditive(op.get(), operands.get(0), operands.get(1), widthOf(simplified));
		}
		return simplified;
	}

	/**
	 * Simplify {@code left op right} where op is plus or minus.
	 */
	private static XXpr simplifyAdditive(XOperator op, XXpr left, XXpr right, int width) {
		if (op == XOperator.PLUS && isZero(left)) {
			return right;
		}

		if (!(right instanceof XXpr.Constant)) {
			return XXpr.compound(op, left, right);
		}

		long addend = widenedValue((XXpr.Constant) right, width);
		if (op == XOperator.MINUS) {
			addend = -addend;
		}

		// Fold (x +/- c1) +/- c2 into x + (+/-c1 +/- c2)
		XXpr base = left;
		if (left instanceof XXpr.Compound inner && inner.getOperands().size() == 2
				&& inner.getOperand(1) instanceof XXpr.Constant c1) {
			var innerOp = inner.getOperator();
			if (innerOp.isPresent() && innerOp.get() == XOperator.PLUS) {
				base = inner.getOperand(0);
				addend += widenedValue(c1, width);
			} else if (innerOp.isPresent() && innerOp.get() == XOperator.MINUS) {
				base = inner.getOperand(0);
				addend -= widenedValue(c1, width);
			}
		}

		return offsetBy(base, IntArith.wrap(addend, width), width);
	}

	/**
	 * @return {@code base + addend}, written with minus for negative addends.
	 */
	private static XXpr offsetBy(XXpr base, long addend, int width) {
		if (addend == 0) {
			return base;
		} else if (addend < 0 && IntArith.wrap(-addend, width) > 0) {
			return XXpr.compound(XOperator.MINUS, base, new XXpr.Constant(-addend, width, false));
		} else {
			return XXpr.compound(XOperator.PLUS, base, new XXpr.Constant(addend, width, false));
		}
	}

	private static long widenedValue(XXpr.Constant c, int width) {
		return widenTo(c.getValue(), c.getWidth(), width);
	}

	private static boolean isZero(XXpr xpr) {
		return xpr instanceof XXpr.Constant c && c.getValue() == 0;
	}
}
