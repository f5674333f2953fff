package bclift.value;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * A symbolic expression.
 */
public interface XXpr {
	/**
	 * An integer constant.  The value is kept as the signed interpretation of
	 * its low {@code width} bits.
	 */
	final class Constant extends AbstractValue implements XXpr {
		private final long value;
		private final int width;
		private final boolean globalAddress;

		public Constant(long value, int width, boolean globalAddress) {
			this.value = IntArith.wrap(value, width);
			this.width = width;
			this.globalAddress = globalAddress;
		}

		public long getValue() {
			return this.value;
		}

		/**
		 * @return The value of the low {@code width} bits, zero-extended.
		 */
		public long getUnsignedValue() {
			return IntArith.zeroExtend(this.value, this.width);
		}

		/**
		 * @return The bit width of this constant.
		 */
		public int getWidth() {
			return this.width;
		}

		/**
		 * @return Whether the analysis recognized this constant as a global address.
		 */
		public boolean isGlobalAddress() {
			return this.globalAddress;
		}

		@Override
		List<?> components() {
			return List.of(this.value, this.width, this.globalAddress);
		}

		@Override
		public String toString() {
			if (this.globalAddress || Math.abs(this.value) >= 0x1000) {
				return IntArith.toHex(this.value, this.width);
			}
			return Long.toString(this.value);
		}
	}

	final class Var extends AbstractValue implements XXpr {
		private final XVariable variable;

		public Var(XVariable variable) {
			this.variable = Objects.requireNonNull(variable);
		}

		public XVariable getVariable() {
			return this.variable;
		}

		@Override
		List<?> components() {
			return List.of(this.variable);
		}

		@Override
		public String toString() {
			return this.variable.toString();
		}
	}

	/**
	 * An operator applied to operands.  The operator is kept by name, so that
	 * unknown operators survive decoding.
	 */
	final class Compound extends AbstractValue implements XXpr {
		private final String operatorName;
		private final ImmutableList<XXpr> operands;

		public Compound(String operatorName, List<XXpr> operands) {
			this.operatorName = Objects.requireNonNull(operatorName);
			this.operands = ImmutableList.copyOf(operands);
		}

		public String getOperatorName() {
			return this.operatorName;
		}

		/**
		 * @return The operator, if it is a known one.
		 */
		public Optional<XOperator> getOperator() {
			return XOperator.lookup(this.operatorName);
		}

		public ImmutableList<XXpr> getOperands() {
			return this.operands;
		}

		public XXpr getOperand(int i) {
			return this.operands.get(i);
		}

		@Override
		List<?> components() {
			return List.of(this.operatorName, this.operands);
		}

		@Override
		public String toString() {
			var op = getOperator();
			if (op.isPresent() && op.get().getArity() == 2 && this.operands.size() == 2 && op.get() != XOperator.XBYTE) {
				return "(" + getOperand(0) + " " + op.get().getSymbol() + " " + getOperand(1) + ")";
			}

			var name = op.map(XOperator::getSymbol).orElse(this.operatorName);
			return this.operands
				.stream()
				.map(XXpr::toString)
				.collect(Collectors.joining(", ", name + "(", ")"));
		}
	}

	/**
	 * @return A 32-bit constant.
	 */
	static Constant constant(long value) {
		return new Constant(value, IntArith.DEFAULT_WIDTH, false);
	}

	static Var var(XVariable variable) {
		return new Var(variable);
	}

	static Compound compound(XOperator op, XXpr... operands) {
		return new Compound(op.getName(), Arrays.asList(operands));
	}

	/**
	 * @return The value of this expression, if it is constant.
	 */
	default OptionalLong evaluate() {
		return ConstantFolder.evaluate(this);
	}

	/**
	 * @return A simplified copy of this expression.
	 */
	default XXpr simplify() {
		return ConstantFolder.simplify(this);
	}

	default boolean isConstant() {
		return this instanceof Constant;
	}

	/**
	 * @return Whether this expression refers to the given variable.
	 */
	default boolean mentions(XVariable variable) {
		if (this instanceof Var v) {
			return v.getVariable().sameAs(variable);
		} else if (this instanceof Compound c) {
			return c.getOperands().stream().anyMatch(o -> o.mentions(variable));
		} else {
			return false;
		}
	}
}
