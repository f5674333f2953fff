package bclift.value;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A structured offset from a memory base.
 */
public interface XMemoryOffset {
	final class None extends AbstractValue implements XMemoryOffset {
		private static final None INSTANCE = new None();

		private None() {
		}

		@Override
		List<?> components() {
			return List.of();
		}

		@Override
		public String toString() {
			return "";
		}
	}

	/** A constant byte offset, followed by more offsets. */
	final class Constant extends AbstractValue implements XMemoryOffset {
		private final long value;
		private final XMemoryOffset rest;

		public Constant(long value, XMemoryOffset rest) {
			this.value = value;
			this.rest = Objects.requireNonNull(rest);
		}

		public long getValue() {
			return this.value;
		}

		public XMemoryOffset getRest() {
			return this.rest;
		}

		@Override
		List<?> components() {
			return List.of(this.value, this.rest);
		}

		@Override
		public String toString() {
			return (this.value < 0 ? "-" : "+") + Math.abs(this.value) + this.rest;
		}
	}

	/** A field of the composite with the given key. */
	final class Field extends AbstractValue implements XMemoryOffset {
		private final String name;
		private final int compKey;
		private final XMemoryOffset rest;

		public Field(String name, int compKey, XMemoryOffset rest) {
			this.name = Objects.requireNonNull(name);
			this.compKey = compKey;
			this.rest = Objects.requireNonNull(rest);
		}

		public String getName() {
			return this.name;
		}

		/**
		 * @return The key of the composite that declares the field.
		 */
		public int getCompKey() {
			return this.compKey;
		}

		public XMemoryOffset getRest() {
			return this.rest;
		}

		@Override
		List<?> components() {
			return List.of(this.name, this.compKey, this.rest);
		}

		@Override
		public String toString() {
			return "." + this.name + this.rest;
		}
	}

	/** An array element selected by an expression. */
	final class Index extends AbstractValue implements XMemoryOffset {
		private final XXpr index;
		private final XMemoryOffset rest;

		public Index(XXpr index, XMemoryOffset rest) {
			this.index = Objects.requireNonNull(index);
			this.rest = Objects.requireNonNull(rest);
		}

		public XXpr getIndex() {
			return this.index;
		}

		public XMemoryOffset getRest() {
			return this.rest;
		}

		@Override
		List<?> components() {
			return List.of(this.index, this.rest);
		}

		@Override
		public String toString() {
			return "[" + this.index + "]" + this.rest;
		}
	}

	/** An element of the given byte size, selected by a variable. */
	final class IndexByVariable extends AbstractValue implements XMemoryOffset {
		private final XVariable variable;
		private final int elementSize;
		private final XMemoryOffset rest;

		public IndexByVariable(XVariable variable, int elementSize, XMemoryOffset rest) {
			this.variable = Objects.requireNonNull(variable);
			this.elementSize = elementSize;
			this.rest = Objects.requireNonNull(rest);
		}

		public XVariable getVariable() {
			return this.variable;
		}

		public int getElementSize() {
			return this.elementSize;
		}

		public XMemoryOffset getRest() {
			return this.rest;
		}

		@Override
		List<?> components() {
			return List.of(this.variable, this.elementSize, this.rest);
		}

		@Override
		public String toString() {
			return "[" + this.variable + "*" + this.elementSize + "]" + this.rest;
		}
	}

	final class Unknown extends AbstractValue implements XMemoryOffset {
		@Override
		List<?> components() {
			return List.of();
		}

		@Override
		public String toString() {
			return "[?]";
		}
	}

	/**
	 * @return The shared empty offset.
	 */
	static XMemoryOffset none() {
		return None.INSTANCE;
	}

	default boolean isNone() {
		return this instanceof None;
	}

	/**
	 * @return The byte offset, if this is a constant with nothing after it.
	 */
	default OptionalLong constantValue() {
		if (this instanceof Constant c && c.getRest().isNone()) {
			return OptionalLong.of(c.getValue());
		} else if (this instanceof None) {
			return OptionalLong.of(0);
		} else {
			return OptionalLong.empty();
		}
	}
}
