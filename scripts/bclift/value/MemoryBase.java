package bclift.value;

import java.util.List;
import java.util.Objects;

/**
 * What a memory variable's offset is relative to.
 */
public interface MemoryBase {
	/**
	 * The bases that carry no data, by name.
	 */
	enum Frame implements MemoryBase {
		/** The function's own stack frame. */
		LOCAL_STACK("stack"),
		/** A stack frame realigned after entry. */
		REALIGNED_STACK("realigned"),
		/** A dynamically allocated stack area. */
		ALLOCATED_STACK("alloca"),
		/** The global address space. */
		GLOBAL("global");

		private final String name;

		Frame(String name) {
			this.name = name;
		}

		@Override
		public String toString() {
			return this.name;
		}
	}

	/** Memory pointed to by the value of a variable. */
	final class BaseVariable extends AbstractValue implements MemoryBase {
		private final XVariable variable;

		public BaseVariable(XVariable variable) {
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
			return "*" + this.variable;
		}
	}

	final class Unknown extends AbstractValue implements MemoryBase {
		private final String description;

		public Unknown(String description) {
			this.description = Objects.requireNonNull(description);
		}

		public String getDescription() {
			return this.description;
		}

		@Override
		List<?> components() {
			return List.of(this.description);
		}

		@Override
		public String toString() {
			return "?" + this.description;
		}
	}
}
