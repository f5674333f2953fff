package bclift.value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A symbolic variable: a storage location, or a placeholder for a value that
 * has no location of its own.
 *
 * The sequence number is the variable's index in its function dictionary and
 * identifies it across facts.
 */
public interface XVariable {
	/**
	 * @return The sequence number of this variable.
	 */
	int getSeq();

	/**
	 * @return Whether this variable and another denote the same dictionary entry.
	 */
	default boolean sameAs(XVariable other) {
		return getSeq() == other.getSeq();
	}

	/**
	 * @return Whether this variable stands for a value rather than a location.
	 */
	default boolean isPlaceholder() {
		return this instanceof InitialRegisterValue
			|| this instanceof InitialMemoryValue
			|| this instanceof ReturnValue
			|| this instanceof SymbolicValue;
	}

	final class Register extends AbstractValue implements XVariable {
		private final int seq;
		private final String register;

		public Register(int seq, String register) {
			this.seq = seq;
			this.register = Objects.requireNonNull(register);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		public String getRegister() {
			return this.register;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.register);
		}

		@Override
		public String toString() {
			return this.register;
		}
	}

	/** A processor status flag. */
	final class Flag extends AbstractValue implements XVariable {
		private final int seq;
		private final String flag;

		public Flag(int seq, String flag) {
			this.seq = seq;
			this.flag = Objects.requireNonNull(flag);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		public String getFlag() {
			return this.flag;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.flag);
		}

		@Override
		public String toString() {
			return this.flag;
		}
	}

	final class Temporary extends AbstractValue implements XVariable {
		private final int seq;

		public Temporary(int seq) {
			this.seq = seq;
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		@Override
		List<?> components() {
			return List.of(this.seq);
		}

		@Override
		public String toString() {
			return "tmp_" + this.seq;
		}
	}

	/** A slot at a constant offset from the frame base. */
	final class LocalStack extends AbstractValue implements XVariable {
		private final int seq;
		private final long offset;
		private final XMemoryOffset rest;

		public LocalStack(int seq, long offset, XMemoryOffset rest) {
			this.seq = seq;
			this.offset = offset;
			this.rest = Objects.requireNonNull(rest);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		/**
		 * @return The byte offset from the frame base.
		 */
		public long getOffset() {
			return this.offset;
		}

		/**
		 * @return The offset into the slot.
		 */
		public XMemoryOffset getRest() {
			return this.rest;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.offset, this.rest);
		}

		@Override
		public String toString() {
			return "stack[" + this.offset + "]" + this.rest;
		}
	}

	/** A global at an absolute address, with an offset into it. */
	final class Global extends AbstractValue implements XVariable {
		private final int seq;
		private final long address;
		private final XMemoryOffset rest;

		public Global(int seq, long address, XMemoryOffset rest) {
			this.seq = seq;
			this.address = address;
			this.rest = Objects.requireNonNull(rest);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		public long getAddress() {
			return this.address;
		}

		public XMemoryOffset getRest() {
			return this.rest;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.address, this.rest);
		}

		@Override
		public String toString() {
			return "gv_" + IntArith.toHex(this.address, 64) + this.rest;
		}
	}

	/** Memory through the value of a base variable. */
	final class BaseMemory extends AbstractValue implements XVariable {
		private final int seq;
		private final XVariable base;
		private final XMemoryOffset offset;

		public BaseMemory(int seq, XVariable base, XMemoryOffset offset) {
			this.seq = seq;
			this.base = Objects.requireNonNull(base);
			this.offset = Objects.requireNonNull(offset);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		/**
		 * @return The variable holding the base pointer.
		 */
		public XVariable getBase() {
			return this.base;
		}

		public XMemoryOffset getOffset() {
			return this.offset;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.base, this.offset);
		}

		@Override
		public String toString() {
			return "(" + this.base + ")" + this.offset;
		}
	}

	/** Memory relative to a base with no direct source form. */
	final class Memory extends AbstractValue implements XVariable {
		private final int seq;
		private final MemoryBase base;
		private final XMemoryOffset offset;

		public Memory(int seq, MemoryBase base, XMemoryOffset offset) {
			this.seq = seq;
			this.base = Objects.requireNonNull(base);
			this.offset = Objects.requireNonNull(offset);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		public MemoryBase getBase() {
			return this.base;
		}

		public XMemoryOffset getOffset() {
			return this.offset;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.base, this.offset);
		}

		@Override
		public String toString() {
			return this.base + "" + this.offset;
		}
	}

	/** The value of a register at function entry. */
	final class InitialRegisterValue extends AbstractValue implements XVariable {
		private final int seq;
		private final String register;

		public InitialRegisterValue(int seq, String register) {
			this.seq = seq;
			this.register = Objects.requireNonNull(register);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		public String getRegister() {
			return this.register;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.register);
		}

		@Override
		public String toString() {
			return this.register + "_in";
		}
	}

	/** The value of a memory location at function entry. */
	final class InitialMemoryValue extends AbstractValue implements XVariable {
		private final int seq;
		private final XVariable variable;

		public InitialMemoryValue(int seq, XVariable variable) {
			this.seq = seq;
			this.variable = Objects.requireNonNull(variable);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		/**
		 * @return The location whose entry value this is.
		 */
		public XVariable getVariable() {
			return this.variable;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.variable);
		}

		@Override
		public String toString() {
			return this.variable + "_in";
		}
	}

	/** The value returned by the call at a call site. */
	final class ReturnValue extends AbstractValue implements XVariable {
		private final int seq;
		private final String callSite;
		private final Optional<String> callee;

		public ReturnValue(int seq, String callSite, Optional<String> callee) {
			this.seq = seq;
			this.callSite = Objects.requireNonNull(callSite);
			this.callee = Objects.requireNonNull(callee);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		/**
		 * @return The address of the call.
		 */
		public String getCallSite() {
			return this.callSite;
		}

		public Optional<String> getCallee() {
			return this.callee;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.callSite, this.callee);
		}

		@Override
		public String toString() {
			return "rtn_" + this.callee.orElse(this.callSite);
		}
	}

	/** A named value defined by an expression. */
	final class SymbolicValue extends AbstractValue implements XVariable {
		private final int seq;
		private final String name;
		private final XXpr xpr;

		public SymbolicValue(int seq, String name, XXpr xpr) {
			this.seq = seq;
			this.name = Objects.requireNonNull(name);
			this.xpr = Objects.requireNonNull(xpr);
		}

		@Override
		public int getSeq() {
			return this.seq;
		}

		public String getName() {
			return this.name;
		}

		public XXpr getXpr() {
			return this.xpr;
		}

		@Override
		List<?> components() {
			return List.of(this.seq, this.name, this.xpr);
		}

		@Override
		public String toString() {
			return "sv__" + this.name;
		}
	}
}
