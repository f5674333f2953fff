package bclift.ast;

import bclift.LiftContractException;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Symbol table entry for a variable.
 *
 * Var-infos are compared by identity: a symbol table mints at most one per
 * name.
 */
public final class VarInfo implements AstNode {
	private final int id;
	private final String name;
	private final AtomicReference<Typ> type;
	private final OptionalInt parameter;
	private final OptionalLong globalAddress;
	private final Optional<String> description;
	private final boolean placeholder;

	private VarInfo(Builder builder) {
		this.id = NodeIds.next();
		this.name = builder.name;
		this.type = new AtomicReference<>(builder.type);
		this.parameter = builder.parameter;
		this.globalAddress = builder.globalAddress;
		this.description = builder.description;
		this.placeholder = builder.placeholder;
	}

	/**
	 * @return A builder for a var-info with the given name.
	 */
	public static Builder builder(String name) {
		return new Builder(name);
	}

	@Override
	public int getId() {
		return this.id;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The type of this variable, if known.
	 */
	public Optional<Typ> getType() {
		return Optional.ofNullable(this.type.get());
	}

	/**
	 * Set the type of an untyped variable.  This can happen at most once.
	 *
	 * @throws LiftContractException If the type is already known.
	 */
	public void refineType(Typ newType) {
		if (!this.type.compareAndSet(null, newType)) {
			throw new LiftContractException("Variable %s already has type %s", this.name, this.type.get());
		}
	}

	/**
	 * @return The index of the formal parameter this variable names, if any.
	 */
	public OptionalInt getParameter() {
		return this.parameter;
	}

	/**
	 * @return The address of this global variable, if it is one.
	 */
	public OptionalLong getGlobalAddress() {
		return this.globalAddress;
	}

	public Optional<String> getDescription() {
		return this.description;
	}

	/**
	 * @return Whether this variable stands for something that could not be resolved.
	 */
	public boolean isPlaceholder() {
		return this.placeholder;
	}

	public boolean isGlobal() {
		return this.globalAddress.isPresent();
	}

	@Override
	public String toString() {
		return this.name;
	}

	/**
	 * Builder for {@link VarInfo}.
	 */
	public static final class Builder {
		private final String name;
		private Typ type;
		private OptionalInt parameter = OptionalInt.empty();
		private OptionalLong globalAddress = OptionalLong.empty();
		private Optional<String> description = Optional.empty();
		private boolean placeholder;

		private Builder(String name) {
			this.name = name;
		}

		public Builder type(Typ type) {
			this.type = type;
			return this;
		}

		public Builder parameter(int index) {
			this.parameter = OptionalInt.of(index);
			return this;
		}

		public Builder globalAddress(long address) {
			this.globalAddress = OptionalLong.of(address);
			return this;
		}

		public Builder description(String description) {
			this.description = Optional.of(description);
			return this;
		}

		public Builder placeholder() {
			this.placeholder = true;
			return this;
		}

		public VarInfo build() {
			return new VarInfo(this);
		}
	}
}
