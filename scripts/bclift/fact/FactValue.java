package bclift.fact;

import bclift.LiftContractException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A decoded fact field: present, missing (not requested), or marked as an
 * error by the upstream analysis.
 */
public final class FactValue<T> {
	private static final FactValue<?> MISSING = new FactValue<>(null, false);
	private static final FactValue<?> ERROR = new FactValue<>(null, true);

	private final T value;
	private final boolean error;

	private FactValue(T value, boolean error) {
		this.value = value;
		this.error = error;
	}

	/**
	 * @return A present fact wrapping the given value.
	 */
	public static <U> FactValue<U> of(U value) {
		return new FactValue<>(Objects.requireNonNull(value), false);
	}

	/**
	 * @return The fact for a field that was not requested.
	 */
	@SuppressWarnings("unchecked")
	public static <U> FactValue<U> missing() {
		return (FactValue<U>) MISSING;
	}

	/**
	 * @return The fact for a field the upstream analysis could not compute.
	 */
	@SuppressWarnings("unchecked")
	public static <U> FactValue<U> error() {
		return (FactValue<U>) ERROR;
	}

	public boolean isPresent() {
		return this.value != null;
	}

	public boolean isMissing() {
		return this.value == null && !this.error;
	}

	public boolean isError() {
		return this.error;
	}

	/**
	 * @return The wrapped value.
	 * @throws LiftContractException If this fact is missing or an error.
	 */
	public T get() {
		if (this.value == null) {
			throw new LiftContractException("Read of %s fact", isError() ? "error-valued" : "missing");
		}
		return this.value;
	}

	/**
	 * @return The wrapped value, if present.
	 */
	public Optional<T> toOptional() {
		return Optional.ofNullable(this.value);
	}

	/**
	 * @return This fact with its value (if any) transformed.
	 */
	public <U> FactValue<U> map(Function<? super T, ? extends U> func) {
		if (this.value == null) {
			return isError() ? error() : missing();
		}
		return of(func.apply(this.value));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof FactValue)) {
			return false;
		}

		FactValue<?> other = (FactValue<?>) obj;
		return Objects.equals(this.value, other.value)
			&& this.error == other.error;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.value, this.error);
	}

	@Override
	public String toString() {
		if (isMissing()) {
			return "missing";
		} else if (isError()) {
			return "error";
		} else {
			return "{" + this.value + "}";
		}
	}
}
