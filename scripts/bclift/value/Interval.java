package bclift.value;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A range of integer values, possibly unbounded on either side.
 */
public final class Interval extends AbstractValue {
	private final OptionalLong low;
	private final OptionalLong high;

	public Interval(OptionalLong low, OptionalLong high) {
		this.low = Objects.requireNonNull(low);
		this.high = Objects.requireNonNull(high);
	}

	/**
	 * @return The interval containing only the given value.
	 */
	public static Interval singleton(long value) {
		return new Interval(OptionalLong.of(value), OptionalLong.of(value));
	}

	/**
	 * @return The interval of all values.
	 */
	public static Interval top() {
		return new Interval(OptionalLong.empty(), OptionalLong.empty());
	}

	public OptionalLong getLow() {
		return this.low;
	}

	public OptionalLong getHigh() {
		return this.high;
	}

	public boolean isSingleton() {
		return this.low.isPresent() && this.high.isPresent() && this.low.getAsLong() == this.high.getAsLong();
	}

	public boolean isBounded() {
		return this.low.isPresent() && this.high.isPresent();
	}

	public boolean contains(long value) {
		return (this.low.isEmpty() || this.low.getAsLong() <= value)
			&& (this.high.isEmpty() || value <= this.high.getAsLong());
	}

	@Override
	List<?> components() {
		return List.of(this.low, this.high);
	}

	@Override
	public String toString() {
		var lo = this.low.isPresent() ? Long.toString(this.low.getAsLong()) : "-oo";
		var hi = this.high.isPresent() ? Long.toString(this.high.getAsLong()) : "oo";
		return "[" + lo + "; " + hi + "]";
	}
}
