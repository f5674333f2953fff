package bclift.value;

import java.util.List;
import java.util.Objects;

/**
 * Base class for symbolic values, with structural equality.
 */
abstract class AbstractValue {
	/**
	 * @return The structural parts of this value, in a fixed order.
	 */
	abstract List<?> components();

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj == null || obj.getClass() != getClass()) {
			return false;
		}

		var other = (AbstractValue) obj;
		return components().equals(other.components());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), components());
	}
}
