package bclift.type;

import bclift.ast.Typ;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A field of a struct or union definition.
 */
public final class FieldInfo {
	private final String name;
	private final Typ type;
	private final OptionalInt offset;
	private final OptionalInt size;

	public FieldInfo(String name, Typ type, OptionalInt offset, OptionalInt size) {
		this.name = name;
		this.type = type;
		this.offset = offset;
		this.size = size;
	}

	/**
	 * @return A field at a known byte offset, with a known byte size.
	 */
	public static FieldInfo at(String name, Typ type, int offset, int size) {
		return new FieldInfo(name, type, OptionalInt.of(offset), OptionalInt.of(size));
	}

	public String getName() {
		return this.name;
	}

	public Typ getType() {
		return this.type;
	}

	/**
	 * @return The byte offset of this field, if the layout is known.
	 */
	public OptionalInt getOffset() {
		return this.offset;
	}

	/**
	 * @return The byte size of this field, if known.
	 */
	public OptionalInt getSize() {
		return this.size;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FieldInfo)) {
			return false;
		}

		var other = (FieldInfo) obj;
		return this.name.equals(other.name)
			&& this.type.equals(other.type)
			&& this.offset.equals(other.offset)
			&& this.size.equals(other.size);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.name, this.type, this.offset, this.size);
	}

	@Override
	public String toString() {
		var str = new StringBuilder(this.name);
		this.offset.ifPresent(o -> str.append("@").append(o));
		return str.toString();
	}
}
