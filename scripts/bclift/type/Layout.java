package bclift.type;

import bclift.LiftContractException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Field layout of a struct or union, validated when the definition is registered.
 */
public final class Layout {
	private final ImmutableList<FieldInfo> fields;
	private final ImmutableMap<String, FieldInfo> byName;
	private final ImmutableSortedMap<Integer, FieldInfo> byOffset;
	private final boolean complete;

	private Layout(List<FieldInfo> fields) {
		this.fields = ImmutableList.copyOf(fields);

		Map<String, FieldInfo> byName = new HashMap<>();
		TreeMap<Integer, FieldInfo> byOffset = new TreeMap<>();
		boolean complete = true;
		for (var field : fields) {
			if (byName.putIfAbsent(field.getName(), field) != null) {
				throw new LiftContractException("Duplicate field %s", field.getName());
			}

			var offset = field.getOffset();
			if (offset.isEmpty()) {
				complete = false;
			} else if (offset.getAsInt() < 0) {
				throw new LiftContractException("Field %s has negative offset %d", field.getName(), offset.getAsInt());
			} else {
				// Union members share offset 0; the first one represents the offset
				byOffset.putIfAbsent(offset.getAsInt(), field);
			}
		}

		this.byName = ImmutableMap.copyOf(byName);
		this.byOffset = ImmutableSortedMap.copyOf(byOffset);
		this.complete = complete;
	}

	/**
	 * @return A validated layout for the given fields.
	 * @throws LiftContractException If two fields share a name, or an offset is negative.
	 */
	public static Layout of(List<FieldInfo> fields) {
		return new Layout(fields);
	}

	/**
	 * @return The fields, in declaration order.
	 */
	public ImmutableList<FieldInfo> getFields() {
		return this.fields;
	}

	/**
	 * @return Whether every field has a known offset.
	 */
	public boolean hasFieldOffsets() {
		return this.complete;
	}

	/**
	 * @return The field with the given name.
	 */
	public Optional<FieldInfo> getField(String name) {
		return Optional.ofNullable(this.byName.get(name));
	}

	/**
	 * Find the field that contains a byte offset.
	 *
	 * @return The field and the residual offset into it, or empty if the offset
	 *         falls before the first field, past a sized field's end, or the layout
	 *         is incomplete.
	 */
	public Optional<FieldAt> fieldAt(int offset) {
		if (!this.complete) {
			return Optional.empty();
		}

		var entry = this.byOffset.floorEntry(offset);
		if (entry == null) {
			return Optional.empty();
		}

		var field = entry.getValue();
		int rest = offset - entry.getKey();
		var size = field.getSize();
		if (size.isPresent() && rest >= size.getAsInt() && rest > 0) {
			return Optional.empty();
		}

		return Optional.of(new FieldAt(field, rest));
	}

	/**
	 * @return The byte size of this layout, if every field's extent is known.
	 */
	public OptionalInt getByteSize() {
		int end = 0;
		for (var field : this.fields) {
			if (field.getOffset().isEmpty() || field.getSize().isEmpty()) {
				return OptionalInt.empty();
			}
			end = Math.max(end, field.getOffset().getAsInt() + field.getSize().getAsInt());
		}
		return OptionalInt.of(end);
	}

	/**
	 * A field located by offset.
	 *
	 * @param field The field containing the offset.
	 * @param rest The offset relative to the start of the field.
	 */
	public record FieldAt(FieldInfo field, int rest) {
	}
}
