package bclift.fact;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * An interned {@code (tags, args)} record, identified by its index in an
 * {@link IndexedTable}.
 */
public final class FactRecord {
	private final int index;
	private final ImmutableList<String> tags;
	private final ImmutableList<Integer> args;

	public FactRecord(int index, List<String> tags, List<Integer> args) {
		this.index = index;
		this.tags = ImmutableList.copyOf(tags);
		this.args = ImmutableList.copyOf(args);
	}

	/**
	 * @return The index of this record in its table.
	 */
	public int getIndex() {
		return this.index;
	}

	public ImmutableList<String> getTags() {
		return this.tags;
	}

	public ImmutableList<Integer> getArgs() {
		return this.args;
	}

	/**
	 * @return The first tag, which selects the record's variant.
	 * @throws FactDecodeException If the record has no tags.
	 */
	public String getKey() {
		return getTag(0);
	}

	/**
	 * @return The tag at the given position.
	 * @throws FactDecodeException If there is no such tag.
	 */
	public String getTag(int i) {
		if (i >= this.tags.size()) {
			throw new FactDecodeException(this.index, "Missing tag %d in %s", i, this);
		}
		return this.tags.get(i);
	}

	/**
	 * @return The argument at the given position.
	 * @throws FactDecodeException If there is no such argument.
	 */
	public int getArg(int i) {
		if (i >= this.args.size()) {
			throw new FactDecodeException(this.index, "Missing argument %d in %s", i, this);
		}
		return this.args.get(i);
	}

	/**
	 * @return Whether this record has the same tags and arguments as another.
	 */
	public boolean sameContent(FactRecord other) {
		return this.tags.equals(other.tags) && this.args.equals(other.args);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FactRecord)) {
			return false;
		}

		var other = (FactRecord) obj;
		return this.index == other.index && sameContent(other);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.index, this.tags, this.args);
	}

	@Override
	public String toString() {
		return String.format("#%d %s %s", this.index, this.tags, this.args);
	}
}
