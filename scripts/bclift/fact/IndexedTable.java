package bclift.fact;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * An append-only, deduplicating table of interned records.
 *
 * Indices handed out by {@link #add} start at 1.  Reads are lock-free; writes
 * are serialized.
 */
public final class IndexedTable {
	private final String name;
	private final ConcurrentMap<Integer, FactRecord> byIndex = new ConcurrentHashMap<>();
	private final Map<Content, Integer> byContent = new HashMap<>();
	private int next = 1;

	private record Content(ImmutableList<String> tags, ImmutableList<Integer> args) {
	}

	public IndexedTable(String name) {
		this.name = name;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * Intern a record.
	 *
	 * @return The index of the existing record with this content, or else the
	 *         index of the newly added one.
	 */
	public synchronized int add(List<String> tags, List<Integer> args) {
		var content = new Content(ImmutableList.copyOf(tags), ImmutableList.copyOf(args));
		var existing = this.byContent.get(content);
		if (existing != null) {
			return existing;
		}

		while (this.byIndex.containsKey(this.next)) {
			++this.next;
		}
		int index = this.next++;
		this.byIndex.put(index, new FactRecord(index, content.tags(), content.args()));
		this.byContent.put(content, index);
		return index;
	}

	/**
	 * Add a record at an explicit index, as read from a persisted table.
	 *
	 * @throws IndexedTableException If a different record already has this index.
	 */
	public synchronized void load(int index, List<String> tags, List<Integer> args) {
		var record = new FactRecord(index, tags, args);
		var existing = this.byIndex.putIfAbsent(index, record);
		if (existing != null && !existing.sameContent(record)) {
			throw new IndexedTableException("%s: index %d already holds %s", this.name, index, existing);
		}
		this.byContent.putIfAbsent(new Content(record.getTags(), record.getArgs()), index);
	}

	/**
	 * @return The record with the given index.
	 * @throws IndexedTableException If there is no such record.
	 */
	public FactRecord retrieve(int index) {
		var record = this.byIndex.get(index);
		if (record == null) {
			throw new IndexedTableException("%s: no record with index %d (size %d)", this.name, index, this.byIndex.size());
		}
		return record;
	}

	public boolean contains(int index) {
		return this.byIndex.containsKey(index);
	}

	public int size() {
		return this.byIndex.size();
	}

	/**
	 * @return A snapshot of all the records, in index order.
	 */
	public List<FactRecord> values() {
		var values = new ArrayList<>(this.byIndex.values());
		values.sort(Comparator.comparingInt(FactRecord::getIndex));
		return values;
	}

	@Override
	public String toString() {
		return this.name + values();
	}
}
