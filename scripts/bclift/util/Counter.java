package bclift.util;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Concurrent counter/multiset with long counts.
 */
public final class Counter<T> {
	private final ConcurrentMap<T, LongAdder> map = new ConcurrentHashMap<>();

	/**
	 * @return The count for a key.
	 */
	public long get(T key) {
		LongAdder adder = this.map.get(key);
		if (adder == null) {
			return 0;
		} else {
			return adder.sum();
		}
	}

	/**
	 * Add to the count for a key.
	 */
	public void add(T key, long count) {
		this.map.computeIfAbsent(key, k -> new LongAdder())
			.add(count);
	}

	/**
	 * Increment the count for a key.
	 */
	public void increment(T key) {
		add(key, 1);
	}

	/**
	 * Increment the count for a key.
	 *
	 * @return The new count.
	 */
	public long incrementAndGet(T key) {
		var adder = this.map.computeIfAbsent(key, k -> new LongAdder());
		adder.increment();
		return adder.sum();
	}

	/**
	 * @return The keys we are counting.
	 */
	public Set<T> keySet() {
		return this.map.keySet();
	}

	/**
	 * @return A sorted snapshot of the current counts.
	 */
	public Map<T, Long> snapshot() {
		var result = new TreeMap<T, Long>();
		this.map.forEach((k, v) -> result.put(k, v.sum()));
		return result;
	}

	@Override
	public String toString() {
		return this.map.toString();
	}
}
