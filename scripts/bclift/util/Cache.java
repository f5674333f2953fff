package bclift.util;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * A concurrent memo table for decoders.
 *
 * Unlike {@link ConcurrentMap#computeIfAbsent}, the function may itself look
 * up other keys of the same cache, as decoding a nested expression does.  Two
 * threads racing on one key may both compute it; the first value stored wins
 * and is returned to both.  Exceptions are not cached.
 */
public final class Cache<K, V> {
	private final ConcurrentMap<K, V> map = new ConcurrentHashMap<>();
	private final Function<K, V> func;

	/**
	 * @param func
	 *         Computes values from keys; must not return null.
	 */
	public Cache(Function<K, V> func) {
		this.func = Objects.requireNonNull(func);
	}

	/**
	 * @return The (possibly cached) value for this key.
	 */
	public V get(K key) {
		var value = this.map.get(key);
		if (value != null) {
			return value;
		}

		value = Objects.requireNonNull(this.func.apply(key), () -> "No value for " + key);
		var existing = this.map.putIfAbsent(key, value);
		return existing != null ? existing : value;
	}

	/**
	 * @return Whether a value is cached for this key.
	 */
	public boolean contains(K key) {
		return this.map.containsKey(key);
	}

	/**
	 * @return The number of cached keys.
	 */
	public int size() {
		return this.map.size();
	}
}
