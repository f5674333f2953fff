package bclift.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A value computed on first use.
 *
 * The initializer runs at most once.  If it throws, the exception is kept and
 * rethrown by every later {@link #get()}, so a record that fails to decode is
 * not decoded again.
 */
public final class Lazy<T> implements Supplier<T> {
	private Supplier<T> init;
	private volatile T value;
	private RuntimeException failure;

	/**
	 * @param init
	 *         Computes the value; must not return null.
	 */
	public Lazy(Supplier<T> init) {
		this.init = Objects.requireNonNull(init);
	}

	@Override
	public T get() {
		var result = this.value;
		if (result != null) {
			return result;
		}

		synchronized (this) {
			if (this.value != null) {
				return this.value;
			} else if (this.failure != null) {
				throw this.failure;
			}

			try {
				result = Objects.requireNonNull(this.init.get(), "Lazy initializer returned null");
			} catch (RuntimeException e) {
				this.failure = e;
				throw e;
			} finally {
				this.init = null;
			}
			this.value = result;
			return result;
		}
	}

	/**
	 * @return Whether the value has been computed.
	 */
	public boolean isInitialized() {
		return this.value != null;
	}

	/**
	 * @return Whether the initializer threw.
	 */
	public synchronized boolean isFailed() {
		return this.failure != null;
	}
}
