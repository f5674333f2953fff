package bclift.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import java.util.concurrent.atomic.AtomicInteger;

public class LazyTest {
	private AtomicInteger calls;

	@BeforeEach
	public void setUp() {
		this.calls = new AtomicInteger();
	}

	@Test
	public void computesOnce() {
		var lazy = new Lazy<>(() -> "value " + this.calls.incrementAndGet());
		assertFalse(lazy.isInitialized());
		assertEquals("value 1", lazy.get());
		assertEquals("value 1", lazy.get());
		assertTrue(lazy.isInitialized());
		assertFalse(lazy.isFailed());
		assertEquals(1, this.calls.get());
	}

	@Test
	public void failuresAreKept() {
		Lazy<String> lazy = new Lazy<>(() -> {
			this.calls.incrementAndGet();
			throw new IllegalStateException("bad record");
		});

		var first = assertThrows(IllegalStateException.class, lazy::get);
		var second = assertThrows(IllegalStateException.class, lazy::get);
		assertSame(first, second);
		assertEquals(1, this.calls.get());
		assertTrue(lazy.isFailed());
		assertFalse(lazy.isInitialized());
	}

	@Test
	public void nullResultsAreRejected() {
		Lazy<String> lazy = new Lazy<>(() -> null);
		assertThrows(NullPointerException.class, lazy::get);
		assertTrue(lazy.isFailed());
	}
}
