package bclift.ast;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide source of AST node ids.
 */
public final class NodeIds {
	private static final AtomicInteger NEXT = new AtomicInteger(1);

	private NodeIds() {
	}

	/**
	 * @return A fresh node id.
	 */
	public static int next() {
		return NEXT.getAndIncrement();
	}
}
