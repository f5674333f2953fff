package bclift.ast;

import java.util.List;

/**
 * The empty offset.
 */
public final class NoOffset extends AbstractNode implements Offset {
	NoOffset(int id) {
		super(id);
	}

	@Override
	List<?> components() {
		return List.of();
	}
}
