package bclift.ast;

import java.util.List;

/**
 * The void type.
 */
public final class VoidType extends AbstractNode implements Typ {
	VoidType(int id) {
		super(id);
	}

	@Override
	List<?> components() {
		return List.of();
	}
}
