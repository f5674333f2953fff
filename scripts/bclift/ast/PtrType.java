package bclift.ast;

import java.util.List;

/**
 * A pointer type.
 */
public final class PtrType extends AbstractNode implements Typ {
	private final Typ target;

	PtrType(int id, Typ target) {
		super(id);
		this.target = target;
	}

	/**
	 * @return The type pointed to.
	 */
	public Typ getTarget() {
		return this.target;
	}

	@Override
	List<?> components() {
		return List.of(this.target);
	}
}
