package bclift.ast;

import java.util.List;

/**
 * {@code lval = expr;}
 */
public final class Assign extends AbstractNode implements Instr {
	private final int locationId;
	private final Lval lval;
	private final Expr rhs;

	Assign(int id, int locationId, Lval lval, Expr rhs) {
		super(id);
		this.locationId = locationId;
		this.lval = lval;
		this.rhs = rhs;
	}

	@Override
	public int getLocationId() {
		return this.locationId;
	}

	public Lval getLval() {
		return this.lval;
	}

	public Expr getRhs() {
		return this.rhs;
	}

	@Override
	List<?> components() {
		return List.of(this.locationId, this.lval, this.rhs);
	}
}
