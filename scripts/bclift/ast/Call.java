package bclift.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * {@code [lval =] target(args...);}
 */
public final class Call extends AbstractNode implements Instr {
	private final int locationId;
	private final Optional<Lval> lval;
	private final Expr target;
	private final ImmutableList<Expr> args;

	Call(int id, int locationId, Optional<Lval> lval, Expr target, List<Expr> args) {
		super(id);
		this.locationId = locationId;
		this.lval = lval;
		this.target = target;
		this.args = ImmutableList.copyOf(args);
	}

	@Override
	public int getLocationId() {
		return this.locationId;
	}

	/**
	 * @return Where the return value is stored, if anywhere.
	 */
	public Optional<Lval> getLval() {
		return this.lval;
	}

	public Expr getTarget() {
		return this.target;
	}

	public ImmutableList<Expr> getArgs() {
		return this.args;
	}

	@Override
	List<?> components() {
		return List.of(this.locationId, this.lval, this.target, this.args);
	}
}
