package bclift.ast;

import java.util.List;

/**
 * An lvalue: a host with an offset into it.
 */
public final class Lval extends AbstractNode {
	private final LHost host;
	private final Offset offset;

	Lval(int id, LHost host, Offset offset) {
		super(id);
		this.host = host;
		this.offset = offset;
	}

	public LHost getHost() {
		return this.host;
	}

	public Offset getOffset() {
		return this.offset;
	}

	/**
	 * @return Whether this lvalue is a bare variable with no offset.
	 */
	public boolean isVariable() {
		return this.host instanceof VarHost && this.offset instanceof NoOffset;
	}

	@Override
	List<?> components() {
		return List.of(this.host, this.offset);
	}
}
