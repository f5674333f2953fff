package bclift.ast;

import java.util.List;

/**
 * {@code case low ... high:}
 */
public final class CaseRangeLabel extends AbstractNode implements StmtLabel {
	private final Expr low;
	private final Expr high;

	CaseRangeLabel(int id, Expr low, Expr high) {
		super(id);
		this.low = low;
		this.high = high;
	}

	public Expr getLow() {
		return this.low;
	}

	public Expr getHigh() {
		return this.high;
	}

	@Override
	List<?> components() {
		return List.of(this.low, this.high);
	}
}
