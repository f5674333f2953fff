package bclift.ast;

import java.util.List;

/**
 * {@code cond ? then : otherwise}.
 */
public final class Question extends AbstractNode implements Expr {
	private final Expr condition;
	private final Expr then;
	private final Expr otherwise;

	Question(int id, Expr condition, Expr then, Expr otherwise) {
		super(id);
		this.condition = condition;
		this.then = then;
		this.otherwise = otherwise;
	}

	public Expr getCondition() {
		return this.condition;
	}

	public Expr getThen() {
		return this.then;
	}

	public Expr getOtherwise() {
		return this.otherwise;
	}

	@Override
	List<?> components() {
		return List.of(this.condition, this.then, this.otherwise);
	}
}
