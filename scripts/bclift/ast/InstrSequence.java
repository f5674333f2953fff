package bclift.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A straight-line run of instructions.
 */
public final class InstrSequence extends AbstractStmt implements Stmt {
	private final ImmutableList<Instr> instrs;

	InstrSequence(int id, int locationId, List<StmtLabel> labels, List<Instr> instrs) {
		super(id, locationId, labels);
		this.instrs = ImmutableList.copyOf(instrs);
	}

	public ImmutableList<Instr> getInstrs() {
		return this.instrs;
	}

	@Override
	List<?> stmtComponents() {
		return List.of(this.instrs);
	}
}
