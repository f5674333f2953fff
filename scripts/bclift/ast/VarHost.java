package bclift.ast;

import java.util.List;

/**
 * A variable lvalue host.
 */
public final class VarHost extends AbstractNode implements LHost {
	private final VarInfo varInfo;

	VarHost(int id, VarInfo varInfo) {
		super(id);
		this.varInfo = varInfo;
	}

	public VarInfo getVarInfo() {
		return this.varInfo;
	}

	@Override
	List<?> components() {
		return List.of(this.varInfo);
	}
}
