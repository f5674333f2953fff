package bclift.symbol;

import bclift.ast.Typ;
import bclift.ast.VarInfo;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A formal parameter and the locations it is passed in.  A formal passed in
 * more than one location is packed, e.g. a small struct spread over registers.
 */
public final class FormalInfo {
	private final int index;
	private final VarInfo varInfo;
	private final ImmutableList<ParameterLocation> locations;

	public FormalInfo(int index, String name, Typ type, List<ParameterLocation> locations) {
		this.index = index;
		this.varInfo = VarInfo.builder(name)
			.type(type)
			.parameter(index)
			.description("formal parameter " + index)
			.build();
		this.locations = ImmutableList.copyOf(locations);
	}

	/**
	 * Wrap an existing parameter variable, e.g. one read back from an export.
	 */
	public FormalInfo(VarInfo varInfo, List<ParameterLocation> locations) {
		this.index = varInfo.getParameter()
			.orElseThrow(() -> new IllegalArgumentException(varInfo.getName() + " is not a parameter"));
		this.varInfo = varInfo;
		this.locations = ImmutableList.copyOf(locations);
	}

	public int getIndex() {
		return this.index;
	}

	public String getName() {
		return this.varInfo.getName();
	}

	public VarInfo getVarInfo() {
		return this.varInfo;
	}

	public ImmutableList<ParameterLocation> getLocations() {
		return this.locations;
	}

	public boolean isPacked() {
		return this.locations.size() > 1;
	}

	@Override
	public String toString() {
		return this.index + ":" + getName() + this.locations;
	}
}
