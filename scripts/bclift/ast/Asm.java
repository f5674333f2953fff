package bclift.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Inline assembly, for instructions with no C equivalent.
 */
public final class Asm extends AbstractNode implements Instr {
	private final int locationId;
	private final boolean isVolatile;
	private final ImmutableList<String> templates;
	private final ImmutableList<String> clobbers;

	Asm(int id, int locationId, boolean isVolatile, List<String> templates, List<String> clobbers) {
		super(id);
		this.locationId = locationId;
		this.isVolatile = isVolatile;
		this.templates = ImmutableList.copyOf(templates);
		this.clobbers = ImmutableList.copyOf(clobbers);
	}

	@Override
	public int getLocationId() {
		return this.locationId;
	}

	public boolean isVolatile() {
		return this.isVolatile;
	}

	public ImmutableList<String> getTemplates() {
		return this.templates;
	}

	public ImmutableList<String> getClobbers() {
		return this.clobbers;
	}

	@Override
	List<?> components() {
		return List.of(this.locationId, this.isVolatile, this.templates, this.clobbers);
	}
}
