package bclift.ast;

import java.util.List;

/**
 * An instruction with no effect, carrying a description of what it stood for.
 */
public final class Nop extends AbstractNode implements Instr {
	private final int locationId;
	private final String description;

	Nop(int id, int locationId, String description) {
		super(id);
		this.locationId = locationId;
		this.description = description;
	}

	@Override
	public int getLocationId() {
		return this.locationId;
	}

	public String getDescription() {
		return this.description;
	}

	@Override
	List<?> components() {
		return List.of(this.locationId, this.description);
	}
}
