package bclift.ast;

import java.util.List;
import java.util.OptionalLong;

/**
 * A string literal, with the address it was read from when known.
 */
public final class StringConstant extends AbstractNode implements Expr {
	private final String value;
	private final OptionalLong address;

	StringConstant(int id, String value, OptionalLong address) {
		super(id);
		this.value = value;
		this.address = address;
	}

	public String getValue() {
		return this.value;
	}

	public OptionalLong getAddress() {
		return this.address;
	}

	@Override
	List<?> components() {
		return List.of(this.value, this.address);
	}
}
