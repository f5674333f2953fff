package bclift.ast;

/**
 * C floating point kinds.
 */
public enum FKind {
	FLOAT("float", 4),
	DOUBLE("double", 8),
	LONGDOUBLE("long double", 8);

	private final String cName;
	private final int size;

	FKind(String cName, int size) {
		this.cName = cName;
		this.size = size;
	}

	public String getCName() {
		return this.cName;
	}

	public int getSize() {
		return this.size;
	}
}
