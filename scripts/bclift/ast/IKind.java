package bclift.ast;

/**
 * C integer kinds, with their byte sizes on the target.
 */
public enum IKind {
	CHAR("char", 1, true),
	SCHAR("signed char", 1, true),
	UCHAR("unsigned char", 1, false),
	BOOL("_Bool", 1, false),
	INT("int", 4, true),
	UINT("unsigned int", 4, false),
	SHORT("short", 2, true),
	USHORT("unsigned short", 2, false),
	LONG("long", 4, true),
	ULONG("unsigned long", 4, false),
	LONGLONG("long long", 8, true),
	ULONGLONG("unsigned long long", 8, false);

	private final String cName;
	private final int size;
	private final boolean signed;

	IKind(String cName, int size, boolean signed) {
		this.cName = cName;
		this.size = size;
		this.signed = signed;
	}

	/**
	 * @return The C spelling of this kind.
	 */
	public String getCName() {
		return this.cName;
	}

	/**
	 * @return The size of this kind in bytes.
	 */
	public int getSize() {
		return this.size;
	}

	/**
	 * @return Whether values of this kind are sign-extended when widened.
	 */
	public boolean isSigned() {
		return this.signed;
	}
}
