package bclift.fact;

/**
 * An opcode record whose shape has been checked against its contract.
 */
public final class OpcodeRecord {
	private final OpcodeContract contract;
	private final FactRecord record;

	private OpcodeRecord(OpcodeContract contract, FactRecord record) {
		this.contract = contract;
		this.record = record;
	}

	/**
	 * @return The checked opcode record.
	 * @throws FactDecodeException If the record's tag or argument count differs
	 *         from the contract.
	 */
	public static OpcodeRecord of(OpcodeContract contract, FactRecord record) {
		int tags = record.getTags().size();
		int args = record.getArgs().size();
		if (tags != contract.tagCount() || args != contract.argCount()) {
			throw new FactDecodeException(record.getIndex(),
				"%s: expected %d tags and %d args, got %d and %d in %s",
				contract.mnemonic(), contract.tagCount(), contract.argCount(), tags, args, record);
		}
		return new OpcodeRecord(contract, record);
	}

	public OpcodeContract getContract() {
		return this.contract;
	}

	public String getMnemonic() {
		return this.contract.mnemonic();
	}

	public FactRecord getRecord() {
		return this.record;
	}

	/**
	 * @return The operand argument at the given position.
	 */
	public int getArg(int i) {
		return this.record.getArg(i);
	}

	@Override
	public String toString() {
		return this.contract.mnemonic() + " " + this.record;
	}
}
