package bclift.lift;

import bclift.fact.InstrFacts;
import bclift.fact.OpcodeRecord;

import java.util.Optional;

/**
 * One instruction of a function, with its semantic facts.
 *
 * @param address The instruction address, used as its site.
 * @param bytes The instruction bytes, in hexadecimal.
 * @param facts The instruction's semantic facts.
 * @param opcode The instruction's checked opcode record, if the architecture supplied one.
 */
public record FunctionInstruction(String address, String bytes, InstrFacts facts, Optional<OpcodeRecord> opcode) {
	public FunctionInstruction(String address, String bytes, InstrFacts facts) {
		this(address, bytes, facts, Optional.empty());
	}

	public Span span() {
		return new Span(this.address, this.bytes);
	}
}
