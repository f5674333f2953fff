package bclift.fact;

/**
 * The declared shape of an architecture opcode's record.
 *
 * @param mnemonic The opcode mnemonic.
 * @param tagCount The exact number of tags its records carry.
 * @param argCount The exact number of arguments its records carry.
 */
public record OpcodeContract(String mnemonic, int tagCount, int argCount) {
}
