package bclift.lift;

/**
 * The bytes an instruction was decoded from.
 *
 * @param address The address of the first byte.
 * @param bytes The bytes, in hexadecimal.
 */
public record Span(String address, String bytes) {
	/**
	 * @return The number of bytes in this span.
	 */
	public int length() {
		return this.bytes.length() / 2;
	}
}
