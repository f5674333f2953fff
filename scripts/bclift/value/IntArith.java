package bclift.value;

import com.google.common.primitives.UnsignedInts;
import com.google.common.primitives.UnsignedLongs;

/**
 * Fixed-width twos-complement integer arithmetic.
 *
 * Values are carried in a {@code long} holding the signed interpretation of
 * the low {@code width} bits.
 */
public final class IntArith {
	/** The width of integer values when none is given. */
	public static final int DEFAULT_WIDTH = 32;

	private IntArith() {
	}

	private static long mask(int width) {
		checkWidth(width);
		return width == 64 ? ~0L : (1L << width) - 1;
	}

	private static void checkWidth(int width) {
		if (width < 1 || width > 64) {
			throw new IllegalArgumentException("Unsupported bit width " + width);
		}
	}

	/**
	 * @return The signed value of the low {@code width} bits.
	 */
	public static long wrap(long value, int width) {
		checkWidth(width);
		if (width == 64) {
			return value;
		}
		int shift = 64 - width;
		return (value << shift) >> shift;
	}

	/**
	 * @return The unsigned value of the low {@code width} bits.
	 */
	public static long zeroExtend(long value, int width) {
		if (width == 32) {
			return UnsignedInts.toLong((int) value);
		}
		return value & mask(width);
	}

	/**
	 * @return The signed value of the low {@code width} bits.
	 */
	public static long signExtend(long value, int width) {
		return wrap(value, width);
	}

	/**
	 * Widen a value of {@code fromWidth} bits, by sign extension if it has a
	 * signed static type and zero extension otherwise.
	 */
	public static long widen(long value, int fromWidth, boolean signed) {
		return signed ? signExtend(value, fromWidth) : zeroExtend(value, fromWidth);
	}

	public static long add(long a, long b, int width) {
		return wrap(a + b, width);
	}

	public static long sub(long a, long b, int width) {
		return wrap(a - b, width);
	}

	public static long mul(long a, long b, int width) {
		return wrap(a * b, width);
	}

	/**
	 * Signed division, truncating toward zero.  The caller checks for zero.
	 */
	public static long div(long a, long b, int width) {
		a = wrap(a, width);
		b = wrap(b, width);
		if (width == 64 && a == Long.MIN_VALUE && b == -1) {
			return a;
		}
		return wrap(a / b, width);
	}

	/**
	 * Signed remainder, with the sign of the dividend.  The caller checks for zero.
	 */
	public static long mod(long a, long b, int width) {
		a = wrap(a, width);
		b = wrap(b, width);
		if (b == -1) {
			return 0;
		}
		return wrap(a % b, width);
	}

	/**
	 * @return The shift count reduced modulo the width.
	 */
	private static int shiftCount(long count, int width) {
		return (int) Math.floorMod(count, (long) width);
	}

	public static long shiftLeft(long a, long count, int width) {
		return wrap(a << shiftCount(count, width), width);
	}

	public static long shiftRightLogical(long a, long count, int width) {
		return wrap(zeroExtend(a, width) >>> shiftCount(count, width), width);
	}

	public static long shiftRightArithmetic(long a, long count, int width) {
		return wrap(wrap(a, width) >> shiftCount(count, width), width);
	}

	/**
	 * Compare two values as unsigned integers of the given width.
	 */
	public static int compareUnsigned(long a, long b, int width) {
		if (width == 32) {
			return UnsignedInts.compare((int) a, (int) b);
		}
		return UnsignedLongs.compare(zeroExtend(a, width), zeroExtend(b, width));
	}

	/**
	 * @return The unsigned hexadecimal representation of a value.
	 */
	public static String toHex(long value, int width) {
		if (width == 32) {
			return "0x" + UnsignedInts.toString((int) value, 16);
		}
		return "0x" + UnsignedLongs.toString(zeroExtend(value, width), 16);
	}

	/**
	 * Parse a decimal or {@code 0x}-prefixed hexadecimal literal, possibly negative.
	 *
	 * @throws NumberFormatException If the literal is malformed.
	 */
	public static long parse(String literal) {
		var str = literal.trim();
		boolean negative = str.startsWith("-");
		if (negative) {
			str = str.substring(1);
		}

		long value;
		if (str.startsWith("0x") || str.startsWith("0X")) {
			value = UnsignedLongs.parseUnsignedLong(str.substring(2), 16);
		} else {
			value = UnsignedLongs.parseUnsignedLong(str);
		}
		return negative ? -value : value;
	}
}
