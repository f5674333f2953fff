package bclift.value;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.OptionalLong;
import java.util.Random;

public class ConstantFolderTest {
	private static XXpr c(long value) {
		return XXpr.constant(value);
	}

	private static XXpr x(XOperator op, XXpr... operands) {
		return XXpr.compound(op, operands);
	}

	private static final XXpr R0 = XXpr.var(new XVariable.Register(1, "R0"));

	private static final long SEED = 0x5eed_2026L;

	private static final int[] EDGES = {
		0, 1, -1, 2, 7, 8, 31, 32, 33, 64, 0x7f, 0x80, 0xff, 0x100,
		Integer.MAX_VALUE, Integer.MIN_VALUE, Integer.MIN_VALUE + 1,
	};

	/**
	 * Folding bottom-up must agree with evaluating the whole tree.
	 */
	private static void assertFoldsLikeEvaluate(XXpr xpr) {
		var simplified = xpr.simplify();
		assertInstanceOf(XXpr.Constant.class, simplified, xpr.toString());
		assertEquals(xpr.evaluate(), simplified.evaluate(), xpr.toString());
	}

	@Test
	public void simplifyAgreesWithEvaluate() {
		List<XXpr> cases = List.of(
			x(XOperator.PLUS, c(0x7fffffff), c(1)),
			x(XOperator.MULT, x(XOperator.PLUS, c(0x10000), c(3)), c(0x10000)),
			x(XOperator.MINUS, c(0), c(0x80000000L)),
			x(XOperator.DIV, c(-7), c(2)),
			x(XOperator.MOD, c(-7), c(2)),
			x(XOperator.LSR, c(-1), c(4)),
			x(XOperator.ASR, c(-16), c(2)),
			x(XOperator.LSL, c(1), c(33)),
			x(XOperator.LT, c(-1), c(1)),
			x(XOperator.XBYTE, c(1), c(0x12345678)),
			x(XOperator.LSB, x(XOperator.BNOT, c(0))),
			x(XOperator.LSH, c(0x12345678)),
			x(XOperator.LNOT, x(XOperator.EQ, c(3), c(3))));
		for (var xpr : cases) {
			assertFoldsLikeEvaluate(xpr);
		}

		var narrow = x(XOperator.LSB, new XXpr.Constant(0x1ff, 16, false));
		assertFoldsLikeEvaluate(narrow);
	}

	@Test
	public void arithmeticWrapsAt32Bits() {
		assertEquals(OptionalLong.of(Integer.MIN_VALUE), x(XOperator.PLUS, c(0x7fffffff), c(1)).evaluate());
		assertEquals(OptionalLong.of(0), x(XOperator.MULT, c(0x10000), c(0x10000)).evaluate());
		assertEquals(OptionalLong.of(-3), x(XOperator.DIV, c(-7), c(2)).evaluate());
		assertEquals(OptionalLong.of(-1), x(XOperator.MOD, c(-7), c(2)).evaluate());
		assertEquals(OptionalLong.of(0x0fffffff), x(XOperator.LSR, c(-1), c(4)).evaluate());
		assertEquals(OptionalLong.of(2), x(XOperator.LSL, c(1), c(33)).evaluate());
		assertEquals(OptionalLong.of(0x56), x(XOperator.XBYTE, c(1), c(0x12345678)).evaluate());
		assertEquals(OptionalLong.of(0), x(XOperator.XBYTE, c(4), c(0x12345678)).evaluate());
	}

	@Test
	public void divisionByZeroDoesNotEvaluate() {
		var xpr = x(XOperator.DIV, c(1), c(0));
		assertEquals(OptionalLong.empty(), xpr.evaluate());
		assertEquals(xpr, xpr.simplify());
		assertEquals(OptionalLong.empty(), x(XOperator.MOD, c(1), c(0)).evaluate());
	}

	@Test
	public void variablesAndUnknownOperatorsDoNotEvaluate() {
		assertEquals(OptionalLong.empty(), R0.evaluate());
		assertEquals(OptionalLong.empty(), new XXpr.Compound("rotl", List.of(c(1), c(2))).evaluate());
		assertEquals(OptionalLong.empty(), new XXpr.Compound("plus", List.of(c(1))).evaluate());
	}

	@Test
	public void additiveIdentitiesAndReassociation() {
		assertEquals(R0, x(XOperator.PLUS, R0, c(0)).simplify());
		assertEquals(R0, x(XOperator.MINUS, R0, c(0)).simplify());
		assertEquals(R0, x(XOperator.PLUS, c(0), R0).simplify());

		assertEquals(x(XOperator.PLUS, R0, c(12)), x(XOperator.PLUS, x(XOperator.PLUS, R0, c(4)), c(8)).simplify());
		assertEquals(x(XOperator.PLUS, R0, c(4)), x(XOperator.PLUS, x(XOperator.MINUS, R0, c(4)), c(8)).simplify());
		assertEquals(x(XOperator.MINUS, R0, c(8)), x(XOperator.MINUS, x(XOperator.MINUS, R0, c(4)), c(4)).simplify());
		assertEquals(R0, x(XOperator.MINUS, x(XOperator.PLUS, R0, c(4)), c(4)).simplify());
	}

	@Test
	public void simplifyIsPure() {
		var inner = x(XOperator.PLUS, R0, c(4));
		var outer = x(XOperator.PLUS, inner, c(8));
		var before = outer.toString();
		outer.simplify();
		assertEquals(before, outer.toString());
	}

	@Test
	public void intArithHelpers() {
		assertEquals(0xffffffffL, IntArith.zeroExtend(-1, 32));
		assertEquals(-1, IntArith.signExtend(0xff, 8));
		assertEquals(0xff, IntArith.widen(-1, 8, false));
		assertEquals(-1, IntArith.widen(-1, 8, true));
		assertTrue(IntArith.compareUnsigned(-1, 1, 32) > 0);
		assertEquals("0xffffffff", IntArith.toHex(-1, 32));
		assertEquals(-16, IntArith.parse("-0x10"));
		assertEquals(255, IntArith.parse("255"));
	}

	@Test
	public void narrowConstantsZeroExtendInWiderCompounds() {
		var sum = x(XOperator.PLUS, new XXpr.Constant(0xff, 8, false), c(1));
		assertEquals(OptionalLong.of(256), sum.evaluate());
		assertEquals(new XXpr.Constant(256, 32, false), sum.simplify());

		var cmp = x(XOperator.LT, c(0), new XXpr.Constant(0x80, 8, false));
		assertEquals(OptionalLong.of(1), cmp.evaluate());

		var offset = x(XOperator.PLUS, x(XOperator.PLUS, R0, new XXpr.Constant(0xff, 8, false)), c(1));
		assertEquals(x(XOperator.PLUS, R0, c(256)), offset.simplify());
	}

	@Test
	public void randomOperandsMatchIntArithmetic() {
		var random = new Random(SEED);
		for (var op : XOperator.values()) {
			for (int i = 0; i < 500; ++i) {
				int a = pick(random);
				int b = pick(random);
				if (op.getArity() == 1) {
					check(reference(op, a), x(op, new XXpr.Constant(a, 32, false)));
				} else {
					check(reference(op, a, b), x(op, new XXpr.Constant(a, 32, false), new XXpr.Constant(b, 32, false)));
				}
			}
		}
	}

	@Test
	public void randomMixedWidthOperands() {
		var random = new Random(SEED + 1);
		for (var op : XOperator.values()) {
			for (int i = 0; i < 500; ++i) {
				int narrow = (byte) random.nextInt();
				int wide = pick(random);
				var narrowXpr = new XXpr.Constant(narrow, 8, false);
				var wideXpr = new XXpr.Constant(wide, 32, false);
				if (op.getArity() == 1) {
					var expected = reference(op, narrow);
					if (expected.isPresent()) {
						expected = OptionalLong.of((byte) expected.getAsLong());
					}
					check(expected, x(op, narrowXpr));
				} else if (random.nextBoolean()) {
					check(reference(op, narrow & 0xff, wide), x(op, narrowXpr, wideXpr));
				} else {
					check(reference(op, wide, narrow & 0xff), x(op, wideXpr, narrowXpr));
				}
			}
		}
	}

	private static int pick(Random random) {
		if (random.nextInt(3) == 0) {
			return EDGES[random.nextInt(EDGES.length)];
		}
		return random.nextInt();
	}

	private static void check(OptionalLong expected, XXpr xpr) {
		assertEquals(expected, xpr.evaluate(), xpr::toString);
		var simplified = xpr.simplify();
		assertEquals(expected.isPresent(), simplified.isConstant(), xpr::toString);
		assertEquals(expected, simplified.evaluate(), xpr::toString);
	}

	private static OptionalLong truth(boolean b) {
		return OptionalLong.of(b ? 1 : 0);
	}

	/**
	 * Binary operators on 32-bit values, computed with int arithmetic.
	 */
	private static OptionalLong reference(XOperator op, int a, int b) {
		switch (op) {
			case PLUS:
				return OptionalLong.of(a + b);
			case MINUS:
				return OptionalLong.of(a - b);
			case MULT:
				return OptionalLong.of(a * b);
			case DIV:
				return b == 0 ? OptionalLong.empty() : OptionalLong.of(a / b);
			case MOD:
				return b == 0 ? OptionalLong.empty() : OptionalLong.of(a % b);
			case BAND:
				return OptionalLong.of(a & b);
			case BOR:
				return OptionalLong.of(a | b);
			case BXOR:
				return OptionalLong.of(a ^ b);
			case LSL:
				return OptionalLong.of(a << b);
			case LSR:
				return OptionalLong.of(a >>> b);
			case ASR:
				return OptionalLong.of(a >> b);
			case LAND:
				return truth(a != 0 && b != 0);
			case LOR:
				return truth(a != 0 || b != 0);
			case EQ:
				return truth(a == b);
			case NE:
				return truth(a != b);
			case LT:
				return truth(a < b);
			case LE:
				return truth(a <= b);
			case GT:
				return truth(a > b);
			case GE:
				return truth(a >= b);
			case XBYTE:
				return OptionalLong.of(a < 0 || a >= 4 ? 0 : (b >>> (8 * a)) & 0xff);
			default:
				throw new AssertionError(op);
		}
	}

	/**
	 * Unary operators on 32-bit values.
	 */
	private static OptionalLong reference(XOperator op, int a) {
		switch (op) {
			case NEG:
				return OptionalLong.of(-a);
			case BNOT:
				return OptionalLong.of(~a);
			case LNOT:
				return truth(a == 0);
			case LSB:
				return OptionalLong.of(a & 0xff);
			case LSH:
				return OptionalLong.of(a & 0xff00);
			default:
				throw new AssertionError(op);
		}
	}
}
