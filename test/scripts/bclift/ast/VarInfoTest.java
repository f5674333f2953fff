package bclift.ast;

import static org.junit.jupiter.api.Assertions.*;

import bclift.LiftContractException;

import org.junit.jupiter.api.*;

import java.util.Optional;
import java.util.OptionalInt;

public class VarInfoTest {
	@Test
	public void typeIsRefinedOnce() {
		var v = VarInfo.builder("v").build();
		assertEquals(Optional.empty(), v.getType());

		var i = Nodes.intType(IKind.INT);
		v.refineType(i);
		assertEquals(Optional.of(i), v.getType());
		assertThrows(LiftContractException.class, () -> v.refineType(Nodes.intType(IKind.UINT)));
	}

	@Test
	public void typedVariablesCannotBeRefined() {
		var v = VarInfo.builder("v").type(Nodes.voidType()).build();
		assertThrows(LiftContractException.class, () -> v.refineType(Nodes.voidType()));
	}

	@Test
	public void equalityIsIdentity() {
		var a = VarInfo.builder("a").parameter(0).build();
		var b = VarInfo.builder("a").parameter(0).build();
		assertNotEquals(a, b);
		assertEquals(OptionalInt.of(0), a.getParameter());
		assertFalse(a.isGlobal());
		assertTrue(VarInfo.builder("g").globalAddress(0x1000).build().isGlobal());
		assertTrue(VarInfo.builder("?m?").placeholder().build().isPlaceholder());
	}
}
