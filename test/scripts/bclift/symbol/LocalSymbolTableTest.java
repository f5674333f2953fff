package bclift.symbol;

import static org.junit.jupiter.api.Assertions.*;

import bclift.LiftContractException;
import bclift.ast.IKind;
import bclift.ast.Nodes;
import bclift.type.CompInfo;
import bclift.type.FieldInfo;
import bclift.type.TypeSizes;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

public class LocalSymbolTableTest {
	private GlobalSymbolTable globals;

	@BeforeEach
	public void setUp() {
		this.globals = new GlobalSymbolTable();
	}

	@Test
	public void ssaVariablesAreMintedOncePerSite() {
		var locals = new LocalSymbolTable(this.globals, List.of());
		var first = locals.ssaVar("R0", "0x100", Optional.empty());
		var again = locals.ssaVar("R0", "0x100", Optional.empty());
		var other = locals.ssaVar("R0", "0x104", Optional.empty());

		assertSame(first, again);
		assertNotSame(first, other);
		assertEquals("R0_1", first.getName());
		assertEquals("R0_2", other.getName());
		assertEquals(2, locals.getSsaCount());
		assertEquals(Optional.of(first), locals.ssaVarAt("R0", "0x100"));
		assertEquals(List.of(other), locals.ssaVarsAt("0x104"));
	}

	@Test
	public void ssaNamesSkipExistingLocals() {
		var n = new FormalInfo(0, "R1_1", Nodes.intType(IKind.INT), List.of(ParameterLocation.register("R1", 4)));
		var locals = new LocalSymbolTable(this.globals, List.of(n));
		var taken = locals.local("R0_1");

		var r0 = locals.ssaVar("R0", "0x100", Optional.empty());
		assertEquals("R0_2", r0.getName());
		assertSame(taken, locals.local("R0_1"));
		assertEquals("R0_3", locals.ssaVar("R0", "0x104", Optional.empty()).getName());

		var r1 = locals.ssaVar("R1", "0x100", Optional.empty());
		assertEquals("R1_2", r1.getName());
		assertSame(n.getVarInfo(), locals.lookup("R1_1").orElseThrow());
		assertEquals(5, locals.getLocals().size());
	}

	@Test
	public void snapshotsRefuseNewSymbols() {
		var locals = new LocalSymbolTable(this.globals, List.of());
		var r0 = locals.ssaVar("R0", "0x100", Optional.empty());
		locals.recordSsaConstant(r0, 7);
		locals.stackVar(-4, Optional.empty());

		var snapshot = locals.snapshot();
		assertTrue(snapshot.isFrozen());
		assertSame(snapshot, snapshot.snapshot());
		assertSame(r0, snapshot.ssaVar("R0", "0x100", Optional.empty()));
		assertSame(r0, snapshot.local("R0_1"));
		assertEquals(OptionalLong.of(7), snapshot.ssaConstant(r0));
		assertEquals(1, snapshot.getStackSlots().size());

		assertThrows(LiftContractException.class, () -> snapshot.local("fresh"));
		assertThrows(LiftContractException.class, () -> snapshot.placeholder("memory"));
		assertThrows(LiftContractException.class, () -> snapshot.ssaVar("R0", "0x104", Optional.empty()));
		assertThrows(LiftContractException.class, () -> snapshot.stackVar(-8, Optional.empty()));
		assertThrows(LiftContractException.class, () -> snapshot.recordSsaConstant(r0, 8));

		// Later changes to the live table do not show through
		locals.ssaVar("R0", "0x104", Optional.empty());
		locals.local("tmp");
		assertEquals(2, snapshot.getLocals().size());
		assertEquals(1, snapshot.getSsaCount());
		assertEquals(Optional.empty(), snapshot.lookup("tmp"));
	}

	@Test
	public void ssaConstants() {
		var locals = new LocalSymbolTable(this.globals, List.of());
		var v = locals.ssaVar("R1", "0x100", Optional.empty());
		assertEquals(OptionalLong.empty(), locals.ssaConstant(v));
		locals.recordSsaConstant(v, 42);
		assertEquals(OptionalLong.of(42), locals.ssaConstant(v));
	}

	@Test
	public void localsAreReusedByName() {
		var locals = new LocalSymbolTable(this.globals, List.of());
		assertSame(locals.local("tmp"), locals.local("tmp"));
		var slot = locals.stackVar(-8, Optional.empty());
		assertEquals("localvar_8", slot.getName());
		assertSame(slot, locals.stackVar(-8, Optional.empty()));
		assertEquals("stackvar_4", locals.stackVar(4, Optional.empty()).getName());
		assertEquals(2, locals.getStackSlots().size());
		assertTrue(locals.placeholder("memory").isPlaceholder());
	}

	@Test
	public void formalsByLocation() {
		var n = new FormalInfo(0, "n", Nodes.intType(IKind.INT), List.of(ParameterLocation.register("R0", 4)));
		var buf = new FormalInfo(1, "buf", Nodes.ptrType(Nodes.voidType()), List.of(ParameterLocation.stack(8, 4)));
		var locals = new LocalSymbolTable(this.globals, List.of(n, buf));

		assertSame(n, locals.formalInRegister("R0").orElseThrow().formal());
		assertSame(buf, locals.formalOnStack(8).orElseThrow().formal());
		assertEquals(Optional.empty(), locals.formalInRegister("R1"));
		assertSame(n.getVarInfo(), locals.lookup("n").orElseThrow());
		assertFalse(n.isPacked());
	}

	@Test
	public void lookupFallsBackToGlobals() {
		var g = this.globals.addGlobal("counter", Optional.of(Nodes.intType(IKind.INT)), 0x2000);
		var locals = new LocalSymbolTable(this.globals, List.of());
		assertSame(g, locals.lookup("counter").orElseThrow());
		assertSame(g, this.globals.addGlobal("counter", Optional.empty(), 0x2000));
	}

	@Test
	public void globalContainment() {
		var hdr = FieldInfo.at("hdr", Nodes.intType(IKind.UINT), 0, 4);
		var len = FieldInfo.at("len", Nodes.intType(IKind.UINT), 4, 4);
		var packet = this.globals.addCompInfo(CompInfo.struct("packet", 1, List.of(hdr, len)));
		var pkt = this.globals.addGlobal("pkt", Optional.of(packet.toType()), 0x3000);
		var sizes = new TypeSizes(this.globals, 4);

		var at = this.globals.globalContaining(0x3004, sizes).orElseThrow();
		assertSame(pkt, at.global());
		assertEquals(4, at.offset());
		assertEquals(Optional.empty(), this.globals.globalContaining(0x3008, sizes));
		assertEquals(0, this.globals.globalContaining(0x3000, sizes).orElseThrow().offset());
	}

	@Test
	public void compositeKeysAreUnique() {
		this.globals.addCompInfo(CompInfo.struct("a", 1, List.of()));
		assertThrows(LiftContractException.class, () -> this.globals.addCompInfo(CompInfo.struct("b", 1, List.of())));
	}
}
