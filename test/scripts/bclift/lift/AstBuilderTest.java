package bclift.lift;

import static org.junit.jupiter.api.Assertions.*;

import bclift.ast.Assign;
import bclift.ast.CPrinter;
import bclift.ast.Nodes;
import bclift.ast.VarInfo;
import bclift.symbol.GlobalSymbolTable;
import bclift.symbol.LocalSymbolTable;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;

public class AstBuilderTest {
	private AstBuilder builder;
	private VarInfo x;

	@BeforeEach
	public void setUp() {
		var globals = new GlobalSymbolTable();
		this.builder = new AstBuilder("f", globals, new LocalSymbolTable(globals, List.of()));
		this.x = this.builder.getLocals().local("x");
	}

	@Test
	public void instructionsAtOneAddressShareALocation() {
		var lval = Nodes.varLval(this.x);
		Assign low = this.builder.mkAssign("0x100", lval, Nodes.intConstant(1));
		Assign high = this.builder.mkAssign("0x100", lval, Nodes.intConstant(1));
		var other = this.builder.mkNop("0x104", "nop");

		assertEquals(low.getLocationId(), high.getLocationId());
		assertNotEquals(low.getLocationId(), other.getLocationId());
		assertNotEquals(low.getId(), high.getId());
		assertEquals(low, high);
		assertEquals(List.of("0x100"), this.builder.getProvenance().getAddresses(low));

		int fresh = this.builder.freshLocationId();
		assertNotEquals(fresh, this.builder.locationId("0x108"));
	}

	@Test
	public void buildsCallsAndAsm() {
		var memset = Nodes.lvalExpr(Nodes.varLval(this.builder.getLocals().local("memset")));
		var call = this.builder.mkCall("0x100", Optional.of(Nodes.varLval(this.x)), memset,
			List.of(Nodes.intConstant(0), Nodes.intConstant(4)));
		assertEquals("x = memset(0, 4);", CPrinter.instr(call));

		var asm = this.builder.mkAsm("0x100", false, List.of("dmb ish"), List.of("memory"));
		assertEquals("__asm__ (\"dmb ish\" ::: \"memory\");", CPrinter.instr(asm));
		assertEquals(call.getLocationId(), asm.getLocationId());
		assertEquals(List.of("0x100"), this.builder.getProvenance().getAddresses(asm));
	}

	@Test
	public void buildsStatements() {
		var cond = Nodes.lvalExpr(Nodes.varLval(this.x));
		var assign = this.builder.mkAssign("0x100", Nodes.varLval(this.x), Nodes.intConstant(0));
		var caseBody = this.builder.mkInstrSequence(List.of(assign), List.of(Nodes.caseLabel(Nodes.intConstant(1))));
		var range = this.builder.mkBlock(List.of(this.builder.mkBreak()),
			List.of(Nodes.caseRangeLabel(Nodes.intConstant(2), Nodes.intConstant(4)), Nodes.defaultLabel()));
		var body = this.builder.mkBlock(List.of(caseBody, range), List.of());
		var sw = this.builder.mkSwitch("0x104", cond, body);

		assertEquals("switch (x) {\n"
			+ "case 1:\n"
			+ "\tx = 0;\n"
			+ "case 2 ... 4:\n"
			+ "default:\n"
			+ "\t{\n"
			+ "\t\tbreak;\n"
			+ "\t}\n"
			+ "}\n", CPrinter.stmt(sw));

		var loop = this.builder.mkLoop(this.builder.mkBlock(List.of(
			this.builder.mkBranch("0x108", cond, this.builder.mkContinue(), this.builder.mkBlock(List.of(), List.of())),
			this.builder.mkReturn("0x10c", Optional.of(cond))), List.of()), List.of(Nodes.label("top")));
		assertEquals("top:\n"
			+ "while (1) {\n"
			+ "\tif (x)\n"
			+ "\t\tcontinue;\n"
			+ "\treturn x;\n"
			+ "}\n", CPrinter.stmt(loop));

		assertEquals("goto top;\n", CPrinter.stmt(this.builder.mkGoto("0x110", "top")));
		assertEquals("goto *x;\n", CPrinter.stmt(this.builder.mkComputedGoto("0x114", cond)));
	}
}
