package bclift.lift;

import static org.junit.jupiter.api.Assertions.*;

import bclift.ast.CPrinter;
import bclift.ast.FieldOffset;
import bclift.ast.GlobalAddressConstant;
import bclift.ast.IKind;
import bclift.ast.IntConstant;
import bclift.ast.NoOffset;
import bclift.ast.Nodes;
import bclift.ast.Unresolved;
import bclift.ast.UnresolvedOffset;
import bclift.ast.VarHost;
import bclift.symbol.FormalInfo;
import bclift.symbol.GlobalSymbolTable;
import bclift.symbol.LocalSymbolTable;
import bclift.symbol.ParameterLocation;
import bclift.type.CompInfo;
import bclift.type.FieldInfo;
import bclift.value.MemoryBase;
import bclift.value.XMemoryOffset;
import bclift.value.XOperator;
import bclift.value.XVariable;
import bclift.value.XXpr;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

public class LiftEngineTest {
	private static final String SITE = "0x100";

	private GlobalSymbolTable globals;
	private CompInfo packet;
	private FormalInfo p;
	private LocalSymbolTable locals;
	private AstBuilder builder;
	private LiftEngine engine;

	@BeforeEach
	public void setUp() {
		this.globals = new GlobalSymbolTable();
		var hdr = FieldInfo.at("hdr", Nodes.intType(IKind.UINT), 0, 4);
		var len = FieldInfo.at("len", Nodes.intType(IKind.UINT), 4, 4);
		this.packet = this.globals.addCompInfo(CompInfo.struct("packet", 1, List.of(hdr, len)));

		this.p = new FormalInfo(0, "p", Nodes.ptrType(this.packet.toType()), List.of(ParameterLocation.register("R0", 4)));
		this.locals = new LocalSymbolTable(this.globals, List.of(this.p));
		this.builder = new AstBuilder("f", this.globals, this.locals);
		this.engine = new LiftEngine(this.builder);
	}

	private static XXpr reg(String name) {
		return XXpr.var(new XVariable.Register(1, name));
	}

	private static XXpr initial(String name) {
		return XXpr.var(new XVariable.InitialRegisterValue(2, name));
	}

	private Diagnostics diagnostics() {
		return this.builder.getDiagnostics();
	}

	@Test
	public void fieldAtOffsetFindsLen() {
		var offset = this.engine.fieldAtOffset(this.packet, 4, SITE);
		var field = assertInstanceOf(FieldOffset.class, offset);
		assertEquals("len", field.getName());
		assertEquals(1, field.getCompKey());
		assertInstanceOf(NoOffset.class, field.getRest());
		assertEquals(0, diagnostics().size());
	}

	@Test
	public void namedFieldOffsetsAreChecked() {
		var len = this.engine.liftOffset(new XMemoryOffset.Field("len", 1, XMemoryOffset.none()), SITE);
		assertEquals(".len", CPrinter.offset(len));
		assertEquals(0, diagnostics().size());

		var unknownComp = this.engine.liftOffset(new XMemoryOffset.Field("len", 99, XMemoryOffset.none()), SITE);
		assertInstanceOf(UnresolvedOffset.class, unknownComp);
		assertEquals(1, diagnostics().count(Diagnostic.Kind.UNSUPPORTED_OFFSET));

		var unknownField = this.engine.liftOffset(new XMemoryOffset.Field("crc", 1, XMemoryOffset.none()), SITE);
		assertInstanceOf(UnresolvedOffset.class, unknownField);

		var opaque = new FieldInfo("x", Nodes.intType(IKind.INT), OptionalInt.empty(), OptionalInt.of(4));
		this.globals.addCompInfo(CompInfo.struct("opaque", 2, List.of(opaque)));
		var noOffsets = this.engine.liftOffset(new XMemoryOffset.Field("x", 2, XMemoryOffset.none()), SITE);
		assertInstanceOf(UnresolvedOffset.class, noOffsets);

		assertEquals(3, diagnostics().count(Diagnostic.Kind.UNSUPPORTED_OFFSET));
		assertEquals(List.of(SITE, SITE, SITE), diagnostics().getAll().stream().map(Diagnostic::site).toList());
	}

	@Test
	public void fieldPointerDereference() {
		var base = new XVariable.InitialRegisterValue(2, "R0");
		var memory = new XVariable.BaseMemory(3, base, new XMemoryOffset.Constant(4, XMemoryOffset.none()));
		var lval = this.engine.liftLval(memory, SITE);
		assertEquals("p->len", CPrinter.lval(lval));
		assertEquals(0, diagnostics().size());
	}

	@Test
	public void initialRegisterResolvesToFormal() {
		var lifted = this.engine.liftExpr(initial("R0"), SITE);
		assertEquals("p", lifted.toString());

		var unknown = this.engine.liftExpr(initial("R5"), SITE);
		assertEquals("R5_in", unknown.toString());
		assertEquals(0, diagnostics().size());
	}

	@Test
	public void unresolvableMemoryBecomesAPlaceholder() {
		var memory = new XVariable.Memory(4, new MemoryBase.Unknown("heap"), XMemoryOffset.none());
		var lifted = this.engine.liftExpr(XXpr.var(memory), SITE);
		assertInstanceOf(Unresolved.class, lifted);
		assertTrue(lifted.toString().startsWith("?"));
		assertEquals(1, diagnostics().count(Diagnostic.Kind.RESOLUTION_GAP));
		assertEquals(1, diagnostics().at(SITE).size());

		var hinted = this.engine.liftLval(memory, Optional.empty(), SITE, Optional.of(reg("R3")));
		assertEquals("*R3", CPrinter.lval(hinted));
		assertEquals(2, diagnostics().count(Diagnostic.Kind.RESOLUTION_GAP));
	}

	@Test
	public void registerDefinitionsAreSsa() {
		var r0 = new XVariable.Register(1, "R0");
		var first = this.engine.liftLval(r0, SITE);
		var second = this.engine.liftLval(r0, SITE);
		var host1 = (VarHost) first.getHost();
		var host2 = (VarHost) second.getHost();
		assertSame(host1.getVarInfo(), host2.getVarInfo());
		assertEquals(1, this.locals.getSsaCount());

		var defined = this.engine.liftDefinition(r0, Optional.of(XXpr.constant(7)), "0x104");
		var info = ((VarHost) defined.getHost()).getVarInfo();
		assertEquals(7, this.locals.ssaConstant(info).getAsLong());
	}

	@Test
	public void returnValues() {
		var callSite = "0x200";
		var rtn = new XVariable.ReturnValue(5, callSite, Optional.of("malloc"));
		assertEquals("rtn_malloc", CPrinter.lval(this.engine.liftLval(rtn, SITE)));

		var r0 = this.locals.ssaVar("R0", callSite, Optional.empty());
		assertEquals(r0, ((VarHost) this.engine.liftLval(rtn, SITE).getHost()).getVarInfo());

		this.locals.ssaVar("R1", callSite, Optional.empty());
		var ambiguous = this.engine.liftLval(rtn, SITE);
		assertTrue(((VarHost) ambiguous.getHost()).getVarInfo().isPlaceholder());
		assertEquals(1, diagnostics().count(Diagnostic.Kind.AMBIGUOUS_SSA));
	}

	@Test
	public void offsetsWithoutLayoutAreUnsupported() {
		var opaque = this.globals.addCompInfo(new CompInfo("opaque", 2, true,
			List.of(new FieldInfo("x", Nodes.intType(IKind.INT), OptionalInt.empty(), OptionalInt.empty())),
			OptionalInt.empty()));
		var offset = this.engine.fieldAtOffset(opaque, 4, SITE);
		assertInstanceOf(UnresolvedOffset.class, offset);
		assertEquals(1, diagnostics().count(Diagnostic.Kind.UNSUPPORTED_OFFSET));
	}

	@Test
	public void offsetNavigationIsTotal() {
		var a = FieldInfo.at("a", Nodes.intType(IKind.INT), 0, 4);
		var b = FieldInfo.at("b", Nodes.intType(IKind.INT), 4, 4);
		var inner = this.globals.addCompInfo(CompInfo.struct("inner", 3, List.of(a, b)));
		var in = FieldInfo.at("in", inner.toType(), 0, 8);
		var tail = FieldInfo.at("tail", Nodes.intType(IKind.INT), 8, 4);
		var outer = this.globals.addCompInfo(CompInfo.struct("outer", 4, List.of(in, tail)));

		assertEquals(".in.b", CPrinter.offset(this.engine.fieldAtOffset(outer, 4, SITE)));
		assertEquals(".tail", CPrinter.offset(this.engine.fieldAtOffset(outer, 8, SITE)));
		assertEquals(0, diagnostics().size());

		// A residual offset at the second level is not navigated further
		assertTrue(this.engine.fieldAtOffset(outer, 6, SITE).isUnresolved());
		for (long offset : new long[] { -1, 12, 100, Long.MAX_VALUE }) {
			assertTrue(this.engine.fieldAtOffset(outer, offset, SITE).isUnresolved());
		}
		assertEquals(5, diagnostics().count(Diagnostic.Kind.UNSUPPORTED_OFFSET));

		var unknown = this.engine.liftOffset(new XMemoryOffset.Unknown(), SITE);
		assertTrue(unknown.isUnresolved());
	}

	@Test
	public void stackAddresses() {
		var sp = initial(LiftEngine.DEFAULT_STACK_POINTER);
		var address = this.engine.liftExpr(XXpr.compound(XOperator.MINUS, sp, XXpr.constant(8)), SITE);
		assertEquals("&localvar_8", address.toString());

		var folded = XXpr.compound(XOperator.PLUS, XXpr.compound(XOperator.MINUS, sp, XXpr.constant(16)), XXpr.constant(4));
		assertEquals("&localvar_12", this.engine.liftExpr(folded, SITE).toString());
	}

	@Test
	public void stackVariablesAndFormalsOnTheStack() {
		var n = new FormalInfo(0, "n", Nodes.intType(IKind.INT), List.of(ParameterLocation.stack(8, 4)));
		var locals = new LocalSymbolTable(this.globals, List.of(n));
		var engine = new LiftEngine(new AstBuilder("g", this.globals, locals));

		var slot = new XVariable.LocalStack(1, -4, XMemoryOffset.none());
		assertEquals("localvar_4", CPrinter.lval(engine.liftLval(slot, SITE)));
		var arg = new XVariable.LocalStack(2, 8, XMemoryOffset.none());
		assertEquals("n", CPrinter.lval(engine.liftLval(arg, SITE)));
		var initial = new XVariable.InitialMemoryValue(3, arg);
		assertEquals("n", CPrinter.lval(engine.liftLval(initial, SITE)));
	}

	@Test
	public void pointerPlusFieldOffsetIsAFieldAddress() {
		var sum = XXpr.compound(XOperator.PLUS, initial("R0"), XXpr.constant(4));
		assertEquals("&p->len", this.engine.liftExpr(sum, SITE).toString());
	}

	@Test
	public void globals() {
		var pkt = this.globals.addGlobal("pkt", Optional.of(this.packet.toType()), 0x3000);
		var inside = this.engine.liftExpr(new XXpr.Constant(0x3004, 32, true), SITE);
		var constant = assertInstanceOf(GlobalAddressConstant.class, inside);
		assertEquals(0x3004, constant.getValue());
		assertEquals("&pkt.len", inside.toString());

		var variable = new XVariable.Global(6, 0x3000, XMemoryOffset.none());
		assertEquals(pkt, ((VarHost) this.engine.liftLval(variable, SITE).getHost()).getVarInfo());

		var fresh = new XVariable.Global(7, 0x5000, XMemoryOffset.none());
		assertEquals("gv_0x5000", CPrinter.lval(this.engine.liftLval(fresh, SITE)));

		var array = Nodes.arrayType(Nodes.intType(IKind.INT), Optional.of(Nodes.intConstant(16)));
		this.globals.addGlobal("table", Optional.of(array), 0x4000);
		var element = XXpr.compound(XOperator.PLUS, new XXpr.Constant(0x4000, 32, true),
			XXpr.compound(XOperator.MULT, XXpr.constant(4), reg("R2")));
		assertEquals("&table[R2]", this.engine.liftExpr(element, SITE).toString());
	}

	@Test
	public void specialOperators() {
		assertEquals("R0 & 255", this.engine.liftExpr(XXpr.compound(XOperator.LSB, reg("R0")), SITE).toString());
		assertEquals("R0 & 0xff00", this.engine.liftExpr(XXpr.compound(XOperator.LSH, reg("R0")), SITE).toString());
		assertEquals("(R0 & 0xff00) >> 8",
			this.engine.liftExpr(XXpr.compound(XOperator.XBYTE, XXpr.constant(1), reg("R0")), SITE).toString());
		assertEquals("R0 >> 16 & 255",
			this.engine.liftExpr(XXpr.compound(XOperator.XBYTE, XXpr.constant(2), reg("R0")), SITE).toString());
		assertEquals("(unsigned int)R0 >> 4",
			this.engine.liftExpr(XXpr.compound(XOperator.LSR, reg("R0"), XXpr.constant(4)), SITE).toString());
	}

	@Test
	public void unknownOperatorsAreUnresolved() {
		var rot = new XXpr.Compound("rotl", List.of(reg("R0"), XXpr.constant(3)));
		assertInstanceOf(Unresolved.class, this.engine.liftExpr(rot, SITE));
		assertEquals(1, diagnostics().count(Diagnostic.Kind.RESOLUTION_GAP));
	}

	@Test
	public void constantsWidenByStaticType() {
		var narrow = new XXpr.Constant(-1, 8, false);
		var signed = this.engine.liftExpr(narrow, Optional.empty(), SITE, Optional.of(Nodes.intType(IKind.SCHAR)));
		assertEquals(-1, ((IntConstant) signed).getValue());
		var unsigned = this.engine.liftExpr(narrow, Optional.empty(), SITE, Optional.of(Nodes.intType(IKind.UCHAR)));
		assertEquals(255, ((IntConstant) unsigned).getValue());
		var untyped = this.engine.liftExpr(narrow, SITE);
		assertEquals(255, ((IntConstant) untyped).getValue());
	}
}
