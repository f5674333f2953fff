package bclift.lift;

import static org.mockito.Mockito.*;
import static org.junit.jupiter.api.Assertions.*;

import bclift.LiftContractException;
import bclift.ast.Assign;
import bclift.ast.CPrinter;
import bclift.ast.IKind;
import bclift.ast.Instr;
import bclift.ast.Nodes;
import bclift.ast.VarHost;
import bclift.ast.VarInfo;
import bclift.fact.DataflowFact;
import bclift.fact.FactRecord;
import bclift.fact.InstrFacts;
import bclift.fact.InvariantStore;
import bclift.fact.StringTable;
import bclift.fact.TypeTable;
import bclift.symbol.FormalInfo;
import bclift.symbol.GlobalSymbolTable;
import bclift.symbol.ParameterLocation;
import bclift.value.FunctionDictionary;

import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class FunctionLiftSerializerTest {
	private FunctionDictionary dictionary;
	private InvariantStore store;
	private GlobalSymbolTable globals;
	private FunctionLift lift;
	private int recordIndex;

	@BeforeEach
	public void setUp() {
		this.dictionary = new FunctionDictionary("f");
		this.store = mock(InvariantStore.class);

		var variables = this.dictionary.getVariableTable();
		variables.load(1, List.of("r", "R1"), List.of());
		variables.load(3, List.of("r", "R0"), List.of());
		var xprs = this.dictionary.getXprTable();
		xprs.load(5, List.of("v"), List.of(3));
		xprs.load(6, List.of("ic", "5"), List.of());
		xprs.load(9, List.of("ic", "1"), List.of());

		var def = new DataflowFact(DataflowFact.Kind.REACHING_DEF, "R0", List.of("0x100"));
		when(this.store.reachingDef(0)).thenReturn(Optional.of(def));

		var formal = new FormalInfo(0, "len", Nodes.intType(IKind.UINT), List.of(ParameterLocation.register("R2", 4)));
		var unit = new FunctionUnit("f", List.of(
			instruction("0x100", "ar:vx", 3, 6),
			instruction("0x104", "ar:vxr", 1, 5, 0),
			instruction("0x108", "nop"),
			instruction("0x10c", "subsumes"),
			instruction("0x110", "ar:vx", -2, 9)), List.of(formal));

		this.globals = new GlobalSymbolTable();
		this.lift = new FunctionLifter(this.globals, InstructionTranslator.assignments()).lift(unit);
	}

	private FunctionInstruction instruction(String address, String key, Integer... args) {
		var record = new FactRecord(this.recordIndex++, List.of(key), List.of(args));
		var facts = new InstrFacts(record, this.dictionary, mock(StringTable.class), mock(TypeTable.class), Optional.of(this.store));
		return new FunctionInstruction(address, "e3a00005", facts);
	}

	private FunctionLift reimport(FunctionLift lift) {
		return new FunctionLiftDeserializer(this.globals).deserialize(FunctionLiftSerializer.toJson(lift));
	}

	private static List<String> print(List<Instr> instrs) {
		return instrs.stream().map(CPrinter::instr).collect(Collectors.toList());
	}

	private static VarInfo assigned(Instr instr) {
		return ((VarHost) ((Assign) instr).getLval().getHost()).getVarInfo();
	}

	@Test
	public void bodiesReadBackWithFreshIds() {
		var imported = reimport(this.lift);

		assertEquals("f", imported.getName());
		assertEquals(print(this.lift.getLowBody().getInstrs()), print(imported.getLowBody().getInstrs()));
		assertEquals(print(this.lift.getHighBody().getInstrs()), print(imported.getHighBody().getInstrs()));
		assertNotEquals(this.lift.getHighBody().getId(), imported.getHighBody().getId());
		assertEquals(this.lift.getHighBody().getLocationId(), imported.getHighBody().getLocationId());
	}

	@Test
	public void provenanceRelatesImportedNodes() {
		var imported = reimport(this.lift);
		var provenance = imported.getProvenance();
		assertTrue(provenance.isFrozen());

		var low = imported.getLowBody().getInstrs();
		var high = imported.getHighBody().getInstrs();
		assertEquals(this.lift.getProvenance().getInstrMappingCount(), provenance.getInstrMappingCount());
		for (int i = 0; i < low.size(); ++i) {
			assertSame(high.get(i), provenance.highInstr(low.get(i)).orElseThrow());
			assertSame(low.get(i), provenance.lowInstr(high.get(i)).orElseThrow());
			assertEquals(this.lift.getProvenance().getAddresses(this.lift.getHighBody().getInstrs().get(i)),
				provenance.getAddresses(high.get(i)));
		}
		assertEquals(new Span("0x104", "e3a00005"), provenance.getSpan(low.get(1)).orElseThrow());

		var lowRhs = ((Assign) low.get(1)).getRhs();
		var highRhs = ((Assign) high.get(1)).getRhs();
		assertSame(highRhs, provenance.highExpr(lowRhs).orElseThrow());
		assertEquals(List.of("0x100"), provenance.getReachingDefs(highRhs).get(0).locations());
		assertSame(((Assign) high.get(1)).getLval(), provenance.highLval(((Assign) low.get(1)).getLval()).orElseThrow());
	}

	@Test
	public void symbolsReadBack() {
		var imported = reimport(this.lift);
		var locals = imported.getLocals();
		assertTrue(locals.isFrozen());

		var names = this.lift.getLocals().getLocals().stream().map(VarInfo::getName).collect(Collectors.toList());
		assertEquals(names, locals.getLocals().stream().map(VarInfo::getName).collect(Collectors.toList()));

		var formal = locals.getFormals().get(0);
		assertEquals("len", formal.getName());
		assertEquals(0, formal.getIndex());
		assertEquals(List.of(ParameterLocation.register("R2", 4)), formal.getLocations());
		assertSame(formal, locals.formalInRegister("R2").orElseThrow().formal());

		var r0 = assigned(imported.getHighBody().getInstrs().get(0));
		assertSame(r0, locals.ssaVarAt("R0", "0x100").orElseThrow());
		assertEquals(5, locals.ssaConstant(r0).getAsLong());
		assertEquals(this.lift.getLocals().getSsaCount(), locals.getSsaCount());
		assertThrows(LiftContractException.class, () -> locals.local("fresh"));
	}

	@Test
	public void diagnosticsReadBack() {
		var imported = reimport(this.lift);
		assertEquals(this.lift.getDiagnostics(), imported.getDiagnostics());
		assertEquals(this.lift.getDiagnosticCounts(), imported.getDiagnosticCounts());
		assertEquals(1, imported.getDiagnosticCount(Diagnostic.Kind.UNSUPPORTED_RECORD));
		assertTrue(imported.getProvenance().getDiagnostics().isFrozen());
	}

	@Test
	public void exportsAreStable() {
		var json = JsonParser.parseString(FunctionLiftSerializer.toJson(this.lift)).getAsJsonObject();
		var again = JsonParser.parseString(FunctionLiftSerializer.toJson(reimport(this.lift))).getAsJsonObject();

		assertEquals(json.getAsJsonArray("nodes").size(), again.getAsJsonArray("nodes").size());
		assertEquals(json.getAsJsonArray("diagnostics"), again.getAsJsonArray("diagnostics"));
		assertEquals(json.getAsJsonArray("ssa").size(), again.getAsJsonArray("ssa").size());
		var provenance = json.getAsJsonObject("provenance");
		var provenanceAgain = again.getAsJsonObject("provenance");
		for (var table : List.of("instrs", "exprs", "lvals", "facts", "spans", "addresses")) {
			assertEquals(provenance.getAsJsonArray(table).size(), provenanceAgain.getAsJsonArray(table).size(), table);
		}

		var twice = reimport(reimport(this.lift));
		assertEquals(print(this.lift.getHighBody().getInstrs()), print(twice.getHighBody().getInstrs()));
	}

	@Test
	public void malformedExportsAreRejected() {
		var deserializer = new FunctionLiftDeserializer(this.globals);
		assertThrows(JsonParseException.class, () -> deserializer.deserialize("[]"));
		assertThrows(JsonParseException.class, () -> deserializer.deserialize("{\"format\": 99}"));

		var json = JsonParser.parseString(FunctionLiftSerializer.toJson(this.lift)).getAsJsonObject();
		json.addProperty("high_body", json.get("low_body").getAsInt() + 100000);
		assertThrows(JsonParseException.class, () -> deserializer.deserialize(json));
	}
}
