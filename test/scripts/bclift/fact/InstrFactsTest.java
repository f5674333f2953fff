package bclift.fact;

import static org.mockito.Mockito.*;
import static org.junit.jupiter.api.Assertions.*;

import bclift.LiftContractException;
import bclift.value.FunctionDictionary;
import bclift.value.XVariable;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;

public class InstrFactsTest {
	private FunctionDictionary dictionary;
	private StringTable strings;
	private TypeTable types;
	private InvariantStore store;

	@BeforeEach
	public void setUp() {
		this.dictionary = new FunctionDictionary("f");
		this.strings = mock(StringTable.class);
		this.types = mock(TypeTable.class);
		this.store = mock(InvariantStore.class);

		// R0 at 3, R1 at 1; xpr 7 is R1 + 4
		var variables = this.dictionary.getVariableTable();
		variables.load(1, List.of("r", "R1"), List.of());
		variables.load(3, List.of("r", "R0"), List.of());
		var xprs = this.dictionary.getXprTable();
		xprs.load(5, List.of("v"), List.of(1));
		xprs.load(6, List.of("ic", "4"), List.of());
		xprs.load(7, List.of("x", "plus"), List.of(5, 6));
		xprs.load(9, List.of("ic", "1"), List.of());
	}

	private InstrFacts facts(String key, Integer... args) {
		var record = new FactRecord(100, List.of(key), List.of(args));
		return new InstrFacts(record, this.dictionary, this.strings, this.types, Optional.of(this.store));
	}

	@Test
	public void plainRecordDecodesOperands() {
		var facts = facts("a:vx", 3, 7);

		assertEquals(DecodedFacts.Form.PLAIN, facts.getForm());
		assertTrue(facts.isOk());
		var variable = facts.var(0).orElseThrow();
		assertInstanceOf(XVariable.Register.class, variable);
		assertEquals("R0", variable.toString());
		assertEquals(3, variable.getSeq());
		assertEquals("(R1 + 4)", facts.xpr(0).orElseThrow().toString());

		verifyNoInteractions(this.store);
	}

	@Test
	public void errorValuedResultIsNotOk() {
		var facts = facts("ar:vx", -2, 9);

		assertEquals(DecodedFacts.Form.RESULT, facts.getForm());
		assertFalse(facts.isOk());
		assertEquals(new ErrorPositions(List.of(0), List.of(), List.of()), facts.getErrorPositions());
		assertTrue(facts.getVarsResult().get(0).isError());
		assertEquals(Optional.empty(), facts.varResult(0));
		assertEquals(1L, facts.xprResult(0).orElseThrow().evaluate().getAsLong());
	}

	@Test
	public void decodingIsLazyAndCached() {
		var facts = facts("a:vx", 3, 7);
		assertFalse(facts.isDecoded());
		assertFalse(facts.isNop());
		assertFalse(facts.isDecoded());

		var first = facts.decoded();
		assertTrue(facts.isDecoded());
		assertSame(first, facts.decoded());
		assertEquals(first, facts("a:vx", 3, 7).decoded());
	}

	@Test
	public void nopAndSubsumesDecodeToNothing() {
		var nop = facts("nop");
		assertTrue(nop.isNop());
		assertTrue(nop.isOk());
		assertTrue(nop.getVars().isEmpty());

		var subsumes = facts("subsumes");
		assertTrue(subsumes.isSubsumes());
		assertTrue(subsumes.getXprs().isEmpty());
	}

	@Test
	public void unknownLetterThrows() {
		var facts = facts("a:vq", 3, 7);
		var e = assertThrows(FactDecodeException.class, facts::decoded);
		assertEquals(100, e.getRecordIndex());

		// The failure is kept, not decoded again
		assertSame(e, assertThrows(FactDecodeException.class, facts::getVars));
		assertFalse(facts.isDecoded());
	}

	@Test
	public void unknownKeyThrows() {
		assertThrows(FactDecodeException.class, () -> facts("b:vx", 3, 7).getForm());
	}

	@Test
	public void letterCountMustMatchArgs() {
		assertThrows(FactDecodeException.class, () -> facts("a:vxx", 3, 7).decoded());
	}

	@Test
	public void committedCountMustMatchResults() {
		var facts = facts("ar:xxc", 7, 9, 7);
		assertThrows(LiftContractException.class, facts::decoded);

		var matched = facts("ar:xc", 9, 7);
		assertTrue(matched.isOk());
		assertEquals("(R1 + 4)", matched.committedXpr(0).orElseThrow().toString());
	}

	@Test
	public void positionOutOfBoundsThrows() {
		var facts = facts("a:vx", 3, 7);
		assertThrows(LiftContractException.class, () -> facts.var(1));
	}

	@Test
	public void dataflowLettersQueryTheStore() {
		var def = new DataflowFact(DataflowFact.Kind.REACHING_DEF, "R0", List.of("0x100", "0x108"));
		when(this.store.reachingDef(4)).thenReturn(Optional.of(def));

		var facts = facts("a:xrrh", 7, 4, -1, 0);
		assertEquals(List.of(Optional.of(def), Optional.empty()), facts.getReachingDefs());
		assertEquals(List.of(Optional.empty()), facts.getDefUsesHigh());
		assertEquals(List.of("0x100", "0x108"), facts.reachingDefLocations("R0"));
		assertEquals(List.of(), facts.reachingDefLocations("R1"));

		verify(this.store).reachingDef(4);
		verifyNoMoreInteractions(this.store);
	}

	@Test
	public void dataflowLettersNeedAStore() {
		var record = new FactRecord(100, List.of("a:r"), List.of(4));
		var facts = new InstrFacts(record, this.dictionary, this.strings, this.types, Optional.empty());
		assertThrows(FactDecodeException.class, facts::decoded);
	}

	@Test
	public void stringsAndIntsAreCollected() {
		when(this.strings.string(2)).thenReturn("hello");
		var facts = facts("a:sl", 2, 42);
		assertEquals(List.of("hello"), facts.getStrings());
		assertEquals(List.of(42), facts.getInts());
	}

	@Test
	public void opcodeContractIsChecked() {
		var contract = new OpcodeContract("MOV", 2, 3);
		var good = new FactRecord(1, List.of("MOV", "c"), List.of(0, 1, 2));
		assertEquals("MOV", OpcodeRecord.of(contract, good).getMnemonic());
		assertEquals(2, OpcodeRecord.of(contract, good).getArg(2));

		var bad = new FactRecord(2, List.of("MOV"), List.of(0, 1, 2));
		var e = assertThrows(FactDecodeException.class, () -> OpcodeRecord.of(contract, bad));
		assertEquals(2, e.getRecordIndex());
	}
}
