package bclift.lift;

import static org.junit.jupiter.api.Assertions.*;

import bclift.LiftContractException;
import bclift.ast.Instr;
import bclift.ast.Nodes;
import bclift.ast.VarInfo;
import bclift.fact.DataflowFact;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;

public class ProvenanceTest {
	private static Instr assign(String name) {
		return Nodes.assign(1, Nodes.varLval(VarInfo.builder(name).build()), Nodes.intConstant(0));
	}

	@Test
	public void manyLowToOneHigh() {
		var provenance = new Provenance(new Diagnostics(), false);
		var low1 = assign("R0");
		var low2 = assign("R1");
		var high = assign("x");
		provenance.mapInstrs("0x100", low1, high);
		provenance.mapInstrs("0x100", low2, high);

		assertEquals(Optional.of(high), provenance.highInstr(low1));
		assertEquals(List.of(low1, low2), provenance.lowInstrs(high));
		assertEquals(Optional.of(low2), provenance.lowInstr(high));
	}

	@Test
	public void remappingOverwritesWithOneDiagnostic() {
		var diagnostics = new Diagnostics();
		var provenance = new Provenance(diagnostics, false);
		var low = assign("R0");
		var first = assign("x");
		var second = assign("y");

		provenance.mapInstrs("0x100", low, first);
		provenance.mapInstrs("0x100", low, first);
		assertEquals(0, diagnostics.size());

		provenance.mapInstrs("0x100", low, second);
		assertEquals(1, diagnostics.count(Diagnostic.Kind.PROVENANCE_OVERWRITE));
		assertEquals(1, diagnostics.size());
		assertEquals(Optional.of(second), provenance.highInstr(low));
		assertEquals(List.of(), provenance.lowInstrs(first));
	}

	@Test
	public void remappingIsFatalWhenStrict() {
		var provenance = new Provenance(new Diagnostics(), true);
		var low = assign("R0");
		provenance.mapInstrs("0x100", low, assign("x"));
		assertThrows(LiftContractException.class, () -> provenance.mapInstrs("0x100", low, assign("y")));
	}

	@Test
	public void snapshotsAreFrozen() {
		var provenance = new Provenance(new Diagnostics(), false);
		var low = Nodes.intConstant(1);
		var high = Nodes.intConstant(1);
		provenance.mapExprs("0x100", low, high);
		var fact = new DataflowFact(DataflowFact.Kind.REACHING_DEF, "R0", List.of("0x0fc"));
		provenance.addReachingDefs(high, List.of(fact));

		var snapshot = provenance.snapshot();
		assertTrue(snapshot.isFrozen());
		assertSame(snapshot, snapshot.snapshot());
		assertEquals(Optional.of(low), snapshot.lowExpr(high));
		assertEquals(List.of(fact), snapshot.getReachingDefs(high));
		assertThrows(LiftContractException.class, () -> snapshot.mapExprs("0x100", low, Nodes.intConstant(2)));

		// The live tables are unaffected by the snapshot
		provenance.addReachingDefs(high, List.of(fact));
		assertEquals(1, snapshot.getReachingDefs(high).size());
	}
}
