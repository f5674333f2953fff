package bclift.fact;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import java.util.List;

public class IndexedTableTest {
	@Test
	public void addDeduplicates() {
		var table = new IndexedTable("test");
		int a = table.add(List.of("r", "R0"), List.of());
		int b = table.add(List.of("r", "R1"), List.of());
		int c = table.add(List.of("r", "R0"), List.of());
		assertEquals(a, c);
		assertNotEquals(a, b);
		assertEquals(2, table.size());
	}

	@Test
	public void retrieveReturnsTheInternedRecord() {
		var table = new IndexedTable("test");
		int i = table.add(List.of("x", "plus"), List.of(1, 2));
		var record = table.retrieve(i);
		assertEquals(i, record.getIndex());
		assertEquals("x", record.getKey());
		assertEquals("plus", record.getTag(1));
		assertEquals(List.of(1, 2), record.getArgs());
	}

	@Test
	public void retrieveMissingIndexThrows() {
		var table = new IndexedTable("test");
		assertThrows(IndexedTableException.class, () -> table.retrieve(42));
	}

	@Test
	public void loadKeepsExplicitIndices() {
		var table = new IndexedTable("test");
		table.load(7, List.of("ic", "4"), List.of());
		assertTrue(table.contains(7));
		assertEquals("4", table.retrieve(7).getTag(1));

		// Same content again is fine
		table.load(7, List.of("ic", "4"), List.of());
		assertThrows(IndexedTableException.class, () -> table.load(7, List.of("ic", "5"), List.of()));

		int next = table.add(List.of("ic", "6"), List.of());
		assertNotEquals(7, next);
	}

	@Test
	public void valuesAreInIndexOrder() {
		var table = new IndexedTable("test");
		table.load(5, List.of("b"), List.of());
		table.load(2, List.of("a"), List.of());
		var values = table.values();
		assertEquals(2, values.get(0).getIndex());
		assertEquals(5, values.get(1).getIndex());
	}

	@Test
	public void missingTagThrows() {
		var record = new FactRecord(1, List.of("v"), List.of());
		assertThrows(FactDecodeException.class, () -> record.getTag(3));
		assertThrows(FactDecodeException.class, () -> record.getArg(0));
	}
}
