package bclift.fact;

import static org.junit.jupiter.api.Assertions.*;

import bclift.LiftContractException;

import org.junit.jupiter.api.*;

import java.util.Optional;

public class FactValueTest {
	@Test
	public void presentValuesMap() {
		var value = FactValue.of(20).map(x -> x + 1);
		assertTrue(value.isPresent());
		assertEquals(21, value.get());
		assertEquals(Optional.of(21), value.toOptional());
	}

	@Test
	public void errorIsDistinctFromMissing() {
		FactValue<Integer> error = FactValue.error();
		FactValue<Integer> missing = FactValue.missing();
		assertTrue(error.isError());
		assertFalse(error.isMissing());
		assertTrue(missing.isMissing());
		assertFalse(missing.isError());
		assertNotEquals(error, missing);
	}

	@Test
	public void errorPropagatesThroughMap() {
		FactValue<Integer> error = FactValue.error();
		assertTrue(error.map(x -> x * 2).isError());
		assertEquals(Optional.empty(), error.toOptional());
	}

	@Test
	public void getOnErrorThrows() {
		FactValue<String> error = FactValue.error();
		assertThrows(LiftContractException.class, error::get);
	}

	@Test
	public void errorSentinels() {
		for (var field : FactField.values()) {
			assertEquals(-2, field.getErrorSentinel());
			assertTrue(field.isError(-2));
			assertFalse(field.isError(0));
		}
	}
}
