package bclift.lift;

import bclift.ast.InstrSequence;
import bclift.symbol.LocalSymbolTable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * The result of lifting one function: both instruction sequences, the
 * function's symbols, frozen provenance and the diagnostics raised.
 */
public final class FunctionLift {
	private final String name;
	private final InstrSequence lowBody;
	private final InstrSequence highBody;
	private final LocalSymbolTable locals;
	private final Provenance provenance;
	private final ImmutableList<Diagnostic> diagnostics;
	private final ImmutableMap<Diagnostic.Kind, Long> diagnosticCounts;

	FunctionLift(String name, InstrSequence lowBody, InstrSequence highBody, LocalSymbolTable locals,
			Provenance provenance, List<Diagnostic> diagnostics, Map<Diagnostic.Kind, Long> diagnosticCounts) {
		this.name = name;
		this.lowBody = lowBody;
		this.highBody = highBody;
		this.locals = locals.snapshot();
		this.provenance = provenance.snapshot();
		this.diagnostics = ImmutableList.copyOf(diagnostics);
		this.diagnosticCounts = ImmutableMap.copyOf(diagnosticCounts);
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The machine-level instructions.
	 */
	public InstrSequence getLowBody() {
		return this.lowBody;
	}

	/**
	 * @return The source-level instructions.
	 */
	public InstrSequence getHighBody() {
		return this.highBody;
	}

	/**
	 * @return The function's symbols, frozen.
	 */
	public LocalSymbolTable getLocals() {
		return this.locals;
	}

	/**
	 * @return The provenance maps, frozen.
	 */
	public Provenance getProvenance() {
		return this.provenance;
	}

	public ImmutableList<Diagnostic> getDiagnostics() {
		return this.diagnostics;
	}

	public long getDiagnosticCount(Diagnostic.Kind kind) {
		return this.diagnosticCounts.getOrDefault(kind, 0L);
	}

	public ImmutableMap<Diagnostic.Kind, Long> getDiagnosticCounts() {
		return this.diagnosticCounts;
	}

	@Override
	public String toString() {
		return this.name + "()";
	}
}
