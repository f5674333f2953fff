package bclift.lift;

import bclift.ast.Instr;
import bclift.symbol.GlobalSymbolTable;
import bclift.symbol.LocalSymbolTable;
import bclift.util.Log;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts one function at a time, instruction by instruction.
 */
public final class FunctionLifter {
	private final GlobalSymbolTable globals;
	private final InstructionTranslator translator;

	public FunctionLifter(GlobalSymbolTable globals, InstructionTranslator translator) {
		this.globals = globals;
		this.translator = translator;
	}

	public GlobalSymbolTable getGlobals() {
		return this.globals;
	}

	/**
	 * Lift a function.
	 *
	 * @throws bclift.fact.FactDecodeException If a fact record cannot be decoded.
	 * @throws bclift.LiftContractException If a record breaks the fact contract.
	 */
	public FunctionLift lift(FunctionUnit unit) {
		var locals = new LocalSymbolTable(this.globals, unit.getFormals());
		var builder = new AstBuilder(unit.getName(), this.globals, locals);
		var engine = new LiftEngine(builder, unit.getStackPointer());
		var diagnostics = builder.getDiagnostics();

		List<Instr> low = new ArrayList<>();
		List<Instr> high = new ArrayList<>();
		for (var instruction : unit.getInstructions()) {
			var site = instruction.address();
			var facts = instruction.facts();

			InstructionTranslator.Translation translation;
			if (facts.isNop()) {
				var lowNop = builder.mkNop(site, "nop");
				var highNop = builder.mkNop(site, "nop");
				engine.pairInstrs(site, lowNop, highNop);
				translation = new InstructionTranslator.Translation(List.of(lowNop), List.of(highNop));
			} else if (facts.isSubsumes()) {
				diagnostics.report(site, Diagnostic.Kind.UNSUPPORTED_RECORD, "subsumed instruction %s", facts);
				continue;
			} else if (!facts.isOk()) {
				diagnostics.report(site, Diagnostic.Kind.RESOLUTION_GAP, "error values at %s in %s",
					facts.getErrorPositions(), facts);
				var lowNop = builder.mkNop(site, "error value");
				var highNop = builder.mkNop(site, "error value");
				engine.pairInstrs(site, lowNop, highNop);
				translation = new InstructionTranslator.Translation(List.of(lowNop), List.of(highNop));
			} else {
				translation = this.translator.translate(instruction, engine);
			}

			var span = instruction.span();
			for (var instr : translation.low()) {
				builder.recordSpan(instr, span);
				builder.getProvenance().addAddress(instr, site);
			}
			for (var instr : translation.high()) {
				builder.getProvenance().addAddress(instr, site);
			}
			low.addAll(translation.low());
			high.addAll(translation.high());
		}

		var lowBody = builder.mkInstrSequence(low, List.of());
		var highBody = builder.mkInstrSequence(high, List.of());
		Log.debug("%s: lifted %,d instructions, %,d diagnostics", unit, unit.getInstructions().size(), diagnostics.size());

		return new FunctionLift(unit.getName(), lowBody, highBody, locals.snapshot(),
			builder.getProvenance().snapshot(), diagnostics.getAll(), diagnostics.getCounts());
	}
}
