package bclift.lift;

import bclift.ast.Instr;
import bclift.fact.DecodedFacts;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Architecture-specific translation of one instruction's facts into
 * low- and high-level instructions, through the lifting engine.
 */
@FunctionalInterface
public interface InstructionTranslator {
	/**
	 * Translate an instruction.  Implementations pair the instructions they
	 * build through {@link LiftEngine#pairInstrs}.
	 */
	Translation translate(FunctionInstruction instruction, LiftEngine engine);

	/**
	 * The instructions produced for one machine instruction.
	 */
	record Translation(List<Instr> low, List<Instr> high) {
		public Translation {
			low = ImmutableList.copyOf(low);
			high = ImmutableList.copyOf(high);
		}

		public static Translation empty() {
			return new Translation(List.of(), List.of());
		}

		/**
		 * @return A translation of the given instruction pairs.
		 */
		public static Translation of(List<LiftEngine.InstrPair> pairs) {
			List<Instr> low = new ArrayList<>();
			List<Instr> high = new ArrayList<>();
			for (var pair : pairs) {
				low.add(pair.low());
				high.add(pair.high());
			}
			return new Translation(low, high);
		}
	}

	/**
	 * A translator for move-like instructions: each result variable is
	 * assigned the result expression at the same position.  Instructions with
	 * no such pair are kept {@link #opaque()}.
	 */
	static InstructionTranslator assignments() {
		var fallback = opaque();
		return (instruction, engine) -> {
			var facts = instruction.facts();
			int count;
			if (facts.getForm() == DecodedFacts.Form.RESULT) {
				count = Math.min(facts.getVarsResult().size(), facts.getXprsResult().size());
			} else {
				count = Math.min(facts.getVars().size(), facts.getXprs().size());
			}
			if (count == 0) {
				return fallback.translate(instruction, engine);
			}

			List<LiftEngine.InstrPair> pairs = new ArrayList<>();
			for (int i = 0; i < count; ++i) {
				pairs.add(engine.liftAssignment(facts, i, i, instruction.address()));
			}
			return Translation.of(pairs);
		};
	}

	/**
	 * A translator for instructions without modelled semantics: each becomes
	 * a volatile inline-assembly statement holding its bytes, at both levels.
	 */
	static InstructionTranslator opaque() {
		return (instruction, engine) -> {
			var site = instruction.address();
			var builder = engine.getBuilder();
			var templates = List.of(".inst 0x" + instruction.bytes());
			var low = builder.mkAsm(site, true, templates, List.of());
			var high = builder.mkAsm(site, true, templates, List.of());
			engine.pairInstrs(site, low, high);
			return new Translation(List.of(low), List.of(high));
		};
	}
}
