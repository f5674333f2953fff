package bclift.fact;

import bclift.LiftContractException;
import bclift.util.Log;
import bclift.value.FunctionDictionary;
import bclift.value.XVariable;
import bclift.value.XXpr;

import java.util.Optional;

/**
 * Walks a per-instruction record's key letters against its arguments.
 */
final class TaggedArgDecoder {
	private static final String PLAIN_PREFIX = "a:";
	private static final String RESULT_PREFIX = "ar:";

	private final FactRecord record;
	private final FunctionDictionary dictionary;
	private final StringTable strings;
	private final TypeTable types;
	private final Optional<InvariantStore> store;

	TaggedArgDecoder(FactRecord record, FunctionDictionary dictionary, StringTable strings, TypeTable types, Optional<InvariantStore> store) {
		this.record = record;
		this.dictionary = dictionary;
		this.strings = strings;
		this.types = types;
		this.store = store;
	}

	/**
	 * @return The form of a record key, without decoding anything.
	 * @throws FactDecodeException If the key has none of the known forms.
	 */
	static DecodedFacts.Form formOf(FactRecord record) {
		var key = record.getKey();
		if (key.equals("nop")) {
			return DecodedFacts.Form.NOP;
		} else if (key.equals("subsumes")) {
			return DecodedFacts.Form.SUBSUMES;
		} else if (key.startsWith(RESULT_PREFIX)) {
			return DecodedFacts.Form.RESULT;
		} else if (key.startsWith(PLAIN_PREFIX)) {
			return DecodedFacts.Form.PLAIN;
		} else {
			throw new FactDecodeException(record.getIndex(), "Unknown record key '%s'", key);
		}
	}

	DecodedFacts decode() {
		var form = formOf(this.record);
		var builder = DecodedFacts.builder(form);

		switch (form) {
			case NOP:
				return builder.build();
			case SUBSUMES:
				Log.debug("Unsupported subsumes record %s", this.record);
				return builder.build();
			default:
				break;
		}

		var key = this.record.getKey();
		var letters = key.substring(form == DecodedFacts.Form.RESULT ? RESULT_PREFIX.length() : PLAIN_PREFIX.length());
		var args = this.record.getArgs();
		if (letters.length() != args.size()) {
			throw new FactDecodeException(this.record.getIndex(),
				"Key '%s' has %d letters but the record has %d arguments", key, letters.length(), args.size());
		}

		boolean result = form == DecodedFacts.Form.RESULT;
		for (int i = 0; i < letters.length(); ++i) {
			char code = letters.charAt(i);
			var letter = KeyLetter.lookup(code)
				.orElseThrow(() -> new FactDecodeException(this.record.getIndex(), "Unknown key letter '%c' in '%s'", code, key));
			consume(letter, args.get(i), result, builder);
		}

		if (result) {
			checkCommitted(builder);
		}
		return builder.build();
	}

	private void consume(KeyLetter letter, int arg, boolean result, DecodedFacts.Builder builder) {
		switch (letter) {
			case VAR:
				(result ? builder.varsResult : builder.vars).add(variable(FactField.VAR, arg));
				break;
			case COMMITTED_VAR:
				builder.committedVars.add(variable(FactField.COMMITTED_VAR, arg));
				break;
			case XPR:
				(result ? builder.xprsResult : builder.xprs).add(xpr(FactField.XPR, arg));
				break;
			case COMMITTED_XPR:
				builder.committedXprs.add(xpr(FactField.COMMITTED_XPR, arg));
				break;
			case AGGREGATE_XPR:
				builder.xprs.add(xpr(FactField.XPR, arg));
				break;
			case STRING:
				builder.strings.add(this.strings.string(arg));
				break;
			case INTERVAL:
				builder.intervals.add(this.dictionary.interval(arg));
				break;
			case INT:
				builder.ints.add(arg);
				break;
			case TYPE:
				builder.types.add(this.types.type(arg));
				break;
			case REACHING_DEF:
				builder.reachingDefs.add(arg < 0 ? Optional.empty() : store().reachingDef(arg));
				break;
			case DEF_USE:
				builder.defUses.add(arg < 0 ? Optional.empty() : store().defUse(arg));
				break;
			case DEF_USE_HIGH:
				builder.defUsesHigh.add(arg > 0 ? store().defUseHigh(arg) : Optional.empty());
				break;
			case FLAG_REACHING_DEF:
				builder.flagReachingDefs.add(arg < 0 ? Optional.empty() : store().flagReachingDef(arg));
				break;
		}
	}

	private FactValue<XVariable> variable(FactField field, int arg) {
		if (field.isError(arg)) {
			return FactValue.error();
		}
		return FactValue.of(this.dictionary.variable(arg));
	}

	private FactValue<XXpr> xpr(FactField field, int arg) {
		if (field.isError(arg)) {
			return FactValue.error();
		}
		return FactValue.of(this.dictionary.xpr(arg));
	}

	private InvariantStore store() {
		return this.store.orElseThrow(() -> new FactDecodeException(this.record.getIndex(),
			"Record %s requests dataflow facts, but there is no invariant store", this.record));
	}

	/**
	 * Committed variants shadow their results one for one.
	 */
	private void checkCommitted(DecodedFacts.Builder builder) {
		if (!builder.committedXprs.isEmpty() && builder.committedXprs.size() != builder.xprsResult.size()) {
			throw new LiftContractException("Record %s has %d committed expressions for %d results",
				this.record, builder.committedXprs.size(), builder.xprsResult.size());
		}
		if (!builder.committedVars.isEmpty() && builder.committedVars.size() != builder.varsResult.size()) {
			throw new LiftContractException("Record %s has %d committed variables for %d results",
				this.record, builder.committedVars.size(), builder.varsResult.size());
		}
	}
}
