package bclift.lift;

import bclift.ast.AstDeserializer;
import bclift.ast.Expr;
import bclift.ast.Instr;
import bclift.ast.InstrSequence;
import bclift.ast.Lval;
import bclift.ast.VarInfo;
import bclift.fact.DataflowFact;
import bclift.symbol.FormalInfo;
import bclift.symbol.GlobalSymbolTable;
import bclift.symbol.LocalSymbolTable;
import bclift.symbol.ParameterLocation;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Imports a function lift exported by {@link FunctionLiftSerializer}.
 *
 * The imported lift has fresh node ids but the same structure, symbols,
 * provenance and diagnostics as the exported one, and is frozen like any
 * finished lift.
 */
public final class FunctionLiftDeserializer {
	private final GlobalSymbolTable globals;

	/**
	 * @param globals
	 *         The globals the imported symbols resolve against.
	 */
	public FunctionLiftDeserializer(GlobalSymbolTable globals) {
		this.globals = globals;
	}

	/**
	 * @throws JsonParseException If the input is not a well-formed export.
	 */
	public FunctionLift deserialize(String json) {
		var element = JsonParser.parseString(json);
		if (!element.isJsonObject()) {
			throw new JsonParseException("Expected a function lift object");
		}
		return deserialize(element.getAsJsonObject());
	}

	public FunctionLift deserialize(JsonObject root) {
		int format = root.get("format").getAsInt();
		if (format != FunctionLiftSerializer.FORMAT_VERSION) {
			throw new JsonParseException("Unsupported export format " + format);
		}

		var name = root.get("name").getAsString();
		var nodes = new AstDeserializer(root.getAsJsonArray("nodes"));
		var lowBody = nodes.read(root.get("low_body").getAsInt(), InstrSequence.class);
		var highBody = nodes.read(root.get("high_body").getAsInt(), InstrSequence.class);

		var locals = readSymbols(root, nodes);

		var diagnostics = new Diagnostics();
		for (var entry : root.getAsJsonArray("diagnostics")) {
			var diagnostic = entry.getAsJsonObject();
			diagnostics.add(new Diagnostic(
				diagnostic.get("site").getAsString(),
				Diagnostic.Kind.valueOf(diagnostic.get("kind").getAsString()),
				diagnostic.get("message").getAsString()));
		}

		// Strict, since an export never holds a re-mapped node
		var provenance = new Provenance(diagnostics, true);
		readProvenance(root.getAsJsonObject("provenance"), nodes, provenance, name);

		return new FunctionLift(name, lowBody, highBody, locals, provenance,
			diagnostics.getAll(), diagnostics.getCounts());
	}

	private LocalSymbolTable readSymbols(JsonObject root, AstDeserializer nodes) {
		List<FormalInfo> formals = new ArrayList<>();
		for (var entry : root.getAsJsonArray("formals")) {
			var formal = entry.getAsJsonObject();
			List<ParameterLocation> locations = new ArrayList<>();
			for (var location : formal.getAsJsonArray("locations")) {
				locations.add(readLocation(location.getAsJsonObject()));
			}
			formals.add(new FormalInfo(nodes.read(formal.get("varinfo").getAsInt(), VarInfo.class), locations));
		}

		var locals = new LocalSymbolTable(this.globals, formals);
		for (var id : root.getAsJsonArray("locals")) {
			locals.declare(nodes.read(id.getAsInt(), VarInfo.class));
		}
		for (var entry : root.getAsJsonArray("stack_slots")) {
			var slot = entry.getAsJsonObject();
			locals.declareStackSlot(slot.get("offset").getAsLong(), nodes.read(slot.get("lval").getAsInt(), Lval.class));
		}
		for (var entry : root.getAsJsonArray("ssa")) {
			var ssa = entry.getAsJsonObject();
			locals.declareSsaVar(ssa.get("register").getAsString(), ssa.get("site").getAsString(),
				nodes.read(ssa.get("varinfo").getAsInt(), VarInfo.class));
		}
		for (var entry : root.getAsJsonArray("ssa_constants")) {
			var constant = entry.getAsJsonObject();
			locals.recordSsaConstant(nodes.read(constant.get("varinfo").getAsInt(), VarInfo.class),
				constant.get("value").getAsLong());
		}
		return locals;
	}

	private static ParameterLocation readLocation(JsonObject location) {
		int offset = location.get("offset").getAsInt();
		int size = location.get("size").getAsInt();
		if (location.has("register")) {
			return new ParameterLocation.Register(location.get("register").getAsString(), offset, size);
		} else if (location.has("stack_offset")) {
			return new ParameterLocation.Stack(location.get("stack_offset").getAsLong(), offset, size);
		}
		throw new JsonParseException("Parameter location without a register or stack offset");
	}

	private static void readProvenance(JsonObject object, AstDeserializer nodes, Provenance provenance, String site) {
		for (var mapping : mappings(object, "instrs")) {
			var high = nodes.read(mapping.high, Instr.class);
			for (int low : mapping.lows) {
				provenance.mapInstrs(site, nodes.read(low, Instr.class), high);
			}
		}
		for (var mapping : mappings(object, "exprs")) {
			var high = nodes.read(mapping.high, Expr.class);
			for (int low : mapping.lows) {
				provenance.mapExprs(site, nodes.read(low, Expr.class), high);
			}
		}
		for (var mapping : mappings(object, "lvals")) {
			var high = nodes.read(mapping.high, Lval.class);
			for (int low : mapping.lows) {
				provenance.mapLvals(site, nodes.read(low, Lval.class), high);
			}
		}

		for (var entry : object.getAsJsonArray("facts")) {
			var fact = entry.getAsJsonObject();
			int node = fact.get("node").getAsInt();
			var value = new DataflowFact(
				DataflowFact.Kind.valueOf(fact.get("kind").getAsString()),
				fact.get("variable").getAsString(),
				strings(fact.getAsJsonArray("locations")));
			switch (DataflowFact.Kind.valueOf(fact.get("attached_as").getAsString())) {
				case REACHING_DEF:
					provenance.addReachingDefs(nodes.read(node, Expr.class), List.of(value));
					break;
				case FLAG_REACHING_DEF:
					provenance.addFlagReachingDefs(nodes.read(node, Expr.class), List.of(value));
					break;
				case DEF_USE:
					provenance.addDefUses(nodes.read(node, Lval.class), List.of(value));
					break;
				case DEF_USE_HIGH:
					provenance.addDefUsesHigh(nodes.read(node, Lval.class), List.of(value));
					break;
			}
		}

		for (var entry : object.getAsJsonArray("spans")) {
			var span = entry.getAsJsonObject();
			provenance.recordSpan(nodes.read(span.get("instr").getAsInt(), Instr.class),
				new Span(span.get("address").getAsString(), span.get("bytes").getAsString()));
		}
		for (var entry : object.getAsJsonArray("addresses")) {
			var addresses = entry.getAsJsonObject();
			var instr = nodes.read(addresses.get("instr").getAsInt(), Instr.class);
			for (var address : strings(addresses.getAsJsonArray("addresses"))) {
				provenance.addAddress(instr, address);
			}
		}
	}

	private static final class Mapping {
		final int high;
		final List<Integer> lows = new ArrayList<>();

		Mapping(int high) {
			this.high = high;
		}
	}

	private static List<Mapping> mappings(JsonObject object, String name) {
		List<Mapping> result = new ArrayList<>();
		for (var entry : object.getAsJsonArray(name)) {
			var mapping = new Mapping(entry.getAsJsonObject().get("high").getAsInt());
			for (JsonElement low : entry.getAsJsonObject().getAsJsonArray("lows")) {
				mapping.lows.add(low.getAsInt());
			}
			result.add(mapping);
		}
		return result;
	}

	private static List<String> strings(JsonArray array) {
		List<String> result = new ArrayList<>();
		for (var element : array) {
			result.add(element.getAsString());
		}
		return result;
	}
}
