package bclift.lift;

import bclift.ast.AstSerializer;
import bclift.ast.VarInfo;
import bclift.fact.DataflowFact;
import bclift.symbol.ParameterLocation;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Sets;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exports a {@link FunctionLift} as JSON: both bodies, the function's symbols,
 * the provenance tables and the diagnostics.
 *
 * All nodes go into one flat {@code nodes} table first (see
 * {@link AstSerializer}); everything after it refers to nodes by id.
 *
 * @see FunctionLiftDeserializer
 */
public final class FunctionLiftSerializer {
	/** Bumped on incompatible changes to the layout. */
	static final int FORMAT_VERSION = 1;

	private final JsonWriter writer;

	public FunctionLiftSerializer(JsonWriter writer) {
		this.writer = writer;
	}

	/**
	 * @return The JSON export of a function lift.
	 */
	public static String toJson(FunctionLift lift) {
		var out = new StringWriter();
		try (var writer = new JsonWriter(out)) {
			writer.setIndent("  ");
			new FunctionLiftSerializer(writer).serialize(lift);
		} catch (IOException e) {
			// StringWriter does not throw
			throw new IllegalStateException(e);
		}
		return out.toString();
	}

	public void serialize(FunctionLift lift) throws IOException {
		var locals = lift.getLocals();
		var provenance = lift.getProvenance();

		this.writer.beginObject();
		this.writer.name("format").value(FORMAT_VERSION);
		this.writer.name("name").value(lift.getName());

		this.writer.name("nodes").beginArray();
		var nodes = new AstSerializer(this.writer);
		nodes.write(lift.getLowBody());
		nodes.write(lift.getHighBody());
		for (var varInfo : locals.getLocals()) {
			nodes.write(varInfo);
		}
		for (var slot : locals.getStackSlots().values()) {
			nodes.write(slot);
		}
		var provenanceNodes = provenance.getNodes();
		for (var id : new TreeSet<>(provenanceNodes.keySet())) {
			nodes.write(provenanceNodes.get(id));
		}
		this.writer.endArray();

		this.writer.name("low_body").value(lift.getLowBody().getId());
		this.writer.name("high_body").value(lift.getHighBody().getId());

		writeSymbols(lift);
		writeProvenance(provenance);
		writeDiagnostics(lift);
		this.writer.endObject();
	}

	private void writeSymbols(FunctionLift lift) throws IOException {
		var locals = lift.getLocals();
		Set<VarInfo> formals = Sets.newIdentityHashSet();

		this.writer.name("formals").beginArray();
		for (var formal : locals.getFormals()) {
			formals.add(formal.getVarInfo());
			this.writer.beginObject();
			this.writer.name("varinfo").value(formal.getVarInfo().getId());
			this.writer.name("locations").beginArray();
			for (var location : formal.getLocations()) {
				writeLocation(location);
			}
			this.writer.endArray();
			this.writer.endObject();
		}
		this.writer.endArray();

		this.writer.name("locals").beginArray();
		for (var varInfo : locals.getLocals()) {
			if (!formals.contains(varInfo)) {
				this.writer.value(varInfo.getId());
			}
		}
		this.writer.endArray();

		this.writer.name("stack_slots").beginArray();
		for (var entry : locals.getStackSlots().entrySet()) {
			this.writer.beginObject();
			this.writer.name("offset").value(entry.getKey());
			this.writer.name("lval").value(entry.getValue().getId());
			this.writer.endObject();
		}
		this.writer.endArray();

		this.writer.name("ssa").beginArray();
		for (var definition : locals.getSsaDefinitions()) {
			this.writer.beginObject();
			this.writer.name("register").value(definition.register());
			this.writer.name("site").value(definition.site());
			this.writer.name("varinfo").value(definition.varInfo().getId());
			this.writer.endObject();
		}
		this.writer.endArray();

		this.writer.name("ssa_constants").beginArray();
		for (var entry : locals.getSsaConstants().entrySet()) {
			this.writer.beginObject();
			this.writer.name("varinfo").value(entry.getKey().getId());
			this.writer.name("value").value(entry.getValue());
			this.writer.endObject();
		}
		this.writer.endArray();
	}

	private void writeLocation(ParameterLocation location) throws IOException {
		this.writer.beginObject();
		if (location instanceof ParameterLocation.Register r) {
			this.writer.name("register").value(r.register());
		} else {
			this.writer.name("stack_offset").value(((ParameterLocation.Stack) location).stackOffset());
		}
		this.writer.name("offset").value(location.offset());
		this.writer.name("size").value(location.size());
		this.writer.endObject();
	}

	private void writeProvenance(Provenance provenance) throws IOException {
		this.writer.name("provenance").beginObject();
		writeMapping("instrs", provenance.getInstrHighToLow());
		writeMapping("exprs", provenance.getExprHighToLow());
		writeMapping("lvals", provenance.getLvalHighToLow());

		this.writer.name("facts").beginArray();
		for (var kind : DataflowFact.Kind.values()) {
			var facts = provenance.getFacts(kind);
			for (var id : new TreeSet<>(facts.keySet())) {
				for (var fact : facts.get(id)) {
					this.writer.beginObject();
					this.writer.name("node").value(id);
					this.writer.name("kind").value(fact.kind().name());
					this.writer.name("variable").value(fact.variable());
					this.writer.name("locations").beginArray();
					for (var location : fact.locations()) {
						this.writer.value(location);
					}
					this.writer.endArray();
					this.writer.name("attached_as").value(kind.name());
					this.writer.endObject();
				}
			}
		}
		this.writer.endArray();

		this.writer.name("spans").beginArray();
		var spans = provenance.getSpans();
		for (var id : new TreeSet<>(spans.keySet())) {
			this.writer.beginObject();
			this.writer.name("instr").value(id);
			this.writer.name("address").value(spans.get(id).address());
			this.writer.name("bytes").value(spans.get(id).bytes());
			this.writer.endObject();
		}
		this.writer.endArray();

		this.writer.name("addresses").beginArray();
		var addresses = provenance.getAddresses();
		for (var id : new TreeSet<>(addresses.keySet())) {
			this.writer.beginObject();
			this.writer.name("instr").value(id);
			this.writer.name("addresses").beginArray();
			for (var address : addresses.get(id)) {
				this.writer.value(address);
			}
			this.writer.endArray();
			this.writer.endObject();
		}
		this.writer.endArray();
		this.writer.endObject();
	}

	private void writeMapping(String name, ImmutableListMultimap<Integer, Integer> highToLow) throws IOException {
		this.writer.name(name).beginArray();
		for (var high : new TreeSet<>(highToLow.keySet())) {
			this.writer.beginObject();
			this.writer.name("high").value(high);
			this.writer.name("lows").beginArray();
			for (var low : highToLow.get(high)) {
				this.writer.value(low);
			}
			this.writer.endArray();
			this.writer.endObject();
		}
		this.writer.endArray();
	}

	private void writeDiagnostics(FunctionLift lift) throws IOException {
		this.writer.name("diagnostics").beginArray();
		for (var diagnostic : lift.getDiagnostics()) {
			this.writer.beginObject();
			this.writer.name("site").value(diagnostic.site());
			this.writer.name("kind").value(diagnostic.kind().name());
			this.writer.name("message").value(diagnostic.message());
			this.writer.endObject();
		}
		this.writer.endArray();
	}
}
