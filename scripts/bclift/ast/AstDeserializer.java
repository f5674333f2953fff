package bclift.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads a node table written by {@link AstSerializer}.
 *
 * Nodes are rebuilt with fresh ids; {@link #read} maps an id from the table
 * to its rebuilt node.  A node referenced from several places is rebuilt
 * once.
 */
public final class AstDeserializer {
	private final Map<Integer, JsonObject> table = new HashMap<>();
	private final Map<Integer, AstNode> nodes = new HashMap<>();

	public AstDeserializer(JsonArray table) {
		for (var element : table) {
			var object = element.getAsJsonObject();
			int id = object.get("id").getAsInt();
			if (this.table.put(id, object) != null) {
				throw new JsonParseException("Duplicate node id " + id);
			}
		}
	}

	/**
	 * @return The rebuilt node for an id of the table.
	 */
	public AstNode read(int id) {
		var node = this.nodes.get(id);
		if (node == null) {
			var object = this.table.get(id);
			if (object == null) {
				throw new JsonParseException("Unknown node id " + id);
			}
			node = build(object);
			this.nodes.put(id, node);
		}
		return node;
	}

	public <T extends AstNode> T read(int id, Class<T> type) {
		var node = read(id);
		if (!type.isInstance(node)) {
			throw new JsonParseException(String.format("Node %d is a %s, not a %s",
				id, node.getClass().getSimpleName(), type.getSimpleName()));
		}
		return type.cast(node);
	}

	private <T extends AstNode> T ref(JsonObject object, String name, Class<T> type) {
		var element = object.get(name);
		if (element == null) {
			throw new JsonParseException(String.format("Node %s has no %s", object.get("id"), name));
		}
		return read(element.getAsInt(), type);
	}

	private <T extends AstNode> Optional<T> optionalRef(JsonObject object, String name, Class<T> type) {
		return object.has(name) ? Optional.of(ref(object, name, type)) : Optional.empty();
	}

	private <T extends AstNode> List<T> refs(JsonObject object, String name, Class<T> type) {
		var result = new ArrayList<T>();
		for (var element : object.getAsJsonArray(name)) {
			result.add(read(element.getAsInt(), type));
		}
		return result;
	}

	private static List<String> strings(JsonObject object, String name) {
		var result = new ArrayList<String>();
		for (var element : object.getAsJsonArray(name)) {
			result.add(element.getAsString());
		}
		return result;
	}

	private static String string(JsonObject object, String name) {
		var element = object.get(name);
		if (element == null) {
			throw new JsonParseException(String.format("Node %s has no %s", object.get("id"), name));
		}
		return element.getAsString();
	}

	private static <E extends Enum<E>> E constant(JsonObject object, String name, Class<E> type) {
		var value = string(object, name);
		try {
			return Enum.valueOf(type, value);
		} catch (IllegalArgumentException e) {
			throw new JsonParseException(String.format("Unknown %s %s", type.getSimpleName(), value), e);
		}
	}

	private AstNode build(JsonObject o) {
		var kind = string(o, "kind");
		switch (kind) {
			case "void":
				return Nodes.voidType();
			case "int":
				return Nodes.intType(constant(o, "ikind", IKind.class));
			case "float":
				return Nodes.floatType(constant(o, "fkind", FKind.class));
			case "ptr":
				return Nodes.ptrType(ref(o, "target", Typ.class));
			case "array":
				return Nodes.arrayType(ref(o, "element", Typ.class), optionalRef(o, "size", Expr.class));
			case "fun":
				return buildFunType(o);
			case "named":
				return Nodes.namedType(string(o, "name"));
			case "comp":
				return Nodes.compType(string(o, "name"), o.get("key").getAsInt());
			case "enum":
				return Nodes.enumType(string(o, "name"), constant(o, "ikind", IKind.class));

			case "const":
				return Nodes.intConstant(o.get("value").getAsLong(), constant(o, "ikind", IKind.class));
			case "fconst":
				return Nodes.floatConstant(Double.parseDouble(string(o, "value")), constant(o, "fkind", FKind.class));
			case "gaconst":
				return Nodes.globalAddressConstant(o.get("value").getAsLong(), ref(o, "address_expr", Expr.class));
			case "string":
				var address = o.has("address") ? OptionalLong.of(o.get("address").getAsLong()) : OptionalLong.empty();
				return Nodes.stringConstant(string(o, "value"), address);
			case "lval_expr":
				return Nodes.lvalExpr(ref(o, "lval", Lval.class));
			case "sizeof":
				return Nodes.sizeOf(ref(o, "type", Typ.class));
			case "cast":
				return Nodes.cast(ref(o, "type", Typ.class), ref(o, "expr", Expr.class));
			case "unop":
				return Nodes.unary(constant(o, "op", UnOp.class), ref(o, "operand", Expr.class));
			case "binop":
				return Nodes.binary(constant(o, "op", BinOp.class), ref(o, "left", Expr.class), ref(o, "right", Expr.class));
			case "question":
				return Nodes.question(ref(o, "condition", Expr.class), ref(o, "then", Expr.class), ref(o, "otherwise", Expr.class));
			case "address_of":
				return Nodes.addressOf(ref(o, "lval", Lval.class));
			case "unresolved":
				return Nodes.unresolved(string(o, "description"));

			case "lval":
				return Nodes.lval(ref(o, "host", LHost.class), ref(o, "offset", Offset.class));
			case "var":
				return Nodes.varHost(ref(o, "varinfo", VarInfo.class));
			case "mem":
				return Nodes.memRef(ref(o, "address", Expr.class));

			case "no_offset":
				return Nodes.noOffset();
			case "field":
				return Nodes.fieldOffset(string(o, "name"), o.get("comp_key").getAsInt(), ref(o, "rest", Offset.class));
			case "index":
				return Nodes.indexOffset(ref(o, "index", Expr.class), ref(o, "rest", Offset.class));
			case "unresolved_offset":
				return Nodes.unresolvedOffset(string(o, "description"));

			case "assign":
				return Nodes.assign(location(o), ref(o, "lval", Lval.class), ref(o, "rhs", Expr.class));
			case "call":
				return Nodes.call(location(o), optionalRef(o, "lval", Lval.class), ref(o, "target", Expr.class), refs(o, "args", Expr.class));
			case "asm":
				return Nodes.asm(location(o), o.get("volatile").getAsBoolean(), strings(o, "templates"), strings(o, "clobbers"));
			case "nop":
				return Nodes.nop(location(o), string(o, "description"));

			case "return":
				return Nodes.returnStmt(location(o), labels(o), optionalRef(o, "value", Expr.class));
			case "break":
				return Nodes.breakStmt(location(o), labels(o));
			case "continue":
				return Nodes.continueStmt(location(o), labels(o));
			case "loop":
				return Nodes.loop(location(o), labels(o), ref(o, "body", Stmt.class));
			case "block":
				return Nodes.block(location(o), labels(o), refs(o, "stmts", Stmt.class));
			case "instrs":
				return Nodes.instrSequence(location(o), labels(o), refs(o, "instrs", Instr.class));
			case "branch":
				return Nodes.branch(location(o), labels(o), ref(o, "condition", Expr.class), ref(o, "then", Stmt.class), ref(o, "otherwise", Stmt.class));
			case "goto":
				return Nodes.gotoStmt(location(o), labels(o), string(o, "target"));
			case "computed_goto":
				return Nodes.computedGoto(location(o), labels(o), ref(o, "target", Expr.class));
			case "switch":
				return Nodes.switchStmt(location(o), labels(o), ref(o, "selector", Expr.class), ref(o, "body", Stmt.class));

			case "label":
				return Nodes.label(string(o, "name"));
			case "case":
				return Nodes.caseLabel(ref(o, "value", Expr.class));
			case "case_range":
				return Nodes.caseRangeLabel(ref(o, "low", Expr.class), ref(o, "high", Expr.class));
			case "default":
				return Nodes.defaultLabel();

			case "varinfo":
				return buildVarInfo(o);

			default:
				throw new JsonParseException(String.format("Node %s has unknown kind %s", o.get("id"), kind));
		}
	}

	private static int location(JsonObject object) {
		return object.get("location").getAsInt();
	}

	private List<StmtLabel> labels(JsonObject object) {
		return refs(object, "labels", StmtLabel.class);
	}

	private FunType buildFunType(JsonObject o) {
		var args = new ArrayList<FunArg>();
		for (JsonElement element : o.getAsJsonArray("args")) {
			var arg = element.getAsJsonObject();
			args.add(new FunArg(string(arg, "name"), ref(arg, "type", Typ.class)));
		}
		return Nodes.funType(ref(o, "return", Typ.class), args, o.get("varargs").getAsBoolean());
	}

	private VarInfo buildVarInfo(JsonObject o) {
		var builder = VarInfo.builder(string(o, "name"));
		optionalRef(o, "type", Typ.class).ifPresent(builder::type);
		if (o.has("parameter")) {
			builder.parameter(o.get("parameter").getAsInt());
		}
		if (o.has("global_address")) {
			builder.globalAddress(o.get("global_address").getAsLong());
		}
		if (o.has("description")) {
			builder.description(string(o, "description"));
		}
		if (o.get("placeholder").getAsBoolean()) {
			builder.placeholder();
		}
		return builder.build();
	}
}
