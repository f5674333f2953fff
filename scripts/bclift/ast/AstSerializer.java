package bclift.ast;

import bclift.LiftContractException;

import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes AST nodes as a flat JSON table.
 *
 * Each node is written once, as an object with its {@code id}, its
 * {@code kind} and its fields.  Child nodes are referenced by id and are
 * written before their parents, so a table can be read back in one pass and
 * shared subtrees stay shared.
 *
 * @see AstDeserializer
 */
public final class AstSerializer {
	private final JsonWriter writer;
	private final Set<Integer> written = new HashSet<>();

	/**
	 * @param writer
	 *         A writer positioned inside an open array.
	 */
	public AstSerializer(JsonWriter writer) {
		this.writer = writer;
	}

	/**
	 * @return Whether a node has already been written.
	 */
	public boolean isWritten(AstNode node) {
		return this.written.contains(node.getId());
	}

	/**
	 * Write a node and everything it references that is not written yet.
	 *
	 * @return The node's id.
	 */
	public int write(AstNode node) throws IOException {
		if (!this.written.add(node.getId())) {
			return node.getId();
		}

		if (node instanceof Typ t) {
			writeType(t);
		} else if (node instanceof Expr e) {
			writeExpr(e);
		} else if (node instanceof Lval l) {
			writeLval(l);
		} else if (node instanceof LHost h) {
			writeHost(h);
		} else if (node instanceof Offset o) {
			writeOffset(o);
		} else if (node instanceof Instr i) {
			writeInstr(i);
		} else if (node instanceof Stmt s) {
			writeStmt(s);
		} else if (node instanceof StmtLabel l) {
			writeLabel(l);
		} else if (node instanceof VarInfo v) {
			writeVarInfo(v);
		} else {
			throw new LiftContractException("Cannot serialize %s", node.getClass().getSimpleName());
		}
		return node.getId();
	}

	private JsonWriter begin(AstNode node, String kind) throws IOException {
		this.writer.beginObject();
		this.writer.name("id").value(node.getId());
		this.writer.name("kind").value(kind);
		return this.writer;
	}

	private int[] writeAll(List<? extends AstNode> nodes) throws IOException {
		int[] ids = new int[nodes.size()];
		for (int i = 0; i < ids.length; ++i) {
			ids[i] = write(nodes.get(i));
		}
		return ids;
	}

	private void refs(String name, int[] ids) throws IOException {
		this.writer.name(name).beginArray();
		for (int id : ids) {
			this.writer.value(id);
		}
		this.writer.endArray();
	}

	private void strings(String name, List<String> values) throws IOException {
		this.writer.name(name).beginArray();
		for (var value : values) {
			this.writer.value(value);
		}
		this.writer.endArray();
	}

	private void writeType(Typ type) throws IOException {
		if (type instanceof VoidType) {
			begin(type, "void");
		} else if (type instanceof IntType t) {
			begin(type, "int").name("ikind").value(t.getKind().name());
		} else if (type instanceof FloatType t) {
			begin(type, "float").name("fkind").value(t.getKind().name());
		} else if (type instanceof PtrType t) {
			int target = write(t.getTarget());
			begin(type, "ptr").name("target").value(target);
		} else if (type instanceof ArrayType t) {
			int element = write(t.getElement());
			Integer size = t.getSize().isPresent() ? write(t.getSize().get()) : null;
			begin(type, "array").name("element").value(element);
			if (size != null) {
				this.writer.name("size").value(size);
			}
		} else if (type instanceof FunType t) {
			int returnType = write(t.getReturnType());
			int[] argTypes = new int[t.getArgs().size()];
			for (int i = 0; i < argTypes.length; ++i) {
				argTypes[i] = write(t.getArgs().get(i).type());
			}
			begin(type, "fun").name("return").value(returnType);
			this.writer.name("args").beginArray();
			for (int i = 0; i < argTypes.length; ++i) {
				this.writer.beginObject();
				this.writer.name("name").value(t.getArgs().get(i).name());
				this.writer.name("type").value(argTypes[i]);
				this.writer.endObject();
			}
			this.writer.endArray();
			this.writer.name("varargs").value(t.isVarArgs());
		} else if (type instanceof NamedType t) {
			begin(type, "named").name("name").value(t.getName());
		} else if (type instanceof CompType t) {
			begin(type, "comp").name("name").value(t.getName());
			this.writer.name("key").value(t.getKey());
		} else if (type instanceof EnumType t) {
			begin(type, "enum").name("name").value(t.getName());
			this.writer.name("ikind").value(t.getKind().name());
		} else {
			throw new LiftContractException("Cannot serialize type %s", type.getClass().getSimpleName());
		}
		this.writer.endObject();
	}

	private void writeExpr(Expr expr) throws IOException {
		if (expr instanceof IntConstant c) {
			begin(expr, "const").name("value").value(c.getValue());
			this.writer.name("ikind").value(c.getKind().name());
		} else if (expr instanceof FloatConstant c) {
			// As a string, so that NaN and infinities survive
			begin(expr, "fconst").name("value").value(Double.toString(c.getValue()));
			this.writer.name("fkind").value(c.getKind().name());
		} else if (expr instanceof GlobalAddressConstant c) {
			int address = write(c.getAddressExpr());
			begin(expr, "gaconst").name("value").value(c.getValue());
			this.writer.name("address_expr").value(address);
		} else if (expr instanceof StringConstant c) {
			begin(expr, "string").name("value").value(c.getValue());
			if (c.getAddress().isPresent()) {
				this.writer.name("address").value(c.getAddress().getAsLong());
			}
		} else if (expr instanceof LvalExpr e) {
			int lval = write(e.getLval());
			begin(expr, "lval_expr").name("lval").value(lval);
		} else if (expr instanceof SizeOf e) {
			int type = write(e.getType());
			begin(expr, "sizeof").name("type").value(type);
		} else if (expr instanceof CastExpr e) {
			int type = write(e.getType());
			int operand = write(e.getExpr());
			begin(expr, "cast").name("type").value(type);
			this.writer.name("expr").value(operand);
		} else if (expr instanceof UnaryOp e) {
			int operand = write(e.getOperand());
			begin(expr, "unop").name("op").value(e.getOp().name());
			this.writer.name("operand").value(operand);
		} else if (expr instanceof BinaryOp e) {
			int left = write(e.getLeft());
			int right = write(e.getRight());
			begin(expr, "binop").name("op").value(e.getOp().name());
			this.writer.name("left").value(left);
			this.writer.name("right").value(right);
		} else if (expr instanceof Question e) {
			int condition = write(e.getCondition());
			int then = write(e.getThen());
			int otherwise = write(e.getOtherwise());
			begin(expr, "question").name("condition").value(condition);
			this.writer.name("then").value(then);
			this.writer.name("otherwise").value(otherwise);
		} else if (expr instanceof AddressOf e) {
			int lval = write(e.getLval());
			begin(expr, "address_of").name("lval").value(lval);
		} else if (expr instanceof Unresolved e) {
			begin(expr, "unresolved").name("description").value(e.getDescription());
		} else {
			throw new LiftContractException("Cannot serialize expression %s", expr.getClass().getSimpleName());
		}
		this.writer.endObject();
	}

	private void writeLval(Lval lval) throws IOException {
		int host = write(lval.getHost());
		int offset = write(lval.getOffset());
		begin(lval, "lval").name("host").value(host);
		this.writer.name("offset").value(offset);
		this.writer.endObject();
	}

	private void writeHost(LHost host) throws IOException {
		if (host instanceof VarHost h) {
			int varInfo = write(h.getVarInfo());
			begin(host, "var").name("varinfo").value(varInfo);
		} else {
			int address = write(((MemRef) host).getAddress());
			begin(host, "mem").name("address").value(address);
		}
		this.writer.endObject();
	}

	private void writeOffset(Offset offset) throws IOException {
		if (offset instanceof NoOffset) {
			begin(offset, "no_offset");
		} else if (offset instanceof FieldOffset o) {
			int rest = write(o.getRest());
			begin(offset, "field").name("name").value(o.getName());
			this.writer.name("comp_key").value(o.getCompKey());
			this.writer.name("rest").value(rest);
		} else if (offset instanceof IndexOffset o) {
			int index = write(o.getIndex());
			int rest = write(o.getRest());
			begin(offset, "index").name("index").value(index);
			this.writer.name("rest").value(rest);
		} else {
			begin(offset, "unresolved_offset").name("description").value(((UnresolvedOffset) offset).getDescription());
		}
		this.writer.endObject();
	}

	private void writeInstr(Instr instr) throws IOException {
		if (instr instanceof Assign a) {
			int lval = write(a.getLval());
			int rhs = write(a.getRhs());
			begin(instr, "assign").name("location").value(a.getLocationId());
			this.writer.name("lval").value(lval);
			this.writer.name("rhs").value(rhs);
		} else if (instr instanceof Call c) {
			Integer lval = c.getLval().isPresent() ? write(c.getLval().get()) : null;
			int target = write(c.getTarget());
			int[] args = writeAll(c.getArgs());
			begin(instr, "call").name("location").value(c.getLocationId());
			if (lval != null) {
				this.writer.name("lval").value(lval);
			}
			this.writer.name("target").value(target);
			refs("args", args);
		} else if (instr instanceof Asm a) {
			begin(instr, "asm").name("location").value(a.getLocationId());
			this.writer.name("volatile").value(a.isVolatile());
			strings("templates", a.getTemplates());
			strings("clobbers", a.getClobbers());
		} else {
			var nop = (Nop) instr;
			begin(instr, "nop").name("location").value(nop.getLocationId());
			this.writer.name("description").value(nop.getDescription());
		}
		this.writer.endObject();
	}

	private void writeStmt(Stmt stmt) throws IOException {
		int[] labels = writeAll(stmt.getLabels());
		if (stmt instanceof ReturnStmt s) {
			Integer value = s.getValue().isPresent() ? write(s.getValue().get()) : null;
			beginStmt(stmt, "return", labels);
			if (value != null) {
				this.writer.name("value").value(value);
			}
		} else if (stmt instanceof BreakStmt) {
			beginStmt(stmt, "break", labels);
		} else if (stmt instanceof ContinueStmt) {
			beginStmt(stmt, "continue", labels);
		} else if (stmt instanceof LoopStmt s) {
			int body = write(s.getBody());
			beginStmt(stmt, "loop", labels).name("body").value(body);
		} else if (stmt instanceof BlockStmt s) {
			int[] stmts = writeAll(s.getStmts());
			beginStmt(stmt, "block", labels);
			refs("stmts", stmts);
		} else if (stmt instanceof InstrSequence s) {
			int[] instrs = writeAll(s.getInstrs());
			beginStmt(stmt, "instrs", labels);
			refs("instrs", instrs);
		} else if (stmt instanceof BranchStmt s) {
			int condition = write(s.getCondition());
			int then = write(s.getThen());
			int otherwise = write(s.getOtherwise());
			beginStmt(stmt, "branch", labels).name("condition").value(condition);
			this.writer.name("then").value(then);
			this.writer.name("otherwise").value(otherwise);
		} else if (stmt instanceof GotoStmt s) {
			beginStmt(stmt, "goto", labels).name("target").value(s.getTarget());
		} else if (stmt instanceof ComputedGotoStmt s) {
			int target = write(s.getTarget());
			beginStmt(stmt, "computed_goto", labels).name("target").value(target);
		} else if (stmt instanceof SwitchStmt s) {
			int selector = write(s.getSelector());
			int body = write(s.getBody());
			beginStmt(stmt, "switch", labels).name("selector").value(selector);
			this.writer.name("body").value(body);
		} else {
			throw new LiftContractException("Cannot serialize statement %s", stmt.getClass().getSimpleName());
		}
		this.writer.endObject();
	}

	private JsonWriter beginStmt(Stmt stmt, String kind, int[] labels) throws IOException {
		begin(stmt, kind).name("location").value(stmt.getLocationId());
		refs("labels", labels);
		return this.writer;
	}

	private void writeLabel(StmtLabel label) throws IOException {
		if (label instanceof Label l) {
			begin(label, "label").name("name").value(l.getName());
		} else if (label instanceof CaseLabel l) {
			int value = write(l.getValue());
			begin(label, "case").name("value").value(value);
		} else if (label instanceof CaseRangeLabel l) {
			int low = write(l.getLow());
			int high = write(l.getHigh());
			begin(label, "case_range").name("low").value(low);
			this.writer.name("high").value(high);
		} else {
			begin(label, "default");
		}
		this.writer.endObject();
	}

	private void writeVarInfo(VarInfo varInfo) throws IOException {
		Integer type = varInfo.getType().isPresent() ? write(varInfo.getType().get()) : null;
		begin(varInfo, "varinfo").name("name").value(varInfo.getName());
		if (type != null) {
			this.writer.name("type").value(type);
		}
		if (varInfo.getParameter().isPresent()) {
			this.writer.name("parameter").value(varInfo.getParameter().getAsInt());
		}
		if (varInfo.getGlobalAddress().isPresent()) {
			this.writer.name("global_address").value(varInfo.getGlobalAddress().getAsLong());
		}
		if (varInfo.getDescription().isPresent()) {
			this.writer.name("description").value(varInfo.getDescription().get());
		}
		this.writer.name("placeholder").value(varInfo.isPlaceholder());
		this.writer.endObject();
	}
}
