package bclift.ast;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Factory for AST nodes.  Every call mints a fresh node id.
 */
public final class Nodes {
	private Nodes() {
	}

	// Types

	public static VoidType voidType() {
		return new VoidType(NodeIds.next());
	}

	public static IntType intType(IKind kind) {
		return new IntType(NodeIds.next(), kind);
	}

	public static FloatType floatType(FKind kind) {
		return new FloatType(NodeIds.next(), kind);
	}

	public static PtrType ptrType(Typ target) {
		return new PtrType(NodeIds.next(), target);
	}

	public static ArrayType arrayType(Typ element, Optional<Expr> size) {
		return new ArrayType(NodeIds.next(), element, size);
	}

	public static FunType funType(Typ returnType, List<FunArg> args, boolean varArgs) {
		return new FunType(NodeIds.next(), returnType, args, varArgs);
	}

	public static NamedType namedType(String name) {
		return new NamedType(NodeIds.next(), name);
	}

	public static CompType compType(String name, int key) {
		return new CompType(NodeIds.next(), name, key);
	}

	public static EnumType enumType(String name, IKind kind) {
		return new EnumType(NodeIds.next(), name, kind);
	}

	// Expressions

	public static IntConstant intConstant(long value) {
		return intConstant(value, IKind.INT);
	}

	public static IntConstant intConstant(long value, IKind kind) {
		return new IntConstant(NodeIds.next(), value, kind);
	}

	public static FloatConstant floatConstant(double value, FKind kind) {
		return new FloatConstant(NodeIds.next(), value, kind);
	}

	public static GlobalAddressConstant globalAddressConstant(long value, Expr addressExpr) {
		return new GlobalAddressConstant(NodeIds.next(), value, addressExpr);
	}

	public static StringConstant stringConstant(String value, OptionalLong address) {
		return new StringConstant(NodeIds.next(), value, address);
	}

	public static LvalExpr lvalExpr(Lval lval) {
		return new LvalExpr(NodeIds.next(), lval);
	}

	public static SizeOf sizeOf(Typ type) {
		return new SizeOf(NodeIds.next(), type);
	}

	public static CastExpr cast(Typ type, Expr expr) {
		return new CastExpr(NodeIds.next(), type, expr);
	}

	public static UnaryOp unary(UnOp op, Expr operand) {
		return new UnaryOp(NodeIds.next(), op, operand);
	}

	public static BinaryOp binary(BinOp op, Expr left, Expr right) {
		return new BinaryOp(NodeIds.next(), op, left, right);
	}

	public static Question question(Expr condition, Expr then, Expr otherwise) {
		return new Question(NodeIds.next(), condition, then, otherwise);
	}

	public static AddressOf addressOf(Lval lval) {
		return new AddressOf(NodeIds.next(), lval);
	}

	public static Unresolved unresolved(String description) {
		return new Unresolved(NodeIds.next(), description);
	}

	// Lvalues

	public static Lval lval(LHost host, Offset offset) {
		return new Lval(NodeIds.next(), host, offset);
	}

	/**
	 * @return The lvalue naming a variable.
	 */
	public static Lval varLval(VarInfo varInfo) {
		return lval(varHost(varInfo), noOffset());
	}

	/**
	 * @return The lvalue {@code *address}, followed by an offset.
	 */
	public static Lval memLval(Expr address, Offset offset) {
		return lval(memRef(address), offset);
	}

	public static VarHost varHost(VarInfo varInfo) {
		return new VarHost(NodeIds.next(), varInfo);
	}

	public static MemRef memRef(Expr address) {
		return new MemRef(NodeIds.next(), address);
	}

	public static NoOffset noOffset() {
		return new NoOffset(NodeIds.next());
	}

	public static FieldOffset fieldOffset(String name, int compKey, Offset rest) {
		return new FieldOffset(NodeIds.next(), name, compKey, rest);
	}

	public static IndexOffset indexOffset(Expr index, Offset rest) {
		return new IndexOffset(NodeIds.next(), index, rest);
	}

	public static UnresolvedOffset unresolvedOffset(String description) {
		return new UnresolvedOffset(NodeIds.next(), description);
	}

	/**
	 * @return The offset chain {@code prefix} followed by {@code suffix}.
	 */
	public static Offset appendOffset(Offset prefix, Offset suffix) {
		if (prefix instanceof NoOffset) {
			return suffix;
		} else if (prefix instanceof FieldOffset f) {
			return fieldOffset(f.getName(), f.getCompKey(), appendOffset(f.getRest(), suffix));
		} else if (prefix instanceof IndexOffset i) {
			return indexOffset(i.getIndex(), appendOffset(i.getRest(), suffix));
		} else {
			return prefix;
		}
	}

	// Instructions

	public static Assign assign(int locationId, Lval lval, Expr rhs) {
		return new Assign(NodeIds.next(), locationId, lval, rhs);
	}

	public static Call call(int locationId, Optional<Lval> lval, Expr target, List<Expr> args) {
		return new Call(NodeIds.next(), locationId, lval, target, args);
	}

	public static Asm asm(int locationId, boolean isVolatile, List<String> templates, List<String> clobbers) {
		return new Asm(NodeIds.next(), locationId, isVolatile, templates, clobbers);
	}

	public static Nop nop(int locationId, String description) {
		return new Nop(NodeIds.next(), locationId, description);
	}

	// Statements

	public static ReturnStmt returnStmt(int locationId, List<StmtLabel> labels, Optional<Expr> value) {
		return new ReturnStmt(NodeIds.next(), locationId, labels, value);
	}

	public static BreakStmt breakStmt(int locationId, List<StmtLabel> labels) {
		return new BreakStmt(NodeIds.next(), locationId, labels);
	}

	public static ContinueStmt continueStmt(int locationId, List<StmtLabel> labels) {
		return new ContinueStmt(NodeIds.next(), locationId, labels);
	}

	public static LoopStmt loop(int locationId, List<StmtLabel> labels, Stmt body) {
		return new LoopStmt(NodeIds.next(), locationId, labels, body);
	}

	public static BlockStmt block(int locationId, List<StmtLabel> labels, List<Stmt> stmts) {
		return new BlockStmt(NodeIds.next(), locationId, labels, stmts);
	}

	public static InstrSequence instrSequence(int locationId, List<StmtLabel> labels, List<Instr> instrs) {
		return new InstrSequence(NodeIds.next(), locationId, labels, instrs);
	}

	public static BranchStmt branch(int locationId, List<StmtLabel> labels, Expr condition, Stmt then, Stmt otherwise) {
		return new BranchStmt(NodeIds.next(), locationId, labels, condition, then, otherwise);
	}

	public static GotoStmt gotoStmt(int locationId, List<StmtLabel> labels, String target) {
		return new GotoStmt(NodeIds.next(), locationId, labels, target);
	}

	public static ComputedGotoStmt computedGoto(int locationId, List<StmtLabel> labels, Expr target) {
		return new ComputedGotoStmt(NodeIds.next(), locationId, labels, target);
	}

	public static SwitchStmt switchStmt(int locationId, List<StmtLabel> labels, Expr selector, Stmt body) {
		return new SwitchStmt(NodeIds.next(), locationId, labels, selector, body);
	}

	// Labels

	public static Label label(String name) {
		return new Label(NodeIds.next(), name);
	}

	public static CaseLabel caseLabel(Expr value) {
		return new CaseLabel(NodeIds.next(), value);
	}

	public static CaseRangeLabel caseRangeLabel(Expr low, Expr high) {
		return new CaseRangeLabel(NodeIds.next(), low, high);
	}

	public static DefaultLabel defaultLabel() {
		return new DefaultLabel(NodeIds.next());
	}
}
