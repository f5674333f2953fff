package bclift.ast;

import java.util.ArrayList;
import java.util.stream.Collectors;

/**
 * Renders AST nodes as C source text.  Placeholders render as {@code ?what?}.
 */
public final class CPrinter {
	private static final int PREC_QUESTION = 3;
	private static final int PREC_UNARY = 14;
	private static final int PREC_POSTFIX = 15;
	private static final int PREC_PRIMARY = 16;

	private CPrinter() {
	}

	/**
	 * @return The C text for any AST node.
	 */
	public static String print(AstNode node) {
		if (node instanceof Expr e) {
			return expr(e);
		} else if (node instanceof Lval l) {
			return lval(l);
		} else if (node instanceof Typ t) {
			return type(t);
		} else if (node instanceof Instr i) {
			return instr(i);
		} else if (node instanceof Stmt s) {
			return stmt(s);
		} else if (node instanceof Offset o) {
			return offset(o);
		} else if (node instanceof VarHost v) {
			return v.getVarInfo().getName();
		} else if (node instanceof MemRef m) {
			return "*" + expr(m.getAddress(), PREC_UNARY);
		} else if (node instanceof StmtLabel l) {
			return label(l);
		} else if (node instanceof VarInfo v) {
			return v.getName();
		} else {
			throw new IllegalArgumentException("Unknown AST node " + node.getClass().getSimpleName());
		}
	}

	/**
	 * Format a type as an abstract C declaration, e.g. {@code int *[4]}.
	 */
	public static String type(Typ typ) {
		var specifier = new StringBuilder();
		var prefix = new StringBuilder();
		var suffix = new StringBuilder();
		type(typ, specifier, prefix, suffix);

		if (prefix.length() > 0) {
			specifier.append(" ").append(prefix);
		}
		specifier.append(suffix);
		return specifier.toString();
	}

	/**
	 * Format a type as a C declaration of the given name.
	 */
	public static String declaration(Typ typ, String name) {
		var specifier = new StringBuilder();
		var prefix = new StringBuilder();
		var suffix = new StringBuilder();
		type(typ, specifier, prefix, suffix);
		return specifier.append(" ")
			.append(prefix)
			.append(name)
			.append(suffix)
			.toString();
	}

	private static void type(Typ typ, StringBuilder specifier, StringBuilder prefix, StringBuilder suffix) {
		if (typ instanceof VoidType) {
			specifier.append("void");
		} else if (typ instanceof IntType i) {
			specifier.append(i.getKind().getCName());
		} else if (typ instanceof FloatType f) {
			specifier.append(f.getKind().getCName());
		} else if (typ instanceof NamedType n) {
			specifier.append(n.getName());
		} else if (typ instanceof CompType c) {
			specifier.append("struct ").append(c.getName());
		} else if (typ instanceof EnumType e) {
			specifier.append("enum ").append(e.getName());
		} else if (typ instanceof PtrType p) {
			var target = p.getTarget();
			if (target instanceof ArrayType || target instanceof FunType) {
				prefix.insert(0, "(*");
				suffix.append(")");
			} else {
				prefix.insert(0, "*");
			}
			type(target, specifier, prefix, suffix);
		} else if (typ instanceof ArrayType a) {
			suffix.append("[")
				.append(a.getSize().map(CPrinter::expr).orElse(""))
				.append("]");
			type(a.getElement(), specifier, prefix, suffix);
		} else if (typ instanceof FunType f) {
			var args = f.getArgs()
				.stream()
				.map(arg -> arg.name().isEmpty() ? type(arg.type()) : declaration(arg.type(), arg.name()))
				.collect(Collectors.toCollection(ArrayList::new));
			if (f.isVarArgs()) {
				args.add("...");
			} else if (args.isEmpty()) {
				args.add("void");
			}
			suffix.append("(").append(String.join(", ", args)).append(")");
			type(f.getReturnType(), specifier, prefix, suffix);
		}
	}

	public static String expr(Expr expr) {
		return expr(expr, 0);
	}

	/**
	 * Format an expression, parenthesized if it binds looser than {@code context}.
	 */
	private static String expr(Expr expr, int context) {
		int prec = precedence(expr);
		var str = bareExpr(expr);
		return prec < context ? "(" + str + ")" : str;
	}

	private static int precedence(Expr expr) {
		if (expr instanceof BinaryOp b) {
			return b.getOp().getPrecedence();
		} else if (expr instanceof Question) {
			return PREC_QUESTION;
		} else if (expr instanceof UnaryOp || expr instanceof CastExpr || expr instanceof AddressOf) {
			return PREC_UNARY;
		} else if (expr instanceof IntConstant c && c.getValue() < 0) {
			return PREC_UNARY;
		} else if (expr instanceof LvalExpr l) {
			return lvalPrecedence(l.getLval());
		} else if (expr instanceof GlobalAddressConstant g) {
			return precedence(g.getAddressExpr());
		} else {
			return PREC_PRIMARY;
		}
	}

	private static String bareExpr(Expr expr) {
		if (expr instanceof IntConstant c) {
			return intLiteral(c.getValue());
		} else if (expr instanceof FloatConstant f) {
			return Double.toString(f.getValue());
		} else if (expr instanceof GlobalAddressConstant g) {
			return bareExpr(g.getAddressExpr());
		} else if (expr instanceof StringConstant s) {
			return stringLiteral(s.getValue());
		} else if (expr instanceof LvalExpr l) {
			return lval(l.getLval());
		} else if (expr instanceof SizeOf s) {
			return "sizeof(" + type(s.getType()) + ")";
		} else if (expr instanceof CastExpr c) {
			return "(" + type(c.getType()) + ")" + expr(c.getExpr(), PREC_UNARY);
		} else if (expr instanceof UnaryOp u) {
			return u.getOp().getSymbol() + expr(u.getOperand(), PREC_UNARY);
		} else if (expr instanceof BinaryOp b) {
			int prec = b.getOp().getPrecedence();
			return expr(b.getLeft(), prec) + " " + b.getOp().getSymbol() + " " + expr(b.getRight(), prec + 1);
		} else if (expr instanceof Question q) {
			return expr(q.getCondition(), PREC_QUESTION + 1)
				+ " ? " + expr(q.getThen(), PREC_QUESTION + 1)
				+ " : " + expr(q.getOtherwise(), PREC_QUESTION);
		} else if (expr instanceof AddressOf a) {
			return "&" + lval(a.getLval(), PREC_UNARY);
		} else if (expr instanceof Unresolved u) {
			return "?" + u.getDescription() + "?";
		} else {
			throw new IllegalArgumentException("Unknown expression " + expr.getClass().getSimpleName());
		}
	}

	private static String intLiteral(long value) {
		long abs = Math.abs(value);
		var digits = abs < 0x1000 ? Long.toString(abs) : "0x" + Long.toHexString(abs);
		return value < 0 ? "-" + digits : digits;
	}

	private static String stringLiteral(String value) {
		var str = new StringBuilder("\"");
		for (char c : value.toCharArray()) {
			switch (c) {
				case '"':
					str.append("\\\"");
					break;
				case '\\':
					str.append("\\\\");
					break;
				case '\n':
					str.append("\\n");
					break;
				case '\t':
					str.append("\\t");
					break;
				default:
					str.append(c);
			}
		}
		return str.append("\"").toString();
	}

	public static String lval(Lval lval) {
		return lval(lval, 0);
	}

	private static String lval(Lval lval, int context) {
		var str = bareLval(lval);
		return lvalPrecedence(lval) < context ? "(" + str + ")" : str;
	}

	private static int lvalPrecedence(Lval lval) {
		if (lval.getHost() instanceof MemRef && lval.getOffset() instanceof NoOffset) {
			return PREC_UNARY;
		} else if (lval.getOffset() instanceof NoOffset) {
			return PREC_PRIMARY;
		} else {
			return PREC_POSTFIX;
		}
	}

	private static String bareLval(Lval lval) {
		var host = lval.getHost();
		var offset = lval.getOffset();
		if (host instanceof VarHost v) {
			return v.getVarInfo().getName() + offset(offset);
		}

		var address = ((MemRef) host).getAddress();
		if (offset instanceof NoOffset) {
			return "*" + expr(address, PREC_UNARY);
		} else if (offset instanceof FieldOffset f) {
			return expr(address, PREC_POSTFIX) + "->" + f.getName() + offset(f.getRest());
		} else {
			return "(*" + expr(address, PREC_UNARY) + ")" + offset(offset);
		}
	}

	public static String offset(Offset offset) {
		if (offset instanceof NoOffset) {
			return "";
		} else if (offset instanceof FieldOffset f) {
			return "." + f.getName() + offset(f.getRest());
		} else if (offset instanceof IndexOffset i) {
			return "[" + expr(i.getIndex()) + "]" + offset(i.getRest());
		} else {
			return ".?" + ((UnresolvedOffset) offset).getDescription() + "?";
		}
	}

	public static String instr(Instr instr) {
		if (instr instanceof Assign a) {
			return lval(a.getLval()) + " = " + expr(a.getRhs()) + ";";
		} else if (instr instanceof Call c) {
			var args = c.getArgs()
				.stream()
				.map(CPrinter::expr)
				.collect(Collectors.joining(", ", "(", ")"));
			var lhs = c.getLval().map(l -> lval(l) + " = ").orElse("");
			return lhs + expr(c.getTarget(), PREC_POSTFIX) + args + ";";
		} else if (instr instanceof Asm a) {
			var str = new StringBuilder("__asm__ ");
			if (a.isVolatile()) {
				str.append("volatile ");
			}
			str.append("(")
				.append(stringLiteral(String.join("; ", a.getTemplates())));
			if (!a.getClobbers().isEmpty()) {
				str.append(" ::: ")
					.append(a.getClobbers()
						.stream()
						.map(CPrinter::stringLiteral)
						.collect(Collectors.joining(", ")));
			}
			return str.append(");").toString();
		} else {
			return "/* nop: " + ((Nop) instr).getDescription() + " */";
		}
	}

	public static String label(StmtLabel label) {
		if (label instanceof Label l) {
			return l.getName() + ":";
		} else if (label instanceof CaseLabel c) {
			return "case " + expr(c.getValue()) + ":";
		} else if (label instanceof CaseRangeLabel r) {
			return "case " + expr(r.getLow()) + " ... " + expr(r.getHigh()) + ":";
		} else {
			return "default:";
		}
	}

	public static String stmt(Stmt stmt) {
		var out = new StringBuilder();
		stmt(stmt, 0, out);
		return out.toString();
	}

	private static void stmt(Stmt stmt, int indent, StringBuilder out) {
		for (var label : stmt.getLabels()) {
			indent(Math.max(indent - 1, 0), out).append(label(label)).append("\n");
		}

		if (stmt instanceof BlockStmt b) {
			indent(indent, out).append("{\n");
			for (var child : b.getStmts()) {
				stmt(child, indent + 1, out);
			}
			indent(indent, out).append("}\n");
		} else if (stmt instanceof InstrSequence s) {
			for (var instr : s.getInstrs()) {
				indent(indent, out).append(instr(instr)).append("\n");
			}
		} else if (stmt instanceof ReturnStmt r) {
			indent(indent, out)
				.append("return")
				.append(r.getValue().map(e -> " " + expr(e)).orElse(""))
				.append(";\n");
		} else if (stmt instanceof BreakStmt) {
			indent(indent, out).append("break;\n");
		} else if (stmt instanceof ContinueStmt) {
			indent(indent, out).append("continue;\n");
		} else if (stmt instanceof LoopStmt l) {
			indent(indent, out).append("while (1)");
			body(l.getBody(), indent, out);
		} else if (stmt instanceof BranchStmt b) {
			indent(indent, out).append("if (").append(expr(b.getCondition())).append(")");
			body(b.getThen(), indent, out);
			if (!isEmpty(b.getOtherwise())) {
				indent(indent, out).append("else");
				body(b.getOtherwise(), indent, out);
			}
		} else if (stmt instanceof GotoStmt g) {
			indent(indent, out).append("goto ").append(g.getTarget()).append(";\n");
		} else if (stmt instanceof ComputedGotoStmt g) {
			indent(indent, out).append("goto ").append("*").append(expr(g.getTarget(), PREC_UNARY)).append(";\n");
		} else if (stmt instanceof SwitchStmt s) {
			indent(indent, out).append("switch (").append(expr(s.getSelector())).append(")");
			body(s.getBody(), indent, out);
		}
	}

	/**
	 * Print the body of a compound statement after its header.
	 */
	private static void body(Stmt body, int indent, StringBuilder out) {
		if (body instanceof BlockStmt b && b.getLabels().isEmpty()) {
			out.append(" {\n");
			for (var child : b.getStmts()) {
				stmt(child, indent + 1, out);
			}
			indent(indent, out).append("}\n");
		} else {
			out.append("\n");
			stmt(body, indent + 1, out);
		}
	}

	private static boolean isEmpty(Stmt stmt) {
		if (!stmt.getLabels().isEmpty()) {
			return false;
		} else if (stmt instanceof BlockStmt b) {
			return b.getStmts().stream().allMatch(CPrinter::isEmpty);
		} else if (stmt instanceof InstrSequence s) {
			return s.getInstrs().isEmpty();
		} else {
			return false;
		}
	}

	private static StringBuilder indent(int indent, StringBuilder out) {
		for (int i = 0; i < indent; ++i) {
			out.append("\t");
		}
		return out;
	}
}
