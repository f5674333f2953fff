package bclift.ast;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;

public class CPrinterTest {
	private static final VarInfo X = VarInfo.builder("x").build();
	private static final VarInfo P = VarInfo.builder("p").build();

	private static Expr x() {
		return Nodes.lvalExpr(Nodes.varLval(X));
	}

	@Test
	public void types() {
		var i = Nodes.intType(IKind.INT);
		assertEquals("int", CPrinter.type(i));
		assertEquals("unsigned int *", CPrinter.type(Nodes.ptrType(Nodes.intType(IKind.UINT))));
		assertEquals("int *[4]", CPrinter.type(Nodes.arrayType(Nodes.ptrType(i), Optional.of(Nodes.intConstant(4)))));
		assertEquals("int (*)[4]", CPrinter.type(Nodes.ptrType(Nodes.arrayType(i, Optional.of(Nodes.intConstant(4))))));
		assertEquals("struct packet", CPrinter.type(Nodes.compType("packet", 1)));

		var fn = Nodes.funType(i, List.of(new FunArg("n", i)), false);
		assertEquals("int (*handler)(int n)", CPrinter.declaration(Nodes.ptrType(fn), "handler"));
		assertEquals("void f(void)", CPrinter.declaration(Nodes.funType(Nodes.voidType(), List.of(), false), "f"));
	}

	@Test
	public void expressionsRespectPrecedence() {
		var sum = Nodes.binary(BinOp.PLUS, x(), Nodes.intConstant(1));
		assertEquals("(x + 1) * 2", CPrinter.expr(Nodes.binary(BinOp.MULT, sum, Nodes.intConstant(2))));
		assertEquals("x + 1 + 2", CPrinter.expr(Nodes.binary(BinOp.PLUS, sum, Nodes.intConstant(2))));
		assertEquals("x - (x + 1)", CPrinter.expr(Nodes.binary(BinOp.MINUS, x(), sum)));
		assertEquals("-(x + 1)", CPrinter.expr(Nodes.unary(UnOp.NEG, sum)));
		assertEquals("(unsigned int)x >> 4",
			CPrinter.expr(Nodes.binary(BinOp.SHIFTRIGHT, Nodes.cast(Nodes.intType(IKind.UINT), x()), Nodes.intConstant(4))));
	}

	@Test
	public void literals() {
		assertEquals("4095", CPrinter.expr(Nodes.intConstant(0xfff)));
		assertEquals("0x1000", CPrinter.expr(Nodes.intConstant(0x1000)));
		assertEquals("-8", CPrinter.expr(Nodes.intConstant(-8)));
		assertEquals("\"a\\\"b\\n\"", CPrinter.expr(Nodes.stringConstant("a\"b\n", java.util.OptionalLong.empty())));
	}

	@Test
	public void lvalues() {
		var pointer = Nodes.lvalExpr(Nodes.varLval(P));
		var field = Nodes.fieldOffset("len", 1, Nodes.noOffset());
		assertEquals("p->len", CPrinter.lval(Nodes.memLval(pointer, field)));
		assertEquals("*p", CPrinter.lval(Nodes.memLval(pointer, Nodes.noOffset())));
		assertEquals("(*p)[2]", CPrinter.lval(Nodes.memLval(pointer, Nodes.indexOffset(Nodes.intConstant(2), Nodes.noOffset()))));
		assertEquals("x.hdr[1]", CPrinter.lval(Nodes.lval(Nodes.varHost(X),
			Nodes.fieldOffset("hdr", 1, Nodes.indexOffset(Nodes.intConstant(1), Nodes.noOffset())))));
		assertEquals("&p->len", CPrinter.expr(Nodes.addressOf(Nodes.memLval(pointer, field))));
		var sum = Nodes.binary(BinOp.PLUS, pointer, Nodes.intConstant(4));
		assertEquals("*(p + 4)", CPrinter.lval(Nodes.memLval(sum, Nodes.noOffset())));
	}

	@Test
	public void placeholdersAreMarked() {
		assertEquals("?memory?", CPrinter.expr(Nodes.unresolved("memory")));
		assertEquals("x.?offset 3?", CPrinter.lval(Nodes.lval(Nodes.varHost(X), Nodes.unresolvedOffset("offset 3"))));
	}

	@Test
	public void instructions() {
		var assign = Nodes.assign(1, Nodes.varLval(X), Nodes.intConstant(1));
		assertEquals("x = 1;", CPrinter.instr(assign));

		var target = Nodes.lvalExpr(Nodes.varLval(VarInfo.builder("f").build()));
		var call = Nodes.call(2, Optional.of(Nodes.varLval(X)), target, List.of(Nodes.intConstant(1), x()));
		assertEquals("x = f(1, x);", CPrinter.instr(call));
		assertEquals("/* nop: skipped */", CPrinter.instr(Nodes.nop(3, "skipped")));
		assertEquals("__asm__ volatile (\"dmb; isb\" ::: \"memory\");",
			CPrinter.instr(Nodes.asm(4, true, List.of("dmb", "isb"), List.of("memory"))));
	}

	@Test
	public void statements() {
		var body = Nodes.instrSequence(1, List.of(), List.of(Nodes.assign(1, Nodes.varLval(X), Nodes.intConstant(0))));
		var empty = Nodes.block(2, List.of(), List.of());
		var cond = Nodes.binary(BinOp.EQ, x(), Nodes.intConstant(0));
		var branch = Nodes.branch(3, List.of(), cond, Nodes.block(4, List.of(), List.of(body)), empty);
		assertEquals("if (x == 0) {\n\tx = 0;\n}\n", CPrinter.stmt(branch));

		var loop = Nodes.loop(5, List.of(Nodes.label("top")), Nodes.block(6, List.of(), List.of(Nodes.breakStmt(7, List.of()))));
		assertEquals("top:\nwhile (1) {\n\tbreak;\n}\n", CPrinter.stmt(loop));

		assertEquals("goto *x;\n", CPrinter.stmt(Nodes.computedGoto(8, List.of(), x())));
		assertEquals("return x;\n", CPrinter.stmt(Nodes.returnStmt(9, List.of(), Optional.of(x()))));
		assertEquals("case 1 ... 3:", CPrinter.label(Nodes.caseRangeLabel(Nodes.intConstant(1), Nodes.intConstant(3))));
	}

	@Test
	public void equalityIgnoresIds() {
		var a = Nodes.binary(BinOp.PLUS, x(), Nodes.intConstant(1));
		var b = Nodes.binary(BinOp.PLUS, x(), Nodes.intConstant(1));
		assertNotEquals(a.getId(), b.getId());
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertEquals("x + 1", a.toString());
	}
}
