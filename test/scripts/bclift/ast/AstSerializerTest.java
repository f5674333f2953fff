package bclift.ast;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

public class AstSerializerTest {
	private VarInfo buffer;
	private VarInfo count;

	@BeforeEach
	public void setUp() {
		var packet = Nodes.compType("packet", 7);
		this.buffer = VarInfo.builder("buf")
			.type(Nodes.ptrType(packet))
			.parameter(0)
			.description("formal parameter 0")
			.build();
		this.count = VarInfo.builder("n").type(Nodes.intType(IKind.UINT)).build();
	}

	private static JsonArray table(AstNode... nodes) throws IOException {
		var out = new StringWriter();
		try (var writer = new JsonWriter(out)) {
			writer.beginArray();
			var serializer = new AstSerializer(writer);
			for (var node : nodes) {
				serializer.write(node);
			}
			writer.endArray();
		}
		return JsonParser.parseString(out.toString()).getAsJsonArray();
	}

	@Test
	public void statementsReadBackWithFreshIds() throws IOException {
		var field = Nodes.memLval(Nodes.lvalExpr(Nodes.varLval(this.buffer)),
			Nodes.fieldOffset("len", 7, Nodes.noOffset()));
		var store = Nodes.assign(3, field, Nodes.binary(BinOp.PLUS,
			Nodes.lvalExpr(Nodes.varLval(this.count)), Nodes.intConstant(-1, IKind.LONG)));
		var call = Nodes.call(4, Optional.empty(), Nodes.lvalExpr(Nodes.varLval(VarInfo.builder("log").build())),
			List.of(Nodes.stringConstant("len=%u\n", OptionalLong.of(0x8000)), Nodes.sizeOf(Nodes.intType(IKind.INT))));
		var body = Nodes.instrSequence(2, List.of(), List.of(store, call, Nodes.asm(5, true, List.of("dmb ish"), List.of("memory"))));
		var loop = Nodes.loop(1, List.of(Nodes.label("again")), Nodes.block(1, List.of(), List.of(body,
			Nodes.branch(6, List.of(), Nodes.question(Nodes.intConstant(1), Nodes.intConstant(0), Nodes.intConstant(1)),
				Nodes.breakStmt(7, List.of()), Nodes.gotoStmt(8, List.of(), "again")))));

		var table = table(loop);
		var read = new AstDeserializer(table).read(loop.getId(), LoopStmt.class);

		assertNotEquals(loop.getId(), read.getId());
		assertEquals(CPrinter.stmt(loop), CPrinter.stmt(read));
		assertEquals(List.of(Nodes.label("again")), read.getLabels());
		assertEquals(1, read.getLocationId());
	}

	@Test
	public void sharedNodesAreWrittenOnceAndStayShared() throws IOException {
		var x = Nodes.lvalExpr(Nodes.varLval(this.count));
		var sum = Nodes.binary(BinOp.PLUS, x, x);

		var table = table(sum, x);
		Set<Integer> ids = new HashSet<>();
		for (var element : table) {
			assertTrue(ids.add(element.getAsJsonObject().get("id").getAsInt()));
		}

		var nodes = new AstDeserializer(table);
		var read = nodes.read(sum.getId(), BinaryOp.class);
		assertSame(read.getLeft(), read.getRight());
		assertSame(read.getLeft(), nodes.read(x.getId()));

		var host = (VarHost) ((LvalExpr) read.getLeft()).getLval().getHost();
		assertNotSame(this.count, host.getVarInfo());
		assertEquals("n", host.getVarInfo().getName());
		assertEquals(Optional.of(Nodes.intType(IKind.UINT)), host.getVarInfo().getType());
	}

	@Test
	public void variableDetailsSurvive() throws IOException {
		var global = VarInfo.builder("counter").globalAddress(0x4000).build();
		var unknown = VarInfo.builder("?R3?").description("R3").placeholder().build();

		var nodes = new AstDeserializer(table(this.buffer, global, unknown));
		var buffer = nodes.read(this.buffer.getId(), VarInfo.class);
		assertEquals(0, buffer.getParameter().getAsInt());
		assertEquals(Optional.of("formal parameter 0"), buffer.getDescription());
		assertEquals(Optional.of(Nodes.ptrType(Nodes.compType("packet", 7))), buffer.getType());
		assertFalse(buffer.isPlaceholder());

		assertEquals(0x4000, nodes.read(global.getId(), VarInfo.class).getGlobalAddress().getAsLong());
		assertTrue(nodes.read(unknown.getId(), VarInfo.class).isPlaceholder());
		assertTrue(nodes.read(unknown.getId(), VarInfo.class).getType().isEmpty());
	}

	@Test
	public void typesAndFloatsReadBackEqual() throws IOException {
		var fn = Nodes.funType(Nodes.voidType(), List.of(new FunArg("fmt", Nodes.ptrType(Nodes.intType(IKind.CHAR)))), true);
		var array = Nodes.arrayType(Nodes.enumType("state", IKind.UINT), Optional.of(Nodes.intConstant(4)));
		var nan = Nodes.floatConstant(Double.NaN, FKind.DOUBLE);
		var half = Nodes.floatConstant(0.5, FKind.FLOAT);

		var nodes = new AstDeserializer(table(fn, array, nan, half, Nodes.namedType("size_t")));
		assertEquals(fn, nodes.read(fn.getId()));
		assertEquals(array, nodes.read(array.getId()));
		assertTrue(Double.isNaN(nodes.read(nan.getId(), FloatConstant.class).getValue()));
		assertEquals(half, nodes.read(half.getId()));
	}

	@Test
	public void switchLabelsAndUnresolvedNodes() throws IOException {
		var body = Nodes.block(9, List.of(), List.of(
			Nodes.returnStmt(10, List.of(Nodes.caseLabel(Nodes.intConstant(1))), Optional.of(Nodes.unresolved("R0 at 0x10"))),
			Nodes.returnStmt(11, List.of(Nodes.caseRangeLabel(Nodes.intConstant(2), Nodes.intConstant(5)), Nodes.defaultLabel()),
				Optional.empty())));
		var sw = Nodes.switchStmt(9, List.of(), Nodes.intConstant(3), body);
		var offset = Nodes.indexOffset(Nodes.intConstant(2), Nodes.unresolvedOffset("offset 3 into int"));

		var nodes = new AstDeserializer(table(sw, offset));
		var read = nodes.read(sw.getId(), SwitchStmt.class);
		assertEquals(CPrinter.stmt(sw), CPrinter.stmt(read));
		assertEquals(offset, nodes.read(offset.getId()));
		assertTrue(nodes.read(offset.getId(), Offset.class).isUnresolved());
	}

	@Test
	public void malformedTablesAreRejected() throws IOException {
		var table = table(Nodes.intConstant(1));
		var id = table.get(0).getAsJsonObject().get("id").getAsInt();
		var nodes = new AstDeserializer(table);
		assertThrows(JsonParseException.class, () -> nodes.read(id + 1));
		assertThrows(JsonParseException.class, () -> nodes.read(id, Stmt.class));

		var unknown = JsonParser.parseString("[{\"id\": 1, \"kind\": \"lambda\"}]").getAsJsonArray();
		assertThrows(JsonParseException.class, () -> new AstDeserializer(unknown).read(1));

		var dangling = JsonParser.parseString("[{\"id\": 1, \"kind\": \"ptr\", \"target\": 2}]").getAsJsonArray();
		assertThrows(JsonParseException.class, () -> new AstDeserializer(dangling).read(1));

		var twice = JsonParser.parseString("[{\"id\": 1, \"kind\": \"void\"}, {\"id\": 1, \"kind\": \"void\"}]").getAsJsonArray();
		assertThrows(JsonParseException.class, () -> new AstDeserializer(twice));

		var badOp = JsonParser.parseString("[{\"id\": 1, \"kind\": \"int\", \"ikind\": \"INT128\"}]").getAsJsonArray();
		assertThrows(JsonParseException.class, () -> new AstDeserializer(badOp).read(1));
	}
}
