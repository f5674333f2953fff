package bclift.lift;

import bclift.ast.Asm;
import bclift.ast.Assign;
import bclift.ast.Call;
import bclift.ast.Expr;
import bclift.ast.Instr;
import bclift.ast.InstrSequence;
import bclift.ast.Lval;
import bclift.ast.Nodes;
import bclift.ast.Nop;
import bclift.ast.Stmt;
import bclift.ast.StmtLabel;
import bclift.symbol.GlobalSymbolTable;
import bclift.symbol.LocalSymbolTable;
import bclift.type.TypeSizes;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-function construction state: symbol tables, location ids, provenance
 * and diagnostics.  Instructions built for the same address share a location
 * id, at both levels.
 */
public final class AstBuilder {
	private final String functionName;
	private final GlobalSymbolTable globals;
	private final LocalSymbolTable locals;
	private final TypeSizes sizes;
	private final AstTyper typer;
	private final Diagnostics diagnostics;
	private final Provenance provenance;
	private final Map<String, Integer> locationIds = new HashMap<>();
	private int nextLocationId = 1;

	public AstBuilder(String functionName, GlobalSymbolTable globals, LocalSymbolTable locals) {
		this.functionName = functionName;
		this.globals = globals;
		this.locals = locals;
		this.sizes = new TypeSizes(globals);
		this.typer = new AstTyper(globals);
		this.diagnostics = new Diagnostics();
		this.provenance = new Provenance(this.diagnostics);
	}

	public String getFunctionName() {
		return this.functionName;
	}

	public GlobalSymbolTable getGlobals() {
		return this.globals;
	}

	public LocalSymbolTable getLocals() {
		return this.locals;
	}

	public TypeSizes getSizes() {
		return this.sizes;
	}

	public AstTyper getTyper() {
		return this.typer;
	}

	public Diagnostics getDiagnostics() {
		return this.diagnostics;
	}

	public Provenance getProvenance() {
		return this.provenance;
	}

	/**
	 * @return The location id for an instruction address.
	 */
	public int locationId(String address) {
		return this.locationIds.computeIfAbsent(address, a -> this.nextLocationId++);
	}

	/**
	 * @return A location id not tied to any address, for synthesized statements.
	 */
	public int freshLocationId() {
		int id = this.nextLocationId++;
		this.locationIds.put("#" + id, id);
		return id;
	}

	private <T extends Instr> T atAddress(T instr, String address) {
		this.provenance.addAddress(instr, address);
		return instr;
	}

	public Assign mkAssign(String address, Lval lval, Expr rhs) {
		return atAddress(Nodes.assign(locationId(address), lval, rhs), address);
	}

	public Call mkCall(String address, Optional<Lval> lval, Expr target, List<Expr> args) {
		return atAddress(Nodes.call(locationId(address), lval, target, args), address);
	}

	public Asm mkAsm(String address, boolean isVolatile, List<String> templates, List<String> clobbers) {
		return atAddress(Nodes.asm(locationId(address), isVolatile, templates, clobbers), address);
	}

	public Nop mkNop(String address, String description) {
		return atAddress(Nodes.nop(locationId(address), description), address);
	}

	/**
	 * @return A straight-line statement of instructions.
	 */
	public InstrSequence mkInstrSequence(List<Instr> instrs, List<StmtLabel> labels) {
		return Nodes.instrSequence(freshLocationId(), labels, instrs);
	}

	public Stmt mkBlock(List<Stmt> stmts, List<StmtLabel> labels) {
		return Nodes.block(freshLocationId(), labels, stmts);
	}

	public Stmt mkReturn(String address, Optional<Expr> value) {
		return Nodes.returnStmt(locationId(address), List.of(), value);
	}

	public Stmt mkBranch(String address, Expr condition, Stmt then, Stmt otherwise) {
		return Nodes.branch(locationId(address), List.of(), condition, then, otherwise);
	}

	public Stmt mkGoto(String address, String label) {
		return Nodes.gotoStmt(locationId(address), List.of(), label);
	}

	public Stmt mkComputedGoto(String address, Expr target) {
		return Nodes.computedGoto(locationId(address), List.of(), target);
	}

	public Stmt mkSwitch(String address, Expr selector, Stmt body) {
		return Nodes.switchStmt(locationId(address), List.of(), selector, body);
	}

	public Stmt mkLoop(Stmt body, List<StmtLabel> labels) {
		return Nodes.loop(freshLocationId(), labels, body);
	}

	public Stmt mkBreak() {
		return Nodes.breakStmt(freshLocationId(), List.of());
	}

	public Stmt mkContinue() {
		return Nodes.continueStmt(freshLocationId(), List.of());
	}

	/**
	 * Record the bytes an instruction was decoded from.
	 */
	public void recordSpan(Instr instr, Span span) {
		this.provenance.recordSpan(instr, span);
	}
}
