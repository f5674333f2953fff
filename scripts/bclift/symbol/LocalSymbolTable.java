package bclift.symbol;

import bclift.LiftContractException;
import bclift.ast.Lval;
import bclift.ast.Nodes;
import bclift.ast.Typ;
import bclift.ast.VarInfo;
import bclift.util.Counter;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The symbols of one function: its locals, formals, stack slots, and the
 * SSA variables introduced for register definitions.
 *
 * Owned by a single function lift, so it is not synchronized.  A finished
 * lift keeps a {@link #snapshot()}, which refuses to create symbols.
 */
public final class LocalSymbolTable {
	private final GlobalSymbolTable globals;
	private final ImmutableList<FormalInfo> formals;
	private final boolean frozen;
	private final Map<String, VarInfo> locals;
	private final SortedMap<Long, Lval> stackSlots;
	private final Map<SsaSite, VarInfo> ssaVars;
	private final Map<VarInfo, Long> ssaConstants;
	private final Counter<String> ssaCounts = new Counter<>();

	private record SsaSite(String register, String site) {
	}

	public LocalSymbolTable(GlobalSymbolTable globals, List<FormalInfo> formals) {
		this.globals = globals;
		this.formals = ImmutableList.copyOf(formals);
		this.frozen = false;
		this.locals = new LinkedHashMap<>();
		this.stackSlots = new TreeMap<>();
		this.ssaVars = new LinkedHashMap<>();
		this.ssaConstants = new LinkedHashMap<>();
		for (var formal : formals) {
			this.locals.put(formal.getName(), formal.getVarInfo());
		}
	}

	private LocalSymbolTable(LocalSymbolTable other) {
		this.globals = other.globals;
		this.formals = other.formals;
		this.frozen = true;
		this.locals = ImmutableMap.copyOf(other.locals);
		this.stackSlots = ImmutableSortedMap.copyOfSorted(other.stackSlots);
		this.ssaVars = ImmutableMap.copyOf(other.ssaVars);
		this.ssaConstants = ImmutableMap.copyOf(other.ssaConstants);
		other.ssaCounts.snapshot().forEach(this.ssaCounts::add);
	}

	/**
	 * @return An immutable copy of this table.  Lookups of existing symbols
	 *         still work; anything that would create one throws.
	 */
	public LocalSymbolTable snapshot() {
		return this.frozen ? this : new LocalSymbolTable(this);
	}

	public boolean isFrozen() {
		return this.frozen;
	}

	private void checkMutable(String what) {
		if (this.frozen) {
			throw new LiftContractException("Cannot create %s in a frozen symbol table", what);
		}
	}

	public GlobalSymbolTable getGlobals() {
		return this.globals;
	}

	/**
	 * @return The local with the given name, creating an untyped one if needed.
	 */
	public VarInfo local(String name) {
		return local(name, Optional.empty(), Optional.empty());
	}

	/**
	 * @return The local with the given name, creating it if needed.
	 */
	public VarInfo local(String name, Optional<Typ> type, Optional<String> description) {
		var existing = this.locals.get(name);
		if (existing != null) {
			return existing;
		}

		checkMutable("local " + name);
		var builder = VarInfo.builder(name);
		type.ifPresent(builder::type);
		description.ifPresent(builder::description);
		var varInfo = builder.build();
		this.locals.put(name, varInfo);
		return varInfo;
	}

	/**
	 * @return A placeholder variable for something that could not be resolved.
	 */
	public VarInfo placeholder(String description) {
		var name = "?" + description + "?";
		var existing = this.locals.get(name);
		if (existing != null) {
			return existing;
		}

		checkMutable("placeholder " + name);
		var varInfo = VarInfo.builder(name)
			.description(description)
			.placeholder()
			.build();
		this.locals.put(name, varInfo);
		return varInfo;
	}

	/**
	 * Add an existing variable as a local, e.g. one read back from an export.
	 */
	public void declare(VarInfo varInfo) {
		checkMutable("local " + varInfo.getName());
		if (this.locals.containsKey(varInfo.getName())) {
			throw new LiftContractException("Local %s is already declared", varInfo.getName());
		}
		this.locals.put(varInfo.getName(), varInfo);
	}

	/**
	 * @return The local or global with the given name.
	 */
	public Optional<VarInfo> lookup(String name) {
		var local = this.locals.get(name);
		if (local != null) {
			return Optional.of(local);
		}
		return this.globals.getGlobal(name);
	}

	public List<VarInfo> getLocals() {
		return new ArrayList<>(this.locals.values());
	}

	public ImmutableList<FormalInfo> getFormals() {
		return this.formals;
	}

	/**
	 * @return The formal passed in the given register.
	 */
	public Optional<FormalLocation> formalInRegister(String register) {
		for (var formal : this.formals) {
			for (var location : formal.getLocations()) {
				if (location instanceof ParameterLocation.Register r && r.register().equals(register)) {
					return Optional.of(new FormalLocation(formal, location));
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * @return The formal passed at the given stack offset.
	 */
	public Optional<FormalLocation> formalOnStack(long stackOffset) {
		for (var formal : this.formals) {
			for (var location : formal.getLocations()) {
				if (location instanceof ParameterLocation.Stack s && s.stackOffset() == stackOffset) {
					return Optional.of(new FormalLocation(formal, location));
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * @return The variable for the stack slot at an offset from the frame base.
	 */
	public VarInfo stackVar(long offset, Optional<Typ> type) {
		var name = offset < 0 ? "localvar_" + (-offset) : "stackvar_" + offset;
		var varInfo = local(name, type, Optional.of("stack slot at offset " + offset));
		if (!this.stackSlots.containsKey(offset)) {
			checkMutable("stack slot " + offset);
			this.stackSlots.put(offset, Nodes.varLval(varInfo));
		}
		return varInfo;
	}

	/**
	 * Bind a stack slot to the lvalue of a declared local.
	 */
	public void declareStackSlot(long offset, Lval lval) {
		checkMutable("stack slot " + offset);
		if (this.stackSlots.containsKey(offset)) {
			throw new LiftContractException("Stack slot %d is already declared", offset);
		}
		this.stackSlots.put(offset, lval);
	}

	/**
	 * @return The lvalues of the stack slots seen so far, by frame offset.
	 */
	public ImmutableMap<Long, Lval> getStackSlots() {
		return ImmutableMap.copyOf(this.stackSlots);
	}

	/**
	 * @return The SSA variable for the definition of a register at a site,
	 *         introducing it on first request.  Version numbers already taken
	 *         by a local of the same name are skipped.
	 */
	public VarInfo ssaVar(String register, String site, Optional<Typ> type) {
		var key = new SsaSite(register, site);
		var existing = this.ssaVars.get(key);
		if (existing != null) {
			return existing;
		}

		checkMutable("SSA variable for " + register + " at " + site);
		String name;
		do {
			name = register + "_" + this.ssaCounts.incrementAndGet(register);
		} while (this.locals.containsKey(name));

		var builder = VarInfo.builder(name)
			.description(register + " defined at " + site);
		type.ifPresent(builder::type);
		var varInfo = builder.build();
		this.ssaVars.put(key, varInfo);
		this.locals.put(varInfo.getName(), varInfo);
		return varInfo;
	}

	/**
	 * Bind a declared local as the SSA variable for a register definition.
	 */
	public void declareSsaVar(String register, String site, VarInfo varInfo) {
		checkMutable("SSA variable for " + register + " at " + site);
		if (this.locals.get(varInfo.getName()) != varInfo) {
			throw new LiftContractException("SSA variable %s is not a declared local", varInfo.getName());
		}
		var key = new SsaSite(register, site);
		if (this.ssaVars.containsKey(key)) {
			throw new LiftContractException("%s already has an SSA variable at %s", register, site);
		}
		this.ssaVars.put(key, varInfo);
		this.ssaCounts.increment(register);
	}

	/**
	 * @return Every SSA variable with the definition it was introduced for,
	 *         in order of introduction.
	 */
	public List<SsaDefinition> getSsaDefinitions() {
		List<SsaDefinition> result = new ArrayList<>();
		this.ssaVars.forEach((key, varInfo) -> result.add(new SsaDefinition(key.register(), key.site(), varInfo)));
		return result;
	}

	/**
	 * @return The SSA variable introduced for a register at a site, if any.
	 */
	public Optional<VarInfo> ssaVarAt(String register, String site) {
		return Optional.ofNullable(this.ssaVars.get(new SsaSite(register, site)));
	}

	/**
	 * @return All SSA variables introduced at a site.
	 */
	public List<VarInfo> ssaVarsAt(String site) {
		List<VarInfo> result = new ArrayList<>();
		this.ssaVars.forEach((key, varInfo) -> {
			if (key.site().equals(site)) {
				result.add(varInfo);
			}
		});
		return result;
	}

	/**
	 * Record that an SSA variable is assigned a known constant.
	 */
	public void recordSsaConstant(VarInfo varInfo, long value) {
		checkMutable("constant for " + varInfo.getName());
		this.ssaConstants.put(varInfo, value);
	}

	/**
	 * @return The constant assigned to an SSA variable, if known.
	 */
	public OptionalLong ssaConstant(VarInfo varInfo) {
		var value = this.ssaConstants.get(varInfo);
		return value == null ? OptionalLong.empty() : OptionalLong.of(value);
	}

	/**
	 * @return The known SSA constants, in order of recording.
	 */
	public ImmutableMap<VarInfo, Long> getSsaConstants() {
		return ImmutableMap.copyOf(this.ssaConstants);
	}

	public int getSsaCount() {
		return this.ssaVars.size();
	}

	/**
	 * The SSA variable introduced for the definition of a register at a site.
	 */
	public record SsaDefinition(String register, String site, VarInfo varInfo) {
	}

	/**
	 * A formal and the location of one of its parts.
	 */
	public record FormalLocation(FormalInfo formal, ParameterLocation location) {
	}
}
