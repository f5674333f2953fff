package bclift.value;

import bclift.fact.FactDecodeException;
import bclift.fact.FactRecord;
import bclift.fact.IndexedTable;
import bclift.util.Cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A function's tables of interned variables, memory bases, memory offsets,
 * expressions and intervals, and their decoding into the value model.
 *
 * Decoded values are memoized per index.
 */
public final class FunctionDictionary {
	private final String name;

	private final IndexedTable variables;
	private final IndexedTable memoryBases;
	private final IndexedTable memoryOffsets;
	private final IndexedTable xprs;
	private final IndexedTable intervals;

	private final Cache<Integer, XVariable> variableCache = new Cache<>(this::decodeVariable);
	private final Cache<Integer, MemoryBase> memoryBaseCache = new Cache<>(this::decodeMemoryBase);
	private final Cache<Integer, XMemoryOffset> memoryOffsetCache = new Cache<>(this::decodeMemoryOffset);
	private final Cache<Integer, XXpr> xprCache = new Cache<>(this::decodeXpr);
	private final Cache<Integer, Interval> intervalCache = new Cache<>(this::decodeInterval);

	public FunctionDictionary(String name) {
		this.name = name;
		this.variables = new IndexedTable(name + ":variables");
		this.memoryBases = new IndexedTable(name + ":memory-bases");
		this.memoryOffsets = new IndexedTable(name + ":memory-offsets");
		this.xprs = new IndexedTable(name + ":xprs");
		this.intervals = new IndexedTable(name + ":intervals");
	}

	/**
	 * @return The name of the function this dictionary belongs to.
	 */
	public String getName() {
		return this.name;
	}

	public IndexedTable getVariableTable() {
		return this.variables;
	}

	public IndexedTable getMemoryBaseTable() {
		return this.memoryBases;
	}

	public IndexedTable getMemoryOffsetTable() {
		return this.memoryOffsets;
	}

	public IndexedTable getXprTable() {
		return this.xprs;
	}

	public IndexedTable getIntervalTable() {
		return this.intervals;
	}

	/**
	 * @return The variable with the given index.
	 * @throws FactDecodeException If its record is malformed.
	 */
	public XVariable variable(int index) {
		return this.variableCache.get(index);
	}

	public MemoryBase memoryBase(int index) {
		return this.memoryBaseCache.get(index);
	}

	public XMemoryOffset memoryOffset(int index) {
		return this.memoryOffsetCache.get(index);
	}

	/**
	 * @return The expression with the given index.
	 * @throws FactDecodeException If its record is malformed.
	 */
	public XXpr xpr(int index) {
		return this.xprCache.get(index);
	}

	public Interval interval(int index) {
		return this.intervalCache.get(index);
	}

	private XVariable decodeVariable(int index) {
		var record = this.variables.retrieve(index);
		switch (record.getKey()) {
			case "r":
				return new XVariable.Register(index, record.getTag(1));
			case "f":
				return new XVariable.Flag(index, record.getTag(1));
			case "t":
				return new XVariable.Temporary(index);
			case "m":
				return memoryVariable(index, memoryBase(record.getArg(0)), memoryOffset(record.getArg(1)));
			case "ir":
				return new XVariable.InitialRegisterValue(index, record.getTag(1));
			case "iv":
				return new XVariable.InitialMemoryValue(index, variable(record.getArg(0)));
			case "fr":
				var callee = record.getTags().size() > 2 ? Optional.of(record.getTag(2)) : Optional.<String>empty();
				return new XVariable.ReturnValue(index, record.getTag(1), callee);
			case "sv":
				return new XVariable.SymbolicValue(index, record.getTag(1), xpr(record.getArg(0)));
			default:
				throw unknownTag(record, this.variables);
		}
	}

	/**
	 * Normalize a memory variable into the kind its base determines.
	 */
	private static XVariable memoryVariable(int index, MemoryBase base, XMemoryOffset offset) {
		if (base == MemoryBase.Frame.LOCAL_STACK) {
			if (offset instanceof XMemoryOffset.Constant c) {
				return new XVariable.LocalStack(index, c.getValue(), c.getRest());
			} else if (offset.isNone()) {
				return new XVariable.LocalStack(index, 0, offset);
			}
		} else if (base == MemoryBase.Frame.GLOBAL && offset instanceof XMemoryOffset.Constant c) {
			return new XVariable.Global(index, c.getValue(), c.getRest());
		} else if (base instanceof MemoryBase.BaseVariable b) {
			return new XVariable.BaseMemory(index, b.getVariable(), offset);
		}
		return new XVariable.Memory(index, base, offset);
	}

	private MemoryBase decodeMemoryBase(int index) {
		var record = this.memoryBases.retrieve(index);
		switch (record.getKey()) {
			case "l":
				return MemoryBase.Frame.LOCAL_STACK;
			case "r":
				return MemoryBase.Frame.REALIGNED_STACK;
			case "a":
				return MemoryBase.Frame.ALLOCATED_STACK;
			case "v":
				return new MemoryBase.BaseVariable(variable(record.getArg(0)));
			case "g":
				return MemoryBase.Frame.GLOBAL;
			case "u":
				return new MemoryBase.Unknown(record.getTags().size() > 1 ? record.getTag(1) : "unknown");
			default:
				throw unknownTag(record, this.memoryBases);
		}
	}

	private XMemoryOffset decodeMemoryOffset(int index) {
		var record = this.memoryOffsets.retrieve(index);
		switch (record.getKey()) {
			case "n":
				return XMemoryOffset.none();
			case "c":
				return new XMemoryOffset.Constant(parseLong(record, 1), memoryOffset(record.getArg(0)));
			case "f":
				return new XMemoryOffset.Field(record.getTag(1), record.getArg(0), memoryOffset(record.getArg(1)));
			case "a":
				return new XMemoryOffset.Index(xpr(record.getArg(0)), memoryOffset(record.getArg(1)));
			case "i":
				return new XMemoryOffset.IndexByVariable(variable(record.getArg(0)), record.getArg(1), memoryOffset(record.getArg(2)));
			case "u":
				return new XMemoryOffset.Unknown();
			default:
				throw unknownTag(record, this.memoryOffsets);
		}
	}

	private XXpr decodeXpr(int index) {
		var record = this.xprs.retrieve(index);
		switch (record.getKey()) {
			case "ic": {
				int width = IntArith.DEFAULT_WIDTH;
				if (record.getTags().size() > 2) {
					width = (int) parseLong(record, 2);
				}
				return new XXpr.Constant(parseLong(record, 1), width, false);
			}
			case "ga":
				return new XXpr.Constant(parseLong(record, 1), IntArith.DEFAULT_WIDTH, true);
			case "v":
				return new XXpr.Var(variable(record.getArg(0)));
			case "x": {
				List<XXpr> operands = new ArrayList<>();
				for (int arg : record.getArgs()) {
					operands.add(xpr(arg));
				}
				return new XXpr.Compound(record.getTag(1), operands);
			}
			default:
				throw unknownTag(record, this.xprs);
		}
	}

	private Interval decodeInterval(int index) {
		var record = this.intervals.retrieve(index);
		return new Interval(optionalBound(record, 0), optionalBound(record, 1));
	}

	private static OptionalLong optionalBound(FactRecord record, int i) {
		if (i >= record.getTags().size() || record.getTag(i).isEmpty()) {
			return OptionalLong.empty();
		}
		return OptionalLong.of(parseLong(record, i));
	}

	private static long parseLong(FactRecord record, int tag) {
		var literal = record.getTag(tag);
		try {
			return IntArith.parse(literal);
		} catch (NumberFormatException e) {
			throw new FactDecodeException(record.getIndex(), "Bad integer literal '%s' in %s", literal, record);
		}
	}

	private static FactDecodeException unknownTag(FactRecord record, IndexedTable table) {
		return new FactDecodeException(record.getIndex(), "%s: unknown tag '%s' in %s", table.getName(), record.getKey(), record);
	}

	// Interning helpers for collaborators that build dictionaries directly

	public int addRegister(String register) {
		return this.variables.add(List.of("r", register), List.of());
	}

	public int addFlag(String flag) {
		return this.variables.add(List.of("f", flag), List.of());
	}

	public int addInitialRegisterValue(String register) {
		return this.variables.add(List.of("ir", register), List.of());
	}

	public int addInitialMemoryValue(int variable) {
		return this.variables.add(List.of("iv"), List.of(variable));
	}

	public int addReturnValue(String callSite, Optional<String> callee) {
		List<String> tags = new ArrayList<>(List.of("fr", callSite));
		callee.ifPresent(tags::add);
		return this.variables.add(tags, List.of());
	}

	public int addMemoryVariable(int base, int offset) {
		return this.variables.add(List.of("m"), List.of(base, offset));
	}

	/**
	 * @return The index of the stack slot at the given frame offset.
	 */
	public int addStackVariable(long offset) {
		return addMemoryVariable(addLocalStackBase(), addConstantOffset(offset, addNoOffset()));
	}

	/**
	 * @return The index of the global at the given address.
	 */
	public int addGlobalVariable(long address, int rest) {
		return addMemoryVariable(addGlobalBase(), addConstantOffset(address, rest));
	}

	public int addLocalStackBase() {
		return this.memoryBases.add(List.of("l"), List.of());
	}

	public int addGlobalBase() {
		return this.memoryBases.add(List.of("g"), List.of());
	}

	public int addBaseVariable(int variable) {
		return this.memoryBases.add(List.of("v"), List.of(variable));
	}

	public int addUnknownBase(String description) {
		return this.memoryBases.add(List.of("u", description), List.of());
	}

	public int addNoOffset() {
		return this.memoryOffsets.add(List.of("n"), List.of());
	}

	public int addConstantOffset(long value, int rest) {
		return this.memoryOffsets.add(List.of("c", Long.toString(value)), List.of(rest));
	}

	public int addFieldOffset(String field, int compKey, int rest) {
		return this.memoryOffsets.add(List.of("f", field), List.of(compKey, rest));
	}

	public int addIndexOffset(int xpr, int rest) {
		return this.memoryOffsets.add(List.of("a"), List.of(xpr, rest));
	}

	public int addConstant(long value) {
		return this.xprs.add(List.of("ic", Long.toString(value)), List.of());
	}

	public int addGlobalAddress(long value) {
		return this.xprs.add(List.of("ga", Long.toString(value)), List.of());
	}

	public int addVariableXpr(int variable) {
		return this.xprs.add(List.of("v"), List.of(variable));
	}

	public int addCompound(String operator, int... operands) {
		List<Integer> args = new ArrayList<>();
		for (int operand : operands) {
			args.add(operand);
		}
		return this.xprs.add(List.of("x", operator), args);
	}

	public int addCompound(XOperator operator, int... operands) {
		return addCompound(operator.getName(), operands);
	}

	public int addInterval(OptionalLong low, OptionalLong high) {
		var lo = low.isPresent() ? Long.toString(low.getAsLong()) : "";
		var hi = high.isPresent() ? Long.toString(high.getAsLong()) : "";
		return this.intervals.add(List.of(lo, hi), List.of());
	}
}
