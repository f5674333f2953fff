package bclift.symbol;

import bclift.LiftContractException;
import bclift.ast.Typ;
import bclift.ast.VarInfo;
import bclift.type.CompInfo;
import bclift.type.EnumInfo;
import bclift.type.TypeDefinitions;
import bclift.type.TypeSizes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Process-wide, append-only table of composite, enum and typedef definitions
 * and global variables.  Shared by all function lifts; readers run
 * concurrently and writers are serialized.
 */
public final class GlobalSymbolTable implements TypeDefinitions {
	private final ReadWriteLock lock = new ReentrantReadWriteLock();
	private final Map<Integer, CompInfo> compInfos = new HashMap<>();
	private final Map<String, EnumInfo> enums = new HashMap<>();
	private final Map<String, Typ> typedefs = new HashMap<>();
	private final Map<String, VarInfo> globalsByName = new HashMap<>();
	private final TreeMap<Long, VarInfo> globalsByAddress = new TreeMap<>();

	private <T> T read(Supplier<T> action) {
		this.lock.readLock().lock();
		try {
			return action.get();
		} finally {
			this.lock.readLock().unlock();
		}
	}

	private <T> T write(Supplier<T> action) {
		this.lock.writeLock().lock();
		try {
			return action.get();
		} finally {
			this.lock.writeLock().unlock();
		}
	}

	/**
	 * Register a struct or union definition.
	 *
	 * @return The registered definition for this key.
	 * @throws LiftContractException If the key is taken by a different definition.
	 */
	public CompInfo addCompInfo(CompInfo compInfo) {
		return write(() -> {
			var existing = this.compInfos.putIfAbsent(compInfo.getKey(), compInfo);
			if (existing == null) {
				return compInfo;
			} else if (!existing.getName().equals(compInfo.getName())) {
				throw new LiftContractException("Composite key %d is %s, not %s", compInfo.getKey(), existing, compInfo);
			}
			return existing;
		});
	}

	@Override
	public Optional<CompInfo> getCompInfo(int key) {
		return read(() -> Optional.ofNullable(this.compInfos.get(key)));
	}

	public EnumInfo addEnum(EnumInfo enumInfo) {
		return write(() -> {
			var existing = this.enums.putIfAbsent(enumInfo.getName(), enumInfo);
			return existing == null ? enumInfo : existing;
		});
	}

	public Optional<EnumInfo> getEnum(String name) {
		return read(() -> Optional.ofNullable(this.enums.get(name)));
	}

	public void addTypedef(String name, Typ type) {
		write(() -> this.typedefs.putIfAbsent(name, type));
	}

	@Override
	public Optional<Typ> getTypedef(String name) {
		return read(() -> Optional.ofNullable(this.typedefs.get(name)));
	}

	/**
	 * Register a global variable.
	 *
	 * @return The var-info for this global, which already exists if the name is
	 *         already registered.
	 */
	public VarInfo addGlobal(String name, Optional<Typ> type, long address) {
		return write(() -> {
			var existing = this.globalsByName.get(name);
			if (existing != null) {
				return existing;
			}

			var builder = VarInfo.builder(name).globalAddress(address);
			type.ifPresent(builder::type);
			var varInfo = builder.build();
			this.globalsByName.put(name, varInfo);
			this.globalsByAddress.putIfAbsent(address, varInfo);
			return varInfo;
		});
	}

	public Optional<VarInfo> getGlobal(String name) {
		return read(() -> Optional.ofNullable(this.globalsByName.get(name)));
	}

	/**
	 * @return The global that starts at exactly this address.
	 */
	public Optional<VarInfo> globalAt(long address) {
		return read(() -> Optional.ofNullable(this.globalsByAddress.get(address)));
	}

	/**
	 * Find the global whose extent contains an address.
	 *
	 * @return The global and the offset of the address within it.
	 */
	public Optional<GlobalOffset> globalContaining(long address, TypeSizes sizes) {
		var entry = read(() -> this.globalsByAddress.floorEntry(address));
		if (entry == null) {
			return Optional.empty();
		}

		var global = entry.getValue();
		long offset = address - entry.getKey();
		if (offset == 0) {
			return Optional.of(new GlobalOffset(global, 0));
		}

		var size = global.getType().map(sizes::sizeOf);
		if (size.isEmpty() || size.get().isEmpty() || offset >= size.get().getAsInt()) {
			return Optional.empty();
		}
		return Optional.of(new GlobalOffset(global, offset));
	}

	public List<VarInfo> getGlobals() {
		return read(() -> new ArrayList<>(this.globalsByAddress.values()));
	}

	public int getCompInfoCount() {
		return read(this.compInfos::size);
	}

	/**
	 * A global variable and an offset into it.
	 */
	public record GlobalOffset(VarInfo global, long offset) {
	}
}
