package bclift.type;

import bclift.ast.CompType;
import bclift.ast.Nodes;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A struct or union definition.
 */
public final class CompInfo {
	private final String name;
	private final int key;
	private final boolean isStruct;
	private final Layout layout;
	private final OptionalInt declaredSize;

	public CompInfo(String name, int key, boolean isStruct, List<FieldInfo> fields, OptionalInt declaredSize) {
		this.name = name;
		this.key = key;
		this.isStruct = isStruct;
		this.layout = Layout.of(fields);
		this.declaredSize = declaredSize;
	}

	/**
	 * @return A struct with the given fields and no declared size.
	 */
	public static CompInfo struct(String name, int key, List<FieldInfo> fields) {
		return new CompInfo(name, key, true, fields, OptionalInt.empty());
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The key that identifies this definition in the global symbol table.
	 */
	public int getKey() {
		return this.key;
	}

	public boolean isStruct() {
		return this.isStruct;
	}

	public Layout getLayout() {
		return this.layout;
	}

	public List<FieldInfo> getFields() {
		return this.layout.getFields();
	}

	public boolean hasFieldOffsets() {
		return this.layout.hasFieldOffsets();
	}

	public Optional<Layout.FieldAt> fieldAt(int offset) {
		return this.layout.fieldAt(offset);
	}

	public Optional<FieldInfo> getField(String name) {
		return this.layout.getField(name);
	}

	/**
	 * @return The declared size, or else the extent of the fields.
	 */
	public OptionalInt getByteSize() {
		if (this.declaredSize.isPresent()) {
			return this.declaredSize;
		}
		return this.layout.getByteSize();
	}

	/**
	 * @return A type node referring to this definition.
	 */
	public CompType toType() {
		return Nodes.compType(this.name, this.key);
	}

	@Override
	public String toString() {
		return (this.isStruct ? "struct " : "union ") + this.name;
	}
}
