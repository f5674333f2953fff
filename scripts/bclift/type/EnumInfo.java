package bclift.type;

import bclift.ast.EnumType;
import bclift.ast.IKind;
import bclift.ast.Nodes;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * An enum definition.
 */
public final class EnumInfo {
	private final String name;
	private final IKind kind;
	private final ImmutableMap<String, Long> items;

	public EnumInfo(String name, IKind kind, Map<String, Long> items) {
		this.name = name;
		this.kind = kind;
		this.items = ImmutableMap.copyOf(items);
	}

	public String getName() {
		return this.name;
	}

	public IKind getKind() {
		return this.kind;
	}

	/**
	 * @return The enumerators, in declaration order.
	 */
	public ImmutableMap<String, Long> getItems() {
		return this.items;
	}

	/**
	 * @return The first enumerator with the given value.
	 */
	public Optional<String> nameOf(long value) {
		return this.items.entrySet()
			.stream()
			.filter(e -> e.getValue() == value)
			.map(Map.Entry::getKey)
			.findFirst();
	}

	public EnumType toType() {
		return Nodes.enumType(this.name, this.kind);
	}
}
