package bclift.type;

import bclift.ast.NamedType;
import bclift.ast.Typ;

import java.util.HashSet;
import java.util.Optional;

/**
 * Lookup of named type definitions.
 */
public interface TypeDefinitions {
	/**
	 * @return The struct or union definition with the given key.
	 */
	Optional<CompInfo> getCompInfo(int key);

	/**
	 * @return The type a typedef name stands for.
	 */
	Optional<Typ> getTypedef(String name);

	/**
	 * @return The given type with any typedefs resolved.
	 */
	default Typ unroll(Typ type) {
		var seen = new HashSet<String>();
		while (type instanceof NamedType named && seen.add(named.getName())) {
			var next = getTypedef(named.getName());
			if (next.isEmpty()) {
				break;
			}
			type = next.get();
		}
		return type;
	}
}
