package bclift.fact;

import java.util.Optional;

/**
 * The upstream analysis's store of dataflow facts, by index.
 */
public interface InvariantStore {
	Optional<DataflowFact> reachingDef(int index);

	Optional<DataflowFact> defUse(int index);

	Optional<DataflowFact> defUseHigh(int index);

	Optional<DataflowFact> flagReachingDef(int index);
}
