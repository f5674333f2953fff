package bclift.lift;

import bclift.LiftConfig;
import bclift.LiftContractException;
import bclift.fact.FactDecodeException;
import bclift.util.Log;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lifts many functions concurrently.  A function whose facts cannot be
 * decoded fails alone; the rest of the batch completes.
 */
public final class BatchLifter {
	private final FunctionLifter lifter;

	public BatchLifter(FunctionLifter lifter) {
		this.lifter = lifter;
	}

	/**
	 * Lift a batch of functions.
	 */
	public BatchResult liftAll(Collection<FunctionUnit> units) {
		Log.info("Lifting %,d functions", units.size());

		var stream = LiftConfig.SEQUENTIAL ? units.stream() : units.parallelStream();
		var outcomes = stream
			.map(this::tryLift)
			.collect(ImmutableList.toImmutableList());

		var lifts = outcomes.stream()
			.flatMap(o -> o.lift().stream())
			.collect(ImmutableList.toImmutableList());
		var failures = outcomes.stream()
			.flatMap(o -> o.failure().stream())
			.collect(ImmutableList.toImmutableList());

		Log.info("Lifted %,d functions, %,d failed", lifts.size(), failures.size());
		return new BatchResult(lifts, failures);
	}

	private Outcome tryLift(FunctionUnit unit) {
		try {
			return new Outcome(Optional.of(this.lifter.lift(unit)), Optional.empty());
		} catch (FactDecodeException | LiftContractException e) {
			Log.error(e, "Error lifting %s: %s", unit, e.getMessage());
			return new Outcome(Optional.empty(), Optional.of(new LiftFailure(unit.getName(), e)));
		} catch (RuntimeException e) {
			Log.error("While lifting %s: %s", unit, e.getMessage());
			throw e;
		}
	}

	private record Outcome(Optional<FunctionLift> lift, Optional<LiftFailure> failure) {
	}

	/**
	 * A function that could not be lifted.
	 */
	public record LiftFailure(String function, RuntimeException cause) {
		@Override
		public String toString() {
			return this.function + "(): " + this.cause.getMessage();
		}
	}

	/**
	 * The functions lifted in a batch, in input order, and those that failed.
	 */
	public record BatchResult(ImmutableList<FunctionLift> lifts, ImmutableList<LiftFailure> failures) {
		public Optional<FunctionLift> get(String function) {
			return this.lifts.stream()
				.filter(l -> l.getName().equals(function))
				.findFirst();
		}

		public String summary() {
			return this.failures.stream()
				.map(LiftFailure::toString)
				.collect(Collectors.joining("\n", this.lifts.size() + " lifted, " + this.failures.size() + " failed\n", ""));
		}
	}
}
