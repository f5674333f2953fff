package bclift.lift;

import bclift.LiftConfig;
import bclift.LiftContractException;
import bclift.util.Counter;
import bclift.util.Log;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The diagnostics of one function lift.
 */
public final class Diagnostics {
	private final boolean frozen;
	private final List<Diagnostic> diagnostics;
	private final Counter<Diagnostic.Kind> counts = new Counter<>();

	public Diagnostics() {
		this.frozen = false;
		this.diagnostics = new ArrayList<>();
	}

	private Diagnostics(Diagnostics other) {
		this.frozen = true;
		this.diagnostics = ImmutableList.copyOf(other.diagnostics);
		other.counts.snapshot().forEach(this.counts::add);
	}

	/**
	 * @return An immutable copy of the diagnostics reported so far.
	 */
	public Diagnostics snapshot() {
		return this.frozen ? this : new Diagnostics(this);
	}

	public boolean isFrozen() {
		return this.frozen;
	}

	/**
	 * Record a diagnostic.
	 *
	 * @return The recorded diagnostic.
	 */
	public Diagnostic report(String site, Diagnostic.Kind kind, String format, Object... args) {
		if (this.frozen) {
			throw new LiftContractException("%s: diagnostic reported after the lift was finished", site);
		}

		var diagnostic = new Diagnostic(site, kind, String.format(format, args));
		this.diagnostics.add(diagnostic);
		this.counts.increment(kind);

		if (LiftConfig.SHOW_DIAGNOSTICS) {
			Log.warn("%s", diagnostic);
		} else {
			Log.debug("%s", diagnostic);
		}
		return diagnostic;
	}

	/**
	 * Record a diagnostic that was already reported elsewhere, without logging it.
	 */
	void add(Diagnostic diagnostic) {
		if (this.frozen) {
			throw new LiftContractException("%s: diagnostic added after the lift was finished", diagnostic.site());
		}
		this.diagnostics.add(diagnostic);
		this.counts.increment(diagnostic.kind());
	}

	public ImmutableList<Diagnostic> getAll() {
		return ImmutableList.copyOf(this.diagnostics);
	}

	/**
	 * @return The diagnostics recorded for a site.
	 */
	public List<Diagnostic> at(String site) {
		List<Diagnostic> result = new ArrayList<>();
		for (var diagnostic : this.diagnostics) {
			if (diagnostic.site().equals(site)) {
				result.add(diagnostic);
			}
		}
		return result;
	}

	public long count(Diagnostic.Kind kind) {
		return this.counts.get(kind);
	}

	public int size() {
		return this.diagnostics.size();
	}

	/**
	 * @return The number of diagnostics of each kind.
	 */
	public Map<Diagnostic.Kind, Long> getCounts() {
		return this.counts.snapshot();
	}
}
