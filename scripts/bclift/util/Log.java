package bclift.util;

import bclift.LiftConfig;

import com.google.common.base.Throwables;

import java.util.Locale;

/**
 * Static logging facade.  Messages are formatted only when their level is
 * enabled, and are tagged with the class that logged them.
 */
public final class Log {
	/**
	 * Available log levels, from most to least verbose.
	 */
	public enum Level {
		TRACE,
		DEBUG,
		INFO,
		WARN,
		ERROR;

		/**
		 * @return Whether this log level is enabled.
		 */
		public boolean isEnabled() {
			// LEVEL is still null while it is being parsed
			return LEVEL == null || this.ordinal() >= LEVEL.ordinal();
		}
	}

	private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

	/** The current log level (from $BCLIFT_LOG_LEVEL). */
	public static final Level LEVEL = parseLevel(LiftConfig.LOG_LEVEL);

	private static Level parseLevel(String level) {
		try {
			return Level.valueOf(level.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			TtyErrorLogger.INSTANCE.log(Level.WARN, Log.class, "Unknown log level '" + level + "', using INFO", null);
			return Level.INFO;
		}
	}

	private Log() {
	}

	/**
	 * @return The first class on the stack outside this one.
	 */
	private static Class<?> caller() {
		return WALKER.walk(frames -> frames
			.map(StackWalker.StackFrame::getDeclaringClass)
			.filter(c -> c != Log.class)
			.findFirst()
			.orElse(Log.class));
	}

	private static void log(Level level, Throwable e, String format, Object... args) {
		if (!level.isEnabled()) {
			return;
		}

		String message;
		if (format == null) {
			message = Throwables.getRootCause(e).toString();
		} else {
			message = String.format(format, args);
		}
		TtyErrorLogger.INSTANCE.log(level, caller(), message, e);
	}

	public static void trace(String format, Object... args) {
		log(Level.TRACE, null, format, args);
	}

	public static void debug(String format, Object... args) {
		log(Level.DEBUG, null, format, args);
	}

	public static void info(String format, Object... args) {
		log(Level.INFO, null, format, args);
	}

	public static void warn(String format, Object... args) {
		log(Level.WARN, null, format, args);
	}

	public static void error(String format, Object... args) {
		log(Level.ERROR, null, format, args);
	}

	/**
	 * Log an error with its stack trace.
	 */
	public static void error(Throwable e, String format, Object... args) {
		log(Level.ERROR, e, format, args);
	}

	/**
	 * Log an error with its stack trace, described by its root cause.
	 */
	public static void error(Throwable e) {
		log(Level.ERROR, e, null);
	}
}
