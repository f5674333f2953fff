package bclift.util;

import bclift.util.Log.Level;

import com.google.common.base.Throwables;

/**
 * Terminal backend for {@link Log}: one colored line per message, with
 * multi-line messages and stack traces indented beneath a header.
 */
public final class TtyErrorLogger {
	public static final TtyErrorLogger INSTANCE = new TtyErrorLogger();

	private TtyErrorLogger() {
	}

	private static String color(Level level) {
		switch (level) {
			case INFO:
				return "cyan";
			case WARN:
				return "yellow";
			case ERROR:
				return "red";
			default:
				return "gray";
		}
	}

	private void header(Level level, String tag, String line) {
		var fg = color(level);
		if (level.compareTo(Level.WARN) >= 0) {
			Tty.print("<fg=%s><b>%-5s</b> <i>%-20s</i> <b>%s</b></fg>\n", fg, level, tag, line);
		} else if (level == Level.INFO) {
			Tty.print("<fg=%s><b>%-5s</b> <i>%-20s</i></fg> %s\n", fg, level, tag, line);
		} else {
			Tty.print("<fg=%s><b>%-5s</b> <i>%-20s</i> %s</fg>\n", fg, level, tag, line);
		}
	}

	private void trailer(Level level, String line) {
		if (level == Level.INFO) {
			Tty.print("%s\n", line);
		} else if (level.compareTo(Level.WARN) >= 0) {
			Tty.print("<fg=%s><b>%s</b></fg>\n", color(level), line);
		} else {
			Tty.print("<fg=%s>%s</fg>\n", color(level), line);
		}
	}

	private void stackTrace(Level level, String line) {
		Tty.print("<fg=%s>%s</fg>\n", color(level), line);
	}

	/**
	 * Print a message, and the stack trace of {@code e} if it is not null.
	 * Disabled levels print nothing.
	 */
	public void log(Level level, Class<?> src, String msg, Throwable e) {
		if (!level.isEnabled()) {
			return;
		}

		// Avoid interleaved lines
		synchronized (this) {
			var tag = src.getSimpleName();
			if (msg.contains("\n")) {
				header(level, tag, "");
				msg.lines()
					.forEach(line -> trailer(level, line));
			} else {
				header(level, tag, msg);
			}

			if (e != null) {
				Throwables.getStackTraceAsString(e)
					.lines()
					.forEach(line -> stackTrace(level, line));
			}
		}
	}
}
