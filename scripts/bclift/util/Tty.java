package bclift.util;

import java.util.Map;

/**
 * Utilities for TTY formatting.
 */
public final class Tty {
	/** Whether standard output is a TTY. */
	public static final boolean IS_A_TTY = System.console() != null;

	private static final Map<String, String> COLORS = Map.ofEntries(
		Map.entry("<b>", "\033[1m"),
		Map.entry("</b>", "\033[22m"),

		Map.entry("<i>", "\033[3m"),
		Map.entry("</i>", "\033[23m"),

		Map.entry("<fg=red>", "\033[31m"),
		Map.entry("<fg=yellow>", "\033[33m"),
		Map.entry("<fg=cyan>", "\033[36m"),
		Map.entry("<fg=gray>", "\033[90m"),
		Map.entry("</fg>", "\033[39m")
	);

	private Tty() {
	}

	/**
	 * Print a formatted message, replacing color markup.
	 *
	 * Markup is expanded after formatting, so arguments may select colors.
	 */
	public static void print(String format, Object... args) {
		System.out.print(markup(String.format(format, args)));
	}

	/**
	 * @return The text with markup replaced by escape codes (or removed, if
	 *         standard output is not a TTY).
	 */
	static String markup(String text) {
		for (var color : COLORS.entrySet()) {
			var value = IS_A_TTY ? color.getValue() : "";
			text = text.replace(color.getKey(), value);
		}
		return text;
	}
}
