package bclift;

/**
 * Lifting configuration.
 */
public final class LiftConfig {
	/** Log level name (from $BCLIFT_LOG_LEVEL). */
	public static final String LOG_LEVEL = stringEnv("BCLIFT_LOG_LEVEL", "INFO");

	/** Whether resolution diagnostics are logged as warnings instead of debug messages. */
	public static final boolean SHOW_DIAGNOSTICS = checkEnv("BCLIFT_SHOW_DIAGNOSTICS");

	/** Whether re-mapping a low-level node is a contract violation instead of an overwrite. */
	public static final boolean STRICT_PROVENANCE = checkEnv("BCLIFT_STRICT_PROVENANCE");

	/** Byte size of pointers and of the default machine word. */
	public static final int POINTER_SIZE = intEnv("BCLIFT_POINTER_SIZE", 4);

	/** Whether batch lifting runs sequentially. */
	public static final boolean SEQUENTIAL = checkEnv("BCLIFT_SEQUENTIAL");

	private LiftConfig() {
	}

	/**
	 * Check if a setting has been enabled through an environment variable.
	 */
	private static boolean checkEnv(String var) {
		String value = System.getenv(var);
		return value != null && !value.isEmpty();
	}

	/**
	 * Get a string value from the environment.
	 */
	private static String stringEnv(String var, String def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return value;
		} else {
			return def;
		}
	}

	/**
	 * Get an integer value from the environment.
	 */
	private static int intEnv(String var, int def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return Integer.parseInt(value);
		} else {
			return def;
		}
	}
}
