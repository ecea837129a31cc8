package maze.planning;

/**
 * Configuration for maze searches.
 * Centralizes all configurable parameters to avoid hardcoding.
 */
public class SearchConfig {

    /** Default maximum states to explore: unbounded, a search runs until goal or exhaustion */
    public static final int DEFAULT_MAX_STATES = Integer.MAX_VALUE;

    /** Progress logging interval (log every N states) */
    public static final int PROGRESS_LOG_INTERVAL = 10_000;

    /** System property overriding the log level */
    public static final String LOG_LEVEL_PROPERTY = "maze.logLevel";

    /** Environment variable overriding the log level */
    public static final String LOG_LEVEL_ENV = "MAZE_LOG_LEVEL";

    // ========== Logging Configuration ==========

    public static final int SILENT = 0;
    public static final int MINIMAL = 1;
    public static final int NORMAL = 2;
    public static final int VERBOSE = 3;

    /**
     * Log level for controlling output verbosity.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (only final results)
     * 2 = NORMAL (+ search summaries)
     * 3 = VERBOSE (+ progress and per-session detail)
     */
    public static final int LOG_LEVEL = resolveLogLevel();

    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= VERBOSE; }

    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= NORMAL; }

    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= MINIMAL; }

    private static int resolveLogLevel() {
        String value = System.getProperty(LOG_LEVEL_PROPERTY);
        if (value == null) {
            value = System.getenv(LOG_LEVEL_ENV);
        }
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            int level = Integer.parseInt(value.trim());
            return Math.max(SILENT, Math.min(VERBOSE, level));
        } catch (NumberFormatException e) {
            System.err.println("SearchConfig: Ignoring invalid log level '" + value + "', using NORMAL");
            return NORMAL;
        }
    }

    // Instance configuration
    private int maxStates = DEFAULT_MAX_STATES;

    public SearchConfig() {}

    public SearchConfig(int maxStates) {
        setMaxStates(maxStates);
    }

    /**
     * Creates a SearchConfig with default values.
     * Factory method for cleaner API.
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }

    public int getMaxStates() { return maxStates; }

    /**
     * Caps the number of expansions a single search may perform.
     *
     * @param maxStates positive limit
     * @throws IllegalArgumentException if the limit is not positive
     */
    public void setMaxStates(int maxStates) {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates must be positive: " + maxStates);
        }
        this.maxStates = maxStates;
    }

    public boolean isBounded() { return maxStates != DEFAULT_MAX_STATES; }
}
