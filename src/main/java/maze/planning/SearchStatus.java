package maze.planning;

/**
 * Lifecycle of a {@link SearchSession}. EXPANDING is the only non-terminal state.
 */
public enum SearchStatus {
    /** Nodes remain to be expanded */
    EXPANDING,
    /** The goal was dequeued; a solution exists */
    GOAL_FOUND,
    /** The frontier ran empty before the goal was reached */
    NO_SOLUTION,
    /** The configured expansion limit was hit first */
    STATE_LIMIT_REACHED;

    public boolean isTerminal() {
        return this != EXPANDING;
    }
}
