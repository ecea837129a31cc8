package maze.planning;

import java.util.Locale;

/**
 * Selects how a maze is searched.
 *
 * - BFS: uninformed breadth-first search over a {@link FifoFrontier}
 * - ASTAR: A* over a {@link PriorityFrontier} with the {@link ManhattanHeuristic}
 */
public enum SearchMode {
    BFS("BFS"),
    ASTAR("A*");

    private final String displayName;

    SearchMode(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return the name of this mode (for logging)
     */
    public String getName() {
        return displayName;
    }

    /**
     * @return true if nodes are ordered by g + h
     */
    public boolean isInformed() {
        return this == ASTAR;
    }

    /**
     * Creates a fresh, empty frontier for one search.
     */
    public Frontier createFrontier() {
        return switch (this) {
            case BFS -> new FifoFrontier();
            case ASTAR -> new PriorityFrontier();
        };
    }

    /**
     * @return the heuristic for informed modes, or null for uninformed ones
     */
    public Heuristic createHeuristic() {
        return isInformed() ? new ManhattanHeuristic() : null;
    }

    /**
     * Parses a mode selector as accepted on the command line.
     *
     * @param s "bfs", "queue" or "astar" (case-insensitive)
     * @return the corresponding mode
     * @throws IllegalArgumentException if the selector is unknown
     */
    public static SearchMode fromString(String s) {
        if (s == null) {
            throw new IllegalArgumentException("unknown search mode: null (use 'bfs' or 'astar')");
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "bfs", "queue" -> BFS;
            case "astar", "a*" -> ASTAR;
            default -> throw new IllegalArgumentException("unknown search mode: '" + s + "' (use 'bfs' or 'astar')");
        };
    }
}
