package maze.planning;

/**
 * Thrown when a node is removed from an empty {@link Frontier}.
 * Callers are expected to check {@link Frontier#isEmpty()} first, so this signals a bug.
 */
public class EmptyFrontierException extends IllegalStateException {

    public EmptyFrontierException(String frontierName) {
        super("Cannot remove from empty frontier: " + frontierName);
    }
}
