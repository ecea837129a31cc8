package maze.planning;

/**
 * Thrown when a solution is requested from a search that did not reach the goal.
 */
public class NoSolutionException extends RuntimeException {

    private final SearchStatus status;
    private final int exploredCount;

    public NoSolutionException(SearchStatus status, int exploredCount) {
        super(status == SearchStatus.STATE_LIMIT_REACHED
                ? "no solution within " + exploredCount + " explored states"
                : "no solution (explored " + exploredCount + " states)");
        this.status = status;
        this.exploredCount = exploredCount;
    }

    public SearchStatus getStatus() { return status; }

    public int getExploredCount() { return exploredCount; }
}
