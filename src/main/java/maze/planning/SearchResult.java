package maze.planning;

import maze.domain.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one search. Immutable.
 */
public final class SearchResult {
    private final SearchMode mode;
    private final SearchStatus status;
    private final Solution solution;
    private final List<Position> exploredOrder;
    private final Set<Position> explored;

    SearchResult(SearchMode mode, SearchStatus status, Solution solution, List<Position> exploredOrder) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Search has not finished: " + status);
        }
        if ((status == SearchStatus.GOAL_FOUND) != (solution != null)) {
            throw new IllegalArgumentException("A solution is present exactly when the goal was found");
        }
        this.mode = mode;
        this.status = status;
        this.solution = solution;
        this.exploredOrder = Collections.unmodifiableList(new ArrayList<>(exploredOrder));
        this.explored = Collections.unmodifiableSet(new LinkedHashSet<>(exploredOrder));
    }

    public SearchStatus getStatus() { return status; }

    public boolean isSolved() { return status == SearchStatus.GOAL_FOUND; }

    /**
     * @return the path from start to goal
     * @throws NoSolutionException if the goal was not reached
     */
    public Solution getSolution() {
        if (solution == null) {
            throw new NoSolutionException(status, getExploredCount());
        }
        return solution;
    }

    /** @return number of nodes dequeued from the frontier */
    public int getExploredCount() { return exploredOrder.size(); }

    /** @return cells in the order they were dequeued */
    public List<Position> getExploredOrder() { return exploredOrder; }

    public boolean isExplored(Position cell) { return explored.contains(cell); }

    /** @return explored cells, iterating in dequeue order */
    public Set<Position> getExplored() { return explored; }

    @Override
    public String toString() {
        if (solution != null) {
            return "SearchResult[" + mode.getName() + ", length=" + solution.length()
                    + ", explored=" + getExploredCount() + "]";
        }
        return "SearchResult[" + mode.getName() + ", " + status + ", explored=" + getExploredCount() + "]";
    }
}
