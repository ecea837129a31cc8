package maze.planning;

import maze.domain.Maze;
import maze.domain.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One graph search over a maze, advanced one expansion at a time.
 *
 * Construction initializes the search: the start node goes into a fresh frontier
 * (with priority h(start) for informed modes) and the explored set is empty.
 * Each {@link #step()} then dequeues one node, records it as explored and either
 * finishes on the goal or adds its unseen neighbors to the frontier.
 *
 * A session owns its frontier and explored set and is not thread-safe.
 * Callers that animate the search call {@link #step()} between frames;
 * everyone else uses {@link MazeSolver}.
 */
public class SearchSession {

    private final Maze maze;
    private final SearchMode mode;
    private final int maxStates;

    /** Null for uninformed modes */
    private final Heuristic heuristic;

    private final Frontier frontier;
    private final Set<Position> explored = new HashSet<>();
    private final List<Position> exploredOrder = new ArrayList<>();

    private SearchStatus status = SearchStatus.EXPANDING;
    private SearchNode goalNode;

    public SearchSession(Maze maze, SearchMode mode) {
        this(maze, mode, SearchConfig.defaults());
    }

    public SearchSession(Maze maze, SearchMode mode, SearchConfig config) {
        this.maze = Objects.requireNonNull(maze, "maze");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.maxStates = Objects.requireNonNull(config, "config").getMaxStates();
        this.heuristic = mode.createHeuristic();
        this.frontier = mode.createFrontier();

        SearchNode start = SearchNode.root(maze.getStart());
        if (heuristic != null) {
            frontier.add(start, priorityOf(start));
        } else {
            frontier.add(start);
        }

        if (SearchConfig.isVerbose()) {
            System.err.println(mode.getName() + ": Searching " + maze + " with " + frontier.getName()
                    + " frontier" + (config.isBounded() ? ", limit " + maxStates + " states" : ""));
        }
    }

    /**
     * Expands the next node of the frontier.
     *
     * @return the cell that was dequeued and marked explored
     * @throws IllegalStateException if the session already finished
     */
    public Position step() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Search already finished: " + status);
        }

        SearchNode current = frontier.remove();
        explored.add(current.state);
        exploredOrder.add(current.state);

        if (SearchConfig.isVerbose() && exploredOrder.size() % SearchConfig.PROGRESS_LOG_INTERVAL == 0) {
            System.err.println(mode.getName() + ": Explored " + exploredOrder.size()
                    + " states, frontier size " + frontier.size());
        }

        if (current.state.equals(maze.getGoal())) {
            goalNode = current;
            status = SearchStatus.GOAL_FOUND;
            return current.state;
        }

        for (Maze.Neighbor neighbor : maze.neighbors(current.state)) {
            if (explored.contains(neighbor.position) || frontier.containsState(neighbor.position)) {
                continue;
            }
            SearchNode child = current.child(neighbor.direction, neighbor.position);
            if (heuristic != null) {
                frontier.add(child, priorityOf(child));
            } else {
                frontier.add(child);
            }
        }

        if (frontier.isEmpty()) {
            status = SearchStatus.NO_SOLUTION;
        } else if (exploredOrder.size() >= maxStates) {
            status = SearchStatus.STATE_LIMIT_REACHED;
        }
        return current.state;
    }

    /**
     * Steps until the session reaches a terminal status.
     *
     * @return the result of the search
     */
    public SearchResult runToCompletion() {
        while (!status.isTerminal()) {
            step();
        }
        return toResult();
    }

    /**
     * @return the result of the finished search
     * @throws IllegalStateException if the session is still expanding
     */
    public SearchResult toResult() {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Search is still expanding after " + exploredOrder.size() + " states");
        }
        Solution solution = goalNode != null ? Solution.fromGoalNode(goalNode) : null;
        return new SearchResult(mode, status, solution, exploredOrder);
    }

    private int priorityOf(SearchNode node) {
        // f = g + h
        return node.cost + heuristic.estimate(node.state, maze.getGoal());
    }

    public SearchStatus getStatus() { return status; }

    public boolean isFinished() { return status.isTerminal(); }

    public int getExploredCount() { return exploredOrder.size(); }

    /** @return read-only view of the cells dequeued so far */
    public List<Position> getExploredOrder() { return Collections.unmodifiableList(exploredOrder); }

    public boolean isExplored(Position cell) { return explored.contains(cell); }

    public int getFrontierSize() { return frontier.size(); }
}
