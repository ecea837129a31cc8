package maze.planning;

import maze.domain.Maze;

import java.util.Objects;

/**
 * Solves mazes in one call.
 *
 * Every call runs its own {@link SearchSession}, so one solver (and one maze)
 * can serve any number of independent solves. Nothing about a solve is kept
 * on the solver; everything is in the returned {@link SearchResult}.
 */
public class MazeSolver {

    private final SearchConfig config;

    public MazeSolver() {
        this(SearchConfig.defaults());
    }

    public MazeSolver(SearchConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Searches for a path from the maze's start to its goal.
     *
     * @param maze the maze to solve
     * @param mode BFS or A*
     * @return the result; check {@link SearchResult#isSolved()} before reading the solution
     */
    public SearchResult solve(Maze maze, SearchMode mode) {
        long startTime = System.currentTimeMillis();
        SearchResult result = new SearchSession(maze, mode, config).runToCompletion();

        if (SearchConfig.isNormal()) {
            long elapsed = System.currentTimeMillis() - startTime;
            switch (result.getStatus()) {
                case GOAL_FOUND:
                    System.err.println(mode.getName() + ": Solution of length " + result.getSolution().length()
                            + " found after " + result.getExploredCount() + " states (" + elapsed + " ms)");
                    break;
                case STATE_LIMIT_REACHED:
                    System.err.println(mode.getName() + ": Gave up after " + result.getExploredCount()
                            + " states (limit " + config.getMaxStates() + ")");
                    break;
                default:
                    System.err.println(mode.getName() + ": No solution found after "
                            + result.getExploredCount() + " states");
                    break;
            }
        }
        return result;
    }

    /**
     * Convenience overload accepting a mode selector such as "bfs" or "astar".
     *
     * @throws IllegalArgumentException if the selector is unknown; no search is started
     */
    public SearchResult solve(Maze maze, String mode) {
        return solve(maze, SearchMode.fromString(mode));
    }
}
