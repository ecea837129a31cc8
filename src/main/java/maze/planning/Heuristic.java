package maze.planning;

import maze.domain.Position;

/**
 * Interface for heuristic functions used in informed search.
 *
 * A heuristic provides an estimate of the number of moves from a cell to the goal.
 * For A* search to be optimal, the heuristic must be admissible (never overestimate
 * the true cost) and ideally consistent (satisfies the triangle inequality).
 */
public interface Heuristic {

    /**
     * Estimates the cost to reach the goal from the given cell.
     *
     * @param from the current cell
     * @param goal the goal cell
     * @return estimated cost to reach goal (lower bound)
     */
    int estimate(Position from, Position goal);
}
