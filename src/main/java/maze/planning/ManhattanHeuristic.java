package maze.planning;

import maze.domain.Position;

/**
 * Manhattan distance heuristic: |row1 - row2| + |col1 - col2|.
 *
 * Admissible and consistent on a 4-connected grid where every move costs 1,
 * because no sequence of moves can close the distance faster than one unit per move.
 * It ignores walls, so it can underestimate badly in winding mazes.
 */
public class ManhattanHeuristic implements Heuristic {

    @Override
    public int estimate(Position from, Position goal) {
        return from.manhattanDistance(goal);
    }
}
