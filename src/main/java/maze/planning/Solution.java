package maze.planning;

import maze.domain.Direction;
import maze.domain.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A path from start to goal: the moves taken and the cells they land on.
 * Cells exclude the start and end with the goal, so both lists have the same length.
 */
public final class Solution {

    private final List<Direction> actions;
    private final List<Position> cells;

    public Solution(List<Direction> actions, List<Position> cells) {
        if (actions.size() != cells.size()) {
            throw new IllegalArgumentException("Solution has " + actions.size() + " actions but "
                    + cells.size() + " cells");
        }
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    /**
     * Reconstructs the path by following parent pointers from {@code goalNode} to the root.
     *
     * @param goalNode the node for the goal cell
     * @return the solution in start-to-goal order
     */
    public static Solution fromGoalNode(SearchNode goalNode) {
        List<Direction> actions = new ArrayList<>(goalNode.cost);
        List<Position> cells = new ArrayList<>(goalNode.cost);
        SearchNode current = goalNode;

        while (current.parent != null) {
            actions.add(current.action);
            cells.add(current.state);
            current = current.parent;
        }

        Collections.reverse(actions);
        Collections.reverse(cells);
        return new Solution(actions, cells);
    }

    public List<Direction> getActions() { return actions; }

    public List<Position> getCells() { return cells; }

    /** @return number of moves */
    public int length() { return actions.size(); }

    @Override
    public String toString() {
        return "Solution[length=" + actions.size() + ", actions=" + actions + "]";
    }
}
