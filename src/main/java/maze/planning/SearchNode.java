package maze.planning;

import maze.domain.Direction;
import maze.domain.Position;

import java.util.Objects;

/**
 * Node in the search tree. Parents always precede their children,
 * so following {@link #parent} ends at the root without cycles.
 */
public final class SearchNode {
    final Position state;
    final SearchNode parent;
    final Direction action;
    final int cost; // g: moves from the start to this node

    private SearchNode(Position state, SearchNode parent, Direction action, int cost) {
        this.state = Objects.requireNonNull(state, "state");
        this.parent = parent;
        this.action = action;
        this.cost = cost;
    }

    /**
     * Creates the root node of a search tree.
     *
     * @param start the start cell
     * @return a node with no parent, no action and cost 0
     */
    public static SearchNode root(Position start) {
        return new SearchNode(start, null, null, 0);
    }

    /**
     * Creates the node reached from this one by taking {@code action}.
     *
     * @param action the move taken
     * @param state the cell the move leads to
     * @return a child node one step more expensive than this one
     */
    public SearchNode child(Direction action, Position state) {
        return new SearchNode(state, this, Objects.requireNonNull(action, "action"), cost + 1);
    }

    @Override
    public String toString() {
        return "SearchNode[state=" + state + ", cost=" + cost + "]";
    }
}
