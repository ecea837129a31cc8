package maze.planning;

import maze.domain.Position;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * First-in first-out frontier for breadth-first search.
 *
 * Every move costs 1, so removing nodes in insertion order dequeues each
 * state at its minimum path length. Priorities are ignored.
 */
public class FifoFrontier implements Frontier {

    private final Deque<SearchNode> queue = new ArrayDeque<>();

    /** States currently in {@link #queue}, for O(1) duplicate checks */
    private final Set<Position> residentStates = new HashSet<>();

    @Override
    public void add(SearchNode node) {
        if (residentStates.add(node.state)) {
            queue.addLast(node);
        }
    }

    @Override
    public void add(SearchNode node, int priority) {
        add(node);
    }

    @Override
    public SearchNode remove() {
        if (queue.isEmpty()) {
            throw new EmptyFrontierException(getName());
        }
        SearchNode node = queue.pollFirst();
        residentStates.remove(node.state);
        return node;
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public boolean containsState(Position state) {
        return residentStates.contains(state);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public String getName() {
        return "FIFO";
    }
}
