package maze.planning;

import maze.domain.Position;

import java.util.HashSet;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Priority-ordered frontier for A*.
 *
 * Nodes come out lowest priority first. Equal priorities come out in the
 * order they were added, which keeps every search reproducible.
 * A node added without a priority is keyed by its cost (g), which turns
 * the search into uniform-cost search.
 */
public class PriorityFrontier implements Frontier {

    /**
     * Heap entry: the priority and arrival sequence of a node.
     */
    private static final class Entry implements Comparable<Entry> {
        final int priority;
        final long sequence;
        final SearchNode node;

        Entry(int priority, long sequence, SearchNode node) {
            this.priority = priority;
            this.sequence = sequence;
            this.node = node;
        }

        @Override
        public int compareTo(Entry other) {
            // Primary: lower priority is better
            int pCompare = Integer.compare(this.priority, other.priority);
            if (pCompare != 0) return pCompare;

            // Tie-breaker: earlier arrival
            return Long.compare(this.sequence, other.sequence);
        }
    }

    private final PriorityQueue<Entry> heap = new PriorityQueue<>();

    /** States currently in {@link #heap}, for O(1) duplicate checks */
    private final Set<Position> residentStates = new HashSet<>();

    private long nextSequence = 0;

    @Override
    public void add(SearchNode node) {
        add(node, node.cost);
    }

    @Override
    public void add(SearchNode node, int priority) {
        if (residentStates.add(node.state)) {
            heap.add(new Entry(priority, nextSequence++, node));
        }
    }

    @Override
    public SearchNode remove() {
        if (heap.isEmpty()) {
            throw new EmptyFrontierException(getName());
        }
        SearchNode node = heap.poll().node;
        residentStates.remove(node.state);
        return node;
    }

    @Override
    public boolean isEmpty() {
        return heap.isEmpty();
    }

    @Override
    public boolean containsState(Position state) {
        return residentStates.contains(state);
    }

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public String getName() {
        return "Priority";
    }
}
