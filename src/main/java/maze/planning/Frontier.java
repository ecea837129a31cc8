package maze.planning;

import maze.domain.Position;

/**
 * The open set of a graph search: discovered nodes waiting to be expanded.
 *
 * A state is resident at most once. The first node added for a state wins;
 * adding another node for a resident state does nothing, even when the new node
 * is cheaper. Breadth-first search stays optimal under this rule because it
 * dequeues states in order of path length. A* does not: a resident state keeps
 * the cost it arrived with, so A* can return a longer path than breadth-first search.
 *
 * Implementations decide the removal order:
 * - FifoFrontier: insertion order (breadth-first search)
 * - PriorityFrontier: lowest priority first, ties in insertion order (A*)
 */
public interface Frontier {

    /**
     * Adds a node with no explicit priority.
     *
     * @param node the node to add
     */
    void add(SearchNode node);

    /**
     * Adds a node with the given priority. Implementations that do not order by
     * priority ignore it.
     *
     * @param node the node to add
     * @param priority the ordering key, lower is removed first
     */
    void add(SearchNode node, int priority);

    /**
     * Removes the next node according to this frontier's strategy.
     *
     * @return the removed node
     * @throws EmptyFrontierException if the frontier is empty
     */
    SearchNode remove();

    boolean isEmpty();

    /**
     * @param state a cell
     * @return true if a node for this cell is waiting in the frontier
     */
    boolean containsState(Position state);

    int size();

    /**
     * @return the name of this frontier (for logging)
     */
    String getName();
}
