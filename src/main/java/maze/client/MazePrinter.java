package maze.client;

import maze.domain.Maze;
import maze.domain.Position;
import maze.planning.SearchResult;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Renders a maze and, optionally, a search result as text.
 *
 * Symbols: '█' wall, 'A' start, 'B' goal, '*' solution cell,
 * '.' explored cell (only when requested), ' ' open cell.
 */
public class MazePrinter {

    public static final char WALL = '█';
    public static final char PATH = '*';
    public static final char EXPLORED = '.';

    /**
     * Renders the bare maze.
     */
    public String render(Maze maze) {
        return render(maze, Collections.emptySet(), Collections.emptySet());
    }

    /**
     * Renders the maze with the result's solution, if any.
     *
     * @param showExplored also mark explored cells that are not on the path
     */
    public String render(Maze maze, SearchResult result, boolean showExplored) {
        Set<Position> path = result.isSolved()
                ? new HashSet<>(result.getSolution().getCells())
                : Collections.emptySet();
        Set<Position> explored = showExplored ? result.getExplored() : Collections.emptySet();
        return render(maze, path, explored);
    }

    private String render(Maze maze, Set<Position> path, Set<Position> explored) {
        StringBuilder sb = new StringBuilder((maze.getWidth() + 1) * maze.getHeight());
        for (int r = 0; r < maze.getHeight(); r++) {
            for (int c = 0; c < maze.getWidth(); c++) {
                Position pos = Position.of(r, c);
                if (maze.isWall(r, c)) {
                    sb.append(WALL);
                } else if (pos.equals(maze.getStart())) {
                    sb.append(MazeParser.START);
                } else if (pos.equals(maze.getGoal())) {
                    sb.append(MazeParser.GOAL);
                } else if (path.contains(pos)) {
                    sb.append(PATH);
                } else if (explored.contains(pos)) {
                    sb.append(EXPLORED);
                } else {
                    sb.append(MazeParser.OPEN);
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
