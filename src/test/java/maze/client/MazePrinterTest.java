package maze.client;

import maze.domain.Maze;
import maze.planning.MazeSolver;
import maze.planning.SearchMode;
import maze.planning.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MazePrinter Tests")
class MazePrinterTest {

    private final MazeParser parser = new MazeParser();
    private final MazePrinter printer = new MazePrinter();

    @Test
    @DisplayName("Bare maze shows walls, start and goal")
    void testBareMaze() {
        Maze maze = parser.parseString("A#\n B");

        assertEquals("A█\n B\n", printer.render(maze));
    }

    @Test
    @DisplayName("Solution cells are marked, explored cells only on request")
    void testSolution() {
        Maze maze = parser.parseString("A  \n   \n  B");
        SearchResult result = new MazeSolver().solve(maze, SearchMode.BFS);

        assertEquals("A  \n*  \n**B\n", printer.render(maze, result, false));
        assertEquals("A..\n*..\n**B\n", printer.render(maze, result, true));
    }

    @Test
    @DisplayName("Unsolved result renders explored cells without a path")
    void testNoSolution() {
        Maze maze = parser.parseString("A #\n ##\n#B ");
        SearchResult result = new MazeSolver().solve(maze, SearchMode.ASTAR);

        assertFalse(result.isSolved());
        assertEquals("A.█\n.██\n█B \n", printer.render(maze, result, true));
    }
}
