package maze.client;

import maze.domain.Maze;
import maze.domain.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MazeParser Tests")
class MazeParserTest {

    private final MazeParser parser = new MazeParser();

    @Test
    @DisplayName("Markers become start and goal, other non-space characters become walls")
    void testSymbols() {
        Maze maze = parser.parseString("A#x\n.+B\n");

        assertEquals(2, maze.getHeight());
        assertEquals(3, maze.getWidth());
        assertEquals(Position.of(0, 0), maze.getStart());
        assertEquals(Position.of(1, 2), maze.getGoal());
        assertTrue(maze.isWall(0, 1));
        assertTrue(maze.isWall(0, 2));
        assertTrue(maze.isWall(1, 0));
        assertTrue(maze.isWall(1, 1));
        assertFalse(maze.isWall(maze.getStart()));
        assertFalse(maze.isWall(maze.getGoal()));
    }

    @Test
    @DisplayName("Short rows are padded with open cells up to the longest row")
    void testPadding() {
        Maze maze = parser.parseLines(List.of(
                "#####",
                "A",
                "##  B"));

        assertEquals(5, maze.getWidth());
        for (int c = 1; c < 5; c++) {
            assertFalse(maze.isWall(1, c), "padded cell (1," + c + ")");
        }
    }

    @Test
    @DisplayName("Characters outside the BMP take one column each")
    void testSupplementaryCharacters() {
        Maze maze = parser.parseLines(List.of(
                "\uD83D\uDE00A B",
                "\uD83E\uDDF1\uD83E\uDDF1"));

        assertEquals(4, maze.getWidth());
        assertEquals(Position.of(0, 1), maze.getStart());
        assertEquals(Position.of(0, 3), maze.getGoal());
        assertTrue(maze.isWall(0, 0));
        assertTrue(maze.isWall(1, 0));
        assertTrue(maze.isWall(1, 1));
        assertFalse(maze.isWall(1, 2));
    }

    @Test
    @DisplayName("Missing or repeated start is rejected")
    void testStartCount() {
        IllegalArgumentException none = assertThrows(IllegalArgumentException.class,
                () -> parser.parseString("  B\n   "));
        assertTrue(none.getMessage().contains("start"));

        assertThrows(IllegalArgumentException.class, () -> parser.parseString("A A\n  B"));
    }

    @Test
    @DisplayName("Missing or repeated goal is rejected")
    void testGoalCount() {
        IllegalArgumentException none = assertThrows(IllegalArgumentException.class,
                () -> parser.parseString("A  \n   "));
        assertTrue(none.getMessage().contains("goal"));

        assertThrows(IllegalArgumentException.class, () -> parser.parseString("AB\nB "));
    }

    @Test
    @DisplayName("Empty input is rejected")
    void testEmpty() {
        assertThrows(IllegalArgumentException.class, () -> parser.parseString(""));
    }

    @Test
    @DisplayName("Windows line endings parse like Unix ones")
    void testCrLf() {
        Maze maze = parser.parseString("A \r\n B\r\n");

        assertEquals(2, maze.getHeight());
        assertEquals(2, maze.getWidth());
        assertEquals(Position.of(1, 1), maze.getGoal());
    }

    @Test
    @DisplayName("Mazes load from files")
    void testFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("maze.txt");
        Files.write(file, List.of("A ##", "   B"), StandardCharsets.UTF_8);

        Maze maze = parser.parse(file);

        assertEquals(Position.of(1, 3), maze.getGoal());
        assertTrue(maze.isWall(0, 2));
    }

    @Test
    @DisplayName("Missing file surfaces as IOException")
    void testMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> parser.parse(dir.resolve("absent.txt")));
    }
}
