package maze.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Maze Tests")
class MazeTest {

    private static boolean[][] open(int height, int width) {
        return new boolean[height][width];
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Valid maze exposes its dimensions, start and goal")
        void testValidMaze() {
            Maze maze = new Maze(2, 3, open(2, 3), Position.of(0, 0), Position.of(1, 2));

            assertEquals(2, maze.getHeight());
            assertEquals(3, maze.getWidth());
            assertEquals(Position.of(0, 0), maze.getStart());
            assertEquals(Position.of(1, 2), maze.getGoal());
            assertEquals(6, maze.countOpenCells());
        }

        @Test
        @DisplayName("Wall table is copied, later changes to the input do not leak in")
        void testWallsCopied() {
            boolean[][] walls = open(2, 2);
            Maze maze = new Maze(2, 2, walls, Position.of(0, 0), Position.of(1, 1));

            walls[0][1] = true;

            assertFalse(maze.isWall(0, 1));
        }

        @Test
        @DisplayName("Start and goal must be distinct")
        void testStartEqualsGoal() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, open(2, 2), Position.of(0, 0), Position.of(0, 0)));
        }

        @Test
        @DisplayName("Start and goal must not be walls")
        void testStartOrGoalOnWall() {
            boolean[][] walls = open(2, 2);
            walls[1][1] = true;

            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, walls, Position.of(1, 1), Position.of(0, 0)));
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, walls, Position.of(0, 0), Position.of(1, 1)));
        }

        @Test
        @DisplayName("Start and goal must be inside the maze")
        void testOutOfBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, open(2, 2), Position.of(-1, 0), Position.of(1, 1)));
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, open(2, 2), Position.of(0, 0), Position.of(2, 1)));
        }

        @Test
        @DisplayName("Dimensions and wall rows must agree")
        void testInconsistentDimensions() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(0, 2, new boolean[0][2], Position.of(0, 0), Position.of(0, 1)));
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, open(3, 2), Position.of(0, 0), Position.of(1, 1)));
            assertThrows(IllegalArgumentException.class,
                    () -> new Maze(2, 2, new boolean[][] { new boolean[2], new boolean[1] },
                            Position.of(0, 0), Position.of(0, 1)));
        }
    }

    @Nested
    @DisplayName("neighbors")
    class Neighbors {

        @Test
        @DisplayName("Interior cell yields up, down, left, right in that order")
        void testFixedOrder() {
            Maze maze = new Maze(3, 3, open(3, 3), Position.of(0, 0), Position.of(2, 2));

            List<Maze.Neighbor> neighbors = maze.neighbors(Position.of(1, 1));

            assertEquals(List.of(
                    new Maze.Neighbor(Direction.UP, Position.of(0, 1)),
                    new Maze.Neighbor(Direction.DOWN, Position.of(2, 1)),
                    new Maze.Neighbor(Direction.LEFT, Position.of(1, 0)),
                    new Maze.Neighbor(Direction.RIGHT, Position.of(1, 2))), neighbors);
        }

        @Test
        @DisplayName("Out-of-bounds cells are skipped silently")
        void testCorner() {
            Maze maze = new Maze(3, 3, open(3, 3), Position.of(0, 0), Position.of(2, 2));

            List<Maze.Neighbor> neighbors = maze.neighbors(Position.of(0, 0));

            assertEquals(List.of(
                    new Maze.Neighbor(Direction.DOWN, Position.of(1, 0)),
                    new Maze.Neighbor(Direction.RIGHT, Position.of(0, 1))), neighbors);
        }

        @Test
        @DisplayName("Walls are skipped silently")
        void testWalls() {
            boolean[][] walls = open(3, 3);
            walls[0][1] = true;
            walls[1][2] = true;
            Maze maze = new Maze(3, 3, walls, Position.of(0, 0), Position.of(2, 2));

            List<Maze.Neighbor> neighbors = maze.neighbors(Position.of(1, 1));

            assertEquals(List.of(
                    new Maze.Neighbor(Direction.DOWN, Position.of(2, 1)),
                    new Maze.Neighbor(Direction.LEFT, Position.of(1, 0))), neighbors);
        }

        @Test
        @DisplayName("Cell boxed in by walls has no neighbors")
        void testEnclosed() {
            boolean[][] walls = open(3, 3);
            walls[0][1] = true;
            walls[1][0] = true;
            walls[1][2] = true;
            walls[2][1] = true;
            Maze maze = new Maze(3, 3, walls, Position.of(0, 0), Position.of(1, 1));

            assertTrue(maze.neighbors(Position.of(1, 1)).isEmpty());
        }
    }

    @Test
    @DisplayName("Cells outside the maze count as walls")
    void testOutsideIsWall() {
        Maze maze = new Maze(1, 2, open(1, 2), Position.of(0, 0), Position.of(0, 1));

        assertTrue(maze.isWall(-1, 0));
        assertTrue(maze.isWall(0, 2));
        assertFalse(maze.isInBounds(Position.of(1, 0)));
        assertFalse(maze.isWall(Position.of(0, 1)));
    }
}
