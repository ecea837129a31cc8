package maze.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents the static (unchanging) description of a maze:
 * dimensions, walls, the start cell and the goal cell.
 *
 * The maze uses a coordinate system where:
 * - Row 0 is the top
 * - Column 0 is the left
 * - Positions are accessed as (row, col)
 *
 * Instances are immutable and may be shared between independent searches.
 */
public class Maze {

    /**
     * A move out of a cell: the direction taken and the cell it leads to.
     */
    public static final class Neighbor {
        public final Direction direction;
        public final Position position;

        public Neighbor(Direction direction, Position position) {
            this.direction = direction;
            this.position = position;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Neighbor)) return false;
            Neighbor other = (Neighbor) obj;
            return direction == other.direction && position.equals(other.position);
        }

        @Override
        public int hashCode() {
            return 31 * direction.hashCode() + position.hashCode();
        }

        @Override
        public String toString() {
            return direction + "->" + position;
        }
    }

    /** Number of rows in the maze */
    private final int height;

    /** Number of columns in the maze */
    private final int width;

    /**
     * Wall positions. walls[row][col] is true if the cell at (row, col) is impassable.
     */
    private final boolean[][] walls;

    private final Position start;

    private final Position goal;

    /**
     * Creates a new Maze.
     *
     * @param height number of rows
     * @param width number of columns
     * @param walls wall positions, one row of exactly {@code width} entries per row (will be copied)
     * @param start the start cell
     * @param goal the goal cell
     * @throws IllegalArgumentException if the dimensions, wall table, start or goal are inconsistent
     */
    public Maze(int height, int width, boolean[][] walls, Position start, Position goal) {
        Objects.requireNonNull(walls, "walls");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Maze dimensions must be positive: " + height + "x" + width);
        }
        if (walls.length != height) {
            throw new IllegalArgumentException("Wall table has " + walls.length + " rows, expected " + height);
        }

        this.height = height;
        this.width = width;

        // Deep copy walls
        this.walls = new boolean[height][width];
        for (int r = 0; r < height; r++) {
            if (walls[r] == null || walls[r].length != width) {
                throw new IllegalArgumentException("Wall row " + r + " must have exactly " + width + " entries");
            }
            System.arraycopy(walls[r], 0, this.walls[r], 0, width);
        }

        if (!isInBounds(start)) {
            throw new IllegalArgumentException("Start " + start + " is outside the maze");
        }
        if (!isInBounds(goal)) {
            throw new IllegalArgumentException("Goal " + goal + " is outside the maze");
        }
        if (isWall(start)) {
            throw new IllegalArgumentException("Start " + start + " is on a wall");
        }
        if (isWall(goal)) {
            throw new IllegalArgumentException("Goal " + goal + " is on a wall");
        }
        if (start.equals(goal)) {
            throw new IllegalArgumentException("Start and goal must be distinct: " + start);
        }
        this.start = start;
        this.goal = goal;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public Position getStart() {
        return start;
    }

    public Position getGoal() {
        return goal;
    }

    public boolean isInBounds(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public boolean isInBounds(Position pos) {
        return isInBounds(pos.row, pos.col);
    }

    /**
     * Checks if there's a wall at the given position.
     * Cells outside the maze count as walls.
     *
     * @param row the row index
     * @param col the column index
     * @return true if the cell is impassable
     */
    public boolean isWall(int row, int col) {
        if (!isInBounds(row, col)) {
            return true;
        }
        return walls[row][col];
    }

    public boolean isWall(Position pos) {
        return isWall(pos.row, pos.col);
    }

    /**
     * Returns the in-bounds, non-wall cells orthogonally adjacent to {@code cell},
     * in the fixed order up, down, left, right. This order decides which of several
     * equally short paths a search returns.
     *
     * @param cell the cell to expand
     * @return the reachable neighbors, possibly empty
     */
    public List<Neighbor> neighbors(Position cell) {
        List<Neighbor> result = new ArrayList<>(Direction.values().length);
        for (Direction dir : Direction.values()) {
            Position next = cell.move(dir);
            if (!isWall(next)) {
                result.add(new Neighbor(dir, next));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return number of cells that are not walls
     */
    public int countOpenCells() {
        int open = 0;
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                if (!walls[r][c]) open++;
            }
        }
        return open;
    }

    @Override
    public String toString() {
        return "Maze{" + height + "x" + width + ", start=" + start + ", goal=" + goal + "}";
    }
}
