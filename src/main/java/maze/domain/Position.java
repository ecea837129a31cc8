package maze.domain;

/**
 * Immutable class representing a position (cell) on the maze grid.
 * Uses row and column indices where (0,0) is the top-left corner.
 * Row increases downward, column increases rightward.
 */
public final class Position {

    /** The row index (vertical position, 0-indexed from top) */
    public final int row;

    /** The column index (horizontal position, 0-indexed from left) */
    public final int col;

    /**
     * Creates a new Position with the specified row and column.
     *
     * @param row the row index (0-indexed)
     * @param col the column index (0-indexed)
     */
    public Position(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Factory method, reads better than the constructor in test fixtures.
     */
    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    /**
     * Returns the Position adjacent to this position in the given direction.
     * The result may lie outside the maze; bounds are the caller's concern.
     *
     * @param direction the direction to move
     * @return the Position in the specified direction
     */
    public Position move(Direction direction) {
        return new Position(row + direction.dRow, col + direction.dCol);
    }

    /**
     * Calculates the Manhattan distance from this position to another position.
     * Manhattan distance is |row1 - row2| + |col1 - col2|.
     *
     * @param other the other position
     * @return the Manhattan distance
     */
    public int manhattanDistance(Position other) {
        return Math.abs(this.row - other.row) + Math.abs(this.col - other.col);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Position position = (Position) obj;
        return row == position.row && col == position.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
