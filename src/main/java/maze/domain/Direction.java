package maze.domain;

/**
 * The four moves available in a maze, also used as the action vocabulary of a solution.
 * Declaration order is the expansion order used by {@link Maze#neighbors(Position)}.
 */
public enum Direction {
    /** Move up (decrease row) */
    UP(-1, 0, "up"),

    /** Move down (increase row) */
    DOWN(1, 0, "down"),

    /** Move left (decrease column) */
    LEFT(0, -1, "left"),

    /** Move right (increase column) */
    RIGHT(0, 1, "right");

    /** Row delta when moving in this direction */
    public final int dRow;

    /** Column delta when moving in this direction */
    public final int dCol;

    private final String label;

    Direction(int dRow, int dCol, String label) {
        this.dRow = dRow;
        this.dCol = dCol;
        this.label = label;
    }

    /**
     * @return the lower-case name of this move ("up", "down", "left", "right")
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label();
    }
}
