package maze.client;

import maze.domain.Maze;
import maze.domain.Position;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses mazes from their text format.
 *
 * Maze format:
 * <pre>
 * ##### B
 * ##### #
 * A     #
 * </pre>
 *
 * Grid symbols:
 * - 'A' : Start (exactly one)
 * - 'B' : Goal (exactly one)
 * - ' ' : Open cell
 * - anything else : Wall
 *
 * The maze is as wide as its longest line, counted in characters (code points).
 * Shorter lines are padded with open cells.
 */
public class MazeParser {

    public static final char START = 'A';
    public static final char GOAL = 'B';
    public static final char OPEN = ' ';

    /**
     * Parses a maze file.
     *
     * @param file path to a UTF-8 text file
     * @return the parsed maze
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the maze format is invalid
     */
    public Maze parse(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses a maze from a BufferedReader, reading to the end of the stream.
     *
     * @param reader the reader to read from
     * @return the parsed maze
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the maze format is invalid
     */
    public Maze parse(BufferedReader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return parseLines(lines);
    }

    /**
     * Parses a maze from its full text (for tests and embedded mazes).
     *
     * @param text the maze, rows separated by line breaks
     * @return the parsed maze
     * @throws IllegalArgumentException if the maze format is invalid
     */
    public Maze parseString(String text) {
        try {
            return parse(new BufferedReader(new StringReader(text)));
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException("Unexpected I/O error reading a string", e);
        }
    }

    /**
     * Parses a maze from its rows.
     *
     * @param lines the maze rows, top to bottom
     * @return the parsed maze
     * @throws IllegalArgumentException if the maze format is invalid
     */
    public Maze parseLines(List<String> lines) {
        // One column per code point, so supplementary characters are a single wall
        int[][] rows = new int[lines.size()][];
        int starts = 0;
        int goals = 0;
        int width = 0;
        for (int r = 0; r < rows.length; r++) {
            rows[r] = lines.get(r).codePoints().toArray();
            width = Math.max(width, rows[r].length);
            for (int ch : rows[r]) {
                if (ch == START) starts++;
                else if (ch == GOAL) goals++;
            }
        }

        // Validate we have the necessary markers
        if (starts != 1) {
            throw new IllegalArgumentException("maze must have exactly one start point (found " + starts + ")");
        }
        if (goals != 1) {
            throw new IllegalArgumentException("maze must have exactly one goal (found " + goals + ")");
        }

        int height = rows.length;
        boolean[][] walls = new boolean[height][width];
        Position start = null;
        Position goal = null;

        for (int r = 0; r < height; r++) {
            int[] row = rows[r];
            for (int c = 0; c < width; c++) {
                int ch = c < row.length ? row[c] : OPEN;

                if (ch == START) {
                    start = Position.of(r, c);
                } else if (ch == GOAL) {
                    goal = Position.of(r, c);
                } else if (ch != OPEN) {
                    walls[r][c] = true;
                }
            }
        }

        return new Maze(height, width, walls, start, goal);
    }
}
