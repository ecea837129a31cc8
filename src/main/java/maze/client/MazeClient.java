package maze.client;

import maze.domain.Maze;
import maze.planning.MazeSolver;
import maze.planning.SearchConfig;
import maze.planning.SearchMode;
import maze.planning.SearchResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: loads a maze file, solves it and prints the result.
 *
 * Usage: {@code MazeClient <maze-file> [bfs|queue|astar] [--show-explored]}
 *
 * Results go to stdout. Diagnostics go to stderr.
 *
 * Exit codes: 0 solved, 1 no solution, 2 bad usage or unreadable/invalid maze.
 */
public class MazeClient {

    public static final int EXIT_SOLVED = 0;
    public static final int EXIT_NO_SOLUTION = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: MazeClient <maze-file> [bfs|queue|astar] [--show-explored]";

    /** Output stream for results */
    private final PrintStream out;

    /** Debug output stream */
    private final PrintStream debugOut;

    private final MazeParser parser = new MazeParser();
    private final MazePrinter printer = new MazePrinter();
    private final MazeSolver solver;

    /**
     * Creates a new MazeClient with standard I/O streams.
     */
    public MazeClient() {
        this(System.out, System.err, SearchConfig.defaults());
    }

    /**
     * Creates a new MazeClient with custom streams and config (for testing).
     */
    public MazeClient(PrintStream out, PrintStream debug, SearchConfig config) {
        this.out = out;
        this.debugOut = debug;
        this.solver = new MazeSolver(config);
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        System.exit(new MazeClient().run(args));
    }

    /**
     * Runs the client.
     *
     * @param args command line arguments
     * @return the process exit code
     */
    public int run(String[] args) {
        Path file = null;
        SearchMode mode = SearchMode.BFS;
        boolean showExplored = false;
        boolean modeGiven = false;

        try {
            for (String arg : args) {
                if (arg.equals("--show-explored")) {
                    showExplored = true;
                } else if (file == null) {
                    file = Paths.get(arg);
                } else if (!modeGiven) {
                    mode = SearchMode.fromString(arg);
                    modeGiven = true;
                } else {
                    throw new IllegalArgumentException("unexpected argument: '" + arg + "'");
                }
            }
        } catch (IllegalArgumentException e) {
            debugOut.println(e.getMessage());
            debugOut.println(USAGE);
            return EXIT_USAGE;
        }
        if (file == null) {
            debugOut.println(USAGE);
            return EXIT_USAGE;
        }

        Maze maze;
        try {
            maze = parser.parse(file);
        } catch (IOException e) {
            debugOut.println("MazeClient: Cannot read " + file + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            debugOut.println("MazeClient: Invalid maze " + file + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        if (SearchConfig.isVerbose()) {
            debugOut.println("MazeClient: Loaded " + maze + ", " + maze.countOpenCells() + " open cells");
        }

        out.println("Maze:");
        out.println();
        out.print(printer.render(maze));
        out.println();
        out.println("Solving...");

        SearchResult result = solver.solve(maze, mode);
        out.println("States Explored: " + result.getExploredCount());

        if (!result.isSolved()) {
            out.println("No solution.");
            return EXIT_NO_SOLUTION;
        }

        out.println("Solution:");
        out.println();
        out.print(printer.render(maze, result, showExplored));
        out.println();
        if (SearchConfig.isMinimal()) {
            debugOut.println("MazeClient: Actions " + result.getSolution().getActions());
        }
        return EXIT_SOLVED;
    }
}
