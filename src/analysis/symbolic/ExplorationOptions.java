package analysis.symbolic;

import analysis.interpreter.InterpreterOptions;

/**
 * Options for the {@link SymbolicExecutor}
 */
public class ExplorationOptions {

    /**
     * Order in which pending states are explored
     */
    public enum SearchOrder {
        /**
         * Breadth first, shortest paths first
         */
        BFS,
        /**
         * Depth first, follows one path to its end before trying another
         */
        DFS
    }

    public static final long DEFAULT_QUERY_TIMEOUT_MILLIS = 5000;
    public static final int DEFAULT_MAX_PATHS = 1000;

    private SearchOrder order = SearchOrder.DFS;
    private long queryTimeoutMillis = DEFAULT_QUERY_TIMEOUT_MILLIS;
    private int maxPaths = DEFAULT_MAX_PATHS;
    private boolean turtleGuard = true;
    private long canvasHalfWidth = InterpreterOptions.DEFAULT_CANVAS_HALF_WIDTH;

    public SearchOrder getOrder() {
        return order;
    }

    public ExplorationOptions setOrder(SearchOrder order) {
        this.order = order;
        return this;
    }

    /**
     * @return time limit for each solver query in milliseconds, non-positive for none
     */
    public long getQueryTimeoutMillis() {
        return queryTimeoutMillis;
    }

    public ExplorationOptions setQueryTimeoutMillis(long queryTimeoutMillis) {
        this.queryTimeoutMillis = queryTimeoutMillis;
        return this;
    }

    /**
     * @return number of test cases after which exploration stops, non-positive for no limit
     */
    public int getMaxPaths() {
        return maxPaths;
    }

    public ExplorationOptions setMaxPaths(int maxPaths) {
        this.maxPaths = maxPaths;
        return this;
    }

    /**
     * @return true if leaving the canvas ends a path with a fault, as it does in the concrete interpreter
     */
    public boolean isTurtleGuard() {
        return turtleGuard;
    }

    public ExplorationOptions setTurtleGuard(boolean turtleGuard) {
        this.turtleGuard = turtleGuard;
        return this;
    }

    public long getCanvasHalfWidth() {
        return canvasHalfWidth;
    }

    public ExplorationOptions setCanvasHalfWidth(long canvasHalfWidth) {
        if (canvasHalfWidth < 0) {
            throw new IllegalArgumentException("canvasHalfWidth must not be negative: " + canvasHalfWidth);
        }
        this.canvasHalfWidth = canvasHalfWidth;
        return this;
    }

    /**
     * @return settings for replaying test cases on the concrete interpreter
     */
    InterpreterOptions toInterpreterOptions() {
        return new InterpreterOptions().setTurtleGuard(turtleGuard).setCanvasHalfWidth(canvasHalfWidth);
    }
}
