package work.leyline.ast;

/**
 * Failure raised while visiting a tree, as opposed to parsing one. Carries the position of the
 * node being visited.
 */
public class TraversalException extends RuntimeException {
    private final int line;
    private final int column;

    public TraversalException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public TraversalException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
