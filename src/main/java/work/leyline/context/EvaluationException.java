package work.leyline.context;

import work.leyline.ast.TraversalException;

/**
 * A {@code with} block or macro failed to evaluate. Line and column are 0 until the visitor attaches
 * the position of the node.
 */
public final class EvaluationException extends TraversalException {
    public EvaluationException(String message, Throwable cause) {
        this(message, 0, 0, cause);
    }

    public EvaluationException(String message, int line, int column, Throwable cause) {
        super(message, line, column, cause);
    }

    boolean isLocated() {
        return line() > 0;
    }
}
