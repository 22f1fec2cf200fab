package work.leyline.shared;

/**
 * Error located in a document's source. Carries {@code file:line:column} plus a caret-pointed copy
 * of the offending line.
 */
public abstract class SourceException extends RuntimeException {
    private final String filename;
    private final int line;
    private final int column;
    private final String detail;
    private final String excerpt;

    protected SourceException(SourceText source, int line, int column, String detail) {
        super(render(source.filename(), line, column, detail, source.excerpt(line, column)));
        this.filename = source.filename();
        this.line = line;
        this.column = column;
        this.detail = detail;
        this.excerpt = source.excerpt(line, column);
    }

    public String filename() {
        return filename;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /** The bare message, without location or excerpt. */
    public String detail() {
        return detail;
    }

    public String excerpt() {
        return excerpt;
    }

    private static String render(String filename, int line, int column, String detail, String excerpt) {
        return filename + ":" + line + ":" + column + ": " + detail + "\n" + excerpt;
    }
}
