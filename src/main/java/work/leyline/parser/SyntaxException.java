package work.leyline.parser;

import work.leyline.lexer.Token;
import work.leyline.shared.SourceException;
import work.leyline.shared.SourceText;

/**
 * Grammar violation. The first one aborts the parse.
 */
public final class SyntaxException extends SourceException {
    public SyntaxException(SourceText source, int line, int column, String detail) {
        super(source, line, column, detail);
    }

    public SyntaxException(SourceText source, Token at, String detail) {
        this(source, at.line(), at.column(), detail);
    }
}
