package work.leyline.lexer;

import work.leyline.shared.SourceException;
import work.leyline.shared.SourceText;

/**
 * Raised for illegal characters, mismatched indentation and unterminated block literals.
 */
public final class LexicalException extends SourceException {
    public LexicalException(SourceText source, int line, int column, String detail) {
        super(source, line, column, detail);
    }
}
