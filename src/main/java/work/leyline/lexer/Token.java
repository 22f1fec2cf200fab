package work.leyline.lexer;

import java.util.Objects;

/**
 * A lexeme with its 1-based position and the 0-based {@code [offset, end)} range it covers in the
 * source.
 */
public record Token(TokenKind kind, String value, int line, int column, int offset, int end) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        value = value == null ? "" : value;
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /** Joins this token with a following {@link TokenKind#TEXT} token. */
    Token mergedWith(Token next) {
        return new Token(kind, value + next.value, line, column, offset, next.end);
    }

    @Override
    public String toString() {
        return kind + "(" + quote(value) + ")@" + line + ":" + column;
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t") + "'";
    }
}
