package work.leyline.lexer;

import java.util.Locale;

/**
 * Kinds of tokens produced by {@link Lexer}.
 */
public enum TokenKind {
    TEXT,

    // formatting toggles, the same token opens and closes a span
    DOUBLESTAR("**"),
    DOUBLETILDE("~~"),
    DOUBLEUNDER("__"),
    DOUBLEDASH("--"),
    DOUBLECOMMA(",,"),
    DOUBLECARET("^^"),

    COMMENT,
    MULTILINECOMMENT,
    CODEBLOCK,
    MULTILINEMATH,
    INLINECODE,
    INLINEMATH,

    DOUBLELBRACE("{{"),
    DOUBLERBRACE("}}"),
    LBRACEPERCENT("{%"),
    PERCENTRBRACE("%}"),
    LBRACEPERCENTRBRACE("{%}"),

    BULLET,
    TABLE("table::"),
    FIGURE("figure::"),
    REND,
    WITH,

    INDENT,
    DEDENT,
    EOF;

    private final String literal;

    TokenKind() {
        this(null);
    }

    TokenKind(String literal) {
        this.literal = literal;
    }

    /** Fixed spelling of the token, or {@code null} when its text varies. */
    public String literal() {
        return literal;
    }

    public boolean isFormatting() {
        return switch (this) {
            case DOUBLESTAR, DOUBLETILDE, DOUBLEUNDER, DOUBLEDASH, DOUBLECOMMA, DOUBLECARET -> true;
            default -> false;
        };
    }

    /** Human readable name used in diagnostics. */
    public String describe() {
        if (literal != null) {
            return "'" + literal + "'";
        }
        return switch (this) {
            case TEXT -> "text";
            case COMMENT, MULTILINECOMMENT -> "comment";
            case CODEBLOCK -> "code block";
            case MULTILINEMATH -> "equation";
            case INLINECODE -> "inline code";
            case INLINEMATH -> "inline math";
            case BULLET -> "list bullet";
            case REND -> "render target header";
            case WITH -> "with header";
            case INDENT -> "indentation";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            default -> name().toLowerCase(Locale.ROOT);
        };
    }
}
