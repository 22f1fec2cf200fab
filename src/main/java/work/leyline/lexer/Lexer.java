package work.leyline.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.leyline.shared.SourceText;

/**
 * Indentation-sensitive tokenizer for leyline documents.
 *
 * <p>Tokens are produced in three layers: the scanner proper fills a FIFO of pending tokens
 * (several at once for dedent flushes and bullet runs), whitespace directly after block literals is
 * dropped, and adjacent {@link TokenKind#TEXT} tokens are merged. A lexer owns mutable cursor and
 * indentation state; use one instance per parse.
 */
public final class Lexer implements Iterable<Token> {
    private static final Pattern BULLET_RUN = Pattern.compile("(?:(?:[-*]|\\d+\\.) )+");
    private static final Pattern BULLET = Pattern.compile("([-*]|\\d+\\.) ");
    private static final Pattern HEADER = Pattern.compile("(?:(rend|with)([ \\t][^\\n\\r:]*)?|(table|figure))::");
    private static final String ESCAPABLE = "\\`*~_-,^$#{}%";
    private static final String SPECIAL = "\n\r\\#`$%{}*~_-,^";
    private static final Set<TokenKind> TRIM_AFTER = EnumSet.of(
        TokenKind.COMMENT,
        TokenKind.MULTILINECOMMENT,
        TokenKind.CODEBLOCK,
        TokenKind.MULTILINEMATH,
        TokenKind.PERCENTRBRACE,
        TokenKind.LBRACEPERCENTRBRACE
    );

    private final String filename;
    private final List<String> indents = new ArrayList<>();
    private final Deque<Token> pending = new ArrayDeque<>();
    private SourceText source;
    private int pos;
    private int limit;
    private boolean lineContent;
    private boolean finished;
    private TokenKind lastKind;
    private Token buffered;

    public Lexer() {
        this(null);
    }

    public Lexer(String filename) {
        this.filename = filename;
    }

    public static List<Token> tokenize(String text, String filename) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : new Lexer(filename).input(text)) {
            tokens.add(token);
        }
        return tokens;
    }

    public Lexer input(String text) {
        return input(new SourceText(filename, text));
    }

    public Lexer input(SourceText text) {
        return input(text, 0, text.length());
    }

    /**
     * Restricts lexing to {@code [from, to)} of {@code text}. Positions stay relative to the whole
     * source.
     */
    public Lexer input(SourceText text, int from, int to) {
        this.source = text;
        this.pos = from;
        this.limit = to;
        this.indents.clear();
        this.indents.add("");
        this.pending.clear();
        this.finished = false;
        this.lastKind = null;
        this.buffered = null;
        this.lineContent = false;
        if (from == text.lineStartOf(from)) {
            newlineRun(true);
        }
        return this;
    }

    public SourceText source() {
        return source;
    }

    /**
     * Next merged token. Once input is exhausted every call returns an {@link TokenKind#EOF} token.
     */
    public Token nextToken() {
        if (source == null) {
            throw new IllegalStateException("input() must be called before nextToken()");
        }
        Token token = buffered != null ? buffered : nextSignificant();
        buffered = null;
        if (token.kind() != TokenKind.TEXT) {
            return token;
        }
        while (true) {
            Token next = nextSignificant();
            if (next.kind() != TokenKind.TEXT) {
                buffered = next;
                return token;
            }
            token = token.mergedWith(next);
        }
    }

    @Override
    public Iterator<Token> iterator() {
        return new Iterator<>() {
            private Token next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    next = nextToken();
                }
                return next.kind() != TokenKind.EOF;
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Token token = next;
                next = null;
                return token;
            }
        };
    }

    private Token nextSignificant() {
        while (true) {
            Token token = scanToken();
            if (token.kind() == TokenKind.TEXT
                && lastKind != null
                && TRIM_AFTER.contains(lastKind)
                && token.value().isBlank()) {
                continue;
            }
            lastKind = token.kind();
            return token;
        }
    }

    private Token scanToken() {
        while (pending.isEmpty()) {
            if (pos >= limit) {
                finish();
            } else {
                scan();
            }
        }
        return pending.poll();
    }

    private void finish() {
        if (!finished) {
            finished = true;
            while (indents.size() > 1) {
                indents.remove(indents.size() - 1);
                pending.add(token(TokenKind.DEDENT, "", limit, limit));
            }
        }
        pending.add(token(TokenKind.EOF, "", limit, limit));
    }

    private void scan() {
        if (lineContent) {
            lineContent = false;
            if (scanBlockStart()) {
                return;
            }
        }
        char ch = source.charAt(pos);
        switch (ch) {
            case '\n', '\r' -> newlineRun(false);
            case '\\' -> escape();
            case '#' -> comment();
            case '`' -> backtick();
            case '$' -> dollar();
            case '{' -> {
                if (ahead("{%}")) {
                    emit(TokenKind.LBRACEPERCENTRBRACE, 3);
                } else if (ahead("{%")) {
                    emit(TokenKind.LBRACEPERCENT, 2);
                } else if (ahead("{{")) {
                    emit(TokenKind.DOUBLELBRACE, 2);
                } else {
                    text(pos + 1);
                }
            }
            case '}' -> {
                if (ahead("}}")) {
                    emit(TokenKind.DOUBLERBRACE, 2);
                } else {
                    text(pos + 1);
                }
            }
            case '%' -> {
                if (ahead("%}")) {
                    emit(TokenKind.PERCENTRBRACE, 2);
                } else {
                    text(pos + 1);
                }
            }
            case '*' -> doubled(TokenKind.DOUBLESTAR);
            case '~' -> doubled(TokenKind.DOUBLETILDE);
            case '_' -> doubled(TokenKind.DOUBLEUNDER);
            case '-' -> doubled(TokenKind.DOUBLEDASH);
            case ',' -> doubled(TokenKind.DOUBLECOMMA);
            case '^' -> doubled(TokenKind.DOUBLECARET);
            default -> textRun();
        }
    }

    /**
     * Bullets and block headers are only recognized where a line's content starts. A bullet run such
     * as {@code "- * "} opens one level per bullet, each followed by a synthetic indent as wide as
     * {@code "<bullet> "}.
     */
    private boolean scanBlockStart() {
        boolean emitted = false;
        Matcher run = BULLET_RUN.matcher(source.text()).region(pos, limit);
        if (run.lookingAt()) {
            Matcher bullet = BULLET.matcher(source.text()).region(pos, run.end());
            while (bullet.lookingAt()) {
                String literal = bullet.group(1);
                int from = bullet.start();
                int to = bullet.end();
                pending.add(token(TokenKind.BULLET, literal, from, from + literal.length()));
                String level = top() + " ".repeat(to - from);
                indents.add(level);
                pending.add(token(TokenKind.INDENT, level, to, to));
                bullet.region(to, run.end());
            }
            pos = run.end();
            emitted = true;
        }
        Matcher header = HEADER.matcher(source.text()).region(pos, limit);
        if (header.lookingAt()) {
            TokenKind kind;
            String value;
            if (header.group(3) != null) {
                kind = "table".equals(header.group(3)) ? TokenKind.TABLE : TokenKind.FIGURE;
                value = header.group(3);
            } else {
                kind = "rend".equals(header.group(1)) ? TokenKind.REND : TokenKind.WITH;
                value = header.group(2) == null ? "" : header.group(2);
            }
            pending.add(token(kind, value, header.start(), header.end()));
            pos = header.end();
            emitted = true;
        }
        return emitted;
    }

    /**
     * Consumes a run of line breaks (blank lines included) and compares the indentation of the next
     * content line with the top of the indentation stack.
     */
    private void newlineRun(boolean regionStart) {
        int start = pos;
        int cursor = pos;
        int newlines = 0;
        if (!regionStart) {
            cursor = skipNewline(cursor);
            newlines++;
        }
        int prefixStart = cursor;
        while (true) {
            while (cursor < limit && isBlank(source.charAt(cursor))) {
                cursor++;
            }
            if (cursor < limit && isNewline(source.charAt(cursor))) {
                cursor = skipNewline(cursor);
                newlines++;
                prefixStart = cursor;
                continue;
            }
            break;
        }
        boolean atEnd = cursor >= limit;
        String prefix = atEnd ? "" : source.slice(prefixStart, cursor);
        String top = top();
        if (prefix.equals(top)) {
            if (newlines > 0 && !regionStart) {
                pending.add(token(TokenKind.TEXT, "\n".repeat(newlines), start, cursor));
            }
        } else if (prefix.startsWith(top)) {
            indents.add(prefix);
            pending.add(token(TokenKind.INDENT, prefix, start, cursor));
        } else {
            while (top().length() > prefix.length() && top().startsWith(prefix)) {
                indents.remove(indents.size() - 1);
                pending.add(token(TokenKind.DEDENT, "", start, cursor));
            }
            if (!top().equals(prefix)) {
                throw new LexicalException(
                    source,
                    source.lineOf(cursor),
                    source.columnOf(cursor),
                    "indentation level doesn't match"
                );
            }
        }
        pos = cursor;
        lineContent = !atEnd;
    }

    private void escape() {
        if (pos + 1 < limit && ESCAPABLE.indexOf(source.charAt(pos + 1)) >= 0) {
            pending.add(token(TokenKind.TEXT, String.valueOf(source.charAt(pos + 1)), pos, pos + 2));
            pos += 2;
        } else {
            text(pos + 1);
        }
    }

    private void comment() {
        if (ahead("###")) {
            int close = source.text().indexOf("###", pos + 3);
            if (close >= 0 && close + 3 <= limit) {
                pending.add(token(TokenKind.MULTILINECOMMENT, source.slice(pos + 3, close), pos, close + 3));
                pos = close + 3;
                return;
            }
        }
        int end = endOfLine(pos);
        pending.add(token(TokenKind.COMMENT, source.slice(pos + 1, end).strip(), pos, end));
        pos = end;
    }

    private void backtick() {
        if (ahead("```")) {
            fenced("```", TokenKind.CODEBLOCK, "unterminated code block");
        } else {
            inline('`', TokenKind.INLINECODE);
        }
    }

    private void dollar() {
        if (ahead("$$$")) {
            fenced("$$$", TokenKind.MULTILINEMATH, "unterminated equation block");
        } else {
            inline('$', TokenKind.INLINEMATH);
        }
    }

    private void fenced(String fence, TokenKind kind, String unterminated) {
        int close = source.text().indexOf(fence, pos + fence.length());
        if (close < 0 || close + fence.length() > limit) {
            throw new LexicalException(source, source.lineOf(pos), source.columnOf(pos), unterminated);
        }
        pending.add(token(kind, source.slice(pos + fence.length(), close), pos, close + fence.length()));
        pos = close + fence.length();
    }

    private void inline(char delimiter, TokenKind kind) {
        int i = pos + 1;
        while (i < limit) {
            char ch = source.charAt(i);
            if (isNewline(ch)) {
                break;
            }
            if (ch == '\\' && i + 1 < limit && !isNewline(source.charAt(i + 1))) {
                i += 2;
                continue;
            }
            if (ch == delimiter) {
                pending.add(token(kind, source.slice(pos + 1, i), pos, i + 1));
                pos = i + 1;
                return;
            }
            i++;
        }
        text(pos + 1);
    }

    private void doubled(TokenKind kind) {
        if (pos + 1 < limit && source.charAt(pos + 1) == source.charAt(pos)) {
            emit(kind, 2);
        } else {
            text(pos + 1);
        }
    }

    private void textRun() {
        int end = pos;
        while (end < limit) {
            char ch = source.charAt(end);
            if (SPECIAL.indexOf(ch) >= 0) {
                break;
            }
            if (isIllegal(ch)) {
                if (end == pos) {
                    throw new LexicalException(
                        source,
                        source.lineOf(end),
                        source.columnOf(end),
                        String.format("illegal character U+%04X", (int) ch)
                    );
                }
                break;
            }
            end++;
        }
        text(end);
    }

    private void text(int end) {
        pending.add(token(TokenKind.TEXT, source.slice(pos, end), pos, end));
        pos = end;
    }

    private void emit(TokenKind kind, int width) {
        pending.add(token(kind, source.slice(pos, pos + width), pos, pos + width));
        pos += width;
    }

    private Token token(TokenKind kind, String value, int from, int to) {
        return new Token(kind, value, source.lineOf(from), source.columnOf(from), from, to);
    }

    private String top() {
        return indents.get(indents.size() - 1);
    }

    private boolean ahead(String literal) {
        return pos + literal.length() <= limit && source.text().startsWith(literal, pos);
    }

    private int endOfLine(int from) {
        int end = from;
        while (end < limit && !isNewline(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private int skipNewline(int at) {
        if (source.charAt(at) == '\r' && at + 1 < limit && source.charAt(at + 1) == '\n') {
            return at + 2;
        }
        return at + 1;
    }

    private static boolean isNewline(char ch) {
        return ch == '\n' || ch == '\r';
    }

    private static boolean isBlank(char ch) {
        return ch == ' ' || ch == '\t';
    }

    private static boolean isIllegal(char ch) {
        return (ch < 0x20 && ch != '\t' && ch != '\n' && ch != '\r') || ch == 0x7f;
    }
}
