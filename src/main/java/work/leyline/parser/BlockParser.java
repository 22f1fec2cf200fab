package work.leyline.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import work.leyline.ast.Bold;
import work.leyline.ast.Bullet;
import work.leyline.ast.Bullets;
import work.leyline.ast.CodeBlock;
import work.leyline.ast.ColumnWidths;
import work.leyline.ast.Comment;
import work.leyline.ast.CorporealMacro;
import work.leyline.ast.Equation;
import work.leyline.ast.Figure;
import work.leyline.ast.IncorporealMacro;
import work.leyline.ast.InlineCode;
import work.leyline.ast.InlineMath;
import work.leyline.ast.Italics;
import work.leyline.ast.ListBlock;
import work.leyline.ast.Node;
import work.leyline.ast.PlainText;
import work.leyline.ast.RenderFor;
import work.leyline.ast.Strikethrough;
import work.leyline.ast.Subscript;
import work.leyline.ast.Superscript;
import work.leyline.ast.Table;
import work.leyline.ast.TextBlock;
import work.leyline.ast.Underline;
import work.leyline.ast.With;
import work.leyline.lexer.Lexer;
import work.leyline.lexer.Token;
import work.leyline.lexer.TokenKind;
import work.leyline.shared.SourceText;
import work.leyline.shared.Verbatim;

/**
 * Recursive-descent grammar over one lexer. An instance parses a single region of a single source
 * and is then discarded.
 */
final class BlockParser {
    private static final Pattern TARGETS = Pattern.compile("( \\S+)+");
    private static final Pattern CONTEXT_NAME = Pattern.compile("( \\S+)?");
    private static final Set<String> TABLE_KEYS = Set.of("widths", "header_rows", "header_cols");
    private static final Set<String> FIGURE_KEYS = Set.of("path", "align", "scale");

    private record Item(Token bullet, List<Node> body) {}

    /** Tokens of an opaque payload, plus the closing token that ended it. */
    private record Payload(List<Token> tokens, Token close) {
        List<Token> content() {
            List<Token> content = new ArrayList<>();
            for (Token token : tokens) {
                if (token.kind() != TokenKind.INDENT && token.kind() != TokenKind.DEDENT) {
                    content.add(token);
                }
            }
            return content;
        }
    }

    private final SourceText source;
    private final TokenCursor tokens;

    BlockParser(SourceText source) {
        this(source, 0, source.length());
    }

    BlockParser(SourceText source, int from, int to) {
        this.source = source;
        this.tokens = new TokenCursor(new Lexer(source.filename()).input(source, from, to));
    }

    List<Node> document() {
        List<Node> body = blocks(TokenKind.EOF);
        expect(TokenKind.EOF, "end of input");
        return body;
    }

    private List<Node> blocks(TokenKind terminator) {
        List<Node> body = new ArrayList<>();
        while (true) {
            Token token = tokens.peek();
            if (token.kind() == terminator) {
                return body;
            }
            if (token.kind() == TokenKind.EOF || token.kind() == TokenKind.DEDENT) {
                throw new SyntaxException(
                    source,
                    token,
                    "expected " + terminator.describe() + ", found " + token.kind().describe()
                );
            }
            block(body);
        }
    }

    private void block(List<Node> body) {
        Token token = tokens.peek();
        switch (token.kind()) {
            case BULLET -> body.add(list());
            case TABLE -> body.add(table());
            case FIGURE -> body.add(figure());
            case REND -> body.add(renderFor());
            case WITH -> body.add(with());
            case LBRACEPERCENT -> body.add(corporealMacro());
            case COMMENT -> {
                tokens.next();
                body.add(new Comment(token.value(), token.line(), token.column()));
            }
            case MULTILINECOMMENT -> {
                tokens.next();
                body.add(new Comment(Verbatim.clean(token.value()), token.line(), token.column()));
            }
            case MULTILINEMATH -> {
                tokens.next();
                body.add(new Equation(Verbatim.clean(token.value()), token.line(), token.column()));
            }
            case CODEBLOCK -> {
                tokens.next();
                body.add(codeBlock(token));
            }
            case INDENT -> {
                tokens.next();
                body.addAll(blocks(TokenKind.DEDENT));
                tokens.next();
            }
            case DOUBLERBRACE, PERCENTRBRACE, LBRACEPERCENTRBRACE -> throw new SyntaxException(
                source,
                token,
                "unexpected " + token.kind().describe()
            );
            default -> {
                TextBlock text = textBlock();
                if (text != null) {
                    body.add(text);
                }
            }
        }
    }

    private TextBlock textBlock() {
        Token first = tokens.peek();
        List<Node> inline = inlines(null);
        if (inline.isEmpty()) {
            throw new SyntaxException(source, first, "unexpected " + first.kind().describe());
        }
        for (Node node : inline) {
            if (!(node instanceof PlainText text) || !text.text().isBlank()) {
                return new TextBlock(inline, first.line(), first.column());
            }
        }
        return null;
    }

    /**
     * Inline run. With an {@code opener} the run stops at the matching delimiter, which is left for
     * the caller to consume.
     */
    private List<Node> inlines(Token opener) {
        List<Node> inline = new ArrayList<>();
        while (true) {
            Token token = tokens.peek();
            if (opener != null && token.kind() == opener.kind()) {
                return inline;
            }
            switch (token.kind()) {
                case TEXT -> {
                    tokens.next();
                    inline.add(new PlainText(token.value(), token.line(), token.column()));
                }
                case INLINECODE -> {
                    tokens.next();
                    inline.add(new InlineCode("", token.value(), token.line(), token.column()));
                }
                case INLINEMATH -> {
                    tokens.next();
                    inline.add(new InlineMath(token.value(), token.line(), token.column()));
                }
                case DOUBLELBRACE -> inline.add(incorporealMacro());
                case DOUBLESTAR, DOUBLETILDE, DOUBLEUNDER, DOUBLEDASH, DOUBLECOMMA, DOUBLECARET -> {
                    tokens.next();
                    List<Node> body = inlines(token);
                    tokens.next();
                    inline.add(formatting(token, body));
                }
                default -> {
                    if (opener != null) {
                        throw new SyntaxException(
                            source,
                            opener,
                            "unterminated " + spanName(opener.kind()) + ": expected "
                                + opener.kind().describe() + " before " + token.kind().describe()
                        );
                    }
                    return inline;
                }
            }
        }
    }

    private static Node formatting(Token opener, List<Node> body) {
        int line = opener.line();
        int column = opener.column();
        return switch (opener.kind()) {
            case DOUBLESTAR -> new Bold(body, line, column);
            case DOUBLETILDE -> new Italics(body, line, column);
            case DOUBLEUNDER -> new Underline(body, line, column);
            case DOUBLEDASH -> new Strikethrough(body, line, column);
            case DOUBLECOMMA -> new Subscript(body, line, column);
            case DOUBLECARET -> new Superscript(body, line, column);
            default -> throw new IllegalArgumentException("not a formatting delimiter: " + opener);
        };
    }

    private static String spanName(TokenKind kind) {
        return switch (kind) {
            case DOUBLESTAR -> "bold";
            case DOUBLETILDE -> "italics";
            case DOUBLEUNDER -> "underline";
            case DOUBLEDASH -> "strikethrough";
            case DOUBLECOMMA -> "subscript";
            case DOUBLECARET -> "superscript";
            default -> kind.describe();
        };
    }

    private IncorporealMacro incorporealMacro() {
        Token open = tokens.next();
        Payload payload = nodedent(TokenKind.DOUBLERBRACE, open, "incorporeal macro");
        return new IncorporealMacro(between(open, payload.close()), open.line(), open.column());
    }

    private CorporealMacro corporealMacro() {
        Token open = tokens.next();
        Payload head = nodedent(TokenKind.PERCENTRBRACE, open, "macro head");
        List<String> words = words(between(open, head.close()));
        if (words.isEmpty()) {
            throw new SyntaxException(source, open, "macro has no name");
        }
        List<Node> body = blocks(TokenKind.LBRACEPERCENTRBRACE);
        tokens.next();
        return new CorporealMacro(words.get(0), words.subList(1, words.size()), body, open.line(), open.column());
    }

    private With with() {
        Token header = tokens.next();
        if (!CONTEXT_NAME.matcher(header.value()).matches()) {
            throw new SyntaxException(
                source,
                header,
                "with header takes at most one context name, separated by a single space"
            );
        }
        expect(TokenKind.INDENT, "an indented block after 'with::'");
        Payload payload = nodedent(TokenKind.DEDENT, header, "with block");
        List<Token> content = payload.content();
        String text = "";
        if (!content.isEmpty()) {
            int from = source.lineStartOf(content.get(0).offset());
            text = Verbatim.clean(source.slice(from, content.get(content.size() - 1).end()));
        }
        return new With(header.value().strip(), text, header.line(), header.column());
    }

    private RenderFor renderFor() {
        Token header = tokens.next();
        String value = header.value();
        if (value.isBlank()) {
            throw new SyntaxException(source, header, "render target list is empty");
        }
        if (!TARGETS.matcher(value).matches()) {
            throw new SyntaxException(source, header, "render targets must be separated by a single space");
        }
        Set<String> targets = new LinkedHashSet<>(Arrays.asList(value.substring(1).split(" ")));
        expect(TokenKind.INDENT, "an indented block after 'rend" + value + "::'");
        List<Node> body = blocks(TokenKind.DEDENT);
        tokens.next();
        return new RenderFor(targets, body, header.line(), header.column());
    }

    private ListBlock list() {
        Token first = tokens.peek();
        List<Item> items = items();
        List<Bullet> bullets = new ArrayList<>(items.size());
        List<List<Node>> bodies = new ArrayList<>(items.size());
        for (Item item : items) {
            bullets.add(Bullet.parse(item.bullet().value()));
            bodies.add(item.body());
        }
        return new ListBlock(Bullets.of(bullets), bodies, first.line(), first.column());
    }

    /** Consecutive items with bullets of one family: numbers, or symbols. */
    private List<Item> items() {
        List<Item> items = new ArrayList<>();
        boolean numbered = tokens.peek().value().endsWith(".");
        while (tokens.at(TokenKind.BULLET) && tokens.peek().value().endsWith(".") == numbered) {
            Token bullet = tokens.next();
            if (numbered && !fitsBulletNumber(bullet.value())) {
                throw new SyntaxException(source, bullet, "bullet number out of range");
            }
            expect(TokenKind.INDENT, "list item content");
            List<Node> body = blocks(TokenKind.DEDENT);
            tokens.next();
            items.add(new Item(bullet, body));
        }
        return items;
    }

    private static boolean fitsBulletNumber(String literal) {
        try {
            Integer.parseInt(literal.substring(0, literal.length() - 1));
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private Table table() {
        Token header = tokens.next();
        expect(TokenKind.INDENT, "an indented block after 'table::'");
        List<Token> meta = new ArrayList<>();
        while (!tokens.at(TokenKind.BULLET) && !tokens.at(TokenKind.DEDENT) && !tokens.at(TokenKind.EOF)) {
            meta.add(tokens.next());
        }
        if (!tokens.at(TokenKind.BULLET)) {
            throw new SyntaxException(source, tokens.peek(), "table body must be a list of rows");
        }
        MetadataReader reader = new MetadataReader(source, "table", TABLE_KEYS);
        Map<String, MetadataReader.Entry> options = Map.of();
        List<Token> metaContent = new Payload(meta, null).content();
        if (!metaContent.isEmpty()) {
            options = reader.read(
                source.lineStartOf(metaContent.get(0).offset()),
                metaContent.get(metaContent.size() - 1).end()
            );
        }

        List<List<List<Node>>> rows = new ArrayList<>();
        for (Item item : items()) {
            if (item.body().size() != 1 || !(item.body().get(0) instanceof ListBlock row)) {
                throw new SyntaxException(source, item.bullet(), "table row must be a list of cells");
            }
            if (!rows.isEmpty() && row.items().size() != rows.get(0).size()) {
                throw new SyntaxException(
                    source,
                    item.bullet(),
                    "table row has " + row.items().size() + " cells, expected " + rows.get(0).size()
                );
            }
            rows.add(row.items());
        }
        if (!tokens.at(TokenKind.DEDENT)) {
            Token stray = tokens.peek();
            throw new SyntaxException(source, stray, "unexpected " + stray.kind().describe() + " after table rows");
        }
        tokens.next();

        int headerRows = Table.DEFAULT_HEADER_ROWS;
        int headerCols = Table.DEFAULT_HEADER_COLS;
        ColumnWidths widths = ColumnWidths.AUTO;
        if (options.containsKey("header_rows")) {
            headerRows = reader.integer(options.get("header_rows"));
        }
        if (options.containsKey("header_cols")) {
            headerCols = reader.integer(options.get("header_cols"));
        }
        if (options.containsKey("widths")) {
            MetadataReader.Entry entry = options.get("widths");
            widths = widths(reader, entry, rows.get(0).size());
        }
        return new Table(headerRows, headerCols, widths, rows, header.line(), header.column());
    }

    private static ColumnWidths widths(MetadataReader reader, MetadataReader.Entry entry, int columns) {
        String value = entry.value().strip();
        if ("auto".equals(value)) {
            return ColumnWidths.AUTO;
        }
        if (value.isEmpty()) {
            throw reader.error(entry, "widths must be 'auto' or one number per column");
        }
        List<Double> weights = new ArrayList<>();
        for (String part : value.split("[,\\s]+")) {
            if (!part.isEmpty()) {
                weights.add(reader.positive(part, entry));
            }
        }
        if (weights.size() != columns) {
            throw reader.error(entry, "widths lists " + weights.size() + " columns, table has " + columns);
        }
        return ColumnWidths.of(weights);
    }

    /**
     * A figure body is read as source: leading {@code key = value} lines configure the figure and
     * the rest is lexed again as the caption.
     */
    private Figure figure() {
        Token header = tokens.next();
        expect(TokenKind.INDENT, "an indented block after 'figure::'");
        List<Token> content = nodedent(TokenKind.DEDENT, header, "figure").content();
        if (content.isEmpty()) {
            throw new SyntaxException(source, header, "figure needs a path");
        }
        int from = source.lineStartOf(content.get(0).offset());
        int to = content.get(content.size() - 1).end();
        int captionStart = to;
        int line = source.lineOf(from);
        while (source.lineStart(line) < to) {
            String text = source.slice(source.lineStart(line), Math.min(source.lineEnd(line), to));
            String stripped = text.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#") && !isMetadata(text)) {
                captionStart = source.lineStart(line);
                break;
            }
            if (line >= source.lineOf(to)) {
                break;
            }
            line++;
        }

        MetadataReader reader = new MetadataReader(source, "figure", FIGURE_KEYS);
        Map<String, MetadataReader.Entry> options = reader.read(from, captionStart);
        MetadataReader.Entry path = options.get("path");
        if (path == null || path.value().isBlank()) {
            throw new SyntaxException(source, header, "figure needs a path");
        }
        String align = Figure.DEFAULT_ALIGN;
        if (options.containsKey("align")) {
            MetadataReader.Entry entry = options.get("align");
            align = entry.value().strip().toLowerCase(Locale.ROOT);
            if (!Figure.ALIGNMENTS.contains(align)) {
                throw reader.error(entry, "align must be one of left, center or right, got '" + entry.value() + "'");
            }
        }
        double scale = Figure.DEFAULT_SCALE;
        if (options.containsKey("scale")) {
            MetadataReader.Entry entry = options.get("scale");
            scale = reader.positive(entry.value().strip(), entry);
        }
        List<Node> caption = captionStart < to ? new BlockParser(source, captionStart, to).document() : List.of();
        return new Figure(path.value(), align, scale, caption, header.line(), header.column());
    }

    private static boolean isMetadata(String line) {
        return MetadataReader.ENTRY.matcher(line).matches();
    }

    private static CodeBlock codeBlock(Token token) {
        String value = Verbatim.normalizeNewlines(token.value());
        int newline = value.indexOf('\n');
        if (newline < 0) {
            return new CodeBlock("", value.strip(), token.line(), token.column());
        }
        String lang = value.substring(0, newline).strip();
        List<String> lines = new ArrayList<>(Arrays.asList(value.substring(newline + 1).split("\n", -1)));
        if (lines.size() > 1 && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        return new CodeBlock(lang, Verbatim.dedent(String.join("\n", lines)), token.line(), token.column());
    }

    /**
     * Consumes tokens up to {@code terminator} at the starting level, allowing balanced
     * INDENT/DEDENT spans in between. A delimiter that closes while lines are still indented must be
     * followed straight away by the DEDENTs that close them.
     */
    private Payload nodedent(TokenKind terminator, Token opener, String what) {
        List<Token> payload = new ArrayList<>();
        int depth = 0;
        while (true) {
            Token token = tokens.next();
            switch (token.kind()) {
                case INDENT -> depth++;
                case DEDENT -> {
                    if (depth == 0) {
                        if (terminator == TokenKind.DEDENT) {
                            return new Payload(payload, token);
                        }
                        throw new SyntaxException(source, opener, "unterminated " + what);
                    }
                    depth--;
                }
                case EOF -> throw new SyntaxException(source, opener, "unterminated " + what);
                default -> {
                    if (token.kind() == terminator) {
                        for (int i = 0; i < depth; i++) {
                            Token next = tokens.next();
                            if (next.kind() != TokenKind.DEDENT) {
                                throw new SyntaxException(
                                    source,
                                    next,
                                    "indented lines of the " + what + " must end where it closes"
                                );
                            }
                        }
                        return new Payload(payload, token);
                    }
                }
            }
            payload.add(token);
        }
    }

    /**
     * Source between two delimiters. The part of the first line before the opening delimiter is
     * replaced by blanks so that the common indent is computed on aligned lines.
     */
    private String between(Token open, Token close) {
        int lineStart = source.lineStartOf(open.end());
        StringBuilder raw = new StringBuilder();
        for (int i = lineStart; i < open.end(); i++) {
            raw.append(source.charAt(i) == '\t' ? '\t' : ' ');
        }
        raw.append(source.slice(open.end(), close.offset()));
        return Verbatim.clean(raw.toString());
    }

    /** Splits a macro head into words. Quoted strings stay one word, quotes included. */
    static List<String> words(String head) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < head.length(); i++) {
            char ch = head.charAt(i);
            if (quote != 0) {
                word.append(ch);
                if (ch == '\\' && i + 1 < head.length()) {
                    word.append(head.charAt(++i));
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (Character.isWhitespace(ch)) {
                if (word.length() > 0) {
                    words.add(word.toString());
                    word.setLength(0);
                }
            } else {
                if (ch == '"' || ch == '\'') {
                    quote = ch;
                }
                word.append(ch);
            }
        }
        if (word.length() > 0) {
            words.add(word.toString());
        }
        return words;
    }

    private Token expect(TokenKind kind, String what) {
        Token token = tokens.next();
        if (token.kind() != kind) {
            throw new SyntaxException(source, token, "expected " + what + ", found " + token.kind().describe());
        }
        return token;
    }
}
