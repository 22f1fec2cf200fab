package work.leyline.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {
    @Test
    void lexesFormattingDelimiters() {
        var tokens = Lexer.tokenize("hello **world**", null);
        assertEquals(
            List.of(
                new Token(TokenKind.TEXT, "hello ", 1, 1, 0, 6),
                new Token(TokenKind.DOUBLESTAR, "**", 1, 7, 6, 8),
                new Token(TokenKind.TEXT, "world", 1, 9, 8, 13),
                new Token(TokenKind.DOUBLESTAR, "**", 1, 14, 13, 15)
            ),
            tokens
        );
    }

    @Test
    void singleDelimiterCharactersStayText() {
        assertEquals(
            List.of(TokenKind.TEXT),
            kinds("dash-ing, 50% of a_b ~ c^2 {x}")
        );
        assertEquals("dash-ing, 50% of a_b ~ c^2 {x}", Lexer.tokenize("dash-ing, 50% of a_b ~ c^2 {x}", null).get(0).value());
    }

    @Test
    void lexesEveryDoubledDelimiter() {
        assertEquals(
            List.of(
                TokenKind.DOUBLESTAR,
                TokenKind.DOUBLETILDE,
                TokenKind.DOUBLEUNDER,
                TokenKind.DOUBLEDASH,
                TokenKind.DOUBLECOMMA,
                TokenKind.DOUBLECARET,
                TokenKind.DOUBLELBRACE,
                TokenKind.DOUBLERBRACE,
                TokenKind.LBRACEPERCENT,
                TokenKind.PERCENTRBRACE,
                TokenKind.LBRACEPERCENTRBRACE
            ),
            kinds("**~~__--,,^^{{}}{%%}{%}")
        );
    }

    @Test
    void continuationLinesMergeIntoOneText() {
        var tokens = Lexer.tokenize("wakka\njawaka", null);
        assertEquals(1, tokens.size());
        assertEquals("wakka\njawaka", tokens.get(0).value());
    }

    @Test
    void lexesBlockLiterals() {
        assertEquals(
            new Token(TokenKind.CODEBLOCK, "python\nx=10\n", 1, 1, 0, 18),
            Lexer.tokenize("```python\nx=10\n```", null).get(0)
        );
        assertEquals("Just a comment", single("# Just a comment ", TokenKind.COMMENT));
        assertEquals(
            "\nI have\na really long comment",
            single("###\nI have\na really long comment###", TokenKind.MULTILINECOMMENT)
        );
        assertEquals("x = 10", single("`x = 10`", TokenKind.INLINECODE));
        assertEquals("e^{i\\pi} = -1", single("$e^{i\\pi} = -1$", TokenKind.INLINEMATH));
        assertEquals("\ne^{i\\pi} = -1\n", single("$$$\ne^{i\\pi} = -1\n$$$", TokenKind.MULTILINEMATH));
        assertEquals("inline math $=$ inside", single("$$$inline math $=$ inside$$$", TokenKind.MULTILINEMATH));
    }

    @Test
    void unclosedInlineCodeIsText() {
        assertEquals(List.of(TokenKind.TEXT), kinds("a `b\nc"));
    }

    @Test
    void tracksIndentation() {
        assertEquals(
            List.of(TokenKind.TEXT, TokenKind.INDENT, TokenKind.TEXT, TokenKind.DEDENT, TokenKind.TEXT),
            kinds("a\n  b\nc")
        );
    }

    @Test
    void flushesOpenLevelsAtEndOfInput() {
        assertEquals(
            List.of(TokenKind.TEXT, TokenKind.INDENT, TokenKind.TEXT, TokenKind.INDENT, TokenKind.TEXT, TokenKind.DEDENT, TokenKind.DEDENT),
            kinds("a\n  b\n    c")
        );
    }

    @Test
    void rejectsMismatchedIndentation() {
        var error = assertThrows(LexicalException.class, () -> Lexer.tokenize("a\n    b\n  c", "notes.ley"));
        assertEquals(3, error.line());
        assertEquals(3, error.column());
        assertEquals("indentation level doesn't match", error.detail());
        assertTrue(error.getMessage().startsWith("notes.ley:3:3: indentation level doesn't match"));
        assertTrue(error.getMessage().endsWith("  c\n  ^"));
    }

    @Test
    void bulletsOpenSyntheticLevels() {
        var tokens = Lexer.tokenize("- * a", null);
        assertEquals(
            List.of(
                TokenKind.BULLET,
                TokenKind.INDENT,
                TokenKind.BULLET,
                TokenKind.INDENT,
                TokenKind.TEXT,
                TokenKind.DEDENT,
                TokenKind.DEDENT
            ),
            kindsOf(tokens)
        );
        assertEquals("-", tokens.get(0).value());
        assertEquals("  ", tokens.get(1).value());
        assertEquals("*", tokens.get(2).value());
        assertEquals("    ", tokens.get(3).value());
    }

    @Test
    void numberedBulletsKeepTheirLiteral() {
        var tokens = Lexer.tokenize("12. twelve", null);
        assertEquals(TokenKind.BULLET, tokens.get(0).kind());
        assertEquals("12.", tokens.get(0).value());
        assertEquals("    ", tokens.get(1).value());
    }

    @Test
    void bulletLookalikesAreText() {
        assertEquals(List.of(TokenKind.TEXT), kinds("1.5 apples"));
        assertEquals(List.of(TokenKind.TEXT), kinds("-not a bullet"));
        assertEquals(List.of(TokenKind.DOUBLESTAR, TokenKind.TEXT, TokenKind.DOUBLESTAR), kinds("**bold**"));
    }

    @Test
    void bulletsAreOnlyRecognizedAtLineStart() {
        assertEquals(List.of(TokenKind.TEXT), kinds("a - b"));
    }

    @Test
    void lexesHeaders() {
        var rend = Lexer.tokenize("rend notes slides::\n  x", null);
        assertEquals(TokenKind.REND, rend.get(0).kind());
        assertEquals(" notes slides", rend.get(0).value());
        assertEquals(TokenKind.INDENT, rend.get(1).kind());

        var with = Lexer.tokenize("with::\n  x", null);
        assertEquals(TokenKind.WITH, with.get(0).kind());
        assertEquals("", with.get(0).value());

        assertEquals(TokenKind.TABLE, Lexer.tokenize("table::\n  - * a", null).get(0).kind());
        assertEquals(TokenKind.FIGURE, Lexer.tokenize("figure::\n  path = a.png", null).get(0).kind());
        assertEquals(List.of(TokenKind.TEXT), kinds("tables:: are not headers"));
    }

    @Test
    void dropsWhitespaceAfterBlockLiterals() {
        assertEquals(List.of(TokenKind.CODEBLOCK, TokenKind.TEXT), kinds("```py\nx\n```\n\nafter"));
        assertEquals(List.of(TokenKind.COMMENT, TokenKind.TEXT), kinds("# note\nafter"));
        assertEquals("after", Lexer.tokenize("# note\nafter", null).get(1).value());
    }

    @Test
    void resolvesEscapes() {
        var tokens = Lexer.tokenize("\\*\\*not bold\\*\\*", null);
        assertEquals(1, tokens.size());
        assertEquals("**not bold**", tokens.get(0).value());
        var braces = Lexer.tokenize("\\{{x}}", null);
        assertEquals(List.of(TokenKind.TEXT, TokenKind.DOUBLERBRACE), kindsOf(braces));
        assertEquals("{{x", braces.get(0).value());
        assertEquals(TokenKind.TEXT, Lexer.tokenize("C:\\path", null).get(0).kind());
        assertEquals("C:\\path", Lexer.tokenize("C:\\path", null).get(0).value());
    }

    @Test
    void rejectsControlCharacters() {
        var error = assertThrows(LexicalException.class, () -> Lexer.tokenize("ab\u0001c", null));
        assertEquals(1, error.line());
        assertEquals(3, error.column());
        assertEquals("<document>", error.filename());
    }

    @Test
    void rejectsUnterminatedFences() {
        assertThrows(LexicalException.class, () -> Lexer.tokenize("```py\nx = 1\n", null));
        assertThrows(LexicalException.class, () -> Lexer.tokenize("$$$ x", null));
    }

    @Test
    void treatsCarriageReturnLineFeedAsOneNewline() {
        var tokens = Lexer.tokenize("a\r\n  b\r\n", null);
        assertEquals(List.of(TokenKind.TEXT, TokenKind.INDENT, TokenKind.TEXT, TokenKind.DEDENT), kindsOf(tokens));
        assertEquals(2, tokens.get(2).line());
        assertEquals(3, tokens.get(2).column());
    }

    @Test
    void returnsEndOfInputRepeatedly() {
        var lexer = new Lexer().input("x");
        assertEquals(TokenKind.TEXT, lexer.nextToken().kind());
        assertEquals(TokenKind.EOF, lexer.nextToken().kind());
        assertEquals(TokenKind.EOF, lexer.nextToken().kind());
    }

    @Test
    void indentsAndDedentsBalance() throws IOException {
        List<String> corpus = new ArrayList<>(List.of(
            "",
            "plain",
            "a\n  b\n    c\n  d\ne",
            "- * a\n  * b\n- c\n",
            "table::\n  - * a\n    * b\n  - * x\n    * y\n",
            "with::\n  x = (\n    1, 2,\n  )\n",
            "rend a b::\n  - one\n  - two\n\n\nafter",
            "1. x\n   - y\n      more\n2. z"
        ));
        corpus.add(resource("/documents/lecture.ley"));
        for (String source : corpus) {
            var tokens = Lexer.tokenize(source, null);
            long indents = tokens.stream().filter(token -> token.is(TokenKind.INDENT)).count();
            long dedents = tokens.stream().filter(token -> token.is(TokenKind.DEDENT)).count();
            assertEquals(indents, dedents, () -> "unbalanced levels in " + source);
        }
    }

    @Test
    void describesKindsForDiagnostics() {
        assertEquals("'**'", TokenKind.DOUBLESTAR.describe());
        assertEquals("**", TokenKind.DOUBLESTAR.literal());
        assertEquals("end of input", TokenKind.EOF.describe());
        assertTrue(TokenKind.DOUBLECARET.isFormatting());
        assertFalse(TokenKind.DOUBLELBRACE.isFormatting());
    }

    private static String single(String source, TokenKind kind) {
        var tokens = Lexer.tokenize(source, null);
        assertEquals(1, tokens.size(), () -> "expected one token, got " + tokens);
        assertEquals(kind, tokens.get(0).kind());
        return tokens.get(0).value();
    }

    private static List<TokenKind> kinds(String source) {
        return kindsOf(Lexer.tokenize(source, null));
    }

    private static List<TokenKind> kindsOf(List<Token> tokens) {
        List<TokenKind> kinds = new ArrayList<>();
        for (Token token : tokens) {
            kinds.add(token.kind());
        }
        return kinds;
    }

    private static String resource(String name) throws IOException {
        try (InputStream stream = LexerTest.class.getResourceAsStream(name)) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
