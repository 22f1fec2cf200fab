package work.leyline.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.leyline.ast.Bold;
import work.leyline.ast.Bullet;
import work.leyline.ast.Bullets;
import work.leyline.ast.CodeBlock;
import work.leyline.ast.ColumnWidths;
import work.leyline.ast.Comment;
import work.leyline.ast.CorporealMacro;
import work.leyline.ast.Document;
import work.leyline.ast.Equation;
import work.leyline.ast.Figure;
import work.leyline.ast.IncorporealMacro;
import work.leyline.ast.InlineMath;
import work.leyline.ast.Italics;
import work.leyline.ast.ListBlock;
import work.leyline.ast.Node;
import work.leyline.ast.PlainText;
import work.leyline.ast.RenderFor;
import work.leyline.ast.Strikethrough;
import work.leyline.ast.Table;
import work.leyline.ast.TextBlock;
import work.leyline.ast.Underline;
import work.leyline.ast.With;

class ParserTest {
    private final Parser parser = new Parser();

    @Test
    void parsesEmptyDocument() {
        assertEquals(new Document(List.of(), 1, 1), parser.parse(""));
    }

    @Test
    void parsesPlainText() {
        assertEquals(
            new Document(List.of(new TextBlock(List.of(new PlainText("hello world", 1, 1)), 1, 1)), 1, 1),
            parser.parse("hello world")
        );
    }

    @Test
    void positionsBoldAtItsOpeningDelimiter() {
        assertEquals(
            document(new TextBlock(
                List.of(
                    new PlainText("hello ", 1, 1),
                    new Bold(List.of(new PlainText("world", 1, 9)), 1, 7)
                ),
                1,
                1
            )),
            parser.parse("hello **world**")
        );
    }

    @Test
    void nestsFormattingSpans() {
        assertEquals(
            document(new TextBlock(
                List.of(new Italics(
                    List.of(
                        new PlainText("hello ", 1, 3),
                        new Bold(List.of(new PlainText("world", 1, 11)), 1, 9)
                    ),
                    1,
                    1
                )),
                1,
                1
            )),
            parser.parse("~~hello **world**~~")
        );
        assertEquals(
            document(new TextBlock(
                List.of(new Strikethrough(
                    List.of(
                        new PlainText("hello ", 1, 3),
                        new Underline(List.of(new PlainText("world", 1, 11)), 1, 9)
                    ),
                    1,
                    1
                )),
                1,
                1
            )),
            parser.parse("--hello __world__--")
        );
    }

    @Test
    void rejectsUnterminatedFormatting() {
        var error = assertThrows(SyntaxException.class, () -> parser.parse("some **bold", "notes.ley"));
        assertEquals(1, error.line());
        assertEquals(6, error.column());
        assertTrue(error.detail().startsWith("unterminated bold"));
    }

    @Test
    void collapsesIdenticalBullets() {
        var list = assertInstanceOf(ListBlock.class, parser.parse("* x\n* y\n* z").body().get(0));
        assertEquals(Bullets.shared(Bullet.symbol("*")), list.bullets());
        assertEquals(3, list.items().size());
        assertEquals(
            List.of(new TextBlock(List.of(new PlainText("y", 2, 3)), 2, 3)),
            list.items().get(1)
        );
    }

    @Test
    void keepsAuthoredNumbers() {
        var list = assertInstanceOf(ListBlock.class, parser.parse("1. x\n2. y\n3. z").body().get(0));
        assertEquals(
            Bullets.perItem(List.of(Bullet.number(1), Bullet.number(2), Bullet.number(3))),
            list.bullets()
        );
        var restarted = assertInstanceOf(ListBlock.class, parser.parse("4. x\n4. y").body().get(0));
        assertEquals(Bullets.shared(Bullet.number(4)), restarted.bullets());
    }

    @Test
    void rejectsBulletNumbersBeyondIntRange() {
        var error = assertThrows(SyntaxException.class, () -> parser.parse("99999999999. x\n", "doc.ley"));
        assertEquals(1, error.line());
        assertEquals(1, error.column());
        assertEquals("bullet number out of range", error.detail());
        var nested = assertThrows(SyntaxException.class, () -> parser.parse("- 12345678901. c\n"));
        assertEquals(1, nested.line());
        assertEquals(3, nested.column());
    }

    @Test
    void switchingBulletFamilyStartsANewList() {
        var body = parser.parse("* x\n* y\n\n1. one\n2. two").body();
        assertEquals(2, body.size());
        assertInstanceOf(ListBlock.class, body.get(0));
        assertInstanceOf(ListBlock.class, body.get(1));
    }

    @Test
    void nestsSingleLineLists() {
        var outer = assertInstanceOf(ListBlock.class, parser.parse("- * a").body().get(0));
        assertEquals(Bullets.shared(Bullet.symbol("-")), outer.bullets());
        var inner = assertInstanceOf(ListBlock.class, outer.items().get(0).get(0));
        assertEquals(Bullets.shared(Bullet.symbol("*")), inner.bullets());
        assertEquals(List.of(new TextBlock(List.of(new PlainText("a", 1, 5)), 1, 5)), inner.items().get(0));
    }

    @Test
    void buildsRectangularTables() {
        String source = "table::\n  - * a\n    * b\n  - * x\n    * y\n";
        var table = assertInstanceOf(Table.class, parser.parse(source).body().get(0));
        assertEquals(2, table.rows().size());
        for (List<List<Node>> row : table.rows()) {
            assertEquals(2, row.size());
        }
        assertEquals(1, table.headerRows());
        assertEquals(0, table.headerCols());
        assertEquals(ColumnWidths.AUTO, table.widths());
        assertEquals(2, table.columnCount());
        assertEquals(List.of(new TextBlock(List.of(new PlainText("y", 5, 7)), 5, 7)), table.rows().get(1).get(1));
    }

    @Test
    void readsTableOptions() {
        String source = "table::\n  header_rows = 0\n  header_cols = 1\n  widths = 1, 3\n  - * a\n    * b\n";
        var table = assertInstanceOf(Table.class, parser.parse(source).body().get(0));
        assertEquals(0, table.headerRows());
        assertEquals(1, table.headerCols());
        assertEquals(List.of(0.25, 0.75), table.widths().fractions());
    }

    @Test
    void rejectsBadTableOptions() {
        var unknown = assertThrows(
            SyntaxException.class,
            () -> parser.parse("table::\n  colour = red\n  - * a\n")
        );
        assertEquals("unknown table option 'colour'", unknown.detail());
        assertEquals(2, unknown.line());
        assertEquals(3, unknown.column());

        var duplicate = assertThrows(
            SyntaxException.class,
            () -> parser.parse("table::\n  header_rows = 1\n  header_rows = 2\n  - * a\n")
        );
        assertEquals("duplicate table option 'header_rows'", duplicate.detail());
        assertEquals(3, duplicate.line());

        var malformed = assertThrows(
            SyntaxException.class,
            () -> parser.parse("table::\n  header_cols = two\n  - * a\n")
        );
        assertEquals(2, malformed.line());

        var widths = assertThrows(
            SyntaxException.class,
            () -> parser.parse("table::\n  widths = 1 2 3\n  - * a\n    * b\n")
        );
        assertEquals("widths lists 3 columns, table has 2", widths.detail());

        assertThrows(SyntaxException.class, () -> parser.parse("table::\n  widths = 1 -2\n  - * a\n    * b\n"));
        assertThrows(SyntaxException.class, () -> parser.parse("table::\n  not an option\n  - * a\n"));
    }

    @Test
    void rejectsRowsThatAreNotLists() {
        var error = assertThrows(SyntaxException.class, () -> parser.parse("table::\n  - a\n  - * b\n"));
        assertEquals("table row must be a list of cells", error.detail());
        assertEquals(2, error.line());
        assertEquals(3, error.column());
    }

    @Test
    void rejectsRaggedRows() {
        var error = assertThrows(
            SyntaxException.class,
            () -> parser.parse("table::\n  - * a\n    * b\n  - * x\n")
        );
        assertEquals("table row has 1 cells, expected 2", error.detail());
        assertEquals(4, error.line());
    }

    @Test
    void parsesFigures() {
        String source = "figure::\n  path = images/cat.png\n  scale = 0.5\n  A **cat**.\n";
        var figure = assertInstanceOf(Figure.class, parser.parse(source).body().get(0));
        assertEquals(
            new Figure(
                "images/cat.png",
                "center",
                0.5,
                List.of(new TextBlock(
                    List.of(
                        new PlainText("A ", 4, 3),
                        new Bold(List.of(new PlainText("cat", 4, 7)), 4, 5),
                        new PlainText(".", 4, 12)
                    ),
                    4,
                    3
                )),
                1,
                1
            ),
            figure
        );
    }

    @Test
    void figuresNeedAPath() {
        assertThrows(SyntaxException.class, () -> parser.parse("figure::\n  align = left\n"));
        var align = assertThrows(
            SyntaxException.class,
            () -> parser.parse("figure::\n  path = a.png\n  align = middle\n")
        );
        assertEquals(3, align.line());
    }

    @Test
    void preservesWithPayloadVerbatim() {
        assertEquals(
            document(new With("", "x = (\n  1, 2,\n)", 1, 1)),
            parser.parse("with::\n  x = (\n    1, 2,\n  )\n")
        );
        assertEquals(
            document(new With("meta", "author = 'Ada'", 1, 1)),
            parser.parse("with meta::\n  author = 'Ada'\n")
        );
    }

    @Test
    void rejectsMalformedHeaders() {
        assertThrows(SyntaxException.class, () -> parser.parse("rend t0   t1::\n  no"));
        assertThrows(SyntaxException.class, () -> parser.parse("with  two_spaces::\n  yes"));
        assertThrows(SyntaxException.class, () -> parser.parse("with a b::\n  yes"));
        var empty = assertThrows(SyntaxException.class, () -> parser.parse("rend::\n  no"));
        assertEquals("render target list is empty", empty.detail());
        var body = assertThrows(SyntaxException.class, () -> parser.parse("rend notes::\nno body"));
        assertTrue(body.detail().startsWith("expected an indented block"));
    }

    @Test
    void parsesRenderTargets() {
        assertEquals(
            document(new RenderFor(
                Set.of("notes", "slides"),
                List.of(new TextBlock(List.of(new PlainText("hi", 2, 3)), 2, 3)),
                1,
                1
            )),
            parser.parse("rend notes slides::\n  hi")
        );
    }

    @Test
    void parsesIncorporealMacros() {
        assertEquals(
            document(new TextBlock(
                List.of(new PlainText("see ", 1, 1), new IncorporealMacro("x + 1", 1, 5), new PlainText(".", 1, 16)),
                1,
                1
            )),
            parser.parse("see {{ x + 1 }}.")
        );
    }

    @Test
    void incorporealPayloadMayContinueOnIndentedLines() {
        var block = assertInstanceOf(TextBlock.class, parser.parse("{{ f(\n     1) }}").body().get(0));
        assertEquals(new IncorporealMacro("f(\n  1)", 1, 1), block.body().get(0));
    }

    @Test
    void parsesCorporealMacros() {
        assertEquals(
            document(new CorporealMacro(
                "note",
                List.of("\"a b\"", "c"),
                List.of(new TextBlock(List.of(new PlainText("body\n", 2, 1)), 2, 1)),
                1,
                1
            )),
            parser.parse("{% note \"a b\" c %}\nbody\n{%}")
        );
    }

    @Test
    void rejectsMacrosWithoutName() {
        var error = assertThrows(SyntaxException.class, () -> parser.parse("{% %}x{%}"));
        assertEquals("macro has no name", error.detail());
        assertThrows(SyntaxException.class, () -> parser.parse("{% note %}never closed"));
    }

    @Test
    void rejectsStrayClosers() {
        assertThrows(SyntaxException.class, () -> parser.parse("a }} b"));
        assertThrows(SyntaxException.class, () -> parser.parse("a %} b"));
        assertThrows(SyntaxException.class, () -> parser.parse("{%}"));
    }

    @Test
    void parsesCodeAndMath() {
        var body = parser.parse("```python\n  x = 1\n  y\n```\n$$$\n  e = mc^2\n$$$\n# done").body();
        assertEquals(new CodeBlock("python", "x = 1\ny", 1, 1), body.get(0));
        assertEquals(new Equation("e = mc^2", 5, 1), body.get(1));
        assertEquals(new Comment("done", 8, 1), body.get(2));
        assertEquals(new CodeBlock("", "x", 1, 1), parser.parse("```x```").body().get(0));
    }

    @Test
    void parsesInlineMath() {
        var block = assertInstanceOf(TextBlock.class, parser.parse("area $\\pi r^2$").body().get(0));
        assertEquals(new InlineMath("\\pi r^2", 1, 6), block.body().get(1));
    }

    @Test
    void indentedParagraphsAreFlattened() {
        var body = parser.parse("a\n  b\nc").body();
        assertEquals(3, body.size());
        assertEquals(new TextBlock(List.of(new PlainText("b", 2, 3)), 2, 3), body.get(1));
    }

    @Test
    void parsesTheLectureFixture() throws IOException {
        var body = parser.parse(resource("/documents/lecture.ley"), "lecture.ley").body();
        assertEquals(
            List.of(
                Comment.class,
                With.class,
                With.class,
                TextBlock.class,
                RenderFor.class,
                ListBlock.class,
                ListBlock.class,
                Table.class,
                Figure.class,
                CorporealMacro.class,
                CodeBlock.class,
                Equation.class
            ),
            body.stream().map(Object::getClass).toList()
        );
        var with = (With) body.get(1);
        assertEquals("var title = \"Graphs\"\nvar edges = [\n  [\"a\", \"b\"],\n  [\"b\", \"c\"],\n]", with.text());
        var table = (Table) body.get(7);
        assertEquals(3, table.rows().size());
        assertEquals(List.of(1.0 / 3, 2.0 / 3), table.widths().fractions());
        var figure = (Figure) body.get(8);
        assertEquals("left", figure.align());
        assertEquals("def degree(v):\n    return len(v.edges)", ((CodeBlock) body.get(10)).text());
    }

    @Test
    void parsingIsDeterministic() throws IOException {
        String source = resource("/documents/lecture.ley");
        assertEquals(parser.parse(source), parser.parse(source));
    }

    private static Document document(Node... body) {
        return new Document(List.of(body), 1, 1);
    }

    private static String resource(String name) throws IOException {
        try (InputStream stream = ParserTest.class.getResourceAsStream(name)) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
