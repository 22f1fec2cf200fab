package work.leyline.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a tree in a canonical nested form, one field per line:
 *
 * <pre>
 * Bold(
 *  body=[
 *   PlainText(
 *    text='world',
 *    line=1,
 *    column=9
 *   )
 *  ],
 *  line=1,
 *  column=7
 * )
 * </pre>
 *
 * Quoted values carry backslash escapes for markup characters, so the printed form lexes as plain
 * text when fed back to the parser.
 */
public final class PrettyFormatter implements NodeVisitor<String> {
    private final String indent;

    public PrettyFormatter() {
        this(" ");
    }

    public PrettyFormatter(String indent) {
        this.indent = indent;
    }

    public static String format(Node node) {
        return node.accept(new PrettyFormatter());
    }

    @Override
    public String visitDocument(Document node) {
        return node("Document", node, "body=" + nodes(node.body()));
    }

    @Override
    public String visitTextBlock(TextBlock node) {
        return node("TextBlock", node, "body=" + nodes(node.body()));
    }

    @Override
    public String visitFormatting(Formatting node) {
        return node(node.getClass().getSimpleName(), node, "body=" + nodes(node.body()));
    }

    @Override
    public String visitPlainText(PlainText node) {
        return node("PlainText", node, "text=" + quote(node.text()));
    }

    @Override
    public String visitComment(Comment node) {
        return node("Comment", node, "text=" + quote(node.text()));
    }

    @Override
    public String visitEquation(Equation node) {
        return node("Equation", node, "text=" + quote(node.text()));
    }

    @Override
    public String visitInlineMath(InlineMath node) {
        return node("InlineMath", node, "text=" + quote(node.text()));
    }

    @Override
    public String visitIncorporealMacro(IncorporealMacro node) {
        return node("IncorporealMacro", node, "text=" + quote(node.text()));
    }

    @Override
    public String visitCode(CodeNode node) {
        return node(
            node.getClass().getSimpleName(),
            node,
            "lang=" + quote(node.lang()),
            "text=" + quote(node.text())
        );
    }

    @Override
    public String visitWith(With node) {
        return node("With", node, "ctx=" + quote(node.ctx()), "text=" + quote(node.text()));
    }

    @Override
    public String visitRenderFor(RenderFor node) {
        List<String> targets = new ArrayList<>();
        for (String target : node.targets()) {
            targets.add(quote(target));
        }
        return node("RenderFor", node, "targets={" + String.join(", ", targets) + "}", "body=" + nodes(node.body()));
    }

    @Override
    public String visitCorporealMacro(CorporealMacro node) {
        List<String> args = new ArrayList<>();
        for (String arg : node.args()) {
            args.add(quote(arg));
        }
        return node(
            "CorporealMacro",
            node,
            "name=" + quote(node.name()),
            "args=[" + String.join(", ", args) + "]",
            "body=" + nodes(node.body())
        );
    }

    @Override
    public String visitListBlock(ListBlock node) {
        List<String> items = new ArrayList<>();
        for (List<Node> item : node.items()) {
            items.add(nodes(item));
        }
        return node("ListBlock", node, "bullets=" + bullets(node.bullets()), "items=" + sequence(items));
    }

    private static String bullets(Bullets bullets) {
        if (bullets.isShared()) {
            return quote(bullets.shared().toString());
        }
        List<String> each = new ArrayList<>();
        for (Bullet bullet : bullets.sequence()) {
            each.add(bullet.isNumbered() ? bullet.toString() : quote(bullet.symbol()));
        }
        return "[" + String.join(", ", each) + "]";
    }

    @Override
    public String visitTable(Table node) {
        List<String> rows = new ArrayList<>();
        for (List<List<Node>> row : node.rows()) {
            List<String> cells = new ArrayList<>();
            for (List<Node> cell : row) {
                cells.add(nodes(cell));
            }
            rows.add(sequence(cells));
        }
        return node(
            "Table",
            node,
            "header_rows=" + node.headerRows(),
            "header_cols=" + node.headerCols(),
            "widths=" + node.widths(),
            "rows=" + sequence(rows)
        );
    }

    @Override
    public String visitFigure(Figure node) {
        return node(
            "Figure",
            node,
            "path=" + quote(node.path()),
            "align=" + quote(node.align()),
            "scale=" + node.scale(),
            "caption=" + nodes(node.caption())
        );
    }

    private String node(String name, Node node, String... fields) {
        List<String> parts = new ArrayList<>(List.of(fields));
        parts.add("line=" + node.line());
        parts.add("column=" + node.column());
        return name + "(\n" + indented(String.join(",\n", parts)) + "\n)";
    }

    private String nodes(List<Node> nodes) {
        return sequence(visitAll(nodes));
    }

    private String sequence(List<String> parts) {
        if (parts.isEmpty()) {
            return "[]";
        }
        return "[\n" + indented(String.join(",\n", parts)) + "\n]";
    }

    private String indented(String block) {
        StringBuilder builder = new StringBuilder(block.length() + 16);
        String[] lines = block.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) {
                builder.append('\n');
            }
            if (!line.isEmpty()) {
                builder.append(indent);
            }
            builder.append(line);
        }
        return builder.toString();
    }

    static String quote(String value) {
        StringBuilder builder = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '\'' -> builder.append("\\'");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '`', '*', '~', '_', '-', ',', '^', '$', '#', '{', '}', '%' -> builder.append('\\').append(ch);
                default -> {
                    if (Character.isISOControl(ch)) {
                        builder.append(String.format("\\u%04x", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        return builder.append('\'').toString();
    }
}
