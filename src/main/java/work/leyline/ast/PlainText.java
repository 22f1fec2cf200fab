package work.leyline.ast;

/** Run of literal text, escapes already resolved. */
public record PlainText(String text, int line, int column) implements TextNode {
    public PlainText {
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPlainText(this);
    }
}
