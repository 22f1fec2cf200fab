package work.leyline.ast;

/** A single-line or multi-line comment. The renderers decide whether it shows. */
public record Comment(String text, int line, int column) implements TextNode {
    public Comment {
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
