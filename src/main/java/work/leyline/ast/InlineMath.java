package work.leyline.ast;

public record InlineMath(String text, int line, int column) implements TextNode {
    public InlineMath {
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInlineMath(this);
    }
}
