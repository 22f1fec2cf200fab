package work.leyline.ast;

/** Display math from a {@code $$$} block, raw. */
public record Equation(String text, int line, int column) implements TextNode {
    public Equation {
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEquation(this);
    }
}
