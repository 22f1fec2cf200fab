package work.leyline.ast;

/** Bodiless macro. The text is evaluated as one expression when the tree is visited. */
public record IncorporealMacro(String text, int line, int column) implements TextNode {
    public IncorporealMacro {
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIncorporealMacro(this);
    }
}
