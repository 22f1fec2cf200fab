package work.leyline.ast;

/**
 * Script block run against a named environment.
 *
 * @param ctx environment name, empty for the visitor's default environment
 * @param text verbatim payload with the common indent stripped
 */
public record With(String ctx, String text, int line, int column) implements TextNode {
    public With {
        ctx = Nodes.text(ctx, "ctx");
        text = Nodes.text(text, "text");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWith(this);
    }
}
