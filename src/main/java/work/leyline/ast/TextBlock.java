package work.leyline.ast;

import java.util.List;

/** A paragraph-level run of inline nodes. */
public record TextBlock(List<Node> body, int line, int column) implements Container {
    public TextBlock {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTextBlock(this);
    }
}
