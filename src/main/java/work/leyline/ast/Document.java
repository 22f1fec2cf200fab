package work.leyline.ast;

import java.util.List;

/** Root of a parsed document. */
public record Document(List<Node> body, int line, int column) implements Container {
    public Document {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDocument(this);
    }
}
