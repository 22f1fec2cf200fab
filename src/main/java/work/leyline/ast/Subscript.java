package work.leyline.ast;

import java.util.List;

public record Subscript(List<Node> body, int line, int column) implements Formatting {
    public Subscript {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }
}
