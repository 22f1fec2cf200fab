package work.leyline.ast;

import java.util.List;

public record Bold(List<Node> body, int line, int column) implements Formatting {
    public Bold {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBold(this);
    }
}
