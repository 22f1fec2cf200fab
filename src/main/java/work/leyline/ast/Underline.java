package work.leyline.ast;

import java.util.List;

public record Underline(List<Node> body, int line, int column) implements Formatting {
    public Underline {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnderline(this);
    }
}
