package work.leyline.ast;

import java.util.List;

public record Strikethrough(List<Node> body, int line, int column) implements Formatting {
    public Strikethrough {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStrikethrough(this);
    }
}
