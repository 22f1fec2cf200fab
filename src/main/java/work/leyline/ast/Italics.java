package work.leyline.ast;

import java.util.List;

public record Italics(List<Node> body, int line, int column) implements Formatting {
    public Italics {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitItalics(this);
    }
}
