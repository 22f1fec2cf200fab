package work.leyline.ast;

import java.util.List;

public record Superscript(List<Node> body, int line, int column) implements Formatting {
    public Superscript {
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSuperscript(this);
    }
}
