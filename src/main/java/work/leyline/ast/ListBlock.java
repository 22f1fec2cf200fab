package work.leyline.ast;

import java.util.List;
import java.util.Objects;

/** A bulleted or numbered list. Each item is a sequence of blocks. */
public record ListBlock(Bullets bullets, List<List<Node>> items, int line, int column) implements Node {
    public ListBlock {
        Objects.requireNonNull(bullets, "bullets");
        items = Nodes.copyItems(items, "items");
        if (!bullets.isShared() && bullets.sequence().size() != items.size()) {
            throw new IllegalArgumentException(
                "expected " + items.size() + " bullets, got " + bullets.sequence().size()
            );
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitListBlock(this);
    }
}
