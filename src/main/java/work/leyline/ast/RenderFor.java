package work.leyline.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Body that is only included when rendering one of {@code targets}. */
public record RenderFor(Set<String> targets, List<Node> body, int line, int column) implements Container {
    public RenderFor {
        Objects.requireNonNull(targets, "targets");
        targets = Collections.unmodifiableSet(new LinkedHashSet<>(targets));
        body = Nodes.copy(body, "body");
    }

    public boolean includes(String target) {
        return target != null && targets.contains(target);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRenderFor(this);
    }
}
