package work.leyline.ast;

import java.util.List;
import java.util.Objects;

/**
 * Macro with a parsed body: {@code {% name arg... %} body {%}}. Arguments are the head's words
 * as written, quotes included.
 */
public record CorporealMacro(String name, List<String> args, List<Node> body, int line, int column)
    implements Container {
    public CorporealMacro {
        name = Nodes.text(name, "name");
        args = List.copyOf(Objects.requireNonNull(args, "args"));
        body = Nodes.copy(body, "body");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCorporealMacro(this);
    }
}
