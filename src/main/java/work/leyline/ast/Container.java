package work.leyline.ast;

import java.util.List;

/** A node holding a sequence of child nodes. */
public interface Container extends Node {
    List<Node> body();
}
