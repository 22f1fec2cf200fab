package work.leyline.ast;

/**
 * A node of the document tree. Every node records the 1-based position of its first token.
 *
 * <p>Nodes are immutable records. Equality compares the variant, the position and the declared
 * fields, which is what parser tests rely on.
 */
public interface Node {
    int line();

    int column();

    <R> R accept(NodeVisitor<R> visitor);
}
