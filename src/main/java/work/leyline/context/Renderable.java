package work.leyline.context;

/**
 * Macro value that knows how to present itself. {@link ContextVisitor} first asks for the projection
 * of the active target, then for the generic one, and otherwise uses the value as is. A projection
 * that exists is used even when it yields null. A result that is a node, or nodes, is visited in
 * place of the macro.
 */
public interface Renderable {
    default boolean rendersFor(String target) {
        return false;
    }

    default Object renderFor(String target, ContextVisitor<?> visitor) {
        throw new UnsupportedOperationException("no projection for target '" + target + "'");
    }

    default boolean renders() {
        return false;
    }

    default Object render(String target, ContextVisitor<?> visitor) {
        throw new UnsupportedOperationException("no generic projection");
    }
}
