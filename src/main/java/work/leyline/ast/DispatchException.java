package work.leyline.ast;

/** No handler of a visitor accepts the node's type or any of its categories. */
public final class DispatchException extends TraversalException {
    private final String nodeType;
    private final String visitorType;

    public DispatchException(Node node, Object visitor) {
        super(
            String.format(
                "could not find valid visitor method for %s on %s",
                node.getClass().getSimpleName(),
                visitor.getClass().getSimpleName()
            ),
            node.line(),
            node.column()
        );
        this.nodeType = node.getClass().getSimpleName();
        this.visitorType = visitor.getClass().getSimpleName();
    }

    public String nodeType() {
        return nodeType;
    }

    public String visitorType() {
        return visitorType;
    }
}
