package work.leyline.ast;

public interface CodeNode extends TextNode {
    /** Language tag, empty when the author gave none. */
    String lang();
}
