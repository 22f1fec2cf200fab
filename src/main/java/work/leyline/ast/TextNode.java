package work.leyline.ast;

/** A node whose content is a single string. */
public interface TextNode extends Node {
    String text();
}
