package work.leyline.ast;

/** Inline span toggled by a doubled delimiter such as {@code **}. */
public interface Formatting extends Container {}
