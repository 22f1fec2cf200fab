package work.leyline.ast;

import java.util.List;
import java.util.Objects;

/**
 * An image with a caption made of blocks.
 *
 * @param align one of {@code left}, {@code center} or {@code right}
 * @param scale positive scale factor relative to the renderer's default size
 */
public record Figure(String path, String align, double scale, List<Node> caption, int line, int column)
    implements Node {
    public static final String DEFAULT_ALIGN = "center";
    public static final double DEFAULT_SCALE = 1.0;
    public static final List<String> ALIGNMENTS = List.of("left", "center", "right");

    public Figure {
        path = Nodes.text(path, "path");
        align = Objects.requireNonNull(align, "align");
        if (!ALIGNMENTS.contains(align)) {
            throw new IllegalArgumentException("unknown alignment: " + align);
        }
        caption = Nodes.copy(caption, "caption");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFigure(this);
    }
}
