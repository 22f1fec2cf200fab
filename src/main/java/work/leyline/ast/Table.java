package work.leyline.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Table built from a list of lists. {@code rows} is rectangular and every cell is a sequence of
 * blocks.
 */
public record Table(
    int headerRows,
    int headerCols,
    ColumnWidths widths,
    List<List<List<Node>>> rows,
    int line,
    int column
) implements Node {
    public static final int DEFAULT_HEADER_ROWS = 1;
    public static final int DEFAULT_HEADER_COLS = 0;

    public Table {
        Objects.requireNonNull(widths, "widths");
        Objects.requireNonNull(rows, "rows");
        List<List<List<Node>>> copy = new ArrayList<>(rows.size());
        for (List<List<Node>> row : rows) {
            copy.add(Nodes.copyItems(row, "rows"));
        }
        rows = Collections.unmodifiableList(copy);
        if (headerRows < 0 || headerCols < 0) {
            throw new IllegalArgumentException("header counts must not be negative");
        }
    }

    public int columnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
