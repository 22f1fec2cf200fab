package work.leyline.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Relative table column widths. {@link #AUTO} leaves the layout to the renderer, otherwise the
 * fractions sum to 1.
 */
public record ColumnWidths(List<Double> fractions) {
    public static final ColumnWidths AUTO = new ColumnWidths(List.of());

    public ColumnWidths {
        fractions = List.copyOf(Objects.requireNonNull(fractions, "fractions"));
    }

    /** Normalizes positive weights so that they sum to 1. */
    public static ColumnWidths of(List<Double> weights) {
        double total = 0;
        for (double weight : weights) {
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("column width must be a positive number: " + weight);
            }
            total += weight;
        }
        List<Double> normalized = new ArrayList<>(weights.size());
        for (double weight : weights) {
            normalized.add(weight / total);
        }
        return new ColumnWidths(normalized);
    }

    public boolean isAuto() {
        return fractions.isEmpty();
    }

    public int size() {
        return fractions.size();
    }

    @Override
    public String toString() {
        return isAuto() ? "'auto'" : fractions.toString();
    }
}
