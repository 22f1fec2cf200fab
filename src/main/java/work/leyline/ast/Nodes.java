package work.leyline.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

final class Nodes {
    private Nodes() {}

    static List<Node> copy(List<? extends Node> nodes, String field) {
        Objects.requireNonNull(nodes, field);
        return List.copyOf(nodes);
    }

    static String text(String value, String field) {
        return Objects.requireNonNull(value, field);
    }

    static List<List<Node>> copyItems(List<? extends List<? extends Node>> items, String field) {
        Objects.requireNonNull(items, field);
        List<List<Node>> copy = new ArrayList<>(items.size());
        for (List<? extends Node> item : items) {
            copy.add(copy(item, field));
        }
        return Collections.unmodifiableList(copy);
    }
}
