package work.leyline.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating a document: every environment after traversal and the resolved macro
 * values in document order.
 */
public record Evaluation(Map<String, Map<String, Object>> environments, List<Object> values) {
    public Evaluation {
        Objects.requireNonNull(environments, "environments");
        Objects.requireNonNull(values, "values");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }
}
