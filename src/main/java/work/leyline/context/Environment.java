package work.leyline.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named, mutable key-value store written by {@code with} blocks and read by macros. Insertion
 * order is kept.
 */
public final class Environment {
    private final String name;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public Environment(String name) {
        this(name, Map.of());
    }

    public Environment(String name, Map<String, ?> initial) {
        this.name = Objects.requireNonNull(name, "name");
        values.putAll(initial);
    }

    public String name() {
        return name;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public void put(String key, Object value) {
        values.put(Objects.requireNonNull(key, "key"), value);
    }

    public void putAll(Map<String, ?> entries) {
        entries.forEach(this::put);
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    /** Read-only live view of the entries. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Environment[" + name + "=" + values.keySet() + "]";
    }
}
