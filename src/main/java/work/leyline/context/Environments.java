package work.leyline.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Environments of one traversal, keyed by name. An environment is created empty the first time it
 * is asked for.
 */
public final class Environments {
    private final Map<String, Environment> byName = new LinkedHashMap<>();

    public Environments() {
        this(Map.of());
    }

    public Environments(Map<String, ? extends Map<String, ?>> initial) {
        initial.forEach((name, values) -> byName.put(name, new Environment(name, values)));
    }

    public Environment get(String name) {
        return byName.computeIfAbsent(name, Environment::new);
    }

    public Optional<Environment> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    /** Copy of every environment's entries, by name. */
    public Map<String, Map<String, Object>> snapshot() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        byName.forEach((name, environment) -> copy.put(name, new LinkedHashMap<>(environment.asMap())));
        return copy;
    }
}
