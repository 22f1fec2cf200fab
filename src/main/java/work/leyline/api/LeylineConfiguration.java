package work.leyline.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.leyline.context.ContextVisitor;

/**
 * Immutable settings for evaluating a document: the default environment name, the active render
 * target, environments seeded before traversal and the diagnostic threshold.
 */
public record LeylineConfiguration(
    String defaultContext,
    Optional<String> target,
    Map<String, Map<String, Object>> initialContexts,
    LogLevel logLevel
) {
    public LeylineConfiguration {
        Objects.requireNonNull(defaultContext, "defaultContext");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(initialContexts, "initialContexts");
        Objects.requireNonNull(logLevel, "logLevel");
        if (defaultContext.isBlank()) {
            throw new IllegalArgumentException("defaultContext must not be blank");
        }
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        initialContexts.forEach((name, values) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        initialContexts = Collections.unmodifiableMap(copy);
    }

    public static LeylineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String defaultContext = ContextVisitor.DEFAULT_CONTEXT;
        private Optional<String> target = Optional.empty();
        private final Map<String, Map<String, Object>> initialContexts = new LinkedHashMap<>();
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder defaultContext(String defaultContext) {
            this.defaultContext = defaultContext;
            return this;
        }

        public Builder target(String target) {
            this.target = Optional.ofNullable(target).filter(value -> !value.isBlank());
            return this;
        }

        /** Adds entries to the named initial environment, merging with earlier ones. */
        public Builder context(String name, Map<String, ?> values) {
            initialContexts.computeIfAbsent(name, ignored -> new LinkedHashMap<>()).putAll(values);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public LeylineConfiguration build() {
            return new LeylineConfiguration(defaultContext, target, initialContexts, logLevel);
        }
    }
}
