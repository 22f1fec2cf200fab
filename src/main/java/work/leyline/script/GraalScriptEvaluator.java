package work.leyline.script;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import work.leyline.context.Environment;
import work.leyline.context.EvaluationException;
import work.leyline.context.ScriptEvaluator;

/**
 * {@link ScriptEvaluator} running JavaScript on the GraalVM polyglot engine.
 *
 * <p>Each environment gets its own JS context. Environment entries are published as globals
 * before a script runs; after a {@code with} block, globals the script created or changed are
 * copied back. Close the evaluator to release the contexts.
 */
public final class GraalScriptEvaluator implements ScriptEvaluator, AutoCloseable {
    private static final String LANGUAGE = "js";
    private static final String RENDER_PROBE = """
        (o) => {
          for (let p = o; p && p !== Object.prototype; p = Object.getPrototypeOf(p)) {
            for (const k of Object.getOwnPropertyNames(p)) {
              if (k === 'render' || k.startsWith('render_')) return true;
            }
          }
          return false;
        }
        """;

    private final Map<Environment, Session> sessions = new IdentityHashMap<>();

    @Override
    public void execute(String script, Environment environment) {
        Session session = session(environment);
        session.publish(environment);
        try {
            session.context.eval(Source.create(LANGUAGE, script));
        } catch (PolyglotException e) {
            throw failure("script", e);
        }
        session.collect(environment);
    }

    @Override
    public Object evaluate(String expression, Environment environment) {
        Session session = session(environment);
        session.publish(environment);
        try {
            Value result = session.context.eval(Source.create(LANGUAGE, "(" + expression + "\n)"));
            return ScriptValues.toJava(result, session::isRenderable);
        } catch (PolyglotException e) {
            throw failure("expression", e);
        }
    }

    @Override
    public void close() {
        for (Session session : sessions.values()) {
            session.context.close();
        }
        sessions.clear();
    }

    private Session session(Environment environment) {
        return sessions.computeIfAbsent(environment, ignored -> new Session(newContext()));
    }

    private static Context newContext() {
        return Context
            .newBuilder(LANGUAGE)
            .allowHostAccess(HostAccess.ALL)
            .allowExperimentalOptions(true)
            .allowAllAccess(true)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2023")
            .build();
    }

    private static EvaluationException failure(String what, PolyglotException e) {
        StringBuilder message = new StringBuilder(what).append(" error: ").append(e.getMessage());
        if (e.getSourceLocation() != null) {
            message.append(" (line ").append(e.getSourceLocation().getStartLine()).append(')');
        }
        return new EvaluationException(message.toString(), e);
    }

    private static final class Session {
        private final Context context;
        private final Value bindings;
        private final Set<String> builtins;
        private final Value probe;
        private final Map<String, Object> published = new HashMap<>();

        Session(Context context) {
            this.context = context;
            this.bindings = context.getBindings(LANGUAGE);
            this.builtins = new HashSet<>(bindings.getMemberKeys());
            this.probe = context.eval(LANGUAGE, RENDER_PROBE);
        }

        boolean isRenderable(Value value) {
            return probe.execute(value).asBoolean();
        }

        void publish(Environment environment) {
            Map<String, Object> values = environment.asMap();
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                String key = entry.getKey();
                if (!published.containsKey(key) || published.get(key) != entry.getValue()) {
                    bindings.putMember(key, ScriptValues.toScript(context, entry.getValue()));
                    published.put(key, entry.getValue());
                }
            }
            published.keySet().removeIf(key -> {
                if (values.containsKey(key)) {
                    return false;
                }
                bindings.removeMember(key);
                return true;
            });
        }

        void collect(Environment environment) {
            for (String key : bindings.getMemberKeys()) {
                if (builtins.contains(key)) {
                    continue;
                }
                Object value = ScriptValues.toJava(bindings.getMember(key), this::isRenderable);
                if (!environment.contains(key) || !Objects.equals(environment.get(key), value)) {
                    environment.put(key, value);
                }
                published.put(key, environment.get(key));
            }
        }
    }
}
