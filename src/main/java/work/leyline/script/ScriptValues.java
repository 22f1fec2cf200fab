package work.leyline.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;

/** Conversions between polyglot values and the plain Java values kept in environments. */
final class ScriptValues {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_DEPTH = 64;

    private ScriptValues() {}

    /**
     * Converts {@code value} to Java. Functions stay polyglot values, objects that can render
     * themselves become {@link ScriptRenderable}s.
     */
    static Object toJava(Value value, Predicate<Value> renderable) {
        return toJava(value, renderable, 0);
    }

    private static Object toJava(Value value, Predicate<Value> renderable, int depth) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) {
                return value.asInt();
            }
            if (value.fitsInLong()) {
                return value.asLong();
            }
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isHostObject()) {
            return value.asHostObject();
        }
        if (value.isProxyObject()) {
            return value.asProxyObject();
        }
        if (value.canExecute() || depth > MAX_DEPTH) {
            return value;
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i), renderable, depth + 1));
            }
            return list;
        }
        if (value.hasMembers()) {
            if (renderable.test(value)) {
                return new ScriptRenderable(value, renderable);
            }
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key), renderable, depth + 1));
            }
            return map;
        }
        return value.toString();
    }

    /**
     * Maps and lists cross over as JSON so that scripts see native objects and arrays. Values JSON
     * cannot carry are shared as host objects.
     */
    static Value toScript(Context context, Object value) {
        if (value instanceof ScriptRenderable renderable) {
            return renderable.value();
        }
        if (value instanceof Value polyglot) {
            return polyglot;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                String serialized = JSON.writeValueAsString(value);
                return context.eval("js", "JSON").getMember("parse").execute(serialized);
            } catch (JsonProcessingException ex) {
                return context.asValue(value);
            }
        }
        return context.asValue(value);
    }
}
