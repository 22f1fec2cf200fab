package work.leyline.script;

import java.util.function.Predicate;
import org.graalvm.polyglot.Value;
import work.leyline.context.ContextVisitor;
import work.leyline.context.Renderable;

/**
 * Script object exposing {@code render_<target>(visitor)} or {@code render(target, visitor)}.
 */
final class ScriptRenderable implements Renderable {
    private final Value value;
    private final Predicate<Value> renderable;

    ScriptRenderable(Value value, Predicate<Value> renderable) {
        this.value = value;
        this.renderable = renderable;
    }

    Value value() {
        return value;
    }

    @Override
    public boolean rendersFor(String target) {
        return executable("render_" + target);
    }

    @Override
    public Object renderFor(String target, ContextVisitor<?> visitor) {
        return ScriptValues.toJava(value.invokeMember("render_" + target, visitor), renderable);
    }

    @Override
    public boolean renders() {
        return executable("render");
    }

    @Override
    public Object render(String target, ContextVisitor<?> visitor) {
        return ScriptValues.toJava(value.invokeMember("render", target, visitor), renderable);
    }

    private boolean executable(String member) {
        Value method = value.getMember(member);
        return method != null && method.canExecute();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
