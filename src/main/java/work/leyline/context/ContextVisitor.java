package work.leyline.context;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import work.leyline.ast.IncorporealMacro;
import work.leyline.ast.Node;
import work.leyline.ast.NodeVisitor;
import work.leyline.ast.RenderFor;
import work.leyline.ast.TraversalException;
import work.leyline.ast.With;

/**
 * Visitor that runs {@code with} blocks and resolves incorporeal macros while it walks the tree.
 *
 * <p>The traversal is depth-first and left to right, so a macro sees every binding made by the
 * {@code with} blocks before it. Renderers extend this class and provide {@link #fromValue(Object)}
 * for plain macro values and {@link #concat(List)} to join visited parts.
 *
 * @param <R> result of visiting one node
 */
public abstract class ContextVisitor<R> implements NodeVisitor<R> {
    public static final String DEFAULT_CONTEXT = "ctx";

    private final ScriptEvaluator evaluator;
    private final Environments environments;
    private final String defaultContext;
    private final String target;

    protected ContextVisitor(ScriptEvaluator evaluator, String target) {
        this(evaluator, new Environments(), DEFAULT_CONTEXT, target);
    }

    /**
     * @param defaultContext environment used by unnamed {@code with} blocks and by macros
     * @param target active render target, {@code null} when none
     */
    protected ContextVisitor(
        ScriptEvaluator evaluator,
        Environments environments,
        String defaultContext,
        String target
    ) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.environments = Objects.requireNonNull(environments, "environments");
        this.defaultContext = Objects.requireNonNull(defaultContext, "defaultContext");
        this.target = target;
    }

    public Environments environments() {
        return environments;
    }

    public String defaultContext() {
        return defaultContext;
    }

    public Optional<String> target() {
        return Optional.ofNullable(target);
    }

    protected ScriptEvaluator evaluator() {
        return evaluator;
    }

    /** Result for a macro value that is neither a node nor a sequence of nodes. */
    protected abstract R fromValue(Object value);

    protected abstract R concat(List<R> parts);

    @Override
    public R visitWith(With node) {
        Environment environment = environments.get(node.ctx().isEmpty() ? defaultContext : node.ctx());
        guarded(node, "with block", () -> {
            evaluator.execute(node.text(), environment);
            return null;
        });
        return concat(List.of());
    }

    @Override
    public R visitIncorporealMacro(IncorporealMacro node) {
        Environment environment = environments.get(defaultContext);
        Object value = guarded(node, "macro", () -> resolve(evaluator.evaluate(node.text(), environment)));
        return dispatch(value);
    }

    /** Visits the body only when the active target is one of the node's targets. */
    @Override
    public R visitRenderFor(RenderFor node) {
        if (node.includes(target)) {
            return concat(visitAll(node.body()));
        }
        return concat(List.of());
    }

    /**
     * Applies the projection protocol of {@link Renderable}.
     */
    protected Object resolve(Object value) {
        if (value instanceof Renderable renderable) {
            if (target != null && renderable.rendersFor(target)) {
                return renderable.renderFor(target, this);
            }
            if (renderable.renders()) {
                return renderable.render(target, this);
            }
        }
        return value;
    }

    /** Visits a node or a sequence of nodes, anything else goes to {@link #fromValue(Object)}. */
    protected R dispatch(Object value) {
        if (value instanceof Node node) {
            return node.accept(this);
        }
        if (value instanceof Iterable<?> iterable && onlyNodes(iterable)) {
            List<R> parts = new ArrayList<>();
            for (Object element : iterable) {
                parts.add(((Node) element).accept(this));
            }
            return concat(parts);
        }
        return fromValue(value);
    }

    private static boolean onlyNodes(Iterable<?> iterable) {
        for (Object element : iterable) {
            if (!(element instanceof Node)) {
                return false;
            }
        }
        return true;
    }

    private <T> T guarded(Node node, String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (EvaluationException e) {
            if (e.isLocated()) {
                throw e;
            }
            throw located(node, what, e.getMessage(), e.getCause() != null ? e.getCause() : e);
        } catch (TraversalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw located(node, what, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }

    private static EvaluationException located(Node node, String what, String detail, Throwable cause) {
        String message = String.format("%s at %d:%d failed: %s", what, node.line(), node.column(), detail);
        return new EvaluationException(message, node.line(), node.column(), cause);
    }
}
