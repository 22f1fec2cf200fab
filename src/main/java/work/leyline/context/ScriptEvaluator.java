package work.leyline.context;

/**
 * Evaluates the opaque payloads of {@code with} blocks and incorporeal macros. Leyline does not
 * interpret scripts itself, the embedding application supplies this capability.
 */
public interface ScriptEvaluator {
    /**
     * Runs a statement block. Bindings it creates or changes are stored back into
     * {@code environment}.
     */
    void execute(String script, Environment environment);

    /** Evaluates a single expression against {@code environment}. */
    Object evaluate(String expression, Environment environment);
}
