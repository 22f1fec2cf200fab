package work.leyline.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import work.leyline.ast.Document;
import work.leyline.ast.Node;
import work.leyline.ast.PrettyFormatter;
import work.leyline.context.Environments;
import work.leyline.context.ScriptEvaluator;
import work.leyline.lexer.Lexer;
import work.leyline.lexer.Token;
import work.leyline.parser.Parser;

/**
 * Entry points for embedding applications.
 */
public final class Leyline {
    private static final Parser PARSER = new Parser();

    private Leyline() {}

    public static Document parse(String source) {
        return PARSER.parse(source);
    }

    public static Document parse(String source, String filename) {
        return PARSER.parse(source, filename);
    }

    /** Reads {@code file} as UTF-8 and parses it, using the path in diagnostics. */
    public static Document parse(Path file) throws IOException {
        return PARSER.parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    public static List<Token> tokens(String source, String filename) {
        return Lexer.tokenize(source, filename);
    }

    public static String format(Node node) {
        return PrettyFormatter.format(node);
    }

    /** Fresh environments seeded from the configuration's initial contexts. */
    public static Environments environments(LeylineConfiguration configuration) {
        return new Environments(configuration.initialContexts());
    }

    /**
     * Runs every {@code with} block and resolves every macro of {@code document}, depth-first in
     * source order.
     */
    public static Evaluation evaluate(Document document, ScriptEvaluator evaluator, LeylineConfiguration configuration) {
        Environments environments = environments(configuration);
        EvaluatingVisitor visitor = new EvaluatingVisitor(
            evaluator,
            environments,
            configuration.defaultContext(),
            configuration.target().orElse(null)
        );
        List<Object> values = document.accept(visitor);
        return new Evaluation(environments.snapshot(), values);
    }
}
