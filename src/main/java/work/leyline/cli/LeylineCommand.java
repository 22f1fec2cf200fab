package work.leyline.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.leyline.api.ConfigurationLoader;
import work.leyline.api.ContextsLoader;
import work.leyline.api.Evaluation;
import work.leyline.api.Leyline;
import work.leyline.api.LeylineConfiguration;
import work.leyline.api.LogLevel;
import work.leyline.api.TreeExporter;
import work.leyline.ast.Document;
import work.leyline.ast.Node;
import work.leyline.lexer.Token;
import work.leyline.script.GraalScriptEvaluator;

@CommandLine.Command(
    name = "leyline",
    description = "Parse a leyline document and print its tokens, tree or evaluated environments.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LeylineCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Document to parse.")
    private Path file;

    @CommandLine.Option(
        names = {"-e", "--emit"},
        description = "Output: ${COMPLETION-CANDIDATES}.",
        defaultValue = "tree"
    )
    private EmitMode emit;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "FILE",
        description = "leyline.toml with default_context, target, log_level and [contexts.*] tables.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--context",
        paramLabel = "NAME=FILE",
        description = "Seed environment NAME from a JSON or YAML file (repeatable)."
    )
    private Map<String, Path> contexts = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"-t", "--target"},
        description = "Active render target for rend:: blocks and macro projections.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String target;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LeylineConfiguration.Builder builder = config != null
            ? ConfigurationLoader.load(config)
            : LeylineConfiguration.builder();
        for (Map.Entry<String, Path> entry : contexts.entrySet()) {
            builder.context(entry.getKey(), ContextsLoader.load(entry.getValue()));
        }
        if (target != null) {
            builder.target(target);
        }
        String level = resolveLogLevel();
        if (level != null) {
            builder.logLevel(LogLevel.from(level));
        }
        LeylineConfiguration configuration = builder.build();
        LogLevel threshold = configuration.logLevel();
        PrintWriter out = spec.commandLine().getOut();

        long started = System.nanoTime();
        if (emit == EmitMode.TOKENS) {
            List<Token> tokens = Leyline.tokens(Files.readString(file, StandardCharsets.UTF_8), file.toString());
            log(threshold, LogLevel.INFO, "lexed %s: %d tokens", file, tokens.size());
            for (Token token : tokens) {
                out.println(token);
            }
            out.flush();
            return 0;
        }

        Document document = Leyline.parse(file);
        log(threshold, LogLevel.INFO, "parsed %s in %d ms", file, (System.nanoTime() - started) / 1_000_000);
        switch (emit) {
            case TREE -> out.println(Leyline.format(document));
            case JSON -> out.println(TreeExporter.toJsonString(document, true));
            case CONTEXTS -> {
                try (GraalScriptEvaluator evaluator = new GraalScriptEvaluator()) {
                    log(threshold, LogLevel.DEBUG, "evaluating with default context '%s'", configuration.defaultContext());
                    Evaluation evaluation = Leyline.evaluate(document, evaluator, configuration);
                    log(threshold, LogLevel.DEBUG, "environments: %s", evaluation.environments().keySet());
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("environments", sanitize(evaluation.environments()));
                    payload.put("values", sanitize(evaluation.values()));
                    out.println(JSON_WRITER.writeValueAsString(payload));
                }
            }
            default -> throw new IllegalStateException("unhandled emit mode " + emit);
        }
        out.flush();
        return 0;
    }

    private String resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LEYLINE_LOG_LEVEL");
        }
        return candidate == null || candidate.isBlank() ? null : candidate;
    }

    private static void log(LogLevel threshold, LogLevel level, String format, Object... args) {
        if (threshold.allows(level)) {
            System.err.printf("[%s] %s%n", level, String.format(format, args));
        }
    }

    /** Reduces evaluated values to what JSON can carry. */
    static Object sanitize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), sanitize(v)));
            return copy;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> copy = new ArrayList<>();
            iterable.forEach(element -> copy.add(sanitize(element)));
            return copy;
        }
        if (value instanceof Node node) {
            return TreeExporter.toJson(node);
        }
        return String.valueOf(value);
    }
}
