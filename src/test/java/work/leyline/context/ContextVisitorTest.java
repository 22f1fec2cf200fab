package work.leyline.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.leyline.ast.Bold;
import work.leyline.ast.Container;
import work.leyline.ast.Node;
import work.leyline.ast.PlainText;
import work.leyline.ast.TextNode;
import work.leyline.parser.Parser;

class ContextVisitorTest {
    /** Runs {@code key = value} lines and evaluates bare names. */
    private static final class AssignmentEvaluator implements ScriptEvaluator {
        @Override
        public void execute(String script, Environment environment) {
            for (String line : script.split("\n")) {
                String[] parts = line.split("=", 2);
                String value = parts[1].strip();
                environment.put(parts[0].strip(), value.matches("\\d+") ? (Object) Integer.valueOf(value) : value);
            }
        }

        @Override
        public Object evaluate(String expression, Environment environment) {
            if ("boom".equals(expression)) {
                throw new IllegalStateException("boom");
            }
            if (!environment.contains(expression)) {
                throw new EvaluationException("unknown name " + expression, null);
            }
            return environment.get(expression);
        }
    }

    /** Concatenates text, macro values are printed with {@link String#valueOf(Object)}. */
    private static final class TextRenderer extends ContextVisitor<String> {
        TextRenderer(String target) {
            super(new AssignmentEvaluator(), target);
        }

        TextRenderer(Environments environments, String target) {
            super(new AssignmentEvaluator(), environments, DEFAULT_CONTEXT, target);
        }

        @Override
        protected String fromValue(Object value) {
            return String.valueOf(value);
        }

        @Override
        protected String concat(List<String> parts) {
            return String.join("", parts);
        }

        @Override
        public String visitContainer(Container node) {
            return concat(visitAll(node.body()));
        }

        @Override
        public String visitText(TextNode node) {
            return node.text();
        }
    }

    private static final class Card implements Renderable {
        @Override
        public boolean rendersFor(String target) {
            return "notes".equals(target) || "quiet".equals(target);
        }

        @Override
        public Object renderFor(String target, ContextVisitor<?> visitor) {
            if ("quiet".equals(target)) {
                return null;
            }
            return new Bold(List.of(new PlainText("for notes", 1, 1)), 1, 1);
        }

        @Override
        public boolean renders() {
            return true;
        }

        @Override
        public Object render(String target, ContextVisitor<?> visitor) {
            return "generic card";
        }
    }

    private final Parser parser = new Parser();

    @Test
    void withBlocksBindValuesForLaterMacros() {
        var renderer = new TextRenderer(null);
        String out = parser.parse("with::\n  s = 42\n\ns is {{ s }}").accept(renderer);
        assertEquals("s is 42", out);
        assertEquals(42, renderer.environments().get("ctx").get("s"));
    }

    @Test
    void namedWithBlocksWriteTheirOwnEnvironment() {
        var renderer = new TextRenderer(null);
        parser.parse("with meta::\n  title = Intro\n").accept(renderer);
        assertEquals("Intro", renderer.environments().find("meta").orElseThrow().get("title"));
        assertTrue(renderer.environments().find("ctx").isEmpty());
        assertEquals(Set.of("meta"), renderer.environments().names());
    }

    @Test
    void failuresCarryTheMacroPosition() {
        var renderer = new TextRenderer(null);
        var document = parser.parse("with meta::\n  title = Intro\n\nsee {{ title }}");
        var error = assertThrows(EvaluationException.class, () -> document.accept(renderer));
        assertEquals("macro at 4:5 failed: unknown name title", error.getMessage());
        assertEquals(4, error.line());
        assertEquals(5, error.column());
    }

    @Test
    void evaluatorCrashesAreWrapped() {
        var error = assertThrows(
            EvaluationException.class,
            () -> parser.parse("{{ boom }}").accept(new TextRenderer(null))
        );
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("macro at 1:1 failed: boom", error.getMessage());
    }

    @Test
    void renderForTargetIsPreferred() {
        var environments = new Environments(Map.of("ctx", Map.of("card", new Card())));
        assertEquals("for notes", parser.parse("{{ card }}").accept(new TextRenderer(environments, "notes")));
    }

    @Test
    void genericRenderIsTheFallback() {
        var document = parser.parse("{{ card }}");
        var slides = new Environments(Map.of("ctx", Map.of("card", new Card())));
        assertEquals("generic card", document.accept(new TextRenderer(slides, "slides")));
        var untargeted = new Environments(Map.of("ctx", Map.of("card", new Card())));
        assertEquals("generic card", document.accept(new TextRenderer(untargeted, null)));
    }

    @Test
    void nullProjectionIsNotAFallthrough() {
        var environments = new Environments(Map.of("ctx", Map.of("card", new Card())));
        assertEquals("[null]", parser.parse("[{{ card }}]").accept(new TextRenderer(environments, "quiet")));
    }

    @Test
    void valuesWithoutProjectionsAreUsedAsIs() {
        Renderable bare = new Renderable() {
            @Override
            public String toString() {
                return "bare";
            }
        };
        var environments = new Environments(Map.of("ctx", Map.of("bare", bare)));
        assertEquals("bare", parser.parse("{{ bare }}").accept(new TextRenderer(environments, "notes")));
    }

    @Test
    void nodeSequencesAreVisited() {
        List<Node> nodes = List.of(new PlainText("a", 1, 1), new PlainText("b", 1, 2));
        var environments = new Environments(Map.of("ctx", Map.of("parts", nodes, "mixed", List.of("x", 1))));
        var renderer = new TextRenderer(environments, null);
        assertEquals("ab|[x, 1]", parser.parse("{{ parts }}|{{ mixed }}").accept(renderer));
    }

    @Test
    void renderBlocksFollowTheTarget() {
        var document = parser.parse("rend notes::\n  shown \n\nalways");
        assertEquals("shown always", document.accept(new TextRenderer("notes")));
        assertEquals("always", document.accept(new TextRenderer("slides")));
        assertEquals("always", document.accept(new TextRenderer(null)));
    }
}
