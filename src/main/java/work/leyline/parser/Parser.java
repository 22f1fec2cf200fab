package work.leyline.parser;

import work.leyline.ast.Document;
import work.leyline.shared.SourceText;

/**
 * Entry point of the grammar. A parser holds no state between calls: every call lexes with a fresh
 * {@link work.leyline.lexer.Lexer}, so one instance may be shared across threads.
 */
public final class Parser {
    public Document parse(String source) {
        return parse(source, null);
    }

    /**
     * Parses a whole document.
     *
     * @param filename used in diagnostics only, {@code <document>} when {@code null}
     * @throws work.leyline.lexer.LexicalException on malformed tokens or indentation
     * @throws SyntaxException on grammar violations
     */
    public Document parse(String source, String filename) {
        return parse(new SourceText(filename, source));
    }

    public Document parse(SourceText source) {
        return new Document(new BlockParser(source).document(), 1, 1);
    }
}
