package work.leyline.parser;

import work.leyline.lexer.Lexer;
import work.leyline.lexer.Token;
import work.leyline.lexer.TokenKind;

/** One-token lookahead over a lexer. */
final class TokenCursor {
    private final Lexer lexer;
    private Token lookahead;

    TokenCursor(Lexer lexer) {
        this.lexer = lexer;
    }

    Token peek() {
        if (lookahead == null) {
            lookahead = lexer.nextToken();
        }
        return lookahead;
    }

    Token next() {
        Token token = peek();
        lookahead = null;
        return token;
    }

    boolean at(TokenKind kind) {
        return peek().kind() == kind;
    }
}
