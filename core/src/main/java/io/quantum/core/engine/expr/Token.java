package io.quantum.core.engine.expr;

/**
 * A lexed token. For {@link TokenType#STRING} the text is the unescaped value; for all other
 * types it is the source text.
 */
record Token(TokenType type, String text, int pos) {

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
    }
}
