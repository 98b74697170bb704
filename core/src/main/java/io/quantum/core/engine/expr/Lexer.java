package io.quantum.core.engine.expr;

import io.quantum.core.error.ExpressionEvalException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Splits expression text into tokens. Single-use, not thread-safe. */
final class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "null", TokenType.NULL,
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT);

    private final String source;
    private final int length;
    private int pos;

    private Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    /**
     * Tokenizes the whole source. The returned list always ends with an {@link TokenType#EOF}
     * token.
     *
     * @throws ExpressionEvalException on an unterminated string or an unexpected character
     */
    static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token next() {
        skipWhitespace();
        if (pos >= length) {
            return new Token(TokenType.EOF, "", pos);
        }
        int start = pos;
        char c = source.charAt(pos);
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (isIdentStart(c)) {
            while (pos < length && isIdentPart(source.charAt(pos))) {
                pos++;
            }
            String text = source.substring(start, pos);
            return new Token(KEYWORDS.getOrDefault(text, TokenType.IDENT), text, start);
        }
        if (c == '"' || c == '\'') {
            return string(start, c);
        }
        pos++;
        Token token = switch (c) {
            case '(' -> new Token(TokenType.L_PAREN, "(", start);
            case ')' -> new Token(TokenType.R_PAREN, ")", start);
            case '[' -> new Token(TokenType.L_BRACKET, "[", start);
            case ']' -> new Token(TokenType.R_BRACKET, "]", start);
            case '{' -> new Token(TokenType.L_CURLY, "{", start);
            case '}' -> new Token(TokenType.R_CURLY, "}", start);
            case ',' -> new Token(TokenType.COMMA, ",", start);
            case '.' -> new Token(TokenType.DOT, ".", start);
            case ':' -> new Token(TokenType.COLON, ":", start);
            case '?' -> new Token(TokenType.QUES, "?", start);
            case '+' -> new Token(TokenType.PLUS, "+", start);
            case '-' -> new Token(TokenType.MINUS, "-", start);
            case '*' -> new Token(TokenType.STAR, "*", start);
            case '/' -> new Token(TokenType.SLASH, "/", start);
            case '%' -> new Token(TokenType.PERCENT, "%", start);
            case '=' -> match('=') ? new Token(TokenType.EQ_EQ, "==", start) : null;
            case '!' -> match('=') ? new Token(TokenType.NOT_EQ, "!=", start) : new Token(TokenType.BANG, "!", start);
            case '<' -> match('=') ? new Token(TokenType.LT_EQ, "<=", start) : new Token(TokenType.LT, "<", start);
            case '>' -> match('=') ? new Token(TokenType.GT_EQ, ">=", start) : new Token(TokenType.GT, ">", start);
            case '&' -> match('&') ? new Token(TokenType.AMP_AMP, "&&", start) : null;
            case '|' -> match('|') ? new Token(TokenType.PIPE_PIPE, "||", start) : null;
            default -> null;
        };
        if (token != null) {
            return token;
        }
        throw new ExpressionEvalException(
                "Unexpected character '" + c + "' at position " + start + " in expression: " + source, source);
    }

    private Token number(int start) {
        while (pos < length && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < length && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < length && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < length && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < length && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < length && Character.isDigit(source.charAt(pos))) {
                while (pos < length && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < length) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c == '\\' && pos < length) {
                char escaped = source.charAt(pos++);
                sb.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
            } else {
                sb.append(c);
            }
        }
        throw new ExpressionEvalException(
                "Unterminated string starting at position " + start + " in expression: " + source, source);
    }

    private boolean match(char expected) {
        if (pos < length && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < length && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
