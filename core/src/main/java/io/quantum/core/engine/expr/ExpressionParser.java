package io.quantum.core.engine.expr;

import io.quantum.core.error.ExpressionEvalException;
import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing parser for the databinding language. Priorities, loosest first: ternary,
 * {@code or}, {@code and}, equality, comparison, additive, multiplicative, then unary and postfix
 * (member, index, call).
 *
 * <p>A chain of identifiers joined by dots is kept as a single {@link Expr.Path} so the scope can
 * apply prefix rules ({@code session.x}) to the whole path.
 */
final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int current;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = Lexer.tokenize(source);
    }

    /**
     * Parses a complete expression.
     *
     * @throws ExpressionEvalException on any syntax error, including trailing input
     */
    static Expr parse(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        if (parser.peek().type() == TokenType.EOF) {
            throw parser.error("empty expression");
        }
        Expr expr = parser.expr(0);
        if (parser.peek().type() != TokenType.EOF) {
            throw parser.error("unexpected " + parser.peek());
        }
        return expr;
    }

    private Expr expr(int priority) {
        Expr left = unary();
        while (true) {
            TokenType type = peek().type();
            if (priority < 1 && type == TokenType.QUES) {
                advance();
                Expr whenTrue = expr(0);
                expect(TokenType.COLON, "':' in conditional expression");
                Expr whenFalse = expr(0);
                left = new Expr.Ternary(left, whenTrue, whenFalse);
            } else if (priority < 2 && (type == TokenType.OR || type == TokenType.PIPE_PIPE)) {
                advance();
                left = new Expr.Logical(false, left, expr(2));
            } else if (priority < 3 && (type == TokenType.AND || type == TokenType.AMP_AMP)) {
                advance();
                left = new Expr.Logical(true, left, expr(3));
            } else if (priority < 4 && (type == TokenType.EQ_EQ || type == TokenType.NOT_EQ)) {
                advance();
                left = new Expr.Binary(type, left, expr(4));
            } else if (priority < 5
                    && (type == TokenType.LT
                            || type == TokenType.LT_EQ
                            || type == TokenType.GT
                            || type == TokenType.GT_EQ)) {
                advance();
                left = new Expr.Binary(type, left, expr(5));
            } else if (priority < 6 && (type == TokenType.PLUS || type == TokenType.MINUS)) {
                advance();
                left = new Expr.Binary(type, left, expr(6));
            } else if (priority < 7
                    && (type == TokenType.STAR || type == TokenType.SLASH || type == TokenType.PERCENT)) {
                advance();
                left = new Expr.Binary(type, left, expr(7));
            } else {
                return left;
            }
        }
    }

    private Expr unary() {
        TokenType type = peek().type();
        if (type == TokenType.MINUS) {
            advance();
            return new Expr.Negate(unary());
        }
        if (type == TokenType.PLUS) {
            advance();
            return unary();
        }
        if (type == TokenType.BANG || type == TokenType.NOT) {
            advance();
            return new Expr.Not(unary());
        }
        return postfix(primary());
    }

    private Expr postfix(Expr target) {
        Expr expr = target;
        while (true) {
            if (match(TokenType.DOT)) {
                Token name = advance();
                if (name.type() != TokenType.IDENT && !isKeyword(name.type())) {
                    throw error("expected property name after '.', got " + name);
                }
                expr = new Expr.Member(expr, name.text());
            } else if (match(TokenType.L_BRACKET)) {
                Expr key = expr(0);
                expect(TokenType.R_BRACKET, "']'");
                expr = new Expr.Index(expr, key);
            } else {
                return expr;
            }
        }
    }

    private Expr primary() {
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> new Expr.Literal(number(token.text()));
            case STRING -> new Expr.Literal(token.text());
            case TRUE -> new Expr.Literal(Boolean.TRUE);
            case FALSE -> new Expr.Literal(Boolean.FALSE);
            case NULL -> new Expr.Literal(null);
            case L_PAREN -> {
                Expr inner = expr(0);
                expect(TokenType.R_PAREN, "')'");
                yield inner;
            }
            case L_BRACKET -> arrayLiteral();
            case L_CURLY -> objectLiteral();
            case IDENT -> identifier(token);
            default -> throw error("unexpected " + token);
        };
    }

    private Expr identifier(Token first) {
        StringBuilder path = new StringBuilder(first.text());
        while (peek().type() == TokenType.DOT && peekAhead(1).type() == TokenType.IDENT) {
            advance();
            path.append('.').append(advance().text());
        }
        if (match(TokenType.L_PAREN)) {
            List<Expr> arguments = new ArrayList<>();
            if (!match(TokenType.R_PAREN)) {
                do {
                    arguments.add(expr(0));
                } while (match(TokenType.COMMA));
                expect(TokenType.R_PAREN, "')' after arguments");
            }
            return new Expr.Call(path.toString(), List.copyOf(arguments));
        }
        return new Expr.Path(path.toString());
    }

    private Expr arrayLiteral() {
        List<Expr> items = new ArrayList<>();
        if (!match(TokenType.R_BRACKET)) {
            do {
                items.add(expr(0));
            } while (match(TokenType.COMMA));
            expect(TokenType.R_BRACKET, "']'");
        }
        return new Expr.ArrayLiteral(List.copyOf(items));
    }

    private Expr objectLiteral() {
        List<String> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (!match(TokenType.R_CURLY)) {
            do {
                Token key = advance();
                if (key.type() != TokenType.IDENT && key.type() != TokenType.STRING && !isKeyword(key.type())) {
                    throw error("expected object key, got " + key);
                }
                expect(TokenType.COLON, "':' after object key");
                keys.add(key.text());
                values.add(expr(0));
            } while (match(TokenType.COMMA));
            expect(TokenType.R_CURLY, "'}'");
        }
        return new Expr.ObjectLiteral(List.copyOf(keys), List.copyOf(values));
    }

    private static Object number(String text) {
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return Double.parseDouble(text);
            }
        }
        return Double.parseDouble(text);
    }

    private static boolean isKeyword(TokenType type) {
        return type == TokenType.TRUE
                || type == TokenType.FALSE
                || type == TokenType.NULL
                || type == TokenType.AND
                || type == TokenType.OR
                || type == TokenType.NOT;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().type() == type) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String what) {
        if (!match(type)) {
            throw error("expected " + what + ", got " + peek());
        }
    }

    private ExpressionEvalException error(String message) {
        return new ExpressionEvalException(
                "Syntax error at position " + peek().pos() + ": " + message + " in expression: " + source, source);
    }
}
