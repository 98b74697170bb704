package io.quantum.core.engine.expr;

/** Token kinds of the databinding expression language. */
enum TokenType {
    NUMBER,
    STRING,
    IDENT,
    TRUE,
    FALSE,
    NULL,
    AND,
    OR,
    NOT,
    L_PAREN,
    R_PAREN,
    L_BRACKET,
    R_BRACKET,
    L_CURLY,
    R_CURLY,
    COMMA,
    DOT,
    COLON,
    QUES,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    EQ_EQ,
    NOT_EQ,
    LT,
    LT_EQ,
    GT,
    GT_EQ,
    AMP_AMP,
    PIPE_PIPE,
    BANG,
    EOF
}
