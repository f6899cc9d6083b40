package com.tonelparser;

public enum TokenType {
    // Literals
    STRING,
    SYMBOL,
    NUMBER,
    CHARACTER,

    // Pseudo-variables
    NIL,
    TRUE,
    FALSE,
    SELF,
    SUPER,
    THIS_CONTEXT,

    // Names and selectors
    IDENTIFIER,
    KEYWORD,
    BINARY_SELECTOR,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    LITERAL_ARRAY_START,   // #(
    BYTE_ARRAY_START,      // #[

    // Punctuation
    ASSIGN,                // :=
    RETURN,                // ^
    CASCADE,               // ;
    PERIOD,
    PIPE,
    COLON,

    // Trivia
    COMMENT,
    PRAGMA,

    EOF;

    /**
     * Whether a token of this type can end a receiver, so that a following
     * {@code |} or {@code -} reads as a binary operator.
     */
    public boolean canEndReceiver() {
        return switch (this) {
            case IDENTIFIER, NUMBER, STRING, SYMBOL, CHARACTER,
                 RPAREN, RBRACKET, RBRACE,
                 NIL, TRUE, FALSE, SELF, SUPER, THIS_CONTEXT -> true;
            default -> false;
        };
    }

    public boolean isPseudoVariable() {
        return switch (this) {
            case NIL, TRUE, FALSE, SELF, SUPER, THIS_CONTEXT -> true;
            default -> false;
        };
    }

    public boolean isTrivia() {
        return this == COMMENT || this == PRAGMA;
    }
}
