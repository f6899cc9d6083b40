package com.tonelparser;

/**
 * A lexical token of a method body.
 *
 * @param type        token kind
 * @param lexeme      exact source text of the token
 * @param line        1-based line of the first character
 * @param column      1-based column of the first character
 * @param position    0-based offset of the first character
 * @param endPosition 0-based offset just past the last character
 */
public record Token(
    TokenType type,
    String lexeme,
    int line,
    int column,
    int position,
    int endPosition
) {
    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, line, column, -1, -1);
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ") at " + line + ":" + column;
    }
}
