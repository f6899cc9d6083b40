package com.tonelparser;

public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String message, Token token) {
        super("SyntaxError", token, null, null, message);
    }

    public ExpectedTokenException(String expected, String context, String message, Token token) {
        super("SyntaxError", token, expected, context, message);
    }
}
