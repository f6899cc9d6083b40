package com.tonelparser;

public class InvalidNumberLiteralException extends ParseException {
    public InvalidNumberLiteralException(String message, Token token) {
        super("InvalidNumberLiteral", token, null, "number literal", message);
    }
}
