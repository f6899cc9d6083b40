package com.tonelparser;

public class InvalidByteValueException extends ParseException {
    public InvalidByteValueException(String message, Token token) {
        super("InvalidByteValue", token, null, "byte array", message);
    }
}
