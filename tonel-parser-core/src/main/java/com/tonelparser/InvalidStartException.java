package com.tonelparser;

public class InvalidStartException extends BoundaryException {
    public InvalidStartException(String text, int offset) {
        super("InvalidStart", describe(text, offset), text, offset);
    }

    private static String describe(String text, int offset) {
        if (offset < 0 || offset >= text.length()) {
            return "Start position " + offset + " is outside the text";
        }
        return "Expected '[' at position " + offset + " but found '" + text.charAt(offset) + "'";
    }
}
