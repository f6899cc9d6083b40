package com.tonelparser;

/**
 * Base class of every failure raised while scanning, lexing or parsing a
 * method body. Positions are 1-based; a position of 0 means unknown.
 */
public class ParseException extends RuntimeException {
    private final String errorType;
    private final Token token;
    private final String expected;
    private final String context;
    private final String reason;
    private final int line;
    private final int column;

    public ParseException(String errorType, Token token, String expected, String context, String message) {
        this(errorType, token, expected, context, message,
             token != null ? token.line() : 0,
             token != null ? token.column() : 0);
    }

    protected ParseException(String errorType, Token token, String expected, String context,
                             String message, int line, int column) {
        super(formatMessage(message, line, column));
        this.errorType = errorType;
        this.token = token;
        this.expected = expected;
        this.context = context;
        this.reason = message;
        this.line = line;
        this.column = column;
    }

    private static String formatMessage(String message, int line, int column) {
        if (line <= 0) {
            return message;
        }
        return "Line " + line + ", Column " + column + ": " + message;
    }

    /** Error category, e.g. {@code SyntaxError} or {@code InvalidByteValue}. */
    public String getErrorType() {
        return errorType;
    }

    public Token getToken() {
        return token;
    }

    /** What the parser was looking for, a {@link TokenType} name or {@code expression}; null if unknown. */
    public String getExpected() {
        return expected;
    }

    /** Construct being parsed when the failure happened, e.g. {@code assignment}; may be null. */
    public String getContext() {
        return context;
    }

    /** The message without its position prefix. */
    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
