package com.tonelparser;

/**
 * Failure of the bracket boundary scanner. Carries the offending offset and
 * the line/column it falls on.
 */
public abstract class BoundaryException extends ParseException {
    private final int offset;

    protected BoundaryException(String errorType, String message, String text, int offset) {
        super(errorType, null, null, "method body boundary", message,
              lineOf(text, offset), columnOf(text, offset));
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    static int lineOf(String text, int offset) {
        if (text == null || offset < 0) {
            return 0;
        }
        int line = 1;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    static int columnOf(String text, int offset) {
        if (text == null || offset < 0) {
            return 0;
        }
        int limit = Math.min(offset, text.length());
        int lineStart = text.lastIndexOf('\n', limit - 1) + 1;
        return limit - lineStart + 1;
    }
}
