package com.tonelparser;

public class UnmatchedBracketException extends BoundaryException {
    public UnmatchedBracketException(String text, int offset) {
        super("UnmatchedBracket", "Unmatched '[' at position " + offset, text, offset);
    }
}
