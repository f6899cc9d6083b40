package com.tonelparser;

/**
 * Offsets of a top-level {@code [} and its matching {@code ]}.
 */
public record BracketPair(int open, int close) {

    /** Text strictly between the brackets. */
    public String body(String text) {
        return text.substring(open + 1, close);
    }
}
