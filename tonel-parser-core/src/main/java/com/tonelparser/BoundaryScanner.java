package com.tonelparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the extent of bracket-delimited method bodies in a Tonel source
 * buffer by counting {@code [} and {@code ]}. Brackets inside string
 * literals, comments and character literals are not counted.
 */
public final class BoundaryScanner {
    private static final Logger logger = LoggerFactory.getLogger(BoundaryScanner.class);

    private BoundaryScanner() {
    }

    public record ExtractedBody(String body, int closePos) {
    }

    /**
     * Returns the offset of the {@code ]} matching the {@code [} at
     * {@code openPos}.
     *
     * @throws InvalidStartException     if {@code openPos} is out of range or not a {@code [}
     * @throws UnmatchedBracketException if the text ends before nesting returns to zero
     */
    public static int findEnd(String text, int openPos) {
        if (openPos < 0 || openPos >= text.length() || text.charAt(openPos) != '[') {
            throw new InvalidStartException(text, openPos);
        }

        int pos = openPos + 1;
        int depth = 1;
        int length = text.length();

        while (pos < length) {
            char c = text.charAt(pos);
            switch (c) {
                case '\'' -> {
                    pos = skipQuoted(text, pos, '\'');
                    continue;
                }
                case '"' -> {
                    pos = skipQuoted(text, pos, '"');
                    continue;
                }
                case '$' -> {
                    pos = Math.min(pos + 2, length);
                    continue;
                }
                case '[' -> depth++;
                case ']' -> {
                    depth--;
                    if (depth == 0) {
                        return pos;
                    }
                }
                default -> {
                }
            }
            pos++;
        }

        throw new UnmatchedBracketException(text, openPos);
    }

    public static ExtractedBody extract(String text, int openPos) {
        int closePos = findEnd(text, openPos);
        return new ExtractedBody(text.substring(openPos + 1, closePos), closePos);
    }

    public static List<BracketPair> findAll(String text) {
        return findAll(text, ScanPolicy.SKIP_UNMATCHED);
    }

    /**
     * Every consecutive top-level bracket pair of {@code text}, in order.
     * Scanning resumes after each pair's closing bracket.
     */
    public static List<BracketPair> findAll(String text, ScanPolicy policy) {
        List<BracketPair> pairs = new ArrayList<>();
        int pos = 0;

        while (pos < text.length()) {
            int open = text.indexOf('[', pos);
            if (open < 0) {
                break;
            }
            try {
                int close = findEnd(text, open);
                pairs.add(new BracketPair(open, close));
                pos = close + 1;
            } catch (UnmatchedBracketException e) {
                if (policy == ScanPolicy.STRICT) {
                    throw e;
                }
                logger.warn("Skipping unmatched '[' at line {}, column {}", e.getLine(), e.getColumn());
                pos = open + 1;
            }
        }

        return pairs;
    }

    /** Offset just past the span opened at {@code open}; the end of text when unterminated. */
    private static int skipQuoted(String text, int open, char quote) {
        int pos = open + 1;
        int length = text.length();
        while (pos < length) {
            if (text.charAt(pos) == quote) {
                if (pos + 1 < length && text.charAt(pos + 1) == quote) {
                    pos += 2;
                    continue;
                }
                return pos + 1;
            }
            pos++;
        }
        return length;
    }
}
