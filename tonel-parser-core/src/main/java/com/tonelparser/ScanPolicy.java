package com.tonelparser;

/**
 * What {@link BoundaryScanner#findAll(String, ScanPolicy)} does with an
 * opening bracket that is never closed.
 */
public enum ScanPolicy {
    /** Log the region, step past the opener and keep scanning. */
    SKIP_UNMATCHED,
    /** Fail the whole scan with {@link UnmatchedBracketException}. */
    STRICT
}
