package com.tonelparser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Literal array {@code #( ... )}. Elements are plain data: numbers, strings,
 * booleans, null for nil, and nested lists for nested literal or byte arrays.
 * Integers are Long (BigInteger when out of range), including those of a
 * nested byte array.
 */
public record LiteralArray(List<Object> elements) implements Expression {
    public LiteralArray {
        // nil elements are kept, so List.copyOf cannot be used
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String type() {
        return "LiteralArray";
    }
}
