package com.tonelparser.ast;

/**
 * Literal constant. {@code value} is null for nil, a Boolean, a Long,
 * BigInteger or Double for numbers, or a String for strings, characters and
 * symbols; {@code raw} is the source text and tells those apart.
 */
public record Literal(Object value, String raw) implements Expression {
    @Override
    public String type() {
        return "Literal";
    }
}
